package last.transmission.stage;

import last.transmission.optimizer.StageConfigurationException;
import last.transmission.solver.LinearLeastSquaresSolver;
import last.transmission.solver.NonlinearMinimizer;
import last.transmission.solver.StageSolver;

/**
 * Algorithm a stage uses to optimize its free parameters, and the factory for the matching
 * solver. The solver is created once per stage.
 */
public enum SolverMethod {

  /**
   * Closed-form regularized least squares over the additive field-correction basis
   */
  LINEAR("linear") {
    @Override
    public StageSolver createSolver() {
      return new LinearLeastSquaresSolver();
    }
  },
  /**
   * Nelder-Mead simplex search over any parameters of the vocabulary
   */
  NONLINEAR("nonlinear") {
    @Override
    public StageSolver createSolver() {
      return new NonlinearMinimizer();
    }
  };

  private final String name;

  SolverMethod(String name) {
    this.name = name;
  }

  public abstract StageSolver createSolver();

  public String getName() {
    return name;
  }

  /**
   * Parse a method name as it appears in configuration (case-insensitive)
   *
   * @param name "linear" or "nonlinear"
   * @return Matching method
   * @throws StageConfigurationException If the name is missing or unknown
   */
  public static SolverMethod fromName(String name) {
    if (name != null) {
      for (SolverMethod method : values()) {
        if (method.name.equalsIgnoreCase(name.trim())) {
          return method;
        }
      }
    }
    throw new StageConfigurationException("Unknown solver method: " + name
        + " (expected 'linear' or 'nonlinear')");
  }

}
