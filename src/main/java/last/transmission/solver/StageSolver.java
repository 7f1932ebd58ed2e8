package last.transmission.solver;

import last.transmission.input.CalibratorDataset;
import last.transmission.optimizer.OptimizationResult;

/**
 * Optimizes the free parameters of a single stage. Implementations are selected through
 * {@link last.transmission.stage.SolverMethod#createSolver()}.
 *
 * Solvers read the dataset they are given and never modify or keep it; when sigma clipping
 * removes calibrators the reduced dataset is returned in the result.
 */
public interface StageSolver {

  /**
   * Check that the arguments are acceptable to this solver without evaluating the model
   *
   * @param args Stage arguments
   * @throws last.transmission.optimizer.StageConfigurationException If they are not
   */
  void validate(SolverArgs args);

  /**
   * Solve the stage
   *
   * @param args Stage arguments
   * @param dataset Calibrators to fit
   * @return Stage result; numerical failures are reported through its exit status
   * @throws last.transmission.optimizer.StageConfigurationException If the arguments are invalid
   * @throws last.transmission.optimizer.InsufficientDataException If there are no calibrators,
   *     or clipping rejects all of them
   * @throws last.transmission.optimizer.OptimizationCancelledException If the run is cancelled
   */
  OptimizationResult solve(SolverArgs args, CalibratorDataset dataset);

}
