package last.transmission.solver;

import java.util.List;
import last.transmission.input.CalibratorDataset;
import last.transmission.model.ModelEvaluationException;
import last.transmission.model.ParameterSet;
import last.transmission.optimizer.CancellationToken;
import last.transmission.stage.SolverMethod;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.log4j.Logger;

/**
 * Derivative-free stage solver. Runs a Nelder-Mead simplex search over the vector of free
 * parameters; fixed parameters are merged in before every cost evaluation.
 *
 * The starting simplex uses steps of 5% of each non-zero starting value and 0.00025 for values
 * that start at zero. A cost evaluation that fails scores {@link #PENALTY_COST} so the search
 * moves away from that region. If the evaluation or iteration budget runs out, the best point
 * seen so far is returned with status {@link ExitStatus#MAX_EVALUATIONS}.
 */
public class NonlinearMinimizer extends ClippingStageSolver {

  private static final Logger logger = Logger.getLogger(NonlinearMinimizer.class);

  /**
   * Cost assigned to parameter vectors where the model cannot be evaluated
   */
  public static final double PENALTY_COST = 1e20;

  private static final double RELATIVE_STEP = 0.05;
  private static final double ZERO_STEP = 0.00025;

  @Override
  protected SolverMethod getMethod() {
    return SolverMethod.NONLINEAR;
  }

  @Override
  public void validate(SolverArgs args) {
    // any vocabulary name can be searched over; SolverArgs has already checked membership
  }

  @Override
  protected StageFit fit(SolverArgs args, CalibratorDataset dataset, ParameterSet start) {
    List<String> freeNames = args.getFreeNames();
    double[] startPoint = start.toArray(freeNames);
    CostFunction cost = new CostFunction(args, dataset);

    SimplexOptimizer optimizer =
        new SimplexOptimizer(args.getRelativeTolerance(), args.getAbsoluteTolerance());

    logger.debug(args.getStageName() + ": simplex search over " + freeNames + " from " + start);

    try {
      PointValuePair optimum = optimizer.optimize(
          new MaxEval(args.getMaxEvaluations()),
          new MaxIter(args.getMaxIterations()),
          new ObjectiveFunction(cost::value),
          GoalType.MINIMIZE,
          new InitialGuess(startPoint),
          new NelderMeadSimplex(initialSteps(startPoint)));

      ParameterSet params = ParameterSet.fromArray(freeNames, optimum.getPoint());
      logger.debug(args.getStageName() + ": simplex converged after "
          + optimizer.getIterations() + " iterations, cost " + optimum.getValue());
      return new StageFit(params, ExitStatus.CONVERGED, optimizer.getIterations(),
          cost.evaluations, Double.NaN, -1, Double.NaN, "");
    } catch (TooManyEvaluationsException | TooManyIterationsException e) {
      double[] best = cost.bestPoint == null ? startPoint : cost.bestPoint;
      logger.warn(args.getStageName() + ": simplex search stopped at its limit ("
          + e.getMessage() + "); keeping best point with cost " + cost.bestValue);
      return new StageFit(ParameterSet.fromArray(freeNames, best), ExitStatus.MAX_EVALUATIONS,
          optimizer.getIterations(), cost.evaluations, Double.NaN, -1, Double.NaN,
          "simplex limit reached: " + e.getMessage());
    }
  }

  /**
   * Get the initial simplex edge lengths for a starting point
   *
   * @param start Starting point
   * @return Step per coordinate, never zero
   */
  static double[] initialSteps(double[] start) {
    double[] steps = new double[start.length];
    for (int i = 0; i < start.length; ++i) {
      steps[i] = start[i] != 0. ? RELATIVE_STEP * start[i] : ZERO_STEP;
    }
    return steps;
  }

  /**
   * Sum-of-squares cost of a free-parameter vector, tracking the best point evaluated
   */
  private static class CostFunction {

    private final SolverArgs args;
    private final CalibratorDataset dataset;
    private final CancellationToken token;
    private int evaluations = 0;
    private double[] bestPoint = null;
    private double bestValue = Double.POSITIVE_INFINITY;

    CostFunction(SolverArgs args, CalibratorDataset dataset) {
      this.args = args;
      this.dataset = dataset;
      this.token = args.getCancellationToken();
    }

    double value(double[] point) {
      token.checkCancelled("during stage " + args.getStageName());
      ++evaluations;
      double cost;
      ParameterSet free = ParameterSet.fromArray(args.getFreeNames(), point);
      try {
        cost = args.getForwardModel().evaluate(args.fullParameters(free), dataset).getCost();
      } catch (ModelEvaluationException e) {
        logger.debug(args.getStageName() + ": evaluation failed at " + free + ": "
            + e.getMessage());
        cost = PENALTY_COST;
      }
      if (!Double.isFinite(cost)) {
        cost = PENALTY_COST;
      }
      if (cost < bestValue) {
        bestValue = cost;
        bestPoint = point.clone();
      }
      return cost;
    }

  }

}
