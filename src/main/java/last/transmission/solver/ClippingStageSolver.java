package last.transmission.solver;

import java.util.Arrays;
import last.transmission.input.CalibratorDataset;
import last.transmission.model.ModelEvaluation;
import last.transmission.model.ModelEvaluationException;
import last.transmission.model.ParameterSet;
import last.transmission.optimizer.CancellationToken;
import last.transmission.optimizer.InsufficientDataException;
import last.transmission.optimizer.OptimizationResult;
import last.transmission.stage.SigmaClipConfig;
import last.transmission.stage.SolverMethod;
import org.apache.log4j.Logger;

/**
 * Common outer loop of the stage solvers. Subclasses implement a single fit of the free
 * parameters on a fixed dataset; this class alternates that fit with sigma clipping:
 * fit, compute residuals, clip, and re-fit from the current optimum on the reduced set, until a
 * pass removes nothing or the iteration cap is reached. The reported cost and residuals are
 * always evaluated on the final dataset with the final parameters.
 *
 * A fit that fails numerically is not clipped; its result carries {@link ExitStatus#FAILED} and
 * the degenerate parameter values the fit produced.
 */
public abstract class ClippingStageSolver implements StageSolver {

  private static final Logger logger = Logger.getLogger(ClippingStageSolver.class);

  private final SigmaClipper clipper = new SigmaClipper();

  /**
   * Fit the free parameters once on a fixed dataset
   *
   * @param args Stage arguments
   * @param dataset Calibrators to fit; never empty
   * @param start Starting values of the free parameters
   * @return Fit outcome
   */
  protected abstract StageFit fit(SolverArgs args, CalibratorDataset dataset, ParameterSet start);

  protected abstract SolverMethod getMethod();

  @Override
  public OptimizationResult solve(SolverArgs args, CalibratorDataset dataset) {
    validate(args);
    String stageName = args.getStageName();
    if (dataset.isEmpty()) {
      throw new InsufficientDataException(stageName, "calibrator dataset is empty");
    }
    CancellationToken token = args.getCancellationToken();
    token.checkCancelled("before stage " + stageName);

    CalibratorDataset current = dataset;
    StageFit fit = fit(args, current, args.getInitialGuess());
    int iterations = fit.iterations;
    int evaluations = fit.evaluations;

    SigmaClipConfig clipConfig = args.getSigmaClip();
    int clipIterations = 0;
    int removed = 0;
    String clipMessage = "";
    ModelEvaluation finalEvaluation = null;

    if (clipConfig.isEnabled() && fit.status != ExitStatus.FAILED) {
      while (clipIterations < clipConfig.getMaxIterations()) {
        token.checkCancelled("during sigma clipping of stage " + stageName);
        ++clipIterations;
        ModelEvaluation evaluation = evaluate(args, fit.params, current);
        ++evaluations;
        if (evaluation == null) {
          clipMessage = "residuals unavailable for clipping";
          break;
        }

        ClipResult clip = clipper.clip(current, evaluation.getResiduals(),
            clipConfig.getThreshold());
        if (clip.getRemovedCount() == 0) {
          clipMessage = "clipping converged in " + clipIterations
              + (clipIterations == 1 ? " iteration" : " iterations");
          finalEvaluation = evaluation;
          break;
        }
        if (clip.getDataset().isEmpty()) {
          throw new InsufficientDataException(stageName,
              "sigma clipping removed all " + current.size() + " calibrators");
        }

        removed += clip.getRemovedCount();
        logger.info(stageName + ": clipping pass " + clipIterations + " removed "
            + clip.getRemovedCount() + " calibrators, " + clip.getDataset().size() + " remain");
        current = clip.getDataset();

        fit = fit(args, current, fit.params);
        iterations += fit.iterations;
        evaluations += fit.evaluations;
        if (fit.status == ExitStatus.FAILED) {
          break;
        }
      }
      if (clipMessage.isEmpty()) {
        clipMessage = "clipping stopped after " + clipIterations
            + (clipIterations == 1 ? " iteration" : " iterations");
      }
    }

    if (finalEvaluation == null) {
      finalEvaluation = evaluate(args, fit.params, current);
      ++evaluations;
    }

    ExitStatus status = fit.status;
    String message = fit.message;
    if (finalEvaluation == null && status != ExitStatus.FAILED) {
      status = ExitStatus.FAILED;
      message = "model could not be evaluated at the solution";
    } else if (status == ExitStatus.CONVERGED && removed > 0) {
      status = ExitStatus.CONVERGED_WITH_CLIPPING;
    }
    if (!clipMessage.isEmpty()) {
      message = message.isEmpty() ? clipMessage : message + "; " + clipMessage;
    }

    double cost;
    double[] residuals;
    double[] diffMagnitudes;
    if (finalEvaluation != null) {
      cost = finalEvaluation.getCost();
      residuals = finalEvaluation.getResiduals();
      diffMagnitudes = finalEvaluation.getDiffMagnitudes();
    } else {
      cost = Double.NaN;
      residuals = new double[current.size()];
      Arrays.fill(residuals, Double.NaN);
      diffMagnitudes = residuals.clone();
    }

    SolverDiagnostics diagnostics = SolverDiagnostics.builder()
        .iterations(iterations)
        .evaluations(evaluations)
        .clipIterations(clipIterations)
        .removedCount(removed)
        .conditionNumber(fit.conditionNumber)
        .rank(fit.rank)
        .penalizedCost(fit.penalizedCost)
        .message(message)
        .build();

    return new OptimizationResult(stageName, getMethod(), fit.params, args.getFixedParams(),
        cost, status, diagnostics, residuals, diffMagnitudes, current);
  }

  /**
   * Evaluate the full model (fixed and free parameters) on a dataset
   *
   * @return Model output, or null if the model could not be evaluated
   */
  ModelEvaluation evaluate(SolverArgs args, ParameterSet free, CalibratorDataset dataset) {
    try {
      return args.getForwardModel().evaluate(args.fullParameters(free), dataset);
    } catch (ModelEvaluationException e) {
      logger.warn(args.getStageName() + ": model evaluation failed at " + free, e);
      return null;
    }
  }

  /**
   * Outcome of a single fit on a fixed dataset
   */
  protected static class StageFit {

    final ParameterSet params;
    final ExitStatus status;
    final int iterations;
    final int evaluations;
    final double conditionNumber;
    final int rank;
    final double penalizedCost;
    final String message;

    StageFit(ParameterSet params, ExitStatus status, int iterations, int evaluations,
        double conditionNumber, int rank, double penalizedCost, String message) {
      this.params = params;
      this.status = status;
      this.iterations = iterations;
      this.evaluations = evaluations;
      this.conditionNumber = conditionNumber;
      this.rank = rank;
      this.penalizedCost = penalizedCost;
      this.message = message == null ? "" : message;
    }

  }

}
