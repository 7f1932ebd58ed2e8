package last.transmission.optimizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import last.transmission.input.CalibratorDataset;
import last.transmission.model.ParameterSet;
import last.transmission.solver.ExitStatus;

/**
 * Snapshot of a sequence run between stages: the parameters accumulated so far, how many stages
 * have completed, their results, and the calibrator dataset the next stage will see.
 *
 * States are immutable. Each completed stage produces a new state through
 * {@link #afterStage(OptimizationResult, boolean)}, so the history of a run can be audited and
 * any transition tested on its own.
 */
public class OptimizerState {

  private final ParameterSet accumulatedParams;
  private final int stageIndex;
  private final List<OptimizationResult> results;
  private final CalibratorDataset dataset;

  private OptimizerState(ParameterSet accumulatedParams, int stageIndex,
      List<OptimizationResult> results, CalibratorDataset dataset) {
    this.accumulatedParams = accumulatedParams;
    this.stageIndex = stageIndex;
    this.results = Collections.unmodifiableList(results);
    this.dataset = dataset;
  }

  /**
   * State before any calibrators are loaded or stages run
   *
   * @return Empty state
   */
  public static OptimizerState empty() {
    return initial(CalibratorDataset.empty());
  }

  /**
   * State at the start of a run over the given calibrators
   *
   * @param dataset Calibrators loaded for the run
   * @return New state with no accumulated parameters
   */
  public static OptimizerState initial(CalibratorDataset dataset) {
    return new OptimizerState(ParameterSet.empty(), 0, new ArrayList<>(), dataset);
  }

  /**
   * Produce the state that follows a completed stage.
   *
   * The stage's optimal parameters are merged into the accumulated set, later values winning.
   * A stage that ran out of evaluations is merged the same way, since its best point is never
   * worse than where it started. If the stage failed outright, only names that have no
   * accumulated value yet are taken from it, so its degenerate values cannot overwrite earlier
   * good ones. When clipping was enabled the stage's final dataset replaces the current one.
   *
   * @param result Result of the stage that just finished
   * @param clippingEnabled Whether the stage ran with sigma clipping
   * @return New state
   */
  public OptimizerState afterStage(OptimizationResult result, boolean clippingEnabled) {
    ParameterSet optimal = result.getOptimalParams();
    ParameterSet merged;
    if (result.getStatus() != ExitStatus.FAILED) {
      merged = accumulatedParams.merge(optimal);
    } else {
      merged = accumulatedParams.merge(optimal.without(accumulatedParams.names()));
    }
    List<OptimizationResult> history = new ArrayList<>(results);
    history.add(result);
    CalibratorDataset next = clippingEnabled ? result.getDataset() : dataset;
    return new OptimizerState(merged, stageIndex + 1, history, next);
  }

  public ParameterSet getAccumulatedParams() {
    return accumulatedParams;
  }

  /**
   * Get the number of stages completed so far, which is also the index of the next stage
   *
   * @return Completed stage count
   */
  public int getStageIndex() {
    return stageIndex;
  }

  public List<OptimizationResult> getResults() {
    return results;
  }

  public CalibratorDataset getDataset() {
    return dataset;
  }

  /**
   * Get the results of stages that did not converge
   *
   * @return Non-converged results, in stage order
   */
  public List<OptimizationResult> getFailedResults() {
    List<OptimizationResult> failed = new ArrayList<>();
    for (OptimizationResult result : results) {
      if (!result.isSuccess()) {
        failed.add(result);
      }
    }
    return failed;
  }

  /**
   * Package the outcome of the run for downstream photometry and reporting
   *
   * @return Final parameters, per-stage results and final dataset
   */
  public OptimizationExport export() {
    List<String> failedStages = new ArrayList<>();
    for (OptimizationResult result : getFailedResults()) {
      failedStages.add(result.getStageName());
    }
    return new OptimizationExport(accumulatedParams, results, dataset, failedStages);
  }

}
