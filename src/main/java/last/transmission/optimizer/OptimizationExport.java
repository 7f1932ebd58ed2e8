package last.transmission.optimizer;

import java.util.Collections;
import java.util.List;
import last.transmission.input.CalibratorDataset;
import last.transmission.model.ParameterSet;

/**
 * Final outcome of a sequence run, as handed to photometry and reporting code
 */
public class OptimizationExport {

  private final ParameterSet finalParameterSet;
  private final List<OptimizationResult> perStageResults;
  private final CalibratorDataset finalCalibratorDataset;
  private final List<String> failedStages;

  OptimizationExport(ParameterSet finalParameterSet, List<OptimizationResult> perStageResults,
      CalibratorDataset finalCalibratorDataset, List<String> failedStages) {
    this.finalParameterSet = finalParameterSet;
    this.perStageResults = Collections.unmodifiableList(perStageResults);
    this.finalCalibratorDataset = finalCalibratorDataset;
    this.failedStages = Collections.unmodifiableList(failedStages);
  }

  public ParameterSet getFinalParameterSet() {
    return finalParameterSet;
  }

  public List<OptimizationResult> getPerStageResults() {
    return perStageResults;
  }

  public CalibratorDataset getFinalCalibratorDataset() {
    return finalCalibratorDataset;
  }

  /**
   * Get the names of stages that did not converge. When this is not empty the final parameter
   * set may be a partial calibration.
   *
   * @return Stage names, in run order
   */
  public List<String> getFailedStages() {
    return failedStages;
  }

  public boolean hasFailures() {
    return !failedStages.isEmpty();
  }

}
