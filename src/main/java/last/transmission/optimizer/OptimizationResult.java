package last.transmission.optimizer;

import java.util.List;
import last.transmission.input.CalibratorDataset;
import last.transmission.model.ParameterSet;
import last.transmission.solver.ExitStatus;
import last.transmission.solver.SolverDiagnostics;
import last.transmission.stage.SolverMethod;
import last.transmission.utils.NumericUtils;

/**
 * Outcome of one calibration stage. Holds the optimized values of the stage's free parameters
 * (and only those), the fixed values they were solved against, the final cost and per-calibrator
 * residuals, and the calibrator dataset as it stood when the stage finished.
 */
public class OptimizationResult {

  private final String stageName;
  private final SolverMethod method;
  private final ParameterSet optimalParams;
  private final ParameterSet fixedParams;
  private final double cost;
  private final ExitStatus status;
  private final SolverDiagnostics diagnostics;
  private final double[] residuals;
  private final double[] diffMagnitudes;
  private final CalibratorDataset dataset;

  /**
   * Create a new stage result. Arrays are copied.
   *
   * @param stageName Name of the stage
   * @param method Solver that produced the result
   * @param optimalParams Optimized values of the free parameters
   * @param fixedParams Values held constant during the stage
   * @param cost Final cost on the final dataset
   * @param status Solver exit status
   * @param diagnostics Iteration counts and numerical diagnostics
   * @param residuals Per-calibrator residuals on the final dataset
   * @param diffMagnitudes Per-calibrator magnitude differences on the final dataset
   * @param dataset Calibrators at stage completion
   */
  public OptimizationResult(String stageName, SolverMethod method, ParameterSet optimalParams,
      ParameterSet fixedParams, double cost, ExitStatus status, SolverDiagnostics diagnostics,
      double[] residuals, double[] diffMagnitudes, CalibratorDataset dataset) {
    this.stageName = stageName;
    this.method = method;
    this.optimalParams = optimalParams;
    this.fixedParams = fixedParams;
    this.cost = cost;
    this.status = status;
    this.diagnostics = diagnostics;
    this.residuals = residuals.clone();
    this.diffMagnitudes = diffMagnitudes.clone();
    this.dataset = dataset;
  }

  public String getStageName() {
    return stageName;
  }

  public SolverMethod getMethod() {
    return method;
  }

  /**
   * Get the optimized free parameters
   *
   * @return Parameter set holding exactly the stage's free names
   */
  public ParameterSet getOptimalParams() {
    return optimalParams;
  }

  public ParameterSet getFixedParams() {
    return fixedParams;
  }

  /**
   * Get the complete parameter set the final cost was computed with
   *
   * @return Fixed parameters overlaid with the optimal ones
   */
  public ParameterSet getAllParams() {
    return fixedParams.merge(optimalParams);
  }

  public double getCost() {
    return cost;
  }

  public ExitStatus getStatus() {
    return status;
  }

  public boolean isSuccess() {
    return status.isSuccess();
  }

  public SolverDiagnostics getDiagnostics() {
    return diagnostics;
  }

  public double[] getResiduals() {
    return residuals.clone();
  }

  public double[] getDiffMagnitudes() {
    return diffMagnitudes.clone();
  }

  public CalibratorDataset getDataset() {
    return dataset;
  }

  /**
   * Get the root-mean-square residual of the final dataset
   *
   * @return RMS of the residuals, NaN if there are none
   */
  public double getRms() {
    return NumericUtils.rms(residuals);
  }

  /**
   * One-line summary for logs and reports
   *
   * @return Summary text
   */
  public String summarize() {
    StringBuilder sb = new StringBuilder();
    sb.append(stageName).append(" [").append(method.getName()).append("]: ");
    sb.append(status.getDescription());
    sb.append(", cost ").append(NumericUtils.SCIENTIFIC_FORMAT.get().format(cost));
    sb.append(", rms ").append(NumericUtils.DECIMAL_FORMAT.get().format(getRms()));
    sb.append(", ").append(dataset.size()).append(" calibrators");
    List<String> names = optimalParams.nameList();
    for (String name : names) {
      sb.append("\n  ").append(name).append(" = ")
          .append(NumericUtils.DECIMAL_FORMAT.get().format(optimalParams.get(name)));
    }
    sb.append("\n  ").append(diagnostics);
    return sb.toString();
  }

}
