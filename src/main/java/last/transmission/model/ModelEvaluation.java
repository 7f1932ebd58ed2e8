package last.transmission.model;

/**
 * Output of one forward-model evaluation: scalar cost plus the per-calibrator residual and
 * magnitude-difference vectors, both aligned index-for-index with the evaluated dataset.
 */
public class ModelEvaluation {

  private final double cost;
  private final double[] residuals;
  private final double[] diffMagnitudes;

  /**
   * Create a new evaluation result. Arrays are copied.
   *
   * @param cost Scalar cost (sum of squared residuals for the magnitude model)
   * @param residuals Per-calibrator residual
   * @param diffMagnitudes Per-calibrator predicted minus observed magnitude
   */
  public ModelEvaluation(double cost, double[] residuals, double[] diffMagnitudes) {
    if (residuals.length != diffMagnitudes.length) {
      throw new IllegalArgumentException("Residual and magnitude-difference vectors differ in"
          + " length: " + residuals.length + " vs. " + diffMagnitudes.length);
    }
    this.cost = cost;
    this.residuals = residuals.clone();
    this.diffMagnitudes = diffMagnitudes.clone();
  }

  /**
   * Build an evaluation whose residuals are the magnitude differences and whose cost is their sum
   * of squares
   *
   * @param diffMagnitudes Per-calibrator magnitude differences
   * @return New evaluation
   */
  public static ModelEvaluation fromMagnitudeDifferences(double[] diffMagnitudes) {
    double cost = 0.;
    for (double diff : diffMagnitudes) {
      cost += diff * diff;
    }
    return new ModelEvaluation(cost, diffMagnitudes, diffMagnitudes);
  }

  public double getCost() {
    return cost;
  }

  public double[] getResiduals() {
    return residuals.clone();
  }

  public double[] getDiffMagnitudes() {
    return diffMagnitudes.clone();
  }

  public int size() {
    return residuals.length;
  }

}
