package last.transmission.stage;

import last.transmission.optimizer.StageConfigurationException;

/**
 * Outlier rejection settings of a single stage: whether to clip, the rejection threshold in
 * standard deviations, and the largest number of minimize-then-clip passes.
 */
public class SigmaClipConfig {

  public static final double DEFAULT_THRESHOLD = 3.0;
  public static final int DEFAULT_ITERATIONS = 3;

  /**
   * Clipping switched off
   */
  public static final SigmaClipConfig DISABLED =
      new SigmaClipConfig(false, DEFAULT_THRESHOLD, DEFAULT_ITERATIONS);

  private final boolean enabled;
  private final double threshold;
  private final int maxIterations;

  private SigmaClipConfig(boolean enabled, double threshold, int maxIterations) {
    this.enabled = enabled;
    this.threshold = threshold;
    this.maxIterations = maxIterations;
  }

  /**
   * Create an enabled clipping configuration
   *
   * @param threshold Rejection threshold in standard deviations, greater than 0
   * @param maxIterations Largest number of clipping passes, at least 1
   * @return New configuration
   * @throws StageConfigurationException If either value is out of range
   */
  public static SigmaClipConfig enabled(double threshold, int maxIterations) {
    if (!(threshold > 0.) || Double.isInfinite(threshold)) {
      throw new StageConfigurationException(
          "Sigma-clipping threshold must be a positive number, got " + threshold);
    }
    if (maxIterations < 1) {
      throw new StageConfigurationException(
          "Sigma-clipping needs at least one iteration, got " + maxIterations);
    }
    return new SigmaClipConfig(true, threshold, maxIterations);
  }

  public boolean isEnabled() {
    return enabled;
  }

  public double getThreshold() {
    return threshold;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SigmaClipConfig)) {
      return false;
    }
    SigmaClipConfig other = (SigmaClipConfig) obj;
    return enabled == other.enabled && threshold == other.threshold
        && maxIterations == other.maxIterations;
  }

  @Override
  public int hashCode() {
    return (enabled ? 1 : 0) + 31 * Double.hashCode(threshold) + 961 * maxIterations;
  }

  @Override
  public String toString() {
    if (!enabled) {
      return "no clipping";
    }
    return threshold + " sigma, up to " + maxIterations + " iterations";
  }

}
