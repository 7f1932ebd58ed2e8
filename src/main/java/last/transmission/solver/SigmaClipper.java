package last.transmission.solver;

import java.util.Arrays;
import last.transmission.input.CalibratorDataset;
import last.transmission.utils.NumericUtils;
import org.apache.log4j.Logger;

/**
 * Rejects calibrators whose residual lies more than a given number of standard deviations from
 * the mean residual. Location and scale are the mean and sample standard deviation of the finite
 * residuals; non-finite residuals are always rejected. Fewer than two finite residuals leave the
 * scale undefined and nothing further is rejected.
 *
 * The result depends only on the residuals and the threshold, so clipping the output again with
 * the same threshold at convergence rejects nothing more.
 */
public class SigmaClipper {

  private static final Logger logger = Logger.getLogger(SigmaClipper.class);

  /**
   * Clip a dataset
   *
   * @param dataset Calibrators matching the residuals
   * @param residuals Residual per calibrator
   * @param threshold Rejection threshold in standard deviations
   * @return Surviving calibrators and the rejection mask
   * @throws IllegalArgumentException If the residual count differs from the dataset size or the
   *     threshold is not positive
   */
  public ClipResult clip(CalibratorDataset dataset, double[] residuals, double threshold) {
    if (residuals.length != dataset.size()) {
      throw new IllegalArgumentException("Got " + residuals.length + " residuals for "
          + dataset.size() + " calibrators");
    }
    if (!(threshold > 0.)) {
      throw new IllegalArgumentException("Clipping threshold must be positive: " + threshold);
    }

    boolean[] mask = new boolean[residuals.length];
    double[] finite = new double[residuals.length];
    int finiteCount = 0;
    for (int i = 0; i < residuals.length; ++i) {
      if (Double.isFinite(residuals[i])) {
        finite[finiteCount++] = residuals[i];
      } else {
        mask[i] = true;
      }
    }

    double mean = Double.NaN;
    double deviation = Double.NaN;
    if (finiteCount >= 2) {
      double[] stats = NumericUtils.meanAndDeviation(Arrays.copyOf(finite, finiteCount));
      mean = stats[0];
      deviation = stats[1];
      double limit = threshold * deviation;
      for (int i = 0; i < residuals.length; ++i) {
        if (!mask[i] && Math.abs(residuals[i] - mean) > limit) {
          mask[i] = true;
        }
      }
    }

    ClipResult result = new ClipResult(dataset.filter(mask), mask, mean, deviation);
    logger.debug("Sigma clip at " + threshold + " sigma (mean "
        + NumericUtils.DECIMAL_FORMAT.get().format(mean) + ", std "
        + NumericUtils.DECIMAL_FORMAT.get().format(deviation) + "): removed "
        + result.getRemovedCount() + " of " + residuals.length);
    return result;
  }

}
