package last.transmission.solver;

import last.transmission.input.CalibratorDataset;

/**
 * Output of one sigma-clipping pass: the surviving calibrators and the mask of rejected ones,
 * aligned index-for-index with the dataset that was clipped.
 */
public class ClipResult {

  private final CalibratorDataset dataset;
  private final boolean[] outlierMask;
  private final int removedCount;
  private final double mean;
  private final double standardDeviation;

  ClipResult(CalibratorDataset dataset, boolean[] outlierMask, double mean,
      double standardDeviation) {
    this.dataset = dataset;
    this.outlierMask = outlierMask.clone();
    int removed = 0;
    for (boolean outlier : outlierMask) {
      if (outlier) {
        ++removed;
      }
    }
    this.removedCount = removed;
    this.mean = mean;
    this.standardDeviation = standardDeviation;
  }

  /**
   * Get the calibrators that were not rejected
   *
   * @return Filtered dataset, in original order
   */
  public CalibratorDataset getDataset() {
    return dataset;
  }

  /**
   * Get the rejection mask
   *
   * @return Copy of the mask; true marks a rejected calibrator
   */
  public boolean[] getOutlierMask() {
    return outlierMask.clone();
  }

  public int getRemovedCount() {
    return removedCount;
  }

  public double getMean() {
    return mean;
  }

  public double getStandardDeviation() {
    return standardDeviation;
  }

}
