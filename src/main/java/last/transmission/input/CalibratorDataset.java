package last.transmission.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered, immutable collection of calibrators used as the fit target of a calibration run.
 * Outlier rejection never edits a dataset in place: {@link #filter(boolean[])} produces a new
 * dataset holding the surviving records in their original order.
 */
public class CalibratorDataset implements Iterable<Calibrator> {

  private static final CalibratorDataset EMPTY = new CalibratorDataset(new ArrayList<>());

  private final List<Calibrator> calibrators;

  /**
   * Create a dataset from a list of calibrators. The list is copied.
   *
   * @param calibrators Calibrator records, in catalog order
   */
  public CalibratorDataset(List<Calibrator> calibrators) {
    this.calibrators = Collections.unmodifiableList(new ArrayList<>(calibrators));
  }

  public static CalibratorDataset empty() {
    return EMPTY;
  }

  public int size() {
    return calibrators.size();
  }

  public boolean isEmpty() {
    return calibrators.isEmpty();
  }

  public Calibrator get(int index) {
    return calibrators.get(index);
  }

  public List<Calibrator> getCalibrators() {
    return calibrators;
  }

  /**
   * @return Detector x coordinate of each calibrator, in dataset order
   */
  public double[] getXCoordinates() {
    double[] xs = new double[calibrators.size()];
    for (int i = 0; i < xs.length; ++i) {
      xs[i] = calibrators.get(i).getX();
    }
    return xs;
  }

  /**
   * @return Detector y coordinate of each calibrator, in dataset order
   */
  public double[] getYCoordinates() {
    double[] ys = new double[calibrators.size()];
    for (int i = 0; i < ys.length; ++i) {
      ys[i] = calibrators.get(i).getY();
    }
    return ys;
  }

  /**
   * @return Observed flux of each calibrator, in dataset order
   */
  public double[] getFluxes() {
    double[] fluxes = new double[calibrators.size()];
    for (int i = 0; i < fluxes.length; ++i) {
      fluxes[i] = calibrators.get(i).getFlux();
    }
    return fluxes;
  }

  public double[] getMagnitudes() {
    double[] mags = new double[calibrators.size()];
    for (int i = 0; i < mags.length; ++i) {
      mags[i] = calibrators.get(i).getMagnitude();
    }
    return mags;
  }

  /**
   * Produce a new dataset without the records flagged in the mask
   *
   * @param outlierMask True for each index to remove; must be as long as this dataset
   * @return New dataset containing the unflagged records in their original order
   */
  public CalibratorDataset filter(boolean[] outlierMask) {
    if (outlierMask.length != calibrators.size()) {
      throw new IllegalArgumentException("Mask length " + outlierMask.length
          + " does not match dataset size " + calibrators.size());
    }
    List<Calibrator> kept = new ArrayList<>();
    for (int i = 0; i < outlierMask.length; ++i) {
      if (!outlierMask[i]) {
        kept.add(calibrators.get(i));
      }
    }
    return new CalibratorDataset(kept);
  }

  @Override
  public Iterator<Calibrator> iterator() {
    return calibrators.iterator();
  }

  @Override
  public String toString() {
    return "CalibratorDataset[" + calibrators.size() + " calibrators]";
  }

}
