package last.transmission.model;

import last.transmission.utils.NumericUtils;

/**
 * Detector extent and the target range that detector coordinates are normalized to before
 * evaluating field-correction polynomials. Immutable; built once by the caller (usually from the
 * configuration) and shared by every forward model and solver of a run.
 */
public class DetectorGeometry {

  /**
   * LAST detector: 1726 pixel square, normalized to [-1, 1]
   */
  public static final DetectorGeometry DEFAULT = new DetectorGeometry(0., 1726., -1., 1.);

  private final double minCoordinate;
  private final double maxCoordinate;
  private final double targetMin;
  private final double targetMax;

  /**
   * Create a new detector geometry
   *
   * @param minCoordinate Smallest pixel coordinate on the detector
   * @param maxCoordinate Largest pixel coordinate on the detector
   * @param targetMin Normalized value the smallest coordinate maps to
   * @param targetMax Normalized value the largest coordinate maps to
   */
  public DetectorGeometry(double minCoordinate, double maxCoordinate,
      double targetMin, double targetMax) {
    if (!(maxCoordinate > minCoordinate)) {
      throw new IllegalArgumentException("Detector max coordinate (" + maxCoordinate
          + ") must exceed min coordinate (" + minCoordinate + ")");
    }
    if (!(targetMax > targetMin)) {
      throw new IllegalArgumentException("Normalization target range is empty: ["
          + targetMin + ", " + targetMax + "]");
    }
    this.minCoordinate = minCoordinate;
    this.maxCoordinate = maxCoordinate;
    this.targetMin = targetMin;
    this.targetMax = targetMax;
  }

  public double getMinCoordinate() {
    return minCoordinate;
  }

  public double getMaxCoordinate() {
    return maxCoordinate;
  }

  public double getTargetMin() {
    return targetMin;
  }

  public double getTargetMax() {
    return targetMax;
  }

  /**
   * Map a pixel coordinate into the normalized range
   *
   * @param coordinate Pixel coordinate (x or y)
   * @return Normalized coordinate
   */
  public double normalize(double coordinate) {
    return NumericUtils.rescale(coordinate, minCoordinate, maxCoordinate, targetMin, targetMax);
  }

  @Override
  public String toString() {
    return "DetectorGeometry[" + minCoordinate + ", " + maxCoordinate + "] -> ["
        + targetMin + ", " + targetMax + "]";
  }

}
