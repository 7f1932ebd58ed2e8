package last.transmission.optimizer;

/**
 * Per-calibrator row of the final calibration: where the star sat on the detector, its observed
 * magnitude and the magnitude difference left by the final model.
 */
public class CalibratorResult {

  private final String id;
  private final double x;
  private final double y;
  private final double magnitude;
  private final double diffMagnitude;

  public CalibratorResult(String id, double x, double y, double magnitude,
      double diffMagnitude) {
    this.id = id;
    this.x = x;
    this.y = y;
    this.magnitude = magnitude;
    this.diffMagnitude = diffMagnitude;
  }

  public String getId() {
    return id;
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  public double getMagnitude() {
    return magnitude;
  }

  public double getDiffMagnitude() {
    return diffMagnitude;
  }

}
