package last.transmission.input;

import java.util.Arrays;

/**
 * A single calibrator star matched between the reference catalog and the observed image.
 * Holds the reference spectrum (sampled on the model's wavelength grid), the observed magnitude
 * and flux, the detector position the star was measured at, and the observing conditions.
 *
 * Instances are immutable; the spectrum array is copied on the way in and on the way out.
 */
public class Calibrator {

  private final String id;
  private final double[] spectrum;
  private final double magnitude;
  private final double flux;
  private final double x;
  private final double y;
  private final double airmass;
  private final double temperature;
  private final double pressure;

  private Calibrator(Builder builder) {
    id = builder.id;
    spectrum = builder.spectrum.clone();
    magnitude = builder.magnitude;
    flux = builder.flux;
    x = builder.x;
    y = builder.y;
    airmass = builder.airmass;
    temperature = builder.temperature;
    pressure = builder.pressure;
  }

  public static Builder builder(String id) {
    return new Builder(id);
  }

  public String getId() {
    return id;
  }

  /**
   * Get the reference spectrum of this calibrator
   *
   * @return Copy of the flux density samples
   */
  public double[] getSpectrum() {
    return spectrum.clone();
  }

  public int getSpectrumLength() {
    return spectrum.length;
  }

  public double getMagnitude() {
    return magnitude;
  }

  /**
   * Get the observed (aperture) flux of this calibrator
   *
   * @return Observed flux, in instrument counts
   */
  public double getFlux() {
    return flux;
  }

  /**
   * @return Detector x coordinate, in pixels
   */
  public double getX() {
    return x;
  }

  /**
   * @return Detector y coordinate, in pixels
   */
  public double getY() {
    return y;
  }

  public double getAirmass() {
    return airmass;
  }

  public double getTemperature() {
    return temperature;
  }

  public double getPressure() {
    return pressure;
  }

  @Override
  public String toString() {
    return "Calibrator[" + id + " @ (" + x + ", " + y + "), mag=" + magnitude + "]";
  }

  /**
   * Builder for calibrator records; only the id is required
   */
  public static class Builder {

    private final String id;
    private double[] spectrum = new double[0];
    private double magnitude = Double.NaN;
    private double flux = Double.NaN;
    private double x;
    private double y;
    private double airmass = 1.0;
    private double temperature = Double.NaN;
    private double pressure = Double.NaN;

    Builder(String id) {
      if (id == null) {
        throw new IllegalArgumentException("Calibrator id cannot be null");
      }
      this.id = id;
    }

    public Builder spectrum(double[] spectrum) {
      this.spectrum = Arrays.copyOf(spectrum, spectrum.length);
      return this;
    }

    public Builder magnitude(double magnitude) {
      this.magnitude = magnitude;
      return this;
    }

    public Builder flux(double flux) {
      this.flux = flux;
      return this;
    }

    public Builder position(double x, double y) {
      this.x = x;
      this.y = y;
      return this;
    }

    public Builder airmass(double airmass) {
      this.airmass = airmass;
      return this;
    }

    public Builder temperature(double temperature) {
      this.temperature = temperature;
      return this;
    }

    public Builder pressure(double pressure) {
      this.pressure = pressure;
      return this;
    }

    public Calibrator build() {
      return new Calibrator(this);
    }
  }

}
