package last.transmission.model;

/**
 * Selects which field-correction model a calibration stage applies on top of the flux
 * prediction. Each constant knows how to turn a parameter set into per-position magnitude
 * offsets.
 */
public enum FieldModel {

  NONE("none") {
    @Override
    public double magnitudeOffset(ParameterSet params, double x, double y) {
      return 0.;
    }
  },
  /**
   * Chebyshev terms added in magnitude space (kx0..kxy); solvable in closed form
   */
  ADDITIVE("additive") {
    @Override
    public double magnitudeOffset(ParameterSet params, double x, double y) {
      return FieldCorrection.additiveOffset(params, x, y);
    }
  },
  /**
   * Exponential Chebyshev scaling of the predicted flux (cx0..cy4)
   */
  MULTIPLICATIVE("multiplicative") {
    @Override
    public double magnitudeOffset(ParameterSet params, double x, double y) {
      return FieldCorrection.multiplicativeOffset(params, x, y);
    }
  };

  private final String name;

  FieldModel(String name) {
    this.name = name;
  }

  /**
   * Get the magnitude offset this model applies at a normalized detector position
   *
   * @param params Parameters containing the model's coefficients
   * @param x Normalized x coordinate
   * @param y Normalized y coordinate
   * @return Offset in magnitudes (0 if no coefficients are set)
   */
  public abstract double magnitudeOffset(ParameterSet params, double x, double y);

  public String getName() {
    return name;
  }

  /**
   * Look up a field model by its configuration name (case-insensitive)
   *
   * @param name One of "none", "additive", "multiplicative"
   * @return Matching model, or null if there is none
   */
  public static FieldModel fromName(String name) {
    if (name == null) {
      return null;
    }
    for (FieldModel model : values()) {
      if (model.name.equalsIgnoreCase(name.trim())) {
        return model;
      }
    }
    return null;
  }

}
