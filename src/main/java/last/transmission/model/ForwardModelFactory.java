package last.transmission.model;

/**
 * Creates the forward model a calibration stage evaluates, given the stage's choice of field
 * correction.
 */
public interface ForwardModelFactory {

  ForwardModel create(FieldModel fieldModel);

  /**
   * Factory producing {@link MagnitudeForwardModel} instances around a shared flux predictor
   *
   * @param predictor Physical flux integrator
   * @param geometry Detector geometry used to normalize calibrator positions
   * @return Factory for magnitude forward models
   */
  static ForwardModelFactory forPredictor(FluxPredictor predictor, DetectorGeometry geometry) {
    return fieldModel -> new MagnitudeForwardModel(predictor, fieldModel, geometry);
  }

}
