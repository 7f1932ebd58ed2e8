package last.transmission.model;

import last.transmission.input.CalibratorDataset;

/**
 * Physical flux integrator: predicts the flux each calibrator should show through the
 * instrumental and atmospheric transmission described by a parameter set. Field corrections are
 * not part of this prediction; {@link MagnitudeForwardModel} applies them afterwards.
 */
public interface FluxPredictor {

  /**
   * Predict calibrator fluxes
   *
   * @param params Transmission parameters (normalization, QE shape, atmosphere)
   * @param dataset Calibrators to predict for
   * @return Predicted flux per calibrator, in dataset order
   * @throws ModelEvaluationException If the transmission cannot be computed for these parameters
   */
  double[] predictFlux(ParameterSet params, CalibratorDataset dataset)
      throws ModelEvaluationException;

}
