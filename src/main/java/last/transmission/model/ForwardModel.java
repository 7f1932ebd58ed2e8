package last.transmission.model;

import last.transmission.input.CalibratorDataset;

/**
 * Maps a complete parameter set and a calibrator dataset to a cost and per-calibrator residuals.
 * Implementations must be pure: the same inputs always give the same outputs, and the dataset is
 * not modified or retained. Any lookup tables a model needs are supplied at construction.
 */
public interface ForwardModel {

  /**
   * Evaluate the model
   *
   * @param params Values of every parameter the model reads, free and fixed
   * @param dataset Calibrators to evaluate against
   * @return Cost with residual and magnitude-difference vectors of length dataset.size()
   * @throws ModelEvaluationException If the model cannot be evaluated at these parameters
   */
  ModelEvaluation evaluate(ParameterSet params, CalibratorDataset dataset)
      throws ModelEvaluationException;

}
