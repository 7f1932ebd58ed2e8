package last.transmission.model;

import last.transmission.input.Calibrator;
import last.transmission.input.CalibratorDataset;

/**
 * Forward model comparing predicted and observed calibrator flux in magnitude space. For each
 * calibrator
 * <pre>
 *   diffMag = 2.5 log10(predictedFlux / observedFlux) + fieldOffset(x, y)
 * </pre>
 * where the field offset comes from the selected {@link FieldModel} evaluated at the
 * calibrator's normalized detector position. Residuals are the magnitude differences and the cost
 * is their sum of squares.
 */
public class MagnitudeForwardModel implements ForwardModel {

  private final FluxPredictor predictor;
  private final FieldModel fieldModel;
  private final DetectorGeometry geometry;

  /**
   * Create a new magnitude model
   *
   * @param predictor Flux integrator for the transmission parameters
   * @param fieldModel Field correction applied to the magnitude differences
   * @param geometry Detector geometry used to normalize calibrator positions
   */
  public MagnitudeForwardModel(FluxPredictor predictor, FieldModel fieldModel,
      DetectorGeometry geometry) {
    this.predictor = predictor;
    this.fieldModel = fieldModel == null ? FieldModel.NONE : fieldModel;
    this.geometry = geometry;
  }

  public FieldModel getFieldModel() {
    return fieldModel;
  }

  public DetectorGeometry getGeometry() {
    return geometry;
  }

  @Override
  public ModelEvaluation evaluate(ParameterSet params, CalibratorDataset dataset)
      throws ModelEvaluationException {
    double[] predicted = predictor.predictFlux(params, dataset);
    if (predicted.length != dataset.size()) {
      throw new ModelEvaluationException("Flux predictor returned " + predicted.length
          + " values for " + dataset.size() + " calibrators");
    }

    double[] diffMagnitudes = new double[predicted.length];
    for (int i = 0; i < predicted.length; ++i) {
      Calibrator calibrator = dataset.get(i);
      double observed = calibrator.getFlux();
      if (!(predicted[i] > 0.) || !(observed > 0.) || Double.isInfinite(predicted[i])) {
        throw new ModelEvaluationException("Non-positive flux for calibrator "
            + calibrator.getId() + " (predicted " + predicted[i] + ", observed " + observed + ")");
      }
      double x = geometry.normalize(calibrator.getX());
      double y = geometry.normalize(calibrator.getY());
      diffMagnitudes[i] = 2.5 * Math.log10(predicted[i] / observed)
          + fieldModel.magnitudeOffset(params, x, y);
    }
    return ModelEvaluation.fromMagnitudeDifferences(diffMagnitudes);
  }

}
