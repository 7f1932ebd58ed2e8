package last.transmission.model;

/**
 * Thrown when a forward model cannot produce a prediction for a parameter set, for example
 * because the predicted flux of a calibrator is not positive or not finite.
 */
public class ModelEvaluationException extends Exception {

  private static final long serialVersionUID = -2318745510274301566L;

  public ModelEvaluationException(String message) {
    super(message);
  }

  public ModelEvaluationException(String message, Throwable cause) {
    super(message, cause);
  }

}
