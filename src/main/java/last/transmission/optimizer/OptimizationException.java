package last.transmission.optimizer;

/**
 * Base class of the errors a calibration sequence can raise to its caller. Numerical failures
 * inside a single stage are not thrown; they are reported in that stage's
 * {@link OptimizationResult} instead.
 */
public class OptimizationException extends RuntimeException {

  private static final long serialVersionUID = 6093188265215630384L;

  public OptimizationException(String message) {
    super(message);
  }

  public OptimizationException(String message, Throwable cause) {
    super(message, cause);
  }

}
