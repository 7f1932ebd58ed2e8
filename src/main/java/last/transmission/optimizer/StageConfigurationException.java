package last.transmission.optimizer;

/**
 * Thrown when a stage or sequence is malformed: unknown solver method, a parameter name outside
 * the model vocabulary, a non-field parameter given to the linear solver, and similar. Always
 * raised before any cost evaluation takes place.
 */
public class StageConfigurationException extends OptimizationException {

  private static final long serialVersionUID = -4906270338190871132L;

  public StageConfigurationException(String message) {
    super(message);
  }

  public StageConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }

}
