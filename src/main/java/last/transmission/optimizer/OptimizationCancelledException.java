package last.transmission.optimizer;

/**
 * Thrown when a sequence run is stopped through its {@link CancellationToken}
 */
public class OptimizationCancelledException extends OptimizationException {

  private static final long serialVersionUID = -7714032850157936415L;

  public OptimizationCancelledException(String message) {
    super(message);
  }

}
