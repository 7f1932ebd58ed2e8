package last.transmission.optimizer;

/**
 * Thrown when a stage has no calibrators to work with, either because the dataset was empty to
 * begin with or because sigma clipping rejected every record.
 */
public class InsufficientDataException extends OptimizationException {

  private static final long serialVersionUID = 2860214797455520719L;

  private final String stageName;

  public InsufficientDataException(String stageName, String message) {
    super("Stage " + stageName + ": " + message);
    this.stageName = stageName;
  }

  /**
   * Get the name of the stage that ran out of data
   *
   * @return Stage name
   */
  public String getStageName() {
    return stageName;
  }

}
