package last.transmission.solver;

/**
 * Outcome of solving one stage. The numeric codes follow the usual simplex-search convention:
 * positive for convergence, 0 when the search stopped without converging, negative for failure.
 */
public enum ExitStatus {

  CONVERGED(1, "converged"),
  CONVERGED_WITH_CLIPPING(2, "converged after sigma clipping"),
  MAX_EVALUATIONS(0, "stopped at evaluation limit"),
  FAILED(-1, "failed");

  private final int code;
  private final String description;

  ExitStatus(int code, String description) {
    this.code = code;
    this.description = description;
  }

  public int getCode() {
    return code;
  }

  public String getDescription() {
    return description;
  }

  /**
   * True if the solver converged, with or without clipping
   *
   * @return True for {@link #CONVERGED} and {@link #CONVERGED_WITH_CLIPPING}
   */
  public boolean isSuccess() {
    return code > 0;
  }

}
