package last.transmission.solver;

import last.transmission.utils.NumericUtils;

/**
 * Bookkeeping reported alongside a stage result. Fields that do not apply to a solver are left
 * at NaN (condition number, penalized cost) or -1 (rank).
 */
public class SolverDiagnostics {

  private final int iterations;
  private final int evaluations;
  private final int clipIterations;
  private final int removedCount;
  private final double conditionNumber;
  private final int rank;
  private final double penalizedCost;
  private final String message;

  private SolverDiagnostics(Builder builder) {
    iterations = builder.iterations;
    evaluations = builder.evaluations;
    clipIterations = builder.clipIterations;
    removedCount = builder.removedCount;
    conditionNumber = builder.conditionNumber;
    rank = builder.rank;
    penalizedCost = builder.penalizedCost;
    message = builder.message;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Get the number of solver iterations, summed over all clipping passes
   *
   * @return Simplex iterations, or solves for the linear method
   */
  public int getIterations() {
    return iterations;
  }

  /**
   * Get the number of forward-model evaluations made by the stage
   *
   * @return Evaluation count, including the final evaluation of the result
   */
  public int getEvaluations() {
    return evaluations;
  }

  /**
   * Get the number of sigma-clipping passes; 0 if clipping was off
   *
   * @return Clipping iterations performed
   */
  public int getClipIterations() {
    return clipIterations;
  }

  public int getRemovedCount() {
    return removedCount;
  }

  /**
   * Get the condition number of the last design matrix (linear method only)
   *
   * @return Ratio of largest to smallest singular value, or NaN
   */
  public double getConditionNumber() {
    return conditionNumber;
  }

  public int getRank() {
    return rank;
  }

  /**
   * Get the regularized objective ||Ax + b||^2 + lambda ||x||^2 (linear method only)
   *
   * @return Penalized cost, or NaN
   */
  public double getPenalizedCost() {
    return penalizedCost;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("iterations=").append(iterations);
    sb.append(", evaluations=").append(evaluations);
    sb.append(", clip iterations=").append(clipIterations);
    sb.append(", removed=").append(removedCount);
    if (!Double.isNaN(conditionNumber)) {
      sb.append(", cond=").append(NumericUtils.SCIENTIFIC_FORMAT.get().format(conditionNumber));
      sb.append(", rank=").append(rank);
    }
    if (!message.isEmpty()) {
      sb.append(" (").append(message).append(')');
    }
    return sb.toString();
  }

  public static class Builder {

    private int iterations = 0;
    private int evaluations = 0;
    private int clipIterations = 0;
    private int removedCount = 0;
    private double conditionNumber = Double.NaN;
    private int rank = -1;
    private double penalizedCost = Double.NaN;
    private String message = "";

    private Builder() {
    }

    public Builder iterations(int iterations) {
      this.iterations = iterations;
      return this;
    }

    public Builder evaluations(int evaluations) {
      this.evaluations = evaluations;
      return this;
    }

    public Builder clipIterations(int clipIterations) {
      this.clipIterations = clipIterations;
      return this;
    }

    public Builder removedCount(int removedCount) {
      this.removedCount = removedCount;
      return this;
    }

    public Builder conditionNumber(double conditionNumber) {
      this.conditionNumber = conditionNumber;
      return this;
    }

    public Builder rank(int rank) {
      this.rank = rank;
      return this;
    }

    public Builder penalizedCost(double penalizedCost) {
      this.penalizedCost = penalizedCost;
      return this;
    }

    public Builder message(String message) {
      this.message = message == null ? "" : message;
      return this;
    }

    public SolverDiagnostics build() {
      return new SolverDiagnostics(this);
    }

  }

}
