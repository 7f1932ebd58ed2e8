package last.transmission.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import last.transmission.model.DetectorGeometry;
import last.transmission.model.ForwardModel;
import last.transmission.model.ParameterSet;
import last.transmission.model.TransmissionParameter;
import last.transmission.optimizer.CancellationToken;
import last.transmission.optimizer.StageConfigurationException;
import last.transmission.stage.SigmaClipConfig;

/**
 * Everything a {@link StageSolver} needs to solve one stage apart from the dataset: which
 * parameters are free, the values of the fixed ones, where to start, and how to stop.
 *
 * The fixed set never contains a free name (free names are removed on build), and the initial
 * guess always holds exactly the free names, filled from vocabulary defaults where the caller gave
 * no value.
 */
public class SolverArgs {

  /**
   * Relative change in cost between simplex iterations below which the search has converged
   */
  public static final double DEFAULT_RELATIVE_TOLERANCE = 1e-6;
  public static final double DEFAULT_ABSOLUTE_TOLERANCE = 1e-10;
  public static final int DEFAULT_MAX_EVALUATIONS = 500;
  public static final int DEFAULT_MAX_ITERATIONS = 200;

  private final String stageName;
  private final List<String> freeNames;
  private final ParameterSet fixedParams;
  private final ParameterSet initialGuess;
  private final SigmaClipConfig sigmaClip;
  private final ForwardModel forwardModel;
  private final DetectorGeometry geometry;
  private final double regularization;
  private final CancellationToken cancellationToken;
  private final double relativeTolerance;
  private final double absoluteTolerance;
  private final int maxEvaluations;
  private final int maxIterations;

  private SolverArgs(Builder builder) {
    stageName = builder.stageName;
    freeNames = Collections.unmodifiableList(new ArrayList<>(builder.freeNames));
    fixedParams = builder.fixedParams.without(freeNames);
    initialGuess = TransmissionParameter.defaults().select(freeNames)
        .merge(builder.initialGuess.select(freeNames));
    sigmaClip = builder.sigmaClip;
    forwardModel = builder.forwardModel;
    geometry = builder.geometry;
    regularization = builder.regularization;
    cancellationToken = builder.cancellationToken;
    relativeTolerance = builder.relativeTolerance;
    absoluteTolerance = builder.absoluteTolerance;
    maxEvaluations = builder.maxEvaluations;
    maxIterations = builder.maxIterations;
  }

  public static Builder builder(String stageName) {
    return new Builder(stageName);
  }

  public String getStageName() {
    return stageName;
  }

  public List<String> getFreeNames() {
    return freeNames;
  }

  public ParameterSet getFixedParams() {
    return fixedParams;
  }

  /**
   * Get the starting values of the free parameters (used by the nonlinear solver only)
   *
   * @return Parameter set with one entry per free name, in free-name order
   */
  public ParameterSet getInitialGuess() {
    return initialGuess;
  }

  public SigmaClipConfig getSigmaClip() {
    return sigmaClip;
  }

  public ForwardModel getForwardModel() {
    return forwardModel;
  }

  public DetectorGeometry getGeometry() {
    return geometry;
  }

  public double getRegularization() {
    return regularization;
  }

  public CancellationToken getCancellationToken() {
    return cancellationToken;
  }

  public double getRelativeTolerance() {
    return relativeTolerance;
  }

  public double getAbsoluteTolerance() {
    return absoluteTolerance;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  /**
   * Combine the fixed parameters with values for the free ones
   *
   * @param free Values of the free parameters
   * @return Complete parameter set to evaluate the forward model with
   */
  public ParameterSet fullParameters(ParameterSet free) {
    return fixedParams.merge(free);
  }

  public static class Builder {

    private final String stageName;
    private final LinkedHashSet<String> freeNames = new LinkedHashSet<>();
    private ParameterSet fixedParams = ParameterSet.empty();
    private ParameterSet initialGuess = ParameterSet.empty();
    private SigmaClipConfig sigmaClip = SigmaClipConfig.DISABLED;
    private ForwardModel forwardModel;
    private DetectorGeometry geometry = DetectorGeometry.DEFAULT;
    private double regularization = 0.;
    private CancellationToken cancellationToken = CancellationToken.NONE;
    private double relativeTolerance = DEFAULT_RELATIVE_TOLERANCE;
    private double absoluteTolerance = DEFAULT_ABSOLUTE_TOLERANCE;
    private int maxEvaluations = DEFAULT_MAX_EVALUATIONS;
    private int maxIterations = DEFAULT_MAX_ITERATIONS;

    private Builder(String stageName) {
      this.stageName = stageName;
    }

    public Builder freeNames(List<String> names) {
      freeNames.addAll(names);
      return this;
    }

    public Builder fixedParams(ParameterSet fixed) {
      fixedParams = fixed;
      return this;
    }

    public Builder initialGuess(ParameterSet guess) {
      initialGuess = guess;
      return this;
    }

    public Builder sigmaClip(SigmaClipConfig config) {
      sigmaClip = config;
      return this;
    }

    public Builder forwardModel(ForwardModel model) {
      forwardModel = model;
      return this;
    }

    public Builder geometry(DetectorGeometry detectorGeometry) {
      geometry = detectorGeometry;
      return this;
    }

    public Builder regularization(double lambda) {
      regularization = lambda;
      return this;
    }

    public Builder cancellationToken(CancellationToken token) {
      cancellationToken = token;
      return this;
    }

    /**
     * Set the simplex stopping rule
     *
     * @param relative Relative cost change threshold
     * @param absolute Absolute cost change threshold
     * @return This builder
     */
    public Builder tolerances(double relative, double absolute) {
      relativeTolerance = relative;
      absoluteTolerance = absolute;
      return this;
    }

    public Builder maxEvaluations(int evaluations) {
      maxEvaluations = evaluations;
      return this;
    }

    public Builder maxIterations(int iterations) {
      maxIterations = iterations;
      return this;
    }

    /**
     * Check and create the arguments
     *
     * @return New solver arguments
     * @throws StageConfigurationException If a required value is missing or out of range
     */
    public SolverArgs build() {
      if (freeNames.isEmpty()) {
        throw new StageConfigurationException("Stage " + stageName + " has no free parameters");
      }
      for (String name : freeNames) {
        if (!TransmissionParameter.isKnown(name)) {
          throw new StageConfigurationException("Stage " + stageName
              + ": unknown free parameter '" + name + "'");
        }
      }
      if (forwardModel == null) {
        throw new StageConfigurationException("Stage " + stageName + " has no forward model");
      }
      if (geometry == null) {
        geometry = DetectorGeometry.DEFAULT;
      }
      if (sigmaClip == null) {
        sigmaClip = SigmaClipConfig.DISABLED;
      }
      if (cancellationToken == null) {
        cancellationToken = CancellationToken.NONE;
      }
      if (!(regularization >= 0.)) {
        throw new StageConfigurationException("Stage " + stageName
            + ": regularization must be non-negative, got " + regularization);
      }
      if (!(relativeTolerance > 0.) && !(absoluteTolerance > 0.)) {
        throw new StageConfigurationException("Stage " + stageName
            + ": at least one simplex tolerance must be positive");
      }
      if (maxEvaluations < 1 || maxIterations < 1) {
        throw new StageConfigurationException("Stage " + stageName
            + ": evaluation and iteration limits must be positive");
      }
      return new SolverArgs(this);
    }

  }

}
