package last.transmission.optimizer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import last.transmission.input.Calibrator;
import last.transmission.input.CalibratorDataset;
import last.transmission.input.CalibratorDatasetLoader;
import last.transmission.input.Configuration;
import last.transmission.model.DetectorGeometry;
import last.transmission.model.FluxPredictor;
import last.transmission.model.ForwardModelFactory;
import last.transmission.model.ParameterSet;
import last.transmission.model.TransmissionParameter;
import last.transmission.solver.SolverArgs;
import last.transmission.solver.StageSolver;
import last.transmission.stage.SigmaClipConfig;
import last.transmission.stage.StageDescriptor;
import last.transmission.stage.StageSequences;
import last.transmission.utils.NumericUtils;
import org.apache.log4j.Logger;

/**
 * Runs a calibration sequence: an ordered list of stages, each optimizing a subset of the model
 * parameters with the linear or the nonlinear solver, with the optimized values of every stage
 * carried forward into the next.
 *
 * For each stage the controller
 * <ol>
 *   <li>builds the fixed parameters from the base values, overlaid with the values accumulated
 *   by earlier stages, overlaid with the stage's explicit overrides, less the stage's free
 *   names;</li>
 *   <li>starts each free parameter from its accumulated value if an earlier stage optimized it,
 *   otherwise from its base value;</li>
 *   <li>solves the stage with the solver its method selects;</li>
 *   <li>replaces the working dataset with the clipped one if the stage clipped;</li>
 *   <li>merges the stage's optimal values into the accumulated set and records the result.</li>
 * </ol>
 *
 * The whole sequence is checked before the first stage runs, so configuration errors never
 * surface halfway through a run. A stage that fails numerically does not stop the run; it is
 * recorded and listed in {@link #getReportString()}. Running out of calibrators or cancellation
 * does stop the run.
 *
 * A controller is single-threaded. Only {@link CancellationToken#cancel()} may be called from
 * another thread.
 */
public class OptimizationController {

  private static final Logger logger = Logger.getLogger(OptimizationController.class);

  private final ForwardModelFactory modelFactory;
  private final DetectorGeometry geometry;

  private ParameterSet baseParameters = TransmissionParameter.defaults();
  private boolean sigmaClippingEnabled = true;
  private CancellationToken cancellationToken = CancellationToken.NONE;
  private double relativeTolerance = SolverArgs.DEFAULT_RELATIVE_TOLERANCE;
  private double absoluteTolerance = SolverArgs.DEFAULT_ABSOLUTE_TOLERANCE;
  private int maxEvaluations = SolverArgs.DEFAULT_MAX_EVALUATIONS;
  private int maxIterations = SolverArgs.DEFAULT_MAX_ITERATIONS;

  private CalibratorDataset loadedDataset = CalibratorDataset.empty();
  private OptimizerState state = OptimizerState.empty();

  /**
   * Create a controller around a forward-model factory
   *
   * @param modelFactory Creates the forward model for each stage's field model
   * @param geometry Detector geometry used by the linear solver's design matrix
   */
  public OptimizationController(ForwardModelFactory modelFactory, DetectorGeometry geometry) {
    this.modelFactory = modelFactory;
    this.geometry = geometry;
  }

  /**
   * Create a controller that compares the predictions of a flux integrator with the observed
   * calibrator fluxes in magnitude space
   *
   * @param predictor Flux integrator
   * @param geometry Detector geometry used to normalize calibrator positions
   */
  public OptimizationController(FluxPredictor predictor, DetectorGeometry geometry) {
    this(ForwardModelFactory.forPredictor(predictor, geometry), geometry);
  }

  /**
   * Create a controller with settings taken from a configuration
   *
   * @param predictor Flux integrator
   * @param config Source of base parameter values, geometry, tolerances and clipping switch
   * @return New controller
   */
  public static OptimizationController fromConfiguration(FluxPredictor predictor,
      Configuration config) {
    OptimizationController controller =
        new OptimizationController(predictor, config.getGeometry());
    controller.setBaseParameters(config.getDefaultParameters());
    controller.setSigmaClippingEnabled(config.isSigmaClippingEnabled());
    controller.setTolerances(config.getRelativeTolerance(), config.getAbsoluteTolerance());
    controller.setMaxEvaluations(config.getMaxEvaluations());
    controller.setMaxIterations(config.getMaxIterations());
    return controller;
  }

  /**
   * Load the calibrators for the next runs. Each run starts from this dataset.
   *
   * @param loader Catalog loader
   * @param catalogIdentifier Catalog to read
   * @param searchRadius Match radius, in arcsec
   * @return Number of calibrators loaded
   * @throws IOException If the loader cannot read the catalog
   */
  public int loadCalibratorData(CalibratorDatasetLoader loader, String catalogIdentifier,
      double searchRadius) throws IOException {
    setCalibratorData(loader.load(catalogIdentifier, searchRadius));
    return loadedDataset.size();
  }

  public void setCalibratorData(CalibratorDataset dataset) {
    loadedDataset = dataset;
    state = OptimizerState.initial(dataset);
    logger.info("Calibrator dataset set: " + dataset.size() + " calibrators");
  }

  /**
   * Set the values parameters take when no stage has optimized them. Names not given keep their
   * vocabulary defaults.
   *
   * @param parameters Base parameter values
   */
  public void setBaseParameters(ParameterSet parameters) {
    for (String name : parameters.names()) {
      if (!TransmissionParameter.isKnown(name)) {
        throw new StageConfigurationException("Unknown base parameter: " + name);
      }
    }
    baseParameters = TransmissionParameter.defaults().merge(parameters);
  }

  public ParameterSet getBaseParameters() {
    return baseParameters;
  }

  /**
   * Switch sigma clipping on or off for every stage. When off, stages that request clipping
   * run without it.
   *
   * @param enabled False to ignore the stages' clipping settings
   */
  public void setSigmaClippingEnabled(boolean enabled) {
    sigmaClippingEnabled = enabled;
  }

  public boolean isSigmaClippingEnabled() {
    return sigmaClippingEnabled;
  }

  public void setCancellationToken(CancellationToken token) {
    cancellationToken = token == null ? CancellationToken.NONE : token;
  }

  public void setTolerances(double relative, double absolute) {
    relativeTolerance = relative;
    absoluteTolerance = absolute;
  }

  public void setMaxEvaluations(int evaluations) {
    maxEvaluations = evaluations;
  }

  public void setMaxIterations(int iterations) {
    maxIterations = iterations;
  }

  /**
   * Run a built-in sequence
   *
   * @param sequenceName Name known to {@link StageSequences#byName(String)}
   * @return Accumulated parameters after the last stage
   */
  public ParameterSet runSequence(String sequenceName) {
    return runSequence(StageSequences.byName(sequenceName));
  }

  /**
   * Run a sequence of stages over the loaded calibrators. Each call starts from the loaded
   * dataset with no accumulated parameters, so repeated calls with the same input give the same
   * result.
   *
   * @param stages Stages in execution order
   * @return Accumulated parameters after the last stage
   * @throws StageConfigurationException If the sequence is malformed; raised before any solving
   * @throws InsufficientDataException If there are no calibrators, or clipping removes them all
   * @throws OptimizationCancelledException If the cancellation token is triggered
   */
  public ParameterSet runSequence(List<StageDescriptor> stages) {
    validateSequence(stages);

    state = OptimizerState.initial(loadedDataset);
    logger.info("Starting sequence of " + stages.size() + " stages on "
        + loadedDataset.size() + " calibrators");

    for (StageDescriptor stage : stages) {
      cancellationToken.checkCancelled("before stage " + stage.getName());
      SigmaClipConfig clip = effectiveClipping(stage);
      SolverArgs args = stageArguments(stage, state.getAccumulatedParams(), clip);

      logger.info("Stage " + (state.getStageIndex() + 1) + "/" + stages.size() + ": " + stage);
      StageSolver solver = stage.getMethod().createSolver();
      OptimizationResult result = solver.solve(args, state.getDataset());
      state = state.afterStage(result, clip.isEnabled());

      if (result.isSuccess()) {
        logger.info(result.summarize());
      } else {
        logger.warn("Stage " + stage.getName() + " did not converge ("
            + result.getStatus() + "); continuing\n" + result.summarize());
      }
    }

    logger.info("Sequence finished, " + state.getFailedResults().size() + " stage(s) failed");
    logger.debug("Final parameters: " + state.getAccumulatedParams());
    return state.getAccumulatedParams();
  }

  /**
   * Check a sequence without evaluating the model
   *
   * @param stages Stages to check
   * @throws StageConfigurationException If the sequence is empty or a stage is unusable
   * @throws InsufficientDataException If no calibrators are loaded
   */
  public void validateSequence(List<StageDescriptor> stages) {
    if (stages == null || stages.isEmpty()) {
      throw new StageConfigurationException("Sequence cannot be empty");
    }
    for (int i = 0; i < stages.size(); ++i) {
      StageDescriptor stage = stages.get(i);
      if (stage == null) {
        throw new StageConfigurationException("Stage " + (i + 1) + " of the sequence is missing");
      }
      SolverArgs args = stageArguments(stage, ParameterSet.empty(), SigmaClipConfig.DISABLED);
      stage.getMethod().createSolver().validate(args);
    }
    if (loadedDataset.isEmpty()) {
      throw new InsufficientDataException(stages.get(0).getName(),
          "no calibrators loaded before running the sequence");
    }
  }

  private SigmaClipConfig effectiveClipping(StageDescriptor stage) {
    return sigmaClippingEnabled ? stage.getSigmaClip() : SigmaClipConfig.DISABLED;
  }

  /**
   * Assemble the solver arguments of a stage from the accumulated parameters
   */
  SolverArgs stageArguments(StageDescriptor stage, ParameterSet accumulated,
      SigmaClipConfig clip) {
    List<String> free = stage.getFreeParameters();
    ParameterSet fixed = baseParameters
        .merge(accumulated)
        .merge(stage.getFixedOverrides())
        .without(free);
    ParameterSet initialGuess = baseParameters.merge(accumulated).select(free);

    return SolverArgs.builder(stage.getName())
        .freeNames(free)
        .fixedParams(fixed)
        .initialGuess(initialGuess)
        .sigmaClip(clip)
        .forwardModel(modelFactory.create(stage.getFieldModel()))
        .geometry(geometry)
        .regularization(stage.getRegularization())
        .cancellationToken(cancellationToken)
        .tolerances(relativeTolerance, absoluteTolerance)
        .maxEvaluations(maxEvaluations)
        .maxIterations(maxIterations)
        .build();
  }

  public OptimizerState getState() {
    return state;
  }

  public ParameterSet getAccumulatedParams() {
    return state.getAccumulatedParams();
  }

  public List<OptimizationResult> getResults() {
    return state.getResults();
  }

  public OptimizationExport export() {
    return state.export();
  }

  /**
   * Get the magnitude difference left on each calibrator by the last stage
   *
   * @return One row per calibrator of the last stage's dataset, empty if nothing has run
   */
  public List<CalibratorResult> getCalibratorResults() {
    List<CalibratorResult> rows = new ArrayList<>();
    List<OptimizationResult> results = state.getResults();
    if (results.isEmpty()) {
      return rows;
    }
    OptimizationResult last = results.get(results.size() - 1);
    CalibratorDataset dataset = last.getDataset();
    double[] diffMagnitudes = last.getDiffMagnitudes();
    for (int i = 0; i < dataset.size(); ++i) {
      Calibrator calibrator = dataset.get(i);
      rows.add(new CalibratorResult(calibrator.getId(), calibrator.getX(), calibrator.getY(),
          calibrator.getMagnitude(), diffMagnitudes[i]));
    }
    return rows;
  }

  /**
   * Produce a plain-text report of the last run: one block per stage, the final parameters,
   * and the list of stages that did not converge
   *
   * @return Report text
   */
  public String getReportString() {
    StringBuilder sb = new StringBuilder();
    List<OptimizationResult> results = state.getResults();
    if (results.isEmpty()) {
      return "No stages have been run.";
    }
    sb.append("Calibration sequence: ").append(results.size()).append(" stage(s), ")
        .append(loadedDataset.size()).append(" calibrators loaded, ")
        .append(state.getDataset().size()).append(" in final set\n\n");
    for (int i = 0; i < results.size(); ++i) {
      sb.append(i + 1).append(". ").append(results.get(i).summarize()).append("\n");
    }

    sb.append("\nFinal parameters:\n");
    ParameterSet finalParams = state.getAccumulatedParams();
    for (String name : finalParams.names()) {
      sb.append("  ").append(name).append(" = ")
          .append(NumericUtils.DECIMAL_FORMAT.get().format(finalParams.get(name))).append('\n');
    }

    List<OptimizationResult> failed = state.getFailedResults();
    if (failed.isEmpty()) {
      sb.append("\nAll stages converged.");
    } else {
      sb.append("\nFAILED STAGES (calibration may be partial):\n");
      for (OptimizationResult result : failed) {
        sb.append("  ").append(result.getStageName()).append(": ")
            .append(result.getStatus().getDescription());
        String message = result.getDiagnostics().getMessage();
        if (!message.isEmpty()) {
          sb.append(" - ").append(message);
        }
        sb.append('\n');
      }
    }
    return sb.toString();
  }

}
