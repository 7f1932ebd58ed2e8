package last.transmission.input;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import last.transmission.model.DetectorGeometry;
import last.transmission.model.ParameterSet;
import last.transmission.model.TransmissionParameter;
import last.transmission.solver.SolverArgs;
import last.transmission.stage.StageDescriptor;
import last.transmission.stage.StageSequenceReader;
import last.transmission.stage.StageSequences;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.ConversionException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Configuration file for transmission calibration runs. Holds the starting values of the model
 * parameters, the detector geometry used to normalize calibrator positions, the simplex stopping
 * rule, the sequence to run by default and whether sigma clipping is applied, and where to find
 * the calibrator table. Sequences may also be declared in the file under a Sequences element;
 * those take precedence over the built-in sequences of the same name.
 *
 * Any value missing from the file keeps its built-in default.
 */
public class Configuration {

  private static Configuration instance;

  private static final String DEFAULT_CONFIG_PATH = "transmission-optimizer-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = DEFAULT_CONFIG_PATH;

  private static final String DEFAULT_CATALOG_PATH = "calibrators.txt";
  private static final double DEFAULT_SEARCH_RADIUS = 1.0;

  private ParameterSet defaultParameters = TransmissionParameter.defaults();
  private DetectorGeometry geometry = DetectorGeometry.DEFAULT;

  private String defaultSequence = StageSequences.DEFAULT_SEQUENCE;
  private boolean sigmaClippingEnabled = true;
  private double relativeTolerance = SolverArgs.DEFAULT_RELATIVE_TOLERANCE;
  private double absoluteTolerance = SolverArgs.DEFAULT_ABSOLUTE_TOLERANCE;
  private int maxEvaluations = SolverArgs.DEFAULT_MAX_EVALUATIONS;
  private int maxIterations = SolverArgs.DEFAULT_MAX_ITERATIONS;

  private String catalogPath = DEFAULT_CATALOG_PATH;
  private double searchRadius = DEFAULT_SEARCH_RADIUS;

  private StageSequenceReader sequenceReader = null;

  private Configuration(String configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration();
      config.setDelimiterParsingDisabled(true);
      config.setFileName(configLocation);
      config.load();

      Map<String, Double> parameters = new LinkedHashMap<>();
      for (TransmissionParameter parameter : TransmissionParameter.values()) {
        String key = "Parameters." + parameter.getName();
        parameters.put(parameter.getName(),
            config.getDouble(key, defaultParameters.get(parameter.getName())));
      }
      defaultParameters = ParameterSet.fromMap(parameters);

      double minCoordinate = config.getDouble("Detector.MinCoordinate",
          geometry.getMinCoordinate());
      double maxCoordinate = config.getDouble("Detector.MaxCoordinate",
          geometry.getMaxCoordinate());
      double targetMin = config.getDouble("Detector.TargetMin", geometry.getTargetMin());
      double targetMax = config.getDouble("Detector.TargetMax", geometry.getTargetMax());
      try {
        geometry = new DetectorGeometry(minCoordinate, maxCoordinate, targetMin, targetMax);
      } catch (IllegalArgumentException e) {
        logger.warn("Ignoring invalid detector geometry in config: " + e.getMessage());
      }

      String sequenceParam = config.getString("Optimizer.DefaultSequence");
      if (sequenceParam != null) {
        defaultSequence = sequenceParam.trim();
      }
      sigmaClippingEnabled = config.getBoolean("Optimizer.SigmaClipping", true);
      relativeTolerance = config.getDouble("Optimizer.RelativeTolerance", relativeTolerance);
      absoluteTolerance = config.getDouble("Optimizer.AbsoluteTolerance", absoluteTolerance);
      maxEvaluations = config.getInt("Optimizer.MaxEvaluations", maxEvaluations);
      maxIterations = config.getInt("Optimizer.MaxIterations", maxIterations);

      String catalogParam = config.getString("Calibrators.CatalogPath");
      if (catalogParam != null) {
        catalogPath = catalogParam.trim();
      }
      searchRadius = config.getDouble("Calibrators.SearchRadius", searchRadius);

      if (!config.configurationsAt("Sequences").isEmpty()) {
        sequenceReader = new StageSequenceReader(config.configurationAt("Sequences"));
      }

      try {
        loadedConfigPath = config.getFile().getCanonicalPath();
        logger.info("Successfully loaded in configuration: " + loadedConfigPath);
      } catch (IOException e) {
        logger.warn("Could not resolve path of loaded configuration", e);
      }
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    } catch (ConversionException e) {
      logger.error("Malformed value in " + configLocation + ", load failed, using defaults", e);
      resetToDefaults();
    }
  }

  private void resetToDefaults() {
    defaultParameters = TransmissionParameter.defaults();
    geometry = DetectorGeometry.DEFAULT;
    defaultSequence = StageSequences.DEFAULT_SEQUENCE;
    sigmaClippingEnabled = true;
    relativeTolerance = SolverArgs.DEFAULT_RELATIVE_TOLERANCE;
    absoluteTolerance = SolverArgs.DEFAULT_ABSOLUTE_TOLERANCE;
    maxEvaluations = SolverArgs.DEFAULT_MAX_EVALUATIONS;
    maxIterations = SolverArgs.DEFAULT_MAX_ITERATIONS;
    catalogPath = DEFAULT_CATALOG_PATH;
    searchRadius = DEFAULT_SEARCH_RADIUS;
    sequenceReader = null;
  }

  private static boolean copyEmbedXML(String pathToPlaceFile) {
    File fileOut = new File(pathToPlaceFile);
    try (InputStream stream =
        Configuration.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_PATH)) {
      if (stream == null) {
        logger.error("Major error: config XML file not part of resources!!");
        return false;
      }
      logger.info("Copying over embedded config file to absolute path "
          + fileOut.getAbsolutePath());
      Files.copy(stream, fileOut.toPath());
      return true;
    } catch (IOException e) {
      logger.warn("Could not copy over the embedded config file", e);
    }
    return false;
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists
   *
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    return getInstance(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists.
   *
   * @param configLocation New configuration file location to read from
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance(String configLocation) {
    if (instance == null) {
      File config = new File(configLocation);
      if (!config.exists() && !copyEmbedXML(configLocation)) {
        logger.warn("Could not find or write to specified config location: " + configLocation);
        logger.warn("Will attempt to initialize config file at user home directory.");
        configLocation = System.getProperty("user.home") + File.separator + DEFAULT_CONFIG_PATH;
        if (!new File(configLocation).exists() && !copyEmbedXML(configLocation)) {
          logger.warn("Could not find or write to user home directory either!");
        }
      }
      instance = new Configuration(configLocation);
    }
    return instance;
  }

  /**
   * Read a configuration without touching the shared instance. If the file does not exist, the
   * embedded default configuration is written there first.
   *
   * @param configLocation Configuration file to read
   * @return New configuration
   */
  public static Configuration fromFile(String configLocation) {
    if (!new File(configLocation).exists()) {
      copyEmbedXML(configLocation);
    }
    return new Configuration(configLocation);
  }

  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * Gets the starting values of every model parameter. A parameter missing from the file uses
   * its vocabulary default.
   *
   * The property is defined from Configuration.Parameters.[name], e.g. Parameters.Norm_
   * @return Default parameter values
   */
  public ParameterSet getDefaultParameters() {
    return defaultParameters;
  }

  public void setDefaultParameter(String name, double value) {
    if (!TransmissionParameter.isKnown(name)) {
      throw new IllegalArgumentException("Unknown parameter: " + name);
    }
    defaultParameters = defaultParameters.with(name, value);
  }

  /**
   * Gets the detector geometry used to normalize calibrator positions. Defaults to a 1726 pixel
   * detector normalized to [-1, 1].
   *
   * The property is defined from Configuration.Detector (MinCoordinate, MaxCoordinate,
   * TargetMin, TargetMax)
   * @return Detector geometry
   */
  public DetectorGeometry getGeometry() {
    return geometry;
  }

  public void setGeometry(DetectorGeometry replacement) {
    geometry = replacement;
  }

  /**
   * Gets the name of the sequence run when none is requested explicitly.
   *
   * The property is defined from Configuration.Optimizer.DefaultSequence
   * @return Sequence name
   */
  public String getDefaultSequence() {
    return defaultSequence;
  }

  public void setDefaultSequence(String replacement) {
    defaultSequence = replacement;
  }

  /**
   * Gets whether stages that request sigma clipping actually apply it. True if not specified.
   *
   * The property is defined from Configuration.Optimizer.SigmaClipping as a boolean
   * @return Whether sigma clipping is enabled
   */
  public boolean isSigmaClippingEnabled() {
    return sigmaClippingEnabled;
  }

  public void setSigmaClippingEnabled(boolean enabled) {
    sigmaClippingEnabled = enabled;
  }

  public double getRelativeTolerance() {
    return relativeTolerance;
  }

  public double getAbsoluteTolerance() {
    return absoluteTolerance;
  }

  public void setTolerances(double relative, double absolute) {
    relativeTolerance = relative;
    absoluteTolerance = absolute;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  public void setMaxEvaluations(int evaluations) {
    maxEvaluations = evaluations;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public void setMaxIterations(int iterations) {
    maxIterations = iterations;
  }

  /**
   * Gets the calibrator table to load. Defaults to calibrators.txt in the working directory.
   *
   * The property is defined from Configuration.Calibrators.CatalogPath
   * @return Path of the calibrator table
   */
  public String getCatalogPath() {
    return catalogPath;
  }

  public void setCatalogPath(String replacement) {
    catalogPath = replacement;
  }

  /**
   * Gets the largest accepted catalog-to-image match separation, in arcseconds.
   *
   * The property is defined from Configuration.Calibrators.SearchRadius
   * @return Search radius
   */
  public double getSearchRadius() {
    return searchRadius;
  }

  public void setSearchRadius(double radius) {
    searchRadius = radius;
  }

  /**
   * Get the names of the sequences declared in the configuration file
   *
   * @return Declared sequence names, empty if the file declares none
   */
  public List<String> getDeclaredSequences() {
    if (sequenceReader == null) {
      return Collections.emptyList();
    }
    return sequenceReader.getSequenceNames();
  }

  /**
   * Get the stages of a sequence, looking first at sequences declared in the configuration file
   * and then at the built-in ones
   *
   * @param name Sequence name
   * @return Stages of the sequence
   * @throws last.transmission.optimizer.StageConfigurationException If no such sequence exists
   *     or its declaration is malformed
   */
  public List<StageDescriptor> getStageSequence(String name) {
    if (sequenceReader != null && sequenceReader.hasSequence(name)) {
      return sequenceReader.readSequence(name);
    }
    return StageSequences.byName(name);
  }

  /**
   * Writes out the current parameter, optimizer and calibrator settings to the file this
   * configuration was loaded from. Declared sequences are left as they are.
   */
  public void saveCurrentConfig() {
    try {
      XMLConfiguration config = new XMLConfiguration();
      config.setDelimiterParsingDisabled(true);
      config.setFileName(loadedConfigPath);
      config.load();

      for (String name : defaultParameters.names()) {
        config.setProperty("Parameters." + name, defaultParameters.get(name));
      }
      config.setProperty("Detector.MinCoordinate", geometry.getMinCoordinate());
      config.setProperty("Detector.MaxCoordinate", geometry.getMaxCoordinate());
      config.setProperty("Detector.TargetMin", geometry.getTargetMin());
      config.setProperty("Detector.TargetMax", geometry.getTargetMax());
      config.setProperty("Optimizer.DefaultSequence", defaultSequence);
      config.setProperty("Optimizer.SigmaClipping", sigmaClippingEnabled);
      config.setProperty("Optimizer.RelativeTolerance", relativeTolerance);
      config.setProperty("Optimizer.AbsoluteTolerance", absoluteTolerance);
      config.setProperty("Optimizer.MaxEvaluations", maxEvaluations);
      config.setProperty("Optimizer.MaxIterations", maxIterations);
      config.setProperty("Calibrators.CatalogPath", catalogPath);
      config.setProperty("Calibrators.SearchRadius", searchRadius);

      config.save();
    } catch (ConfigurationException e) {
      logger.error("Could not save configuration to " + loadedConfigPath, e);
    }
  }

}
