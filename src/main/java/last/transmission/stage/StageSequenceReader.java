package last.transmission.stage;

import java.util.ArrayList;
import java.util.List;
import last.transmission.model.FieldModel;
import last.transmission.optimizer.StageConfigurationException;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.HierarchicalConfiguration;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Reads calibration sequences declared in XML. The expected layout is
 *
 * <pre>
 * &lt;Sequences&gt;
 *   &lt;Sequence name="Custom"&gt;
 *     &lt;Stage name="NormOnly" method="nonlinear" fieldModel="additive"&gt;
 *       &lt;Free&gt;Norm_&lt;/Free&gt;
 *       &lt;Fixed name="ky0" value="0"/&gt;
 *       &lt;SigmaClip threshold="3.0" iterations="3"/&gt;
 *       &lt;Description&gt;Initial normalization&lt;/Description&gt;
 *     &lt;/Stage&gt;
 *   &lt;/Sequence&gt;
 * &lt;/Sequences&gt;
 * </pre>
 *
 * Free parameters may be listed in one comma-separated element or in repeated elements. Stage
 * name, method and at least one free parameter are required; the field model defaults to
 * additive, regularization to 0 and clipping to off. A SigmaClip element enables clipping unless
 * it sets enabled="false".
 *
 * Every stage is built through {@link StageDescriptor.Builder}, so anything the builder rejects
 * is reported as a {@link StageConfigurationException} naming the sequence and stage.
 */
public class StageSequenceReader {

  private static final Logger logger = Logger.getLogger(StageSequenceReader.class);

  private final HierarchicalConfiguration root;

  /**
   * Create a reader over an already loaded configuration node whose children are the
   * Sequence elements
   *
   * @param root Node holding Sequence children
   */
  public StageSequenceReader(HierarchicalConfiguration root) {
    this.root = root;
  }

  /**
   * Create a reader for a standalone sequence file
   *
   * @param path Location of an XML file with a Sequences root element
   * @return New reader
   * @throws ConfigurationException If the file cannot be read or parsed
   */
  public static StageSequenceReader fromFile(String path) throws ConfigurationException {
    XMLConfiguration config = new XMLConfiguration();
    config.setDelimiterParsingDisabled(true);
    config.setFileName(path);
    config.load();
    logger.info("Read stage sequences from " + path);
    return new StageSequenceReader(config);
  }

  /**
   * Get the names of all sequences declared in this source
   *
   * @return Sequence names, in document order
   */
  public List<String> getSequenceNames() {
    List<String> names = new ArrayList<>();
    for (HierarchicalConfiguration sequence : root.configurationsAt("Sequence")) {
      names.add(sequence.getString("[@name]"));
    }
    return names;
  }

  public boolean hasSequence(String name) {
    return findSequence(name) != null;
  }

  /**
   * Build the stages of a named sequence
   *
   * @param name Sequence name (case-insensitive)
   * @return Stages in execution order
   * @throws StageConfigurationException If the sequence is missing, empty or malformed
   */
  public List<StageDescriptor> readSequence(String name) {
    HierarchicalConfiguration sequence = findSequence(name);
    if (sequence == null) {
      throw new StageConfigurationException("No sequence named " + name + " is declared");
    }

    List<HierarchicalConfiguration> stageNodes = sequence.configurationsAt("Stage");
    if (stageNodes.isEmpty()) {
      throw new StageConfigurationException("Sequence " + name + " has no stages");
    }

    List<StageDescriptor> stages = new ArrayList<>();
    for (int i = 0; i < stageNodes.size(); ++i) {
      stages.add(readStage(name, i + 1, stageNodes.get(i)));
    }
    logger.debug("Sequence " + name + " declares " + stages.size() + " stages");
    return stages;
  }

  private HierarchicalConfiguration findSequence(String name) {
    for (HierarchicalConfiguration sequence : root.configurationsAt("Sequence")) {
      if (name != null && name.equalsIgnoreCase(sequence.getString("[@name]"))) {
        return sequence;
      }
    }
    return null;
  }

  private static StageDescriptor readStage(String sequenceName, int index,
      HierarchicalConfiguration node) {
    String where = "sequence " + sequenceName + ", stage " + index;

    String stageName = node.getString("[@name]");
    if (stageName == null || stageName.trim().isEmpty()) {
      throw new StageConfigurationException("Missing stage name in " + where);
    }
    where = "sequence " + sequenceName + ", stage " + stageName;

    String methodName = node.getString("[@method]");
    if (methodName == null) {
      throw new StageConfigurationException("Missing solver method in " + where);
    }

    List<String> free = new ArrayList<>();
    for (String entry : node.getStringArray("Free")) {
      for (String parameter : entry.split("[,\\s]+")) {
        if (!parameter.isEmpty()) {
          free.add(parameter);
        }
      }
    }
    if (free.isEmpty()) {
      throw new StageConfigurationException("No free parameters in " + where);
    }

    try {
      StageDescriptor.Builder builder = StageDescriptor.builder(stageName.trim())
          .freeParameters(free)
          .method(SolverMethod.fromName(methodName))
          .description(node.getString("Description", ""))
          .regularization(node.getDouble("[@regularization]", 0.));

      String fieldModelName = node.getString("[@fieldModel]");
      if (fieldModelName != null) {
        FieldModel fieldModel = FieldModel.fromName(fieldModelName);
        if (fieldModel == null) {
          throw new StageConfigurationException("unknown field model '" + fieldModelName + "'");
        }
        builder.fieldModel(fieldModel);
      }

      for (HierarchicalConfiguration fixed : node.configurationsAt("Fixed")) {
        String parameter = fixed.getString("[@name]");
        if (parameter == null || !fixed.containsKey("[@value]")) {
          throw new StageConfigurationException("fixed entry needs a name and a value");
        }
        builder.fixed(parameter, fixed.getDouble("[@value]"));
      }

      List<HierarchicalConfiguration> clipNodes = node.configurationsAt("SigmaClip");
      if (!clipNodes.isEmpty()) {
        HierarchicalConfiguration clip = clipNodes.get(0);
        if (clip.getBoolean("[@enabled]", true)) {
          builder.sigmaClip(
              clip.getDouble("[@threshold]", SigmaClipConfig.DEFAULT_THRESHOLD),
              clip.getInt("[@iterations]", SigmaClipConfig.DEFAULT_ITERATIONS));
        }
      }

      return builder.build();
    } catch (StageConfigurationException e) {
      throw new StageConfigurationException("Invalid " + where + ": " + e.getMessage(), e);
    } catch (RuntimeException e) {
      // conversion errors from the configuration library, e.g. a non-numeric threshold
      throw new StageConfigurationException("Could not read " + where + ": " + e.getMessage(),
          e);
    }
  }

}
