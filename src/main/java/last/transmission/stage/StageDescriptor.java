package last.transmission.stage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import last.transmission.model.FieldModel;
import last.transmission.model.ParameterSet;
import last.transmission.model.TransmissionParameter;
import last.transmission.model.TransmissionParameter.ParameterGroup;
import last.transmission.optimizer.StageConfigurationException;

/**
 * One step of a calibration sequence: the parameters to optimize, constants to pin, the solver
 * to use, outlier rejection settings and the field-correction model to evaluate with.
 *
 * Descriptors are immutable and checked when built, so a sequence that holds only descriptors is
 * already known to be well formed before any solving starts. The checks are:
 * <ul>
 *   <li>a non-blank name and at least one free parameter</li>
 *   <li>every free and fixed name is in the {@link TransmissionParameter} vocabulary</li>
 *   <li>no free name is repeated or also pinned by a fixed override</li>
 *   <li>a linear stage frees only additive field terms and uses the additive field model</li>
 *   <li>free field terms belong to the stage's field model</li>
 *   <li>regularization is non-negative and only set on linear stages</li>
 * </ul>
 */
public class StageDescriptor {

  private final String name;
  private final List<String> freeParameters;
  private final ParameterSet fixedOverrides;
  private final SolverMethod method;
  private final SigmaClipConfig sigmaClip;
  private final FieldModel fieldModel;
  private final String description;
  private final double regularization;

  private StageDescriptor(Builder builder) {
    name = builder.name;
    freeParameters = Collections.unmodifiableList(new ArrayList<>(builder.freeParameters));
    fixedOverrides = builder.fixedOverrides;
    method = builder.method;
    sigmaClip = builder.sigmaClip;
    fieldModel = builder.fieldModel;
    description = builder.description;
    regularization = builder.regularization;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  /**
   * Get the names of the parameters this stage optimizes
   *
   * @return Unmodifiable list of names, in solver vector order
   */
  public List<String> getFreeParameters() {
    return freeParameters;
  }

  /**
   * Get the constants this stage pins regardless of earlier results (e.g., ky0 = 0)
   *
   * @return Explicit fixed overrides, possibly empty
   */
  public ParameterSet getFixedOverrides() {
    return fixedOverrides;
  }

  public SolverMethod getMethod() {
    return method;
  }

  public SigmaClipConfig getSigmaClip() {
    return sigmaClip;
  }

  public FieldModel getFieldModel() {
    return fieldModel;
  }

  public String getDescription() {
    return description;
  }

  /**
   * Get the ridge penalty applied by the linear solver
   *
   * @return Regularization weight, 0 for plain least squares
   */
  public double getRegularization() {
    return regularization;
  }

  /**
   * Get a builder initialized with this descriptor's settings
   *
   * @return New builder
   */
  public Builder toBuilder() {
    Builder builder = new Builder(name);
    builder.freeParameters.addAll(freeParameters);
    builder.fixedOverrides = fixedOverrides;
    builder.method = method;
    builder.sigmaClip = sigmaClip;
    builder.fieldModel = fieldModel;
    builder.description = description;
    builder.regularization = regularization;
    return builder;
  }

  /**
   * Get a copy of this stage solved with a different method. The copy is checked again, so
   * switching a stage with non-field parameters to the linear method fails here.
   *
   * @param replacement Solver method for the copy
   * @return New descriptor
   */
  public StageDescriptor withMethod(SolverMethod replacement) {
    return toBuilder().method(replacement).build();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(name);
    sb.append(" [").append(method.getName()).append("] free=").append(freeParameters);
    if (!fixedOverrides.isEmpty()) {
      sb.append(" fixed=").append(fixedOverrides);
    }
    sb.append(", ").append(sigmaClip);
    if (regularization > 0.) {
      sb.append(", lambda=").append(regularization);
    }
    return sb.toString();
  }

  /**
   * Assembles and checks a {@link StageDescriptor}. Defaults: nonlinear method, no clipping,
   * additive field model, no regularization, empty description.
   */
  public static class Builder {

    private final String name;
    private final Set<String> freeParameters = new LinkedHashSet<>();
    private final List<String> duplicates = new ArrayList<>();
    private ParameterSet fixedOverrides = ParameterSet.empty();
    private SolverMethod method = SolverMethod.NONLINEAR;
    private SigmaClipConfig sigmaClip = SigmaClipConfig.DISABLED;
    private FieldModel fieldModel = FieldModel.ADDITIVE;
    private String description = "";
    private double regularization = 0.;

    private Builder(String name) {
      this.name = name;
    }

    public Builder freeParameters(String... names) {
      return freeParameters(Arrays.asList(names));
    }

    /**
     * Add parameters to optimize. Order is kept; repeated names are reported when built.
     *
     * @param names Parameter names
     * @return This builder
     */
    public Builder freeParameters(List<String> names) {
      for (String parameter : names) {
        if (!freeParameters.add(parameter)) {
          duplicates.add(parameter);
        }
      }
      return this;
    }

    public Builder fixed(String parameter, double value) {
      fixedOverrides = fixedOverrides.with(parameter, value);
      return this;
    }

    public Builder fixedParameters(ParameterSet overrides) {
      fixedOverrides = fixedOverrides.merge(overrides);
      return this;
    }

    public Builder method(SolverMethod method) {
      this.method = method;
      return this;
    }

    public Builder sigmaClip(SigmaClipConfig sigmaClip) {
      this.sigmaClip = sigmaClip;
      return this;
    }

    /**
     * Enable clipping for this stage
     *
     * @param threshold Rejection threshold in standard deviations
     * @param maxIterations Largest number of clipping passes
     * @return This builder
     */
    public Builder sigmaClip(double threshold, int maxIterations) {
      this.sigmaClip = SigmaClipConfig.enabled(threshold, maxIterations);
      return this;
    }

    public Builder fieldModel(FieldModel fieldModel) {
      this.fieldModel = fieldModel;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder regularization(double regularization) {
      this.regularization = regularization;
      return this;
    }

    /**
     * Check the settings and create the descriptor
     *
     * @return New stage descriptor
     * @throws StageConfigurationException If the settings do not describe a valid stage
     */
    public StageDescriptor build() {
      if (name == null || name.trim().isEmpty()) {
        throw new StageConfigurationException("Stage name is required");
      }
      if (method == null) {
        throw new StageConfigurationException("Stage " + name + " has no solver method");
      }
      if (sigmaClip == null) {
        sigmaClip = SigmaClipConfig.DISABLED;
      }
      if (fieldModel == null) {
        fieldModel = FieldModel.ADDITIVE;
      }
      if (description == null) {
        description = "";
      }
      if (freeParameters.isEmpty()) {
        throw new StageConfigurationException("Stage " + name + " has no free parameters");
      }
      if (!duplicates.isEmpty()) {
        throw new StageConfigurationException("Stage " + name
            + " lists free parameters more than once: " + duplicates);
      }

      for (String parameter : freeParameters) {
        if (!TransmissionParameter.isKnown(parameter)) {
          throw new StageConfigurationException("Stage " + name
              + ": unknown free parameter '" + parameter + "'");
        }
        if (fixedOverrides.contains(parameter)) {
          throw new StageConfigurationException("Stage " + name + ": parameter " + parameter
              + " is both free and fixed");
        }
        ParameterGroup group = TransmissionParameter.fromName(parameter).getGroup();
        if (group == ParameterGroup.FIELD_ADDITIVE && fieldModel != FieldModel.ADDITIVE) {
          throw new StageConfigurationException("Stage " + name + ": " + parameter
              + " requires the additive field model, stage uses " + fieldModel.getName());
        }
        if (group == ParameterGroup.FIELD_MULTIPLICATIVE
            && fieldModel != FieldModel.MULTIPLICATIVE) {
          throw new StageConfigurationException("Stage " + name + ": " + parameter
              + " requires the multiplicative field model, stage uses " + fieldModel.getName());
        }
      }
      for (String parameter : fixedOverrides.names()) {
        if (!TransmissionParameter.isKnown(parameter)) {
          throw new StageConfigurationException("Stage " + name
              + ": unknown fixed parameter '" + parameter + "'");
        }
      }

      if (method == SolverMethod.LINEAR) {
        for (String parameter : freeParameters) {
          if (!TransmissionParameter.isLinearFieldTerm(parameter)) {
            throw new StageConfigurationException("Stage " + name + ": linear solver cannot"
                + " optimize " + parameter + ", only additive field-correction terms");
          }
        }
      }

      if (!(regularization >= 0.) || Double.isInfinite(regularization)) {
        throw new StageConfigurationException("Stage " + name
            + ": regularization must be a non-negative number, got " + regularization);
      }
      if (regularization > 0. && method != SolverMethod.LINEAR) {
        throw new StageConfigurationException("Stage " + name
            + ": regularization only applies to the linear solver");
      }

      return new StageDescriptor(this);
    }

  }

}
