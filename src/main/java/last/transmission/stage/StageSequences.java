package last.transmission.stage;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import last.transmission.model.FieldModel;
import last.transmission.optimizer.StageConfigurationException;

/**
 * Built-in calibration sequences. Each sequence starts with a clipped normalization fit so that
 * gross outliers are removed before the more expensive stages run.
 */
public final class StageSequences {

  public static final String DEFAULT_SEQUENCE = "DefaultSequence";
  public static final String SIMPLE_FIELD_CORRECTION_SEQUENCE = "SimpleFieldCorrectionSequence";
  public static final String ATMOSPHERIC_SEQUENCE = "AtmosphericSequence";
  public static final String QUICK_SEQUENCE = "QuickSequence";
  public static final String FIELD_CORRECTION_SEQUENCE = "FieldCorrectionSequence";

  private static final String[] CHEBYSHEV_FIELD_TERMS =
      {"kx0", "kx", "ky", "kx2", "ky2", "kx3", "ky3", "kx4", "ky4", "kxy"};

  private static final String[] SIMPLE_FIELD_TERMS =
      {"cx0", "cx1", "cx2", "cx3", "cx4", "cy0", "cy1", "cy2", "cy3", "cy4"};

  private StageSequences() {
  }

  /**
   * Names of all built-in sequences
   *
   * @return Sequence names accepted by {@link #byName(String)}
   */
  public static List<String> names() {
    return Collections.unmodifiableList(Arrays.asList(DEFAULT_SEQUENCE,
        SIMPLE_FIELD_CORRECTION_SEQUENCE, ATMOSPHERIC_SEQUENCE, QUICK_SEQUENCE,
        FIELD_CORRECTION_SEQUENCE));
  }

  /**
   * Look up a built-in sequence
   *
   * @param name Sequence name (case-insensitive)
   * @return Stages of the sequence, in execution order
   * @throws StageConfigurationException If there is no sequence with that name
   */
  public static List<StageDescriptor> byName(String name) {
    if (DEFAULT_SEQUENCE.equalsIgnoreCase(name)) {
      return defaultSequence();
    } else if (SIMPLE_FIELD_CORRECTION_SEQUENCE.equalsIgnoreCase(name)) {
      return simpleFieldCorrectionSequence();
    } else if (ATMOSPHERIC_SEQUENCE.equalsIgnoreCase(name)) {
      return atmosphericSequence();
    } else if (QUICK_SEQUENCE.equalsIgnoreCase(name)) {
      return quickSequence();
    } else if (FIELD_CORRECTION_SEQUENCE.equalsIgnoreCase(name)) {
      return fieldCorrectionSequence();
    }
    throw new StageConfigurationException("Unknown sequence: " + name
        + " (available: " + names() + ")");
  }

  /**
   * Normalization, QE center, closed-form Chebyshev field correction, normalization refinement,
   * then water vapor and aerosol. ky0 stays pinned at 0 throughout since it is degenerate with
   * kx0.
   *
   * @return Five-stage sequence
   */
  public static List<StageDescriptor> defaultSequence() {
    return Arrays.asList(
        StageDescriptor.builder("NormOnly_Initial")
            .freeParameters("Norm_")
            .fixed("ky0", 0.)
            .sigmaClip(3.0, 3)
            .description("Initial normalization with outlier removal")
            .build(),
        StageDescriptor.builder("NormAndCenter")
            .freeParameters("Norm_", "Center")
            .fixed("ky0", 0.)
            .description("Optimize normalization and QE center")
            .build(),
        StageDescriptor.builder("FieldCorrection_Chebyshev")
            .freeParameters(CHEBYSHEV_FIELD_TERMS)
            .fixed("ky0", 0.)
            .method(SolverMethod.LINEAR)
            .sigmaClip(2.0, 3)
            .description("Chebyshev field corrections solved by linear least squares")
            .build(),
        StageDescriptor.builder("NormRefinement")
            .freeParameters("Norm_")
            .fixed("ky0", 0.)
            .description("Refine normalization after field corrections")
            .build(),
        StageDescriptor.builder("Atmospheric")
            .freeParameters("Pwv_cm", "Tau_aod500")
            .fixed("ky0", 0.)
            .description("Optimize water vapor and aerosol parameters")
            .build());
  }

  /**
   * Same stages as the default sequence, with the field correction done by the multiplicative
   * Chebyshev model through the simplex search
   *
   * @return Five-stage sequence
   */
  public static List<StageDescriptor> simpleFieldCorrectionSequence() {
    return Arrays.asList(
        StageDescriptor.builder("NormOnly_Initial")
            .freeParameters("Norm_")
            .fieldModel(FieldModel.MULTIPLICATIVE)
            .sigmaClip(3.0, 3)
            .description("Initial normalization with outlier removal")
            .build(),
        StageDescriptor.builder("NormAndCenter")
            .freeParameters("Norm_", "Center")
            .fieldModel(FieldModel.MULTIPLICATIVE)
            .description("Optimize normalization and QE center")
            .build(),
        StageDescriptor.builder("FieldCorrection_Simple")
            .freeParameters(SIMPLE_FIELD_TERMS)
            .fieldModel(FieldModel.MULTIPLICATIVE)
            .sigmaClip(2.0, 3)
            .description("Basic Chebyshev field correction coefficients")
            .build(),
        StageDescriptor.builder("NormRefinement")
            .freeParameters("Norm_")
            .fieldModel(FieldModel.MULTIPLICATIVE)
            .description("Refine normalization after field corrections")
            .build(),
        StageDescriptor.builder("Atmospheric")
            .freeParameters("Pwv_cm", "Tau_aod500")
            .fieldModel(FieldModel.MULTIPLICATIVE)
            .description("Optimize water vapor and aerosol parameters")
            .build());
  }

  public static List<StageDescriptor> atmosphericSequence() {
    return Arrays.asList(
        StageDescriptor.builder("NormOnly_Initial")
            .freeParameters("Norm_")
            .sigmaClip(3.0, 3)
            .description("Initial normalization with outlier removal")
            .build(),
        StageDescriptor.builder("NormAndCenter")
            .freeParameters("Norm_", "Center")
            .description("Optimize normalization and QE center")
            .build(),
        StageDescriptor.builder("Atmospheric")
            .freeParameters("Pwv_cm", "Tau_aod500")
            .description("Optimize water vapor and aerosol parameters")
            .build());
  }

  public static List<StageDescriptor> quickSequence() {
    return Arrays.asList(
        StageDescriptor.builder("QuickNorm")
            .freeParameters("Norm_")
            .sigmaClip(3.0, 1)
            .description("Quick normalization")
            .build(),
        StageDescriptor.builder("QuickAtmospheric")
            .freeParameters("Tau_aod500")
            .description("Quick aerosol adjustment")
            .build());
  }

  public static List<StageDescriptor> fieldCorrectionSequence() {
    return Arrays.asList(
        StageDescriptor.builder("NormOnly")
            .freeParameters("Norm_")
            .sigmaClip(3.0, 2)
            .description("Initial normalization")
            .build(),
        StageDescriptor.builder("FieldCorrection_Chebyshev")
            .freeParameters(CHEBYSHEV_FIELD_TERMS)
            .fixed("ky0", 0.)
            .method(SolverMethod.LINEAR)
            .sigmaClip(2.0, 3)
            .description("Chebyshev field corrections solved by linear least squares")
            .build());
  }

}
