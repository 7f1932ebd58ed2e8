package last.transmission.stage;

import static org.junit.Assert.*;

import java.util.Arrays;
import last.transmission.model.FieldModel;
import last.transmission.model.ParameterSet;
import last.transmission.optimizer.StageConfigurationException;
import org.junit.Test;

public class StageDescriptorTest {

  @Test
  public void build_defaults() {
    StageDescriptor stage = StageDescriptor.builder("Norm").freeParameters("Norm_").build();
    assertEquals(SolverMethod.NONLINEAR, stage.getMethod());
    assertFalse(stage.getSigmaClip().isEnabled());
    assertEquals(FieldModel.ADDITIVE, stage.getFieldModel());
    assertEquals(0., stage.getRegularization(), 0.);
    assertEquals("", stage.getDescription());
    assertTrue(stage.getFixedOverrides().isEmpty());
  }

  @Test
  public void build_keepsFreeOrderAndOverrides() {
    StageDescriptor stage = StageDescriptor.builder("Field")
        .freeParameters("kxy", "kx0", "ky")
        .fixed("ky0", 0.)
        .fixedParameters(ParameterSet.of("Norm_", 1.))
        .method(SolverMethod.LINEAR)
        .sigmaClip(2.0, 3)
        .regularization(0.5)
        .build();
    assertEquals(Arrays.asList("kxy", "kx0", "ky"), stage.getFreeParameters());
    assertEquals(Arrays.asList("ky0", "Norm_"), stage.getFixedOverrides().nameList());
    assertEquals(2.0, stage.getSigmaClip().getThreshold(), 0.);
    assertEquals(3, stage.getSigmaClip().getMaxIterations());
    assertEquals(0.5, stage.getRegularization(), 0.);
  }

  @Test(expected = StageConfigurationException.class)
  public void build_linearWithNonFieldParameter_throws() {
    StageDescriptor.builder("BadLinear")
        .freeParameters("Norm_")
        .method(SolverMethod.LINEAR)
        .build();
  }

  @Test
  public void withMethod_linearOnNonFieldStage_throws() {
    StageDescriptor stage = StageDescriptor.builder("Atmosphere")
        .freeParameters("Pwv_cm", "Tau_aod500")
        .build();
    try {
      stage.withMethod(SolverMethod.LINEAR);
      fail("Switching a non-field stage to the linear solver should be rejected");
    } catch (StageConfigurationException e) {
      assertTrue(e.getMessage().contains("Pwv_cm"));
    }
  }

  @Test
  public void withMethod_fieldStage_keepsSettings() {
    StageDescriptor stage = StageDescriptor.builder("Field")
        .freeParameters("kx0", "kx")
        .fixed("ky0", 0.)
        .sigmaClip(2.5, 2)
        .build();
    StageDescriptor linear = stage.withMethod(SolverMethod.LINEAR);
    assertEquals(SolverMethod.LINEAR, linear.getMethod());
    assertEquals(stage.getFreeParameters(), linear.getFreeParameters());
    assertEquals(stage.getFixedOverrides(), linear.getFixedOverrides());
    assertEquals(stage.getSigmaClip(), linear.getSigmaClip());
    assertEquals(SolverMethod.NONLINEAR, stage.getMethod());
  }

  @Test(expected = StageConfigurationException.class)
  public void build_duplicateFree_throws() {
    StageDescriptor.builder("Dup").freeParameters("Norm_", "Center", "Norm_").build();
  }

  @Test(expected = StageConfigurationException.class)
  public void build_freeAndFixed_throws() {
    StageDescriptor.builder("Both").freeParameters("Norm_").fixed("Norm_", 1.).build();
  }

  @Test(expected = StageConfigurationException.class)
  public void build_unknownFree_throws() {
    StageDescriptor.builder("Unknown").freeParameters("Airmass").build();
  }

  @Test(expected = StageConfigurationException.class)
  public void build_unknownFixed_throws() {
    StageDescriptor.builder("Unknown").freeParameters("Norm_").fixed("Airmass", 1.).build();
  }

  @Test(expected = StageConfigurationException.class)
  public void build_noFree_throws() {
    StageDescriptor.builder("Nothing").build();
  }

  @Test(expected = StageConfigurationException.class)
  public void build_blankName_throws() {
    StageDescriptor.builder("  ").freeParameters("Norm_").build();
  }

  @Test(expected = StageConfigurationException.class)
  public void build_multiplicativeTermWithAdditiveModel_throws() {
    StageDescriptor.builder("Simple").freeParameters("cx0").build();
  }

  @Test(expected = StageConfigurationException.class)
  public void build_additiveTermWithMultiplicativeModel_throws() {
    StageDescriptor.builder("Mixed")
        .freeParameters("kx")
        .fieldModel(FieldModel.MULTIPLICATIVE)
        .build();
  }

  @Test(expected = StageConfigurationException.class)
  public void build_negativeRegularization_throws() {
    StageDescriptor.builder("Ridge")
        .freeParameters("kx")
        .method(SolverMethod.LINEAR)
        .regularization(-1.)
        .build();
  }

  @Test(expected = StageConfigurationException.class)
  public void build_regularizationOnNonlinear_throws() {
    StageDescriptor.builder("Ridge").freeParameters("kx").regularization(0.1).build();
  }

  @Test(expected = StageConfigurationException.class)
  public void sigmaClip_zeroThreshold_throws() {
    SigmaClipConfig.enabled(0., 3);
  }

  @Test(expected = StageConfigurationException.class)
  public void sigmaClip_zeroIterations_throws() {
    SigmaClipConfig.enabled(3., 0);
  }

  @Test
  public void solverMethod_fromName() {
    assertEquals(SolverMethod.LINEAR, SolverMethod.fromName("linear"));
    assertEquals(SolverMethod.NONLINEAR, SolverMethod.fromName("NonLinear"));
    try {
      SolverMethod.fromName("quadratic");
      fail("Unknown method should be rejected");
    } catch (StageConfigurationException e) {
      assertTrue(e.getMessage().contains("quadratic"));
    }
  }

}
