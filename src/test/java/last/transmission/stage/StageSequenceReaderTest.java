package last.transmission.stage;

import static org.junit.Assert.*;

import java.net.URL;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import last.transmission.model.FieldModel;
import last.transmission.optimizer.StageConfigurationException;
import org.junit.Before;
import org.junit.Test;

public class StageSequenceReaderTest {

  private StageSequenceReader reader;

  @Before
  public void loadSequences() throws Exception {
    URL file = StageSequenceReaderTest.class.getResource("/sequences.xml");
    reader = StageSequenceReader.fromFile(Paths.get(file.toURI()).toString());
  }

  @Test
  public void listsDeclaredSequences() {
    assertEquals(Arrays.asList("NormThenField", "RepeatedFree", "LinearNorm", "UnknownMethod",
        "MissingMethod", "Empty"), reader.getSequenceNames());
    assertTrue(reader.hasSequence("normthenfield"));
    assertFalse(reader.hasSequence("DefaultSequence"));
  }

  @Test
  public void readsStageSettings() {
    List<StageDescriptor> stages = reader.readSequence("NormThenField");
    assertEquals(2, stages.size());

    StageDescriptor norm = stages.get(0);
    assertEquals("NormOnly", norm.getName());
    assertEquals(SolverMethod.NONLINEAR, norm.getMethod());
    assertEquals(Arrays.asList("Norm_"), norm.getFreeParameters());
    assertEquals(0., norm.getFixedOverrides().get("ky0"), 0.);
    assertTrue(norm.getSigmaClip().isEnabled());
    assertEquals(3.0, norm.getSigmaClip().getThreshold(), 0.);
    assertEquals(2, norm.getSigmaClip().getMaxIterations());
    assertEquals("Initial normalization, clipped", norm.getDescription());

    StageDescriptor field = stages.get(1);
    assertEquals(SolverMethod.LINEAR, field.getMethod());
    assertEquals(FieldModel.ADDITIVE, field.getFieldModel());
    assertEquals(Arrays.asList("kx0", "kx", "ky", "kxy"), field.getFreeParameters());
    assertEquals(0.01, field.getRegularization(), 0.);
    assertFalse(field.getSigmaClip().isEnabled());
  }

  @Test
  public void repeatedFreeElementsAccumulate() {
    StageDescriptor stage = reader.readSequence("RepeatedFree").get(0);
    assertEquals(Arrays.asList("Pwv_cm", "Tau_aod500"), stage.getFreeParameters());
    assertFalse(stage.getSigmaClip().isEnabled());
  }

  @Test
  public void linearStageWithNormalization_throws() {
    try {
      reader.readSequence("LinearNorm");
      fail("A linear stage freeing Norm_ should be rejected");
    } catch (StageConfigurationException e) {
      assertTrue(e.getMessage().contains("LinearNorm"));
      assertTrue(e.getMessage().contains("BadLinear"));
    }
  }

  @Test(expected = StageConfigurationException.class)
  public void unknownMethod_throws() {
    reader.readSequence("UnknownMethod");
  }

  @Test(expected = StageConfigurationException.class)
  public void missingMethod_throws() {
    reader.readSequence("MissingMethod");
  }

  @Test(expected = StageConfigurationException.class)
  public void emptySequence_throws() {
    reader.readSequence("Empty");
  }

  @Test(expected = StageConfigurationException.class)
  public void undeclaredSequence_throws() {
    reader.readSequence("Nothing");
  }

}
