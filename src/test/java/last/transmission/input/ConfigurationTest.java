package last.transmission.input;

import static org.junit.Assert.*;

import java.io.File;
import java.io.FileWriter;
import java.util.Collections;
import java.util.List;
import last.transmission.model.DetectorGeometry;
import last.transmission.optimizer.StageConfigurationException;
import last.transmission.stage.SolverMethod;
import last.transmission.stage.StageDescriptor;
import last.transmission.stage.StageSequences;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ConfigurationTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void fromFile_missingFile_copiesEmbeddedDefaults() throws Exception {
    File target = new File(folder.getRoot(), "config.xml");
    assertFalse(target.exists());
    Configuration config = Configuration.fromFile(target.getAbsolutePath());
    assertTrue(target.exists());
    assertEquals(target.getCanonicalPath(), config.getLoadedConfigPath());

    assertEquals(0.5, config.getDefaultParameters().get("Norm_"), 0.);
    assertEquals(965., config.getDefaultParameters().get("Pressure"), 0.);
    assertEquals(0., config.getDefaultParameters().get("kx"), 0.);
    assertEquals(StageSequences.DEFAULT_SEQUENCE, config.getDefaultSequence());
    assertTrue(config.isSigmaClippingEnabled());
    assertEquals(1e-6, config.getRelativeTolerance(), 0.);
    assertEquals(1e-10, config.getAbsoluteTolerance(), 0.);
    assertEquals(500, config.getMaxEvaluations());
    assertEquals(200, config.getMaxIterations());
    assertEquals(1726., config.getGeometry().getMaxCoordinate(), 0.);
    assertEquals("calibrators.txt", config.getCatalogPath());
    assertEquals(1.0, config.getSearchRadius(), 0.);
    assertTrue(config.getDeclaredSequences().isEmpty());
  }

  @Test
  public void saveCurrentConfig_roundTrips() throws Exception {
    String path = new File(folder.getRoot(), "config.xml").getAbsolutePath();
    Configuration config = Configuration.fromFile(path);
    config.setDefaultParameter("Norm_", 0.75);
    config.setSigmaClippingEnabled(false);
    config.setTolerances(1e-8, 1e-12);
    config.setMaxEvaluations(1500);
    config.setMaxIterations(600);
    config.setGeometry(new DetectorGeometry(0., 2048., -1., 1.));
    config.setDefaultSequence(StageSequences.QUICK_SEQUENCE);
    config.setCatalogPath("field-42.txt");
    config.setSearchRadius(2.5);
    config.saveCurrentConfig();

    Configuration reloaded = Configuration.fromFile(path);
    assertEquals(0.75, reloaded.getDefaultParameters().get("Norm_"), 0.);
    assertFalse(reloaded.isSigmaClippingEnabled());
    assertEquals(1e-8, reloaded.getRelativeTolerance(), 0.);
    assertEquals(1e-12, reloaded.getAbsoluteTolerance(), 0.);
    assertEquals(1500, reloaded.getMaxEvaluations());
    assertEquals(600, reloaded.getMaxIterations());
    assertEquals(2048., reloaded.getGeometry().getMaxCoordinate(), 0.);
    assertEquals(StageSequences.QUICK_SEQUENCE, reloaded.getDefaultSequence());
    assertEquals("field-42.txt", reloaded.getCatalogPath());
    assertEquals(2.5, reloaded.getSearchRadius(), 0.);
  }

  @Test(expected = IllegalArgumentException.class)
  public void setDefaultParameter_unknownName_throws() throws Exception {
    Configuration config =
        Configuration.fromFile(new File(folder.getRoot(), "config.xml").getAbsolutePath());
    config.setDefaultParameter("Airmass", 1.2);
  }

  @Test
  public void partialFile_usesDefaultsForMissingValues() throws Exception {
    File file = folder.newFile("partial.xml");
    try (FileWriter writer = new FileWriter(file)) {
      writer.write("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
          + "<Configuration>\n"
          + "  <Parameters><Norm_>0.9</Norm_></Parameters>\n"
          + "  <Optimizer><MaxEvaluations>50</MaxEvaluations></Optimizer>\n"
          + "</Configuration>\n");
    }
    Configuration config = Configuration.fromFile(file.getAbsolutePath());
    assertEquals(0.9, config.getDefaultParameters().get("Norm_"), 0.);
    assertEquals(570.973, config.getDefaultParameters().get("Center"), 0.);
    assertEquals(50, config.getMaxEvaluations());
    assertEquals(200, config.getMaxIterations());
    assertEquals(DetectorGeometry.DEFAULT.getMaxCoordinate(),
        config.getGeometry().getMaxCoordinate(), 0.);
  }

  @Test
  public void malformedValue_fallsBackToDefaultsEverywhere() throws Exception {
    File file = folder.newFile("malformed.xml");
    try (FileWriter writer = new FileWriter(file)) {
      writer.write("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
          + "<Configuration>\n"
          + "  <Parameters><Norm_>0.9</Norm_></Parameters>\n"
          + "  <Detector><MaxCoordinate>2048</MaxCoordinate></Detector>\n"
          + "  <Optimizer><MaxEvaluations>lots</MaxEvaluations></Optimizer>\n"
          + "</Configuration>\n");
    }
    Configuration config = Configuration.fromFile(file.getAbsolutePath());
    assertEquals(0.5, config.getDefaultParameters().get("Norm_"), 0.);
    assertEquals(DetectorGeometry.DEFAULT.getMaxCoordinate(),
        config.getGeometry().getMaxCoordinate(), 0.);
    assertEquals(500, config.getMaxEvaluations());
    assertTrue(config.getDeclaredSequences().isEmpty());
  }

  @Test
  public void declaredSequences_takePrecedenceOverBuiltIns() throws Exception {
    File file = folder.newFile("sequences-config.xml");
    try (FileWriter writer = new FileWriter(file)) {
      writer.write("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
          + "<Configuration>\n"
          + "  <Sequences>\n"
          + "    <Sequence name=\"QuickSequence\">\n"
          + "      <Stage name=\"FieldOnly\" method=\"linear\">\n"
          + "        <Free>kx0, kx</Free>\n"
          + "        <Description>Offset, then tilt</Description>\n"
          + "      </Stage>\n"
          + "    </Sequence>\n"
          + "  </Sequences>\n"
          + "</Configuration>\n");
    }
    Configuration config = Configuration.fromFile(file.getAbsolutePath());
    assertEquals(Collections.singletonList("QuickSequence"), config.getDeclaredSequences());

    List<StageDescriptor> quick = config.getStageSequence("QuickSequence");
    assertEquals(1, quick.size());
    assertEquals("FieldOnly", quick.get(0).getName());
    assertEquals(SolverMethod.LINEAR, quick.get(0).getMethod());
    assertEquals("Offset, then tilt", quick.get(0).getDescription());

    List<StageDescriptor> builtIn = config.getStageSequence(StageSequences.DEFAULT_SEQUENCE);
    assertEquals(5, builtIn.size());
  }

  @Test(expected = StageConfigurationException.class)
  public void getStageSequence_unknownName_throws() throws Exception {
    Configuration config =
        Configuration.fromFile(new File(folder.getRoot(), "config.xml").getAbsolutePath());
    config.getStageSequence("NoSuchSequence");
  }

}
