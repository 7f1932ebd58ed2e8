package last.transmission.input;

import static org.junit.Assert.*;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.net.URL;
import java.nio.file.Paths;
import last.transmission.input.CalibratorFileLoader.CalibratorFormatException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CalibratorFileLoaderTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private static String resourcePath(String name) throws Exception {
    URL file = CalibratorFileLoaderTest.class.getResource("/" + name);
    return Paths.get(file.toURI()).toString();
  }

  @Test
  public void load_withinRadius_skipsHeaderAndFarMatches() throws Exception {
    CalibratorDataset dataset = new CalibratorFileLoader().load(resourcePath("calibrators.txt"),
        1.0);
    assertEquals(3, dataset.size());
    assertEquals("Gaia-001", dataset.get(0).getId());
    assertEquals("Gaia-002", dataset.get(1).getId());
    assertEquals("Gaia-004", dataset.get(2).getId());

    Calibrator first = dataset.get(0);
    assertEquals(100., first.getX(), 0.);
    assertEquals(200., first.getY(), 0.);
    assertEquals(12.1, first.getMagnitude(), 0.);
    assertEquals(15000., first.getFlux(), 0.);
    assertEquals(1.10, first.getAirmass(), 0.);
    assertEquals(15.2, first.getTemperature(), 0.);
    assertEquals(965., first.getPressure(), 0.);
    assertArrayEquals(new double[]{1.0, 1.1, 1.2}, first.getSpectrum(), 0.);
  }

  @Test
  public void load_commaSeparatedRow_parses() throws Exception {
    CalibratorDataset dataset = new CalibratorFileLoader().load(resourcePath("calibrators.txt"),
        1.0);
    Calibrator last = dataset.get(2);
    assertEquals(1700., last.getX(), 0.);
    assertEquals(7100., last.getFlux(), 0.);
  }

  @Test
  public void load_largeRadius_keepsEverything() throws Exception {
    CalibratorDataset dataset = new CalibratorFileLoader().load(resourcePath("calibrators.txt"),
        10.);
    assertEquals(4, dataset.size());
  }

  @Test(expected = CalibratorFormatException.class)
  public void load_shortRow_throwsFormatException() throws Exception {
    File table = folder.newFile("short.txt");
    try (FileWriter writer = new FileWriter(table)) {
      writer.write("Gaia-100 1.0 2.0 12.0\n");
    }
    new CalibratorFileLoader().load(table, 1.0);
  }

  @Test(expected = CalibratorFormatException.class)
  public void load_badNumber_throwsFormatException() throws Exception {
    File table = folder.newFile("bad.txt");
    try (FileWriter writer = new FileWriter(table)) {
      writer.write("Gaia-100 1.0 2.0 12.0 100.0 1.1 15.0 965.0 0.1 1.0\n");
      writer.write("Gaia-101 1.0 2.0 12.0 lots 1.1 15.0 965.0 0.1 1.0\n");
    }
    new CalibratorFileLoader().load(table, 1.0);
  }

  @Test(expected = IOException.class)
  public void load_missingFile_throws() throws Exception {
    new CalibratorFileLoader().load(new File(folder.getRoot(), "absent.txt"), 1.0);
  }

}
