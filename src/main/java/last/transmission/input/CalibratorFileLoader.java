package last.transmission.input;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Reads calibrators from a pre-matched text table. Each non-comment line describes one
 * calibrator with whitespace- or comma-separated fields in this order:
 *
 * <pre>
 * id  x  y  magnitude  flux  airmass  temperature  pressure  separation  [spectrum...]
 * </pre>
 *
 * where separation is the catalog-to-image match distance in arcseconds and any remaining fields
 * are the reference spectrum samples. Lines starting with '#' are skipped, as is a first line
 * whose second field is not numeric (a column header). Rows whose separation exceeds the
 * requested search radius are dropped.
 */
public class CalibratorFileLoader implements CalibratorDatasetLoader {

  private static final Logger logger = Logger.getLogger(CalibratorFileLoader.class);

  private static final int REQUIRED_FIELDS = 9;

  @Override
  public CalibratorDataset load(String catalogIdentifier, double searchRadius)
      throws IOException {
    return load(new File(catalogIdentifier), searchRadius);
  }

  /**
   * Read calibrators from a file
   *
   * @param file Table to read
   * @param searchRadius Largest accepted match separation, in arcsec
   * @return Calibrators within the search radius, in file order
   * @throws IOException If the file cannot be read
   * @throws CalibratorFormatException If a line has too few fields or unparseable values
   */
  public CalibratorDataset load(File file, double searchRadius) throws IOException {
    List<Calibrator> calibrators = new ArrayList<>();
    int rejected = 0;
    int lineNumber = 0;
    boolean firstContentLine = true;

    try (BufferedReader br = new BufferedReader(new FileReader(file))) {
      String line;
      while ((line = br.readLine()) != null) {
        ++lineNumber;
        line = line.trim();
        if (line.isEmpty() || line.startsWith("#")) {
          continue;
        }
        String[] fields = line.split("[,\\s]+");
        if (firstContentLine) {
          firstContentLine = false;
          if (!isNumeric(fields.length > 1 ? fields[1] : fields[0])) {
            // column header
            continue;
          }
        }
        if (fields.length < REQUIRED_FIELDS) {
          throw new CalibratorFormatException("Line " + lineNumber + " of " + file.getName()
              + " has " + fields.length + " fields, expected at least " + REQUIRED_FIELDS);
        }
        try {
          double separation = Double.parseDouble(fields[8]);
          if (separation > searchRadius) {
            ++rejected;
            continue;
          }
          double[] spectrum = new double[fields.length - REQUIRED_FIELDS];
          for (int i = 0; i < spectrum.length; ++i) {
            spectrum[i] = Double.parseDouble(fields[REQUIRED_FIELDS + i]);
          }
          calibrators.add(Calibrator.builder(fields[0])
              .position(Double.parseDouble(fields[1]), Double.parseDouble(fields[2]))
              .magnitude(Double.parseDouble(fields[3]))
              .flux(Double.parseDouble(fields[4]))
              .airmass(Double.parseDouble(fields[5]))
              .temperature(Double.parseDouble(fields[6]))
              .pressure(Double.parseDouble(fields[7]))
              .spectrum(spectrum)
              .build());
        } catch (NumberFormatException e) {
          throw new CalibratorFormatException("Could not parse line " + lineNumber + " of "
              + file.getName() + ": " + e.getMessage());
        }
      }
    }

    logger.info("Loaded " + calibrators.size() + " calibrators from " + file.getName()
        + " (" + rejected + " outside " + searchRadius + " arcsec search radius)");
    return new CalibratorDataset(calibrators);
  }

  private static boolean isNumeric(String field) {
    try {
      Double.parseDouble(field);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  /**
   * Thrown when a calibrator table does not have the expected layout
   */
  public static class CalibratorFormatException extends IOException {

    private static final long serialVersionUID = 4427917183465014823L;

    public CalibratorFormatException(String message) {
      super(message);
    }
  }

}
