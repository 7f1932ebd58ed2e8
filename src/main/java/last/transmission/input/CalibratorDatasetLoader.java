package last.transmission.input;

import java.io.IOException;

/**
 * Source of calibrator data for a calibration run. Implementations cross-match (or read an
 * already cross-matched) catalog and return the calibrators found within the search radius.
 */
public interface CalibratorDatasetLoader {

  /**
   * Load the calibrators for one image or catalog
   *
   * @param catalogIdentifier Identifier of the catalog to read (i.e., a file path)
   * @param searchRadius Maximum match separation between catalog and image sources, in arcsec
   * @return Calibrators found, in catalog order
   * @throws IOException If the catalog cannot be read
   */
  CalibratorDataset load(String catalogIdentifier, double searchRadius) throws IOException;

}
