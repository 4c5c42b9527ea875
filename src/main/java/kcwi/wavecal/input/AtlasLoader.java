package kcwi.wavecal.input;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import kcwi.wavecal.CalibrationException.AtlasException;
import kcwi.wavecal.model.AtlasSpectrum;
import kcwi.wavecal.utils.FitsUtils;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.apache.log4j.Logger;

/**
 * Reads reference atlas spectra for calibration lamps. An atlas is a FITS file named after the
 * lamp in lower case (i.e., "thar.fits") whose primary HDU holds a 1D flux array on a linear
 * wavelength axis described by CRVAL1, CDELT1 and optionally CRPIX1.
 * Files are looked up in the configured atlas folder first and then on the classpath under
 * "atlas/".
 */
public class AtlasLoader {

  private static final Logger logger = Logger.getLogger(AtlasLoader.class);

  private final String atlasFolder;

  public AtlasLoader(String atlasFolder) {
    this.atlasFolder = atlasFolder;
  }

  /**
   * Name of the atlas file for a lamp.
   */
  public static String fileNameFor(String lamp) {
    return lamp.trim().toLowerCase() + ".fits";
  }

  /**
   * Load the atlas for a lamp.
   *
   * @param lamp lamp name, i.e., "ThAr" or "FeAr"
   * @return atlas spectrum without any resolution applied
   * @throws AtlasException if no atlas exists for the lamp or it cannot be read
   */
  public AtlasSpectrum load(String lamp) throws AtlasException {
    if (lamp == null || lamp.trim().isEmpty()) {
      throw new AtlasException("No lamp given to select an atlas");
    }
    String fileName = fileNameFor(lamp);
    File file = new File(atlasFolder, fileName);
    if (file.exists()) {
      logger.info("Reading atlas " + file.getAbsolutePath());
      return read(lamp, file);
    }

    try (InputStream stream =
        AtlasLoader.class.getClassLoader().getResourceAsStream("atlas/" + fileName)) {
      if (stream == null) {
        throw new AtlasException("No atlas for lamp " + lamp + " in " + atlasFolder
            + " or on the classpath");
      }
      File temp = File.createTempFile("atlas-", ".fits");
      temp.deleteOnExit();
      Files.copy(stream, temp.toPath(), StandardCopyOption.REPLACE_EXISTING);
      logger.info("Reading embedded atlas for lamp " + lamp);
      return read(lamp, temp);
    } catch (IOException e) {
      throw new AtlasException("Could not read embedded atlas for lamp " + lamp, e);
    }
  }

  /**
   * Read an atlas from a specific file.
   *
   * @param lamp lamp name to record with the spectrum
   * @param file FITS file
   * @return atlas spectrum
   * @throws AtlasException if the file is missing, malformed, or lacks wavelength keywords
   */
  public static AtlasSpectrum read(String lamp, File file) throws AtlasException {
    if (!file.exists()) {
      throw new AtlasException("Atlas file not found: " + file.getAbsolutePath());
    }
    try (Fits fits = new Fits(file)) {
      BasicHDU<?> hdu = fits.getHDU(0);
      if (hdu == null) {
        throw new AtlasException("Atlas file has no data: " + file.getAbsolutePath());
      }
      Header header = hdu.getHeader();
      if (!header.containsKey("CRVAL1") || !header.containsKey("CDELT1")) {
        throw new AtlasException("Atlas file lacks CRVAL1/CDELT1: " + file.getAbsolutePath());
      }
      double[] flux = FitsUtils.toDoubleArray(hdu.getKernel(), header);
      double crval = header.getDoubleValue("CRVAL1", 0.);
      double cdelt = header.getDoubleValue("CDELT1", 1.);
      double crpix = header.getDoubleValue("CRPIX1", 1.);
      if (cdelt <= 0.) {
        throw new AtlasException("Atlas dispersion must be positive, CDELT1 = " + cdelt);
      }
      double start = crval - (crpix - 1.) * cdelt;
      logger.info("Atlas for " + lamp + ": " + flux.length + " samples from " + start
          + " A at " + cdelt + " A/px");
      return AtlasSpectrum.fromLinearAxis(lamp, flux, start, cdelt);
    } catch (FitsException | IOException | IllegalArgumentException e) {
      throw new AtlasException("Could not read atlas file " + file.getAbsolutePath(), e);
    }
  }
}
