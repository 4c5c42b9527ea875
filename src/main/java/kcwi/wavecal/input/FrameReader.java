package kcwi.wavecal.input;

import java.io.File;
import java.io.IOException;
import kcwi.wavecal.utils.FitsUtils;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.apache.log4j.Logger;

/**
 * Builds {@link Frame} objects from corrected FITS images. The image is taken from the primary
 * HDU and the instrument settings from these header keywords:
 * BINNING ("x,y"), BGRATNAM, BGRANGLE, BCAMANG, BCWAVE, IFUNAM, and optionally ADJANG.
 * The lamp is read from CALLAMP if present, otherwise from whichever of the LMP0 (ThAr) or
 * LMP1 (FeAr) lamps has its status keyword set.
 */
public class FrameReader {

  private static final Logger logger = Logger.getLogger(FrameReader.class);

  private final Configuration configuration;

  public FrameReader(Configuration configuration) {
    this.configuration = configuration;
  }

  /**
   * Read a frame.
   *
   * @param file FITS file
   * @return the frame
   * @throws IOException if the file cannot be read or lacks the required keywords
   */
  public Frame read(File file) throws IOException {
    logger.info("Reading frame " + file.getAbsolutePath());
    try (Fits fits = new Fits(file)) {
      BasicHDU<?> hdu = fits.getHDU(0);
      if (hdu == null) {
        throw new IOException("No image HDU in " + file.getAbsolutePath());
      }
      Header header = hdu.getHeader();
      double[][] data = FitsUtils.toDoubleImage(hdu.getKernel(), header);

      Frame.Builder builder = new Frame.Builder(data)
          .name(file.getName())
          .taperFraction(configuration.getTaperFraction())
          .interactivityLevel(configuration.getInteractivityLevel());

      int[] binning = parseBinning(header.getStringValue("BINNING"));
      builder.binning(binning[0], binning[1]);

      String gratingName = required(header, "BGRATNAM");
      builder.grating(Grating.fromName(gratingName));
      builder.gratingAngle(header.getDoubleValue("BGRANGLE", 0.));
      builder.cameraAngle(header.getDoubleValue("BCAMANG", 0.));
      builder.centralWavelength(header.getDoubleValue("BCWAVE", 0.));
      if (header.containsKey("ADJANG")) {
        builder.adjusterAngle(header.getDoubleValue("ADJANG", 0.));
      }
      builder.slicer(Slicer.fromName(required(header, "IFUNAM")));
      builder.lamp(lampName(header));
      return builder.build();
    } catch (FitsException | IllegalArgumentException e) {
      throw new IOException("Could not read frame " + file.getAbsolutePath(), e);
    }
  }

  static int[] parseBinning(String binning) {
    if (binning == null) {
      return new int[]{1, 1};
    }
    String[] parts = binning.split(",");
    if (parts.length != 2) {
      throw new IllegalArgumentException("Malformed BINNING value: " + binning);
    }
    return new int[]{Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim())};
  }

  static String lampName(Header header) {
    String callamp = header.getStringValue("CALLAMP");
    if (callamp != null && !callamp.trim().isEmpty()) {
      return callamp.trim();
    }
    for (int lamp = 0; lamp < 2; ++lamp) {
      String name = header.getStringValue("LMP" + lamp + "NAM");
      int status = header.getIntValue("LMP" + lamp + "STAT", 0);
      if (name != null && status == 1) {
        return name.trim();
      }
    }
    return "";
  }

  private static String required(Header header, String key) {
    String value = header.getStringValue(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing header keyword " + key);
    }
    return value;
  }
}
