package kcwi.wavecal.utils;

import java.io.File;
import java.io.IOException;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.util.BufferedFile;

/**
 * Conversions between FITS data kernels and the double arrays used by the calibration, and
 * a helper to write a set of HDUs to disk.
 */
public class FitsUtils {

  /**
   * Convert a 1D primitive array of any numeric type to doubles, applying BSCALE and BZERO
   * from the header.
   *
   * @param kernel array returned by an HDU's getKernel
   * @param header header holding scaling keywords (may be null)
   * @return data as doubles
   * @throws IllegalArgumentException if the kernel is not a 1D numeric array
   */
  public static double[] toDoubleArray(Object kernel, Header header) {
    double[] raw = toDoubleRaw(kernel);
    double scale = header == null ? 1. : header.getDoubleValue("BSCALE", 1.);
    double zero = header == null ? 0. : header.getDoubleValue("BZERO", 0.);
    if (scale != 1. || zero != 0.) {
      for (int i = 0; i < raw.length; ++i) {
        raw[i] = raw[i] * scale + zero;
      }
    }
    return raw;
  }

  /**
   * Copy a 1D data row of any FITS pixel type into doubles, without scaling. FITS bytes are
   * unsigned.
   */
  static double[] toDoubleRaw(Object kernel) {
    if (kernel instanceof double[]) {
      return ((double[]) kernel).clone();
    }
    double[] out;
    if (kernel instanceof float[]) {
      float[] values = (float[]) kernel;
      out = new double[values.length];
      for (int i = 0; i < values.length; ++i) {
        out[i] = values[i];
      }
    } else if (kernel instanceof int[]) {
      int[] values = (int[]) kernel;
      out = new double[values.length];
      for (int i = 0; i < values.length; ++i) {
        out[i] = values[i];
      }
    } else if (kernel instanceof short[]) {
      short[] values = (short[]) kernel;
      out = new double[values.length];
      for (int i = 0; i < values.length; ++i) {
        out[i] = values[i];
      }
    } else if (kernel instanceof long[]) {
      long[] values = (long[]) kernel;
      out = new double[values.length];
      for (int i = 0; i < values.length; ++i) {
        out[i] = values[i];
      }
    } else if (kernel instanceof byte[]) {
      byte[] values = (byte[]) kernel;
      out = new double[values.length];
      for (int i = 0; i < values.length; ++i) {
        out[i] = values[i] & 0xFF;
      }
    } else {
      throw new IllegalArgumentException("Expected a one-dimensional numeric data array");
    }
    return out;
  }

  /**
   * Convert a 2D primitive array of any numeric type to doubles indexed [row][column],
   * applying BSCALE and BZERO from the header.
   *
   * @param kernel array returned by an HDU's getKernel
   * @param header header holding scaling keywords (may be null)
   * @return data as doubles
   * @throws IllegalArgumentException if the kernel is not a 2D numeric array
   */
  public static double[][] toDoubleImage(Object kernel, Header header) {
    if (!(kernel instanceof Object[])) {
      throw new IllegalArgumentException("Expected a two-dimensional data array");
    }
    Object[] rows = (Object[]) kernel;
    double[][] out = new double[rows.length][];
    for (int row = 0; row < rows.length; ++row) {
      out[row] = toDoubleArray(rows[row], header);
    }
    return out;
  }

  /**
   * Write HDUs to a new FITS file, replacing any existing file at that path.
   *
   * @param file destination
   * @param hdus HDUs in file order; the first must be able to serve as primary
   * @throws IOException if the file cannot be written
   * @throws FitsException if the HDUs cannot be assembled into a FITS structure
   */
  public static void write(File file, BasicHDU<?>... hdus) throws IOException, FitsException {
    if (file.exists() && !file.delete()) {
      throw new IOException("Could not replace existing file " + file.getAbsolutePath());
    }
    try (Fits fits = new Fits(); BufferedFile out = new BufferedFile(file.getPath(), "rw")) {
      for (BasicHDU<?> hdu : hdus) {
        fits.addHDU(hdu);
      }
      fits.write(out);
    }
  }

}
