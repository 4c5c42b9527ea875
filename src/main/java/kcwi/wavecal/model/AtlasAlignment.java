package kcwi.wavecal.model;

/**
 * Coarse registration of the reference bar's arc spectrum to the atlas: the wavelength offset
 * between the preliminary observed axis and the atlas, and the central pixel range used for it.
 */
public class AtlasAlignment {

  private final int offsetPixels;
  private final double offsetWavelength;
  private final double referencePixel;
  private final int minRow;
  private final int maxRow;
  private final double preliminaryDispersion;

  public AtlasAlignment(int offsetPixels, double offsetWavelength, double referencePixel,
      int minRow, int maxRow, double preliminaryDispersion) {
    this.offsetPixels = offsetPixels;
    this.offsetWavelength = offsetWavelength;
    this.referencePixel = referencePixel;
    this.minRow = minRow;
    this.maxRow = maxRow;
    this.preliminaryDispersion = preliminaryDispersion;
  }

  /**
   * @return offset in atlas samples
   */
  public int getOffsetPixels() {
    return offsetPixels;
  }

  /**
   * @return offset in Angstroms (subtracted from the preliminary axis)
   */
  public double getOffsetWavelength() {
    return offsetWavelength;
  }

  /**
   * @return pixel about which the centered axis is defined (half the spectrum length)
   */
  public double getReferencePixel() {
    return referencePixel;
  }

  public int getMinRow() {
    return minRow;
  }

  public int getMaxRow() {
    return maxRow;
  }

  public double getPreliminaryDispersion() {
    return preliminaryDispersion;
  }

  /**
   * Pixel axis centered on the reference pixel, x - x0 for x in [0, length).
   */
  public double[] centeredAxis(int length) {
    double[] out = new double[length];
    for (int i = 0; i < length; ++i) {
      out[i] = i - referencePixel;
    }
    return out;
  }
}
