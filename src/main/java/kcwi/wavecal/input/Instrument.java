package kcwi.wavecal.input;

/**
 * Fixed constants of the spectrograph and of the bar mask. {@link #KCWI} holds the values for
 * the instrument itself; the builder exists for reduced geometries.
 */
public class Instrument {

  public static final Instrument KCWI = new Builder().build();

  private final int barCount;
  private final int referenceBar;
  private final int barsPerSlice;
  private final double pixelSize;
  private final double focalLength;
  private final double outOfPlaneAngle;
  private final int sampleSpacing;
  private final int locatorHalfWidth;
  private final int alignmentTrim;
  private final int baselineTrim;
  private final double atlasMargin;
  private final int transformOrder;

  private Instrument(Builder builder) {
    barCount = builder.barCount;
    referenceBar = builder.referenceBar;
    barsPerSlice = builder.barsPerSlice;
    pixelSize = builder.pixelSize;
    focalLength = builder.focalLength;
    outOfPlaneAngle = builder.outOfPlaneAngle;
    sampleSpacing = builder.sampleSpacing;
    locatorHalfWidth = builder.locatorHalfWidth;
    alignmentTrim = builder.alignmentTrim;
    baselineTrim = builder.baselineTrim;
    atlasMargin = builder.atlasMargin;
    transformOrder = builder.transformOrder;
  }

  public int getBarCount() {
    return barCount;
  }

  public int getReferenceBar() {
    return referenceBar;
  }

  public int getBarsPerSlice() {
    return barsPerSlice;
  }

  public int sliceOf(int bar) {
    return bar / barsPerSlice;
  }

  /**
   * @return unbinned pixel size in mm
   */
  public double getPixelSize() {
    return pixelSize;
  }

  /**
   * @return camera focal length in mm
   */
  public double getFocalLength() {
    return focalLength;
  }

  /**
   * @return out-of-plane angle of the spectrograph in degrees
   */
  public double getOutOfPlaneAngle() {
    return outOfPlaneAngle;
  }

  /**
   * @return spacing between bar trace samples, in unbinned rows
   */
  public int getSampleSpacing() {
    return sampleSpacing;
  }

  /**
   * @return half-width of the bar centroid window, in unbinned pixels
   */
  public int getLocatorHalfWidth() {
    return locatorHalfWidth;
  }

  /**
   * @return samples trimmed from each end of the arc spectra before inter-bar correlation
   */
  public int getAlignmentTrim() {
    return alignmentTrim;
  }

  /**
   * @return rows excluded at each end when estimating an arc spectrum's baseline
   */
  public int getBaselineTrim() {
    return baselineTrim;
  }

  /**
   * @return margin (A) kept inside the common wavelength window when picking atlas lines
   */
  public double getAtlasMargin() {
    return atlasMargin;
  }

  public int getTransformOrder() {
    return transformOrder;
  }

  public static class Builder {

    private int barCount = 120;
    private int referenceBar = 57;
    private int barsPerSlice = 5;
    private double pixelSize = 0.0150;
    private double focalLength = 305.0;
    private double outOfPlaneAngle = 4.0;
    private int sampleSpacing = 80;
    private int locatorHalfWidth = 10;
    private int alignmentTrim = 10;
    private int baselineTrim = 100;
    private double atlasMargin = 10.;
    private int transformOrder = 3;

    public Builder barCount(int barCount) {
      this.barCount = barCount;
      return this;
    }

    public Builder referenceBar(int referenceBar) {
      this.referenceBar = referenceBar;
      return this;
    }

    public Builder barsPerSlice(int barsPerSlice) {
      this.barsPerSlice = barsPerSlice;
      return this;
    }

    public Builder pixelSize(double pixelSize) {
      this.pixelSize = pixelSize;
      return this;
    }

    public Builder focalLength(double focalLength) {
      this.focalLength = focalLength;
      return this;
    }

    public Builder outOfPlaneAngle(double outOfPlaneAngle) {
      this.outOfPlaneAngle = outOfPlaneAngle;
      return this;
    }

    public Builder sampleSpacing(int sampleSpacing) {
      this.sampleSpacing = sampleSpacing;
      return this;
    }

    public Builder locatorHalfWidth(int locatorHalfWidth) {
      this.locatorHalfWidth = locatorHalfWidth;
      return this;
    }

    public Builder alignmentTrim(int alignmentTrim) {
      this.alignmentTrim = alignmentTrim;
      return this;
    }

    public Builder baselineTrim(int baselineTrim) {
      this.baselineTrim = baselineTrim;
      return this;
    }

    public Builder atlasMargin(double atlasMargin) {
      this.atlasMargin = atlasMargin;
      return this;
    }

    public Builder transformOrder(int transformOrder) {
      if (transformOrder < 3) {
        throw new IllegalArgumentException("Transform order must be at least 3");
      }
      this.transformOrder = transformOrder;
      return this;
    }

    public Instrument build() {
      if (referenceBar < 0 || referenceBar >= barCount) {
        throw new IllegalArgumentException("Reference bar " + referenceBar
            + " outside [0, " + barCount + ")");
      }
      return new Instrument(this);
    }
  }
}
