package kcwi.wavecal.input;

/**
 * A corrected detector frame (bars or arc exposure) with the instrument settings it was taken
 * with. Data is indexed [row][column], where rows run along the dispersion direction.
 * Frames are built by {@link Builder} or read from FITS by {@link FrameReader}; the calibration
 * reads them but never modifies them.
 */
public class Frame {

  private final String name;
  private final double[][] data;
  private final int xBinning;
  private final int yBinning;
  private final Grating grating;
  private final double rho;
  private final double gratingAngle;
  private final double cameraAngle;
  private final double adjusterAngle;
  private final double centralWavelength;
  private final Slicer slicer;
  private final String lamp;
  private final double taperFraction;
  private final int interactivityLevel;

  private Frame(Builder builder) {
    name = builder.name;
    data = builder.data;
    xBinning = builder.xBinning;
    yBinning = builder.yBinning;
    grating = builder.grating;
    rho = Double.isNaN(builder.rho) ? grating.getRho() : builder.rho;
    gratingAngle = builder.gratingAngle;
    cameraAngle = builder.cameraAngle;
    adjusterAngle = Double.isNaN(builder.adjusterAngle) ?
        grating.getDefaultAdjusterAngle() : builder.adjusterAngle;
    centralWavelength = builder.centralWavelength;
    slicer = builder.slicer;
    lamp = builder.lamp;
    taperFraction = builder.taperFraction;
    interactivityLevel = builder.interactivityLevel;
  }

  public String getName() {
    return name;
  }

  /**
   * @return the frame data; callers must not modify it
   */
  public double[][] getData() {
    return data;
  }

  public int getHeight() {
    return data.length;
  }

  public int getWidth() {
    return data[0].length;
  }

  public int getXBinning() {
    return xBinning;
  }

  public int getYBinning() {
    return yBinning;
  }

  public Grating getGrating() {
    return grating;
  }

  /**
   * @return grating density, lines per micron
   */
  public double getRho() {
    return rho;
  }

  public double getGratingAngle() {
    return gratingAngle;
  }

  public double getCameraAngle() {
    return cameraAngle;
  }

  public double getAdjusterAngle() {
    return adjusterAngle;
  }

  /**
   * @return central wavelength in Angstroms
   */
  public double getCentralWavelength() {
    return centralWavelength;
  }

  public Slicer getSlicer() {
    return slicer;
  }

  public String getLamp() {
    return lamp;
  }

  public double getTaperFraction() {
    return taperFraction;
  }

  public int getInteractivityLevel() {
    return interactivityLevel;
  }

  /**
   * Instrumental resolution (FWHM, Angstroms) at a given wavelength for this frame's grating
   * and slicer.
   *
   * @param wavelength wavelength in Angstroms
   * @return resolution element in Angstroms
   */
  public double resolution(double wavelength) {
    return wavelength / (grating.getResolvingPower() * slicer.getResolutionFactor());
  }

  public static class Builder {

    private String name = "frame";
    private double[][] data;
    private int xBinning = 1;
    private int yBinning = 1;
    private Grating grating = Grating.BM;
    private double rho = Double.NaN;
    private double gratingAngle;
    private double cameraAngle;
    private double adjusterAngle = Double.NaN;
    private double centralWavelength;
    private Slicer slicer = Slicer.MEDIUM;
    private String lamp = "ThAr";
    private double taperFraction = 0.2;
    private int interactivityLevel = 0;

    public Builder(double[][] data) {
      this.data = data;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder binning(int xBinning, int yBinning) {
      this.xBinning = xBinning;
      this.yBinning = yBinning;
      return this;
    }

    public Builder grating(Grating grating) {
      this.grating = grating;
      return this;
    }

    /**
     * Override the grating density taken from the grating table.
     */
    public Builder rho(double rho) {
      this.rho = rho;
      return this;
    }

    public Builder gratingAngle(double gratingAngle) {
      this.gratingAngle = gratingAngle;
      return this;
    }

    public Builder cameraAngle(double cameraAngle) {
      this.cameraAngle = cameraAngle;
      return this;
    }

    /**
     * Override the adjuster angle implied by the grating.
     */
    public Builder adjusterAngle(double adjusterAngle) {
      this.adjusterAngle = adjusterAngle;
      return this;
    }

    public Builder centralWavelength(double centralWavelength) {
      this.centralWavelength = centralWavelength;
      return this;
    }

    public Builder slicer(Slicer slicer) {
      this.slicer = slicer;
      return this;
    }

    public Builder lamp(String lamp) {
      this.lamp = lamp;
      return this;
    }

    public Builder taperFraction(double taperFraction) {
      this.taperFraction = taperFraction;
      return this;
    }

    public Builder interactivityLevel(int interactivityLevel) {
      this.interactivityLevel = interactivityLevel;
      return this;
    }

    public Frame build() {
      if (data == null || data.length == 0 || data[0].length == 0) {
        throw new IllegalArgumentException("Frame data is empty");
      }
      if (xBinning < 1 || yBinning < 1) {
        throw new IllegalArgumentException("Binning must be positive");
      }
      return new Frame(this);
    }
  }
}
