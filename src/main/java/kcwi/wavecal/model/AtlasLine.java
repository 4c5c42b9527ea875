package kcwi.wavecal.model;

/**
 * A canonical emission line from the atlas: adopted wavelength, fitted amplitude and width.
 */
public class AtlasLine {

  private final double wavelength;
  private final double amplitude;
  private final double sigma;

  public AtlasLine(double wavelength, double amplitude, double sigma) {
    this.wavelength = wavelength;
    this.amplitude = amplitude;
    this.sigma = sigma;
  }

  public double getWavelength() {
    return wavelength;
  }

  public double getAmplitude() {
    return amplitude;
  }

  public double getSigma() {
    return sigma;
  }
}
