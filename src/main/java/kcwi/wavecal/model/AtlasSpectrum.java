package kcwi.wavecal.model;

import kcwi.wavecal.utils.NumericUtils;

/**
 * Reference emission-line spectrum of a calibration lamp on a linear wavelength axis.
 * A freshly loaded atlas has no resolution applied; {@link #convolvedTo(double)} returns the copy
 * smoothed to the instrument's resolution that the matching stages work from.
 */
public class AtlasSpectrum {

  private final String lamp;
  private final double[] wavelengths;
  private final double[] flux;
  private final double dispersion;
  private final double resolutionPixels;

  public AtlasSpectrum(String lamp, double[] wavelengths, double[] flux, double dispersion) {
    this(lamp, wavelengths, flux, dispersion, 0.);
  }

  private AtlasSpectrum(String lamp, double[] wavelengths, double[] flux, double dispersion,
      double resolutionPixels) {
    if (wavelengths.length != flux.length) {
      throw new IllegalArgumentException("Atlas wavelength and flux lengths differ: "
          + wavelengths.length + " vs " + flux.length);
    }
    this.lamp = lamp;
    this.wavelengths = wavelengths.clone();
    this.flux = flux.clone();
    this.dispersion = dispersion;
    this.resolutionPixels = resolutionPixels;
  }

  /**
   * Build an atlas from a linear axis description.
   *
   * @param lamp Lamp name
   * @param flux Flux samples
   * @param startWavelength Wavelength of the first sample (A)
   * @param dispersion Wavelength step per sample (A)
   * @return the atlas
   */
  public static AtlasSpectrum fromLinearAxis(String lamp, double[] flux, double startWavelength,
      double dispersion) {
    double[] wavelengths = new double[flux.length];
    for (int i = 0; i < flux.length; ++i) {
      wavelengths[i] = startWavelength + i * dispersion;
    }
    return new AtlasSpectrum(lamp, wavelengths, flux, dispersion);
  }

  /**
   * Smooth the flux with a Gaussian matching the instrument resolution.
   *
   * @param resolutionFwhm Instrumental resolution as a FWHM in Angstroms
   * @return new atlas with convolved flux and the resolution expressed in atlas pixels
   */
  public AtlasSpectrum convolvedTo(double resolutionFwhm) {
    double resPix = resolutionFwhm / dispersion;
    double[] smoothed = NumericUtils.gaussianFilter(flux, resPix / NumericUtils.FWHM_TO_SIGMA);
    return new AtlasSpectrum(lamp, wavelengths, smoothed, dispersion, resPix);
  }

  public String getLamp() {
    return lamp;
  }

  public double[] getWavelengths() {
    return wavelengths.clone();
  }

  public double[] getFlux() {
    return flux.clone();
  }

  public int getLength() {
    return flux.length;
  }

  /**
   * @return Angstroms per atlas sample
   */
  public double getDispersion() {
    return dispersion;
  }

  /**
   * @return FWHM resolution in atlas samples, or 0 if the atlas has not been convolved
   */
  public double getResolutionPixels() {
    return resolutionPixels;
  }

  /**
   * @return first index whose wavelength is at least the given value, or -1 if none is
   */
  public int firstIndexAtOrAbove(double wavelength) {
    for (int i = 0; i < wavelengths.length; ++i) {
      if (wavelengths[i] >= wavelength) {
        return i;
      }
    }
    return -1;
  }

  /**
   * @return last index whose wavelength is at most the given value, or -1 if none is
   */
  public int lastIndexAtOrBelow(double wavelength) {
    for (int i = wavelengths.length - 1; i >= 0; --i) {
      if (wavelengths[i] <= wavelength) {
        return i;
      }
    }
    return -1;
  }
}
