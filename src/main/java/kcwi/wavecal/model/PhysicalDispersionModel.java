package kcwi.wavecal.model;

import kcwi.wavecal.utils.NumericUtils;

/**
 * Five-term pixel-to-wavelength polynomial derived from the grating equation. The constant and
 * linear terms are the zero point and dispersion; the three higher-order terms follow from the
 * dispersion through the diffraction angle it implies.
 *
 * Coefficients are held highest power first and are expanded about a reference pixel x0, so
 * the wavelength of pixel p is polyval(coefficients, p - x0). {@link #getPixelCoefficients()}
 * gives the equivalent polynomial in p itself.
 */
public class PhysicalDispersionModel {

  private final double[] coefficients;
  private final double referencePixel;

  public PhysicalDispersionModel(double[] coefficients, double referencePixel) {
    if (coefficients.length != 5) {
      throw new IllegalArgumentException("Expected 5 coefficients, got " + coefficients.length);
    }
    this.coefficients = coefficients.clone();
    this.referencePixel = referencePixel;
  }

  /**
   * Build the model for a trial zero point and dispersion.
   *
   * @param zeroPoint Wavelength at the reference pixel (A)
   * @param dispersion Linear dispersion (A/pixel)
   * @param pixelScale Binned pixel size (mm)
   * @param rho Grating density (lines/um)
   * @param focalLength Camera focal length (mm)
   * @param referencePixel Pixel the polynomial is expanded about
   * @return the model
   */
  public static PhysicalDispersionModel fromGratingEquation(double zeroPoint, double dispersion,
      double pixelScale, double rho, double focalLength, double referencePixel) {
    double cosBeta = dispersion / pixelScale * rho * focalLength * 1.E-4;
    if (cosBeta > 1.) {
      cosBeta = 1.;
    }
    double sinBeta = Math.sqrt(Math.max(0., 1. - cosBeta * cosBeta));
    double ratio = pixelScale / focalLength;
    double[] coeffs = new double[5];
    coeffs[4] = zeroPoint;
    coeffs[3] = dispersion;
    coeffs[2] = -Math.pow(ratio, 2) * sinBeta / 2. / rho * 1.E4;
    coeffs[1] = -Math.pow(ratio, 3) * cosBeta / 6. / rho * 1.E4;
    coeffs[0] = Math.pow(ratio, 4) * sinBeta / 24. / rho * 1.E4;
    return new PhysicalDispersionModel(coeffs, referencePixel);
  }

  /**
   * @return coefficients about the reference pixel, highest power first
   */
  public double[] getCoefficients() {
    return coefficients.clone();
  }

  /**
   * @return coefficients as a polynomial in raw pixel, highest power first
   */
  public double[] getPixelCoefficients() {
    return NumericUtils.pascalShift(coefficients, referencePixel);
  }

  public double getReferencePixel() {
    return referencePixel;
  }

  public double getZeroPoint() {
    return coefficients[4];
  }

  public double getDispersion() {
    return coefficients[3];
  }

  public double wavelengthAt(double pixel) {
    return NumericUtils.polyval(coefficients, pixel - referencePixel);
  }

  public double[] wavelengthsAt(double[] pixels) {
    double[] out = new double[pixels.length];
    for (int i = 0; i < pixels.length; ++i) {
      out[i] = wavelengthAt(pixels[i]);
    }
    return out;
  }
}
