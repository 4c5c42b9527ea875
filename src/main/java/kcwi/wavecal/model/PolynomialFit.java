package kcwi.wavecal.model;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;

/**
 * Generic least-squares polynomial from pixel to wavelength. Coefficients are lowest power
 * first, the {@link PolynomialFunction} convention.
 */
public class PolynomialFit {

  private final PolynomialFunction function;
  private final double rms;
  private final int pointCount;

  public PolynomialFit(double[] coefficientsLowFirst, double rms, int pointCount) {
    this.function = new PolynomialFunction(coefficientsLowFirst);
    this.rms = rms;
    this.pointCount = pointCount;
  }

  public double[] getCoefficients() {
    return function.getCoefficients();
  }

  public int getDegree() {
    return function.degree();
  }

  /**
   * @return root-mean-square residual of the fitted points (A)
   */
  public double getRms() {
    return rms;
  }

  public int getPointCount() {
    return pointCount;
  }

  public double value(double pixel) {
    return function.value(pixel);
  }
}
