package kcwi.wavecal.utils;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * Full-mode linear cross-correlation and lag selection, used by the inter-bar alignment and the
 * atlas matching stages.
 *
 * The correlation of a against v is c[i] = sum over n of a[n + k] * v[n], where the lag k
 * is i - (v.length - 1). A positive lag means the features of v appear k samples later in a.
 * When several lags share the maximum the first one is used.
 */
public class CorrelationUtils {

  /**
   * Above this many multiply-adds the correlation is done through FFTs.
   */
  private static final long DIRECT_LIMIT = 1L << 21;

  /**
   * Relative spread below which a correlation is considered flat (no usable peak).
   */
  private static final double FLAT_TOLERANCE = 1E-10;

  /**
   * Result of selecting a peak from a correlation: lag in samples and correlation value there.
   */
  public static class CorrelationPeak {

    private final int lag;
    private final double value;
    private final boolean flat;

    CorrelationPeak(int lag, double value, boolean flat) {
      this.lag = lag;
      this.value = value;
      this.flat = flat;
    }

    public int getLag() {
      return lag;
    }

    public double getValue() {
      return value;
    }

    /**
     * @return True if the searched region of the correlation had no distinguishable maximum
     */
    public boolean isFlat() {
      return flat;
    }
  }

  /**
   * Full cross-correlation of a against v, of length a.length + v.length - 1.
   *
   * @param a First series
   * @param v Second series
   * @return Correlation values, index i corresponding to lag i - (v.length - 1)
   */
  public static double[] correlate(double[] a, double[] v) {
    if ((long) a.length * v.length <= DIRECT_LIMIT) {
      return correlateDirect(a, v);
    }
    return correlateFFT(a, v);
  }

  static double[] correlateDirect(double[] a, double[] v) {
    int length = a.length + v.length - 1;
    int shift = v.length - 1;
    double[] correlations = new double[length];
    for (int i = 0; i < length; ++i) {
      int k = i - shift;
      int nStart = Math.max(0, -k);
      int nEnd = Math.min(v.length, a.length - k);
      double sum = 0.;
      for (int n = nStart; n < nEnd; ++n) {
        sum += a[n + k] * v[n];
      }
      correlations[i] = sum;
    }
    return correlations;
  }

  static double[] correlateFFT(double[] a, double[] v) {
    int length = a.length + v.length - 1;
    int padded = Integer.highestOneBit(length);
    if (padded < length) {
      padded <<= 1;
    }
    double[] aPad = new double[padded];
    System.arraycopy(a, 0, aPad, 0, a.length);
    // correlation is the convolution of a with v reversed
    double[] vPad = new double[padded];
    for (int j = 0; j < v.length; ++j) {
      vPad[j] = v[v.length - 1 - j];
    }

    FastFourierTransformer fft = new FastFourierTransformer(DftNormalization.STANDARD);
    Complex[] aFreq = fft.transform(aPad, TransformType.FORWARD);
    Complex[] vFreq = fft.transform(vPad, TransformType.FORWARD);
    Complex[] product = new Complex[padded];
    for (int i = 0; i < padded; ++i) {
      product[i] = aFreq[i].multiply(vFreq[i]);
    }
    Complex[] inverse = fft.transform(product, TransformType.INVERSE);
    double[] correlations = new double[length];
    for (int i = 0; i < length; ++i) {
      correlations[i] = inverse[i].getReal();
    }
    return correlations;
  }

  /**
   * Lag of the global maximum of the full correlation of a against v.
   */
  public static CorrelationPeak fullPeak(double[] a, double[] v) {
    double[] correlations = correlate(a, v);
    return peakInRange(correlations, 0, correlations.length, v.length, scale(a, v));
  }

  /**
   * Lag of the maximum of the correlation of a against v, searching only the central third
   * of the correlation (from len/3 up to 2*(len/3)) to avoid aliasing at extreme lags.
   */
  public static CorrelationPeak centralThirdPeak(double[] a, double[] v) {
    double[] correlations = correlate(a, v);
    double third = correlations.length / 3.0;
    int from = (int) third;
    int to = Math.max(from + 1, (int) (2 * third));
    return peakInRange(correlations, from, to, v.length, scale(a, v));
  }

  private static CorrelationPeak peakInRange(double[] correlations, int from, int to,
      int vLength, double scale) {
    int best = NumericUtils.argmax(correlations, from, to);
    double min = correlations[from];
    for (int i = from; i < to; ++i) {
      min = Math.min(min, correlations[i]);
    }
    boolean flat = !(correlations[best] - min > FLAT_TOLERANCE * scale);
    return new CorrelationPeak(best - (vLength - 1), correlations[best], flat);
  }

  private static double scale(double[] a, double[] v) {
    double normA = 0.;
    for (double value : a) {
      normA += value * value;
    }
    double normV = 0.;
    for (double value : v) {
      normV += value * value;
    }
    return Math.sqrt(normA * normV);
  }

}
