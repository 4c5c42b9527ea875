package kcwi.wavecal.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Arrays;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.util.CombinatoricsUtils;
import org.apache.log4j.Logger;

/**
 * Class containing static math functions shared by the calibration stages: spline resampling,
 * robust statistics on image bands, smoothing kernels, windows for tapering data before
 * correlation, and polynomial manipulation.
 */
public class NumericUtils {

  private static final Logger logger = Logger.getLogger(NumericUtils.class);

  /**
   * Ratio between a Gaussian's FWHM and its standard deviation, to the precision used for the
   * instrument's resolution estimates.
   */
  public static final double FWHM_TO_SIGMA = 2.354;

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.###");
        setInfinityPrintable(format);
        return format;
      });

  /**
   * Numerical Recipes cubic spline (spline.c) with natural boundary conditions, rewritten for
   * zero-offset arrays. Fills y2 with the second derivatives at each knot.
   *
   * @param x knot positions, strictly increasing
   * @param y knot values
   * @param y2 output array of second derivatives, same length as x
   */
  private static void spline(double[] x, double[] y, double[] y2) {
    int n = x.length;
    double[] u = new double[n];
    y2[0] = 0.;
    u[0] = 0.;
    for (int i = 1; i < n - 1; i++) {
      double sig = (x[i] - x[i - 1]) / (x[i + 1] - x[i - 1]);
      double p = sig * y2[i - 1] + 2.0;
      y2[i] = (sig - 1.0) / p;
      u[i] = (y[i + 1] - y[i]) / (x[i + 1] - x[i]) - (y[i] - y[i - 1]) / (x[i] - x[i - 1]);
      u[i] = (6.0 * u[i] / (x[i + 1] - x[i - 1]) - sig * u[i - 1]) / p;
    }
    y2[n - 1] = 0.;
    for (int k = n - 2; k >= 0; k--) {
      y2[k] = y2[k] * y2[k + 1] + u[k];
    }
  }

  /**
   * Numerical Recipes spline evaluation (splint.c) for zero-offset arrays. Points outside the
   * knot range are extrapolated from the nearest end interval.
   */
  private static double splint(double[] xa, double[] ya, double[] y2a, double x) {
    int klo = 0;
    int khi = xa.length - 1;
    while (khi - klo > 1) {
      int k = (khi + klo) >> 1;
      if (xa[k] > x) {
        khi = k;
      } else {
        klo = k;
      }
    }
    double h = xa[khi] - xa[klo];
    if (h == 0.0) {
      logger.warn("Repeated abscissa in spline input at x=" + xa[klo]);
      return ya[klo];
    }
    double a = (xa[khi] - x) / h;
    double b = (x - xa[klo]) / h;
    return a * ya[klo] + b * ya[khi] +
        ((a * a * a - a) * y2a[klo] + (b * b * b - b) * y2a[khi]) * (h * h) / 6.0;
  }

  /**
   * Interpolate using a cubic spline.
   * Given arrays X and Y, where Y = f(X), we want Y[Z], the values of f at positions Z.
   * X must be monotonic; decreasing inputs are reversed before the spline is built.
   *
   * @param X Known X coordinates (monotonic)
   * @param Y Known Y values corresponding to X
   * @param Z Desired X coordinates to interpolate
   * @return interpolated array of Y values corresponding to input Z
   */
  public static double[] interpolate(double[] X, double[] Y, double[] Z) {
    int n = Math.min(X.length, Y.length);
    double[] xs = Arrays.copyOf(X, n);
    double[] ys = Arrays.copyOf(Y, n);
    if (n > 1 && xs[0] > xs[n - 1]) {
      reverse(xs);
      reverse(ys);
    }

    double[] interpolatedValues = new double[Z.length];
    if (n == 1) {
      Arrays.fill(interpolatedValues, ys[0]);
      return interpolatedValues;
    }

    double[] y2 = new double[n];
    spline(xs, ys, y2);
    for (int i = 0; i < Z.length; i++) {
      interpolatedValues[i] = splint(xs, ys, y2, Z[i]);
    }
    return interpolatedValues;
  }

  /**
   * Evenly spaced values over [start, stop], both ends included.
   */
  public static double[] linspace(double start, double stop, int count) {
    double[] out = new double[count];
    if (count == 1) {
      out[0] = start;
      return out;
    }
    double step = (stop - start) / (count - 1);
    for (int i = 0; i < count; ++i) {
      out[i] = start + i * step;
    }
    out[count - 1] = stop;
    return out;
  }

  /**
   * Index of the first occurrence of the maximum value within [from, to).
   */
  public static int argmax(double[] values, int from, int to) {
    int best = from;
    for (int i = from + 1; i < to; ++i) {
      if (values[i] > values[best]) {
        best = i;
      }
    }
    return best;
  }

  public static int argmax(double[] values) {
    return argmax(values, 0, values.length);
  }

  public static double mean(double[] values) {
    double sum = 0.;
    for (double value : values) {
      sum += value;
    }
    return sum / values.length;
  }

  /**
   * Minimum of values within [from, to), ignoring NaN entries.
   */
  public static double nanMin(double[] values, int from, int to) {
    double min = Double.NaN;
    for (int i = from; i < to; ++i) {
      if (Double.isNaN(values[i])) {
        continue;
      }
      if (Double.isNaN(min) || values[i] < min) {
        min = values[i];
      }
    }
    return min;
  }

  public static double median(double[] values) {
    return new Median().evaluate(values);
  }

  /**
   * Population standard deviation (normalized by N rather than N-1).
   */
  public static double populationStdDev(double[] values) {
    return new StandardDeviation(false).evaluate(values);
  }

  /**
   * Get the median of each column across a band of rows of a 2D frame.
   *
   * @param data Frame data indexed as [row][column]
   * @param firstRow First row of the band (inclusive)
   * @param lastRow Last row of the band (inclusive)
   * @param firstCol First column to evaluate (inclusive)
   * @param lastCol Last column to evaluate (inclusive)
   * @return Array with one median per column in [firstCol, lastCol]
   */
  public static double[] columnMedians(double[][] data, int firstRow, int lastRow,
      int firstCol, int lastCol) {
    Median median = new Median();
    double[] column = new double[lastRow - firstRow + 1];
    double[] out = new double[lastCol - firstCol + 1];
    for (int col = firstCol; col <= lastCol; ++col) {
      for (int row = firstRow; row <= lastRow; ++row) {
        column[row - firstRow] = data[row][col];
      }
      out[col - firstCol] = median.evaluate(column);
    }
    return out;
  }

  /**
   * Get the median of each row across a band of columns of a 2D frame.
   *
   * @param data Frame data indexed as [row][column]
   * @param firstCol First column of the band (inclusive)
   * @param lastCol Last column of the band (inclusive)
   * @return Array with one median per row of the frame
   */
  public static double[] rowMedians(double[][] data, int firstCol, int lastCol) {
    Median median = new Median();
    double[] out = new double[data.length];
    for (int row = 0; row < data.length; ++row) {
      out[row] = median.evaluate(Arrays.copyOfRange(data[row], firstCol, lastCol + 1));
    }
    return out;
  }

  /**
   * Flux-weighted centroid, sum(x*y)/sum(y).
   *
   * @param xs Positions
   * @param ys Weights (already background-subtracted)
   * @return Centroid position, NaN if the weights sum to zero
   */
  public static double centroid(double[] xs, double[] ys) {
    double num = 0.;
    double den = 0.;
    for (int i = 0; i < xs.length; ++i) {
      num += xs[i] * ys[i];
      den += ys[i];
    }
    if (den == 0.) {
      return Double.NaN;
    }
    return num / den;
  }

  /**
   * Evaluate a polynomial whose coefficients are ordered from the highest power down to the
   * constant term (Horner's method).
   */
  public static double polyval(double[] coeffsHighFirst, double x) {
    double result = 0.;
    for (double coeff : coeffsHighFirst) {
      result = result * x + coeff;
    }
    return result;
  }

  public static double[] polyval(double[] coeffsHighFirst, double[] xs) {
    double[] out = new double[xs.length];
    for (int i = 0; i < xs.length; ++i) {
      out[i] = polyval(coeffsHighFirst, xs[i]);
    }
    return out;
  }

  /**
   * Re-express a polynomial about a new expansion point using binomial expansion.
   * Given coefficients c (highest power first) of p(u), returns coefficients of q(x) = p(x - x0),
   * so that a polynomial fit against a centered axis u = x - x0 can be evaluated directly on x.
   * Shifting by x0 and then by -x0 returns the original coefficients.
   *
   * @param coeffsHighFirst Polynomial coefficients, highest power first
   * @param x0 Expansion point offset
   * @return Shifted coefficients, highest power first
   */
  public static double[] pascalShift(double[] coeffsHighFirst, double x0) {
    int n = coeffsHighFirst.length;
    if (x0 == 0.) {
      return coeffsHighFirst.clone();
    }
    // work lowest-first: a[j] is the coefficient of u^j
    double[] a = new double[n];
    for (int j = 0; j < n; ++j) {
      a[j] = coeffsHighFirst[n - 1 - j];
    }
    double[] shifted = new double[n];
    for (int k = 0; k < n; ++k) {
      double sum = 0.;
      for (int j = k; j < n; ++j) {
        sum += CombinatoricsUtils.binomialCoefficientDouble(j, k) * a[j] * Math.pow(-x0, j - k);
      }
      shifted[k] = sum;
    }
    double[] out = new double[n];
    for (int k = 0; k < n; ++k) {
      out[n - 1 - k] = shifted[k];
    }
    return out;
  }

  /**
   * Tukey (tapered cosine) window of the given length. Alpha is the fraction of the window
   * inside the cosine-tapered region; 0 gives a rectangular window and 1 a Hann window.
   */
  public static double[] tukeyWindow(int length, double alpha) {
    double[] window = new double[length];
    Arrays.fill(window, 1.);
    if (length <= 1 || alpha <= 0.) {
      return window;
    }
    if (alpha >= 1.) {
      alpha = 1.;
    }
    int width = (int) Math.floor(alpha * (length - 1) / 2.0);
    for (int i = 0; i <= width; ++i) {
      window[i] = 0.5 * (1 + Math.cos(Math.PI * (-1 + 2.0 * i / alpha / (length - 1))));
    }
    for (int i = length - width - 1; i < length; ++i) {
      window[i] = 0.5 *
          (1 + Math.cos(Math.PI * (-2.0 / alpha + 1 + 2.0 * i / alpha / (length - 1))));
    }
    return window;
  }

  /**
   * Multiply two arrays elementwise, returning a new array.
   */
  public static double[] multiply(double[] values, double[] weights) {
    double[] out = new double[values.length];
    for (int i = 0; i < values.length; ++i) {
      out[i] = values[i] * weights[i];
    }
    return out;
  }

  /**
   * One-dimensional Gaussian smoothing. The kernel is truncated at four standard deviations
   * and the data is mirrored about its ends (half-sample symmetric).
   *
   * @param values Data to smooth
   * @param sigma Kernel standard deviation in samples
   * @return Smoothed data, same length as input
   */
  public static double[] gaussianFilter(double[] values, double sigma) {
    if (sigma <= 0.) {
      return values.clone();
    }
    int radius = (int) (4.0 * sigma + 0.5);
    double[] kernel = new double[2 * radius + 1];
    double sum = 0.;
    for (int i = -radius; i <= radius; ++i) {
      kernel[i + radius] = Math.exp(-0.5 * i * i / (sigma * sigma));
      sum += kernel[i + radius];
    }
    for (int i = 0; i < kernel.length; ++i) {
      kernel[i] /= sum;
    }

    int n = values.length;
    double[] out = new double[n];
    for (int i = 0; i < n; ++i) {
      double acc = 0.;
      for (int k = -radius; k <= radius; ++k) {
        acc += kernel[k + radius] * values[reflectIndex(i + k, n)];
      }
      out[i] = acc;
    }
    return out;
  }

  /**
   * Map an out-of-range index into [0, n) by mirroring about the array ends, where the edge
   * sample is repeated (d c b a | a b c d | d c b a).
   */
  private static int reflectIndex(int index, int n) {
    if (n == 1) {
      return 0;
    }
    int period = 2 * n;
    index = ((index % period) + period) % period;
    if (index >= n) {
      index = period - 1 - index;
    }
    return index;
  }

  /**
   * Normalized boxcar smoothing with zero padding outside the data, producing an output
   * the same size as the input and centered on each sample. Widths below 2 return a copy.
   */
  public static double[] boxcarSmooth(double[] values, int width) {
    if (width < 2) {
      return values.clone();
    }
    int n = values.length;
    int lead = (width - 1) / 2;
    double[] out = new double[n];
    for (int i = 0; i < n; ++i) {
      double acc = 0.;
      for (int k = 0; k < width; ++k) {
        int index = i - lead + k;
        if (index >= 0 && index < n) {
          acc += values[index];
        }
      }
      out[i] = acc / width;
    }
    return out;
  }

  /**
   * Iterative sigma clipping. Each pass computes the mean and population standard deviation of
   * the surviving values and keeps those within [mean - low*std, mean + high*std]. Stops after
   * the given number of passes or once a pass removes nothing.
   *
   * @param values Data to clip
   * @param low Lower bound in standard deviations
   * @param high Upper bound in standard deviations
   * @param maxIterations Maximum number of clipping passes
   * @return two-element array holding the final lower and upper bounds
   */
  public static double[] sigmaClipBounds(double[] values, double low, double high,
      int maxIterations) {
    double[] current = values.clone();
    double lower = Double.NEGATIVE_INFINITY;
    double upper = Double.POSITIVE_INFINITY;
    for (int iter = 0; iter < maxIterations && current.length > 0; ++iter) {
      DescriptiveStatistics stats = new DescriptiveStatistics(current);
      double mean = stats.getMean();
      double std = populationStdDev(current);
      lower = mean - std * low;
      upper = mean + std * high;
      final double lo = lower;
      final double hi = upper;
      double[] kept = Arrays.stream(current).filter(v -> v >= lo && v <= hi).toArray();
      boolean changed = kept.length != current.length;
      current = kept;
      if (!changed) {
        break;
      }
    }
    return new double[]{lower, upper};
  }

  /**
   * Sets a DecimalFormat to use the given symbol for infinity. This is done to
   * resolve issues with the default PDF font not having a glyph for that symbol.
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Infinity");
    df.setDecimalFormatSymbols(symbols);
  }

  private static void reverse(double[] values) {
    for (int i = 0, j = values.length - 1; i < j; ++i, --j) {
      double temp = values[i];
      values[i] = values[j];
      values[j] = temp;
    }
  }

}
