package kcwi.wavecal.stage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import kcwi.wavecal.CalibrationException.FitException;
import kcwi.wavecal.input.CalibrationContext;
import kcwi.wavecal.input.Configuration;
import kcwi.wavecal.input.Instrument;
import kcwi.wavecal.model.AtlasLine;
import kcwi.wavecal.model.BarSolution;
import kcwi.wavecal.model.LineList;
import kcwi.wavecal.model.PhysicalDispersionModel;
import kcwi.wavecal.model.PolynomialFit;
import kcwi.wavecal.utils.LineWindow;
import kcwi.wavecal.utils.NumericUtils;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.CombinatoricsUtils;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Solves each bar's final pixel-to-wavelength polynomial. Every atlas line is looked for in the
 * (slicer-smoothed) bar spectrum near the pixel the central model predicts for it; lines that
 * are found, bright enough, and symmetric enough that their interpolated peak agrees with their
 * centroid are paired with their atlas wavelength. A polynomial is fit to the pairs and refit
 * after dropping outlying residuals, up to a fixed number of times.
 *
 * A bar with too few lines for the polynomial gets a FAILED solution; the other bars are
 * unaffected.
 */
public class ArcSolveStage extends CalibrationStage {

  private static final Logger logger = Logger.getLogger(ArcSolveStage.class);

  /**
   * Points used to resample a line profile when locating its peak.
   */
  static final int PROFILE_SAMPLES = 1000;

  /**
   * Fewest samples a line window may hold.
   */
  static final int MIN_WINDOW_SAMPLES = 5;

  private List<BarSolution> solutions;

  public ArcSolveStage() {
    super();
  }

  /**
   * Matched pixel positions and wavelengths of the lines measured in one bar.
   */
  public static class LineMatches {

    private final double[] pixels;
    private final double[] wavelengths;
    private final int rejected;

    LineMatches(double[] pixels, double[] wavelengths, int rejected) {
      this.pixels = pixels;
      this.wavelengths = wavelengths;
      this.rejected = rejected;
    }

    public double[] getPixels() {
      return pixels;
    }

    public double[] getWavelengths() {
      return wavelengths;
    }

    /**
     * @return number of atlas lines that could not be measured in the bar
     */
    public int getRejected() {
      return rejected;
    }
  }

  /**
   * Result of the fit-and-reject loop.
   */
  public static class RobustFit {

    private final PolynomialFit fit;
    private final double[] rmsHistory;
    private final int rejected;

    RobustFit(PolynomialFit fit, double[] rmsHistory, int rejected) {
      this.fit = fit;
      this.rmsHistory = rmsHistory;
      this.rejected = rejected;
    }

    public PolynomialFit getFit() {
      return fit;
    }

    public double[] getRmsHistory() {
      return rmsHistory.clone();
    }

    /**
     * @return points dropped by the rejection passes
     */
    public int getRejected() {
      return rejected;
    }
  }

  /**
   * Locate atlas lines in a bar spectrum.
   *
   * @param spectrum Smoothed bar spectrum
   * @param model Central model giving the expected wavelength of each pixel
   * @param lines Atlas lines
   * @param threshold Minimum line peak
   * @param tolerance Largest accepted difference between interpolated peak and centroid (px)
   * @return matched lines
   */
  public static LineMatches measureLines(double[] spectrum, PhysicalDispersionModel model,
      LineList lines, double threshold, double tolerance) {
    int n = spectrum.length;
    double[] xvals = new double[n];
    for (int i = 0; i < n; ++i) {
      xvals[i] = i;
    }
    double[] expected = NumericUtils.polyval(model.getPixelCoefficients(), xvals);

    List<Double> pixels = new ArrayList<>();
    List<Double> waves = new ArrayList<>();
    int rejected = 0;
    for (AtlasLine line : lines.getLines()) {
      double wave = line.getWavelength();
      int lineX = -1;
      for (int i = 0; i < n; ++i) {
        if (expected[i] >= wave) {
          lineX = i;
          break;
        }
      }
      if (lineX < 0) {
        logger.debug("Line at " + wave + " A lies beyond the bar");
        ++rejected;
        continue;
      }
      LineWindow window = LineWindow.find(spectrum, lineX, threshold);
      if (window == null || window.getCount() < MIN_WINDOW_SAMPLES) {
        ++rejected;
        continue;
      }
      double[] xs = Arrays.copyOfRange(xvals, window.getFirst(), window.getLast() + 1);
      double[] ys = Arrays.copyOfRange(spectrum, window.getFirst(), window.getLast() + 1);
      double[] fine = NumericUtils.linspace(xs[0], xs[xs.length - 1], PROFILE_SAMPLES);
      double peak = fine[NumericUtils.argmax(NumericUtils.interpolate(xs, ys, fine))];
      double centroid = NumericUtils.centroid(xs, ys);
      if (!(Math.abs(centroid - peak) <= tolerance)) {
        logger.debug("Line at " + wave + " A rejected: peak " + peak + " vs centroid "
            + centroid);
        ++rejected;
        continue;
      }
      pixels.add(peak);
      waves.add(wave);
    }
    return new LineMatches(pixels.stream().mapToDouble(Double::doubleValue).toArray(),
        waves.stream().mapToDouble(Double::doubleValue).toArray(), rejected);
  }

  /**
   * Least-squares polynomial through the points. The pixel axis is scaled into [-1, 1] for
   * the solve and the result converted back to raw pixel coefficients.
   *
   * @param x Pixel positions
   * @param y Wavelengths
   * @param degree Polynomial degree
   * @return coefficients in raw pixel, lowest power first
   * @throws FitException if there are too few points or they do not constrain the fit
   */
  public static double[] polynomialFit(double[] x, double[] y, int degree) throws FitException {
    int n = x.length;
    if (n < degree + 1) {
      throw new FitException("Need " + (degree + 1) + " lines for a degree " + degree
          + " fit, have " + n);
    }
    double min = Arrays.stream(x).min().getAsDouble();
    double max = Arrays.stream(x).max().getAsDouble();
    double center = (max + min) / 2.;
    double scale = Math.max((max - min) / 2., 1.);

    RealMatrix design = MatrixUtils.createRealMatrix(n, degree + 1);
    for (int i = 0; i < n; ++i) {
      double u = (x[i] - center) / scale;
      double term = 1.;
      for (int k = 0; k <= degree; ++k) {
        design.setEntry(i, k, term);
        term *= u;
      }
    }
    DecompositionSolver solver = new QRDecomposition(design, 1E-12).getSolver();
    double[] scaled;
    try {
      scaled = solver.solve(new ArrayRealVector(y)).toArray();
    } catch (SingularMatrixException e) {
      throw new FitException("Line positions do not constrain a degree " + degree + " fit", e);
    }

    // expand sum a_k ((x - c) / s)^k in powers of x
    double[] coeffs = new double[degree + 1];
    for (int k = 0; k <= degree; ++k) {
      double factor = scaled[k] / Math.pow(scale, k);
      for (int j = 0; j <= k; ++j) {
        coeffs[j] += factor * CombinatoricsUtils.binomialCoefficientDouble(k, j)
            * Math.pow(-center, k - j);
      }
    }
    return coeffs;
  }

  /**
   * Fit a polynomial, then repeatedly drop points whose residual exceeds the given number of
   * standard deviations and refit. Stops early when a pass would drop nothing or would leave
   * too few points for the fit.
   *
   * @param x Pixel positions
   * @param y Wavelengths
   * @param degree Polynomial degree
   * @param rejectSigma Residual cutoff in standard deviations
   * @param iterations Largest number of rejection passes
   * @return final fit with its RMS history
   * @throws FitException if the initial fit cannot be made
   */
  public static RobustFit robustFit(double[] x, double[] y, int degree, double rejectSigma,
      int iterations) throws FitException {
    double[] xs = x.clone();
    double[] ys = y.clone();
    double[] coeffs = polynomialFit(xs, ys, degree);
    double[] residuals = residuals(coeffs, xs, ys);
    List<Double> history = new ArrayList<>();
    history.add(rms(residuals));

    for (int iter = 0; iter < iterations; ++iter) {
      List<Integer> keep = withinCutoff(residuals, rejectSigma);
      if (keep.size() == xs.length || keep.size() < degree + 1) {
        break;
      }
      double[] keptX = new double[keep.size()];
      double[] keptY = new double[keep.size()];
      for (int i = 0; i < keep.size(); ++i) {
        keptX[i] = xs[keep.get(i)];
        keptY[i] = ys[keep.get(i)];
      }
      xs = keptX;
      ys = keptY;
      coeffs = polynomialFit(xs, ys, degree);
      residuals = residuals(coeffs, xs, ys);
      history.add(rms(residuals));
    }
    double[] rmsHistory = history.stream().mapToDouble(Double::doubleValue).toArray();
    PolynomialFit fit = new PolynomialFit(coeffs, rmsHistory[rmsHistory.length - 1], xs.length);
    return new RobustFit(fit, rmsHistory, x.length - xs.length);
  }

  /**
   * Indices of the residuals no larger than the given number of standard deviations.
   * A residual on the cutoff is kept, so a perfect fit (zero spread) keeps every point.
   *
   * @param residuals Fit residuals
   * @param rejectSigma Cutoff in population standard deviations
   * @return indices of the kept residuals, ascending
   */
  static List<Integer> withinCutoff(double[] residuals, double rejectSigma) {
    double cutoff = rejectSigma * NumericUtils.populationStdDev(residuals);
    List<Integer> keep = new ArrayList<>();
    for (int i = 0; i < residuals.length; ++i) {
      if (Math.abs(residuals[i]) <= cutoff) {
        keep.add(i);
      }
    }
    return keep;
  }

  /**
   * Solve one bar.
   *
   * @param barId Bar index
   * @param sliceId Slice the bar belongs to
   * @param spectrum Bar arc spectrum
   * @param model Central model for the bar, null if the central fit failed
   * @param lines Atlas lines
   * @param smoothingWidth Boxcar width for the slicer
   * @param configuration Thresholds and fit settings
   * @return the bar's solution, FAILED if it could not be fit
   */
  public static BarSolution solveBar(int barId, int sliceId, double[] spectrum,
      PhysicalDispersionModel model, LineList lines, int smoothingWidth,
      Configuration configuration) {
    if (model == null) {
      return BarSolution.failed(barId, sliceId, null, "No central wavelength model");
    }
    double[] smoothed = NumericUtils.boxcarSmooth(spectrum, smoothingWidth);
    LineMatches matches = measureLines(smoothed, model, lines,
        configuration.getLineThreshold(), configuration.getPeakCentroidTolerance());
    logger.debug("Bar " + barId + ": fitting " + matches.getPixels().length
        + " lines after rejecting " + matches.getRejected());
    try {
      RobustFit robust = robustFit(matches.getPixels(), matches.getWavelengths(),
          configuration.getFitDegree(), configuration.getResidualRejectSigma(),
          configuration.getRejectIterations());
      return BarSolution.solved(barId, sliceId, model, robust.getFit(),
          robust.getRmsHistory(), matches.getRejected() + robust.getRejected());
    } catch (FitException e) {
      return BarSolution.failed(barId, sliceId, model, e.getMessage());
    }
  }

  private static double[] residuals(double[] coeffsLowFirst, double[] x, double[] y) {
    double[] out = new double[x.length];
    for (int i = 0; i < x.length; ++i) {
      double value = 0.;
      for (int k = coeffsLowFirst.length - 1; k >= 0; --k) {
        value = value * x[i] + coeffsLowFirst[k];
      }
      out[i] = value - y[i];
    }
    return out;
  }

  private static double rms(double[] residuals) {
    double sum = 0.;
    for (double residual : residuals) {
      sum += residual * residual;
    }
    return Math.sqrt(sum / residuals.length);
  }

  @Override
  protected void backend(final CalibrationContext context) {
    Instrument instrument = context.getInstrument();
    Configuration configuration = context.getConfiguration();
    List<PhysicalDispersionModel> models = context.getCentralModels();
    LineList lines = context.getLineList();
    int smoothing = context.getArcFrame().getSlicer().getSmoothingWidth();

    fireStateChange("Solving " + models.size() + " bars against " + lines.size()
        + " atlas lines...");
    solutions = IntStream.range(0, models.size()).parallel()
        .mapToObj(bar -> solveBar(bar, instrument.sliceOf(bar),
            context.getArcSpectra().getSpectrum(bar), models.get(bar), lines, smoothing,
            configuration))
        .collect(Collectors.toList());

    XYSeries rmsSeries = new XYSeries("RMS");
    XYSeries countSeries = new XYSeries("Lines");
    for (BarSolution solution : solutions) {
      if (!solution.isSolved()) {
        logger.warn("Bar " + solution.getBarId() + " failed: " + solution.getFailureReason());
        context.markFailed(solution.getBarId(), solution.getFailureReason());
        continue;
      }
      logger.info("Bar " + solution.getBarId() + ": rms " + solution.getRms() + " A over "
          + solution.getLineCount() + " lines");
      rmsSeries.add(solution.getBarId(), solution.getRms());
      countSeries.add(solution.getBarId(), solution.getLineCount());
    }
    context.setBarSolutions(solutions);
    addPlot(new XYSeriesCollection(rmsSeries), "Solution RMS", "Bar", "RMS (A)");
    addPlot(new XYSeriesCollection(countSeries), "Lines used", "Bar", "Lines");

    for (BarSolution solution : solutions) {
      if (solution.isSolved()) {
        addDetailPlot(fitPlot(solution, context.getArcSpectra().getLength()),
            "Bar " + solution.getBarId() + " solution", "Row (px)", "Wavelength - central (A)");
      }
    }
  }

  /**
   * Difference between the final fit and the central model along the bar.
   */
  private static XYSeriesCollection fitPlot(BarSolution solution, int length) {
    XYSeries series = new XYSeries("Bar " + solution.getBarId());
    PhysicalDispersionModel model = solution.getCentralModel();
    for (int row = 0; row < length; ++row) {
      series.add(row, solution.getFit().value(row) - model.wavelengthAt(row));
    }
    return new XYSeriesCollection(series);
  }

  public List<BarSolution> getSolutions() {
    return solutions;
  }

  @Override
  String[] getDataStrings() {
    int solved = 0;
    double sum = 0.;
    for (BarSolution solution : solutions) {
      if (solution.isSolved()) {
        ++solved;
        sum += solution.getRms();
      }
    }
    String mean = solved > 0 ? DECIMAL_FORMAT.get().format(sum / solved) : "n/a";
    return new String[]{"Bars solved: " + solved + " of " + solutions.size()
        + "\nMean RMS: " + mean + " A"};
  }

  @Override
  public String getName() {
    return "Arc solution";
  }

  @Override
  public boolean hasEnoughData(final CalibrationContext context) {
    return context.getArcFrame() != null && context.getArcSpectra() != null
        && context.getCentralModels() != null && context.getLineList() != null;
  }
}
