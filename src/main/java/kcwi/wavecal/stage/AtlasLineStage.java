package kcwi.wavecal.stage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import kcwi.wavecal.CalibrationException.FitException;
import kcwi.wavecal.input.CalibrationContext;
import kcwi.wavecal.model.AtlasLine;
import kcwi.wavecal.model.AtlasSpectrum;
import kcwi.wavecal.model.LineList;
import kcwi.wavecal.model.PhysicalDispersionModel;
import kcwi.wavecal.utils.NumericUtils;
import kcwi.wavecal.utils.PeakFinder;
import kcwi.wavecal.utils.PeakFinder.Peak;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.GaussianCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Picks the atlas lines the per-bar solutions are fit to. Only the wavelength range seen by
 * every modelled bar (less a margin at each end) is searched. Isolated peaks of about the
 * instrument's resolution are Gaussian-fit; lines whose fitted width is unusual for the set, or
 * whose Gaussian center disagrees with the peak of the sampled profile, are dropped. Kept lines
 * are placed at the peak of the sampled profile.
 */
public class AtlasLineStage extends CalibrationStage {

  private static final Logger logger = Logger.getLogger(AtlasLineStage.class);

  /**
   * Points used to resample a line profile when locating its peak.
   */
  static final int PROFILE_SAMPLES = 1000;

  private LineList lineList;
  private List<AtlasLine> rejected;

  public AtlasLineStage() {
    super();
  }

  /**
   * Wavelength range covered by every bar with a model, shrunk by a margin at each end.
   *
   * @param models Central models per bar, null for failed bars
   * @param length Spectrum length in pixels
   * @param margin Margin in Angstroms
   * @return {minimum, maximum} wavelength
   * @throws FitException if no bar has a model or the bars share no wavelengths
   */
  public static double[] commonRange(List<PhysicalDispersionModel> models, int length,
      double margin) throws FitException {
    double[] pixels = new double[length];
    for (int i = 0; i < length; ++i) {
      pixels[i] = i;
    }
    double lower = Double.NEGATIVE_INFINITY;
    double upper = Double.POSITIVE_INFINITY;
    int modelled = 0;
    for (PhysicalDispersionModel model : models) {
      if (model == null) {
        continue;
      }
      double[] waves = NumericUtils.polyval(model.getPixelCoefficients(), pixels);
      double min = Arrays.stream(waves).min().getAsDouble();
      double max = Arrays.stream(waves).max().getAsDouble();
      lower = Math.max(lower, min);
      upper = Math.min(upper, max);
      ++modelled;
    }
    if (modelled == 0) {
      throw new FitException("No bar has a central wavelength model");
    }
    lower += margin;
    upper -= margin;
    if (upper <= lower) {
      throw new FitException("Bars share no wavelength range (" + lower + " to " + upper + ")");
    }
    return new double[]{lower, upper};
  }

  /**
   * Find, fit, and filter atlas lines in a wavelength range.
   *
   * @param atlas Atlas convolved to the instrument resolution
   * @param minWave Lower end of the range (A)
   * @param maxWave Upper end of the range (A)
   * @param clipSigma Sigma-clip threshold applied to fitted widths
   * @param clipIterations Sigma-clip passes
   * @param peakTolerance Largest accepted offset between Gaussian center and profile peak (A)
   * @param rejectedOut Collects lines that were fit but dropped; may be null
   * @return accepted lines
   * @throws FitException if the range does not overlap the atlas
   */
  public static LineList extractLines(AtlasSpectrum atlas, double minWave, double maxWave,
      double clipSigma, int clipIterations, double peakTolerance, List<AtlasLine> rejectedOut)
      throws FitException {
    int first = atlas.firstIndexAtOrAbove(minWave);
    int last = atlas.lastIndexAtOrBelow(maxWave);
    if (first < 0 || last - first < 3) {
      throw new FitException("Atlas does not cover " + minWave + " to " + maxWave + " A");
    }
    double[] waves = Arrays.copyOfRange(atlas.getWavelengths(), first, last);
    double[] flux = Arrays.copyOfRange(atlas.getFlux(), first, last);
    double resolution = atlas.getResolutionPixels();

    List<Peak> peaks = new PeakFinder()
        .setDistance(resolution * 4.)
        .setWidthRange(resolution * 0.5, resolution * 3.)
        .find(flux);
    logger.info("Found " + peaks.size() + " atlas peaks between " + minWave + " and "
        + maxWave + " A");

    List<double[]> fits = new ArrayList<>();
    List<int[]> windows = new ArrayList<>();
    for (Peak peak : peaks) {
      int x0 = Math.max(0, (int) (peak.getLeftPosition() + 0.5) - 1);
      int x1 = Math.min(flux.length, (int) (peak.getRightPosition() + 0.5) + 2);
      WeightedObservedPoints points = new WeightedObservedPoints();
      for (int i = x0; i < x1; ++i) {
        points.add(waves[i], flux[i]);
      }
      try {
        double[] fit = GaussianCurveFitter.create()
            .withStartPoint(new double[]{peak.getHeight(), waves[peak.getIndex()], 1.})
            .fit(points.toList());
        fit[2] = Math.abs(fit[2]);
        fits.add(fit);
        windows.add(new int[]{x0, x1});
      } catch (MathIllegalStateException | MathIllegalArgumentException e) {
        logger.debug("Gaussian fit failed for atlas peak at " + waves[peak.getIndex()] + " A: "
            + e.getMessage());
      }
    }

    double[] sigmas = new double[fits.size()];
    for (int i = 0; i < sigmas.length; ++i) {
      sigmas[i] = fits.get(i)[2];
    }
    double[] bounds = NumericUtils.sigmaClipBounds(sigmas, clipSigma, clipSigma, clipIterations);
    logger.info("Line width band: " + bounds[0] + " to " + bounds[1] + " A");

    List<AtlasLine> lines = new ArrayList<>();
    for (int i = 0; i < fits.size(); ++i) {
      double[] fit = fits.get(i);
      if (fit[2] < bounds[0] || fit[2] > bounds[1]) {
        logger.debug("Rejected atlas line at " + fit[1] + " A: width " + fit[2]
            + " outside band");
        reject(rejectedOut, fit);
        continue;
      }
      int[] window = windows.get(i);
      double[] xs = Arrays.copyOfRange(waves, window[0], window[1]);
      double[] ys = Arrays.copyOfRange(flux, window[0], window[1]);
      double[] fine = NumericUtils.linspace(xs[0], xs[xs.length - 1], PROFILE_SAMPLES);
      double[] profile = NumericUtils.interpolate(xs, ys, fine);
      double peak = fine[NumericUtils.argmax(profile)];
      if (Math.abs(fit[1] - peak) > peakTolerance) {
        logger.debug("Rejected atlas line at " + fit[1] + " A: peak at " + peak);
        reject(rejectedOut, fit);
        continue;
      }
      lines.add(new AtlasLine(peak, fit[0], fit[2]));
    }
    logger.info("Kept " + lines.size() + " of " + fits.size() + " fitted atlas lines");
    return new LineList(lines, minWave, maxWave);
  }

  private static void reject(List<AtlasLine> rejectedOut, double[] fit) {
    if (rejectedOut != null) {
      rejectedOut.add(new AtlasLine(fit[1], fit[0], fit[2]));
    }
  }

  @Override
  protected void backend(final CalibrationContext context) throws FitException {
    AtlasSpectrum atlas = context.getAtlas();
    fireStateChange("Finding wavelength range common to all bars...");
    double[] range = commonRange(context.getCentralModels(),
        context.getArcSpectra().getLength(), context.getInstrument().getAtlasMargin());

    fireStateChange("Fitting atlas lines...");
    rejected = new ArrayList<>();
    lineList = extractLines(atlas, range[0], range[1],
        context.getConfiguration().getWidthClipSigma(),
        context.getConfiguration().getWidthClipIterations(),
        context.getConfiguration().getAtlasPeakTolerance(), rejected);
    context.setLineList(lineList);

    XYSeries atlasSeries = new XYSeries("Atlas");
    double[] waves = atlas.getWavelengths();
    double[] flux = atlas.getFlux();
    int first = Math.max(0, atlas.firstIndexAtOrAbove(range[0]));
    int last = atlas.lastIndexAtOrBelow(range[1]);
    for (int i = first; i <= last; ++i) {
      atlasSeries.add(waves[i], flux[i]);
    }
    XYSeries kept = new XYSeries("Kept lines");
    for (AtlasLine line : lineList.getLines()) {
      kept.add(line.getWavelength(), line.getAmplitude());
    }
    XYSeries dropped = new XYSeries("Rejected lines");
    for (AtlasLine line : rejected) {
      dropped.add(line.getWavelength(), line.getAmplitude());
    }
    XYSeriesCollection xysc = new XYSeriesCollection();
    xysc.addSeries(atlasSeries);
    xysc.addSeries(kept);
    xysc.addSeries(dropped);
    addPlot(xysc, "Atlas lines", "Wavelength (A)", "Flux");
  }

  public LineList getLineList() {
    return lineList;
  }

  public List<AtlasLine> getRejected() {
    return rejected;
  }

  @Override
  String[] getDataStrings() {
    return new String[]{"Atlas lines: " + lineList.size() + " kept, " + rejected.size()
        + " rejected\nRange: " + DECIMAL_FORMAT.get().format(lineList.getMinWavelength())
        + " to " + DECIMAL_FORMAT.get().format(lineList.getMaxWavelength()) + " A"};
  }

  @Override
  public String getName() {
    return "Atlas lines";
  }

  @Override
  public boolean hasEnoughData(final CalibrationContext context) {
    return context.getAtlas() != null && context.getCentralModels() != null
        && context.getArcSpectra() != null;
  }
}
