package kcwi.wavecal.stage;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import kcwi.wavecal.CalibrationException.FitException;
import kcwi.wavecal.input.CalibrationContext;
import kcwi.wavecal.input.Frame;
import kcwi.wavecal.input.Instrument;
import kcwi.wavecal.model.ArcSpectra;
import kcwi.wavecal.model.AtlasAlignment;
import kcwi.wavecal.model.AtlasSpectrum;
import kcwi.wavecal.model.PhysicalDispersionModel;
import kcwi.wavecal.utils.CorrelationUtils;
import kcwi.wavecal.utils.CorrelationUtils.CorrelationPeak;
import kcwi.wavecal.utils.NumericUtils;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Refines each bar's zero point and linear dispersion over the central rows. For a grid of
 * trial dispersions around the preliminary one, the grating-equation model is used to put the
 * bar's central spectrum on the atlas wavelength grid and the two are cross-correlated. The
 * correlation peak value and lag, as functions of trial dispersion, are spline-resampled; the
 * dispersion with the highest peak is kept and the zero point is corrected by the lag there.
 *
 * Bars are refined in parallel. A bar that cannot be refined is marked failed and has no model;
 * the other bars are unaffected.
 */
public class CentralFitStage extends CalibrationStage {

  private static final Logger logger = Logger.getLogger(CentralFitStage.class);

  /**
   * Resampled points per trial dispersion when locating the best dispersion.
   */
  static final int RESAMPLE_FACTOR = 100;

  private List<PhysicalDispersionModel> models;
  private DispersionScan referenceScan;
  private int trialCount;
  private int failures;

  public CentralFitStage() {
    super();
  }

  /**
   * Correlation peak value and lag at each trial dispersion for one bar.
   */
  public static class DispersionScan {

    private final double[] dispersions;
    private final double[] maxima;
    private final double[] lags;

    DispersionScan(double[] dispersions, double[] maxima, double[] lags) {
      this.dispersions = dispersions;
      this.maxima = maxima;
      this.lags = lags;
    }

    public double[] getDispersions() {
      return dispersions;
    }

    public double[] getMaxima() {
      return maxima;
    }

    /**
     * @return correlation lags in atlas samples
     */
    public double[] getLags() {
      return lags;
    }
  }

  /**
   * Number of dispersion steps, chosen so each step moves the ends of the central range by
   * about an atlas sample, and kept between 10 and 25.
   */
  public static int trialCount(double dispersion, double atlasDispersion, int minRow,
      int maxRow, double fraction) {
    int count = (int) (fraction * Math.abs(dispersion) / atlasDispersion
        * (maxRow - minRow) / 3.);
    return Math.max(10, Math.min(25, count));
  }

  /**
   * Trial dispersions spanning the preliminary dispersion plus or minus the given fraction.
   *
   * @param dispersion Preliminary dispersion
   * @param count Number of steps; count + 1 values are returned
   * @param fraction Half-range as a fraction of the dispersion
   * @return trial dispersions, evenly spaced
   */
  public static double[] trialDispersions(double dispersion, int count, double fraction) {
    double[] out = new double[count + 1];
    for (int i = 0; i <= count; ++i) {
      out[i] = dispersion * (1. + fraction * (i - count / 2.) * 2. / count);
    }
    return out;
  }

  /**
   * Correlate one bar against the atlas for every trial dispersion.
   *
   * @param spectrum Bar spectrum
   * @param zeroPoint Trial zero point at the reference pixel (A)
   * @param dispersions Trial dispersions
   * @param atlas Atlas convolved to the instrument resolution
   * @param alignment Alignment giving the central rows and reference pixel
   * @param pixelScale Binned pixel size (mm)
   * @param rho Grating density (lines/um)
   * @param focalLength Camera focal length (mm)
   * @param taperFraction Tukey window fraction
   * @param deadlineNanos System.nanoTime() value after which the scan is abandoned
   * @return correlation results per trial
   * @throws FitException if the bar does not overlap the atlas, does not correlate, or runs
   *     past the deadline
   */
  public static DispersionScan scan(double[] spectrum, double zeroPoint, double[] dispersions,
      AtlasSpectrum atlas, AtlasAlignment alignment, double pixelScale, double rho,
      double focalLength, double taperFraction, long deadlineNanos) throws FitException {
    int minRow = alignment.getMinRow();
    int maxRow = alignment.getMaxRow();
    double x0 = alignment.getReferencePixel();
    double[] xvals = alignment.centeredAxis(spectrum.length);
    double[] subX = Arrays.copyOfRange(xvals, minRow, maxRow);
    double[] subSpectrum = Arrays.copyOfRange(spectrum, minRow, maxRow);
    double[] atlasWaves = atlas.getWavelengths();
    double[] atlasFlux = atlas.getFlux();

    double[] maxima = new double[dispersions.length];
    double[] lags = new double[dispersions.length];
    for (int i = 0; i < dispersions.length; ++i) {
      if (System.nanoTime() - deadlineNanos > 0) {
        throw new FitException("Central fit exceeded its time budget");
      }
      double[] coeffs = PhysicalDispersionModel.fromGratingEquation(zeroPoint, dispersions[i],
          pixelScale, rho, focalLength, x0).getCoefficients();
      double wave0 = NumericUtils.polyval(coeffs, xvals[minRow]);
      double wave1 = NumericUtils.polyval(coeffs, xvals[maxRow]);
      int first = atlas.firstIndexAtOrAbove(Math.min(wave0, wave1));
      int last = atlas.lastIndexAtOrBelow(Math.max(wave0, wave1));
      if (first < 0 || last - first < 4) {
        throw new FitException("No atlas coverage between " + Math.min(wave0, wave1)
            + " and " + Math.max(wave0, wave1) + " A");
      }
      double[] subWaves = Arrays.copyOfRange(atlasWaves, first, last);
      double[] taper = NumericUtils.tukeyWindow(subWaves.length, taperFraction);
      double[] subAtlas = NumericUtils.multiply(Arrays.copyOfRange(atlasFlux, first, last), taper);
      double[] waves = NumericUtils.polyval(coeffs, subX);
      double[] resampled = NumericUtils.multiply(
          NumericUtils.interpolate(waves, subSpectrum, subWaves), taper);

      CorrelationPeak peak = CorrelationUtils.centralThirdPeak(resampled, subAtlas);
      if (peak.isFlat()) {
        throw new FitException("Spectrum does not correlate with the atlas at dispersion "
            + dispersions[i]);
      }
      maxima[i] = peak.getValue();
      lags[i] = peak.getLag();
    }
    return new DispersionScan(dispersions.clone(), maxima, lags);
  }

  /**
   * Pick the best model from a scan: resample the peak and lag curves and take the dispersion
   * with the highest resampled peak.
   *
   * @param scan Correlation results per trial
   * @param zeroPoint Zero point the scan was made with (A)
   * @param atlasDispersion Atlas sample spacing (A)
   * @param pixelScale Binned pixel size (mm)
   * @param rho Grating density (lines/um)
   * @param focalLength Camera focal length (mm)
   * @param referencePixel Pixel the model is expanded about
   * @return refined model
   */
  public static PhysicalDispersionModel bestModel(DispersionScan scan, double zeroPoint,
      double atlasDispersion, double pixelScale, double rho, double focalLength,
      double referencePixel) {
    double[] dispersions = scan.getDispersions();
    double low = Arrays.stream(dispersions).min().getAsDouble();
    double high = Arrays.stream(dispersions).max().getAsDouble();
    int steps = (dispersions.length - 1) * RESAMPLE_FACTOR;
    double[] fine = NumericUtils.linspace(low, high, steps);
    double[] maxima = NumericUtils.interpolate(dispersions, scan.getMaxima(), fine);
    double[] lags = NumericUtils.interpolate(dispersions, scan.getLags(), fine);
    int best = NumericUtils.argmax(maxima);
    double shift = lags[best] * atlasDispersion;
    return PhysicalDispersionModel.fromGratingEquation(zeroPoint - shift, fine[best],
        pixelScale, rho, focalLength, referencePixel);
  }

  @Override
  protected void backend(final CalibrationContext context) {
    Frame frame = context.getArcFrame();
    Instrument instrument = context.getInstrument();
    ArcSpectra spectra = context.getArcSpectra();
    int[] offsets = context.getBarOffsets();
    AtlasSpectrum atlas = context.getAtlas();
    AtlasAlignment alignment = context.getAtlasAlignment();
    double dispersion = context.getPreliminaryDispersion();
    double fraction = context.getConfiguration().getDispersionSearchFraction();
    double pixelScale = instrument.getPixelSize() * frame.getYBinning();
    double cwave = frame.getCentralWavelength();

    trialCount = trialCount(dispersion, atlas.getDispersion(), alignment.getMinRow(),
        alignment.getMaxRow(), fraction);
    double[] dispersions = trialDispersions(dispersion, trialCount, fraction);
    logger.info("Scanning " + dispersions.length + " trial dispersions");

    double budget = context.getConfiguration().getCentralFitBudgetSeconds();
    long deadline = budget > 0. ?
        System.nanoTime() + (long) (budget * TimeUnit.SECONDS.toNanos(1)) :
        System.nanoTime() + Long.MAX_VALUE / 2;

    int referenceBar = instrument.getReferenceBar();
    DispersionScan[] scans = new DispersionScan[spectra.getBarCount()];
    fireStateChange("Refining central dispersion for " + spectra.getBarCount() + " bars...");
    models = IntStream.range(0, spectra.getBarCount()).parallel().mapToObj(bar -> {
      if (context.isFailed(bar)) {
        return null;
      }
      double zeroPoint = cwave + offsets[bar] * dispersion - alignment.getOffsetWavelength();
      try {
        DispersionScan scan = scan(spectra.getSpectrum(bar), zeroPoint, dispersions, atlas,
            alignment, pixelScale, frame.getRho(), instrument.getFocalLength(),
            frame.getTaperFraction(), deadline);
        scans[bar] = scan;
        PhysicalDispersionModel model = bestModel(scan, zeroPoint, atlas.getDispersion(),
            pixelScale, frame.getRho(), instrument.getFocalLength(),
            alignment.getReferencePixel());
        logger.debug("Central fit bar " + bar + ": dispersion " + model.getDispersion()
            + ", zero point " + model.getZeroPoint());
        return model;
      } catch (FitException e) {
        logger.warn("Central fit failed for bar " + bar + ": " + e.getMessage());
        context.markFailed(bar, "Central fit: " + e.getMessage());
        return null;
      }
    }).collect(Collectors.toList());
    context.setCentralModels(models);
    referenceScan = scans[referenceBar];

    failures = 0;
    XYSeries dispersionSeries = new XYSeries("Central dispersion");
    XYSeries zeroSeries = new XYSeries("Zero point");
    for (int bar = 0; bar < models.size(); ++bar) {
      PhysicalDispersionModel model = models.get(bar);
      if (model == null) {
        ++failures;
        continue;
      }
      dispersionSeries.add(bar, model.getDispersion());
      zeroSeries.add(bar, model.getZeroPoint());
    }
    logger.info("Central fit done, " + failures + " bars failed");
    addPlot(new XYSeriesCollection(dispersionSeries), "Central dispersion", "Bar",
        "Dispersion (A/px)");
    addPlot(new XYSeriesCollection(zeroSeries), "Central wavelength", "Bar", "Wavelength (A)");

    if (referenceScan != null) {
      XYSeries scanSeries = new XYSeries("Bar " + referenceBar);
      for (int i = 0; i < referenceScan.getDispersions().length; ++i) {
        scanSeries.add(referenceScan.getDispersions()[i], referenceScan.getMaxima()[i]);
      }
      addDetailPlot(new XYSeriesCollection(scanSeries), "Dispersion scan",
          "Dispersion (A/px)", "Correlation peak");
    }
  }

  public List<PhysicalDispersionModel> getModels() {
    return models;
  }

  /**
   * @return scan of the reference bar, null if that bar failed
   */
  public DispersionScan getReferenceScan() {
    return referenceScan;
  }

  @Override
  String[] getDataStrings() {
    StringBuilder sb = new StringBuilder();
    sb.append("Trial dispersions: ").append(trialCount + 1);
    sb.append("\nBars refined: ").append(models.size() - failures);
    sb.append("\nBars failed: ").append(failures);
    return new String[]{sb.toString()};
  }

  @Override
  public String getName() {
    return "Central fit";
  }

  @Override
  public boolean hasEnoughData(final CalibrationContext context) {
    return context.getArcSpectra() != null && context.getBarOffsets() != null
        && context.getAtlas() != null && context.getAtlasAlignment() != null;
  }
}
