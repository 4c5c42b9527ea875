package kcwi.wavecal.stage;

import java.util.Arrays;
import kcwi.wavecal.CalibrationException;
import kcwi.wavecal.CalibrationException.AlignmentException;
import kcwi.wavecal.input.AtlasLoader;
import kcwi.wavecal.input.CalibrationContext;
import kcwi.wavecal.input.Frame;
import kcwi.wavecal.model.AtlasAlignment;
import kcwi.wavecal.model.AtlasSpectrum;
import kcwi.wavecal.utils.CorrelationUtils;
import kcwi.wavecal.utils.CorrelationUtils.CorrelationPeak;
import kcwi.wavecal.utils.NumericUtils;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Registers the reference bar's arc spectrum against the lamp atlas. The atlas is smoothed to
 * the arc frame's resolution, the reference spectrum is placed on a linear wavelength axis from
 * the central wavelength and the preliminary dispersion, and the central part of that spectrum
 * is resampled onto the atlas grid and cross-correlated with it. The lag of the correlation peak
 * gives the wavelength offset of the preliminary axis.
 *
 * The atlas is taken from the context if one was supplied, otherwise it is read from the
 * configured atlas folder for the arc frame's lamp.
 */
public class AtlasAlignStage extends CalibrationStage {

  private static final Logger logger = Logger.getLogger(AtlasAlignStage.class);

  private AtlasAlignment alignment;
  private AtlasSpectrum atlas;

  public AtlasAlignStage() {
    super();
  }

  /**
   * Central pixel range used for alignment, as {first, last}. Low-dispersion gratings cover
   * more of the atlas per pixel and use a wider range.
   */
  public static int[] centralRange(int length, boolean lowDispersion) {
    if (lowDispersion) {
      return new int[]{length / 5, 4 * length / 5};
    }
    return new int[]{length / 3, 2 * length / 3};
  }

  /**
   * Align a spectrum to an atlas.
   *
   * @param spectrum Reference bar spectrum
   * @param atlas Atlas already convolved to the instrument resolution
   * @param centralWavelength Wavelength at the spectrum's center (A)
   * @param dispersion Preliminary dispersion (A/px)
   * @param lowDispersion True to use the wider central range
   * @param taperFraction Tukey window fraction
   * @return the alignment
   * @throws AlignmentException if the spectrum and atlas do not overlap or nothing correlates
   */
  public static AtlasAlignment align(double[] spectrum, AtlasSpectrum atlas,
      double centralWavelength, double dispersion, boolean lowDispersion, double taperFraction)
      throws AlignmentException {
    int n = spectrum.length;
    double x0 = n / 2;
    double[] observed = new double[n];
    for (int i = 0; i < n; ++i) {
      observed[i] = (i - x0) * dispersion + centralWavelength;
    }
    int[] range = centralRange(n, lowDispersion);
    int minRow = range[0];
    int maxRow = range[1];
    double minWave = Math.min(observed[minRow], observed[maxRow]);
    double maxWave = Math.max(observed[minRow], observed[maxRow]);

    int first = atlas.firstIndexAtOrAbove(minWave);
    int last = atlas.lastIndexAtOrBelow(maxWave);
    if (first < 0 || last - first < 4) {
      throw new AlignmentException("Atlas does not cover " + minWave + " to " + maxWave + " A");
    }
    double[] atlasWaves = Arrays.copyOfRange(atlas.getWavelengths(), first, last);
    double[] atlasFlux = Arrays.copyOfRange(atlas.getFlux(), first, last);

    double[] subWaves = Arrays.copyOfRange(observed, minRow, maxRow + 1);
    double[] subSpectrum = Arrays.copyOfRange(spectrum, minRow, maxRow + 1);
    double[] resampled = NumericUtils.interpolate(subWaves, subSpectrum, atlasWaves);

    double[] taper = NumericUtils.tukeyWindow(atlasWaves.length, taperFraction);
    CorrelationPeak peak = CorrelationUtils.centralThirdPeak(
        NumericUtils.multiply(resampled, taper), NumericUtils.multiply(atlasFlux, taper));
    if (peak.isFlat()) {
      throw new AlignmentException("No correlation peak between reference arc and atlas");
    }
    double offsetWavelength = peak.getLag() * atlas.getDispersion();
    logger.info("Atlas offset: " + peak.getLag() + " atlas px, " + offsetWavelength + " A");
    return new AtlasAlignment(peak.getLag(), offsetWavelength, x0, minRow, maxRow, dispersion);
  }

  @Override
  protected void backend(final CalibrationContext context) throws CalibrationException {
    Frame frame = context.getArcFrame();
    AtlasSpectrum reference = context.getReferenceAtlas();
    if (reference == null) {
      fireStateChange("Reading atlas for lamp " + frame.getLamp() + "...");
      reference = new AtlasLoader(context.getConfiguration().getAtlasFolder())
          .load(frame.getLamp());
      context.setReferenceAtlas(reference);
    }

    fireStateChange("Convolving atlas to instrument resolution...");
    double cwave = frame.getCentralWavelength();
    atlas = reference.convolvedTo(frame.resolution(cwave));
    context.setAtlas(atlas);
    logger.info("Atlas resolution: " + atlas.getResolutionPixels() + " atlas px");

    fireStateChange("Cross-correlating reference bar with atlas...");
    double[] spectrum = context.getArcSpectra()
        .getSpectrum(context.getInstrument().getReferenceBar());
    alignment = align(spectrum, atlas, cwave, context.getPreliminaryDispersion(),
        frame.getGrating().isLowDispersion(), frame.getTaperFraction());
    context.setAtlasAlignment(alignment);

    // plot the reference arc on the corrected preliminary axis against the atlas
    XYSeries observed = new XYSeries("Reference bar");
    double peak = 0.;
    for (double value : spectrum) {
      peak = Math.max(peak, value);
    }
    double disp = alignment.getPreliminaryDispersion();
    for (int i = alignment.getMinRow(); i <= alignment.getMaxRow(); ++i) {
      double wave = (i - alignment.getReferencePixel()) * disp + cwave
          - alignment.getOffsetWavelength();
      observed.add(wave, peak > 0 ? spectrum[i] / peak : spectrum[i]);
    }
    XYSeries atlasSeries = new XYSeries("Atlas");
    double[] waves = atlas.getWavelengths();
    double[] flux = atlas.getFlux();
    int first = Math.max(0, atlas.firstIndexAtOrAbove(observed.getMinX()));
    int last = atlas.lastIndexAtOrBelow(observed.getMaxX());
    double atlasPeak = 0.;
    for (int i = first; i <= last; ++i) {
      atlasPeak = Math.max(atlasPeak, flux[i]);
    }
    for (int i = first; i <= last; ++i) {
      atlasSeries.add(waves[i], atlasPeak > 0 ? flux[i] / atlasPeak : flux[i]);
    }
    XYSeriesCollection xysc = new XYSeriesCollection();
    xysc.addSeries(observed);
    xysc.addSeries(atlasSeries);
    addPlot(xysc, "Atlas alignment", "Wavelength (A)", "Relative flux");
  }

  public AtlasAlignment getAlignment() {
    return alignment;
  }

  @Override
  String[] getDataStrings() {
    return new String[]{"Atlas lamp: " + atlas.getLamp()
        + "\nAtlas offset: " + alignment.getOffsetPixels() + " px ("
        + DECIMAL_FORMAT.get().format(alignment.getOffsetWavelength()) + " A)"
        + "\nCentral rows: " + alignment.getMinRow() + " to " + alignment.getMaxRow()};
  }

  @Override
  public String getName() {
    return "Atlas alignment";
  }

  @Override
  public boolean hasEnoughData(final CalibrationContext context) {
    return context.getArcFrame() != null && context.getArcSpectra() != null
        && !Double.isNaN(context.getPreliminaryDispersion());
  }
}
