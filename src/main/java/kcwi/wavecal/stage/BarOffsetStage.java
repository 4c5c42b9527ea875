package kcwi.wavecal.stage;

import java.util.Arrays;
import java.util.stream.IntStream;
import kcwi.wavecal.CalibrationException.AlignmentException;
import kcwi.wavecal.input.CalibrationContext;
import kcwi.wavecal.model.ArcSpectra;
import kcwi.wavecal.utils.CorrelationUtils;
import kcwi.wavecal.utils.CorrelationUtils.CorrelationPeak;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Measures the pixel offset of each bar's arc spectrum relative to the reference bar by full
 * cross-correlation of the trimmed spectra. With the reference spectrum as the first argument
 * of the correlation, a bar whose lines sit k pixels higher than the reference gets offset -k.
 * A bar whose correlation has no peak is marked failed with offset 0; if that happens to the
 * reference bar itself nothing can be aligned and the stage fails.
 */
public class BarOffsetStage extends CalibrationStage {

  private static final Logger logger = Logger.getLogger(BarOffsetStage.class);

  private int[] offsets;
  private int failures;

  public BarOffsetStage() {
    super();
  }

  /**
   * Correlate a bar against the reference after trimming both ends of each spectrum.
   *
   * @param reference Reference bar spectrum
   * @param bar Spectrum to align
   * @param trim Samples removed from each end
   * @return correlation peak, whose lag is the bar's offset
   */
  public static CorrelationPeak offset(double[] reference, double[] bar, int trim) {
    double[] ref = Arrays.copyOfRange(reference, trim, reference.length - trim);
    double[] other = Arrays.copyOfRange(bar, trim, bar.length - trim);
    return CorrelationUtils.fullPeak(ref, other);
  }

  @Override
  protected void backend(final CalibrationContext context) throws AlignmentException {
    ArcSpectra spectra = context.getArcSpectra();
    int referenceBar = context.getInstrument().getReferenceBar();
    int trim = context.getInstrument().getAlignmentTrim();
    double[] reference = spectra.getSpectrum(referenceBar);
    if (reference.length <= 2 * trim) {
      throw new AlignmentException("Arc spectra of length " + reference.length
          + " are too short to trim by " + trim);
    }

    fireStateChange("Cross-correlating bars with bar " + referenceBar + "...");
    CorrelationPeak[] peaks = IntStream.range(0, spectra.getBarCount()).parallel()
        .mapToObj(bar -> offset(reference, spectra.getSpectrum(bar), trim))
        .toArray(CorrelationPeak[]::new);

    if (peaks[referenceBar].isFlat()) {
      throw new AlignmentException("Reference bar " + referenceBar
          + " has no correlation peak; arc spectrum is flat");
    }

    offsets = new int[peaks.length];
    failures = 0;
    for (int bar = 0; bar < peaks.length; ++bar) {
      if (peaks[bar].isFlat()) {
        logger.warn("Bar " + bar + " has no correlation peak against the reference bar");
        context.markFailed(bar, "No correlation peak against reference bar " + referenceBar);
        ++failures;
        offsets[bar] = 0;
        continue;
      }
      offsets[bar] = peaks[bar].getLag();
      logger.debug("Bar " + bar + " offset " + offsets[bar] + " px");
    }
    context.setBarOffsets(offsets);

    XYSeries series = new XYSeries("Offset to bar " + referenceBar);
    for (int bar = 0; bar < offsets.length; ++bar) {
      series.add(bar, offsets[bar]);
    }
    addPlot(new XYSeriesCollection(series), "Bar offsets", "Bar", "Offset (px)");
  }

  public int[] getOffsets() {
    return offsets;
  }

  @Override
  String[] getDataStrings() {
    int min = Arrays.stream(offsets).min().orElse(0);
    int max = Arrays.stream(offsets).max().orElse(0);
    return new String[]{"Offset range: " + min + " to " + max + " px"
        + "\nBars without a correlation peak: " + failures};
  }

  @Override
  public String getName() {
    return "Bar alignment";
  }

  @Override
  public boolean hasEnoughData(final CalibrationContext context) {
    return context.getArcSpectra() != null;
  }
}
