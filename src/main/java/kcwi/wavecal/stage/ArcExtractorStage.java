package kcwi.wavecal.stage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import kcwi.wavecal.CalibrationException.ExtractionException;
import kcwi.wavecal.input.CalibrationContext;
import kcwi.wavecal.model.ArcSpectra;
import kcwi.wavecal.model.ControlPoint;
import kcwi.wavecal.model.ControlPointSet;
import kcwi.wavecal.utils.NumericUtils;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Rectifies the arc frame with the bar transform and extracts one spectrum per bar by taking,
 * for every row, the median across the bar's window on the rectified frame. Each spectrum has
 * its minimum away from the frame ends subtracted.
 */
public class ArcExtractorStage extends CalibrationStage {

  private static final Logger logger = Logger.getLogger(ArcExtractorStage.class);

  private ArcSpectra spectra;

  public ArcExtractorStage() {
    super();
  }

  /**
   * Extract bar spectra from a rectified arc frame.
   *
   * @param warped Rectified arc frame indexed [row][column]
   * @param referencePoints Control points on the reference row, one per bar
   * @param win Half-width of the extraction window
   * @param baselineTrim Rows excluded at each end when finding the baseline
   * @param expectedBars Number of bars the instrument has
   * @return one spectrum per bar, in bar order
   * @throws ExtractionException if the number of reference points is not the bar count
   */
  public static ArcSpectra extract(double[][] warped, List<ControlPoint> referencePoints,
      int win, int baselineTrim, int expectedBars) throws ExtractionException {
    if (referencePoints.size() != expectedBars) {
      throw new ExtractionException("Extracted " + referencePoints.size()
          + " arcs but the instrument has " + expectedBars + " bars");
    }
    List<ControlPoint> ordered = new ArrayList<>(referencePoints);
    ordered.sort(Comparator.comparingInt(ControlPoint::getBarId));

    int ny = warped.length;
    int nx = warped[0].length;
    int baseFirst = baselineTrim;
    int baseLast = ny - baselineTrim;
    if (baseLast <= baseFirst) {
      baseFirst = 0;
      baseLast = ny;
    }

    List<double[]> arcs = new ArrayList<>();
    for (ControlPoint point : ordered) {
      int xi = (int) (point.getDestinationX() + 0.5);
      int first = Math.max(0, xi - win);
      int last = Math.min(nx - 1, xi + win);
      double[] spectrum = NumericUtils.rowMedians(warped, first, last);
      double baseline = NumericUtils.nanMin(spectrum, baseFirst, baseLast);
      for (int row = 0; row < ny; ++row) {
        spectrum[row] -= baseline;
      }
      arcs.add(spectrum);
    }
    return new ArcSpectra(arcs);
  }

  @Override
  protected void backend(final CalibrationContext context) throws ExtractionException {
    ControlPointSet controlPoints = context.getControlPoints();

    fireStateChange("Rectifying arc frame...");
    double[][] warped = context.getTransform().warp(context.getArcFrame().getData());
    context.setWarpedArc(warped);

    fireStateChange("Extracting bar spectra...");
    spectra = extract(warped, controlPoints.getReferenceRowPoints(), controlPoints.getWindow(),
        context.getInstrument().getBaselineTrim(), context.getInstrument().getBarCount());
    context.setArcSpectra(spectra);
    logger.info("Extracted " + spectra.getBarCount() + " arc spectra of length "
        + spectra.getLength());

    int reference = context.getInstrument().getReferenceBar();
    XYSeries series = new XYSeries("Bar " + reference);
    double[] spectrum = spectra.getSpectrum(reference);
    for (int row = 0; row < spectrum.length; ++row) {
      series.add(row, spectrum[row]);
    }
    addPlot(new XYSeriesCollection(series), "Reference bar arc", "Row (px)", "Counts");
  }

  public ArcSpectra getSpectra() {
    return spectra;
  }

  @Override
  String[] getDataStrings() {
    return new String[]{"Arcs extracted: " + spectra.getBarCount()
        + "\nSpectrum length: " + spectra.getLength()};
  }

  @Override
  public String getName() {
    return "Arc extraction";
  }

  @Override
  public boolean hasEnoughData(final CalibrationContext context) {
    return context.getArcFrame() != null && context.getControlPoints() != null
        && context.getTransform() != null;
  }
}
