package kcwi.wavecal.stage;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import kcwi.wavecal.CalibrationException.GeometryException;
import kcwi.wavecal.input.CalibrationContext;
import kcwi.wavecal.input.Frame;
import kcwi.wavecal.input.Instrument;
import kcwi.wavecal.model.BarLocation;
import kcwi.wavecal.model.ControlPoint;
import kcwi.wavecal.model.ControlPointSet;
import kcwi.wavecal.utils.NumericUtils;
import kcwi.wavecal.utils.PolynomialTransform;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Follows each bar up and down the bars frame from its reference-row centroid, producing
 * control points that pair where a bar is on the detector with where it would be if the
 * bars were perfectly vertical. A polynomial transform mapping nominal positions onto detector
 * positions is then fit to all the control points.
 *
 * At each sample row a square block around the bar's last accepted position is collapsed by a
 * column median and centroided; tracing in a direction stops at the first sample whose peak
 * is not above the trace threshold, or when the block would leave the frame.
 */
public class BarTracerStage extends CalibrationStage {

  private static final Logger logger = Logger.getLogger(BarTracerStage.class);

  private ControlPointSet controlPoints;
  private PolynomialTransform transform;

  public BarTracerStage() {
    super();
  }

  /**
   * Trace one bar in both directions from the reference row.
   *
   * @param data Bars frame indexed [row][column]
   * @param barId Bar index
   * @param sliceId Slice the bar belongs to
   * @param centroid Bar position on the reference row
   * @param referenceRow Row the centroid was measured on
   * @param win Half-width of the sampling block
   * @param spacing Rows between samples
   * @param threshold Minimum block peak (after minimum subtraction) for a sample to count
   * @return control points in ascending row order
   */
  public static List<ControlPoint> traceBar(double[][] data, int barId, int sliceId,
      double centroid, int referenceRow, int win, int spacing, double threshold) {
    int ny = data.length;
    int nx = data[0].length;

    List<ControlPoint> below = new ArrayList<>();
    double previous = centroid;
    for (int row = referenceRow - spacing; row >= win; row -= spacing) {
      double x = sample(data, row, previous, win, nx, threshold);
      if (Double.isNaN(x)) {
        break;
      }
      below.add(new ControlPoint(barId, sliceId, x, row, centroid, row));
      previous = x;
    }

    List<ControlPoint> points = new ArrayList<>();
    for (int i = below.size() - 1; i >= 0; --i) {
      points.add(below.get(i));
    }
    points.add(new ControlPoint(barId, sliceId, centroid, referenceRow, centroid, referenceRow));

    previous = centroid;
    for (int row = referenceRow + spacing; row < ny - win; row += spacing) {
      double x = sample(data, row, previous, win, nx, threshold);
      if (Double.isNaN(x)) {
        break;
      }
      points.add(new ControlPoint(barId, sliceId, x, row, centroid, row));
      previous = x;
    }
    return points;
  }

  /**
   * Centroid of the bar at one sample row, NaN if the sample is rejected.
   */
  private static double sample(double[][] data, int row, double previousX, int win, int nx,
      double threshold) {
    int xi = (int) (previousX + 0.5);
    if (xi - win < 0 || xi + win > nx - 1) {
      logger.debug("Trace stopped at row " + row + ": window leaves the frame at x=" + xi);
      return Double.NaN;
    }
    double[] ys = NumericUtils.columnMedians(data, row - win, row + win, xi - win, xi + win);
    double[] xs = new double[ys.length];
    double min = NumericUtils.nanMin(ys, 0, ys.length);
    double max = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < ys.length; ++i) {
      xs[i] = xi - win + i;
      ys[i] -= min;
      max = Math.max(max, ys[i]);
    }
    if (!(max > threshold)) {
      logger.debug("Trace stopped at row " + row + ": peak " + max + " not above " + threshold);
      return Double.NaN;
    }
    return NumericUtils.centroid(xs, ys);
  }

  @Override
  protected void backend(final CalibrationContext context) throws GeometryException {
    BarLocation location = context.getBarLocation();
    if (!location.isValid()) {
      throw new GeometryException("Cannot trace bars: the locator did not find "
          + context.getInstrument().getBarCount() + " bars");
    }
    Frame frame = context.getBarsFrame();
    Instrument instrument = context.getInstrument();
    double[][] data = frame.getData();
    int win = location.getWindow();
    int midRow = location.getReferenceRow();
    int spacing = Math.max(1, instrument.getSampleSpacing() / frame.getYBinning());
    double threshold = context.getConfiguration().getTraceThreshold();

    fireStateChange("Tracing " + location.getBarCount() + " bars...");
    List<List<ControlPoint>> traces = IntStream.range(0, location.getBarCount()).parallel()
        .mapToObj(bar -> traceBar(data, bar, instrument.sliceOf(bar), location.getCentroid(bar),
            midRow, win, spacing, threshold))
        .collect(Collectors.toList());

    List<ControlPoint> points = new ArrayList<>();
    for (List<ControlPoint> trace : traces) {
      points.addAll(trace);
    }
    controlPoints = new ControlPointSet(points, midRow, win);
    logger.info("Traced " + points.size() + " control points over " + traces.size() + " bars");

    fireStateChange("Fitting spatial transform...");
    transform = controlPoints.fitTransform(instrument.getTransformOrder());
    context.setControlPoints(controlPoints);
    context.setTransform(transform);

    XYSeries detector = new XYSeries("Detector position", false, true);
    XYSeries nominal = new XYSeries("Nominal position", false, true);
    for (ControlPoint point : points) {
      detector.add(point.getSourceX(), point.getSourceY());
      nominal.add(point.getDestinationX(), point.getDestinationY());
    }
    XYSeriesCollection xysc = new XYSeriesCollection();
    xysc.addSeries(detector);
    xysc.addSeries(nominal);
    addPlot(xysc, "Bar traces", "Column (px)", "Row (px)");
  }

  public ControlPointSet getControlPoints() {
    return controlPoints;
  }

  public PolynomialTransform getTransform() {
    return transform;
  }

  @Override
  String[] getDataStrings() {
    return new String[]{"Control points: " + controlPoints.size()
        + "\nTransform order: " + transform.getOrder()};
  }

  @Override
  public String getName() {
    return "Bar tracing";
  }

  @Override
  public boolean hasEnoughData(final CalibrationContext context) {
    return context.getBarsFrame() != null && context.getBarLocation() != null;
  }
}
