package kcwi.wavecal.stage;

import java.util.Arrays;
import java.util.List;
import kcwi.wavecal.input.CalibrationContext;
import kcwi.wavecal.input.Frame;
import kcwi.wavecal.model.BarLocation;
import kcwi.wavecal.utils.NumericUtils;
import kcwi.wavecal.utils.PeakFinder;
import kcwi.wavecal.utils.PeakFinder.Peak;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Finds the x position of every bar along the middle row of the continuum bars frame.
 * The rows around the middle of the frame are collapsed by a column median into a profile,
 * local maxima above the profile mean are taken as bars, and each bar's position is refined to
 * a flux-weighted centroid. If the number of bars found is not the number the instrument has,
 * the result holds no centroids; the tracer refuses to proceed from such a result.
 */
public class BarLocatorStage extends CalibrationStage {

  private static final Logger logger = Logger.getLogger(BarLocatorStage.class);

  private BarLocation location;
  private int peaksFound;

  public BarLocatorStage() {
    super();
  }

  /**
   * Locate bars in a frame.
   *
   * @param data Bars frame indexed [row][column]
   * @param yBinning Binning along the rows
   * @param halfWidth Unbinned half-width of the row band and centroid window
   * @param expectedBars Number of bars the instrument has
   * @return location of the bars; empty if the count did not match
   */
  public static BarLocation locate(double[][] data, int yBinning, int halfWidth,
      int expectedBars) {
    int win = halfWidth / yBinning;
    int midRow = data.length / 2;
    double[] profile = profile(data, midRow, win);
    List<Peak> peaks = findBars(profile);

    if (peaks.size() != expectedBars) {
      logger.error("Did not find all bars: found " + peaks.size() + ", expected "
          + expectedBars);
      return new BarLocation(new double[]{}, midRow, win);
    }

    int nx = profile.length;
    double[] centroids = new double[peaks.size()];
    for (int bar = 0; bar < peaks.size(); ++bar) {
      int peak = peaks.get(bar).getIndex();
      int first = Math.max(0, peak - win);
      int last = Math.min(nx - 1, peak + win);
      centroids[bar] = windowCentroid(profile, first, last);
    }
    logger.info("Found " + centroids.length + " bars on row " + midRow);
    return new BarLocation(centroids, midRow, win);
  }

  /**
   * Column medians over the rows within win of the middle row.
   */
  static double[] profile(double[][] data, int midRow, int win) {
    return NumericUtils.columnMedians(data, midRow - win, midRow + win, 0, data[0].length - 1);
  }

  /**
   * Local maxima of a profile that stand above its mean.
   */
  static List<Peak> findBars(double[] profile) {
    double threshold = NumericUtils.mean(profile);
    return new PeakFinder().setMinHeight(threshold).find(profile);
  }

  /**
   * Flux-weighted centroid of values in [first, last] after removing the window minimum.
   * A window with no flux above its minimum gives its center.
   */
  static double windowCentroid(double[] values, int first, int last) {
    double[] xs = new double[last - first + 1];
    double[] ys = Arrays.copyOfRange(values, first, last + 1);
    double min = NumericUtils.nanMin(ys, 0, ys.length);
    for (int i = 0; i < ys.length; ++i) {
      xs[i] = first + i;
      ys[i] -= min;
    }
    double centroid = NumericUtils.centroid(xs, ys);
    if (Double.isNaN(centroid)) {
      return (first + last) / 2.;
    }
    return centroid;
  }

  @Override
  protected void backend(final CalibrationContext context) {
    Frame frame = context.getBarsFrame();
    double[][] data = frame.getData();
    int expected = context.getInstrument().getBarCount();

    fireStateChange("Collapsing rows around the frame center...");
    location = locate(data, frame.getYBinning(),
        context.getInstrument().getLocatorHalfWidth(), expected);
    context.setBarLocation(location);

    int win = location.getWindow();
    int midRow = location.getReferenceRow();
    double[] profile = profile(data, midRow, win);
    peaksFound = findBars(profile).size();
    XYSeries profileSeries = new XYSeries("Row " + midRow + " profile");
    for (int col = 0; col < profile.length; ++col) {
      profileSeries.add(col, profile[col]);
    }
    XYSeries barSeries = new XYSeries("Bar centroids");
    for (double centroid : location.getCentroids()) {
      int col = Math.min(profile.length - 1, Math.max(0, (int) (centroid + 0.5)));
      barSeries.add(centroid, profile[col]);
    }
    XYSeriesCollection xysc = new XYSeriesCollection();
    xysc.addSeries(profileSeries);
    xysc.addSeries(barSeries);
    addPlot(xysc, "Bar profile", "Column (px)", "Counts");
  }

  public BarLocation getLocation() {
    return location;
  }

  @Override
  String[] getDataStrings() {
    if (!location.isValid()) {
      return new String[]{"Bar count mismatch, located " + peaksFound + " bars"};
    }
    return new String[]{"Bars located: " + location.getBarCount()
        + "\nReference row: " + location.getReferenceRow()
        + "\nWindow: " + location.getWindow() + " px"};
  }

  @Override
  public String getName() {
    return "Bar location";
  }

  @Override
  public boolean hasEnoughData(final CalibrationContext context) {
    return context.getBarsFrame() != null;
  }
}
