package kcwi.wavecal.stage;

import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.EventListenerList;
import kcwi.wavecal.CalibrationException;
import kcwi.wavecal.input.CalibrationContext;
import kcwi.wavecal.utils.NumericUtils;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * This class defines the template pattern for each step of the wavelength calibration.
 * Concrete extensions of this class define a backend for one stage of the calculation, which
 * reads the products of earlier stages from a {@link CalibrationContext} and stores its own
 * product back into it.
 *
 * Stages work in a manner similar to the builder pattern: stages with parameters of their own
 * have them set first, and then "runStageOnData" is called with the context. Stages that can
 * run without all of their inputs (i.e., the tracer, which needs bar centroids) refuse to do so
 * and throw an IllegalStateException, since that is an error in the calling code rather than in
 * the data.
 *
 * Besides storing their product, stages produce XY series data to be plotted for diagnostics,
 * and text summaries of their results. These should not be read until the stage has run.
 */
public abstract class CalibrationStage {

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.###");
        NumericUtils.setInfinityPrintable(format);
        return format;
      });

  private final EventListenerList eventHelper;
  List<XYSeriesCollection> xySeriesData;
  List<String[]> plotLabels;
  List<Boolean> detailPlots;
  private String status;

  /**
   * Initialize all fields common to stage objects
   */
  CalibrationStage() {
    status = "";
    xySeriesData = new ArrayList<>();
    plotLabels = new ArrayList<>();
    detailPlots = new ArrayList<>();
    eventHelper = new EventListenerList();
  }

  /**
   * Add a chart's worth of data along with its title and axis labels.
   *
   * @param data Series to be plotted together
   * @param title Chart title
   * @param xLabel Domain axis label
   * @param yLabel Range axis label
   */
  void addPlot(XYSeriesCollection data, String title, String xLabel, String yLabel) {
    xySeriesData.add(data);
    plotLabels.add(new String[]{title, xLabel, yLabel});
    detailPlots.add(false);
  }

  /**
   * Add a chart that shows a single bar or intermediate step in detail. Such charts are only
   * included in diagnostics at higher interactivity levels.
   */
  void addDetailPlot(XYSeriesCollection data, String title, String xLabel, String yLabel) {
    addPlot(data, title, xLabel, yLabel);
    detailPlots.set(detailPlots.size() - 1, true);
  }

  /**
   * Stub method to be overridden by stages to produce String data for the stage result.
   * Includes formatting of numeric data.
   * @return Strings containing human-readable data
   */
  String[] getDataStrings() {
    return new String[]{""};
  }

  /**
   * Strings to be shown as an inset on the stage's plots. Defaults to the data strings.
   * @return Strings containing human-readable data
   */
  public String[] getInsetStrings() {
    return getDataStrings();
  }

  /**
   * String for reports, made from the stage's data strings, one per line.
   * @return String containing human-readable data
   */
  public String getReportString() {
    StringBuilder sb = new StringBuilder();
    String[] strings = getDataStrings();
    for (int i = 0; i < strings.length; ++i) {
      sb.append(strings[i]);
      if (i + 1 < strings.length) {
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  /**
   * Add an object to the list of objects to be notified when the stage's status changes
   *
   * @param listener ChangeListener to be notified
   */
  public void addChangeListener(ChangeListener listener) {
    eventHelper.add(ChangeListener.class, listener);
  }

  /**
   * Abstract function that runs the calculations specific to a given stage, overwritten by
   * concrete stages with specific operations.
   *
   * @param context Calibration inputs and the products of earlier stages
   * @throws CalibrationException if the data cannot support the stage's calculation
   */
  protected abstract void backend(final CalibrationContext context)
      throws CalibrationException;

  /**
   * Update processing status and notify listeners of the change. May be called from worker
   * threads.
   *
   * @param newStatus Status change message to notify listeners of
   */
  void fireStateChange(String newStatus) {
    ChangeListener[] listeners;
    synchronized (this) {
      status = newStatus;
      listeners = eventHelper.getListeners(ChangeListener.class);
    }
    if (listeners != null && listeners.length > 0) {
      ChangeEvent event = new ChangeEvent(this);
      for (ChangeListener listener : listeners) {
        listener.stateChanged(event);
      }
    }
  }

  /**
   * Return the plottable data for this stage, populated in the backend. Each list entry is the
   * data to be placed into a separate chart.
   *
   * @return Plottable data
   */
  public List<XYSeriesCollection> getData() {
    return xySeriesData;
  }

  /**
   * Titles and axis labels of the charts in {@link #getData()}, in the same order; each entry
   * holds the title, the domain label and the range label.
   *
   * @return Chart labels
   */
  public List<String[]> getPlotLabels() {
    return plotLabels;
  }

  /**
   * @param index index of a chart in {@link #getData()}
   * @return True if the chart is a detail plot
   */
  public boolean isDetailPlot(int index) {
    return detailPlots.get(index);
  }

  /**
   * Human-readable name of the stage, used in status messages and reports.
   *
   * @return Stage name
   */
  public abstract String getName();

  /**
   * Return newest status message produced by this stage
   *
   * @return String representing status of the stage
   */
  public synchronized String getStatus() {
    return status;
  }

  /**
   * Used to check if the context holds the products this stage needs.
   *
   * @param context Context to be fed into the stage calculation
   * @return True if there is enough data to be run
   */
  public abstract boolean hasEnoughData(final CalibrationContext context);

  /**
   * Driver to run the stage on a context (calls the concrete backend method).
   *
   * @param context Calibration inputs and earlier products
   * @throws CalibrationException if the stage's calculation fails for the whole frame
   * @throws IllegalStateException if the context lacks the inputs this stage needs
   */
  public void runStageOnData(final CalibrationContext context) throws CalibrationException {
    if (!hasEnoughData(context)) {
      throw new IllegalStateException(getName() + " run before its inputs were produced");
    }
    xySeriesData = new ArrayList<>();
    plotLabels = new ArrayList<>();
    detailPlots = new ArrayList<>();

    fireStateChange("Beginning " + getName().toLowerCase() + "...");

    backend(context);

    fireStateChange(getName() + " done!");
  }
}
