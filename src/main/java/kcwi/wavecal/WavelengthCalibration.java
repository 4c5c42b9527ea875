package kcwi.wavecal;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.swing.event.ChangeListener;
import kcwi.wavecal.CalibrationException.GeometryException;
import kcwi.wavecal.input.CalibrationContext;
import kcwi.wavecal.input.Configuration;
import kcwi.wavecal.input.Frame;
import kcwi.wavecal.input.Instrument;
import kcwi.wavecal.model.AtlasSpectrum;
import kcwi.wavecal.model.CalibrationReport;
import kcwi.wavecal.model.ControlPointSet;
import kcwi.wavecal.output.ControlPointTable;
import kcwi.wavecal.output.DiagnosticReporter;
import kcwi.wavecal.output.PdfDiagnosticReporter;
import kcwi.wavecal.output.SolutionTable;
import kcwi.wavecal.stage.CalibrationStage;
import kcwi.wavecal.stage.StageEnum;
import org.apache.log4j.Logger;

/**
 * Runs the calibration stages in order over a shared context. The bar stages run once per bars
 * frame; the arc stages can then be run for any number of arc frames taken with the same
 * configuration, each producing its own report.
 *
 * Diagnostics follow the arc frame's interactivity level: at 0 nothing is written, at 1 or
 * more a PDF of the stage plots is written to the report folder. Output tables are written to
 * the report folder only when requested with {@link #setWriteTables(boolean)}.
 */
public class WavelengthCalibration {

  private static final Logger logger = Logger.getLogger(WavelengthCalibration.class);

  private final Configuration configuration;
  private final Instrument instrument;
  private final CalibrationContext context;
  private final List<ChangeListener> listeners;
  private final List<CalibrationStage> barStages;
  private final List<CalibrationStage> arcStages;

  private AtlasSpectrum atlasOverride;
  private DiagnosticReporter reporter;
  private boolean writeTables;

  public WavelengthCalibration(Configuration configuration, Instrument instrument) {
    this.configuration = configuration;
    this.instrument = instrument;
    context = new CalibrationContext(configuration, instrument);
    listeners = new ArrayList<>();
    barStages = new ArrayList<>();
    arcStages = new ArrayList<>();
    reporter = DiagnosticReporter.NONE;
  }

  /**
   * Use the given atlas instead of reading one for the arc's lamp from the atlas folder.
   * @param atlas Unconvolved atlas spectrum, or null to read from the atlas folder
   */
  public void setAtlas(AtlasSpectrum atlas) {
    atlasOverride = atlas;
  }

  /**
   * Set whether the control point and solution tables are written to the report folder.
   */
  public void setWriteTables(boolean writeTables) {
    this.writeTables = writeTables;
  }

  /**
   * Add a listener to be notified of the status of every stage that runs.
   */
  public void addChangeListener(ChangeListener listener) {
    listeners.add(listener);
  }

  public CalibrationContext getContext() {
    return context;
  }

  /**
   * @return stages run for the current bars and the most recent arc, in run order
   */
  public List<CalibrationStage> getCompletedStages() {
    List<CalibrationStage> stages = new ArrayList<>(barStages);
    stages.addAll(arcStages);
    return Collections.unmodifiableList(stages);
  }

  /**
   * Locate and trace the bars of a continuum bars frame, replacing any previous trace.
   *
   * @param bars Continuum bars frame
   * @return control points of the traced bars
   * @throws CalibrationException if the bars cannot be located or traced
   * @throws IOException if the control point table cannot be written
   */
  public ControlPointSet traceBars(Frame bars) throws CalibrationException, IOException {
    barStages.clear();
    arcStages.clear();
    context.clearArcProducts();
    context.setBarsFrame(bars);
    context.setBarLocation(null);
    context.setControlPoints(null);
    context.setTransform(null);
    for (StageEnum stageEnum : StageEnum.values()) {
      if (stageEnum.isBarsStage()) {
        runStage(stageEnum);
      }
    }
    ControlPointSet points = context.getControlPoints();
    if (writeTables) {
      writeControlPoints(bars, points);
    }
    return points;
  }

  /**
   * Use control points from an earlier run (i.e., read with {@link ControlPointTable}) in
   * place of tracing a bars frame.
   *
   * @param points Control points of the traced bars
   * @throws GeometryException if the points do not support the spatial transform
   */
  public void useControlPoints(ControlPointSet points) throws GeometryException {
    barStages.clear();
    arcStages.clear();
    context.clearArcProducts();
    context.setControlPoints(points);
    context.setTransform(points.fitTransform(instrument.getTransformOrder()));
  }

  /**
   * Solve the wavelength solution of every bar in an arc frame, using the bars traced by
   * {@link #traceBars(Frame)} or set by {@link #useControlPoints(ControlPointSet)}.
   *
   * @param arc Arc lamp frame
   * @return solutions for every bar, with the reason each failed bar failed
   * @throws CalibrationException if a stage fails for the whole frame
   * @throws IOException if diagnostics or tables cannot be written
   * @throws IllegalStateException if no bars have been traced
   */
  public CalibrationReport solveArcs(Frame arc) throws CalibrationException, IOException {
    if (context.getControlPoints() == null) {
      throw new IllegalStateException("Bars must be traced before arcs are solved");
    }
    arcStages.clear();
    context.clearArcProducts();
    context.setArcFrame(arc);
    context.setReferenceAtlas(atlasOverride);
    reporter = createReporter(arc);
    // stages from the bar trace are reported with this arc
    for (CalibrationStage stage : barStages) {
      reporter.stageCompleted(stage);
    }
    for (StageEnum stageEnum : StageEnum.values()) {
      if (!stageEnum.isBarsStage()) {
        runStage(stageEnum);
      }
    }

    CalibrationReport report = context.buildReport();
    logger.info("Solved " + report.getSolvedCount() + " of " + report.getSolutions().size()
        + " bars for " + arc.getName());
    reporter.runCompleted(report);
    if (writeTables) {
      File table = new File(configuration.getReportFolder(), baseName(arc) + "_wavesol.fits");
      ensureParent(table);
      SolutionTable.write(table, report);
    }
    return report;
  }

  /**
   * Trace the bars frame, then solve the arc frame with the traced bars.
   *
   * @param bars Continuum bars frame
   * @param arc Arc lamp frame
   * @return solutions for every bar
   * @throws CalibrationException if a stage fails for the whole frame
   * @throws IOException if diagnostics or tables cannot be written
   */
  public CalibrationReport run(Frame bars, Frame arc) throws CalibrationException, IOException {
    traceBars(bars);
    return solveArcs(arc);
  }

  private void runStage(StageEnum stageEnum) throws CalibrationException {
    CalibrationStage stage = stageEnum.createStage();
    for (ChangeListener listener : listeners) {
      stage.addChangeListener(listener);
    }
    logger.info("Running stage: " + stage.getName());
    try {
      stage.runStageOnData(context);
    } catch (CalibrationException e) {
      logger.error(stage.getName() + " failed: " + e.getMessage());
      throw e;
    }
    if (stageEnum.isBarsStage()) {
      barStages.add(stage);
    } else {
      arcStages.add(stage);
      reporter.stageCompleted(stage);
    }
  }

  private DiagnosticReporter createReporter(Frame arc) {
    if (arc.getInteractivityLevel() < 1) {
      return DiagnosticReporter.NONE;
    }
    File pdf = new File(configuration.getReportFolder(), baseName(arc) + "_wavecal.pdf");
    return new PdfDiagnosticReporter(pdf, arc.getInteractivityLevel());
  }

  private void writeControlPoints(Frame bars, ControlPointSet points) throws IOException {
    File table = new File(configuration.getReportFolder(), baseName(bars) + "_cpoints.fits");
    ensureParent(table);
    ControlPointTable.write(table, points);
  }

  private static void ensureParent(File file) throws IOException {
    File parent = file.getAbsoluteFile().getParentFile();
    if (parent != null && !parent.exists() && !parent.mkdirs()) {
      throw new IOException("Could not create report folder " + parent.getAbsolutePath());
    }
  }

  static String baseName(Frame frame) {
    String name = frame.getName();
    if (name == null || name.isEmpty()) {
      return "frame";
    }
    name = new File(name).getName();
    int dot = name.lastIndexOf('.');
    if (dot > 0) {
      name = name.substring(0, dot);
    }
    return name.replaceAll("[^A-Za-z0-9_.-]", "_");
  }
}
