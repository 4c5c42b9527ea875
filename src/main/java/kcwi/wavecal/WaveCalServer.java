package kcwi.wavecal;

import static kcwi.wavecal.utils.ReportingUtils.createChart;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import kcwi.wavecal.input.Configuration;
import kcwi.wavecal.input.Frame;
import kcwi.wavecal.input.FrameReader;
import kcwi.wavecal.input.Instrument;
import kcwi.wavecal.model.CalibrationReport;
import kcwi.wavecal.output.CalResult;
import kcwi.wavecal.output.ControlPointTable;
import kcwi.wavecal.stage.CalibrationStage;
import kcwi.wavecal.utils.ReportingUtils;
import org.apache.log4j.Logger;
import org.jfree.chart.JFreeChart;
import py4j.GatewayServer;
import py4j.Py4JNetworkException;

/**
 * WaveCalServer allows for running wavelength calibrations in a python environment using Py4J.
 *
 * It uses the Py4J default port: 25333 If a process is already using that port it silently
 * terminates.
 */
public class WaveCalServer {

  private static final Logger logger = Logger.getLogger(WaveCalServer.class);

  static final int PLOT_WIDTH = 1280;
  static final int PLOT_HEIGHT = 960;

  private final Configuration configuration;

  public WaveCalServer() {
    this(Configuration.getInstance());
  }

  WaveCalServer(Configuration configuration) {
    this.configuration = configuration;
  }

  public static void main(String[] args) {
    GatewayServer gatewayServer = new GatewayServer(new WaveCalServer());
    try {
      gatewayServer.start();
    } catch (Py4JNetworkException e) {
      logger.error("Could not start gateway server", e);
      System.exit(0);
    }
    System.out.println("Gateway Server Started");
  }

  /**
   * Trace the bars of a continuum bars frame and solve the wavelength solution of every bar of
   * an arc frame. Both files are FITS images with the instrument keywords in the primary header.
   *
   * @param barsFileName Full path to the continuum bars frame
   * @param arcFileName Full path to the arc lamp frame
   * @return Data from running the calibration (per-bar solutions, and plots as PNG images)
   * @throws IOException If either file cannot be read or the plots cannot be encoded
   * @throws CalibrationException If the bars cannot be traced or the arc cannot be aligned
   */
  public CalResult runWavelengthCalibration(String barsFileName, String arcFileName)
      throws IOException, CalibrationException {
    FrameReader reader = new FrameReader(configuration);
    Frame bars = reader.read(new File(barsFileName));
    Frame arc = reader.read(new File(arcFileName));

    WavelengthCalibration calibration = new WavelengthCalibration(configuration,
        Instrument.KCWI);
    CalibrationReport report = calibration.run(bars, arc);
    return buildResult(calibration, report);
  }

  /**
   * Solve an arc frame using control points saved from an earlier bar trace.
   *
   * @param controlPointFileName Full path to a control point table
   * @param arcFileName Full path to the arc lamp frame
   * @return Data from running the calibration (per-bar solutions, and plots as PNG images)
   * @throws IOException If either file cannot be read or the plots cannot be encoded
   * @throws CalibrationException If the arc cannot be aligned
   */
  public CalResult runArcCalibration(String controlPointFileName, String arcFileName)
      throws IOException, CalibrationException {
    Frame arc = new FrameReader(configuration).read(new File(arcFileName));
    WavelengthCalibration calibration = new WavelengthCalibration(configuration,
        Instrument.KCWI);
    calibration.useControlPoints(ControlPointTable.read(new File(controlPointFileName)));
    CalibrationReport report = calibration.solveArcs(arc);
    return buildResult(calibration, report);
  }

  /**
   * Turn the summary plots of each stage into PNG images named after the stage and plot title.
   */
  static CalResult buildResult(WavelengthCalibration calibration, CalibrationReport report)
      throws IOException {
    List<String> names = new ArrayList<>();
    List<BufferedImage> images = new ArrayList<>();
    for (CalibrationStage stage : calibration.getCompletedStages()) {
      List<String[]> labels = stage.getPlotLabels();
      for (int i = 0; i < stage.getData().size(); ++i) {
        if (stage.isDetailPlot(i)) {
          continue;
        }
        JFreeChart chart = createChart(stage.getData().get(i), labels.get(i));
        names.add((stage.getName() + "_" + labels.get(i)[0]).replaceAll("[^A-Za-z0-9]+", "_"));
        images.add(chart.createBufferedImage(PLOT_WIDTH, PLOT_HEIGHT));
      }
    }
    byte[][] pngs = ReportingUtils.imagesToPNGBytes(images.toArray(new BufferedImage[0]));
    logger.info("Returning " + report.getSolvedCount() + " solutions with " + pngs.length
        + " plots");
    return CalResult.buildWavelengthSolutionData(report, names.toArray(new String[0]), pngs);
  }
}
