package kcwi.wavecal.output;

import static kcwi.wavecal.utils.ReportingUtils.chartsToImageList;
import static kcwi.wavecal.utils.ReportingUtils.createChart;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import kcwi.wavecal.model.BarSolution;
import kcwi.wavecal.model.CalibrationReport;
import kcwi.wavecal.stage.CalibrationStage;
import kcwi.wavecal.utils.ReportingUtils;
import org.apache.log4j.Logger;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.jfree.chart.JFreeChart;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Collects the plots and result text of each stage and writes them, with a summary of the
 * per-bar solutions, to a single PDF once the run completes. Per-bar detail plots are only
 * included at interactivity level 2 and above.
 */
public class PdfDiagnosticReporter implements DiagnosticReporter {

  private static final Logger logger = Logger.getLogger(PdfDiagnosticReporter.class);

  static final int CHARTS_PER_PAGE = 2;
  static final int CHART_WIDTH = 1280;
  static final int CHART_HEIGHT = 960;

  private final File file;
  private final int level;
  private final List<JFreeChart> charts;
  private final List<String> stageText;

  /**
   * @param file PDF to write when the run completes
   * @param level Interactivity level; detail plots are kept at 2 or more
   */
  public PdfDiagnosticReporter(File file, int level) {
    this.file = file;
    this.level = level;
    charts = new ArrayList<>();
    stageText = new ArrayList<>();
  }

  @Override
  public void stageCompleted(CalibrationStage stage) {
    List<XYSeriesCollection> data = stage.getData();
    List<String[]> labels = stage.getPlotLabels();
    for (int i = 0; i < data.size(); ++i) {
      if (stage.isDetailPlot(i) && level < 2) {
        continue;
      }
      charts.add(createChart(data.get(i), labels.get(i)));
    }
    String text = stage.getReportString();
    if (!text.isEmpty()) {
      stageText.add(stage.getName() + ":\n" + text);
    }
  }

  /**
   * @return number of charts collected so far
   */
  public int getChartCount() {
    return charts.size();
  }

  public File getFile() {
    return file;
  }

  @Override
  public void runCompleted(CalibrationReport report) throws IOException {
    File parent = file.getAbsoluteFile().getParentFile();
    if (parent != null && !parent.exists() && !parent.mkdirs()) {
      throw new IOException("Could not create report folder " + parent.getAbsolutePath());
    }
    try (PDDocument pdf = new PDDocument()) {
      ReportingUtils.textToPDFPage(summarize(report), pdf);
      ReportingUtils.textListToPDFPages(pdf, stageText.toArray(new String[0]));
      if (!charts.isEmpty()) {
        BufferedImage[] pages = chartsToImageList(CHARTS_PER_PAGE, CHART_WIDTH, CHART_HEIGHT,
            charts.toArray(new JFreeChart[0]));
        ReportingUtils.imageListToPDFPages(pdf, pages);
      }
      pdf.save(file);
    }
    logger.info("Diagnostic report written to " + file.getAbsolutePath());
  }

  /**
   * Text table of the solution for each bar, followed by the failure reasons.
   */
  static String summarize(CalibrationReport report) {
    StringBuilder sb = new StringBuilder();
    sb.append("Solved ").append(report.getSolvedCount()).append(" of ")
        .append(report.getSolutions().size()).append(" bars\n\n");
    sb.append("Bar Slice  Lines  RMS (A)\n");
    for (BarSolution solution : report.getSolutions()) {
      sb.append(String.format("%3d %5d", solution.getBarId(), solution.getSliceId()));
      if (solution.isSolved()) {
        sb.append(String.format(" %6d  %.4f", solution.getLineCount(), solution.getRms()));
      } else {
        sb.append("  FAILED");
      }
      sb.append('\n');
    }
    Map<Integer, String> failed = report.getFailedBars();
    if (!failed.isEmpty()) {
      sb.append('\n');
      for (Map.Entry<Integer, String> entry : failed.entrySet()) {
        sb.append("Bar ").append(entry.getKey()).append(": ").append(entry.getValue())
            .append('\n');
      }
    }
    return sb.toString();
  }
}
