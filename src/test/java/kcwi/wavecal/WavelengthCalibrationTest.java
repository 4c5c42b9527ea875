package kcwi.wavecal;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import kcwi.wavecal.input.Configuration;
import kcwi.wavecal.input.Frame;
import kcwi.wavecal.model.BarSolution;
import kcwi.wavecal.model.CalibrationReport;
import kcwi.wavecal.model.ControlPointSet;
import kcwi.wavecal.model.PhysicalDispersionModel;
import kcwi.wavecal.output.ControlPointTable;
import kcwi.wavecal.test.SyntheticData;
import org.junit.BeforeClass;
import org.junit.ClassRule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class WavelengthCalibrationTest {

  @ClassRule
  public static TemporaryFolder folder = new TemporaryFolder();

  private static Configuration configuration;
  private static CalibrationReport report;
  private static PhysicalDispersionModel reference;

  @BeforeClass
  public static void runCalibration() throws Exception {
    configuration = Configuration.defaults();
    configuration.setReportFolder(new File(folder.getRoot(), "reports").getAbsolutePath());
    WavelengthCalibration calibration =
        new WavelengthCalibration(configuration, SyntheticData.instrument());
    calibration.setAtlas(SyntheticData.atlas());
    calibration.setWriteTables(true);
    Frame arc = SyntheticData.arcFrameBuilder(0.01, SyntheticData.instrument())
        .interactivityLevel(1).build();
    report = calibration.run(SyntheticData.barsFrame(0.01), arc);
    reference = SyntheticData.referenceModel(arc, SyntheticData.instrument());
  }

  @Test
  public void run_solvesEveryBar() {
    assertEquals(SyntheticData.BARS, report.getSolutions().size());
    assertTrue(report.getFailedBars().toString(), report.isComplete());
    for (BarSolution solution : report.getSolutions()) {
      assertTrue(solution.getRms() < 0.1);
    }
  }

  @Test
  public void run_solutionsMatchArcWavelengths() {
    for (BarSolution solution : report.getSolutions()) {
      int bar = solution.getBarId();
      for (int row = 100; row <= 500; row += 20) {
        String message = "bar " + bar + " row " + row;
        assertEquals(message, SyntheticData.wavelengthAt(reference, bar, row),
            solution.getFit().value(row), 0.1);
      }
    }
  }

  @Test
  public void run_writesTablesAndReport() throws Exception {
    File reports = new File(configuration.getReportFolder());
    File points = new File(reports, "bars_cpoints.fits");
    assertTrue(points.exists());
    assertTrue(new File(reports, "arc_wavesol.fits").exists());
    assertTrue(new File(reports, "arc_wavecal.pdf").exists());

    ControlPointSet read = ControlPointTable.read(points);
    assertEquals(SyntheticData.BARS, read.getReferenceRowPoints().size());
  }

  @Test
  public void solveArcs_reusesSavedControlPoints() throws Exception {
    Configuration quiet = Configuration.defaults();
    quiet.setReportFolder(folder.newFolder().getAbsolutePath());
    WavelengthCalibration calibration =
        new WavelengthCalibration(quiet, SyntheticData.instrument());
    calibration.setAtlas(SyntheticData.atlas());
    calibration.useControlPoints(ControlPointTable.read(
        new File(configuration.getReportFolder(), "bars_cpoints.fits")));
    CalibrationReport again =
        calibration.solveArcs(SyntheticData.arcFrame(0.01, SyntheticData.instrument()));
    assertEquals(report.getSolvedCount(), again.getSolvedCount());
    for (int bar = 0; bar < SyntheticData.BARS; ++bar) {
      assertEquals(report.getSolution(bar).getFit().value(300),
          again.getSolution(bar).getFit().value(300), 1E-6);
    }
  }

  @Test(expected = IllegalStateException.class)
  public void solveArcs_beforeTracing() throws Exception {
    WavelengthCalibration calibration =
        new WavelengthCalibration(Configuration.defaults(), SyntheticData.instrument());
    calibration.solveArcs(SyntheticData.arcFrame(0.01, SyntheticData.instrument()));
  }

  @Test
  public void baseName_stripsFolderAndExtension() {
    Frame frame = SyntheticData.frameBuilder(new double[1][1]).name("/data/kb230101 01.fits")
        .build();
    assertEquals("kb230101_01", WavelengthCalibration.baseName(frame));
    assertEquals("frame",
        WavelengthCalibration.baseName(SyntheticData.frameBuilder(new double[1][1]).build()));
  }
}
