package kcwi.wavecal.stage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import kcwi.wavecal.CalibrationException;
import kcwi.wavecal.input.CalibrationContext;
import kcwi.wavecal.input.Configuration;
import kcwi.wavecal.model.BarLocation;
import kcwi.wavecal.test.SyntheticData;
import org.junit.Test;

public class BarLocatorStageTest {

  @Test
  public void locate_centroidsMatchBars() {
    double[][] data = SyntheticData.barsFrameData(0.);
    BarLocation location = BarLocatorStage.locate(data, SyntheticData.Y_BINNING, 10,
        SyntheticData.BARS);
    assertTrue(location.isValid());
    assertEquals(SyntheticData.BARS, location.getBarCount());
    assertEquals(SyntheticData.HEIGHT / 2, location.getReferenceRow());
    assertEquals(5, location.getWindow());
    for (int bar = 0; bar < SyntheticData.BARS; ++bar) {
      assertEquals(SyntheticData.barCenter(bar, SyntheticData.HEIGHT / 2, 0.),
          location.getCentroid(bar), 0.05);
    }
  }

  @Test
  public void locate_wrongCountIsInvalid() {
    double[][] data = SyntheticData.barsFrameData(0.);
    BarLocation location = BarLocatorStage.locate(data, SyntheticData.Y_BINNING, 10,
        SyntheticData.BARS + 2);
    assertFalse(location.isValid());
    assertEquals(0, location.getBarCount());
  }

  @Test
  public void windowCentroid_flatWindowGivesCenter() {
    double[] flat = new double[20];
    assertEquals(7., BarLocatorStage.windowCentroid(flat, 4, 10), 0.);
  }

  @Test
  public void runStageOnData_storesLocation() throws CalibrationException {
    CalibrationContext context =
        new CalibrationContext(Configuration.defaults(), SyntheticData.instrument());
    context.setBarsFrame(SyntheticData.barsFrame(0.01));
    BarLocatorStage stage = new BarLocatorStage();
    stage.runStageOnData(context);

    assertTrue(context.getBarLocation().isValid());
    assertEquals(stage.getLocation(), context.getBarLocation());
    assertEquals(1, stage.getData().size());
    assertTrue(stage.getReportString().startsWith("Bars located: 10"));
  }

  @Test
  public void runStageOnData_reportsMismatch() throws CalibrationException {
    CalibrationContext context =
        new CalibrationContext(Configuration.defaults(), SyntheticData.instrument());
    double[][] data = SyntheticData.barsFrameData(0.);
    // blank out the last bar
    for (double[] row : data) {
      for (int col = 190; col < row.length; ++col) {
        row[col] = SyntheticData.BACKGROUND;
      }
    }
    context.setBarsFrame(SyntheticData.frameBuilder(data).build());
    BarLocatorStage stage = new BarLocatorStage();
    stage.runStageOnData(context);
    assertFalse(context.getBarLocation().isValid());
    assertEquals("Bar count mismatch, located 9 bars", stage.getReportString());
  }
}
