package kcwi.wavecal.stage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import kcwi.wavecal.CalibrationException;
import kcwi.wavecal.input.CalibrationContext;
import kcwi.wavecal.input.Configuration;
import kcwi.wavecal.input.Instrument;
import org.junit.Test;

public class CalibrationStageTest {

  private static CalibrationContext context() {
    return new CalibrationContext(Configuration.defaults(), Instrument.KCWI);
  }

  @Test
  public void runStageOnData_callsBackendAndFiresChanges() throws CalibrationException {
    MockStage stage = new MockStage();
    stage.runStageOnData(context());
    assertTrue(stage.hasEnoughDataCalled);
    assertTrue(stage.backendCalled);
    // beginning, the backend's own message, and done
    assertEquals(3, stage.numberOfChangesFired);
    assertEquals("Mock stage done!", stage.getStatus());
  }

  @Test
  public void runStageOnData_withoutInputsThrows() throws CalibrationException {
    MockStage stage = new MockStage();
    stage.setHasEnoughData = false;
    try {
      stage.runStageOnData(context());
    } catch (IllegalStateException e) {
      assertFalse(stage.backendCalled);
      assertEquals(0, stage.numberOfChangesFired);
      return;
    }
    throw new AssertionError("Stage ran without its inputs");
  }

  @Test
  public void runStageOnData_resetsPlotsBetweenRuns() throws CalibrationException {
    MockStage stage = new MockStage();
    stage.runStageOnData(context());
    stage.runStageOnData(context());
    assertEquals(2, stage.getData().size());
    assertEquals(2, stage.getPlotLabels().size());
    assertFalse(stage.isDetailPlot(0));
    assertTrue(stage.isDetailPlot(1));
    assertEquals("Detail", stage.getPlotLabels().get(1)[0]);
  }

  @Test
  public void getReportString_joinsDataStrings() {
    MockStage stage = new MockStage();
    assertEquals("first\nsecond", stage.getReportString());
    assertEquals(2, stage.getInsetStrings().length);
  }

  @Test
  public void getStatus_emptyBeforeRun() {
    assertEquals("", new MockStage().getStatus());
  }
}
