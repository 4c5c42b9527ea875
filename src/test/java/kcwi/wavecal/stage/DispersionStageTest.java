package kcwi.wavecal.stage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import kcwi.wavecal.CalibrationException;
import kcwi.wavecal.input.CalibrationContext;
import kcwi.wavecal.input.Configuration;
import kcwi.wavecal.input.Frame;
import kcwi.wavecal.input.Grating;
import kcwi.wavecal.input.Instrument;
import kcwi.wavecal.test.SyntheticData;
import org.junit.Test;

public class DispersionStageTest {

  @Test
  public void preliminaryDispersion_mediumGrating() {
    Frame frame = SyntheticData.frameBuilder(new double[1][1]).build();
    // alpha = 30 - 13 = 17, beta = 34 - 17 = 17
    double expected = Math.cos(Math.toRadians(17.)) / 1.901 / 305. * 0.030 * 1.E4
        * Math.cos(Math.toRadians(4.));
    assertEquals(expected, DispersionStage.preliminaryDispersion(frame, Instrument.KCWI),
        1E-12);
    assertEquals(0.4936, expected, 1E-4);
  }

  @Test
  public void preliminaryDispersion_scalesWithBinning() {
    Frame unbinned = SyntheticData.frameBuilder(new double[1][1]).binning(1, 1).build();
    Frame binned = SyntheticData.frameBuilder(new double[1][1]).build();
    assertEquals(2. * DispersionStage.preliminaryDispersion(unbinned, Instrument.KCWI),
        DispersionStage.preliminaryDispersion(binned, Instrument.KCWI), 1E-12);
  }

  @Test
  public void preliminaryDispersion_reversedGratingUsesAdjuster() {
    Frame frame = new Frame.Builder(new double[1][1])
        .grating(Grating.BH2)
        .gratingAngle(200.)
        .cameraAngle(20.)
        .build();
    // alpha = 200 - 13 - 180 = 7, beta = 13
    double expected = Math.cos(Math.toRadians(13.)) / Grating.BH2.getRho() / 305. * 0.015
        * 1.E4 * Math.cos(Math.toRadians(4.));
    assertEquals(expected, DispersionStage.preliminaryDispersion(frame, Instrument.KCWI),
        1E-12);
  }

  @Test
  public void runStageOnData_storesDispersion() throws CalibrationException {
    CalibrationContext context = new CalibrationContext(Configuration.defaults(),
        SyntheticData.instrument());
    context.setArcFrame(SyntheticData.frameBuilder(new double[1][1]).build());
    DispersionStage stage = new DispersionStage();
    stage.runStageOnData(context);
    assertEquals(stage.getDispersion(), context.getPreliminaryDispersion(), 0.);
    assertEquals(0.4936, context.getPreliminaryDispersion(), 1E-4);
    assertTrue(stage.getReportString().startsWith("Alpha: 17 deg\nBeta: 17 deg\n"));
  }
}
