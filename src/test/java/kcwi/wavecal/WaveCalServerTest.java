package kcwi.wavecal;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Map;
import kcwi.wavecal.input.Configuration;
import kcwi.wavecal.model.CalibrationReport;
import kcwi.wavecal.output.CalResult;
import kcwi.wavecal.test.SyntheticData;
import org.junit.Test;

public class WaveCalServerTest {

  @Test
  public void buildResult_summaryPlotsAndSolutions() throws Exception {
    WavelengthCalibration calibration =
        new WavelengthCalibration(Configuration.defaults(), SyntheticData.instrument());
    calibration.setAtlas(SyntheticData.atlas());
    CalibrationReport report = calibration.run(SyntheticData.barsFrame(0.01),
        SyntheticData.arcFrame(0.01, SyntheticData.instrument()));

    CalResult result = WaveCalServer.buildResult(calibration, report);
    Map<String, double[]> numbers = result.getNumerMap();
    assertEquals(SyntheticData.BARS, numbers.get("Bar_ids").length);
    assertEquals(report.getSolvedCount(), numbers.get("Solved_bars").length);
    for (int bar = 0; bar < SyntheticData.BARS; ++bar) {
      assertTrue(numbers.containsKey("Bar_" + bar + "_coefficients"));
    }

    Map<String, byte[]> images = result.getImageMap();
    assertTrue(images.containsKey("Bar_location_Bar_profile"));
    assertFalse(images.containsKey("Arc_solution_Bar_0_solution"));
    for (byte[] png : images.values()) {
      // PNG signature
      assertEquals((byte) 0x89, png[0]);
      assertEquals((byte) 'P', png[1]);
    }
  }
}
