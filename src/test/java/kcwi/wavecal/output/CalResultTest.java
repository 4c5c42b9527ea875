package kcwi.wavecal.output;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import kcwi.wavecal.model.BarSolution;
import kcwi.wavecal.model.CalibrationReport;
import kcwi.wavecal.model.PhysicalDispersionModel;
import kcwi.wavecal.model.PolynomialFit;
import org.junit.Test;

public class CalResultTest {

  static CalibrationReport report() {
    PhysicalDispersionModel model =
        new PhysicalDispersionModel(new double[]{0., 0., -1E-6, 0.5, 4500.}, 300);
    BarSolution solved = BarSolution.solved(0, 0, model,
        new PolynomialFit(new double[]{4350., 0.5, 1E-6}, 0.02, 40), new double[]{0.05, 0.02}, 3);
    BarSolution failed = BarSolution.failed(1, 0, null, "No central wavelength model");
    return new CalibrationReport(Arrays.asList(solved, failed),
        Collections.singletonMap(1, "No central wavelength model"));
  }

  @Test
  public void buildWavelengthSolutionData_numericEntries() {
    CalResult result = CalResult.buildWavelengthSolutionData(report(),
        new String[]{"plot"}, new byte[][]{{1, 2, 3}});
    Map<String, double[]> numbers = result.getNumerMap();
    assertArrayEquals(new double[]{0., 1.}, numbers.get("Bar_ids"), 0.);
    assertArrayEquals(new double[]{0.}, numbers.get("Solved_bars"), 0.);
    assertArrayEquals(new double[]{1.}, numbers.get("Failed_bars"), 0.);
    assertArrayEquals(new double[]{40., 0.}, numbers.get("Line_counts"), 0.);
    assertArrayEquals(new double[]{3., 0.}, numbers.get("Rejected_lines"), 0.);
    assertEquals(0.02, numbers.get("Fit_rms")[0], 0.);
    assertEquals(Double.NaN, numbers.get("Fit_rms")[1], 0.);
    assertArrayEquals(new double[]{4350., 0.5, 1E-6}, numbers.get("Bar_0_coefficients"), 0.);
    assertEquals(0, numbers.get("Bar_1_coefficients").length);
    assertEquals(4500., numbers.get("Bar_0_central_model")[4], 0.);
    assertFalse(numbers.containsKey("Bar_1_central_model"));
    assertArrayEquals(new byte[]{1, 2, 3}, result.getImageMap().get("plot"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void buildWavelengthSolutionData_mismatchedImages() {
    CalResult.buildWavelengthSolutionData(report(), new String[]{"a", "b"}, new byte[][]{{1}});
  }
}
