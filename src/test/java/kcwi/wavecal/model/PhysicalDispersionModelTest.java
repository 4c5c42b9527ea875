package kcwi.wavecal.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import kcwi.wavecal.utils.NumericUtils;
import org.junit.Test;

public class PhysicalDispersionModelTest {

  private static PhysicalDispersionModel model() {
    return PhysicalDispersionModel.fromGratingEquation(4500., 0.49, 0.03, 1.901, 305., 300.);
  }

  @Test
  public void fromGratingEquation_leadingTerms() {
    PhysicalDispersionModel model = model();
    assertEquals(4500., model.getZeroPoint(), 0.);
    assertEquals(0.49, model.getDispersion(), 0.);
    assertEquals(4500., model.wavelengthAt(300.), 1E-12);
    assertEquals(300., model.getReferencePixel(), 0.);
  }

  @Test
  public void fromGratingEquation_higherTermsSmallAndSigned() {
    double[] coeffs = model().getCoefficients();
    // curvature terms oppose the linear term for a diffraction angle below 90 degrees
    assertTrue(coeffs[2] < 0.);
    assertTrue(coeffs[1] < 0.);
    assertTrue(coeffs[0] > 0.);
    assertTrue(Math.abs(coeffs[2]) < 1E-3);
  }

  @Test
  public void fromGratingEquation_cosineClampedAtUnity() {
    // implausibly large dispersion gives cos(beta) > 1, which is clamped to a grazing angle
    PhysicalDispersionModel model =
        PhysicalDispersionModel.fromGratingEquation(4500., 100., 0.03, 1.901, 305., 0.);
    double[] coeffs = model.getCoefficients();
    assertEquals(0., coeffs[2], 0.);
    assertEquals(0., coeffs[0], 0.);
    assertTrue(coeffs[1] < 0.);
  }

  @Test
  public void getPixelCoefficients_agreeWithWavelengthAt() {
    PhysicalDispersionModel model = model();
    double[] pixelCoeffs = model.getPixelCoefficients();
    for (double pixel = 0.; pixel <= 600.; pixel += 37.5) {
      assertEquals(model.wavelengthAt(pixel), NumericUtils.polyval(pixelCoeffs, pixel), 1E-6);
    }
  }

  @Test
  public void wavelengthsAt_matchesSingleEvaluation() {
    PhysicalDispersionModel model = model();
    double[] pixels = {0., 150., 599.};
    double[] waves = model.wavelengthsAt(pixels);
    for (int i = 0; i < pixels.length; ++i) {
      assertEquals(model.wavelengthAt(pixels[i]), waves[i], 0.);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void constructor_rejectsWrongTermCount() {
    new PhysicalDispersionModel(new double[]{1., 2., 3.}, 0.);
  }
}
