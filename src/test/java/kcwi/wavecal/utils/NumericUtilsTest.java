package kcwi.wavecal.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class NumericUtilsTest {

  @Test
  public void linspace_includesBothEnds() {
    double[] values = NumericUtils.linspace(2., 4., 5);
    assertArrayEquals(new double[]{2., 2.5, 3., 3.5, 4.}, values, 1E-12);
  }

  @Test
  public void argmax_returnsFirstOfTies() {
    double[] values = {1., 5., 3., 5., 2.};
    assertEquals(1, NumericUtils.argmax(values));
    assertEquals(3, NumericUtils.argmax(values, 2, 5));
  }

  @Test
  public void nanMin_skipsNaN() {
    double[] values = {Double.NaN, 4., 2., Double.NaN, 3.};
    assertEquals(2., NumericUtils.nanMin(values, 0, values.length), 0.);
    assertEquals(3., NumericUtils.nanMin(values, 3, 5), 0.);
    assertTrue(Double.isNaN(NumericUtils.nanMin(values, 0, 1)));
  }

  @Test
  public void polyval_highestPowerFirst() {
    // 2x^2 - 3x + 1
    assertEquals(1., NumericUtils.polyval(new double[]{2., -3., 1.}, 0.), 0.);
    assertEquals(15., NumericUtils.polyval(new double[]{2., -3., 1.}, -2.), 1E-12);
  }

  @Test
  public void pascalShift_knownPolynomial() {
    // p(u) = u^2 + 2u + 3, q(x) = p(x - 2) = x^2 - 2x + 3
    double[] shifted = NumericUtils.pascalShift(new double[]{1., 2., 3.}, 2.);
    assertArrayEquals(new double[]{1., -2., 3.}, shifted, 1E-12);
  }

  @Test
  public void pascalShift_roundTripIsExact() {
    double[] coeffs = {1.2E-11, -3.4E-8, -7.4E-6, 0.4936, 4500.};
    double x0 = 1024.;
    double[] shifted = NumericUtils.pascalShift(coeffs, x0);
    double[] back = NumericUtils.pascalShift(shifted, -x0);
    for (int i = 0; i < coeffs.length; ++i) {
      assertEquals(coeffs[i], back[i], Math.abs(coeffs[i]) * 1E-6 + 1E-12);
    }
    for (double x = 0.; x < 2048.; x += 97.) {
      assertEquals(NumericUtils.polyval(coeffs, x - x0), NumericUtils.polyval(shifted, x),
          1E-6);
    }
  }

  @Test
  public void tukeyWindow_limits() {
    double[] flat = NumericUtils.tukeyWindow(11, 0.);
    for (double value : flat) {
      assertEquals(1., value, 0.);
    }
    double[] hann = NumericUtils.tukeyWindow(11, 1.);
    assertEquals(0., hann[0], 1E-12);
    assertEquals(0., hann[10], 1E-12);
    assertEquals(1., hann[5], 1E-12);

    double[] tapered = NumericUtils.tukeyWindow(101, 0.2);
    assertEquals(0., tapered[0], 1E-12);
    assertEquals(1., tapered[50], 0.);
    assertEquals(1., tapered[20], 1E-12);
    assertTrue(tapered[5] < 1.);
    assertEquals(tapered[5], tapered[95], 1E-12);
  }

  @Test
  public void boxcarSmooth_centeredWithZeroPadding() {
    double[] values = {0., 0., 3., 0., 0.};
    assertArrayEquals(new double[]{0., 1., 1., 1., 0.},
        NumericUtils.boxcarSmooth(values, 3), 1E-12);
    assertArrayEquals(values, NumericUtils.boxcarSmooth(values, 1), 0.);
  }

  @Test
  public void gaussianFilter_preservesFluxAndCenter() {
    double[] values = new double[101];
    values[50] = 10.;
    double[] smoothed = NumericUtils.gaussianFilter(values, 3.);
    double sum = 0.;
    for (double value : smoothed) {
      sum += value;
    }
    assertEquals(10., sum, 1E-9);
    assertEquals(50, NumericUtils.argmax(smoothed));
    assertEquals(smoothed[45], smoothed[55], 1E-12);
  }

  @Test
  public void interpolate_passesThroughKnots() {
    double[] xs = {0., 1., 2., 3., 4.};
    double[] ys = {0., 1., 4., 9., 16.};
    double[] out = NumericUtils.interpolate(xs, ys, new double[]{1., 3., 2.5});
    assertEquals(1., out[0], 1E-12);
    assertEquals(9., out[1], 1E-12);
    assertEquals(6.25, out[2], 0.1);
  }

  @Test
  public void interpolate_acceptsDecreasingAxis() {
    double[] xs = {4., 3., 2., 1., 0.};
    double[] ys = {8., 6., 4., 2., 0.};
    double[] out = NumericUtils.interpolate(xs, ys, new double[]{1.5});
    assertEquals(3., out[0], 1E-9);
  }

  @Test
  public void columnMedians_inclusiveBounds() {
    double[][] data = {
        {1., 10., 5.},
        {2., 20., 5.},
        {3., 30., 100.},
        {4., 40., 5.}
    };
    double[] medians = NumericUtils.columnMedians(data, 0, 2, 1, 2);
    assertArrayEquals(new double[]{20., 5.}, medians, 0.);
  }

  @Test
  public void centroid_zeroWeightIsNaN() {
    assertTrue(Double.isNaN(NumericUtils.centroid(new double[]{1., 2.}, new double[]{0., 0.})));
    assertEquals(1.75, NumericUtils.centroid(new double[]{1., 2.}, new double[]{1., 3.}), 1E-12);
  }

  @Test
  public void sigmaClipBounds_dropsOutlier() {
    double[] values = {1., 1., 1., 1., 1., 1., 1., 1., 1., 100.};
    double[] bounds = NumericUtils.sigmaClipBounds(values, 2., 2., 2);
    assertEquals(1., bounds[0], 1E-12);
    assertEquals(1., bounds[1], 1E-12);
  }

  @Test
  public void sigmaClipBounds_keepsEverythingInsideBand() {
    double[] values = {0.9, 1.0, 1.1, 1.0, 0.95, 1.05};
    double[] bounds = NumericUtils.sigmaClipBounds(values, 2., 2., 2);
    for (double value : values) {
      assertTrue(value >= bounds[0] && value <= bounds[1]);
    }
  }
}
