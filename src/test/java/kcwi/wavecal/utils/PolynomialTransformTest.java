package kcwi.wavecal.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import kcwi.wavecal.CalibrationException.GeometryException;
import org.junit.Test;

public class PolynomialTransformTest {

  private static double distortX(double x, double y) {
    return x + 0.01 * (y - 300.) + 2E-7 * x * x * x - 1E-6 * x * y;
  }

  private static double distortY(double x, double y) {
    return y - 0.5 + 3E-4 * x + 1E-8 * y * y * y;
  }

  @Test
  public void termCount_triangularNumbers() {
    assertEquals(1, PolynomialTransform.termCount(0));
    assertEquals(3, PolynomialTransform.termCount(1));
    assertEquals(10, PolynomialTransform.termCount(3));
  }

  @Test
  public void estimate_recoversCubicDistortion() throws GeometryException {
    int n = 0;
    double[] fromX = new double[64];
    double[] fromY = new double[64];
    double[] toX = new double[64];
    double[] toY = new double[64];
    for (int i = 0; i < 8; ++i) {
      for (int j = 0; j < 8; ++j) {
        fromX[n] = 10. + 25. * i;
        fromY[n] = 20. + 80. * j;
        toX[n] = distortX(fromX[n], fromY[n]);
        toY[n] = distortY(fromX[n], fromY[n]);
        ++n;
      }
    }
    PolynomialTransform transform = PolynomialTransform.estimate(fromX, fromY, toX, toY, 3);
    assertEquals(3, transform.getOrder());
    // points between the control grid
    double[][] probes = {{33., 47.}, {100., 301.}, {170.5, 555.5}};
    for (double[] probe : probes) {
      double[] mapped = transform.apply(probe[0], probe[1]);
      assertEquals(distortX(probe[0], probe[1]), mapped[0], 1E-6);
      assertEquals(distortY(probe[0], probe[1]), mapped[1], 1E-6);
    }
  }

  @Test(expected = GeometryException.class)
  public void estimate_tooFewPointsThrows() throws GeometryException {
    double[] x = {0., 1., 2., 3., 4., 5., 6., 7., 8.};
    double[] y = {0., 1., 0., 1., 0., 1., 0., 1., 0.};
    PolynomialTransform.estimate(x, y, x, y, 3);
  }

  @Test(expected = GeometryException.class)
  public void estimate_collinearPointsThrows() throws GeometryException {
    double[] x = new double[20];
    double[] y = new double[20];
    for (int i = 0; i < x.length; ++i) {
      x[i] = i;
      y[i] = 5.;
    }
    PolynomialTransform.estimate(x, y, x, y, 2);
  }

  @Test(expected = GeometryException.class)
  public void estimate_mismatchedLengthsThrows() throws GeometryException {
    double[] x = new double[12];
    PolynomialTransform.estimate(x, x, x, new double[11], 1);
  }

  @Test
  public void warp_shiftedTransformMovesColumns() throws GeometryException {
    int n = 0;
    double[] fromX = new double[25];
    double[] fromY = new double[25];
    double[] toX = new double[25];
    double[] toY = new double[25];
    for (int i = 0; i < 5; ++i) {
      for (int j = 0; j < 5; ++j) {
        fromX[n] = 4. * i;
        fromY[n] = 3. * j;
        toX[n] = fromX[n] + 2.;
        toY[n] = fromY[n];
        ++n;
      }
    }
    PolynomialTransform transform = PolynomialTransform.estimate(fromX, fromY, toX, toY, 1);
    double[][] image = new double[12][16];
    for (int row = 0; row < image.length; ++row) {
      for (int col = 0; col < image[0].length; ++col) {
        image[row][col] = 10. * row + col * col;
      }
    }
    double[][] warped = transform.warp(image);
    for (int row = 1; row < image.length - 1; ++row) {
      for (int col = 1; col < image[0].length - 4; ++col) {
        assertEquals(image[row][col + 2], warped[row][col], 1E-6);
      }
    }
    // sampled beyond the right edge of the input
    assertArrayEquals(new double[]{0., 0.}, new double[]{warped[5][14], warped[5][15]}, 0.);
  }
}
