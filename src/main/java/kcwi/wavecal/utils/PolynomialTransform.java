package kcwi.wavecal.utils;

import java.util.stream.IntStream;
import kcwi.wavecal.CalibrationException.GeometryException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

/**
 * Two-dimensional polynomial coordinate mapping of a given order, estimated by least squares
 * from matched point pairs: x' = sum a_ij x^i y^j and y' = sum b_ij x^i y^j for i + j <= order.
 * Inputs are scaled into [-1, 1] before fitting to keep the normal equations well-conditioned.
 *
 * Used to rectify frames: {@link #warp(double[][])} treats the transform as mapping output
 * (rectified) coordinates to positions in the input frame.
 */
public class PolynomialTransform {

  private final int order;
  private final double[] xParams;
  private final double[] yParams;
  private final double centerX;
  private final double centerY;
  private final double scaleX;
  private final double scaleY;

  private PolynomialTransform(int order, double[] xParams, double[] yParams,
      double centerX, double centerY, double scaleX, double scaleY) {
    this.order = order;
    this.xParams = xParams;
    this.yParams = yParams;
    this.centerX = centerX;
    this.centerY = centerY;
    this.scaleX = scaleX;
    this.scaleY = scaleY;
  }

  /**
   * Number of polynomial terms for a transform of the given order.
   */
  public static int termCount(int order) {
    return (order + 1) * (order + 2) / 2;
  }

  /**
   * Fit the transform taking (fromX, fromY) onto (toX, toY).
   *
   * @param fromX x coordinates in the domain of the mapping
   * @param fromY y coordinates in the domain of the mapping
   * @param toX x coordinates the domain points should map to
   * @param toY y coordinates the domain points should map to
   * @param order Polynomial order
   * @return fitted transform
   * @throws GeometryException if there are too few points or the system is singular
   */
  public static PolynomialTransform estimate(double[] fromX, double[] fromY,
      double[] toX, double[] toY, int order) throws GeometryException {
    int n = fromX.length;
    if (fromY.length != n || toX.length != n || toY.length != n) {
      throw new GeometryException("Control point arrays differ in length");
    }
    int terms = termCount(order);
    if (n < terms) {
      throw new GeometryException("Need at least " + terms + " control points for an order "
          + order + " transform, have " + n);
    }

    double minX = Double.POSITIVE_INFINITY;
    double maxX = Double.NEGATIVE_INFINITY;
    double minY = Double.POSITIVE_INFINITY;
    double maxY = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < n; ++i) {
      minX = Math.min(minX, fromX[i]);
      maxX = Math.max(maxX, fromX[i]);
      minY = Math.min(minY, fromY[i]);
      maxY = Math.max(maxY, fromY[i]);
    }
    double centerX = (maxX + minX) / 2.;
    double centerY = (maxY + minY) / 2.;
    double scaleX = Math.max((maxX - minX) / 2., 1.);
    double scaleY = Math.max((maxY - minY) / 2., 1.);

    RealMatrix design = MatrixUtils.createRealMatrix(n, terms);
    for (int i = 0; i < n; ++i) {
      design.setRow(i, basis((fromX[i] - centerX) / scaleX, (fromY[i] - centerY) / scaleY, order));
    }
    DecompositionSolver solver = new QRDecomposition(design, 1E-12).getSolver();
    try {
      RealVector xSolution = solver.solve(new ArrayRealVector(toX));
      RealVector ySolution = solver.solve(new ArrayRealVector(toY));
      return new PolynomialTransform(order, xSolution.toArray(), ySolution.toArray(),
          centerX, centerY, scaleX, scaleY);
    } catch (SingularMatrixException e) {
      throw new GeometryException("Control points do not constrain an order " + order
          + " transform (degenerate point distribution)", e);
    }
  }

  private static double[] basis(double u, double v, int order) {
    double[] row = new double[termCount(order)];
    int index = 0;
    for (int total = 0; total <= order; ++total) {
      for (int j = 0; j <= total; ++j) {
        int i = total - j;
        row[index++] = Math.pow(u, i) * Math.pow(v, j);
      }
    }
    return row;
  }

  public int getOrder() {
    return order;
  }

  /**
   * Map a single point.
   *
   * @param x x coordinate
   * @param y y coordinate
   * @return two-element array of the mapped x and y
   */
  public double[] apply(double x, double y) {
    double[] row = basis((x - centerX) / scaleX, (y - centerY) / scaleY, order);
    double outX = 0.;
    double outY = 0.;
    for (int k = 0; k < row.length; ++k) {
      outX += xParams[k] * row[k];
      outY += yParams[k] * row[k];
    }
    return new double[]{outX, outY};
  }

  /**
   * Produce a frame of the same shape as the input, where each output pixel (column c, row r)
   * takes the bilinearly interpolated input value at apply(c, r). Samples that fall outside the
   * input frame are set to zero.
   *
   * @param image Input frame indexed [row][column]
   * @return Warped frame indexed [row][column]
   */
  public double[][] warp(double[][] image) {
    int ny = image.length;
    int nx = image[0].length;
    double[][] out = new double[ny][nx];
    IntStream.range(0, ny).parallel().forEach(row -> {
      for (int col = 0; col < nx; ++col) {
        double[] source = apply(col, row);
        out[row][col] = bilinear(image, source[0], source[1]);
      }
    });
    return out;
  }

  private static double bilinear(double[][] image, double x, double y) {
    int ny = image.length;
    int nx = image[0].length;
    if (x < 0 || y < 0 || x > nx - 1 || y > ny - 1) {
      return 0.;
    }
    int x0 = Math.min((int) Math.floor(x), nx - 2);
    int y0 = Math.min((int) Math.floor(y), ny - 2);
    x0 = Math.max(x0, 0);
    y0 = Math.max(y0, 0);
    double fx = x - x0;
    double fy = y - y0;
    int x1 = Math.min(x0 + 1, nx - 1);
    int y1 = Math.min(y0 + 1, ny - 1);
    double top = image[y0][x0] * (1 - fx) + image[y0][x1] * fx;
    double bottom = image[y1][x0] * (1 - fx) + image[y1][x1] * fx;
    return top * (1 - fy) + bottom * fy;
  }

}
