package kcwi.wavecal.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import kcwi.wavecal.CalibrationException.GeometryException;
import kcwi.wavecal.utils.PolynomialTransform;

/**
 * All control points gathered from tracing the bars, with the reference row and window
 * half-width they were measured with. Points are kept in bar order.
 */
public class ControlPointSet {

  private final List<ControlPoint> points;
  private final int referenceRow;
  private final int window;

  public ControlPointSet(List<ControlPoint> points, int referenceRow, int window) {
    this.points = Collections.unmodifiableList(new ArrayList<>(points));
    this.referenceRow = referenceRow;
    this.window = window;
  }

  public List<ControlPoint> getPoints() {
    return points;
  }

  public int size() {
    return points.size();
  }

  public int getReferenceRow() {
    return referenceRow;
  }

  public int getWindow() {
    return window;
  }

  /**
   * Get the points belonging to one bar, in trace order.
   */
  public List<ControlPoint> getPointsForBar(int barId) {
    List<ControlPoint> out = new ArrayList<>();
    for (ControlPoint point : points) {
      if (point.getBarId() == barId) {
        out.add(point);
      }
    }
    return out;
  }

  /**
   * Get the control points that lie on the reference row, one per traced bar.
   */
  public List<ControlPoint> getReferenceRowPoints() {
    List<ControlPoint> out = new ArrayList<>();
    for (ControlPoint point : points) {
      if (point.getDestinationY() == referenceRow) {
        out.add(point);
      }
    }
    return out;
  }

  public double[] getSourceX() {
    return points.stream().mapToDouble(ControlPoint::getSourceX).toArray();
  }

  public double[] getSourceY() {
    return points.stream().mapToDouble(ControlPoint::getSourceY).toArray();
  }

  public double[] getDestinationX() {
    return points.stream().mapToDouble(ControlPoint::getDestinationX).toArray();
  }

  public double[] getDestinationY() {
    return points.stream().mapToDouble(ControlPoint::getDestinationY).toArray();
  }

  /**
   * Fit the rectifying transform: maps rectified (destination) coordinates back to detector
   * (source) coordinates, the direction needed to resample a frame.
   *
   * @param order Polynomial order of the transform
   * @return Fitted transform
   * @throws GeometryException if the points cannot constrain the transform
   */
  public PolynomialTransform fitTransform(int order) throws GeometryException {
    return PolynomialTransform.estimate(getDestinationX(), getDestinationY(),
        getSourceX(), getSourceY(), order);
  }
}
