package kcwi.wavecal.model;

/**
 * One sample of a traced bar: where the bar was detected on the detector (source) and where it
 * belongs in the rectified frame (destination, x fixed at the bar's reference-row centroid).
 */
public class ControlPoint {

  private final int barId;
  private final int sliceId;
  private final double sourceX;
  private final double sourceY;
  private final double destinationX;
  private final double destinationY;

  public ControlPoint(int barId, int sliceId, double sourceX, double sourceY,
      double destinationX, double destinationY) {
    this.barId = barId;
    this.sliceId = sliceId;
    this.sourceX = sourceX;
    this.sourceY = sourceY;
    this.destinationX = destinationX;
    this.destinationY = destinationY;
  }

  public int getBarId() {
    return barId;
  }

  public int getSliceId() {
    return sliceId;
  }

  public double getSourceX() {
    return sourceX;
  }

  public double getSourceY() {
    return sourceY;
  }

  public double getDestinationX() {
    return destinationX;
  }

  public double getDestinationY() {
    return destinationY;
  }
}
