package kcwi.wavecal.model;

import java.util.Arrays;

/**
 * Sub-pixel x positions of the bars in the reference row of a bars frame, along with the row
 * itself and the half-width of the window used to measure them. An empty centroid array means
 * the locator did not find the expected number of bars.
 */
public class BarLocation {

  private final double[] centroids;
  private final int referenceRow;
  private final int window;

  public BarLocation(double[] centroids, int referenceRow, int window) {
    this.centroids = centroids.clone();
    this.referenceRow = referenceRow;
    this.window = window;
  }

  public double[] getCentroids() {
    return centroids.clone();
  }

  public double getCentroid(int bar) {
    return centroids[bar];
  }

  public int getBarCount() {
    return centroids.length;
  }

  public int getReferenceRow() {
    return referenceRow;
  }

  public int getWindow() {
    return window;
  }

  /**
   * @return True if the locator produced centroids the tracer can use
   */
  public boolean isValid() {
    return centroids.length > 0;
  }

  @Override
  public String toString() {
    return "BarLocation[row=" + referenceRow + ", window=" + window + ", centroids="
        + Arrays.toString(centroids) + "]";
  }
}
