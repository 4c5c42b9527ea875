package kcwi.wavecal.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Finds local maxima in a 1D series and filters them by height, separation and width.
 * Works like a builder: set the conditions that should apply, then call {@link #find(double[])}.
 *
 * Flat-topped maxima resolve to the middle sample of the plateau. Widths are measured at half of
 * each peak's prominence, with the crossing points linearly interpolated between samples; those
 * crossing positions are reported with each peak so callers can define fitting windows from them.
 */
public class PeakFinder {

  /**
   * A single maximum and the measurements taken of it.
   */
  public static class Peak {

    private final int index;
    private final double height;
    private double prominence;
    private double leftPosition;
    private double rightPosition;

    Peak(int index, double height) {
      this.index = index;
      this.height = height;
      this.leftPosition = index;
      this.rightPosition = index;
    }

    public int getIndex() {
      return index;
    }

    public double getHeight() {
      return height;
    }

    public double getProminence() {
      return prominence;
    }

    /**
     * @return interpolated position where the left flank crosses half the prominence
     */
    public double getLeftPosition() {
      return leftPosition;
    }

    /**
     * @return interpolated position where the right flank crosses half the prominence
     */
    public double getRightPosition() {
      return rightPosition;
    }

    public double getWidth() {
      return rightPosition - leftPosition;
    }
  }

  private double minHeight = Double.NEGATIVE_INFINITY;
  private double distance = 0.;
  private double minWidth = Double.NEGATIVE_INFINITY;
  private double maxWidth = Double.POSITIVE_INFINITY;

  public PeakFinder setMinHeight(double minHeight) {
    this.minHeight = minHeight;
    return this;
  }

  /**
   * Minimum separation in samples between retained peaks; where two peaks are closer than this
   * the lower one is dropped.
   */
  public PeakFinder setDistance(double distance) {
    this.distance = distance;
    return this;
  }

  public PeakFinder setWidthRange(double minWidth, double maxWidth) {
    this.minWidth = minWidth;
    this.maxWidth = maxWidth;
    return this;
  }

  /**
   * Run the search over the given data.
   *
   * @param values Series to search
   * @return Peaks meeting every condition, in order of position
   */
  public List<Peak> find(double[] values) {
    List<Peak> peaks = localMaxima(values);

    List<Peak> tall = new ArrayList<>();
    for (Peak peak : peaks) {
      if (peak.height >= minHeight) {
        tall.add(peak);
      }
    }
    peaks = tall;

    if (distance > 1.) {
      peaks = selectByDistance(peaks, (int) Math.ceil(distance));
    }

    List<Peak> out = new ArrayList<>();
    for (Peak peak : peaks) {
      measure(values, peak);
      double width = peak.getWidth();
      if (width >= minWidth && width <= maxWidth) {
        out.add(peak);
      }
    }
    return out;
  }

  static List<Peak> localMaxima(double[] x) {
    List<Peak> peaks = new ArrayList<>();
    int i = 1;
    int iMax = x.length - 1;
    while (i < iMax) {
      if (x[i - 1] < x[i]) {
        int ahead = i + 1;
        while (ahead < iMax && x[ahead] == x[i]) {
          ++ahead;
        }
        if (x[ahead] < x[i]) {
          int midpoint = (i + ahead - 1) / 2;
          peaks.add(new Peak(midpoint, x[midpoint]));
          i = ahead;
        }
      }
      ++i;
    }
    return peaks;
  }

  private static List<Peak> selectByDistance(List<Peak> peaks, int minDistance) {
    int n = peaks.size();
    boolean[] keep = new boolean[n];
    Arrays.fill(keep, true);
    Integer[] order = new Integer[n];
    for (int i = 0; i < n; ++i) {
      order[i] = i;
    }
    // stable sort, tallest evaluated first; among equals the later peak wins
    Arrays.sort(order, Comparator.comparingDouble(i -> peaks.get(i).height));
    for (int o = n - 1; o >= 0; --o) {
      int j = order[o];
      if (!keep[j]) {
        continue;
      }
      int pos = peaks.get(j).index;
      for (int k = j - 1; k >= 0 && pos - peaks.get(k).index < minDistance; --k) {
        keep[k] = false;
      }
      for (int k = j + 1; k < n && peaks.get(k).index - pos < minDistance; ++k) {
        keep[k] = false;
      }
    }
    List<Peak> out = new ArrayList<>();
    for (int i = 0; i < n; ++i) {
      if (keep[i]) {
        out.add(peaks.get(i));
      }
    }
    return out;
  }

  private static void measure(double[] x, Peak peak) {
    int p = peak.index;
    double top = x[p];

    int leftBase = p;
    double leftMin = top;
    for (int i = p; i >= 0 && x[i] <= top; --i) {
      if (x[i] < leftMin) {
        leftMin = x[i];
        leftBase = i;
      }
    }
    int rightBase = p;
    double rightMin = top;
    for (int i = p; i < x.length && x[i] <= top; ++i) {
      if (x[i] < rightMin) {
        rightMin = x[i];
        rightBase = i;
      }
    }
    peak.prominence = top - Math.max(leftMin, rightMin);

    double height = top - peak.prominence * 0.5;
    int i = p;
    while (leftBase < i && height < x[i]) {
      --i;
    }
    double left = i;
    if (x[i] < height) {
      left += (height - x[i]) / (x[i + 1] - x[i]);
    }
    i = p;
    while (i < rightBase && height < x[i]) {
      ++i;
    }
    double right = i;
    if (x[i] < height) {
      right -= (height - x[i]) / (x[i - 1] - x[i]);
    }
    peak.leftPosition = left;
    peak.rightPosition = right;
  }

}
