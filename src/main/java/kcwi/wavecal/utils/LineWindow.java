package kcwi.wavecal.utils;

import org.apache.log4j.Logger;

/**
 * Window around an emission line that spans its profile down to half of the local maximum.
 * Windows are produced by {@link #find(double[], int, double)}, which returns null when the line
 * cannot be isolated (too close to the detector edge, too faint, or not monotonically falling
 * on both sides).
 */
public class LineWindow {

  private static final Logger logger = Logger.getLogger(LineWindow.class);

  private final int first;
  private final int last;
  private final int count;

  LineWindow(int first, int last, int count) {
    this.first = first;
    this.last = last;
    this.count = count;
  }

  /**
   * @return first index of the window (inclusive)
   */
  public int getFirst() {
    return first;
  }

  /**
   * @return last index of the window (inclusive)
   */
  public int getLast() {
    return last;
  }

  /**
   * @return number of samples visited while growing the window
   */
  public int getCount() {
    return count;
  }

  /**
   * Search outward from a starting pixel for the window covering a line profile.
   *
   * The search first moves the initial 5-sample window uphill to the local maximum, re-centers
   * on it and checks that maximum against the threshold. Each side is then extended until the
   * profile falls to half the maximum. A side that rises again, climbs above the maximum, or
   * reaches the array edge causes the line to be rejected.
   *
   * @param y Spectrum to search
   * @param center Starting pixel (predicted line position)
   * @param threshold Minimum acceptable peak value
   * @return window, or null if the line was rejected
   */
  public static LineWindow find(double[] y, int center, double threshold) {
    int nx = y.length;
    if (center < 2 || center > nx - 3) {
      logger.debug("Line window rejected: start " + center + " too close to edge");
      return null;
    }
    int x0 = center - 2;
    int x1 = center + 2;
    double mx = max(y, x0, x1);
    int count = 5;

    // move the window onto the local maximum
    if (x0 - 1 < 0) {
      return null;
    }
    while (y[x0 - 1] > mx) {
      --x0;
      ++count;
      if (x0 - 1 < 0) {
        logger.debug("Line window rejected: low edge hit while climbing");
        return null;
      }
    }
    if (x1 + 1 >= nx) {
      return null;
    }
    while (y[x1 + 1] > mx) {
      ++x1;
      ++count;
      if (x1 + 1 >= nx) {
        logger.debug("Line window rejected: high edge hit while climbing");
        return null;
      }
    }

    int peak = NumericUtils.argmax(y, x0, x1 + 1);
    x0 = peak - 2;
    x1 = peak + 2;
    if (x0 < 0 || x1 >= nx) {
      return null;
    }
    mx = max(y, x0, x1);
    if (mx < threshold) {
      logger.debug("Line window rejected: peak " + mx + " below threshold " + threshold);
      return null;
    }

    double halfMax = mx * 0.5;
    double prev = mx;
    while (y[x0] > halfMax) {
      if (y[x0] > mx || x0 <= 0 || y[x0] > prev) {
        logger.debug("Line window rejected on low side near pixel " + x0);
        return null;
      }
      prev = y[x0];
      --x0;
      ++count;
    }
    prev = mx;
    while (y[x1] > halfMax) {
      if (y[x1] > mx || x1 >= nx - 1 || y[x1] > prev) {
        logger.debug("Line window rejected on high side near pixel " + x1);
        return null;
      }
      prev = y[x1];
      ++x1;
      ++count;
    }
    return new LineWindow(x0, x1, count);
  }

  private static double max(double[] y, int from, int to) {
    double mx = y[from];
    for (int i = from + 1; i <= to; ++i) {
      if (y[i] > mx || Double.isNaN(mx)) {
        mx = y[i];
      }
    }
    return mx;
  }

}
