package kcwi.wavecal.utils;

import static org.junit.Assert.assertEquals;

import java.util.List;
import kcwi.wavecal.utils.PeakFinder.Peak;
import org.junit.Test;

public class PeakFinderTest {

  private static double[] gaussians(int length, double[] centers, double[] heights,
      double sigma) {
    double[] out = new double[length];
    for (int i = 0; i < length; ++i) {
      for (int k = 0; k < centers.length; ++k) {
        double dx = i - centers[k];
        out[i] += heights[k] * Math.exp(-0.5 * dx * dx / (sigma * sigma));
      }
    }
    return out;
  }

  @Test
  public void find_allPeaksByDefault() {
    double[] data = gaussians(200, new double[]{30., 80., 150.}, new double[]{5., 10., 2.}, 3.);
    List<Peak> peaks = new PeakFinder().find(data);
    assertEquals(3, peaks.size());
    assertEquals(30, peaks.get(0).getIndex());
    assertEquals(80, peaks.get(1).getIndex());
    assertEquals(150, peaks.get(2).getIndex());
  }

  @Test
  public void find_minHeightDropsFaintPeaks() {
    double[] data = gaussians(200, new double[]{30., 80., 150.}, new double[]{5., 10., 2.}, 3.);
    List<Peak> peaks = new PeakFinder().setMinHeight(4.).find(data);
    assertEquals(2, peaks.size());
    assertEquals(30, peaks.get(0).getIndex());
    assertEquals(80, peaks.get(1).getIndex());
  }

  @Test
  public void find_distanceKeepsTallerPeak() {
    double[] data = gaussians(200, new double[]{50., 62.}, new double[]{5., 10.}, 2.);
    List<Peak> peaks = new PeakFinder().setDistance(20.).find(data);
    assertEquals(1, peaks.size());
    assertEquals(62, peaks.get(0).getIndex());
  }

  @Test
  public void find_widthIsFullWidthHalfMaximum() {
    double sigma = 4.;
    double[] data = gaussians(200, new double[]{100.}, new double[]{10.}, sigma);
    Peak peak = new PeakFinder().find(data).get(0);
    assertEquals(2.3548 * sigma, peak.getWidth(), 0.1);
    assertEquals(100., (peak.getLeftPosition() + peak.getRightPosition()) / 2., 1E-6);
  }

  @Test
  public void find_widthRangeFilters() {
    double[] broad = gaussians(300, new double[]{200.}, new double[]{8.}, 8.);
    double[] narrow = gaussians(300, new double[]{60.}, new double[]{10.}, 2.);
    double[] data = new double[300];
    for (int i = 0; i < data.length; ++i) {
      data[i] = narrow[i] + broad[i];
    }
    List<Peak> peaks = new PeakFinder().setWidthRange(2., 8.).find(data);
    assertEquals(1, peaks.size());
    assertEquals(60, peaks.get(0).getIndex());
  }

  @Test
  public void localMaxima_plateauResolvesToMiddle() {
    double[] data = {0., 1., 3., 3., 3., 3., 1., 0.};
    List<Peak> peaks = PeakFinder.localMaxima(data);
    assertEquals(1, peaks.size());
    assertEquals(3, peaks.get(0).getIndex());
  }
}
