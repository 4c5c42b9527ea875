package kcwi.wavecal.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class LineWindowTest {

  private static double[] line(int length, double center, double height, double sigma) {
    double[] out = new double[length];
    for (int i = 0; i < length; ++i) {
      double dx = i - center;
      out[i] = height * Math.exp(-0.5 * dx * dx / (sigma * sigma));
    }
    return out;
  }

  @Test
  public void find_spansLineProfile() {
    double[] spectrum = line(100, 50.3, 1000., 2.);
    LineWindow window = LineWindow.find(spectrum, 48, 50.);
    assertNotNull(window);
    assertTrue(window.getFirst() < 50);
    assertTrue(window.getLast() > 50);
    assertTrue(spectrum[window.getFirst()] <= 500.);
    assertTrue(spectrum[window.getLast()] <= 500.);
    assertTrue(window.getCount() >= 5);
  }

  @Test
  public void find_climbsToOffsetPeak() {
    double[] spectrum = line(100, 55., 1000., 1.5);
    LineWindow window = LineWindow.find(spectrum, 51, 50.);
    assertNotNull(window);
    assertTrue(window.getFirst() <= 55 && window.getLast() >= 55);
  }

  @Test
  public void find_faintLineRejected() {
    double[] spectrum = line(100, 50., 20., 2.);
    assertNull(LineWindow.find(spectrum, 50, 50.));
  }

  @Test
  public void find_startNearEdgeRejected() {
    double[] spectrum = line(100, 1., 1000., 2.);
    assertNull(LineWindow.find(spectrum, 1, 50.));
    assertNull(LineWindow.find(spectrum, 98, 50.));
  }

  @Test
  public void find_blendedNeighborRejected() {
    double[] first = line(100, 50., 1000., 3.);
    double[] second = line(100, 58., 900., 3.);
    double[] spectrum = new double[100];
    for (int i = 0; i < spectrum.length; ++i) {
      spectrum[i] = first[i] + second[i];
    }
    // the profile rises into the neighbor before falling to half maximum
    assertNull(LineWindow.find(spectrum, 50, 50.));
  }

  @Test
  public void find_isolatedLineWindowIsSymmetric() {
    double[] spectrum = line(100, 50., 1000., 3.);
    LineWindow window = LineWindow.find(spectrum, 50, 50.);
    assertNotNull(window);
    assertEquals(50 - window.getFirst(), window.getLast() - 50);
  }
}
