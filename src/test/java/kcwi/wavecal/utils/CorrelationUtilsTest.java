package kcwi.wavecal.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Random;
import kcwi.wavecal.utils.CorrelationUtils.CorrelationPeak;
import org.junit.Test;

public class CorrelationUtilsTest {

  @Test
  public void correlate_matchesDefinition() {
    double[] a = {1., 2., 3.};
    double[] v = {0., 1., 0.5};
    // lags -2..2
    double[] expected = {0.5, 2., 3.5, 3., 0.};
    assertArrayEquals(expected, CorrelationUtils.correlate(a, v), 1E-12);
  }

  @Test
  public void correlateFFT_agreesWithDirect() {
    Random random = new Random(1234);
    double[] a = new double[300];
    double[] v = new double[257];
    for (int i = 0; i < a.length; ++i) {
      a[i] = random.nextGaussian();
    }
    for (int i = 0; i < v.length; ++i) {
      v[i] = random.nextGaussian();
    }
    double[] direct = CorrelationUtils.correlateDirect(a, v);
    double[] fft = CorrelationUtils.correlateFFT(a, v);
    assertEquals(direct.length, fft.length);
    for (int i = 0; i < direct.length; ++i) {
      assertEquals(direct[i], fft[i], 1E-8);
    }
  }

  @Test
  public void fullPeak_positiveLagWhenFeatureLaterInFirst() {
    double[] a = new double[50];
    double[] v = new double[50];
    a[30] = 1.;
    v[22] = 1.;
    CorrelationPeak peak = CorrelationUtils.fullPeak(a, v);
    assertEquals(8, peak.getLag());
    assertEquals(-8, CorrelationUtils.fullPeak(v, a).getLag());
    assertFalse(peak.isFlat());
  }

  @Test
  public void fullPeak_flatForZeroSignal() {
    CorrelationPeak peak = CorrelationUtils.fullPeak(new double[20], new double[20]);
    assertTrue(peak.isFlat());
  }

  @Test
  public void centralThirdPeak_ignoresExtremeLags() {
    double[] a = new double[30];
    double[] v = new double[30];
    // strong match at lag 25, weak match at lag 2
    a[27] = 10.;
    v[2] = 10.;
    a[12] = 1.;
    v[10] = 1.;
    assertEquals(25, CorrelationUtils.fullPeak(a, v).getLag());
    assertEquals(2, CorrelationUtils.centralThirdPeak(a, v).getLag());
  }
}
