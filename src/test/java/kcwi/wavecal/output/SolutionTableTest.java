package kcwi.wavecal.output;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import kcwi.wavecal.model.BarSolution;
import kcwi.wavecal.model.CalibrationReport;
import kcwi.wavecal.model.PolynomialFit;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class SolutionTableTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void write_statusAndCoefficients() throws Exception {
    File file = folder.newFile("arc_wavesol.fits");
    SolutionTable.write(file, CalResultTest.report());

    try (Fits fits = new Fits(file)) {
      BinaryTableHDU table = (BinaryTableHDU) fits.getHDU(1);
      assertEquals(2, table.getNRows());
      assertArrayEquals(new int[]{1, 0},
          (int[]) table.getColumn(table.findColumn("STATUS")));
      assertArrayEquals(new int[]{40, 0},
          (int[]) table.getColumn(table.findColumn("NLINES")));
      double[] coef0 = (double[]) table.getColumn(table.findColumn("COEF0"));
      assertEquals(4350., coef0[0], 0.);
      assertTrue(Double.isNaN(coef0[1]));
      // lower-degree fits are padded with zeros up to the minimum term count
      double[] coef4 = (double[]) table.getColumn(table.findColumn("COEF4"));
      assertEquals(0., coef4[0], 0.);
      assertEquals(-1, table.findColumn("COEF5"));
      double[] cent4 = (double[]) table.getColumn(table.findColumn("CENT4"));
      assertEquals(4500., cent4[0], 0.);
      assertTrue(Double.isNaN(cent4[1]));
      assertEquals(1, table.getHeader().getIntValue("NSOLVED"));
      assertEquals(1, table.getHeader().getIntValue("NFAILED"));
    }
  }

  @Test
  public void write_higherDegreeAddsColumns() throws Exception {
    File file = folder.newFile("deg6_wavesol.fits");
    double[] coefficients = {4000., 0.5, 1E-6, 1E-9, 1E-12, 1E-15, 1E-18};
    BarSolution solution = BarSolution.solved(0, 0, null,
        new PolynomialFit(coefficients, 0.01, 30), new double[]{0.01}, 0);
    SolutionTable.write(file, new CalibrationReport(Arrays.asList(solution),
        Collections.<Integer, String>emptyMap()));

    try (Fits fits = new Fits(file)) {
      BinaryTableHDU table = (BinaryTableHDU) fits.getHDU(1);
      double[] coef6 = (double[]) table.getColumn(table.findColumn("COEF6"));
      assertEquals(1E-18, coef6[0], 0.);
      assertEquals(-1, table.findColumn("COEF7"));
    }
  }
}
