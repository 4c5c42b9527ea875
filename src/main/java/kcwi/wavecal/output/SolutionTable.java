package kcwi.wavecal.output;

import java.io.File;
import java.io.IOException;
import java.util.List;
import kcwi.wavecal.model.BarSolution;
import kcwi.wavecal.model.CalibrationReport;
import kcwi.wavecal.utils.FitsUtils;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTable;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import org.apache.log4j.Logger;

/**
 * Writes per-bar wavelength solutions as a FITS binary table with one row per bar.
 * Columns CENT0 to CENT4 hold the central grating-equation model about the reference pixel,
 * highest power first; COEF0 onward hold the final pixel-to-wavelength polynomial, lowest
 * power first, with at least five terms. Failed bars have STATUS 0 and NaN coefficients.
 */
public class SolutionTable {

  private static final Logger logger = Logger.getLogger(SolutionTable.class);

  static final int TERMS = 5;

  /**
   * Write a report's solutions to a FITS file, replacing any existing file.
   *
   * @param file Destination
   * @param report Solutions to write
   * @throws IOException if the table cannot be built or written
   */
  public static void write(File file, CalibrationReport report) throws IOException {
    List<BarSolution> solutions = report.getSolutions();
    int rows = solutions.size();
    int[] barIds = new int[rows];
    int[] sliceIds = new int[rows];
    int[] status = new int[rows];
    int[] lineCounts = new int[rows];
    double[] rms = new double[rows];
    int fitTerms = TERMS;
    for (BarSolution solution : solutions) {
      if (solution.isSolved()) {
        fitTerms = Math.max(fitTerms, solution.getFit().getCoefficients().length);
      }
    }
    double[][] central = new double[TERMS][rows];
    double[][] coefficients = new double[fitTerms][rows];

    for (int row = 0; row < rows; ++row) {
      BarSolution solution = solutions.get(row);
      barIds[row] = solution.getBarId();
      sliceIds[row] = solution.getSliceId();
      status[row] = solution.isSolved() ? 1 : 0;
      lineCounts[row] = solution.getLineCount();
      rms[row] = solution.getRms();
      double[] model = solution.getCentralModel() == null ?
          null : solution.getCentralModel().getCoefficients();
      double[] fit = solution.isSolved() ? solution.getFit().getCoefficients() : null;
      for (int term = 0; term < TERMS; ++term) {
        central[term][row] = model == null ? Double.NaN : model[term];
      }
      for (int term = 0; term < fitTerms; ++term) {
        if (fit == null) {
          coefficients[term][row] = Double.NaN;
        } else {
          coefficients[term][row] = term < fit.length ? fit[term] : 0.;
        }
      }
    }

    Object[] columns = new Object[5 + TERMS + fitTerms];
    columns[0] = barIds;
    columns[1] = sliceIds;
    columns[2] = status;
    columns[3] = lineCounts;
    columns[4] = rms;
    for (int term = 0; term < TERMS; ++term) {
      columns[5 + term] = central[term];
    }
    for (int term = 0; term < fitTerms; ++term) {
      columns[5 + TERMS + term] = coefficients[term];
    }

    try {
      BinaryTableHDU table = (BinaryTableHDU) Fits.makeHDU(new BinaryTable(columns));
      table.setColumnName(0, "BARID", "bar index");
      table.setColumnName(1, "SLICEID", "slice index");
      table.setColumnName(2, "STATUS", "1 if solved, 0 if failed");
      table.setColumnName(3, "NLINES", "lines in final fit");
      table.setColumnName(4, "RMS", "final fit rms (A)");
      for (int term = 0; term < TERMS; ++term) {
        table.setColumnName(5 + term, "CENT" + term, "central model term " + term);
      }
      for (int term = 0; term < fitTerms; ++term) {
        table.setColumnName(5 + TERMS + term, "COEF" + term, "pixel^" + term + " coefficient");
      }
      table.addValue("NSOLVED", report.getSolvedCount(), "bars with a solution");
      table.addValue("NFAILED", rows - report.getSolvedCount(), "bars without a solution");
      FitsUtils.write(file, BasicHDU.getDummyHDU(), table);
    } catch (FitsException e) {
      throw new IOException("Could not write solutions to " + file.getAbsolutePath(), e);
    }
    logger.info("Wrote " + rows + " bar solutions to " + file.getAbsolutePath());
  }
}
