package kcwi.wavecal.output;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import kcwi.wavecal.model.BarSolution;
import kcwi.wavecal.model.CalibrationReport;

/**
 * Holds the results of a calibration run in a form that external programs can read without
 * knowing the engine's types. CalResult contains two maps, one of which is a map from string
 * descriptors to a set of binary objects representing images as PNGs (stored as byte arrays so
 * they can be stored directly by a database backend) and the other of which is a map from
 * string descriptors to the values produced by the run, given as arrays of doubles.
 * In practice this is only used by the Python gateway.
 */
public class CalResult {

  /**
   * Get data from a wavelength calibration run.
   *
   * Numeric entries are "Bar_ids", "Solved_bars", "Failed_bars", "Fit_rms", "Line_counts",
   * "Rejected_lines", and for each bar n "Bar_n_coefficients" (final pixel-to-wavelength
   * polynomial, lowest power first; empty for a failed bar) and "Bar_n_central_model"
   * (grating-equation model about the reference pixel, highest power first).
   *
   * @param report Solutions from the run
   * @param imageNames Names for the plot images, in the same order as the images
   * @param images plots converted to png-format images as byte arrays
   * @return object holding these values in easily-accessed maps with variable descriptions
   */
  public static CalResult buildWavelengthSolutionData(CalibrationReport report,
      String[] imageNames, byte[][] images) {
    if (imageNames.length != images.length) {
      throw new IllegalArgumentException("Got " + imageNames.length + " image names for "
          + images.length + " images");
    }
    List<BarSolution> solutions = report.getSolutions();
    int bars = solutions.size();
    double[] barIds = new double[bars];
    double[] rms = new double[bars];
    double[] lineCounts = new double[bars];
    double[] rejected = new double[bars];
    double[] solved = new double[report.getSolvedCount()];
    double[] failed = new double[bars - solved.length];

    CalResult out = new CalResult();
    int solvedIndex = 0;
    int failedIndex = 0;
    for (int i = 0; i < bars; ++i) {
      BarSolution solution = solutions.get(i);
      barIds[i] = solution.getBarId();
      rms[i] = solution.getRms();
      lineCounts[i] = solution.getLineCount();
      rejected[i] = solution.getRejectedLines();
      if (solution.isSolved()) {
        solved[solvedIndex++] = solution.getBarId();
        out.numerMap.put("Bar_" + solution.getBarId() + "_coefficients",
            solution.getFit().getCoefficients());
      } else {
        failed[failedIndex++] = solution.getBarId();
        out.numerMap.put("Bar_" + solution.getBarId() + "_coefficients", new double[]{});
      }
      if (solution.getCentralModel() != null) {
        out.numerMap.put("Bar_" + solution.getBarId() + "_central_model",
            solution.getCentralModel().getCoefficients());
      }
    }
    out.numerMap.put("Bar_ids", barIds);
    out.numerMap.put("Solved_bars", solved);
    out.numerMap.put("Failed_bars", failed);
    out.numerMap.put("Fit_rms", rms);
    out.numerMap.put("Line_counts", lineCounts);
    out.numerMap.put("Rejected_lines", rejected);
    for (int i = 0; i < images.length; ++i) {
      out.imageMap.put(imageNames[i], images[i]);
    }
    return out;
  }

  private final Map<String, double[]> numerMap;
  private final Map<String, byte[]> imageMap;

  private CalResult() {
    numerMap = new HashMap<>();
    imageMap = new HashMap<>();
  }

  /**
   * Get the PNG images produced by the run, keyed by plot name
   * @return Map from plot names to PNG bytes
   */
  public Map<String, byte[]> getImageMap() {
    return imageMap;
  }

  /**
   * Get the numeric results of the run, keyed by description
   * @return Map from descriptions to values
   */
  public Map<String, double[]> getNumerMap() {
    return numerMap;
  }
}
