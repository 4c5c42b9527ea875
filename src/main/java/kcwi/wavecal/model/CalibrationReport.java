package kcwi.wavecal.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of a calibration run: one solution per bar (in bar order) and the bars that failed,
 * with the reason for each.
 */
public class CalibrationReport {

  private final List<BarSolution> solutions;
  private final Map<Integer, String> failedBars;

  public CalibrationReport(List<BarSolution> solutions, Map<Integer, String> failedBars) {
    this.solutions = Collections.unmodifiableList(new ArrayList<>(solutions));
    this.failedBars = Collections.unmodifiableMap(new TreeMap<>(failedBars));
  }

  public List<BarSolution> getSolutions() {
    return solutions;
  }

  public BarSolution getSolution(int bar) {
    return solutions.get(bar);
  }

  public Map<Integer, String> getFailedBars() {
    return failedBars;
  }

  public int getSolvedCount() {
    int count = 0;
    for (BarSolution solution : solutions) {
      if (solution.isSolved()) {
        ++count;
      }
    }
    return count;
  }

  /**
   * @return True if every bar has a solution
   */
  public boolean isComplete() {
    return failedBars.isEmpty() && getSolvedCount() == solutions.size();
  }
}
