package kcwi.wavecal.model;

import java.util.Arrays;

/**
 * Final wavelength solution for one bar. A SOLVED bar carries the robust polynomial fit and
 * its quality metrics; a FAILED bar carries the reason it could not be solved.
 */
public class BarSolution {

  public enum Status {
    SOLVED,
    FAILED
  }

  private final int barId;
  private final int sliceId;
  private final Status status;
  private final PhysicalDispersionModel centralModel;
  private final PolynomialFit fit;
  private final double[] rmsHistory;
  private final int rejectedLines;
  private final String failureReason;

  private BarSolution(int barId, int sliceId, Status status,
      PhysicalDispersionModel centralModel, PolynomialFit fit, double[] rmsHistory,
      int rejectedLines, String failureReason) {
    this.barId = barId;
    this.sliceId = sliceId;
    this.status = status;
    this.centralModel = centralModel;
    this.fit = fit;
    this.rmsHistory = rmsHistory;
    this.rejectedLines = rejectedLines;
    this.failureReason = failureReason;
  }

  public static BarSolution solved(int barId, int sliceId, PhysicalDispersionModel centralModel,
      PolynomialFit fit, double[] rmsHistory, int rejectedLines) {
    return new BarSolution(barId, sliceId, Status.SOLVED, centralModel, fit,
        rmsHistory.clone(), rejectedLines, "");
  }

  public static BarSolution failed(int barId, int sliceId, PhysicalDispersionModel centralModel,
      String reason) {
    return new BarSolution(barId, sliceId, Status.FAILED, centralModel, null, new double[]{}, 0,
        reason);
  }

  public int getBarId() {
    return barId;
  }

  public int getSliceId() {
    return sliceId;
  }

  public Status getStatus() {
    return status;
  }

  public boolean isSolved() {
    return status == Status.SOLVED;
  }

  /**
   * @return the grating-equation model from the central-region search, null if that failed
   */
  public PhysicalDispersionModel getCentralModel() {
    return centralModel;
  }

  /**
   * @return the final fit, null for a failed bar
   */
  public PolynomialFit getFit() {
    return fit;
  }

  public double getRms() {
    return fit == null ? Double.NaN : fit.getRms();
  }

  public int getLineCount() {
    return fit == null ? 0 : fit.getPointCount();
  }

  /**
   * @return RMS after the initial fit and after each rejection pass
   */
  public double[] getRmsHistory() {
    return rmsHistory.clone();
  }

  public int getRejectedLines() {
    return rejectedLines;
  }

  public String getFailureReason() {
    return failureReason;
  }

  @Override
  public String toString() {
    if (!isSolved()) {
      return "Bar " + barId + " FAILED: " + failureReason;
    }
    return "Bar " + barId + " SOLVED: rms=" + getRms() + " lines=" + getLineCount()
        + " coefficients=" + Arrays.toString(fit.getCoefficients());
  }
}
