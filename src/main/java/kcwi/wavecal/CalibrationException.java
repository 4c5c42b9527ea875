package kcwi.wavecal;

/**
 * Checked exception raised when a calibration stage cannot produce a usable result.
 * The nested subclasses name the precondition that was violated so that callers can tell
 * geometric failures (which make the whole run unusable) from fit failures that only affect
 * a single bar.
 */
public class CalibrationException extends Exception {

  private static final long serialVersionUID = -3020188135826465251L;

  public CalibrationException(String message) {
    super(message);
  }

  public CalibrationException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Wrong bar count found by the locator, a trace failure, or a degenerate set of control
   * points for the spatial transform.
   */
  public static class GeometryException extends CalibrationException {

    private static final long serialVersionUID = 1612079546403373211L;

    public GeometryException(String message) {
      super(message);
    }

    public GeometryException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * Number of arc spectra extracted after warping does not match the number of bars.
   */
  public static class ExtractionException extends CalibrationException {

    private static final long serialVersionUID = -6402216766306317342L;

    public ExtractionException(String message) {
      super(message);
    }
  }

  /**
   * Cross-correlation produced no usable peak (i.e., the correlation was flat).
   */
  public static class AlignmentException extends CalibrationException {

    private static final long serialVersionUID = 4497113592618398062L;

    public AlignmentException(String message) {
      super(message);
    }
  }

  /**
   * Atlas file for the requested lamp is missing or could not be parsed.
   */
  public static class AtlasException extends CalibrationException {

    private static final long serialVersionUID = 2335563357201850047L;

    public AtlasException(String message) {
      super(message);
    }

    public AtlasException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * A per-bar or per-line fit was underdetermined or numerically singular.
   */
  public static class FitException extends CalibrationException {

    private static final long serialVersionUID = -8923017263570812293L;

    public FitException(String message) {
      super(message);
    }

    public FitException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
