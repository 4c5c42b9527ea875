package kcwi.wavecal.input;

/**
 * Image slicer sizes. The slicer sets the width of the slit image, and so both the spectral
 * resolution and how much an arc spectrum is smoothed before its lines are measured.
 */
public enum Slicer {

  SMALL("Small", 2.0, 1),
  MEDIUM("Medium", 1.0, 3),
  LARGE("Large", 0.5, 5);

  private final String name;
  private final double resolutionFactor;
  private final int smoothingWidth;

  Slicer(String name, double resolutionFactor, int smoothingWidth) {
    this.name = name;
    this.resolutionFactor = resolutionFactor;
    this.smoothingWidth = smoothingWidth;
  }

  public String getName() {
    return name;
  }

  /**
   * @return factor applied to a grating's medium-slicer resolving power
   */
  public double getResolutionFactor() {
    return resolutionFactor;
  }

  /**
   * @return boxcar width applied to arc spectra before line measurement (1 means none)
   */
  public int getSmoothingWidth() {
    return smoothingWidth;
  }

  /**
   * Match a slicer from an IFU name header value; the value only has to contain the name.
   *
   * @param ifuName header value, i.e., "Medium" or "BL Large"
   * @return matching slicer
   * @throws IllegalArgumentException if nothing matches
   */
  public static Slicer fromName(String ifuName) {
    String lower = ifuName.toLowerCase();
    for (Slicer slicer : values()) {
      if (lower.contains(slicer.name.toLowerCase())) {
        return slicer;
      }
    }
    throw new IllegalArgumentException("Unknown slicer: " + ifuName);
  }
}
