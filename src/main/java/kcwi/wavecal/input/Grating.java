package kcwi.wavecal.input;

/**
 * Gratings of the blue spectrograph channel, with their ruling density and nominal resolving
 * power through the medium slicer.
 */
public enum Grating {

  BL(0.870, 1800., true),
  BM(1.901, 4000., false),
  BH1(3.751, 9000., false),
  BH2(3.255, 9000., false),
  BH3(2.800, 9000., false);

  private final double rho;
  private final double resolvingPower;
  private final boolean lowDispersion;

  Grating(double rho, double resolvingPower, boolean lowDispersion) {
    this.rho = rho;
    this.resolvingPower = resolvingPower;
    this.lowDispersion = lowDispersion;
  }

  /**
   * @return grating density in lines per micron
   */
  public double getRho() {
    return rho;
  }

  /**
   * @return resolving power (lambda / delta lambda) with the medium slicer
   */
  public double getResolvingPower() {
    return resolvingPower;
  }

  /**
   * @return True for low-dispersion gratings, which use a wider central region when matched
   * to the atlas
   */
  public boolean isLowDispersion() {
    return lowDispersion;
  }

  /**
   * Default adjuster angle (degrees) for this grating: the high-resolution gratings are
   * mounted reversed.
   */
  public double getDefaultAdjusterAngle() {
    return name().startsWith("BH") ? 180. : 0.;
  }

  /**
   * Look up a grating from a header value such as "BM" or "bh2".
   *
   * @param name grating name
   * @return matching grating
   * @throws IllegalArgumentException if no grating matches
   */
  public static Grating fromName(String name) {
    String trimmed = name.trim().toUpperCase();
    for (Grating grating : values()) {
      if (grating.name().equals(trimmed)) {
        return grating;
      }
    }
    throw new IllegalArgumentException("Unknown grating: " + name);
  }
}
