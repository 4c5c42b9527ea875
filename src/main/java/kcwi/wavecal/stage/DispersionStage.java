package kcwi.wavecal.stage;

import kcwi.wavecal.input.CalibrationContext;
import kcwi.wavecal.input.Frame;
import kcwi.wavecal.input.Instrument;
import org.apache.log4j.Logger;

/**
 * Computes the preliminary dispersion from the grating equation, using the frame's grating
 * and camera angles. The grating normal is offset from the grating angle by a fixed 13 degrees
 * and by the adjuster angle.
 */
public class DispersionStage extends CalibrationStage {

  private static final Logger logger = Logger.getLogger(DispersionStage.class);

  /**
   * Offset, in degrees, between the grating angle encoder zero and the grating normal.
   */
  public static final double GRATING_ANGLE_OFFSET = 13.;

  private double dispersion;
  private double alpha;
  private double beta;

  public DispersionStage() {
    super();
  }

  /**
   * Dispersion at the detector center from the grating equation.
   *
   * @param frame Frame with grating and camera settings
   * @param instrument Instrument constants
   * @return dispersion in Angstroms per binned pixel
   */
  public static double preliminaryDispersion(Frame frame, Instrument instrument) {
    double alpha = frame.getGratingAngle() - GRATING_ANGLE_OFFSET - frame.getAdjusterAngle();
    double beta = frame.getCameraAngle() - alpha;
    return Math.cos(Math.toRadians(beta)) / frame.getRho() / instrument.getFocalLength()
        * (instrument.getPixelSize() * frame.getYBinning()) * 1.E4
        * Math.cos(Math.toRadians(instrument.getOutOfPlaneAngle()));
  }

  @Override
  protected void backend(final CalibrationContext context) {
    Frame frame = context.getArcFrame();
    alpha = frame.getGratingAngle() - GRATING_ANGLE_OFFSET - frame.getAdjusterAngle();
    beta = frame.getCameraAngle() - alpha;
    dispersion = preliminaryDispersion(frame, context.getInstrument());
    context.setPreliminaryDispersion(dispersion);
    logger.info("Preliminary dispersion: " + dispersion + " A/px (alpha " + alpha
        + ", beta " + beta + ")");
  }

  public double getDispersion() {
    return dispersion;
  }

  @Override
  String[] getDataStrings() {
    return new String[]{"Alpha: " + DECIMAL_FORMAT.get().format(alpha) + " deg"
        + "\nBeta: " + DECIMAL_FORMAT.get().format(beta) + " deg"
        + "\nPreliminary dispersion: " + DECIMAL_FORMAT.get().format(dispersion) + " A/px"};
  }

  @Override
  public String getName() {
    return "Preliminary dispersion";
  }

  @Override
  public boolean hasEnoughData(final CalibrationContext context) {
    return context.getArcFrame() != null;
  }
}
