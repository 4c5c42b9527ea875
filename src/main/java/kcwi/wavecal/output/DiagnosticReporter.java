package kcwi.wavecal.output;

import java.io.IOException;
import kcwi.wavecal.model.CalibrationReport;
import kcwi.wavecal.stage.CalibrationStage;

/**
 * Receives each calibration stage once it has run, and the final report. Reporters only read
 * what the stages produced, so the calibration results do not depend on which one is used.
 */
public interface DiagnosticReporter {

  /**
   * Reporter that ignores everything, used when no diagnostics are requested.
   */
  DiagnosticReporter NONE = new DiagnosticReporter() {
    @Override
    public void stageCompleted(CalibrationStage stage) {
    }

    @Override
    public void runCompleted(CalibrationReport report) {
    }
  };

  void stageCompleted(CalibrationStage stage);

  /**
   * Called once after the solver stage.
   *
   * @param report Solutions for every bar
   * @throws IOException if the diagnostics cannot be written
   */
  void runCompleted(CalibrationReport report) throws IOException;
}
