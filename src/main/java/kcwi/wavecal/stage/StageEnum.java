package kcwi.wavecal.stage;

/**
 * Enumerated type defining each stage of the calibration, in the order the stages run, and
 * creating the associated CalibrationStage class.
 */
public enum StageEnum {

  /**
   * Stages before ARC_EXTRACTION depend only on the bars frame and can be run once for
   * several arcs. Due to how iterating through an enum works, the order here is the run order.
   */
  BAR_LOCATION("Bar location") {
    @Override
    public CalibrationStage createStage() {
      return new BarLocatorStage();
    }
  },
  BAR_TRACING("Bar tracing") {
    @Override
    public CalibrationStage createStage() {
      return new BarTracerStage();
    }
  },
  ARC_EXTRACTION("Arc extraction") {
    @Override
    public CalibrationStage createStage() {
      return new ArcExtractorStage();
    }
  },
  BAR_ALIGNMENT("Bar alignment") {
    @Override
    public CalibrationStage createStage() {
      return new BarOffsetStage();
    }
  },
  DISPERSION("Preliminary dispersion") {
    @Override
    public CalibrationStage createStage() {
      return new DispersionStage();
    }
  },
  ATLAS_ALIGNMENT("Atlas alignment") {
    @Override
    public CalibrationStage createStage() {
      return new AtlasAlignStage();
    }
  },
  CENTRAL_FIT("Central fit") {
    @Override
    public CalibrationStage createStage() {
      return new CentralFitStage();
    }
  },
  ATLAS_LINES("Atlas lines") {
    @Override
    public CalibrationStage createStage() {
      return new AtlasLineStage();
    }
  },
  ARC_SOLUTION("Arc solution") {
    @Override
    public CalibrationStage createStage() {
      return new ArcSolveStage();
    }
  };

  private final String name;

  StageEnum(String name) {
    this.name = name;
  }

  public abstract CalibrationStage createStage();

  public String getName() {
    return name;
  }

  /**
   * @return True if the stage works only from the bars frame
   */
  public boolean isBarsStage() {
    return ordinal() < ARC_EXTRACTION.ordinal();
  }
}
