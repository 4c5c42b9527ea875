package kcwi.wavecal.input;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Configuration file holding the locations of the atlas files and diagnostic reports, and the
 * tunable thresholds used by the calibration stages. Every threshold that the stages use to
 * accept or reject a trace sample, line, or fit point is read from here so that it can be
 * overridden without changing code. Values missing from the XML file keep their defaults.
 */
public class Configuration {

  private static Configuration instance;

  static final String DEFAULT_CONFIG_PATH = "wavecal-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = "";

  private String atlasFolder = "atlas";
  private String reportFolder = System.getProperty("user.home");

  private double taperFraction = 0.2;
  private double traceThreshold = 255.;
  private double lineThreshold = 50.;
  private double peakCentroidTolerance = 0.7;
  private double atlasPeakTolerance = 2.0;
  private double residualRejectSigma = 2.5;
  private int rejectIterations = 3;
  private int fitDegree = 4;
  private double widthClipSigma = 2.0;
  private int widthClipIterations = 2;
  private double dispersionSearchFraction = 0.05;
  private double centralFitBudgetSeconds = 0.;

  private int interactivityLevel = 0;

  private Configuration() {
    // defaults only
  }

  private Configuration(String configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      String atlasFolderParam = config.getString("LocalPaths.AtlasPath");
      if (atlasFolderParam != null) {
        atlasFolder = atlasFolderParam;
      }
      String reportFolderParam = config.getString("LocalPaths.ReportPath");
      if (reportFolderParam != null) {
        reportFolder = reportFolderParam;
      }

      taperFraction = config.getDouble("Tunables.TaperFraction", taperFraction);
      traceThreshold = config.getDouble("Tunables.TraceThreshold", traceThreshold);
      lineThreshold = config.getDouble("Tunables.LineThreshold", lineThreshold);
      peakCentroidTolerance =
          config.getDouble("Tunables.PeakCentroidTolerance", peakCentroidTolerance);
      atlasPeakTolerance = config.getDouble("Tunables.AtlasPeakTolerance", atlasPeakTolerance);
      residualRejectSigma =
          config.getDouble("Tunables.ResidualRejectSigma", residualRejectSigma);
      rejectIterations = config.getInt("Tunables.RejectIterations", rejectIterations);
      fitDegree = config.getInt("Tunables.FitDegree", fitDegree);
      widthClipSigma = config.getDouble("Tunables.WidthClipSigma", widthClipSigma);
      widthClipIterations = config.getInt("Tunables.WidthClipIterations", widthClipIterations);
      dispersionSearchFraction =
          config.getDouble("Tunables.DispersionSearchFraction", dispersionSearchFraction);
      centralFitBudgetSeconds =
          config.getDouble("Tunables.CentralFitBudgetSeconds", centralFitBudgetSeconds);

      interactivityLevel = config.getInt("Diagnostics.InteractivityLevel", interactivityLevel);

      try {
        loadedConfigPath = config.getFile().getCanonicalPath();
        logger.info("Successfully loaded in configuration: " + loadedConfigPath);
      } catch (IOException e) {
        logger.warn("Could not resolve canonical path of loaded configuration", e);
        loadedConfigPath = configLocation;
      }
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  private static boolean copyEmbedXML(String pathToPlaceFile) {
    File fileOut = new File(pathToPlaceFile);
    try (InputStream stream =
        Configuration.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_PATH)) {
      if (stream == null) {
        logger.error("Config XML file " + DEFAULT_CONFIG_PATH + " not part of resources");
        return false;
      }
      logger.info("Copying embedded config file to " + fileOut.getAbsolutePath());
      Files.copy(stream, fileOut.toPath());
      return true;
    } catch (IOException e) {
      logger.warn("Could not copy embedded config file to " + fileOut.getAbsolutePath(), e);
    }
    return false;
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    return getInstance(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists. If the file does not exist, the embedded default file is written there first.
   * @param configLocation Configuration file location to read from
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance(String configLocation) {
    if (instance == null) {
      File config = new File(configLocation);
      if (!config.exists() && !copyEmbedXML(configLocation)) {
        logger.warn("Could not find or write to specified config location: " + configLocation
            + "; using built-in defaults.");
        instance = new Configuration();
        return instance;
      }
      instance = new Configuration(configLocation);
    }
    return instance;
  }

  /**
   * Read a configuration from the given file without touching the shared instance.
   * @param configLocation XML file to read
   * @return new configuration
   */
  public static Configuration fromFile(String configLocation) {
    return new Configuration(configLocation);
  }

  /**
   * Get a configuration holding only the built-in default values, independent of the shared
   * instance (useful for programmatic runs and tests).
   * @return new configuration with default values
   */
  public static Configuration defaults() {
    return new Configuration();
  }

  /**
   * @return canonical path of the file this configuration was read from, empty if defaults
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * Gets the folder atlas spectra are read from. Files in it are named after the lamp,
   * i.e., "thar.fits" or "fear.fits".
   *
   * The property is defined from Configuration.LocalPaths.AtlasPath
   * @return atlas folder path
   */
  public String getAtlasFolder() {
    return atlasFolder;
  }

  public void setAtlasFolder(String replacement) {
    atlasFolder = replacement;
  }

  /**
   * Gets the folder diagnostic reports and output tables are written to.
   *
   * The property is defined from Configuration.LocalPaths.ReportPath
   * @return report folder path
   */
  public String getReportFolder() {
    return reportFolder;
  }

  public void setReportFolder(String replacement) {
    reportFolder = replacement;
  }

  /**
   * Fraction of each spectrum tapered by the cosine window applied before correlation.
   * Defined from Configuration.Tunables.TaperFraction, default 0.2.
   */
  public double getTaperFraction() {
    return taperFraction;
  }

  public void setTaperFraction(double taperFraction) {
    this.taperFraction = taperFraction;
  }

  /**
   * Minimum peak flux (counts) for a bar trace sample to be accepted.
   * Defined from Configuration.Tunables.TraceThreshold, default 255.
   */
  public double getTraceThreshold() {
    return traceThreshold;
  }

  public void setTraceThreshold(double traceThreshold) {
    this.traceThreshold = traceThreshold;
  }

  /**
   * Minimum peak flux (counts) for an arc line to be used in a bar's solution.
   * Defined from Configuration.Tunables.LineThreshold, default 50.
   */
  public double getLineThreshold() {
    return lineThreshold;
  }

  public void setLineThreshold(double lineThreshold) {
    this.lineThreshold = lineThreshold;
  }

  /**
   * Largest allowed disagreement (pixels) between an arc line's interpolated peak and its
   * centroid. Defined from Configuration.Tunables.PeakCentroidTolerance, default 0.7.
   */
  public double getPeakCentroidTolerance() {
    return peakCentroidTolerance;
  }

  public void setPeakCentroidTolerance(double peakCentroidTolerance) {
    this.peakCentroidTolerance = peakCentroidTolerance;
  }

  /**
   * Largest allowed disagreement (Angstroms) between an atlas line's Gaussian center and its
   * interpolated peak. Defined from Configuration.Tunables.AtlasPeakTolerance, default 2.
   */
  public double getAtlasPeakTolerance() {
    return atlasPeakTolerance;
  }

  public void setAtlasPeakTolerance(double atlasPeakTolerance) {
    this.atlasPeakTolerance = atlasPeakTolerance;
  }

  /**
   * Residual cutoff, in standard deviations, for dropping points between solution refits.
   * Defined from Configuration.Tunables.ResidualRejectSigma, default 2.5.
   */
  public double getResidualRejectSigma() {
    return residualRejectSigma;
  }

  public void setResidualRejectSigma(double residualRejectSigma) {
    this.residualRejectSigma = residualRejectSigma;
  }

  public int getRejectIterations() {
    return rejectIterations;
  }

  public void setRejectIterations(int rejectIterations) {
    this.rejectIterations = rejectIterations;
  }

  public int getFitDegree() {
    return fitDegree;
  }

  public void setFitDegree(int fitDegree) {
    this.fitDegree = fitDegree;
  }

  public double getWidthClipSigma() {
    return widthClipSigma;
  }

  public void setWidthClipSigma(double widthClipSigma) {
    this.widthClipSigma = widthClipSigma;
  }

  public int getWidthClipIterations() {
    return widthClipIterations;
  }

  public void setWidthClipIterations(int widthClipIterations) {
    this.widthClipIterations = widthClipIterations;
  }

  /**
   * Half-range of the central dispersion search as a fraction of the preliminary dispersion.
   */
  public double getDispersionSearchFraction() {
    return dispersionSearchFraction;
  }

  public void setDispersionSearchFraction(double dispersionSearchFraction) {
    this.dispersionSearchFraction = dispersionSearchFraction;
  }

  /**
   * Wall-clock limit in seconds on the central dispersion search; 0 means no limit.
   */
  public double getCentralFitBudgetSeconds() {
    return centralFitBudgetSeconds;
  }

  public void setCentralFitBudgetSeconds(double centralFitBudgetSeconds) {
    this.centralFitBudgetSeconds = centralFitBudgetSeconds;
  }

  /**
   * Level of diagnostic output. 0 produces none; 1 or more writes a PDF of stage plots to the
   * report folder; 2 or more also includes per-bar plots. Results are the same at every level.
   */
  public int getInteractivityLevel() {
    return interactivityLevel;
  }

  public void setInteractivityLevel(int interactivityLevel) {
    this.interactivityLevel = interactivityLevel;
  }
}
