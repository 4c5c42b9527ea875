package kcwi.wavecal.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import kcwi.wavecal.model.ArcSpectra;
import kcwi.wavecal.model.AtlasAlignment;
import kcwi.wavecal.model.AtlasSpectrum;
import kcwi.wavecal.model.BarLocation;
import kcwi.wavecal.model.BarSolution;
import kcwi.wavecal.model.CalibrationReport;
import kcwi.wavecal.model.ControlPointSet;
import kcwi.wavecal.model.LineList;
import kcwi.wavecal.model.PhysicalDispersionModel;
import kcwi.wavecal.utils.PolynomialTransform;

/**
 * Holds the inputs to a calibration run and the products of each stage that has run so far.
 * Stages read the products of earlier stages from here and store their own; a stage checks
 * that what it needs is set before running (see the hasEnoughData method of each stage).
 *
 * The failed-bar map may be written from worker threads.
 */
public class CalibrationContext {

  private final Configuration configuration;
  private final Instrument instrument;

  private Frame barsFrame;
  private Frame arcFrame;

  private BarLocation barLocation;
  private ControlPointSet controlPoints;
  private PolynomialTransform transform;
  private double[][] warpedArc;
  private ArcSpectra arcSpectra;
  private int[] barOffsets;
  private double preliminaryDispersion = Double.NaN;
  private AtlasSpectrum referenceAtlas;
  private AtlasSpectrum atlas;
  private AtlasAlignment atlasAlignment;
  private List<PhysicalDispersionModel> centralModels;
  private LineList lineList;
  private List<BarSolution> barSolutions;

  private final Map<Integer, String> failedBars;

  public CalibrationContext(Configuration configuration, Instrument instrument) {
    this.configuration = configuration;
    this.instrument = instrument;
    failedBars = Collections.synchronizedMap(new TreeMap<>());
  }

  public Configuration getConfiguration() {
    return configuration;
  }

  public Instrument getInstrument() {
    return instrument;
  }

  public Frame getBarsFrame() {
    return barsFrame;
  }

  public void setBarsFrame(Frame barsFrame) {
    this.barsFrame = barsFrame;
  }

  public Frame getArcFrame() {
    return arcFrame;
  }

  public void setArcFrame(Frame arcFrame) {
    this.arcFrame = arcFrame;
  }

  public BarLocation getBarLocation() {
    return barLocation;
  }

  public void setBarLocation(BarLocation barLocation) {
    this.barLocation = barLocation;
  }

  public ControlPointSet getControlPoints() {
    return controlPoints;
  }

  public void setControlPoints(ControlPointSet controlPoints) {
    this.controlPoints = controlPoints;
  }

  /**
   * @return transform mapping nominal (rectified) coordinates onto detector coordinates
   */
  public PolynomialTransform getTransform() {
    return transform;
  }

  public void setTransform(PolynomialTransform transform) {
    this.transform = transform;
  }

  public double[][] getWarpedArc() {
    return warpedArc;
  }

  public void setWarpedArc(double[][] warpedArc) {
    this.warpedArc = warpedArc;
  }

  public ArcSpectra getArcSpectra() {
    return arcSpectra;
  }

  public void setArcSpectra(ArcSpectra arcSpectra) {
    this.arcSpectra = arcSpectra;
  }

  /**
   * @return per-bar pixel offsets relative to the reference bar
   */
  public int[] getBarOffsets() {
    return barOffsets;
  }

  public void setBarOffsets(int[] barOffsets) {
    this.barOffsets = barOffsets;
  }

  /**
   * @return dispersion from the grating equation in Angstroms per binned pixel, NaN if unset
   */
  public double getPreliminaryDispersion() {
    return preliminaryDispersion;
  }

  public void setPreliminaryDispersion(double preliminaryDispersion) {
    this.preliminaryDispersion = preliminaryDispersion;
  }

  /**
   * @return the atlas as loaded, before any smoothing; null if it is to be read from the
   *     configured atlas folder
   */
  public AtlasSpectrum getReferenceAtlas() {
    return referenceAtlas;
  }

  public void setReferenceAtlas(AtlasSpectrum referenceAtlas) {
    this.referenceAtlas = referenceAtlas;
  }

  /**
   * @return the atlas convolved to the arc frame's resolution
   */
  public AtlasSpectrum getAtlas() {
    return atlas;
  }

  public void setAtlas(AtlasSpectrum atlas) {
    this.atlas = atlas;
  }

  public AtlasAlignment getAtlasAlignment() {
    return atlasAlignment;
  }

  public void setAtlasAlignment(AtlasAlignment atlasAlignment) {
    this.atlasAlignment = atlasAlignment;
  }

  /**
   * @return per-bar central models in bar order; entries are null for bars that failed
   */
  public List<PhysicalDispersionModel> getCentralModels() {
    return centralModels;
  }

  public void setCentralModels(List<PhysicalDispersionModel> centralModels) {
    this.centralModels = centralModels;
  }

  public LineList getLineList() {
    return lineList;
  }

  public void setLineList(LineList lineList) {
    this.lineList = lineList;
  }

  public List<BarSolution> getBarSolutions() {
    return barSolutions;
  }

  public void setBarSolutions(List<BarSolution> barSolutions) {
    this.barSolutions = barSolutions;
  }

  /**
   * Record that a bar could not be processed. The first reason recorded for a bar is kept.
   *
   * @param bar bar index
   * @param reason description of the failure
   */
  public void markFailed(int bar, String reason) {
    failedBars.putIfAbsent(bar, reason);
  }

  public boolean isFailed(int bar) {
    return failedBars.containsKey(bar);
  }

  /**
   * @return snapshot of failed bars, keyed by bar index in ascending order
   */
  public Map<Integer, String> getFailedBars() {
    synchronized (failedBars) {
      return new TreeMap<>(failedBars);
    }
  }

  /**
   * Drop the products of the arc stages so the same traced bars can be reused for another arc.
   */
  public void clearArcProducts() {
    warpedArc = null;
    arcSpectra = null;
    barOffsets = null;
    preliminaryDispersion = Double.NaN;
    atlas = null;
    atlasAlignment = null;
    centralModels = null;
    lineList = null;
    barSolutions = null;
    failedBars.clear();
  }

  /**
   * @return report of the solutions produced so far
   * @throws IllegalStateException if the solver has not run
   */
  public CalibrationReport buildReport() {
    if (barSolutions == null) {
      throw new IllegalStateException("No bar solutions have been computed");
    }
    return new CalibrationReport(new ArrayList<>(barSolutions), getFailedBars());
  }
}
