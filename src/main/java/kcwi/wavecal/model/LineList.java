package kcwi.wavecal.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered list of canonical atlas lines shared by every bar, plus the wavelength window the
 * lines were selected from.
 */
public class LineList {

  private final List<AtlasLine> lines;
  private final double minWavelength;
  private final double maxWavelength;

  public LineList(List<AtlasLine> lines, double minWavelength, double maxWavelength) {
    List<AtlasLine> sorted = new ArrayList<>(lines);
    sorted.sort(Comparator.comparingDouble(AtlasLine::getWavelength));
    this.lines = Collections.unmodifiableList(sorted);
    this.minWavelength = minWavelength;
    this.maxWavelength = maxWavelength;
  }

  public List<AtlasLine> getLines() {
    return lines;
  }

  public int size() {
    return lines.size();
  }

  public double[] getWavelengths() {
    return lines.stream().mapToDouble(AtlasLine::getWavelength).toArray();
  }

  public double getMinWavelength() {
    return minWavelength;
  }

  public double getMaxWavelength() {
    return maxWavelength;
  }
}
