package kcwi.wavecal.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Baseline-subtracted 1D arc spectra, one per bar in bar order. Arrays handed out are copies.
 */
public class ArcSpectra {

  private final List<double[]> spectra;

  public ArcSpectra(List<double[]> spectra) {
    List<double[]> copies = new ArrayList<>();
    for (double[] spectrum : spectra) {
      copies.add(spectrum.clone());
    }
    this.spectra = Collections.unmodifiableList(copies);
  }

  public double[] getSpectrum(int bar) {
    return spectra.get(bar).clone();
  }

  public int getBarCount() {
    return spectra.size();
  }

  public int getLength() {
    return spectra.isEmpty() ? 0 : spectra.get(0).length;
  }
}
