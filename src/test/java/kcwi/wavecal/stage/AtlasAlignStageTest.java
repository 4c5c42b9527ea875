package kcwi.wavecal.stage;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.util.ArrayList;
import java.util.List;
import kcwi.wavecal.CalibrationException;
import kcwi.wavecal.CalibrationException.AlignmentException;
import kcwi.wavecal.CalibrationException.AtlasException;
import kcwi.wavecal.input.CalibrationContext;
import kcwi.wavecal.input.Configuration;
import kcwi.wavecal.input.Frame;
import kcwi.wavecal.model.AtlasAlignment;
import kcwi.wavecal.model.AtlasSpectrum;
import kcwi.wavecal.model.ArcSpectra;
import kcwi.wavecal.test.SyntheticData;
import kcwi.wavecal.utils.NumericUtils;
import org.junit.Test;

public class AtlasAlignStageTest {

  private static final double DISPERSION = 0.5;

  private static Frame settings() {
    return SyntheticData.frameBuilder(new double[1][1]).build();
  }

  /**
   * Spectrum of the convolved atlas on a linear axis that lies offset Angstroms below the
   * nominal one.
   */
  private static double[] linearSpectrum(AtlasSpectrum convolved, double offset) {
    double[] waves = new double[SyntheticData.HEIGHT];
    for (int i = 0; i < waves.length; ++i) {
      waves[i] = SyntheticData.CENTRAL_WAVELENGTH + (i - SyntheticData.HEIGHT / 2) * DISPERSION
          - offset;
    }
    return NumericUtils.interpolate(convolved.getWavelengths(), convolved.getFlux(), waves);
  }

  @Test
  public void centralRange_widerForLowDispersion() {
    assertArrayEquals(new int[]{200, 400}, AtlasAlignStage.centralRange(600, false));
    assertArrayEquals(new int[]{120, 480}, AtlasAlignStage.centralRange(600, true));
  }

  @Test
  public void align_recoversOffset() throws AlignmentException {
    AtlasSpectrum convolved = SyntheticData.atlas()
        .convolvedTo(settings().resolution(SyntheticData.CENTRAL_WAVELENGTH));
    double[] spectrum = linearSpectrum(convolved, 3.);
    AtlasAlignment alignment = AtlasAlignStage.align(spectrum, convolved,
        SyntheticData.CENTRAL_WAVELENGTH, DISPERSION, false, 0.2);
    assertEquals(3., alignment.getOffsetWavelength(), 0.15);
    assertEquals(alignment.getOffsetPixels() * SyntheticData.ATLAS_DISPERSION,
        alignment.getOffsetWavelength(), 1E-12);
    assertEquals(300., alignment.getReferencePixel(), 0.);
    assertEquals(200, alignment.getMinRow());
    assertEquals(400, alignment.getMaxRow());
  }

  @Test
  public void align_negativeOffset() throws AlignmentException {
    AtlasSpectrum convolved = SyntheticData.atlas()
        .convolvedTo(settings().resolution(SyntheticData.CENTRAL_WAVELENGTH));
    double[] spectrum = linearSpectrum(convolved, -5.);
    AtlasAlignment alignment = AtlasAlignStage.align(spectrum, convolved,
        SyntheticData.CENTRAL_WAVELENGTH, DISPERSION, false, 0.2);
    assertEquals(-5., alignment.getOffsetWavelength(), 0.15);
  }

  @Test(expected = AlignmentException.class)
  public void align_noAtlasCoverageThrows() throws AlignmentException {
    AtlasSpectrum atlas = SyntheticData.atlas();
    AtlasAlignStage.align(new double[600], atlas, 9000., DISPERSION, false, 0.2);
  }

  @Test(expected = AlignmentException.class)
  public void align_flatSpectrumThrows() throws AlignmentException {
    AtlasSpectrum atlas = SyntheticData.atlas();
    AtlasAlignStage.align(new double[600], atlas, SyntheticData.CENTRAL_WAVELENGTH,
        DISPERSION, false, 0.2);
  }

  @Test
  public void runStageOnData_usesSuppliedAtlas() throws CalibrationException {
    Frame frame = settings();
    CalibrationContext context = new CalibrationContext(Configuration.defaults(),
        SyntheticData.instrument());
    context.setArcFrame(frame);
    AtlasSpectrum reference = SyntheticData.atlas();
    context.setReferenceAtlas(reference);
    context.setPreliminaryDispersion(DISPERSION);
    AtlasSpectrum convolved =
        reference.convolvedTo(frame.resolution(SyntheticData.CENTRAL_WAVELENGTH));
    List<double[]> spectra = new ArrayList<>();
    for (int bar = 0; bar < SyntheticData.BARS; ++bar) {
      spectra.add(linearSpectrum(convolved, 2.));
    }
    context.setArcSpectra(new ArcSpectra(spectra));

    AtlasAlignStage stage = new AtlasAlignStage();
    stage.runStageOnData(context);
    assertSame(reference, context.getReferenceAtlas());
    assertEquals(frame.resolution(SyntheticData.CENTRAL_WAVELENGTH)
        / SyntheticData.ATLAS_DISPERSION, context.getAtlas().getResolutionPixels(), 1E-9);
    assertEquals(2., context.getAtlasAlignment().getOffsetWavelength(), 0.15);
    assertEquals(1, stage.getData().size());
  }

  @Test(expected = AtlasException.class)
  public void runStageOnData_missingAtlasFileThrows() throws CalibrationException {
    Configuration configuration = Configuration.defaults();
    configuration.setAtlasFolder("no-such-folder");
    CalibrationContext context = new CalibrationContext(configuration,
        SyntheticData.instrument());
    context.setArcFrame(SyntheticData.frameBuilder(new double[1][1]).lamp("Xe").build());
    context.setPreliminaryDispersion(DISPERSION);
    List<double[]> spectra = new ArrayList<>();
    for (int bar = 0; bar < SyntheticData.BARS; ++bar) {
      spectra.add(new double[600]);
    }
    context.setArcSpectra(new ArcSpectra(spectra));
    new AtlasAlignStage().runStageOnData(context);
  }
}
