package kcwi.wavecal.input;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import kcwi.wavecal.CalibrationException.AtlasException;
import kcwi.wavecal.model.AtlasSpectrum;
import kcwi.wavecal.utils.FitsUtils;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class AtlasLoaderTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private File writeAtlas(String name, double crval, double cdelt, Double crpix)
      throws Exception {
    double[] flux = new double[100];
    for (int i = 0; i < flux.length; ++i) {
      flux[i] = i % 10 == 5 ? 100. : 1.;
    }
    BasicHDU<?> hdu = Fits.makeHDU(flux);
    hdu.addValue("CRVAL1", crval, "first wavelength");
    hdu.addValue("CDELT1", cdelt, "step");
    if (crpix != null) {
      hdu.addValue("CRPIX1", crpix, "reference pixel");
    }
    File file = new File(folder.getRoot(), name);
    FitsUtils.write(file, hdu);
    return file;
  }

  @Test
  public void fileNameFor_lowerCasesLamp() {
    assertEquals("thar.fits", AtlasLoader.fileNameFor("ThAr"));
    assertEquals("fear.fits", AtlasLoader.fileNameFor(" FeAr "));
  }

  @Test
  public void load_readsLinearAxis() throws Exception {
    writeAtlas("thar.fits", 3000., 0.5, null);
    AtlasSpectrum atlas = new AtlasLoader(folder.getRoot().getAbsolutePath()).load("ThAr");
    assertEquals("ThAr", atlas.getLamp());
    assertEquals(100, atlas.getLength());
    assertEquals(0.5, atlas.getDispersion(), 0.);
    assertEquals(3000., atlas.getWavelengths()[0], 1E-9);
    assertEquals(3049.5, atlas.getWavelengths()[99], 1E-9);
    assertEquals(100., atlas.getFlux()[5], 0.);
    assertEquals(0., atlas.getResolutionPixels(), 0.);
  }

  @Test
  public void read_referencePixelShiftsStart() throws Exception {
    File file = writeAtlas("fear.fits", 3010., 0.5, 21.);
    AtlasSpectrum atlas = AtlasLoader.read("FeAr", file);
    assertEquals(3000., atlas.getWavelengths()[0], 1E-9);
  }

  @Test(expected = AtlasException.class)
  public void load_missingLampThrows() throws AtlasException {
    new AtlasLoader(folder.getRoot().getAbsolutePath()).load("NoSuchLamp");
  }

  @Test(expected = AtlasException.class)
  public void load_emptyLampThrows() throws AtlasException {
    new AtlasLoader(folder.getRoot().getAbsolutePath()).load(" ");
  }

  @Test
  public void read_missingKeywordsThrows() throws Exception {
    BasicHDU<?> hdu = Fits.makeHDU(new double[]{1., 2., 3.});
    File file = new File(folder.getRoot(), "bare.fits");
    FitsUtils.write(file, hdu);
    try {
      AtlasLoader.read("ThAr", file);
      fail("Atlas without wavelength keywords was accepted");
    } catch (AtlasException e) {
      assertTrue(e.getMessage().contains("CRVAL1"));
    }
  }

  @Test(expected = AtlasException.class)
  public void read_negativeDispersionThrows() throws Exception {
    File file = writeAtlas("bad.fits", 3000., -0.5, null);
    AtlasLoader.read("ThAr", file);
  }
}
