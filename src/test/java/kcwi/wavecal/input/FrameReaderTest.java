package kcwi.wavecal.input;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.io.File;
import java.io.IOException;
import kcwi.wavecal.utils.FitsUtils;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.Header;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class FrameReaderTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private static double[][] image() {
    double[][] data = new double[8][6];
    for (int row = 0; row < data.length; ++row) {
      for (int col = 0; col < data[0].length; ++col) {
        data[row][col] = row * 10 + col;
      }
    }
    return data;
  }

  private File writeFrame(String name, boolean withGrating) throws Exception {
    BasicHDU<?> hdu = Fits.makeHDU(image());
    hdu.addValue("BINNING", "2,2", "x,y binning");
    if (withGrating) {
      hdu.addValue("BGRATNAM", "BH2", "grating");
    }
    hdu.addValue("BGRANGLE", 12.5, "grating angle");
    hdu.addValue("BCAMANG", 40.0, "camera angle");
    hdu.addValue("BCWAVE", 4800.0, "central wavelength");
    hdu.addValue("IFUNAM", "Large", "slicer");
    hdu.addValue("LMP0NAM", "ThAr", "lamp 0");
    hdu.addValue("LMP0STAT", 0, "lamp 0 status");
    hdu.addValue("LMP1NAM", "FeAr", "lamp 1");
    hdu.addValue("LMP1STAT", 1, "lamp 1 status");
    File file = new File(folder.getRoot(), name);
    FitsUtils.write(file, hdu);
    return file;
  }

  @Test
  public void read_populatesFrame() throws Exception {
    Configuration config = Configuration.defaults();
    config.setTaperFraction(0.3);
    config.setInteractivityLevel(1);
    Frame frame = new FrameReader(config).read(writeFrame("arc.fits", true));

    assertEquals("arc.fits", frame.getName());
    assertEquals(8, frame.getHeight());
    assertEquals(6, frame.getWidth());
    assertArrayEquals(image()[3], frame.getData()[3], 0.);
    assertEquals(2, frame.getXBinning());
    assertEquals(2, frame.getYBinning());
    assertEquals(Grating.BH2, frame.getGrating());
    assertEquals(Grating.BH2.getRho(), frame.getRho(), 0.);
    // high-resolution gratings default to the reversed adjuster
    assertEquals(180., frame.getAdjusterAngle(), 0.);
    assertEquals(12.5, frame.getGratingAngle(), 0.);
    assertEquals(40., frame.getCameraAngle(), 0.);
    assertEquals(4800., frame.getCentralWavelength(), 0.);
    assertEquals(Slicer.LARGE, frame.getSlicer());
    assertEquals("FeAr", frame.getLamp());
    assertEquals(0.3, frame.getTaperFraction(), 0.);
    assertEquals(1, frame.getInteractivityLevel());
  }

  @Test(expected = IOException.class)
  public void read_missingGratingThrows() throws Exception {
    new FrameReader(Configuration.defaults()).read(writeFrame("nograting.fits", false));
  }

  @Test
  public void parseBinning_values() {
    assertArrayEquals(new int[]{1, 2}, FrameReader.parseBinning("1, 2"));
    assertArrayEquals(new int[]{1, 1}, FrameReader.parseBinning(null));
  }

  @Test(expected = IllegalArgumentException.class)
  public void parseBinning_malformedThrows() {
    FrameReader.parseBinning("2x2");
  }

  @Test
  public void lampName_callampTakesPrecedence() throws Exception {
    Header header = new Header();
    header.addValue("CALLAMP", "ThAr", "");
    header.addValue("LMP1NAM", "FeAr", "");
    header.addValue("LMP1STAT", 1, "");
    assertEquals("ThAr", FrameReader.lampName(header));
  }

  @Test
  public void lampName_noLampOnIsEmpty() throws Exception {
    Header header = new Header();
    header.addValue("LMP0NAM", "ThAr", "");
    header.addValue("LMP0STAT", 0, "");
    assertEquals("", FrameReader.lampName(header));
  }

  @Test
  public void resolution_scalesWithSlicer() {
    Frame medium = new Frame.Builder(image()).slicer(Slicer.MEDIUM).build();
    Frame small = new Frame.Builder(image()).slicer(Slicer.SMALL).build();
    assertEquals(4500. / 4000., medium.resolution(4500.), 1E-12);
    assertEquals(medium.resolution(4500.) / 2., small.resolution(4500.), 1E-12);
  }
}
