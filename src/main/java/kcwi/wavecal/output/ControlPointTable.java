package kcwi.wavecal.output;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import kcwi.wavecal.model.ControlPoint;
import kcwi.wavecal.model.ControlPointSet;
import kcwi.wavecal.utils.FitsUtils;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTable;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.apache.log4j.Logger;

/**
 * Reads and writes traced control points as a FITS binary table, so the bars of one run can be
 * reused to rectify arcs in a later run. The table is the first extension after an empty
 * primary HDU, with one row per control point.
 */
public class ControlPointTable {

  private static final Logger logger = Logger.getLogger(ControlPointTable.class);

  static final String[] COLUMNS = {"SRCX", "SRCY", "DSTX", "DSTY", "BARID", "SLICEID"};

  /**
   * Write control points to a FITS file, replacing any existing file.
   *
   * @param file Destination
   * @param points Control points to write
   * @throws IOException if the table cannot be built or written
   */
  public static void write(File file, ControlPointSet points) throws IOException {
    List<ControlPoint> list = points.getPoints();
    int[] barIds = new int[list.size()];
    int[] sliceIds = new int[list.size()];
    for (int i = 0; i < list.size(); ++i) {
      barIds[i] = list.get(i).getBarId();
      sliceIds[i] = list.get(i).getSliceId();
    }
    Object[] columns = {points.getSourceX(), points.getSourceY(), points.getDestinationX(),
        points.getDestinationY(), barIds, sliceIds};
    try {
      BinaryTableHDU table = (BinaryTableHDU) Fits.makeHDU(new BinaryTable(columns));
      table.setColumnName(0, COLUMNS[0], "detector x of trace sample (px)");
      table.setColumnName(1, COLUMNS[1], "detector y of trace sample (px)");
      table.setColumnName(2, COLUMNS[2], "nominal x of trace sample (px)");
      table.setColumnName(3, COLUMNS[3], "nominal y of trace sample (px)");
      table.setColumnName(4, COLUMNS[4], "bar index");
      table.setColumnName(5, COLUMNS[5], "slice index");
      table.addValue("MIDROW", points.getReferenceRow(), "reference row of bar centroids");
      table.addValue("WINDOW", points.getWindow(), "half-width of trace window (px)");
      FitsUtils.write(file, BasicHDU.getDummyHDU(), table);
    } catch (FitsException e) {
      throw new IOException("Could not write control points to " + file.getAbsolutePath(), e);
    }
    logger.info("Wrote " + list.size() + " control points to " + file.getAbsolutePath());
  }

  /**
   * Read control points written by {@link #write(File, ControlPointSet)}.
   *
   * @param file Source
   * @return control points with their reference row and window
   * @throws IOException if the file is missing, unreadable, or lacks a required column
   */
  public static ControlPointSet read(File file) throws IOException {
    try (Fits fits = new Fits(file)) {
      BasicHDU<?> hdu = fits.getHDU(1);
      if (!(hdu instanceof BinaryTableHDU)) {
        throw new IOException("No control point table in " + file.getAbsolutePath());
      }
      BinaryTableHDU table = (BinaryTableHDU) hdu;
      Header header = table.getHeader();
      int[] indices = new int[COLUMNS.length];
      for (int i = 0; i < COLUMNS.length; ++i) {
        indices[i] = table.findColumn(COLUMNS[i]);
        if (indices[i] < 0) {
          throw new IOException("Control point table lacks column " + COLUMNS[i]);
        }
      }
      double[] srcX = (double[]) table.getColumn(indices[0]);
      double[] srcY = (double[]) table.getColumn(indices[1]);
      double[] dstX = (double[]) table.getColumn(indices[2]);
      double[] dstY = (double[]) table.getColumn(indices[3]);
      int[] barIds = (int[]) table.getColumn(indices[4]);
      int[] sliceIds = (int[]) table.getColumn(indices[5]);

      List<ControlPoint> points = new ArrayList<>();
      for (int i = 0; i < srcX.length; ++i) {
        points.add(new ControlPoint(barIds[i], sliceIds[i], srcX[i], srcY[i], dstX[i], dstY[i]));
      }
      logger.info("Read " + points.size() + " control points from " + file.getAbsolutePath());
      return new ControlPointSet(points, header.getIntValue("MIDROW"),
          header.getIntValue("WINDOW"));
    } catch (FitsException | ClassCastException e) {
      throw new IOException("Could not read control points from " + file.getAbsolutePath(), e);
    }
  }
}
