package kcwi.wavecal.utils;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.imageio.ImageIO;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.renderer.xy.XYItemRenderer;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * This class defines functions relevant to creating output files,
 * such as images of plots and PDF reports. These methods are all static.
 * The diagnostic reporter and the py4j server both use these functions to turn stage
 * plots into PNG images and PDF pages.
 */
public class ReportingUtils {

  /**
   * Colors for series within a chart, cycled through in order.
   */
  public static final Color[] COLORS = {Color.RED, Color.BLUE, Color.GREEN};

  /**
   * Build a line chart for a stage plot, coloring the series consistently.
   *
   * @param data Series to plot
   * @param labels Title, domain axis label, and range axis label
   * @return the chart
   */
  public static JFreeChart createChart(XYSeriesCollection data, String[] labels) {
    JFreeChart chart = ChartFactory.createXYLineChart(labels[0], labels[1], labels[2], data);
    XYItemRenderer renderer = chart.getXYPlot().getRenderer();
    for (int i = 0; i < chart.getXYPlot().getSeriesCount(); ++i) {
      renderer.setSeriesPaint(i, COLORS[i % COLORS.length]);
    }
    return chart;
  }

  /**
   * Add a buffered image to a PDDocument page
   *
   * @param bi BufferedImage to be added to PDF
   * @param pdf PDF to have BufferedImage appended to
   * @throws IOException if the image cannot be encoded into the document
   */
  private static void bufferedImageToPDFPage(BufferedImage bi, PDDocument pdf)
      throws IOException {
    PDRectangle rec = new PDRectangle(bi.getWidth(), bi.getHeight());
    PDPage page = new PDPage(rec);
    PDImageXObject pdImageXObject = LosslessFactory.createFromImage(pdf, bi);
    pdf.addPage(page);
    try (PDPageContentStream contentStream = new PDPageContentStream(pdf, page,
        PDPageContentStream.AppendMode.OVERWRITE, true, false)) {
      contentStream.drawImage(pdImageXObject, 0, 0, bi.getWidth(), bi.getHeight());
    }
  }

  /**
   * Converts a series of charts into a buffered image. Each chart has the
   * dimensions given as the width and height parameters, and so the resulting
   * image has width given by that parameter and height equal to height
   * multiplied by the number of charts passed in
   * (that is, the charts are concatenated vertically)
   *
   * @param width width of each chart plot
   * @param height height of each chart plot
   * @param charts series of charts to be plotted in
   * @return buffered image consisting of the concatenation of the given charts
   */
  public static BufferedImage chartsToImage(int width, int height, JFreeChart... charts) {
    BufferedImage[] bis = new BufferedImage[charts.length];
    for (int i = 0; i < charts.length; ++i) {
      bis[i] = charts[i].createBufferedImage(width, height);
    }
    return mergeBufferedImages(bis);
  }

  /**
   * Create a list of buffered images from a series of charts, with a specified
   * number of charts included on each image. This is used to write the charts
   * to a series of pages in a PDF report
   *
   * @param perImg Number of charts' plots to write to a single page
   * @param width Width to set each chart's output image
   * @param height Height to set each chart's output image
   * @param charts List of charts to be compiled into images
   * @return A list of buffered images with no more than perImg plots in
   * each image
   */
  public static BufferedImage[] chartsToImageList(int perImg, int width, int height,
      JFreeChart... charts) {
    int totalNumber = charts.length;
    if (totalNumber <= perImg) {
      return new BufferedImage[]{chartsToImage(width, height, charts)};
    }

    int pageCount = (totalNumber + perImg - 1) / perImg;
    BufferedImage[] imageList = new BufferedImage[pageCount];
    for (int i = 0; i < pageCount; ++i) {
      int start = perImg * i;
      int end = Math.min(start + perImg, totalNumber);
      JFreeChart[] onOnePage = Arrays.copyOfRange(charts, start, end);
      BufferedImage pageImage = chartsToImage(width, height, onOnePage);
      // keep charts on a short last page the same size as the others
      int spacerCount = perImg - onOnePage.length;
      if (spacerCount > 0) {
        pageImage = mergeBufferedImages(pageImage,
            createWhitespace(width, height * spacerCount));
      }
      imageList[i] = pageImage;
    }
    return imageList;
  }

  /**
   * Encode images as PNG byte arrays.
   *
   * @param images Images to encode
   * @return one PNG byte array per image
   * @throws IOException if an image cannot be encoded
   */
  public static byte[][] imagesToPNGBytes(BufferedImage... images) throws IOException {
    byte[][] pngByteArrays = new byte[images.length][];
    for (int i = 0; i < images.length; ++i) {
      try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
        ImageIO.write(images[i], "png", out);
        pngByteArrays[i] = out.toByteArray();
      }
    }
    return pngByteArrays;
  }

  private static BufferedImage createWhitespace(int width, int height) {
    BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = out.createGraphics();
    g.setPaint(Color.WHITE);
    g.fillRect(0, 0, out.getWidth(), out.getHeight());
    g.dispose();
    return out;
  }

  /**
   * Write a list of images to a pdf document, each image its own page
   *
   * @param pdf PDF document to write to
   * @param images List of buffered images to write. Each image is written to its
   * own PDF page.
   * @throws IOException if a page cannot be written
   */
  public static void imageListToPDFPages(PDDocument pdf, BufferedImage... images)
      throws IOException {
    for (BufferedImage bi : images) {
      bufferedImageToPDFPage(bi, pdf);
    }
  }

  /**
   * Utility function to combine a series of buffered images into a single
   * buffered image. Images are concatenated vertically and centered
   * horizontally into an image as wide as the widest passed-in image
   *
   * @param images Buffered images to send in
   * @return Single concatenated buffered image
   */
  private static BufferedImage mergeBufferedImages(BufferedImage... images) {
    int maxWidth = 0;
    int totalHeight = 0;
    for (BufferedImage bi : images) {
      maxWidth = Math.max(maxWidth, bi.getWidth());
      totalHeight += bi.getHeight();
    }

    BufferedImage out = new BufferedImage(maxWidth, totalHeight, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = out.createGraphics();
    int heightIndex = 0;
    for (BufferedImage bi : images) {
      int centeringOffset = (maxWidth - bi.getWidth()) / 2;
      g.drawImage(bi, null, centeringOffset, heightIndex);
      heightIndex += bi.getHeight();
    }
    g.dispose();
    return out;
  }

  /**
   * Add pages to a PDF document consisting of textual data with a series of
   * strings, where each string is written to a separate page
   *
   * @param pdf Document to append pages of text to
   * @param toWrite Series of strings to write to PDF
   * @throws IOException if a page cannot be written
   */
  public static void textListToPDFPages(PDDocument pdf, String... toWrite) throws IOException {
    for (String onePage : toWrite) {
      textToPDFPage(onePage, pdf);
    }
  }

  /**
   * Split text into lines no wider than the given width in the given font, breaking at spaces
   * where possible.
   */
  static List<String> wrapText(String toWrite, PDFont font, float fontSize, float width)
      throws IOException {
    List<String> lines = new ArrayList<>();
    for (String text : toWrite.split("\n")) {
      if (text.isEmpty()) {
        lines.add("");
        continue;
      }
      int lastSpace = -1;
      while (text.length() > 0) {
        int spaceIndex = text.indexOf(' ', lastSpace + 1);
        if (spaceIndex < 0) {
          spaceIndex = text.length();
        }
        String subString = text.substring(0, spaceIndex);
        float size = fontSize * font.getStringWidth(subString) / 1000;
        if (size > width) {
          if (lastSpace < 0) {
            lastSpace = spaceIndex;
          }
          lines.add(text.substring(0, lastSpace));
          text = text.substring(lastSpace).trim();
          lastSpace = -1;
        } else if (spaceIndex == text.length()) {
          lines.add(text);
          text = "";
        } else {
          lastSpace = spaceIndex;
        }
      }
    }
    return lines;
  }

  /**
   * Add a page to a PDF document consisting of textual data. Text that does not fit on one
   * page continues onto further pages.
   *
   * @param toWrite String to add to a new PDF page
   * @param pdf Document to append the page to
   * @throws IOException if the page cannot be written
   */
  public static void textToPDFPage(String toWrite, PDDocument pdf) throws IOException {
    if (toWrite.length() == 0) {
      return;
    }

    PDFont pdfFont = PDType1Font.COURIER;
    float fontSize = 12;
    float leading = 1.5f * fontSize;
    float margin = 72;

    PDRectangle mediaBox = PDRectangle.LETTER;
    float width = mediaBox.getWidth() - 2 * margin;
    float startX = mediaBox.getLowerLeftX() + margin;
    float startY = mediaBox.getUpperRightY() - margin;
    int linesPerPage = Math.max(1, (int) ((mediaBox.getHeight() - 2 * margin) / leading));

    List<String> lines = wrapText(toWrite, pdfFont, fontSize, width);

    for (int first = 0; first < lines.size(); first += linesPerPage) {
      PDPage page = new PDPage(mediaBox);
      pdf.addPage(page);
      int last = Math.min(lines.size(), first + linesPerPage);
      try (PDPageContentStream contentStream = new PDPageContentStream(pdf, page)) {
        contentStream.beginText();
        contentStream.setFont(pdfFont, fontSize);
        contentStream.newLineAtOffset(startX, startY);
        for (String line : lines.subList(first, last)) {
          contentStream.showText(line);
          contentStream.newLineAtOffset(0, -leading);
        }
        contentStream.endText();
      }
    }
  }
}
