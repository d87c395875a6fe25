package com.flamingo.ai.houseanalysis.support;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import javax.imageio.ImageIO;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

/** Builds small but real image and PDF payloads for tests. */
public final class TestDocuments {

  private TestDocuments() {}

  public static byte[] png() {
    return image("png");
  }

  public static byte[] jpeg() {
    return image("jpg");
  }

  /** A RIFF/WEBP container header; enough for signature sniffing, not for decoding. */
  public static byte[] webpHeader() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes("RIFF".getBytes(StandardCharsets.US_ASCII));
    out.writeBytes(new byte[] {0x24, 0x00, 0x00, 0x00});
    out.writeBytes("WEBPVP8 ".getBytes(StandardCharsets.US_ASCII));
    out.writeBytes(new byte[24]);
    return out.toByteArray();
  }

  /** A PDF with the given number of blank US Letter pages. */
  public static byte[] pdf(int pageCount) {
    try (PDDocument document = new PDDocument()) {
      for (int i = 0; i < pageCount; i++) {
        document.addPage(new PDPage(PDRectangle.LETTER));
      }
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      document.save(out);
      return out.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static byte[] image(String format) {
    BufferedImage image = new BufferedImage(16, 16, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = image.createGraphics();
    g.setColor(Color.BLUE);
    g.fillRect(0, 0, 16, 16);
    g.dispose();
    try {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      ImageIO.write(image, format, out);
      return out.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
