package com.flamingo.ai.houseanalysis.service.analysis.intake;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Component;

/**
 * Structural integrity check for uploaded images.
 *
 * <p>Bytes are decoded with the first matching ImageIO reader. Formats the JDK has no reader for
 * (WebP) are checked by content sniffing instead: Tika must detect an {@code image/*} type from the
 * magic bytes.
 */
@Component
@Slf4j
public class ImageIntegrityVerifier {

  private final Tika tika = new Tika();

  /**
   * Returns {@code true} if the bytes hold a readable raster image.
   *
   * @param bytes uploaded image bytes
   * @return whether the image decodes
   */
  public boolean isReadableImage(byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      return false;
    }
    try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
      Iterator<ImageReader> readers = input == null ? null : ImageIO.getImageReaders(input);
      if (readers == null || !readers.hasNext()) {
        return isImageBySignature(bytes);
      }
      ImageReader reader = readers.next();
      try {
        reader.setInput(input, true, true);
        return reader.read(0) != null;
      } finally {
        reader.dispose();
      }
    } catch (IOException | RuntimeException e) {
      log.debug("Image failed to decode: {}", e.getMessage());
      return false;
    }
  }

  private boolean isImageBySignature(byte[] bytes) {
    String detected = tika.detect(bytes);
    log.debug("No ImageIO reader for upload, detected media type {}", detected);
    return detected != null && detected.startsWith("image/");
  }
}
