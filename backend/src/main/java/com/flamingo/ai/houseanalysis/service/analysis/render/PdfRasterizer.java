package com.flamingo.ai.houseanalysis.service.analysis.render;

import com.flamingo.ai.houseanalysis.config.InferenceConfig;
import com.flamingo.ai.houseanalysis.domain.model.Page;
import com.flamingo.ai.houseanalysis.domain.model.SourceDocument;
import com.flamingo.ai.houseanalysis.exception.DocumentTransformException;
import io.micrometer.core.annotation.Timed;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

/**
 * Renders every page of a PDF upload to a PNG image with Apache PDFBox 3.x.
 *
 * <p>Pages come back in document order. A PDF that cannot be read, has no pages, or fails to render
 * on any page aborts with a {@link DocumentTransformException}; pages are never skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfRasterizer {

  private static final String CATEGORY = "PDF image conversion failed";

  private final InferenceConfig inferenceConfig;

  /**
   * Rasterizes a PDF document.
   *
   * @param document a PDF-tagged source document
   * @return one page per PDF page, ordered by page index
   */
  @Timed(value = "analysis.rasterize", description = "Time to rasterize a PDF upload")
  public List<Page> rasterize(SourceDocument document) {
    float dpi = inferenceConfig.getRasterization().getDpi();
    try (PDDocument pdf = Loader.loadPDF(document.bytes())) {
      int pageCount = pdf.getNumberOfPages();
      if (pageCount == 0) {
        throw new DocumentTransformException(document.fileName(), CATEGORY, "PDF has no pages");
      }

      PDFRenderer renderer = new PDFRenderer(pdf);
      List<Page> pages = new ArrayList<>(pageCount);
      for (int pageIndex = 0; pageIndex < pageCount; pageIndex++) {
        BufferedImage image = renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
        pages.add(new Page(document.index(), pageIndex, toPng(image)));
      }

      log.info("Rasterized {} page(s) of {} at {} DPI", pageCount, document.fileName(), dpi);
      return List.copyOf(pages);
    } catch (IOException e) {
      log.error("PDF rasterization failed for {}: {}", document.fileName(), e.getMessage());
      throw new DocumentTransformException(document.fileName(), CATEGORY, e.getMessage(), e);
    }
  }

  private byte[] toPng(BufferedImage image) throws IOException {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    if (!ImageIO.write(image, "png", baos)) {
      throw new IOException("No PNG writer available");
    }
    return baos.toByteArray();
  }
}
