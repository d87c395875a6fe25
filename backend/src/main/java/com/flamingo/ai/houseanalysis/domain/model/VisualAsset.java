package com.flamingo.ai.houseanalysis.domain.model;

/**
 * Unit of visual content submitted for registration: a whole image upload or one rasterized PDF
 * page. Assets are ordered by {@code (documentIndex, pageIndex)}; images use page index 0.
 *
 * @param documentIndex index of the owning document in the upload list
 * @param pageIndex 0-based page index (0 for image uploads)
 * @param sourceFileName filename of the owning upload, used in error messages
 * @param assetName name the asset is registered under
 * @param bytes image bytes
 */
public record VisualAsset(
    int documentIndex, int pageIndex, String sourceFileName, String assetName, byte[] bytes) {

  public static VisualAsset ofImage(SourceDocument document) {
    return new VisualAsset(
        document.index(), 0, document.fileName(), document.fileName(), document.bytes());
  }

  public static VisualAsset ofPage(SourceDocument document, Page page) {
    return new VisualAsset(
        document.index(),
        page.pageIndex(),
        document.fileName(),
        document.fileName() + "_page_" + page.pageNumber() + ".png",
        page.raster());
  }
}
