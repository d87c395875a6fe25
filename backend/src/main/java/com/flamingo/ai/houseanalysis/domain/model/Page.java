package com.flamingo.ai.houseanalysis.domain.model;

/**
 * A rasterized PDF page.
 *
 * @param documentIndex index of the owning document in the upload list
 * @param pageIndex 0-based page index within the document
 * @param raster PNG-encoded page image
 */
public record Page(int documentIndex, int pageIndex, byte[] raster) {

  /** 1-based page number. */
  public int pageNumber() {
    return pageIndex + 1;
  }
}
