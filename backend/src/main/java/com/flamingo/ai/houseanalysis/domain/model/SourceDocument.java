package com.flamingo.ai.houseanalysis.domain.model;

import com.flamingo.ai.houseanalysis.domain.enums.DocumentKind;

/**
 * One uploaded document after intake classification. Lives for a single analysis request.
 *
 * @param index position of the document in the upload list (0-based)
 * @param fileName original filename
 * @param kind image or PDF
 * @param bytes raw uploaded bytes
 */
public record SourceDocument(int index, String fileName, DocumentKind kind, byte[] bytes) {

  public boolean isPdf() {
    return kind == DocumentKind.PDF;
  }
}
