package com.flamingo.ai.houseanalysis.exception;

/** Thrown when an uploaded image or PDF cannot be decoded. Aborts the whole request. */
public class DocumentTransformException extends RuntimeException {

  private final String fileName;

  public DocumentTransformException(String fileName, String category, String detail) {
    super(category + " (" + fileName + "): " + detail);
    this.fileName = fileName;
  }

  public DocumentTransformException(
      String fileName, String category, String detail, Throwable cause) {
    super(category + " (" + fileName + "): " + detail, cause);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
