package com.flamingo.ai.houseanalysis.exception;

/**
 * Thrown when an upload is rejected before any processing: no files, a file without a name, an
 * empty file or an unsupported extension.
 */
public class DocumentValidationException extends RuntimeException {

  private final String fileName;

  public DocumentValidationException(String message) {
    this(null, message);
  }

  public DocumentValidationException(String fileName, String message) {
    super(message);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
