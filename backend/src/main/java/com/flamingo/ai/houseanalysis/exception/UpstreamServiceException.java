package com.flamingo.ai.houseanalysis.exception;

/**
 * Thrown when the inference service fails before a verdict can be attempted, e.g. when an asset
 * cannot be registered.
 */
public class UpstreamServiceException extends RuntimeException {

  private final String fileName;
  private final String userMessage;

  public UpstreamServiceException(String fileName, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
    this.userMessage = "File upload to the analysis service failed (" + fileName + ")";
  }

  public String getFileName() {
    return fileName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
