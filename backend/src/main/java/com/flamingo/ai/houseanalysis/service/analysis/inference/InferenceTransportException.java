package com.flamingo.ai.houseanalysis.service.analysis.inference;

/** Exception thrown when a call to the inference service fails at the transport level. */
public class InferenceTransportException extends RuntimeException {

  public InferenceTransportException(String message) {
    super(message);
  }

  public InferenceTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
