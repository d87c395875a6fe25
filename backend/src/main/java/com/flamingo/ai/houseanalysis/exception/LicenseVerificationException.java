package com.flamingo.ai.houseanalysis.exception;

/** Exception thrown when a broker license cannot be verified. */
public class LicenseVerificationException extends RuntimeException {

  public LicenseVerificationException(String message) {
    super(message);
  }

  public LicenseVerificationException(String message, Throwable cause) {
    super(message, cause);
  }
}
