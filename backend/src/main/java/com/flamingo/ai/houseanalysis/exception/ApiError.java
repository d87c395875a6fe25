package com.flamingo.ai.houseanalysis.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String UPLOAD_TOO_LARGE = "VALIDATION_002";
  public static final String DOCUMENT_TRANSFORM_ERROR = "DOCUMENT_002";
  public static final String UPSTREAM_ERROR = "UPSTREAM_001";
  public static final String LICENSE_VERIFICATION_ERROR = "LICENSE_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-facing message naming the offending file and failure category. */
  private final String message;

  /** File the error refers to, if any. */
  private final String fileName;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
