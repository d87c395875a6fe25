package com.flamingo.ai.houseanalysis.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentValidationException.class)
  public ResponseEntity<ApiError> handleDocumentValidation(
      DocumentValidationException ex, HttpServletRequest request) {

    incrementErrorCounter("document_validation");
    String errorId = generateErrorId();
    log.warn("Upload rejected [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        ex.getMessage(),
        ex.getFileName(),
        request);
  }

  @ExceptionHandler(DocumentTransformException.class)
  public ResponseEntity<ApiError> handleDocumentTransform(
      DocumentTransformException ex, HttpServletRequest request) {

    incrementErrorCounter("document_transform");
    String errorId = generateErrorId();
    log.warn("Document transform error [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.DOCUMENT_TRANSFORM_ERROR,
        ex.getMessage(),
        ex.getFileName(),
        request);
  }

  @ExceptionHandler(UpstreamServiceException.class)
  public ResponseEntity<ApiError> handleUpstream(
      UpstreamServiceException ex, HttpServletRequest request) {

    incrementErrorCounter("upstream_error");
    String errorId = generateErrorId();
    log.error("Upstream service error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.UPSTREAM_ERROR,
        ex.getUserMessage(),
        ex.getFileName(),
        request);
  }

  @ExceptionHandler(LicenseVerificationException.class)
  public ResponseEntity<ApiError> handleLicenseVerification(
      LicenseVerificationException ex, HttpServletRequest request) {

    incrementErrorCounter("license_verification");
    String errorId = generateErrorId();
    log.warn("License verification failed [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.LICENSE_VERIFICATION_ERROR,
        "License verification failed: " + ex.getMessage(),
        null,
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, null, request);
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiError> handleMissingFiles(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("document_validation");
    String errorId = generateErrorId();
    log.warn("Upload without files [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "At least one file is required.",
        null,
        request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("upload_too_large");
    String errorId = generateErrorId();
    log.warn("Upload too large [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.UPLOAD_TOO_LARGE,
        "Uploaded files exceed the maximum allowed size.",
        null,
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An error occurred during analysis: " + ex.getMessage(),
        null,
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      String fileName,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .fileName(fileName)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
