package com.flamingo.learn.downloader.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(EntityNotFoundException.class)
  public ResponseEntity<ApiError> handleEntityNotFound(
      EntityNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("entity_not_found");
    String errorId = generateErrorId();
    log.warn("Catalog entity not found [{}]: {} {}", errorId, ex.getType(), ex.getUid());

    return build(
        HttpStatus.NOT_FOUND, errorId, ApiError.ENTITY_NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(MalformedCatalogUrlException.class)
  public ResponseEntity<ApiError> handleMalformedUrl(
      MalformedCatalogUrlException ex, HttpServletRequest request) {

    incrementErrorCounter("malformed_url");
    String errorId = generateErrorId();
    log.warn("Malformed catalog URL [{}]: {}", errorId, ex.getUrl());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.MALFORMED_URL,
        "URL does not point to a learning path",
        request);
  }

  @ExceptionHandler(CatalogFetchException.class)
  public ResponseEntity<ApiError> handleCatalogFetch(
      CatalogFetchException ex, HttpServletRequest request) {

    incrementErrorCounter("catalog_unavailable");
    String errorId = generateErrorId();
    log.error("Catalog request failed [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.CATALOG_UNAVAILABLE,
        "Catalog service is unavailable",
        request);
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiError> handleJobNotFound(
      JobNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("job_not_found");
    String errorId = generateErrorId();
    log.warn("Job not found [{}]: {}", errorId, ex.getJobId());

    return build(HttpStatus.NOT_FOUND, errorId, ApiError.JOB_NOT_FOUND, "Job not found", request);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, IllegalArgumentException.class})
  public ResponseEntity<ApiError> handleValidation(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation");
    String errorId = generateErrorId();
    log.warn("Validation error [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, "Invalid request", request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api.errors", "type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
