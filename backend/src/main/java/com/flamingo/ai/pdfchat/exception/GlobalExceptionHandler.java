package com.flamingo.ai.pdfchat.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ApiError> handleSessionNotFound(
      SessionNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("session_not_found");
    String errorId = generateErrorId();
    log.warn("Session not found [{}]: {}", errorId, ex.getSessionId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.SESSION_NOT_FOUND, "Session not found", null,
        request);
  }

  @ExceptionHandler(IndexingInProgressException.class)
  public ResponseEntity<ApiError> handleIndexingInProgress(
      IndexingInProgressException ex, HttpServletRequest request) {

    incrementErrorCounter("indexing_in_progress");
    String errorId = generateErrorId();
    log.info("Upload rejected [{}]: build in flight for session {}", errorId, ex.getSessionId());

    return respond(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.INDEXING_IN_PROGRESS,
        "Session is still indexing a previous upload. Wait for it to finish and retry.",
        null,
        request);
  }

  @ExceptionHandler(IndexNotReadyException.class)
  public ResponseEntity<ApiError> handleIndexNotReady(
      IndexNotReadyException ex, HttpServletRequest request) {

    incrementErrorCounter("index_not_ready");
    String errorId = generateErrorId();
    log.info("Query rejected [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.INDEX_NOT_READY,
        "Session index is not ready for queries",
        ex.getStatus().wireName(),
        request);
  }

  @ExceptionHandler(UploadLimitExceededException.class)
  public ResponseEntity<ApiError> handleUploadLimit(
      UploadLimitExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("upload_limit");
    String errorId = generateErrorId();
    log.warn("Upload rejected [{}]: {}", errorId, ex.getMessage());

    HttpStatus status =
        ex.getLimit() == UploadLimitExceededException.Limit.NO_FILES
            ? HttpStatus.BAD_REQUEST
            : HttpStatus.PAYLOAD_TOO_LARGE;
    String code =
        ex.getLimit() == UploadLimitExceededException.Limit.NO_FILES
            ? ApiError.UPLOAD_INVALID
            : ApiError.UPLOAD_LIMIT_EXCEEDED;
    return respond(status, errorId, code, ex.getMessage(), null, request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleMultipartLimit(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("upload_limit");
    String errorId = generateErrorId();
    log.warn("Multipart request too large [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.UPLOAD_LIMIT_EXCEEDED,
        "Upload exceeds the maximum request size",
        null,
        request);
  }

  @ExceptionHandler(DocumentExtractionException.class)
  public ResponseEntity<ApiError> handleExtraction(
      DocumentExtractionException ex, HttpServletRequest request) {

    incrementErrorCounter("document_unreadable");
    String errorId = generateErrorId();
    log.warn("Document rejected [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_UNREADABLE,
        ex.getUserMessage(),
        ex.getFileName(),
        request);
  }

  @ExceptionHandler(IndexingRejectedException.class)
  public ResponseEntity<ApiError> handleIndexingRejected(
      IndexingRejectedException ex, HttpServletRequest request) {

    incrementErrorCounter("indexing_rejected");
    String errorId = generateErrorId();
    log.warn("Upload rolled back [{}]: no indexing capacity for session {}", errorId,
        ex.getSessionId());

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.INDEXING_REJECTED,
        "The server is busy indexing other uploads. Retry the upload later.",
        null,
        request);
  }

  @ExceptionHandler(EmbeddingUnavailableException.class)
  public ResponseEntity<ApiError> handleEmbeddingUnavailable(
      EmbeddingUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("embedding_unavailable");
    String errorId = generateErrorId();
    log.error("Embedding unavailable [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.EMBEDDING_UNAVAILABLE,
        ex.getUserMessage(),
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

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, null, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadableBody(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Request body is missing or malformed",
        null,
        request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Bad request [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), null, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        null,
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      String details,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .details(details)
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
