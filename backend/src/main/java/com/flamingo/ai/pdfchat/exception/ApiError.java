package com.flamingo.ai.pdfchat.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String SESSION_NOT_FOUND = "SESSION_001";
  public static final String INDEXING_IN_PROGRESS = "SESSION_002";
  public static final String INDEX_NOT_READY = "SESSION_003";
  public static final String INDEXING_REJECTED = "SESSION_004";
  public static final String UPLOAD_LIMIT_EXCEEDED = "UPLOAD_001";
  public static final String UPLOAD_INVALID = "UPLOAD_002";
  public static final String DOCUMENT_UNREADABLE = "DOCUMENT_001";
  public static final String EMBEDDING_UNAVAILABLE = "EMBEDDING_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Additional detail, e.g. the session status for not-ready errors. */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
