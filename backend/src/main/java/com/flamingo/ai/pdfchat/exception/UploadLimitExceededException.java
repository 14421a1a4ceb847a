package com.flamingo.ai.pdfchat.exception;

/** Exception thrown when an upload would break a per-file or per-session limit. */
public class UploadLimitExceededException extends RuntimeException {

  /** Which limit was hit. */
  public enum Limit {
    NO_FILES,
    FILE_COUNT,
    FILE_SIZE,
    SESSION_SIZE
  }

  private final Limit limit;

  public UploadLimitExceededException(Limit limit, String message) {
    super(message);
    this.limit = limit;
  }

  public Limit getLimit() {
    return limit;
  }
}
