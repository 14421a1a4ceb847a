package com.flamingo.ai.pdfchat.exception;

import com.flamingo.ai.pdfchat.domain.enums.IndexingStatus;

/** Exception thrown when a session cannot serve queries in its current indexing state. */
public class IndexNotReadyException extends RuntimeException {

  private final String sessionId;
  private final IndexingStatus status;

  public IndexNotReadyException(String sessionId, IndexingStatus status, String detail) {
    super("Index not ready for session " + sessionId + " (" + status.wireName() + ")"
        + (detail != null ? ": " + detail : ""));
    this.sessionId = sessionId;
    this.status = status;
  }

  public String getSessionId() {
    return sessionId;
  }

  public IndexingStatus getStatus() {
    return status;
  }
}
