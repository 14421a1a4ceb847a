package com.flamingo.ai.pdfchat.exception;

/**
 * Exception thrown when an accepted upload cannot be scheduled for indexing. The upload is rolled
 * back before this is thrown, so the session looks as if it never arrived.
 */
public class IndexingRejectedException extends RuntimeException {

  private final String sessionId;

  public IndexingRejectedException(String sessionId, Throwable cause) {
    super("Indexing capacity exhausted for session: " + sessionId, cause);
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }
}
