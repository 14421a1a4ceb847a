package com.flamingo.ai.pdfchat.exception;

/** Exception thrown when an upload targets a session whose indexing build is still running. */
public class IndexingInProgressException extends RuntimeException {

  private final String sessionId;

  public IndexingInProgressException(String sessionId) {
    super("Indexing already in progress for session: " + sessionId);
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }
}
