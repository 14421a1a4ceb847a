package com.flamingo.ai.pdfchat.exception;

/** Exception thrown when a session id is unknown or was torn down. */
public class SessionNotFoundException extends RuntimeException {

  private final String sessionId;

  public SessionNotFoundException(String sessionId) {
    super("Session not found: " + sessionId);
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }
}
