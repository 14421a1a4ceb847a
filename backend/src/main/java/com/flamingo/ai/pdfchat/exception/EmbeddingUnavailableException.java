package com.flamingo.ai.pdfchat.exception;

/** Exception thrown when the embedding model cannot be reached or returns unusable output. */
public class EmbeddingUnavailableException extends RuntimeException {

  private final String userMessage;

  public EmbeddingUnavailableException(String message) {
    super(message);
    this.userMessage = "Embedding service is temporarily unavailable. Please try again later.";
  }

  public EmbeddingUnavailableException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Embedding service is temporarily unavailable. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
