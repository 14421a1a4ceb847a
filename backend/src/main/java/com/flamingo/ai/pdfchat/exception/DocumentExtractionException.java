package com.flamingo.ai.pdfchat.exception;

/** Base class for failures turning one uploaded file into page text. */
public abstract class DocumentExtractionException extends RuntimeException {

  private final String fileName;
  private final String userMessage;

  protected DocumentExtractionException(String fileName, String message, String userMessage) {
    super(message);
    this.fileName = fileName;
    this.userMessage = userMessage;
  }

  protected DocumentExtractionException(
      String fileName, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
    this.userMessage = userMessage;
  }

  public String getFileName() {
    return fileName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
