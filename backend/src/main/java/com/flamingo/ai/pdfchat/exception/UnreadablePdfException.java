package com.flamingo.ai.pdfchat.exception;

/** Exception thrown when the uploaded bytes are not a readable PDF container. */
public class UnreadablePdfException extends DocumentExtractionException {

  public UnreadablePdfException(String fileName, Throwable cause) {
    super(
        fileName,
        "Failed to read PDF " + fileName + ": " + cause.getMessage(),
        fileName + " is not a valid PDF",
        cause);
  }
}
