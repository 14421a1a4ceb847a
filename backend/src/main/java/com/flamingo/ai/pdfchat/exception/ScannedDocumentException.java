package com.flamingo.ai.pdfchat.exception;

/** Exception thrown when no page of a PDF carries a usable text layer. */
public class ScannedDocumentException extends DocumentExtractionException {

  private final int pageCount;

  public ScannedDocumentException(String fileName, int pageCount) {
    super(
        fileName,
        String.format("%s: none of %d pages has extractable text", fileName, pageCount),
        fileName + " appears scanned/unsearchable (no text layer)");
    this.pageCount = pageCount;
  }

  public int getPageCount() {
    return pageCount;
  }
}
