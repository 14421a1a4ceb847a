package com.flamingo.ai.pdfchat.exception;

/** Exception thrown when a PDF has more pages than the configured ceiling. */
public class PageLimitExceededException extends DocumentExtractionException {

  private final int pageCount;
  private final int maxPages;

  public PageLimitExceededException(String fileName, int pageCount, int maxPages) {
    super(
        fileName,
        String.format("%s has %d pages, limit is %d", fileName, pageCount, maxPages),
        fileName + " exceeds " + maxPages + " pages");
    this.pageCount = pageCount;
    this.maxPages = maxPages;
  }

  public int getPageCount() {
    return pageCount;
  }

  public int getMaxPages() {
    return maxPages;
  }
}
