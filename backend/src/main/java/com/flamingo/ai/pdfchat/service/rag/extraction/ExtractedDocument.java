package com.flamingo.ai.pdfchat.service.rag.extraction;

import java.util.List;

/**
 * Ordered page texts of one PDF.
 *
 * @param fileName original file name, for error messages and logging
 * @param pageCount number of pages in the PDF
 * @param pages one entry per page, in page order
 */
public record ExtractedDocument(String fileName, int pageCount, List<ExtractedPage> pages) {

  public ExtractedDocument {
    pages = List.copyOf(pages);
  }

  /** Pages that carry a usable text layer, in page order. */
  public List<ExtractedPage> textPages() {
    return pages.stream().filter(p -> !p.scanned()).toList();
  }

  public List<Integer> scannedPageNumbers() {
    return pages.stream().filter(ExtractedPage::scanned).map(ExtractedPage::pageNumber).toList();
  }
}
