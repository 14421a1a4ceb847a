package com.flamingo.ai.pdfchat.service.rag.extraction;

/**
 * Turns raw document bytes into ordered page text.
 *
 * <p>Implementations must be stateless so one instance can serve concurrent indexing builds.
 */
public interface TextExtractor {

  /**
   * Extracts page text from the given document.
   *
   * @param fileName original file name, used in error details
   * @param content raw document bytes
   * @return the extracted pages
   * @throws com.flamingo.ai.pdfchat.exception.UnreadablePdfException if the bytes are not a
   *     readable PDF
   * @throws com.flamingo.ai.pdfchat.exception.PageLimitExceededException if the document has too
   *     many pages
   * @throws com.flamingo.ai.pdfchat.exception.ScannedDocumentException if no page has a text layer
   */
  ExtractedDocument extract(String fileName, byte[] content);
}
