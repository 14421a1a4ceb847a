package com.flamingo.ai.pdfchat.service.rag.extraction;

/**
 * Text of a single PDF page.
 *
 * @param pageNumber 1-based page number
 * @param text extracted text with normalized line endings, stripped of surrounding whitespace
 * @param scanned {@code true} when the page has no usable text layer
 */
public record ExtractedPage(int pageNumber, String text, boolean scanned) {}
