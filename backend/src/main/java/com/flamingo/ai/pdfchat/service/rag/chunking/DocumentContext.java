package com.flamingo.ai.pdfchat.service.rag.chunking;

/**
 * Identity of the document being chunked, stamped onto every chunk for provenance.
 *
 * @param documentId session-scoped document id
 * @param ordinal position of the document in the session's upload order
 * @param fileName original file name
 */
public record DocumentContext(String documentId, int ordinal, String fileName) {}
