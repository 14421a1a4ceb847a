package com.flamingo.ai.pdfchat.service.rag.index;

/**
 * A query as seen by the indexes.
 *
 * @param text raw question text, used by keyword retrieval
 * @param embedding unit-length query vector, or {@code null} when the query could not be embedded
 */
public record RetrievalQuery(String text, float[] embedding) {

  public static RetrievalQuery keywordOnly(String text) {
    return new RetrievalQuery(text, null);
  }

  public boolean hasEmbedding() {
    return embedding != null;
  }
}
