package com.flamingo.ai.pdfchat.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A bounded, overlapping span of one document's text: the unit of indexing and retrieval.
 *
 * <p>Offsets are character positions in the document's concatenated page text; {@code pageStart}
 * and {@code pageEnd} are the 1-based pages those offsets touch.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DocumentChunk {

  /** {@code <documentId>#<chunkIndex>}; unique within a session. */
  String id;

  String documentId;
  int documentOrdinal;
  String fileName;
  int chunkIndex;

  int pageStart;
  int pageEnd;

  /** Inclusive start offset. */
  int startOffset;

  /** Exclusive end offset. */
  int endOffset;

  int tokenCount;
  String text;

  /** L2-normalized embedding, {@code null} until the chunk has been embedded. */
  float[] embedding;

  public static String idFor(String documentId, int chunkIndex) {
    return documentId + "#" + chunkIndex;
  }

  public DocumentChunk withEmbedding(float[] vector) {
    return toBuilder().embedding(vector).build();
  }
}
