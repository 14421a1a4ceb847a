package com.flamingo.ai.pdfchat.service.rag.chunking;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.domain.model.DocumentChunk;
import com.flamingo.ai.pdfchat.service.rag.extraction.ExtractedDocument;
import java.util.List;

/**
 * Splits one extracted document into chunks ready for embedding.
 *
 * <p>Implementations must be stateless and safe for concurrent use. A chunker only chunks; it does
 * not extract or embed.
 */
public interface DocumentChunker {

  /**
   * Produces chunks from the document's page text.
   *
   * @param context identity of the document
   * @param document extracted pages
   * @param config chunk window, bounds and overlap
   * @return ordered chunks without embeddings
   */
  List<DocumentChunk> chunk(DocumentContext context, ExtractedDocument document, RagConfig config);
}
