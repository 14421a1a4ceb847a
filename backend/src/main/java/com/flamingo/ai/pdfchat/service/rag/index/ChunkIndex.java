package com.flamingo.ai.pdfchat.service.rag.index;

import com.flamingo.ai.pdfchat.domain.model.DocumentChunk;
import java.util.List;

/**
 * A per-session index over document chunks.
 *
 * <p>Implementations are not synchronized. The owning session serializes writers against readers;
 * any number of concurrent searches are allowed while no writer is active.
 */
public interface ChunkIndex {

  RetrievalSignal signal();

  /**
   * Adds a chunk. Adding a chunk whose id is already present is a no-op.
   *
   * @return {@code true} if the chunk was added
   */
  boolean add(DocumentChunk chunk);

  /**
   * Returns at most {@code k} candidates ordered by descending score. Ties keep insertion order.
   *
   * @param query the query
   * @param k maximum number of candidates
   * @return ranked candidates, empty if the index is empty or nothing matches
   */
  List<ScoredCandidate> search(RetrievalQuery query, int k);

  int size();

  void clear();
}
