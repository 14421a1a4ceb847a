package com.flamingo.ai.pdfchat.service.rag.index;

import com.flamingo.ai.pdfchat.domain.model.DocumentChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Exact nearest-neighbour index over unit-length chunk embeddings.
 *
 * <p>Similarity is the dot product, which equals cosine similarity for normalized vectors. All
 * vectors in one index share the dimension of the first one added.
 */
public class VectorIndex implements ChunkIndex {

  private final List<DocumentChunk> chunks = new ArrayList<>();
  private final Set<String> ids = new HashSet<>();
  private int dimension = -1;

  @Override
  public RetrievalSignal signal() {
    return RetrievalSignal.VECTOR;
  }

  @Override
  public boolean add(DocumentChunk chunk) {
    float[] embedding = chunk.getEmbedding();
    if (embedding == null) {
      throw new IllegalArgumentException("Chunk " + chunk.getId() + " has no embedding");
    }
    if (ids.contains(chunk.getId())) {
      return false;
    }
    if (dimension < 0) {
      dimension = embedding.length;
    } else if (embedding.length != dimension) {
      throw new IllegalArgumentException(
          "Embedding dimension " + embedding.length + " does not match index dimension "
              + dimension);
    }
    chunks.add(chunk);
    ids.add(chunk.getId());
    return true;
  }

  @Override
  public List<ScoredCandidate> search(RetrievalQuery query, int k) {
    if (k <= 0 || chunks.isEmpty() || !query.hasEmbedding()) {
      return List.of();
    }
    float[] vector = query.embedding();
    if (vector.length != dimension) {
      throw new IllegalArgumentException(
          "Query dimension " + vector.length + " does not match index dimension " + dimension);
    }

    List<ScoredCandidate> scored = new ArrayList<>(chunks.size());
    for (DocumentChunk chunk : chunks) {
      scored.add(new ScoredCandidate(chunk, dot(vector, chunk.getEmbedding())));
    }
    // List.sort is stable, so equal scores stay in insertion order.
    scored.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());
    return List.copyOf(scored.subList(0, Math.min(k, scored.size())));
  }

  @Override
  public int size() {
    return chunks.size();
  }

  @Override
  public void clear() {
    chunks.clear();
    ids.clear();
    dimension = -1;
  }

  static double dot(float[] a, float[] b) {
    double sum = 0;
    for (int i = 0; i < a.length; i++) {
      sum += (double) a[i] * b[i];
    }
    return sum;
  }
}
