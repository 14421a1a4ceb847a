package com.flamingo.ai.pdfchat.service.rag.embedding;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.exception.EmbeddingUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Maps text to L2-normalized vectors through the configured {@link EmbeddingModel}.
 *
 * <p>Passages and queries go through the same model, so their vectors are directly comparable by
 * dot product. Any failure of the model surfaces as {@link EmbeddingUnavailableException}; callers
 * never receive an empty or partial result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a query string.
   *
   * @param query the query text
   * @return unit-length embedding vector
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedQueryFallback")
  @Retry(name = "embedding")
  public float[] embedQuery(String query) {
    List<float[]> vectors = callModel(List.of(truncate(query, 0)));
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return vectors.get(0);
  }

  /**
   * Embeds document passages, batching calls to the model.
   *
   * @param passages chunk texts in order
   * @return one unit-length vector per passage, in the same order
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed passage batch")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedPassagesFallback")
  @Retry(name = "embedding")
  public List<float[]> embedPassages(List<String> passages) {
    if (passages.isEmpty()) {
      return List.of();
    }
    int batchSize = Math.max(1, ragConfig.getEmbedding().getBatchSize());
    List<float[]> results = new ArrayList<>(passages.size());
    for (int from = 0; from < passages.size(); from += batchSize) {
      int to = Math.min(from + batchSize, passages.size());
      List<String> batch = new ArrayList<>(to - from);
      for (int i = from; i < to; i++) {
        batch.add(truncate(passages.get(i), i));
      }
      results.addAll(callModel(batch));
    }
    meterRegistry.counter("embedding.requests.success", "type", "passage").increment();
    log.debug("Embedded {} passages in batches of {}", passages.size(), batchSize);
    return results;
  }

  private List<float[]> callModel(List<String> texts) {
    Response<List<Embedding>> response;
    try {
      response = embeddingModel.embedAll(texts.stream().map(TextSegment::from).toList());
    } catch (RuntimeException e) {
      throw new EmbeddingUnavailableException("Embedding model call failed: " + e.getMessage(), e);
    }
    List<Embedding> embeddings = response == null ? null : response.content();
    if (embeddings == null || embeddings.size() != texts.size()) {
      throw new EmbeddingUnavailableException(
          "Embedding model returned "
              + (embeddings == null ? "no" : embeddings.size())
              + " vectors for "
              + texts.size()
              + " inputs");
    }
    List<float[]> vectors = new ArrayList<>(embeddings.size());
    for (Embedding embedding : embeddings) {
      vectors.add(normalize(embedding.vector()));
    }
    return vectors;
  }

  private String truncate(String text, int position) {
    int maxChars = ragConfig.getEmbedding().getMaxChars();
    if (text.length() <= maxChars) {
      return text;
    }
    log.warn(
        "Text {} too long for embedding, truncating from {} chars to {} chars",
        position,
        text.length(),
        maxChars);
    return text.substring(0, maxChars);
  }

  /** Scales the vector to unit length. A zero vector is returned unchanged. */
  static float[] normalize(float[] vector) {
    double sumSquares = 0;
    for (float v : vector) {
      sumSquares += (double) v * v;
    }
    if (sumSquares == 0) {
      return vector.clone();
    }
    double norm = Math.sqrt(sumSquares);
    float[] normalized = new float[vector.length];
    for (int i = 0; i < vector.length; i++) {
      normalized[i] = (float) (vector[i] / norm);
    }
    return normalized;
  }

  @SuppressWarnings("unused")
  private float[] embedQueryFallback(String query, Throwable t) {
    log.error("Query embedding failed: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "query").increment();
    throw asUnavailable(t);
  }

  @SuppressWarnings("unused")
  private List<float[]> embedPassagesFallback(List<String> passages, Throwable t) {
    log.error("Passage embedding failed for {} passages: {}", passages.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "passage").increment();
    throw asUnavailable(t);
  }

  private EmbeddingUnavailableException asUnavailable(Throwable t) {
    if (t instanceof EmbeddingUnavailableException unavailable) {
      return unavailable;
    }
    return new EmbeddingUnavailableException("Embedding service unavailable: " + t.getMessage(), t);
  }
}
