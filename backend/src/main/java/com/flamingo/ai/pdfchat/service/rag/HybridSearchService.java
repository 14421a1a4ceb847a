package com.flamingo.ai.pdfchat.service.rag;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.domain.enums.IndexingStatus;
import com.flamingo.ai.pdfchat.domain.enums.QueryReadinessPolicy;
import com.flamingo.ai.pdfchat.domain.model.DocumentChunk;
import com.flamingo.ai.pdfchat.domain.model.IndexingProgress;
import com.flamingo.ai.pdfchat.exception.EmbeddingUnavailableException;
import com.flamingo.ai.pdfchat.exception.IndexNotReadyException;
import com.flamingo.ai.pdfchat.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.pdfchat.service.rag.index.ChunkIndex;
import com.flamingo.ai.pdfchat.service.rag.index.RetrievalQuery;
import com.flamingo.ai.pdfchat.service.rag.index.ScoredCandidate;
import com.flamingo.ai.pdfchat.service.rag.model.HybridSearchResult;
import com.flamingo.ai.pdfchat.service.rag.model.RankedChunk;
import com.flamingo.ai.pdfchat.service.rag.model.SignalBreakdown;
import com.flamingo.ai.pdfchat.service.session.IndexingSession;
import com.flamingo.ai.pdfchat.service.session.SessionIndexManager;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Hybrid search over a session's vector and keyword indexes.
 *
 * <p>Both indexes are queried in parallel for their top candidates. Each candidate list is min-max
 * normalized on its own, then the two are combined by weighted sum; a chunk missing from one list
 * scores 0 for that signal. Ties are broken by document upload order, then by position in the
 * document. The top chunk of each index is always kept in the returned window. If the query cannot
 * be embedded the ranking falls back to keyword scores alone.
 */
@Service
@Slf4j
public class HybridSearchService {

  private static final Comparator<RankedChunk> RANKING =
      Comparator.comparingDouble(RankedChunk::score)
          .reversed()
          .thenComparingInt(r -> r.chunk().getDocumentOrdinal())
          .thenComparingInt(r -> r.chunk().getStartOffset());

  private final SessionIndexManager sessionIndexManager;
  private final EmbeddingService embeddingService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final TaskExecutor searchExecutor;

  public HybridSearchService(
      SessionIndexManager sessionIndexManager,
      EmbeddingService embeddingService,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Qualifier("searchExecutor") TaskExecutor searchExecutor) {
    this.sessionIndexManager = sessionIndexManager;
    this.embeddingService = embeddingService;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.searchExecutor = searchExecutor;
  }

  /**
   * Returns the best chunks of a session for a question.
   *
   * @param sessionId the session to search
   * @param question natural-language query
   * @param maxResults number of results wanted, {@code null} for the default
   * @return fused ranking, at most {@code maxResults} long
   */
  @Timed(value = "rag.search", description = "Time for hybrid search")
  public HybridSearchResult search(String sessionId, String question, Integer maxResults) {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("Question must not be blank");
    }
    int limit = resolveLimit(maxResults);
    IndexingSession session = sessionIndexManager.getSession(sessionId);
    IndexingProgress progress = session.getProgress();
    checkReadiness(session, progress);

    RetrievalQuery query = embed(question);
    int candidates = Math.max(ragConfig.getRetrieval().getCandidatesPerIndex(), limit);
    List<RankedChunk> results =
        session.withReadLock(
            () -> {
              List<SearchTask> tasks = new ArrayList<>(2);
              try {
                tasks.add(searchAsync(session.getVectorIndex(), query, candidates));
                tasks.add(searchAsync(session.getKeywordIndex(), query, candidates));
                return rank(await(tasks.get(0).result()), await(tasks.get(1).result()), limit);
              } finally {
                // a timed-out search may still be reading the indexes
                tasks.forEach(SearchTask::awaitFinished);
              }
            });

    meterRegistry
        .counter("rag.search.results", "mode", query.hasEmbedding() ? "hybrid" : "keyword")
        .increment();
    log.debug(
        "Session {}: returning {} chunks (status={})",
        sessionId,
        results.size(),
        progress.status().wireName());
    return new HybridSearchResult(progress.status(), !query.hasEmbedding(), List.copyOf(results));
  }

  private void checkReadiness(IndexingSession session, IndexingProgress progress) {
    IndexingStatus status = progress.status();
    if (status == IndexingStatus.DONE) {
      return;
    }
    QueryReadinessPolicy policy = ragConfig.getQuery().getReadiness();
    if (policy == QueryReadinessPolicy.BEST_EFFORT && session.hasCommittedChunks()) {
      log.debug("Session {}: serving partial index while {}", session.getId(), status.wireName());
      return;
    }
    throw new IndexNotReadyException(session.getId(), status, progress.error());
  }

  private RetrievalQuery embed(String question) {
    try {
      return new RetrievalQuery(question, embeddingService.embedQuery(question));
    } catch (EmbeddingUnavailableException e) {
      log.warn("Query embedding unavailable, falling back to keyword-only ranking: {}",
          e.getMessage());
      return RetrievalQuery.keywordOnly(question);
    }
  }

  private SearchTask searchAsync(ChunkIndex index, RetrievalQuery query, int k) {
    CompletableFuture<Void> finished = new CompletableFuture<>();
    CompletableFuture<List<ScoredCandidate>> result =
        CompletableFuture.supplyAsync(
                () -> {
                  try {
                    return index.search(query, k);
                  } finally {
                    finished.complete(null);
                  }
                },
                searchExecutor)
            .orTimeout(ragConfig.getQuery().getTimeout().toMillis(), TimeUnit.MILLISECONDS);
    return new SearchTask(result, finished);
  }

  private List<ScoredCandidate> await(CompletableFuture<List<ScoredCandidate>> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof TimeoutException) {
        throw new IllegalStateException("Search timed out", cause);
      }
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw e;
    }
  }

  /**
   * Fused top {@code limit}, in which the best chunk of each signal always keeps a place.
   *
   * <p>Without the reservation a chunk that only one index ranks first can be pushed out by chunks
   * the other index ties at its maximum. A reserved chunk that did not make the cut replaces the
   * lowest unreserved entry.
   */
  List<RankedChunk> rank(List<ScoredCandidate> vector, List<ScoredCandidate> keyword, int limit) {
    List<RankedChunk> fused = fuse(vector, keyword);
    if (fused.size() <= limit) {
      return fused;
    }
    Set<String> leaders = new LinkedHashSet<>();
    if (!keyword.isEmpty()) {
      leaders.add(keyword.get(0).chunk().getId());
    }
    if (!vector.isEmpty()) {
      leaders.add(vector.get(0).chunk().getId());
    }

    List<RankedChunk> top = new ArrayList<>(fused.subList(0, limit));
    for (String leader : leaders) {
      if (top.stream().anyMatch(r -> r.chunk().getId().equals(leader))) {
        continue;
      }
      int slot = lowestUnreserved(top, leaders);
      if (slot < 0) {
        break;
      }
      fused.stream()
          .filter(r -> r.chunk().getId().equals(leader))
          .findFirst()
          .ifPresent(r -> top.set(slot, r));
    }
    top.sort(RANKING);
    return top;
  }

  private static int lowestUnreserved(List<RankedChunk> top, Set<String> reserved) {
    for (int i = top.size() - 1; i >= 0; i--) {
      if (!reserved.contains(top.get(i).chunk().getId())) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Combines the two candidate lists into one ranking.
   *
   * @param vector vector candidates, best first
   * @param keyword keyword candidates, best first
   * @return all distinct candidates ordered by fused score
   */
  List<RankedChunk> fuse(List<ScoredCandidate> vector, List<ScoredCandidate> keyword) {
    double vectorWeight = ragConfig.getRetrieval().getVectorWeight();
    double keywordWeight = ragConfig.getRetrieval().getKeywordWeight();

    Map<String, Double> vectorNorm = normalize(vector);
    Map<String, Double> keywordNorm = normalize(keyword);
    Map<String, Double> vectorRaw = rawScores(vector);
    Map<String, Double> keywordRaw = rawScores(keyword);

    Map<String, DocumentChunk> chunks = new LinkedHashMap<>();
    vector.forEach(c -> chunks.putIfAbsent(c.chunk().getId(), c.chunk()));
    keyword.forEach(c -> chunks.putIfAbsent(c.chunk().getId(), c.chunk()));

    List<RankedChunk> ranked = new ArrayList<>(chunks.size());
    for (DocumentChunk chunk : chunks.values()) {
      String id = chunk.getId();
      double v = vectorNorm.getOrDefault(id, 0.0);
      double k = keywordNorm.getOrDefault(id, 0.0);
      ranked.add(
          new RankedChunk(
              chunk,
              vectorWeight * v + keywordWeight * k,
              new SignalBreakdown(vectorRaw.get(id), v, keywordRaw.get(id), k)));
    }
    ranked.sort(RANKING);
    return ranked;
  }

  /** Min-max normalization to {@code [0, 1]}; a list whose scores are all equal maps to 1. */
  static Map<String, Double> normalize(List<ScoredCandidate> candidates) {
    Map<String, Double> normalized = new HashMap<>();
    if (candidates.isEmpty()) {
      return normalized;
    }
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (ScoredCandidate candidate : candidates) {
      min = Math.min(min, candidate.score());
      max = Math.max(max, candidate.score());
    }
    double range = max - min;
    for (ScoredCandidate candidate : candidates) {
      double value = range == 0 ? 1.0 : (candidate.score() - min) / range;
      normalized.put(candidate.chunk().getId(), value);
    }
    return normalized;
  }

  private static Map<String, Double> rawScores(List<ScoredCandidate> candidates) {
    Map<String, Double> raw = new HashMap<>();
    candidates.forEach(c -> raw.put(c.chunk().getId(), c.score()));
    return raw;
  }

  private int resolveLimit(Integer maxResults) {
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    if (maxResults == null) {
      return retrieval.getDefaultMaxResults();
    }
    if (maxResults < 1) {
      throw new IllegalArgumentException("maxResults must be at least 1");
    }
    return Math.min(maxResults, retrieval.getMaxResultsCap());
  }

  private record SearchTask(
      CompletableFuture<List<ScoredCandidate>> result, CompletableFuture<Void> finished) {

    void awaitFinished() {
      finished.join();
    }
  }
}
