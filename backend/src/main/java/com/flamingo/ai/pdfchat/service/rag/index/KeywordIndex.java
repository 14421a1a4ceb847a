package com.flamingo.ai.pdfchat.service.rag.index;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.domain.model.DocumentChunk;
import com.flamingo.ai.pdfchat.service.rag.chunking.Tokenizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * In-memory BM25 index over chunk text.
 *
 * <p>Terms come from {@link Tokenizer#terms(String)}. Besides exact term matches, a query term of
 * at least {@value #MIN_PARTIAL_TERM_LENGTH} characters also matches vocabulary terms that contain
 * it, at a reduced weight. Chunks that contain the full query term sequence contiguously get their
 * score multiplied by the phrase boost.
 *
 * <pre>
 * score(D,Q) = sum IDF(q) * (f(q,D) * (k1 + 1)) / (f(q,D) + k1 * (1 - b + b * |D| / avgdl))
 * IDF(q)     = log((N - n(q) + 0.5) / (n(q) + 0.5) + 1)
 * </pre>
 */
public class KeywordIndex implements ChunkIndex {

  static final double K1 = 1.5;
  static final double B = 0.75;
  static final int MIN_PARTIAL_TERM_LENGTH = 3;

  private final double partialMatchWeight;
  private final double phraseBoost;

  private final Map<String, Entry> entries = new HashMap<>();
  private final Map<String, Map<String, Integer>> invertedIndex = new LinkedHashMap<>();
  private long totalLength;

  private record Entry(DocumentChunk chunk, int sequence, List<String> terms) {}

  public KeywordIndex(double partialMatchWeight, double phraseBoost) {
    this.partialMatchWeight = partialMatchWeight;
    this.phraseBoost = phraseBoost;
  }

  public static KeywordIndex from(RagConfig.Retrieval retrieval) {
    return new KeywordIndex(retrieval.getPartialMatchWeight(), retrieval.getPhraseBoost());
  }

  @Override
  public RetrievalSignal signal() {
    return RetrievalSignal.KEYWORD;
  }

  @Override
  public boolean add(DocumentChunk chunk) {
    if (entries.containsKey(chunk.getId())) {
      return false;
    }
    List<String> terms = Tokenizer.terms(chunk.getText());
    entries.put(chunk.getId(), new Entry(chunk, entries.size(), terms));
    totalLength += terms.size();

    Map<String, Integer> termFreq = new LinkedHashMap<>();
    for (String term : terms) {
      termFreq.merge(term, 1, Integer::sum);
    }
    termFreq.forEach(
        (term, tf) ->
            invertedIndex.computeIfAbsent(term, t -> new LinkedHashMap<>()).put(chunk.getId(), tf));
    return true;
  }

  @Override
  public List<ScoredCandidate> search(RetrievalQuery query, int k) {
    if (k <= 0 || entries.isEmpty()) {
      return List.of();
    }
    List<String> queryTerms = Tokenizer.terms(query.text());
    if (queryTerms.isEmpty()) {
      return List.of();
    }

    double avgLength = (double) totalLength / entries.size();
    Map<String, Double> scores = new HashMap<>();
    for (String term : new LinkedHashSet<>(queryTerms)) {
      accumulate(scores, term, 1.0, avgLength);
      if (term.length() >= MIN_PARTIAL_TERM_LENGTH && partialMatchWeight > 0) {
        for (String vocabulary : invertedIndex.keySet()) {
          if (!vocabulary.equals(term) && vocabulary.contains(term)) {
            accumulate(scores, vocabulary, partialMatchWeight, avgLength);
          }
        }
      }
    }

    List<ScoredCandidate> ranked = new ArrayList<>(scores.size());
    scores.forEach(
        (id, score) -> {
          Entry entry = entries.get(id);
          double boosted =
              queryTerms.size() > 1 && containsSequence(entry.terms(), queryTerms)
                  ? score * phraseBoost
                  : score;
          ranked.add(new ScoredCandidate(entry.chunk(), boosted));
        });
    ranked.sort(
        Comparator.comparingDouble(ScoredCandidate::score)
            .reversed()
            .thenComparingInt(c -> entries.get(c.chunk().getId()).sequence()));
    return List.copyOf(ranked.subList(0, Math.min(k, ranked.size())));
  }

  private void accumulate(
      Map<String, Double> scores, String term, double weight, double avgLength) {
    Map<String, Integer> postings = invertedIndex.get(term);
    if (postings == null || postings.isEmpty()) {
      return;
    }
    int totalDocs = entries.size();
    int df = postings.size();
    double idf = Math.log((totalDocs - df + 0.5) / (df + 0.5) + 1);
    for (Map.Entry<String, Integer> posting : postings.entrySet()) {
      int tf = posting.getValue();
      double docLength = entries.get(posting.getKey()).terms().size();
      double lengthNorm = 1 - B + B * (docLength / avgLength);
      double tfNorm = (tf * (K1 + 1)) / (tf + K1 * lengthNorm);
      scores.merge(posting.getKey(), weight * idf * tfNorm, Double::sum);
    }
  }

  static boolean containsSequence(List<String> terms, List<String> sequence) {
    return Collections.indexOfSubList(terms, sequence) >= 0;
  }

  @Override
  public int size() {
    return entries.size();
  }

  public int vocabularySize() {
    return invertedIndex.size();
  }

  @Override
  public void clear() {
    entries.clear();
    invertedIndex.clear();
    totalLength = 0;
  }
}
