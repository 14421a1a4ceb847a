package com.flamingo.ai.pdfchat.config;

import com.flamingo.ai.pdfchat.domain.enums.QueryReadinessPolicy;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the indexing and retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Extraction extraction = new Extraction();
  private Embedding embedding = new Embedding();
  private Retrieval retrieval = new Retrieval();
  private Query query = new Query();
  private Session session = new Session();
  private Upload upload = new Upload();

  /** Fails startup on chunk bounds the chunker cannot honor. */
  @PostConstruct
  public void validate() {
    chunking.validate();
    if (retrieval.getVectorWeight() < 0 || retrieval.getKeywordWeight() < 0) {
      throw new IllegalStateException("rag.retrieval weights must be non-negative");
    }
    if (retrieval.getVectorWeight() + retrieval.getKeywordWeight() <= 0) {
      throw new IllegalStateException("rag.retrieval weights must not both be zero");
    }
  }

  @Getter
  @Setter
  public static class Chunking {
    /** Tokens per emitted chunk. */
    private int windowTokens = 500;

    private int minTokens = 400;
    private int maxTokens = 600;

    /** Fraction of the window repeated at the start of the next chunk. */
    private double overlap = 0.15;

    /** Number of tokens shared by two consecutive chunks. */
    public int overlapTokens() {
      return (int) Math.round(windowTokens * overlap);
    }

    /** Number of tokens the window advances between chunks. */
    public int strideTokens() {
      return windowTokens - overlapTokens();
    }

    void validate() {
      if (minTokens <= 0 || minTokens > maxTokens) {
        throw new IllegalStateException(
            "rag.chunking: min-tokens must be positive and not above max-tokens");
      }
      if (windowTokens < minTokens || windowTokens > maxTokens) {
        throw new IllegalStateException(
            "rag.chunking: window-tokens must lie within [min-tokens, max-tokens]");
      }
      if (overlap < 0 || overlap >= 1) {
        throw new IllegalStateException("rag.chunking: overlap must be in [0, 1)");
      }
      if (strideTokens() <= 0) {
        throw new IllegalStateException(
            "rag.chunking: overlap leaves no room for the window to advance");
      }
    }
  }

  @Getter
  @Setter
  public static class Extraction {
    /** Documents with more pages are rejected. */
    private int maxPages = 500;

    /**
     * Pages whose non-whitespace character density falls below this value are treated as scanned
     * (no usable text layer). A US-letter page is ~93.5 square inches.
     */
    private double minCharsPerSquareInch = 0.1;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Maximum number of texts sent to the embedding model in one call. */
    private int batchSize = 32;

    /** Texts longer than this are truncated before embedding. */
    private int maxChars = 8000;
  }

  @Getter
  @Setter
  public static class Retrieval {
    /** Candidates requested from each index before fusion. */
    private int candidatesPerIndex = 20;

    private int defaultMaxResults = 8;
    private int maxResultsCap = 50;

    private double vectorWeight = 0.5;
    private double keywordWeight = 0.5;

    /** Weight of a vocabulary term that only contains the query term as a substring. */
    private double partialMatchWeight = 0.3;

    /** Multiplier applied when a chunk contains the whole query token sequence. */
    private double phraseBoost = 1.5;
  }

  @Getter
  @Setter
  public static class Query {
    private QueryReadinessPolicy readiness = QueryReadinessPolicy.STRICT;

    /** Upper bound on a query's fan-out to both indexes. */
    private Duration timeout = Duration.ofSeconds(30);
  }

  @Getter
  @Setter
  public static class Session {
    /** Sessions without any access for this long are torn down by the sweeper. */
    private Duration idleTtl = Duration.ofMinutes(60);

    private Duration sweepInterval = Duration.ofMinutes(1);
  }

  @Getter
  @Setter
  public static class Upload {
    private int maxFilesPerSession = 10;
    private long maxFileBytes = 50L * 1024 * 1024;
    private long maxSessionBytes = 100L * 1024 * 1024;
  }
}
