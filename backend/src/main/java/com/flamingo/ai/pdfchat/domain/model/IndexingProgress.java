package com.flamingo.ai.pdfchat.domain.model;

import com.flamingo.ai.pdfchat.domain.enums.IndexingStatus;

/**
 * Immutable snapshot of a session's indexing state. Transitions return new snapshots so readers
 * never see a half-applied update.
 *
 * @param status current lifecycle status
 * @param totalFiles files in the current build
 * @param filesIndexed files of the current build committed to both indexes
 * @param error failure detail when {@code status} is ERROR
 */
public record IndexingProgress(
    IndexingStatus status, int totalFiles, int filesIndexed, String error) {

  public static IndexingProgress pending() {
    return new IndexingProgress(IndexingStatus.PENDING, 0, 0, null);
  }

  /** Counters reset to {@code (0, totalFiles)} for a new build. */
  public IndexingProgress startBuild(int totalFiles) {
    return new IndexingProgress(IndexingStatus.INDEXING, totalFiles, 0, null);
  }

  /** One more document committed; reaching {@code totalFiles} completes the build. */
  public IndexingProgress documentIndexed() {
    if (status != IndexingStatus.INDEXING || filesIndexed >= totalFiles) {
      return this;
    }
    int indexed = filesIndexed + 1;
    IndexingStatus next = indexed == totalFiles ? IndexingStatus.DONE : IndexingStatus.INDEXING;
    return new IndexingProgress(next, totalFiles, indexed, null);
  }

  public IndexingProgress failed(String detail) {
    return new IndexingProgress(IndexingStatus.ERROR, totalFiles, filesIndexed, detail);
  }

  public boolean isIndexing() {
    return status == IndexingStatus.INDEXING;
  }
}
