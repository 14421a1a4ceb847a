package com.flamingo.ai.pdfchat.domain.model;

import com.flamingo.ai.pdfchat.domain.enums.ExtractionOutcome;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * An uploaded file within a session.
 *
 * <p>Instances are immutable; the indexing build replaces the accepted document with the copy that
 * carries its extraction outcome.
 */
@Value
@Builder(toBuilder = true)
public class SessionDocument {

  /** Session-scoped id, e.g. {@code doc-3}. */
  String id;

  /** Position in the session's upload order, used as the first fusion tie-breaker. */
  int ordinal;

  String fileName;
  long sizeBytes;

  @Builder.Default int pageCount = 0;

  @Builder.Default ExtractionOutcome outcome = ExtractionOutcome.PENDING;

  /** 1-based numbers of pages without a usable text layer. */
  @Builder.Default List<Integer> scannedPages = List.of();

  @Builder.Default int chunkCount = 0;

  /** Human-readable failure cause when {@link #outcome} is SCANNED or FAILED. */
  String error;

  Instant uploadedAt;

  /** Copy with a successful extraction outcome. */
  public SessionDocument extracted(int pageCount, List<Integer> scannedPages, int chunkCount) {
    return toBuilder()
        .pageCount(pageCount)
        .scannedPages(List.copyOf(scannedPages))
        .chunkCount(chunkCount)
        .outcome(ExtractionOutcome.OK)
        .error(null)
        .build();
  }

  /** Copy marked as failed with the given outcome and cause. */
  public SessionDocument failed(ExtractionOutcome outcome, int pageCount, String error) {
    return toBuilder().outcome(outcome).pageCount(pageCount).error(error).build();
  }
}
