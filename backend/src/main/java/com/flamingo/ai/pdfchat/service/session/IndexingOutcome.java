package com.flamingo.ai.pdfchat.service.session;

import java.util.List;

/**
 * Result of one indexing build, fed into the session's final state transition.
 *
 * @param kind how the build ended
 * @param documentsIndexed documents committed to both indexes by this build
 * @param detail human-readable cause when the build did not complete cleanly
 */
public record IndexingOutcome(Kind kind, int documentsIndexed, String detail) {

  /** How a build ended. */
  public enum Kind {
    /** Every document was indexed. */
    COMPLETED,
    /** Some documents could not be extracted; the others were indexed. */
    PARTIAL,
    /** The build stopped early, e.g. because the embedding service was unavailable. */
    ABORTED,
    /** The session was torn down while the build was running. */
    CANCELLED
  }

  public static IndexingOutcome completed(int documentsIndexed) {
    return new IndexingOutcome(Kind.COMPLETED, documentsIndexed, null);
  }

  public static IndexingOutcome partial(int documentsIndexed, int total, List<String> failures) {
    String detail =
        "Failed to index "
            + failures.size()
            + " of "
            + total
            + " documents: "
            + String.join("; ", failures);
    return new IndexingOutcome(Kind.PARTIAL, documentsIndexed, detail);
  }

  public static IndexingOutcome aborted(int documentsIndexed, String detail) {
    return new IndexingOutcome(Kind.ABORTED, documentsIndexed, detail);
  }

  public static IndexingOutcome cancelled(int documentsIndexed) {
    return new IndexingOutcome(Kind.CANCELLED, documentsIndexed, null);
  }

  /** {@code true} when the session must be moved to ERROR. */
  public boolean isFailure() {
    return kind == Kind.PARTIAL || kind == Kind.ABORTED;
  }
}
