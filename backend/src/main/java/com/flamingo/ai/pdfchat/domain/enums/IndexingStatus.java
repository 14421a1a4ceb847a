package com.flamingo.ai.pdfchat.domain.enums;

import java.util.Locale;

/** Lifecycle status of a session's background indexing work. */
public enum IndexingStatus {
  /** Session registered, no build started yet. */
  PENDING,

  /** A build is extracting, chunking, embedding or committing documents. */
  INDEXING,

  /** Every document of the last build is committed to both indexes. */
  DONE,

  /** The last build failed for at least one document. */
  ERROR;

  /** Wire representation used by the status endpoint. */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
