package com.flamingo.ai.pdfchat.domain.enums;

/** Decides whether a session that is not {@link IndexingStatus#DONE} may be queried. */
public enum QueryReadinessPolicy {
  /** Only sessions in {@code DONE} are queried; anything else is not ready. */
  STRICT,

  /**
   * Sessions still indexing or in error are queried against the chunks committed so far; a session
   * with nothing committed is not ready.
   */
  BEST_EFFORT
}
