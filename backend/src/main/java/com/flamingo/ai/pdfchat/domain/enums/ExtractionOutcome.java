package com.flamingo.ai.pdfchat.domain.enums;

/** Result of running text extraction on an uploaded document. */
public enum ExtractionOutcome {
  /** Accepted, extraction not run yet. */
  PENDING,

  /** At least one page has a usable text layer. */
  OK,

  /** Every page lacks a usable text layer. */
  SCANNED,

  /** The bytes could not be read as a PDF or exceeded the page ceiling. */
  FAILED
}
