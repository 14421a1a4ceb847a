package com.flamingo.ai.pdfchat.service.rag.index;

/** The two retrieval signals fused by hybrid search. */
public enum RetrievalSignal {
  VECTOR,
  KEYWORD
}
