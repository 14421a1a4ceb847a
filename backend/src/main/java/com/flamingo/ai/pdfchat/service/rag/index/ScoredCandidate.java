package com.flamingo.ai.pdfchat.service.rag.index;

import com.flamingo.ai.pdfchat.domain.model.DocumentChunk;

/**
 * A chunk returned by one index with that index's raw score.
 *
 * @param chunk the matched chunk
 * @param score raw, index-specific score; higher is better
 */
public record ScoredCandidate(DocumentChunk chunk, double score) {}
