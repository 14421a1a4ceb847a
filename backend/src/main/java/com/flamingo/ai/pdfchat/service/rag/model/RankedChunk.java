package com.flamingo.ai.pdfchat.service.rag.model;

import com.flamingo.ai.pdfchat.domain.model.DocumentChunk;

/**
 * A chunk in a fused result list.
 *
 * @param chunk the chunk with its provenance
 * @param score fused score in {@code [0, vectorWeight + keywordWeight]}
 * @param signals the scores it was fused from
 */
public record RankedChunk(DocumentChunk chunk, double score, SignalBreakdown signals) {}
