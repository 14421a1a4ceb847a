package com.flamingo.ai.pdfchat.service.rag.model;

import com.flamingo.ai.pdfchat.domain.enums.IndexingStatus;
import java.util.List;

/**
 * Fused ranking for one query.
 *
 * @param status session status the query was served under
 * @param keywordOnly {@code true} if the query could not be embedded and only keyword scores count
 * @param results ranked chunks, best first
 */
public record HybridSearchResult(
    IndexingStatus status, boolean keywordOnly, List<RankedChunk> results) {}
