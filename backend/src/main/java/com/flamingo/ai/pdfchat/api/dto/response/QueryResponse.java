package com.flamingo.ai.pdfchat.api.dto.response;

import com.flamingo.ai.pdfchat.service.rag.model.HybridSearchResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a session query. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

  private String sessionId;
  private String status;
  private boolean keywordOnly;
  private List<ChunkHit> results;

  public static QueryResponse fromResult(String sessionId, HybridSearchResult result) {
    return QueryResponse.builder()
        .sessionId(sessionId)
        .status(result.status().wireName())
        .keywordOnly(result.keywordOnly())
        .results(result.results().stream().map(ChunkHit::fromRanked).toList())
        .build();
  }
}
