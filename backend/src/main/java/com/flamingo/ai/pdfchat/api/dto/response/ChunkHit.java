package com.flamingo.ai.pdfchat.api.dto.response;

import com.flamingo.ai.pdfchat.domain.model.DocumentChunk;
import com.flamingo.ai.pdfchat.service.rag.model.RankedChunk;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One ranked chunk in a query response. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkHit {

  private String chunkId;
  private String documentId;
  private String fileName;
  private int pageStart;
  private int pageEnd;
  private int startOffset;
  private int endOffset;
  private String text;
  private double score;
  private double vectorScore;
  private double keywordScore;

  public static ChunkHit fromRanked(RankedChunk ranked) {
    DocumentChunk chunk = ranked.chunk();
    return ChunkHit.builder()
        .chunkId(chunk.getId())
        .documentId(chunk.getDocumentId())
        .fileName(chunk.getFileName())
        .pageStart(chunk.getPageStart())
        .pageEnd(chunk.getPageEnd())
        .startOffset(chunk.getStartOffset())
        .endOffset(chunk.getEndOffset())
        .text(chunk.getText())
        .score(ranked.score())
        .vectorScore(ranked.signals().vectorNormalized())
        .keywordScore(ranked.signals().keywordNormalized())
        .build();
  }
}
