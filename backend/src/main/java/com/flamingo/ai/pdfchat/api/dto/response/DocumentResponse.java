package com.flamingo.ai.pdfchat.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.pdfchat.domain.enums.ExtractionOutcome;
import com.flamingo.ai.pdfchat.domain.model.SessionDocument;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a document in a session. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentResponse {

  private String id;
  private int ordinal;
  private String fileName;
  private long sizeBytes;
  private int pageCount;
  private ExtractionOutcome outcome;
  private List<Integer> scannedPages;
  private int chunkCount;
  private String error;
  private Instant uploadedAt;

  public static DocumentResponse fromDocument(SessionDocument document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .ordinal(document.getOrdinal())
        .fileName(document.getFileName())
        .sizeBytes(document.getSizeBytes())
        .pageCount(document.getPageCount())
        .outcome(document.getOutcome())
        .scannedPages(document.getScannedPages())
        .chunkCount(document.getChunkCount())
        .error(document.getError())
        .uploadedAt(document.getUploadedAt())
        .build();
  }
}
