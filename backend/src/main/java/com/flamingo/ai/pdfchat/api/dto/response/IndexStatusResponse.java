package com.flamingo.ai.pdfchat.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.pdfchat.domain.model.IndexingProgress;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a session's indexing status. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndexStatusResponse {

  private String status;
  private int totalFiles;
  private int filesIndexed;
  private String error;

  public static IndexStatusResponse fromProgress(IndexingProgress progress) {
    return IndexStatusResponse.builder()
        .status(progress.status().wireName())
        .totalFiles(progress.totalFiles())
        .filesIndexed(progress.filesIndexed())
        .error(progress.error())
        .build();
  }
}
