package com.flamingo.ai.pdfchat.api.dto.response;

import com.flamingo.ai.pdfchat.service.session.UploadReceipt;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an accepted upload. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {

  private String sessionId;
  private String status;
  private int totalFiles;
  private int filesIndexed;
  private Totals totals;

  /** Cumulative size of the session after this upload. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Totals {
    private int files;
    private long bytes;
  }

  public static UploadResponse fromReceipt(UploadReceipt receipt) {
    return UploadResponse.builder()
        .sessionId(receipt.sessionId())
        .status(receipt.progress().status().wireName())
        .totalFiles(receipt.progress().totalFiles())
        .filesIndexed(receipt.progress().filesIndexed())
        .totals(new Totals(receipt.sessionFiles(), receipt.sessionBytes()))
        .build();
  }
}
