package com.flamingo.ai.pdfchat.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for querying a session. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

  @NotBlank(message = "Question is required")
  @Size(max = 4000, message = "Question must be at most 4000 characters")
  private String question;

  /** Results wanted; defaults to 8 and is capped server-side. */
  @Min(value = 1, message = "maxResults must be at least 1")
  private Integer maxResults;
}
