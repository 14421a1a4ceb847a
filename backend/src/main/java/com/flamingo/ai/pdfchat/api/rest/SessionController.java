package com.flamingo.ai.pdfchat.api.rest;

import com.flamingo.ai.pdfchat.api.dto.request.QueryRequest;
import com.flamingo.ai.pdfchat.api.dto.response.DocumentResponse;
import com.flamingo.ai.pdfchat.api.dto.response.IndexStatusResponse;
import com.flamingo.ai.pdfchat.api.dto.response.QueryResponse;
import com.flamingo.ai.pdfchat.api.dto.response.UploadResponse;
import com.flamingo.ai.pdfchat.service.document.DocumentService;
import com.flamingo.ai.pdfchat.service.rag.HybridSearchService;
import com.flamingo.ai.pdfchat.service.rag.model.HybridSearchResult;
import com.flamingo.ai.pdfchat.service.session.SessionIndexManager;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for upload sessions: intake, status, query and teardown. */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

  private final DocumentService documentService;
  private final SessionIndexManager sessionIndexManager;
  private final HybridSearchService hybridSearchService;

  /** Uploads PDFs into a new session. */
  @PostMapping(value = "/uploads", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UploadResponse> uploadToNewSession(
      @RequestParam(value = "files", required = false) List<MultipartFile> files) {
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(UploadResponse.fromReceipt(documentService.upload(null, files)));
  }

  /** Uploads more PDFs into an existing session. */
  @PostMapping(value = "/{sessionId}/uploads", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UploadResponse> uploadToSession(
      @PathVariable String sessionId,
      @RequestParam(value = "files", required = false) List<MultipartFile> files) {
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(UploadResponse.fromReceipt(documentService.upload(sessionId, files)));
  }

  /** Gets the indexing status of a session. */
  @GetMapping("/{sessionId}/status")
  public ResponseEntity<IndexStatusResponse> getStatus(@PathVariable String sessionId) {
    return ResponseEntity.ok(
        IndexStatusResponse.fromProgress(sessionIndexManager.getStatus(sessionId)));
  }

  /** Gets per-document extraction outcomes of a session. */
  @GetMapping("/{sessionId}/documents")
  public ResponseEntity<List<DocumentResponse>> getDocuments(@PathVariable String sessionId) {
    return ResponseEntity.ok(
        sessionIndexManager.getDocuments(sessionId).stream()
            .map(DocumentResponse::fromDocument)
            .toList());
  }

  /** Returns the chunks that best answer a question. */
  @PostMapping("/{sessionId}/query")
  public ResponseEntity<QueryResponse> query(
      @PathVariable String sessionId, @Valid @RequestBody QueryRequest request) {
    HybridSearchResult result =
        hybridSearchService.search(sessionId, request.getQuestion(), request.getMaxResults());
    return ResponseEntity.ok(QueryResponse.fromResult(sessionId, result));
  }

  /** Tears down a session and its indexes. */
  @DeleteMapping("/{sessionId}")
  public ResponseEntity<Void> deleteSession(@PathVariable String sessionId) {
    sessionIndexManager.teardown(sessionId);
    return ResponseEntity.noContent().build();
  }
}
