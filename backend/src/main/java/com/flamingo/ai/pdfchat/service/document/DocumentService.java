package com.flamingo.ai.pdfchat.service.document;

import com.flamingo.ai.pdfchat.service.session.UploadReceipt;
import java.util.List;
import org.springframework.web.multipart.MultipartFile;

/** Upload intake: checks limits on incoming files and hands them to a session. */
public interface DocumentService {

  /**
   * Validates an upload and schedules its indexing.
   *
   * @param sessionId existing session id, or {@code null} to start a new session
   * @param files the uploaded PDF files
   * @return receipt with the session id and initial progress
   * @throws com.flamingo.ai.pdfchat.exception.UploadLimitExceededException if any limit is broken
   * @throws com.flamingo.ai.pdfchat.exception.SessionNotFoundException for an unknown session id
   */
  UploadReceipt upload(String sessionId, List<MultipartFile> files);
}
