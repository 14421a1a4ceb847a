package com.flamingo.ai.pdfchat.service.session;

import com.flamingo.ai.pdfchat.domain.model.IndexingProgress;
import com.flamingo.ai.pdfchat.domain.model.SessionDocument;
import com.flamingo.ai.pdfchat.service.document.UploadedFile;
import java.util.List;

/** Owns the per-session indexes and drives their indexing lifecycle. */
public interface SessionIndexManager {

  /**
   * Accepts files into a session and schedules a background build for them.
   *
   * @param sessionId existing session, or {@code null} to create a new one
   * @param files uploaded files, already checked against per-file limits
   * @return the receipt; the build may still be running
   * @throws com.flamingo.ai.pdfchat.exception.SessionNotFoundException for an unknown session id
   * @throws com.flamingo.ai.pdfchat.exception.IndexingInProgressException if a build is in flight
   * @throws com.flamingo.ai.pdfchat.exception.UploadLimitExceededException on session limits
   * @throws com.flamingo.ai.pdfchat.exception.IndexingRejectedException if the build cannot be
   *     scheduled; the upload is rolled back
   */
  UploadReceipt upload(String sessionId, List<UploadedFile> files);

  /** Returns the session and refreshes its idle timer. */
  IndexingSession getSession(String sessionId);

  IndexingProgress getStatus(String sessionId);

  List<SessionDocument> getDocuments(String sessionId);

  /** Removes the session, cancels its build and drops its indexes. */
  void teardown(String sessionId);

  /**
   * Tears down sessions idle for longer than the configured TTL whose build is not running.
   *
   * @return number of sessions removed
   */
  int expireIdleSessions();
}
