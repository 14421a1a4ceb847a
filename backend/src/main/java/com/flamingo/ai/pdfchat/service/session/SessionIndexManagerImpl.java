package com.flamingo.ai.pdfchat.service.session;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.domain.model.IndexingProgress;
import com.flamingo.ai.pdfchat.domain.model.SessionDocument;
import com.flamingo.ai.pdfchat.exception.IndexingRejectedException;
import com.flamingo.ai.pdfchat.exception.SessionNotFoundException;
import com.flamingo.ai.pdfchat.service.document.UploadedFile;
import com.flamingo.ai.pdfchat.service.rag.index.KeywordIndex;
import com.flamingo.ai.pdfchat.service.rag.index.VectorIndex;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/** In-memory implementation of {@link SessionIndexManager}. */
@Service
@Slf4j
public class SessionIndexManagerImpl implements SessionIndexManager {

  private final SessionRegistry sessionRegistry;
  private final DocumentIndexingService documentIndexingService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final TaskExecutor indexingExecutor;

  public SessionIndexManagerImpl(
      SessionRegistry sessionRegistry,
      DocumentIndexingService documentIndexingService,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Qualifier("indexingExecutor") TaskExecutor indexingExecutor) {
    this.sessionRegistry = sessionRegistry;
    this.documentIndexingService = documentIndexingService;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.indexingExecutor = indexingExecutor;
  }

  @Override
  @Timed(value = "session.upload", description = "Time to accept an upload")
  public UploadReceipt upload(String sessionId, List<UploadedFile> files) {
    boolean created = sessionId == null;
    IndexingSession session = created ? newSession() : requireSession(sessionId);

    List<PendingDocument> accepted = session.admit(files, ragConfig.getUpload());
    IndexingProgress progress = session.getProgress();
    try {
      IndexingJob job =
          IndexingJob.submit(
              session.getId(),
              session.getCancellationToken(),
              () -> documentIndexingService.build(session, accepted),
              indexingExecutor,
              (outcome, error) -> finishBuild(session, outcome, error));
      session.setCurrentJob(job);
    } catch (RejectedExecutionException e) {
      session.revokeAdmission(accepted);
      log.error("Session {}: indexing executor rejected the build", session.getId(), e);
      throw new IndexingRejectedException(session.getId(), e);
    }

    session.touch();
    if (created) {
      sessionRegistry.register(session);
      meterRegistry.counter("session.created").increment();
      log.info("Created session {}", session.getId());
    }
    log.info(
        "Session {}: accepted {} files, build scheduled ({} files / {} bytes in session)",
        session.getId(),
        accepted.size(),
        session.getTotalFiles(),
        session.getTotalBytes());
    return new UploadReceipt(
        session.getId(), progress, session.getTotalFiles(), session.getTotalBytes());
  }

  @Override
  public IndexingSession getSession(String sessionId) {
    IndexingSession session = requireSession(sessionId);
    session.touch();
    return session;
  }

  @Override
  public IndexingProgress getStatus(String sessionId) {
    return getSession(sessionId).getProgress();
  }

  @Override
  public List<SessionDocument> getDocuments(String sessionId) {
    return getSession(sessionId).getDocuments();
  }

  @Override
  @Timed(value = "session.delete", description = "Time to tear down a session")
  public void teardown(String sessionId) {
    IndexingSession session =
        sessionRegistry
            .remove(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
    session.close();
    meterRegistry.counter("session.deleted").increment();
    log.info("Tore down session {}", sessionId);
  }

  @Override
  public int expireIdleSessions() {
    Instant now = Instant.now();
    Duration ttl = ragConfig.getSession().getIdleTtl();
    int expired = 0;
    for (IndexingSession session : sessionRegistry.all()) {
      if (!session.closeIfIdle(now, ttl)) {
        continue;
      }
      if (sessionRegistry.remove(session.getId()).isPresent()) {
        expired++;
        meterRegistry.counter("session.expired").increment();
        log.info(
            "Expired session {} (idle since {})", session.getId(), session.getLastAccessedAt());
      }
    }
    return expired;
  }

  private void finishBuild(IndexingSession session, IndexingOutcome outcome, Throwable error) {
    if (session.isClosed()) {
      return;
    }
    if (error != null) {
      log.error("Session {}: indexing build failed", session.getId(), error);
      session.failBuild("Indexing failed unexpectedly");
      return;
    }
    if (outcome.isFailure()) {
      IndexingProgress progress = session.failBuild(outcome.detail());
      log.warn(
          "Session {}: build ended in {} ({}/{} files indexed): {}",
          session.getId(),
          progress.status(),
          progress.filesIndexed(),
          progress.totalFiles(),
          outcome.detail());
    }
  }

  private IndexingSession newSession() {
    return new IndexingSession(
        sessionRegistry.newSessionId(),
        new VectorIndex(),
        KeywordIndex.from(ragConfig.getRetrieval()));
  }

  private IndexingSession requireSession(String sessionId) {
    return sessionRegistry
        .find(sessionId)
        .orElseThrow(() -> new SessionNotFoundException(sessionId));
  }
}
