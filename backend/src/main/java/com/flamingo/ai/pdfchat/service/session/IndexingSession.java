package com.flamingo.ai.pdfchat.service.session;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.domain.model.DocumentChunk;
import com.flamingo.ai.pdfchat.domain.model.IndexingProgress;
import com.flamingo.ai.pdfchat.domain.model.SessionDocument;
import com.flamingo.ai.pdfchat.exception.IndexingInProgressException;
import com.flamingo.ai.pdfchat.exception.SessionNotFoundException;
import com.flamingo.ai.pdfchat.exception.UploadLimitExceededException;
import com.flamingo.ai.pdfchat.exception.UploadLimitExceededException.Limit;
import com.flamingo.ai.pdfchat.service.document.UploadedFile;
import com.flamingo.ai.pdfchat.service.rag.index.KeywordIndex;
import com.flamingo.ai.pdfchat.service.rag.index.VectorIndex;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * One upload session: its documents, its two indexes and its indexing state.
 *
 * <p>Locking:
 *
 * <ul>
 *   <li>the instance monitor guards admission, the document list and the upload totals;
 *   <li>{@code commitLock} serializes chunk commits (write) against queries (read);
 *   <li>{@code buildLock} is held for the whole body of a build;
 *   <li>the progress snapshot is read without locking.
 * </ul>
 */
public class IndexingSession {

  private final String id;
  private final Instant createdAt;
  private volatile Instant lastAccessedAt;

  private final AtomicReference<IndexingProgress> progress =
      new AtomicReference<>(IndexingProgress.pending());
  private final List<SessionDocument> documents = new ArrayList<>();
  private long totalBytes;
  private boolean closed;
  private IndexingProgress progressBeforeAdmission;

  private final VectorIndex vectorIndex;
  private final KeywordIndex keywordIndex;
  private final ReentrantReadWriteLock commitLock = new ReentrantReadWriteLock();
  private final ReentrantLock buildLock = new ReentrantLock();
  private final CancellationToken cancellationToken = new CancellationToken();
  private volatile IndexingJob currentJob;

  public IndexingSession(String id, VectorIndex vectorIndex, KeywordIndex keywordIndex) {
    this.id = id;
    this.vectorIndex = vectorIndex;
    this.keywordIndex = keywordIndex;
    this.createdAt = Instant.now();
    this.lastAccessedAt = createdAt;
  }

  /**
   * Accepts an upload and starts a new build in one step.
   *
   * <p>Fails without changing anything if a build is in flight or the upload would push the
   * session over its file-count or byte limits.
   *
   * @return the accepted documents with their content, in upload order
   */
  public synchronized List<PendingDocument> admit(
      List<UploadedFile> files, RagConfig.Upload limits) {
    if (closed) {
      throw new SessionNotFoundException(id);
    }
    if (progress.get().isIndexing()) {
      throw new IndexingInProgressException(id);
    }
    if (documents.size() + files.size() > limits.getMaxFilesPerSession()) {
      throw new UploadLimitExceededException(
          Limit.FILE_COUNT,
          "A session holds at most " + limits.getMaxFilesPerSession() + " files");
    }
    long uploadBytes = files.stream().mapToLong(UploadedFile::sizeBytes).sum();
    if (totalBytes + uploadBytes > limits.getMaxSessionBytes()) {
      throw new UploadLimitExceededException(
          Limit.SESSION_SIZE,
          "A session holds at most " + limits.getMaxSessionBytes() + " bytes in total");
    }

    Instant now = Instant.now();
    List<PendingDocument> accepted = new ArrayList<>(files.size());
    for (UploadedFile file : files) {
      int ordinal = documents.size();
      SessionDocument document =
          SessionDocument.builder()
              .id("doc-" + (ordinal + 1))
              .ordinal(ordinal)
              .fileName(file.fileName())
              .sizeBytes(file.sizeBytes())
              .uploadedAt(now)
              .build();
      documents.add(document);
      accepted.add(new PendingDocument(document, file.content()));
    }
    totalBytes += uploadBytes;
    progressBeforeAdmission = progress.get();
    progress.set(progressBeforeAdmission.startBuild(files.size()));
    return accepted;
  }

  /**
   * Undoes the last {@link #admit} when its build could not be scheduled: the documents and their
   * bytes are dropped and the progress reverts to what it was before the upload.
   */
  public synchronized void revokeAdmission(List<PendingDocument> accepted) {
    Set<String> ids = new HashSet<>();
    for (PendingDocument pending : accepted) {
      ids.add(pending.document().getId());
      totalBytes -= pending.document().getSizeBytes();
    }
    documents.removeIf(d -> ids.contains(d.getId()));
    if (progressBeforeAdmission != null) {
      progress.set(progressBeforeAdmission);
      progressBeforeAdmission = null;
    }
  }

  /** Adds one embedded chunk to both indexes, unless the session has been torn down. */
  public void commit(DocumentChunk chunk) {
    commitLock.writeLock().lock();
    try {
      cancellationToken.throwIfCancelled();
      vectorIndex.add(chunk);
      keywordIndex.add(chunk);
    } finally {
      commitLock.writeLock().unlock();
    }
  }

  /** Runs {@code search} while no chunk commit can interleave. */
  public <T> T withReadLock(Supplier<T> search) {
    commitLock.readLock().lock();
    try {
      return search.get();
    } finally {
      commitLock.readLock().unlock();
    }
  }

  public synchronized void replaceDocument(SessionDocument updated) {
    for (int i = 0; i < documents.size(); i++) {
      if (documents.get(i).getId().equals(updated.getId())) {
        documents.set(i, updated);
        return;
      }
    }
  }

  public IndexingProgress documentIndexed() {
    return progress.updateAndGet(IndexingProgress::documentIndexed);
  }

  /** Moves an in-flight build to ERROR. A finished build is left untouched. */
  public IndexingProgress failBuild(String detail) {
    return progress.updateAndGet(p -> p.isIndexing() ? p.failed(detail) : p);
  }

  /**
   * Marks the session closed, cancels any running build and drops all indexed data. Commits that
   * race with this call either land before the indexes are cleared or are refused.
   */
  public void close() {
    synchronized (this) {
      closed = true;
    }
    releaseIndexes();
  }

  /**
   * Closes the session only if it is idle and not indexing, checked under the same monitor that
   * guards {@link #admit}, so an upload admitted concurrently either wins or sees a closed session.
   *
   * @return true if this call closed the session
   */
  public boolean closeIfIdle(Instant now, Duration ttl) {
    synchronized (this) {
      if (closed || progress.get().isIndexing() || !isIdleSince(now, ttl)) {
        return false;
      }
      closed = true;
    }
    releaseIndexes();
    return true;
  }

  private void releaseIndexes() {
    cancellationToken.cancel();
    commitLock.writeLock().lock();
    try {
      vectorIndex.clear();
      keywordIndex.clear();
    } finally {
      commitLock.writeLock().unlock();
    }
  }

  public boolean hasCommittedChunks() {
    return withReadLock(() -> vectorIndex.size() > 0);
  }

  public void touch() {
    lastAccessedAt = Instant.now();
  }

  public boolean isIdleSince(Instant now, Duration ttl) {
    return !lastAccessedAt.plus(ttl).isAfter(now);
  }

  public String getId() {
    return id;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getLastAccessedAt() {
    return lastAccessedAt;
  }

  public IndexingProgress getProgress() {
    return progress.get();
  }

  public synchronized List<SessionDocument> getDocuments() {
    return List.copyOf(documents);
  }

  public synchronized int getTotalFiles() {
    return documents.size();
  }

  public synchronized long getTotalBytes() {
    return totalBytes;
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  public VectorIndex getVectorIndex() {
    return vectorIndex;
  }

  public KeywordIndex getKeywordIndex() {
    return keywordIndex;
  }

  public ReentrantLock getBuildLock() {
    return buildLock;
  }

  public CancellationToken getCancellationToken() {
    return cancellationToken;
  }

  public IndexingJob getCurrentJob() {
    return currentJob;
  }

  void setCurrentJob(IndexingJob currentJob) {
    this.currentJob = currentJob;
  }
}
