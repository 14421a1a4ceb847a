package com.flamingo.ai.pdfchat.service.session;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.domain.enums.ExtractionOutcome;
import com.flamingo.ai.pdfchat.domain.model.DocumentChunk;
import com.flamingo.ai.pdfchat.domain.model.SessionDocument;
import com.flamingo.ai.pdfchat.exception.DocumentExtractionException;
import com.flamingo.ai.pdfchat.exception.EmbeddingUnavailableException;
import com.flamingo.ai.pdfchat.exception.PageLimitExceededException;
import com.flamingo.ai.pdfchat.exception.ScannedDocumentException;
import com.flamingo.ai.pdfchat.service.rag.chunking.DocumentChunker;
import com.flamingo.ai.pdfchat.service.rag.chunking.DocumentContext;
import com.flamingo.ai.pdfchat.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.pdfchat.service.rag.extraction.ExtractedDocument;
import com.flamingo.ai.pdfchat.service.rag.extraction.TextExtractor;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs an indexing build: extract, chunk, embed and commit each accepted document in turn.
 *
 * <p>A document that cannot be extracted is recorded as failed and the build moves on. An
 * unavailable embedding service stops the build. Nothing thrown by a document escapes; every ending
 * is reported as an {@link IndexingOutcome}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIndexingService {

  private final TextExtractor textExtractor;
  private final DocumentChunker documentChunker;
  private final EmbeddingService embeddingService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "document.indexing.build", description = "Time to index one upload")
  public IndexingOutcome build(IndexingSession session, List<PendingDocument> pending) {
    session.getBuildLock().lock();
    try {
      log.info("Session {}: indexing {} documents", session.getId(), pending.size());
      List<String> failures = new ArrayList<>();
      int indexed = 0;

      for (PendingDocument item : pending) {
        SessionDocument document = item.document();
        if (session.getCancellationToken().isCancelled()) {
          return cancelled(session, indexed);
        }
        try {
          indexDocument(session, document, item.content());
          indexed++;
          meterRegistry.counter("document.indexing.success").increment();
        } catch (DocumentExtractionException e) {
          ExtractionOutcome outcome =
              e instanceof ScannedDocumentException
                  ? ExtractionOutcome.SCANNED
                  : ExtractionOutcome.FAILED;
          int pageCount = pageCountOf(e);
          session.replaceDocument(document.failed(outcome, pageCount, e.getUserMessage()));
          failures.add(document.getFileName() + " (" + e.getUserMessage() + ")");
          meterRegistry.counter("document.indexing.failure", "reason", outcome.name()).increment();
          log.warn(
              "Session {}: skipping {} [{}]: {}",
              session.getId(),
              document.getFileName(),
              document.getId(),
              e.getMessage());
        } catch (EmbeddingUnavailableException e) {
          session.replaceDocument(
              document.failed(ExtractionOutcome.FAILED, 0, "Embedding service unavailable"));
          meterRegistry.counter("document.indexing.failure", "reason", "EMBEDDING").increment();
          log.error(
              "Session {}: embedding unavailable while indexing {} [{}], aborting build",
              session.getId(),
              document.getFileName(),
              document.getId(),
              e);
          return IndexingOutcome.aborted(
              indexed,
              "Embedding service unavailable while indexing " + document.getFileName());
        } catch (CancellationException e) {
          return cancelled(session, indexed);
        } catch (RuntimeException e) {
          session.replaceDocument(
              document.failed(ExtractionOutcome.FAILED, 0, "Unexpected indexing error"));
          meterRegistry.counter("document.indexing.failure", "reason", "INTERNAL").increment();
          log.error(
              "Session {}: unexpected failure indexing {} [{}], aborting build",
              session.getId(),
              document.getFileName(),
              document.getId(),
              e);
          return IndexingOutcome.aborted(
              indexed, "Unexpected error while indexing " + document.getFileName());
        }
      }

      if (!failures.isEmpty()) {
        return IndexingOutcome.partial(indexed, pending.size(), failures);
      }
      log.info("Session {}: indexed {} documents", session.getId(), indexed);
      return IndexingOutcome.completed(indexed);
    } finally {
      session.getBuildLock().unlock();
    }
  }

  private void indexDocument(IndexingSession session, SessionDocument document, byte[] content) {
    ExtractedDocument extracted = textExtractor.extract(document.getFileName(), content);
    List<DocumentChunk> chunks =
        documentChunker.chunk(
            new DocumentContext(document.getId(), document.getOrdinal(), document.getFileName()),
            extracted,
            ragConfig);
    log.debug(
        "Session {}: {} [{}] -> {} pages, {} chunks",
        session.getId(),
        document.getFileName(),
        document.getId(),
        extracted.pageCount(),
        chunks.size());

    List<float[]> vectors =
        embeddingService.embedPassages(chunks.stream().map(DocumentChunk::getText).toList());
    for (int i = 0; i < chunks.size(); i++) {
      session.commit(chunks.get(i).withEmbedding(vectors.get(i)));
    }

    session.replaceDocument(
        document.extracted(extracted.pageCount(), extracted.scannedPageNumbers(), chunks.size()));
    session.documentIndexed();
  }

  private static int pageCountOf(DocumentExtractionException e) {
    if (e instanceof ScannedDocumentException scanned) {
      return scanned.getPageCount();
    }
    if (e instanceof PageLimitExceededException tooLong) {
      return tooLong.getPageCount();
    }
    return 0;
  }

  private IndexingOutcome cancelled(IndexingSession session, int indexed) {
    log.info("Session {}: build cancelled after {} documents", session.getId(), indexed);
    return IndexingOutcome.cancelled(indexed);
  }
}
