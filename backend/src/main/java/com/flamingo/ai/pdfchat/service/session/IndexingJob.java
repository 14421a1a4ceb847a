package com.flamingo.ai.pdfchat.service.session;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/** A background indexing build for one session upload. */
public final class IndexingJob {

  private final String sessionId;
  private final CancellationToken token;
  private final CompletableFuture<IndexingOutcome> future;

  private IndexingJob(
      String sessionId, CancellationToken token, CompletableFuture<IndexingOutcome> future) {
    this.sessionId = sessionId;
    this.token = token;
    this.future = future;
  }

  /**
   * Schedules a build on the given executor. The returned job's future completes only after
   * {@code onComplete} has run.
   *
   * @throws java.util.concurrent.RejectedExecutionException if the executor is saturated
   */
  public static IndexingJob submit(
      String sessionId,
      CancellationToken token,
      Supplier<IndexingOutcome> build,
      Executor executor,
      BiConsumer<IndexingOutcome, Throwable> onComplete) {
    return new IndexingJob(
        sessionId, token, CompletableFuture.supplyAsync(build, executor).whenComplete(onComplete));
  }

  public String getSessionId() {
    return sessionId;
  }

  public CompletableFuture<IndexingOutcome> getFuture() {
    return future;
  }

  public boolean isDone() {
    return future.isDone();
  }

  /** Requests cancellation. The build stops before its next commit. */
  public void cancel() {
    token.cancel();
  }
}
