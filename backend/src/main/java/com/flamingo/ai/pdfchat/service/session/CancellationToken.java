package com.flamingo.ai.pdfchat.service.session;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/** One-way cancellation flag shared between a session and its indexing builds. */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new CancellationException("Indexing cancelled");
    }
  }
}
