package com.social100.cipherrelay.audit;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands events to a wrapped sink on a single daemon thread, so a slow audit backend never holds
 * up a connection. Events keep their submission order. When the backlog is full, new events are
 * dropped and logged.
 */
public class AsyncAuditSink implements AuditSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(AsyncAuditSink.class);
  private static final long DRAIN_TIMEOUT_MS = 2000;

  private final AuditSink delegate;
  private final ThreadPoolExecutor executor;

  public AsyncAuditSink(AuditSink delegate, int backlog) {
    if (backlog <= 0) {
      throw new IllegalArgumentException("backlog must be positive");
    }
    this.delegate = delegate;
    this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(backlog),
        r -> {
          Thread t = new Thread(r, "AuditPublisher");
          t.setDaemon(true);
          return t;
        },
        (task, pool) -> {
          throw new RejectedExecutionException("audit backlog full");
        });
  }

  @Override
  public void record(AuditEvent event) {
    try {
      executor.execute(() -> publish(event));
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Dropped audit event {}: {}", event.type(),
          executor.isShutdown() ? "sink closed" : e.getMessage());
    }
  }

  /** Publishes what is already queued, up to a short deadline, then closes the wrapped sink. */
  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        LOGGER.warn("Audit backlog not drained within {} ms, {} events lost",
            DRAIN_TIMEOUT_MS, executor.shutdownNow().size());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    delegate.close();
  }

  private void publish(AuditEvent event) {
    try {
      delegate.record(event);
    } catch (RuntimeException e) {
      LOGGER.warn("Audit sink failed on {}", event.type(), e);
    }
  }
}
