package com.social100.cipherrelay.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.social100.cipherrelay.identity.Identity;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class AsyncAuditSinkTest {

  private static final Identity A = Identity.of("AB12CD");
  private static final Identity B = Identity.of("XY99ZZ");

  @Test
  void record_returnsWhileBackendIsStalled() throws Exception {
    StalledSink backend = new StalledSink();
    AsyncAuditSink sink = new AsyncAuditSink(backend, 16);

    long before = System.nanoTime();
    sink.record(AuditEvent.sessionOpened(A, 1L));
    sink.record(AuditEvent.sessionOpened(B, 2L));
    sink.record(AuditEvent.messageRelayed(A, B, 3L));
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - before);

    assertThat(backend.started.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(elapsedMillis).isLessThan(1000);
    assertThat(backend.recorded).isEmpty();

    backend.release.countDown();
    sink.close();

    assertThat(backend.recorded).extracting(AuditEvent::timestampMillis).containsExactly(1L, 2L, 3L);
    assertThat(backend.closed).isTrue();
  }

  @Test
  void record_backlogFull_dropsNewEventsWithoutThrowing() throws Exception {
    StalledSink backend = new StalledSink();
    AsyncAuditSink sink = new AsyncAuditSink(backend, 1);

    sink.record(AuditEvent.sessionOpened(A, 1L));
    assertThat(backend.started.await(5, TimeUnit.SECONDS)).isTrue();
    sink.record(AuditEvent.sessionOpened(B, 2L));
    assertThatCode(() -> sink.record(AuditEvent.sessionClosed(A, 3L))).doesNotThrowAnyException();

    backend.release.countDown();
    sink.close();

    assertThat(backend.recorded).extracting(AuditEvent::timestampMillis).containsExactly(1L, 2L);
  }

  @Test
  void record_afterClose_isDropped() {
    StalledSink backend = new StalledSink();
    backend.release.countDown();
    AsyncAuditSink sink = new AsyncAuditSink(backend, 4);
    sink.close();

    assertThatCode(() -> sink.record(AuditEvent.sessionOpened(A, 1L))).doesNotThrowAnyException();
    assertThat(backend.recorded).isEmpty();
  }

  @Test
  void record_failingBackend_keepsPublishingLaterEvents() {
    List<AuditEvent> recorded = new CopyOnWriteArrayList<>();
    AuditSink flaky = event -> {
      if (event.timestampMillis() == 1L) {
        throw new IllegalStateException("backend hiccup");
      }
      recorded.add(event);
    };
    AsyncAuditSink sink = new AsyncAuditSink(flaky, 4);

    sink.record(AuditEvent.sessionOpened(A, 1L));
    sink.record(AuditEvent.sessionOpened(B, 2L));
    sink.close();

    assertThat(recorded).extracting(AuditEvent::timestampMillis).containsExactly(2L);
  }

  private static final class StalledSink implements AuditSink {

    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final List<AuditEvent> recorded = new CopyOnWriteArrayList<>();
    volatile boolean closed;

    @Override
    public void record(AuditEvent event) {
      started.countDown();
      try {
        release.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      recorded.add(event);
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
