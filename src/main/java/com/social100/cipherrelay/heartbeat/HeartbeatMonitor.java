package com.social100.cipherrelay.heartbeat;

import com.social100.cipherrelay.error.ChannelClosedException;
import com.social100.cipherrelay.protocol.FrameCodec;
import com.social100.cipherrelay.protocol.OutboundFrame;
import com.social100.cipherrelay.registry.ConnectionRegistry;
import com.social100.cipherrelay.registry.Session;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically probes every active session with a {@code ping} frame and expires sessions that
 * have not sent anything for longer than the timeout.
 *
 * <p>Any inbound frame counts as a sign of life, not just {@code pong}. Expired sessions are handed
 * to the {@link ExpiryHandler}, which tears them down through the normal close path.</p>
 */
public class HeartbeatMonitor {

  private static final Logger LOGGER = LoggerFactory.getLogger(HeartbeatMonitor.class);

  @FunctionalInterface
  public interface ExpiryHandler {
    void onExpired(Session session);
  }

  private final ConnectionRegistry registry;
  private final ExpiryHandler expiryHandler;
  private final Clock clock;
  private final Duration interval;
  private final Duration timeout;
  private final String pingFrame;
  private final ScheduledExecutorService scheduler;

  public HeartbeatMonitor(ConnectionRegistry registry, FrameCodec codec, ExpiryHandler expiryHandler,
                          Clock clock, Duration interval, Duration timeout) {
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    if (timeout.compareTo(interval) <= 0) {
      throw new IllegalArgumentException("timeout must be longer than the probe interval");
    }
    this.registry = registry;
    this.expiryHandler = expiryHandler;
    this.clock = clock;
    this.interval = interval;
    this.timeout = timeout;
    this.pingFrame = codec.encode(new OutboundFrame.Ping());
    this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "HeartbeatMonitor");
      t.setDaemon(true);
      return t;
    });
  }

  public void start() {
    long periodMillis = interval.toMillis();
    scheduler.scheduleAtFixedRate(this::sweepSafely, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    LOGGER.info("Heartbeat every {} ms, timeout {} ms", periodMillis, timeout.toMillis());
  }

  /**
   * One probe round over a snapshot of the registry.
   *
   * @return the sessions expired by this round
   */
  public List<Session> sweep() {
    long now = clock.millis();
    long timeoutMillis = timeout.toMillis();
    List<Session> expired = new ArrayList<>();
    int probed = 0;

    for (Session session : registry.snapshot()) {
      if (!session.isActive()) {
        continue;
      }
      long idle = now - session.getLastSeenMillis();
      if (idle > timeoutMillis) {
        LOGGER.info("Session {} silent for {} ms, expiring", session.getIdentity(), idle);
        expired.add(session);
        continue;
      }
      try {
        session.getChannel().send(pingFrame);
        probed++;
      } catch (ChannelClosedException e) {
        LOGGER.debug("Probe to {} failed, channel closed", session.getIdentity());
        expired.add(session);
      }
    }

    for (Session session : expired) {
      expiryHandler.onExpired(session);
    }
    LOGGER.debug("Heartbeat sweep: probed={}, expired={}, live={}", probed, expired.size(), registry.size());
    return expired;
  }

  public void shutdown() {
    scheduler.shutdownNow();
  }

  // an exception escaping a periodic task would cancel every later run
  private void sweepSafely() {
    try {
      sweep();
    } catch (RuntimeException e) {
      LOGGER.error("Heartbeat sweep failed", e);
    }
  }
}
