package com.social100.cipherrelay;

import com.social100.cipherrelay.audit.AsyncAuditSink;
import com.social100.cipherrelay.audit.AuditSink;
import com.social100.cipherrelay.audit.RedisAuditSink;
import com.social100.cipherrelay.config.RelayConfig;
import com.social100.cipherrelay.friend.FriendRelationshipStore;
import com.social100.cipherrelay.heartbeat.HeartbeatMonitor;
import com.social100.cipherrelay.identity.IdentityAllocator;
import com.social100.cipherrelay.protocol.FrameCodec;
import com.social100.cipherrelay.protocol.FriendNotifier;
import com.social100.cipherrelay.protocol.ProtocolDispatcher;
import com.social100.cipherrelay.registry.ConnectionRegistry;
import com.social100.cipherrelay.routing.MessageRouter;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the relay components together and owns their lifecycle.
 */
public class CipherRelay {

  private static final Logger LOGGER = LoggerFactory.getLogger(CipherRelay.class);
  private static final int STOP_TIMEOUT_MS = 2000;
  private static final int AUDIT_BACKLOG = 10_000;

  @Getter
  private final ConnectionRegistry registry;
  @Getter
  private final FriendRelationshipStore friendStore;
  @Getter
  private final IdentityAllocator allocator;
  @Getter
  private final HeartbeatMonitor heartbeatMonitor;
  @Getter
  private final CipherRelayServer server;
  private final AuditSink audit;

  public CipherRelay(RelayConfig config) {
    this(config, createAuditSink(config), Clock.systemUTC());
  }

  public CipherRelay(RelayConfig config, AuditSink audit, Clock clock) {
    config.validate();
    this.audit = audit;

    FrameCodec codec = new FrameCodec(config.getMaxFrameChars());
    this.registry = new ConnectionRegistry();
    this.allocator = new IdentityAllocator(config.getIdentityMaxAttempts());
    FriendNotifier notifier = new FriendNotifier(registry, codec);
    this.friendStore = new FriendRelationshipStore(notifier);
    MessageRouter router = new MessageRouter(friendStore, registry, codec, audit, clock);
    ProtocolDispatcher dispatcher = new ProtocolDispatcher(
        allocator, registry, friendStore, notifier, router, codec, audit, clock);

    this.heartbeatMonitor = new HeartbeatMonitor(registry, codec, dispatcher::expire, clock,
        Duration.ofSeconds(config.getHeartbeatIntervalSeconds()),
        Duration.ofSeconds(config.getHeartbeatTimeoutSeconds()));
    this.server = new CipherRelayServer(
        new InetSocketAddress(config.getBindAddress(), config.getPort()), dispatcher, config.getWebsocketPath());
  }

  /**
   * Binds the server and starts the heartbeat.
   *
   * @throws IllegalStateException if the socket is not bound within {@code timeoutMillis}
   */
  public void start(long timeoutMillis) throws InterruptedException {
    server.start();
    if (!server.awaitStarted(timeoutMillis, TimeUnit.MILLISECONDS)) {
      throw new IllegalStateException("Relay did not start within " + timeoutMillis + " ms");
    }
    heartbeatMonitor.start();
  }

  public int getPort() {
    return server.getPort();
  }

  public void stop() {
    heartbeatMonitor.shutdown();
    try {
      server.stop(STOP_TIMEOUT_MS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while stopping the WebSocket server");
    }
    audit.close();
    LOGGER.info("Cipher relay stopped");
  }

  private static AuditSink createAuditSink(RelayConfig config) {
    if (!config.isAuditEnabled()) {
      return AuditSink.NONE;
    }
    LOGGER.info("Auditing to Redis stream '{}' at {}:{}", config.getAuditStream(),
        config.getRedisHost(), config.getRedisPort());
    return new AsyncAuditSink(new RedisAuditSink(config.getRedisHost(), config.getRedisPort(),
        config.getAuditStream(), config.getAuditStreamMaxLength()), AUDIT_BACKLOG);
  }
}
