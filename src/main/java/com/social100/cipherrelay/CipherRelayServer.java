package com.social100.cipherrelay;

import com.social100.cipherrelay.protocol.ProtocolDispatcher;
import com.social100.cipherrelay.registry.Session;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.java_websocket.WebSocket;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WebSocket endpoint. Turns transport callbacks into dispatcher calls; each connection carries its
 * {@link Session} as the socket attachment.
 */
public class CipherRelayServer extends WebSocketServer {

  private static final Logger LOGGER = LoggerFactory.getLogger(CipherRelayServer.class);

  private final ProtocolDispatcher dispatcher;
  private final String websocketPath;
  private final CountDownLatch started = new CountDownLatch(1);
  private volatile Exception startupFailure;

  public CipherRelayServer(InetSocketAddress address, ProtocolDispatcher dispatcher, String websocketPath) {
    super(address);
    this.dispatcher = dispatcher;
    this.websocketPath = websocketPath == null ? "" : websocketPath;
    setReuseAddr(true);
    // liveness is owned by HeartbeatMonitor
    setConnectionLostTimeout(0);
  }

  @Override
  public void onOpen(WebSocket conn, ClientHandshake handshake) {
    String resourceDescriptor = handshake.getResourceDescriptor();
    if (!websocketPath.isEmpty() && !websocketPath.equals(resourceDescriptor)) {
      LOGGER.info("Rejected client {} with invalid path: {}", conn.getRemoteSocketAddress(), resourceDescriptor);
      conn.close(CloseFrame.PROTOCOL_ERROR, "Invalid path");
      return;
    }

    Session session = dispatcher.newSession(new WebSocketPeerChannel(conn));
    conn.setAttachment(session);
    dispatcher.open(session);
  }

  @Override
  public void onClose(WebSocket conn, int code, String reason, boolean remote) {
    Session session = conn.getAttachment();
    if (session != null) {
      dispatcher.close(session, "transport closed, code " + code + (remote ? " by peer" : " by relay"));
    }
  }

  @Override
  public void onMessage(WebSocket conn, String raw) {
    Session session = conn.getAttachment();
    if (session != null) {
      dispatcher.handle(session, raw);
    }
  }

  @Override
  public void onMessage(WebSocket conn, ByteBuffer message) {
    Session session = conn.getAttachment();
    if (session != null) {
      dispatcher.rejectBinary(session);
    }
  }

  @Override
  public void onError(WebSocket conn, Exception ex) {
    if (conn == null) {
      LOGGER.error("WebSocket server error", ex);
      if (started.getCount() > 0) {
        startupFailure = ex;
        started.countDown();
      }
      return;
    }
    LOGGER.warn("WebSocket error on {}: {}", conn.getRemoteSocketAddress(), ex.getMessage());
  }

  @Override
  public void onStart() {
    LOGGER.info("Cipher relay listening on {}", getAddress());
    started.countDown();
  }

  /**
   * Waits until the listening socket is bound.
   *
   * @return false on timeout
   * @throws IllegalStateException if the server failed before it started listening
   */
  public boolean awaitStarted(long timeout, TimeUnit unit) throws InterruptedException {
    if (!started.await(timeout, unit)) {
      return false;
    }
    if (startupFailure != null) {
      throw new IllegalStateException("Relay failed to start on " + getAddress(), startupFailure);
    }
    return true;
  }
}
