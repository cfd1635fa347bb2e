package com.social100.cipherrelay;

import com.social100.cipherrelay.error.ChannelClosedException;
import com.social100.cipherrelay.registry.PeerChannel;
import java.net.InetSocketAddress;
import org.java_websocket.WebSocket;
import org.java_websocket.exceptions.WebsocketNotConnectedException;

/**
 * {@link PeerChannel} over a Java-WebSocket connection. {@link WebSocket#send(String)} only
 * enqueues, so sending never blocks on the peer.
 */
class WebSocketPeerChannel implements PeerChannel {

  private final WebSocket conn;

  WebSocketPeerChannel(WebSocket conn) {
    this.conn = conn;
  }

  @Override
  public void send(String frame) {
    try {
      conn.send(frame);
    } catch (WebsocketNotConnectedException e) {
      throw new ChannelClosedException("WebSocket is not open", e);
    }
  }

  @Override
  public void close(int code, String reason) {
    conn.close(code, reason);
  }

  @Override
  public String remoteAddress() {
    InetSocketAddress remote = conn.getRemoteSocketAddress();
    return remote != null ? remote.toString() : "unknown";
  }
}
