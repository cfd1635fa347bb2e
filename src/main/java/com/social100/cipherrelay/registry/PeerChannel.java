package com.social100.cipherrelay.registry;

import com.social100.cipherrelay.error.ChannelClosedException;

/**
 * Outbound side of one client connection. Implementations queue frames in call order, so frames
 * pushed by a single thread reach the client in that order.
 */
public interface PeerChannel {

  /**
   * Queues a text frame for the client.
   *
   * @throws ChannelClosedException if the transport is no longer open
   */
  void send(String frame);

  void close(int code, String reason);

  /** Human readable remote endpoint, for logs only. */
  String remoteAddress();
}
