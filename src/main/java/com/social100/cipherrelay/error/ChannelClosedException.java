package com.social100.cipherrelay.error;

/**
 * Raised when writing to a transport that has already gone away. The peer cannot be told about it,
 * so the only reaction is to tear down that one session.
 */
public class ChannelClosedException extends RelayException {

  public ChannelClosedException(String message, Throwable cause) {
    super(ErrorCode.CHANNEL_CLOSED, message, cause);
  }
}
