package com.social100.cipherrelay.error;

import java.util.Objects;

/**
 * Base class of every failure the relay knows how to report. The message is sent to the client
 * verbatim, so it must never contain ciphertext or key material.
 */
public class RelayException extends RuntimeException {

  private final ErrorCode code;

  public RelayException(ErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
  }

  public RelayException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
  }

  public ErrorCode getCode() {
    return code;
  }

  public ErrorCategory getCategory() {
    return code.category();
  }
}
