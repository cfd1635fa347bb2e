package com.social100.cipherrelay.error;

/**
 * Coarse classification of relay failures. Decides how a failure is surfaced: everything except
 * {@link #TRANSPORT} is reported back to the originating client as an {@code error} frame.
 */
public enum ErrorCategory {
  /** Malformed or unexpected frame. The session stays up. */
  PROTOCOL,
  /** The caller is not allowed to perform the operation in the current relationship state. */
  AUTHORIZATION,
  /** The addressed identity is not live. */
  NOT_FOUND,
  /** A bounded server resource ran out for this attempt. */
  RESOURCE,
  /** The peer's transport is gone. Never reported, only triggers cleanup. */
  TRANSPORT,
  /** Unexpected failure inside the relay. */
  INTERNAL
}
