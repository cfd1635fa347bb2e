package com.social100.cipherrelay.routing;

import com.social100.cipherrelay.identity.Identity;

/**
 * One routed payload. {@link #toString()} leaves the ciphertext out so envelopes are safe to log.
 */
public record Envelope(Identity fromId, Identity toId, String ciphertext, long timestamp) {

  @Override
  public String toString() {
    return "Envelope[" + fromId + " -> " + toId + ", timestamp=" + timestamp + "]";
  }
}
