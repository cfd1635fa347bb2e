package com.social100.cipherrelay.audit;

import com.social100.cipherrelay.identity.Identity;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routing metadata handed to an {@link AuditSink}. Carries identities and a timestamp only, never
 * ciphertext or key material.
 */
public record AuditEvent(Type type, Identity subject, Identity peer, long timestampMillis) {

  public enum Type {
    SESSION_OPENED,
    SESSION_CLOSED,
    FRIENDSHIP_ACCEPTED,
    MESSAGE_RELAYED
  }

  public static AuditEvent sessionOpened(Identity subject, long timestampMillis) {
    return new AuditEvent(Type.SESSION_OPENED, subject, null, timestampMillis);
  }

  public static AuditEvent sessionClosed(Identity subject, long timestampMillis) {
    return new AuditEvent(Type.SESSION_CLOSED, subject, null, timestampMillis);
  }

  public static AuditEvent friendshipAccepted(Identity requester, Identity responder, long timestampMillis) {
    return new AuditEvent(Type.FRIENDSHIP_ACCEPTED, requester, responder, timestampMillis);
  }

  public static AuditEvent messageRelayed(Identity from, Identity to, long timestampMillis) {
    return new AuditEvent(Type.MESSAGE_RELAYED, from, to, timestampMillis);
  }

  /** Flat field map, in a stable order. */
  public Map<String, String> toFields() {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("event", type.name());
    fields.put("subject", subject.value());
    if (peer != null) {
      fields.put("peer", peer.value());
    }
    fields.put("ts", Long.toString(timestampMillis));
    return fields;
  }
}
