package com.social100.cipherrelay.friend;

public enum RequestOutcome {
  /** A new pending request was recorded. */
  CREATED,
  /** The same request was already pending; nothing changed and the target is notified again. */
  RESENT
}
