package com.social100.cipherrelay.identity;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Ephemeral identifier of a live session, e.g. {@code AB12CD}. Only unique among sessions that are
 * live at the same time; a reconnecting client gets a new one.
 */
public record Identity(String value) implements Comparable<Identity> {

  public static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
  public static final int LENGTH = 6;

  public Identity {
    Objects.requireNonNull(value, "value");
  }

  /**
   * Parses an identity typed by a user: surrounding whitespace is dropped and letters are
   * upper-cased before the format check.
   *
   * @return the identity, or empty if the normalized text is not {@value #LENGTH} characters of
   *     {@link #ALPHABET}
   */
  public static Optional<Identity> parse(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.strip().toUpperCase(Locale.ROOT);
    if (normalized.length() != LENGTH) {
      return Optional.empty();
    }
    for (int i = 0; i < normalized.length(); i++) {
      if (ALPHABET.indexOf(normalized.charAt(i)) < 0) {
        return Optional.empty();
      }
    }
    return Optional.of(new Identity(normalized));
  }

  public static Identity of(String raw) {
    return parse(raw).orElseThrow(() -> new IllegalArgumentException("Not a valid identity: " + raw));
  }

  @Override
  public int compareTo(Identity other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }
}
