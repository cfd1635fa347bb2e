package com.social100.cipherrelay.registry;

import com.social100.cipherrelay.identity.Identity;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live identity -> session (and through it, transport handle) mapping.
 *
 * <p>Every operation is a single atomic map operation, so callers on different connections never
 * contend on anything wider than one key.</p>
 */
public class ConnectionRegistry {

  private final Map<Identity, Session> sessions = new ConcurrentHashMap<>();

  /**
   * @throws IllegalStateException if another session already holds the identity
   */
  public void register(Identity identity, Session session) {
    Session existing = sessions.putIfAbsent(identity, session);
    if (existing != null && existing != session) {
      throw new IllegalStateException("Identity already registered: " + identity);
    }
  }

  /**
   * Removes the mapping only if it still points at {@code session}. Safe to call any number of
   * times, from the close path and the heartbeat path alike.
   *
   * @return true if this call removed the mapping
   */
  public boolean unregister(Identity identity, Session session) {
    return sessions.remove(identity, session);
  }

  /** Unconditional, idempotent removal. */
  public void unregister(Identity identity) {
    sessions.remove(identity);
  }

  public Optional<PeerChannel> lookup(Identity identity) {
    return find(identity).map(Session::getChannel);
  }

  public Optional<Session> find(Identity identity) {
    return Optional.ofNullable(sessions.get(identity));
  }

  public boolean isLive(Identity identity) {
    return sessions.containsKey(identity);
  }

  /** Point-in-time copy, safe to iterate while sessions come and go. */
  public Collection<Session> snapshot() {
    return List.copyOf(sessions.values());
  }

  public int size() {
    return sessions.size();
  }
}
