package com.social100.cipherrelay.registry;

import com.social100.cipherrelay.identity.Identity;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import lombok.Getter;

/**
 * Server-side state of one live connection.
 *
 * <p>Relationship state is not kept here; it lives in the friend store and refers to sessions by
 * {@link Identity} only. State transitions are driven exclusively by the protocol dispatcher.</p>
 */
public class Session {

  public enum State {
    CONNECTING,
    REGISTERED,
    ACTIVE,
    CLOSED
  }

  @Getter
  private final PeerChannel channel;

  private final long openedAtMillis;

  private final AtomicReference<State> state = new AtomicReference<>(State.CONNECTING);

  private volatile Identity identity;

  // opaque, never inspected
  private volatile String publicKeyBlob;

  private volatile long lastSeenMillis;

  public Session(PeerChannel channel, long openedAtMillis) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.openedAtMillis = openedAtMillis;
    this.lastSeenMillis = openedAtMillis;
  }

  public Identity getIdentity() {
    return identity;
  }

  public State getState() {
    return state.get();
  }

  /**
   * Binds the allocated identity and moves {@code CONNECTING -> REGISTERED}.
   *
   * @return false if the session was closed in the meantime
   */
  public boolean register(Identity assigned) {
    Objects.requireNonNull(assigned, "assigned");
    if (identity != null) {
      throw new IllegalStateException("Session already registered as " + identity);
    }
    identity = assigned;
    return state.compareAndSet(State.CONNECTING, State.REGISTERED);
  }

  /** {@code REGISTERED -> ACTIVE}, once the identity has been delivered to the client. */
  public boolean activate() {
    return state.compareAndSet(State.REGISTERED, State.ACTIVE);
  }

  /**
   * Moves to {@code CLOSED} from any state.
   *
   * @return true only for the call that performed the transition
   */
  public boolean markClosed() {
    return state.getAndSet(State.CLOSED) != State.CLOSED;
  }

  public boolean isActive() {
    return state.get() == State.ACTIVE;
  }

  public String getPublicKeyBlob() {
    return publicKeyBlob;
  }

  public void setPublicKeyBlob(String publicKeyBlob) {
    this.publicKeyBlob = publicKeyBlob;
  }

  public long getLastSeenMillis() {
    return lastSeenMillis;
  }

  public void touch(long nowMillis) {
    this.lastSeenMillis = nowMillis;
  }

  /** Time since the connection was accepted. */
  public long ageMillis(long nowMillis) {
    return nowMillis - openedAtMillis;
  }

  @Override
  public String toString() {
    return "Session[" + (identity != null ? identity : "unassigned") + ", " + state.get()
        + ", remote=" + channel.remoteAddress() + "]";
  }
}
