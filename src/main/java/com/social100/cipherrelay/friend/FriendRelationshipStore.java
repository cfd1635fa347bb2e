package com.social100.cipherrelay.friend;

import com.social100.cipherrelay.error.AuthorizationException;
import com.social100.cipherrelay.error.NotFoundException;
import com.social100.cipherrelay.error.ProtocolException;
import com.social100.cipherrelay.identity.Identity;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pending and accepted relationships between identities.
 *
 * <p>Each joined identity owns one {@code Relations} record. Every mutation touching two
 * identities locks exactly those two records, in identity order, so operations on disjoint pairs
 * never contend and no two threads can deadlock.</p>
 *
 * <p>Departure of an identity cancels its pending requests in both directions but keeps accepted
 * friendships in the other party's state. A friendship is dropped once both sides have departed,
 * and a departed identity's record is discarded (and reported as released) once no friendship
 * references it any more.</p>
 */
public class FriendRelationshipStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FriendRelationshipStore.class);

  private final Map<Identity, Relations> relations = new ConcurrentHashMap<>();
  private final FriendEventListener listener;

  public FriendRelationshipStore(FriendEventListener listener) {
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  /**
   * Starts tracking a newly registered identity.
   *
   * @throws IllegalStateException if the identity is still tracked
   */
  public void join(Identity identity) {
    Relations existing = relations.putIfAbsent(identity, new Relations(identity));
    if (existing != null) {
      throw new IllegalStateException("Identity still tracked by the friend store: " + identity);
    }
  }

  /**
   * Records a pending request {@code from -> to} and notifies the listener.
   *
   * <p>A second request for a pair that is already pending changes nothing and is reported as
   * {@link RequestOutcome#RESENT}.</p>
   */
  public RequestOutcome request(Identity from, Identity to) {
    if (from.equals(to)) {
      throw ProtocolException.selfRequest();
    }
    Relations sender = member(from);
    Relations target = relations.get(to);
    if (target == null) {
      throw NotFoundException.unknownTarget(to);
    }
    RequestOutcome outcome = locked(sender, target, () -> {
      if (target.departed) {
        throw NotFoundException.unknownTarget(to);
      }
      if (sender.friends.contains(to)) {
        throw ProtocolException.alreadyFriends(to);
      }
      if (!sender.outgoing.add(to)) {
        return RequestOutcome.RESENT;
      }
      target.incoming.add(from);
      return RequestOutcome.CREATED;
    });
    LOGGER.debug("Friend request {} -> {}: {}", from, to, outcome);
    listener.onRequest(from, to, outcome);
    return outcome;
  }

  /**
   * Resolves the pending request {@code requester -> responder}.
   *
   * <p>Accepting makes the pair friends and also clears a crossed request in the other direction.
   * Declining leaves no state behind.</p>
   *
   * @throws AuthorizationException with {@code NoSuchRequest} if no such request is pending
   */
  public FriendRequest respond(Identity responder, Identity requester, boolean accept) {
    Relations self = member(responder);
    Relations other = relations.get(requester);
    if (other == null || other == self) {
      throw AuthorizationException.noSuchRequest(requester);
    }
    FriendRequest resolved = locked(self, other, () -> {
      if (!self.incoming.remove(requester)) {
        throw AuthorizationException.noSuchRequest(requester);
      }
      other.outgoing.remove(responder);
      if (!accept) {
        return new FriendRequest(requester, responder, FriendRequest.State.DECLINED);
      }
      self.friends.add(requester);
      other.friends.add(responder);
      self.outgoing.remove(requester);
      other.incoming.remove(responder);
      return new FriendRequest(requester, responder, FriendRequest.State.ACCEPTED);
    });
    LOGGER.debug("Friend request {} -> {} {}", requester, responder, resolved.state());
    listener.onResponse(resolved);
    return resolved;
  }

  /** Symmetric: friendships are always inserted and removed on both sides under one lock. */
  public boolean areFriends(Identity a, Identity b) {
    Relations ra = relations.get(a);
    if (ra == null) {
      return false;
    }
    synchronized (ra) {
      return ra.friends.contains(b);
    }
  }

  public boolean isPending(Identity from, Identity to) {
    Relations sender = relations.get(from);
    if (sender == null) {
      return false;
    }
    synchronized (sender) {
      return sender.outgoing.contains(to);
    }
  }

  public Set<Identity> friendsOf(Identity identity) {
    return snapshot(identity, r -> r.friends);
  }

  public Set<Identity> outgoingRequestsOf(Identity identity) {
    return snapshot(identity, r -> r.outgoing);
  }

  public Set<Identity> incomingRequestsOf(Identity identity) {
    return snapshot(identity, r -> r.incoming);
  }

  /** Whether the store still holds a record for the identity (joined, or retained by a friendship). */
  public boolean isTracked(Identity identity) {
    return relations.containsKey(identity);
  }

  /**
   * Handles the disconnection of an identity.
   *
   * @return identities that no relationship references any more; they may be handed out again
   */
  public Set<Identity> depart(Identity identity) {
    Relations self = relations.get(identity);
    if (self == null) {
      return Set.of();
    }
    Set<Identity> peers = new LinkedHashSet<>();
    synchronized (self) {
      if (self.departed) {
        return Set.of();
      }
      self.departed = true;
      peers.addAll(self.outgoing);
      peers.addAll(self.incoming);
      peers.addAll(self.friends);
    }

    Set<Identity> released = new HashSet<>();
    for (Identity peerId : peers) {
      Relations peer = relations.get(peerId);
      if (peer == null) {
        synchronized (self) {
          self.outgoing.remove(peerId);
          self.incoming.remove(peerId);
          self.friends.remove(peerId);
        }
        continue;
      }
      locked(self, peer, () -> {
        if (self.outgoing.remove(peerId)) {
          peer.incoming.remove(identity);
        }
        if (self.incoming.remove(peerId)) {
          peer.outgoing.remove(identity);
        }
        if (peer.departed && self.friends.remove(peerId)) {
          peer.friends.remove(identity);
          if (peer.settled && peer.friends.isEmpty() && discard(peer)) {
            released.add(peerId);
          }
        }
        return null;
      });
    }

    synchronized (self) {
      self.settled = true;
      if (self.friends.isEmpty() && discard(self)) {
        released.add(identity);
      }
    }
    LOGGER.debug("{} departed, released {}", identity, released);
    return released;
  }

  // caller holds the record's lock
  private boolean discard(Relations record) {
    if (record.discarded) {
      return false;
    }
    record.discarded = true;
    relations.remove(record.owner, record);
    return true;
  }

  private Relations member(Identity identity) {
    Relations record = relations.get(identity);
    if (record == null || record.departed) {
      throw new IllegalStateException("Identity is not an active member of the friend store: " + identity);
    }
    return record;
  }

  private Set<Identity> snapshot(Identity identity, Function<Relations, Set<Identity>> field) {
    Relations record = relations.get(identity);
    if (record == null) {
      return Set.of();
    }
    synchronized (record) {
      return Collections.unmodifiableSet(new LinkedHashSet<>(field.apply(record)));
    }
  }

  private static <T> T locked(Relations a, Relations b, Supplier<T> action) {
    Relations first = a.owner.compareTo(b.owner) <= 0 ? a : b;
    Relations second = first == a ? b : a;
    synchronized (first) {
      synchronized (second) {
        return action.get();
      }
    }
  }

  /** Guarded by its own monitor. */
  private static final class Relations {
    final Identity owner;
    final Set<Identity> friends = new HashSet<>();
    final Set<Identity> outgoing = new HashSet<>();
    final Set<Identity> incoming = new HashSet<>();
    volatile boolean departed;
    // departure bookkeeping finished; from here on a peer may discard this record
    boolean settled;
    boolean discarded;

    Relations(Identity owner) {
      this.owner = owner;
    }
  }
}
