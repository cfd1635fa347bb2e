package com.social100.cipherrelay.protocol;

import com.social100.cipherrelay.audit.AuditEvent;
import com.social100.cipherrelay.audit.AuditSink;
import com.social100.cipherrelay.error.ChannelClosedException;
import com.social100.cipherrelay.error.ErrorCategory;
import com.social100.cipherrelay.error.ErrorCode;
import com.social100.cipherrelay.error.RelayException;
import com.social100.cipherrelay.error.ResourceException;
import com.social100.cipherrelay.friend.FriendRelationshipStore;
import com.social100.cipherrelay.friend.FriendRequest;
import com.social100.cipherrelay.identity.Identity;
import com.social100.cipherrelay.identity.IdentityAllocator;
import com.social100.cipherrelay.registry.ConnectionRegistry;
import com.social100.cipherrelay.registry.PeerChannel;
import com.social100.cipherrelay.registry.Session;
import com.social100.cipherrelay.routing.Envelope;
import com.social100.cipherrelay.routing.MessageRouter;
import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-connection protocol state machine: {@code CONNECTING -> REGISTERED -> ACTIVE -> CLOSED}.
 *
 * <p>Every entry point synchronizes on the {@link Session}, so frames of one connection are
 * handled one at a time and in order, and a close racing a frame either happens before it (the
 * frame is ignored) or after it. Different connections never share a lock here.</p>
 *
 * <p>Each frame maps to one operation on the registries. Failures are answered with an
 * {@code error} frame and leave the session up; only a dead transport closes it.</p>
 */
public class ProtocolDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProtocolDispatcher.class);

  public static final int CLOSE_GOING_AWAY = 1001;
  public static final int CLOSE_TRY_AGAIN_LATER = 1013;

  private final IdentityAllocator allocator;
  private final ConnectionRegistry registry;
  private final FriendRelationshipStore friends;
  private final FriendNotifier notifier;
  private final MessageRouter router;
  private final FrameCodec codec;
  private final AuditSink audit;
  private final Clock clock;

  public ProtocolDispatcher(IdentityAllocator allocator, ConnectionRegistry registry,
                            FriendRelationshipStore friends, FriendNotifier notifier,
                            MessageRouter router, FrameCodec codec, AuditSink audit, Clock clock) {
    this.allocator = allocator;
    this.registry = registry;
    this.friends = friends;
    this.notifier = notifier;
    this.router = router;
    this.codec = codec;
    this.audit = audit;
    this.clock = clock;
  }

  public Session newSession(PeerChannel channel) {
    return new Session(channel, clock.millis());
  }

  /**
   * Assigns an identity, registers the session and tells the client its identity. This is the only
   * frame the relay sends unprompted.
   *
   * @return false if the session could not be opened; the channel has then been closed
   */
  public boolean open(Session session) {
    synchronized (session) {
      if (session.getState() != Session.State.CONNECTING) {
        return false;
      }

      Identity identity;
      try {
        identity = allocator.allocate();
      } catch (ResourceException e) {
        LOGGER.warn("Refusing connection from {}: {}", session.getChannel().remoteAddress(), e.getMessage());
        session.markClosed();
        try {
          reply(session, errorFrame(e));
        } catch (ChannelClosedException closed) {
          LOGGER.debug("Client {} left before the refusal was sent", session.getChannel().remoteAddress());
        }
        session.getChannel().close(CLOSE_TRY_AGAIN_LATER, "No identity available");
        return false;
      }

      registry.register(identity, session);
      friends.join(identity);
      session.register(identity);

      try {
        reply(session, new OutboundFrame.IdentityAssigned(identity.value()));
      } catch (ChannelClosedException e) {
        close(session, "closed before identity delivery");
        return false;
      }
      session.activate();
      audit.record(AuditEvent.sessionOpened(identity, clock.millis()));
      LOGGER.info("Session {} opened for {}", identity, session.getChannel().remoteAddress());
      return true;
    }
  }

  /**
   * Handles one inbound text frame.
   */
  public void handle(Session session, String raw) {
    synchronized (session) {
      if (!session.isActive()) {
        LOGGER.debug("Ignoring frame on {}", session);
        return;
      }
      session.touch(clock.millis());
      try {
        InboundFrame frame = codec.decode(raw);
        LOGGER.debug("{} <- {}", session.getIdentity(), frame);
        frame.accept(new FrameHandler(session));
      } catch (ChannelClosedException e) {
        close(session, "channel closed");
      } catch (RelayException e) {
        reject(session, e);
      } catch (RuntimeException e) {
        LOGGER.error("Unexpected failure handling a frame from {}", session.getIdentity(), e);
        reject(session, new RelayException(ErrorCode.INTERNAL_ERROR, "Internal error"));
      }
    }
  }

  /** Binary frames carry nothing this protocol understands. */
  public void rejectBinary(Session session) {
    synchronized (session) {
      if (session.isActive()) {
        session.touch(clock.millis());
        reject(session, new RelayException(ErrorCode.MALFORMED_FRAME, "Binary frames are not supported"));
      }
    }
  }

  /**
   * Heartbeat path: closes the transport and runs the same cleanup as a regular close.
   */
  public void expire(Session session) {
    close(session, "heartbeat timeout");
    session.getChannel().close(CLOSE_GOING_AWAY, "Heartbeat timeout");
  }

  /**
   * Tears the session down: unregisters it, cancels its pending requests and releases whatever
   * identities are no longer referenced. Idempotent.
   */
  public void close(Session session, String reason) {
    synchronized (session) {
      if (!session.markClosed()) {
        return;
      }
      Identity identity = session.getIdentity();
      if (identity == null) {
        return;
      }
      registry.unregister(identity, session);
      Set<Identity> released = friends.depart(identity);
      released.forEach(allocator::release);
      long now = clock.millis();
      audit.record(AuditEvent.sessionClosed(identity, now));
      LOGGER.info("Session {} closed after {} ms ({})", identity, session.ageMillis(now), reason);
    }
  }

  private void reject(Session session, RelayException e) {
    if (e.getCategory() == ErrorCategory.PROTOCOL) {
      LOGGER.warn("Rejected frame from {}: {} {}", session.getIdentity(), e.getCode().wireName(), e.getMessage());
    } else {
      LOGGER.debug("Refused request from {}: {} {}", session.getIdentity(), e.getCode().wireName(), e.getMessage());
    }
    try {
      reply(session, errorFrame(e));
    } catch (ChannelClosedException closed) {
      close(session, "channel closed");
    }
  }

  private void reply(Session session, OutboundFrame frame) {
    session.getChannel().send(codec.encode(frame));
  }

  private static OutboundFrame errorFrame(RelayException e) {
    return new OutboundFrame.ErrorReply(e.getCode().wireName(), e.getMessage());
  }

  private final class FrameHandler implements InboundFrame.Visitor<Void> {

    private final Session session;
    private final Identity self;

    FrameHandler(Session session) {
      this.session = session;
      this.self = session.getIdentity();
    }

    @Override
    public Void visitRegisterKey(InboundFrame.RegisterKey frame) {
      session.setPublicKeyBlob(frame.publicKeyBlob());
      reply(session, new OutboundFrame.KeyRegistered());
      return null;
    }

    @Override
    public Void visitFriendRequest(InboundFrame.FriendRequest frame) {
      friends.request(self, frame.toId());
      reply(session, new OutboundFrame.FriendRequestSent(frame.toId().value()));
      return null;
    }

    @Override
    public Void visitFriendResponse(InboundFrame.FriendResponse frame) {
      FriendRequest resolved = friends.respond(self, frame.fromId(), frame.accept());
      if (resolved.isAccepted()) {
        Identity requester = resolved.fromId();
        reply(session, new OutboundFrame.FriendAdded(requester.value(), notifier.publicKeyOf(requester)));
        audit.record(AuditEvent.friendshipAccepted(requester, self, clock.millis()));
      }
      return null;
    }

    @Override
    public Void visitListFriends(InboundFrame.ListFriends frame) {
      List<OutboundFrame.FriendEntry> entries = friends.friendsOf(self).stream()
          .sorted()
          .map(friend -> new OutboundFrame.FriendEntry(friend.value(), notifier.publicKeyOf(friend)))
          .collect(Collectors.toList());
      reply(session, new OutboundFrame.FriendsList(entries));
      return null;
    }

    @Override
    public Void visitMessage(InboundFrame.Message frame) {
      Envelope envelope = router.route(self, frame.toId(), frame.ciphertext());
      reply(session, new OutboundFrame.MessageSent(envelope.toId().value(), envelope.timestamp()));
      return null;
    }

    @Override
    public Void visitPing(InboundFrame.Ping frame) {
      reply(session, new OutboundFrame.Pong());
      return null;
    }

    @Override
    public Void visitPong(InboundFrame.Pong frame) {
      return null;
    }
  }
}
