package com.social100.cipherrelay.routing;

import com.social100.cipherrelay.audit.AuditEvent;
import com.social100.cipherrelay.audit.AuditSink;
import com.social100.cipherrelay.error.AuthorizationException;
import com.social100.cipherrelay.error.ChannelClosedException;
import com.social100.cipherrelay.error.NotFoundException;
import com.social100.cipherrelay.friend.FriendRelationshipStore;
import com.social100.cipherrelay.identity.Identity;
import com.social100.cipherrelay.protocol.FrameCodec;
import com.social100.cipherrelay.protocol.OutboundFrame;
import com.social100.cipherrelay.registry.ConnectionRegistry;
import com.social100.cipherrelay.registry.PeerChannel;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards opaque payloads between friends. Transit only: a payload for an offline recipient is
 * dropped, never queued.
 */
public class MessageRouter {

  private static final Logger LOGGER = LoggerFactory.getLogger(MessageRouter.class);

  private final FriendRelationshipStore friends;
  private final ConnectionRegistry registry;
  private final FrameCodec codec;
  private final AuditSink audit;
  private final Clock clock;

  public MessageRouter(FriendRelationshipStore friends, ConnectionRegistry registry, FrameCodec codec,
                       AuditSink audit, Clock clock) {
    this.friends = friends;
    this.registry = registry;
    this.codec = codec;
    this.audit = audit;
    this.clock = clock;
  }

  /**
   * Delivers {@code ciphertext} to {@code to} exactly once.
   *
   * <p>Deliveries from one sender are pushed to the recipient's channel in call order.</p>
   *
   * @throws AuthorizationException with {@code NotFriends} if there is no accepted relationship
   * @throws NotFoundException with {@code RecipientOffline} if {@code to} is not live
   */
  public Envelope route(Identity from, Identity to, String ciphertext) {
    if (!friends.areFriends(from, to)) {
      throw AuthorizationException.notFriends(to);
    }
    PeerChannel channel = registry.lookup(to)
        .orElseThrow(() -> NotFoundException.recipientOffline(to));

    Envelope envelope = new Envelope(from, to, ciphertext, clock.millis());
    try {
      channel.send(codec.encode(
          new OutboundFrame.MessageIncoming(from.value(), ciphertext, envelope.timestamp())));
    } catch (ChannelClosedException e) {
      LOGGER.debug("Dropped {}: recipient channel already closed", envelope);
      throw NotFoundException.recipientOffline(to);
    }
    LOGGER.debug("Relayed {}", envelope);
    audit.record(AuditEvent.messageRelayed(from, to, envelope.timestamp()));
    return envelope;
  }
}
