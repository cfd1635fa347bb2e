package com.social100.cipherrelay.protocol;

import com.social100.cipherrelay.error.ChannelClosedException;
import com.social100.cipherrelay.friend.FriendEventListener;
import com.social100.cipherrelay.friend.FriendRequest;
import com.social100.cipherrelay.friend.RequestOutcome;
import com.social100.cipherrelay.identity.Identity;
import com.social100.cipherrelay.registry.ConnectionRegistry;
import com.social100.cipherrelay.registry.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pushes relationship notifications to the other party of a request, if that party is live.
 */
public class FriendNotifier implements FriendEventListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(FriendNotifier.class);

  private final ConnectionRegistry registry;
  private final FrameCodec codec;

  public FriendNotifier(ConnectionRegistry registry, FrameCodec codec) {
    this.registry = registry;
    this.codec = codec;
  }

  @Override
  public void onRequest(Identity from, Identity to, RequestOutcome outcome) {
    notify(to, new OutboundFrame.FriendRequestIncoming(from.value(), publicKeyOf(from)));
  }

  @Override
  public void onResponse(FriendRequest resolved) {
    Identity responder = resolved.toId();
    String key = resolved.isAccepted() ? publicKeyOf(responder) : null;
    notify(resolved.fromId(),
        new OutboundFrame.FriendResponseResult(responder.value(), resolved.isAccepted(), key));
  }

  /** Public key registered by a live session, or null. */
  public String publicKeyOf(Identity identity) {
    return registry.find(identity).map(Session::getPublicKeyBlob).orElse(null);
  }

  private void notify(Identity recipient, OutboundFrame frame) {
    registry.lookup(recipient).ifPresentOrElse(channel -> {
      try {
        channel.send(codec.encode(frame));
      } catch (ChannelClosedException e) {
        // its own close path cleans up
        LOGGER.debug("Could not notify {}: channel closed", recipient);
      }
    }, () -> LOGGER.debug("Not notifying {}: offline", recipient));
  }
}
