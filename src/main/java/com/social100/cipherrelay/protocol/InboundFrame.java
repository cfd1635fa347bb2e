package com.social100.cipherrelay.protocol;

import com.social100.cipherrelay.identity.Identity;

/**
 * Client-to-server frames. The set is closed: adding a variant forces every {@link Visitor} to
 * handle it.
 */
public sealed interface InboundFrame {

  <R> R accept(Visitor<R> visitor);

  interface Visitor<R> {
    R visitRegisterKey(RegisterKey frame);

    R visitFriendRequest(FriendRequest frame);

    R visitFriendResponse(FriendResponse frame);

    R visitListFriends(ListFriends frame);

    R visitMessage(Message frame);

    R visitPing(Ping frame);

    R visitPong(Pong frame);
  }

  /** {@code register_key}. The blob is opaque and never inspected. */
  record RegisterKey(String publicKeyBlob) implements InboundFrame {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRegisterKey(this);
    }

    @Override
    public String toString() {
      return "RegisterKey[publicKeyBlob=<" + publicKeyBlob.length() + " chars>]";
    }
  }

  /** {@code friend_request}. */
  record FriendRequest(Identity toId) implements InboundFrame {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFriendRequest(this);
    }
  }

  /** {@code friend_response}; {@code fromId} is the original requester. */
  record FriendResponse(Identity fromId, boolean accept) implements InboundFrame {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFriendResponse(this);
    }
  }

  /** {@code list_friends}. */
  record ListFriends() implements InboundFrame {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitListFriends(this);
    }
  }

  /** {@code message}. The ciphertext is opaque and never inspected. */
  record Message(Identity toId, String ciphertext) implements InboundFrame {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitMessage(this);
    }

    @Override
    public String toString() {
      return "Message[toId=" + toId + ", ciphertext=<" + ciphertext.length() + " chars>]";
    }
  }

  record Ping() implements InboundFrame {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPing(this);
    }
  }

  record Pong() implements InboundFrame {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPong(this);
    }
  }
}
