package com.social100.cipherrelay.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

/**
 * Server-to-client frames. Serialized through {@link FrameCodec} with the variant name in the
 * {@code type} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = OutboundFrame.IdentityAssigned.class, name = "identity_assigned"),
    @JsonSubTypes.Type(value = OutboundFrame.KeyRegistered.class, name = "key_registered"),
    @JsonSubTypes.Type(value = OutboundFrame.FriendRequestSent.class, name = "friend_request_sent"),
    @JsonSubTypes.Type(value = OutboundFrame.FriendRequestIncoming.class, name = "friend_request_incoming"),
    @JsonSubTypes.Type(value = OutboundFrame.FriendResponseResult.class, name = "friend_response_result"),
    @JsonSubTypes.Type(value = OutboundFrame.FriendAdded.class, name = "friend_added"),
    @JsonSubTypes.Type(value = OutboundFrame.FriendsList.class, name = "friends_list"),
    @JsonSubTypes.Type(value = OutboundFrame.MessageIncoming.class, name = "message_incoming"),
    @JsonSubTypes.Type(value = OutboundFrame.MessageSent.class, name = "message_sent"),
    @JsonSubTypes.Type(value = OutboundFrame.Ping.class, name = "ping"),
    @JsonSubTypes.Type(value = OutboundFrame.Pong.class, name = "pong"),
    @JsonSubTypes.Type(value = OutboundFrame.ErrorReply.class, name = "error")
})
public sealed interface OutboundFrame {

  record IdentityAssigned(@JsonProperty("id") String id) implements OutboundFrame {
  }

  record KeyRegistered() implements OutboundFrame {
  }

  record FriendRequestSent(@JsonProperty("to_id") String toId) implements OutboundFrame {
  }

  record FriendRequestIncoming(
      @JsonProperty("from_id") String fromId,
      @JsonProperty("public_key_blob") String publicKeyBlob) implements OutboundFrame {
  }

  record FriendResponseResult(
      @JsonProperty("peer_id") String peerId,
      @JsonProperty("accepted") boolean accepted,
      @JsonProperty("public_key_blob") String publicKeyBlob) implements OutboundFrame {
  }

  record FriendAdded(
      @JsonProperty("peer_id") String peerId,
      @JsonProperty("public_key_blob") String publicKeyBlob) implements OutboundFrame {
  }

  record FriendsList(@JsonProperty("friends") List<FriendEntry> friends) implements OutboundFrame {
  }

  record FriendEntry(
      @JsonProperty("id") String id,
      @JsonProperty("public_key_blob") String publicKeyBlob) {
  }

  record MessageIncoming(
      @JsonProperty("from_id") String fromId,
      @JsonProperty("ciphertext") String ciphertext,
      @JsonProperty("timestamp") long timestamp) implements OutboundFrame {

    @Override
    public String toString() {
      return "MessageIncoming[fromId=" + fromId + ", timestamp=" + timestamp + "]";
    }
  }

  record MessageSent(
      @JsonProperty("to_id") String toId,
      @JsonProperty("timestamp") long timestamp) implements OutboundFrame {
  }

  record Ping() implements OutboundFrame {
  }

  record Pong() implements OutboundFrame {
  }

  record ErrorReply(
      @JsonProperty("code") String code,
      @JsonProperty("message") String message) implements OutboundFrame {
  }
}
