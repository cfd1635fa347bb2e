package com.social100.cipherrelay.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.social100.cipherrelay.error.ProtocolException;
import com.social100.cipherrelay.identity.Identity;

/**
 * JSON text frames <-> {@link InboundFrame} / {@link OutboundFrame}.
 *
 * <p>Inbound frames are read as a tree and mapped by their {@code type} field, so a bad frame is
 * reported with the precise field at fault instead of a generic binding error. Opaque fields
 * ({@code ciphertext}, {@code public_key_blob}) must be JSON strings and are passed through
 * untouched.</p>
 */
public class FrameCodec {

  public static final int DEFAULT_MAX_FRAME_CHARS = 1 << 20;

  private final ObjectMapper objectMapper;
  private final ObjectWriter outboundWriter;
  private final int maxFrameChars;

  public FrameCodec() {
    this(DEFAULT_MAX_FRAME_CHARS);
  }

  public FrameCodec(int maxFrameChars) {
    if (maxFrameChars <= 0) {
      throw new IllegalArgumentException("maxFrameChars must be positive");
    }
    this.maxFrameChars = maxFrameChars;
    this.objectMapper = new ObjectMapper()
        .setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        // one frame is exactly one JSON object
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    this.outboundWriter = objectMapper.writerFor(OutboundFrame.class);
  }

  /**
   * @throws ProtocolException if the text is not a well-formed frame of a known type
   */
  public InboundFrame decode(String raw) {
    if (raw == null || raw.isBlank()) {
      throw ProtocolException.malformed("Empty frame");
    }
    if (raw.length() > maxFrameChars) {
      throw ProtocolException.malformed("Frame exceeds " + maxFrameChars + " characters");
    }

    JsonNode node;
    try {
      node = objectMapper.readTree(raw);
    } catch (JsonProcessingException e) {
      throw ProtocolException.malformed("Frame is not valid JSON");
    }
    if (node == null || !node.isObject()) {
      throw ProtocolException.malformed("Frame must be a JSON object");
    }

    String type = requireText(node, "type");
    switch (type) {
      case "register_key":
        return new InboundFrame.RegisterKey(requireText(node, "public_key_blob"));
      case "friend_request":
        return new InboundFrame.FriendRequest(requireIdentity(node, "to_id"));
      case "friend_response":
        return new InboundFrame.FriendResponse(requireIdentity(node, "from_id"), requireBoolean(node, "accept"));
      case "list_friends":
        return new InboundFrame.ListFriends();
      case "message":
        return new InboundFrame.Message(requireIdentity(node, "to_id"), requireText(node, "ciphertext"));
      case "ping":
        return new InboundFrame.Ping();
      case "pong":
        return new InboundFrame.Pong();
      default:
        throw ProtocolException.unknownType(type);
    }
  }

  public String encode(OutboundFrame frame) {
    try {
      return outboundWriter.writeValueAsString(frame);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize " + frame.getClass().getSimpleName(), e);
    }
  }

  public int getMaxFrameChars() {
    return maxFrameChars;
  }

  private static JsonNode require(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw ProtocolException.missingField(field);
    }
    return value;
  }

  private static String requireText(JsonNode node, String field) {
    JsonNode value = require(node, field);
    if (!value.isTextual()) {
      throw ProtocolException.invalidField(field, "expected a string");
    }
    return value.textValue();
  }

  private static Identity requireIdentity(JsonNode node, String field) {
    String raw = requireText(node, field);
    return Identity.parse(raw)
        .orElseThrow(() -> ProtocolException.invalidField(field,
            "expected " + Identity.LENGTH + " characters of A-Z, 0-9"));
  }

  private static boolean requireBoolean(JsonNode node, String field) {
    JsonNode value = require(node, field);
    if (!value.isBoolean()) {
      throw ProtocolException.invalidField(field, "expected true or false");
    }
    return value.booleanValue();
  }
}
