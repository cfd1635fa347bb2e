package com.social100.cipherrelay.error;

/**
 * A frame that cannot be parsed, lacks a required field, or asks for something the protocol does
 * not allow. Logged and answered; the session is not torn down.
 */
public class ProtocolException extends RelayException {

  public ProtocolException(ErrorCode code, String message) {
    super(code, message);
  }

  public static ProtocolException malformed(String message) {
    return new ProtocolException(ErrorCode.MALFORMED_FRAME, message);
  }

  public static ProtocolException unknownType(String type) {
    return new ProtocolException(ErrorCode.UNKNOWN_TYPE, "Unknown frame type: " + type);
  }

  public static ProtocolException missingField(String field) {
    return new ProtocolException(ErrorCode.MISSING_FIELD, "Missing required field: " + field);
  }

  public static ProtocolException invalidField(String field, String reason) {
    return new ProtocolException(ErrorCode.INVALID_FIELD, "Invalid field '" + field + "': " + reason);
  }

  public static ProtocolException selfRequest() {
    return new ProtocolException(ErrorCode.SELF_REQUEST, "Cannot send a friend request to yourself");
  }

  public static ProtocolException alreadyFriends(Object peer) {
    return new ProtocolException(ErrorCode.ALREADY_FRIENDS, "Already friends with " + peer);
  }
}
