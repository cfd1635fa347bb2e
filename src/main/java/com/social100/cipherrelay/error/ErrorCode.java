package com.social100.cipherrelay.error;

/**
 * Error codes carried in the {@code code} field of {@code error} frames.
 */
public enum ErrorCode {
  MALFORMED_FRAME("MalformedFrame", ErrorCategory.PROTOCOL),
  UNKNOWN_TYPE("UnknownType", ErrorCategory.PROTOCOL),
  MISSING_FIELD("MissingField", ErrorCategory.PROTOCOL),
  INVALID_FIELD("InvalidField", ErrorCategory.PROTOCOL),
  SELF_REQUEST("SelfRequest", ErrorCategory.PROTOCOL),
  ALREADY_FRIENDS("AlreadyFriends", ErrorCategory.PROTOCOL),
  NOT_FRIENDS("NotFriends", ErrorCategory.AUTHORIZATION),
  NO_SUCH_REQUEST("NoSuchRequest", ErrorCategory.AUTHORIZATION),
  UNKNOWN_TARGET("UnknownTarget", ErrorCategory.NOT_FOUND),
  RECIPIENT_OFFLINE("RecipientOffline", ErrorCategory.NOT_FOUND),
  EXHAUSTED_NAMESPACE("ExhaustedNamespace", ErrorCategory.RESOURCE),
  CHANNEL_CLOSED("ChannelClosed", ErrorCategory.TRANSPORT),
  INTERNAL_ERROR("InternalError", ErrorCategory.INTERNAL);

  private final String wireName;
  private final ErrorCategory category;

  ErrorCode(String wireName, ErrorCategory category) {
    this.wireName = wireName;
    this.category = category;
  }

  /** The value sent to clients, e.g. {@code NotFriends}. */
  public String wireName() {
    return wireName;
  }

  public ErrorCategory category() {
    return category;
  }
}
