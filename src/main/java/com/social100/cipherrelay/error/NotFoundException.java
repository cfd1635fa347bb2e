package com.social100.cipherrelay.error;

public class NotFoundException extends RelayException {

  public NotFoundException(ErrorCode code, String message) {
    super(code, message);
  }

  public static NotFoundException unknownTarget(Object target) {
    return new NotFoundException(ErrorCode.UNKNOWN_TARGET, "User ID not found: " + target);
  }

  public static NotFoundException recipientOffline(Object recipient) {
    return new NotFoundException(ErrorCode.RECIPIENT_OFFLINE, "Recipient is offline: " + recipient);
  }
}
