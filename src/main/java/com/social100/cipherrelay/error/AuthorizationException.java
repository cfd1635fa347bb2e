package com.social100.cipherrelay.error;

public class AuthorizationException extends RelayException {

  public AuthorizationException(ErrorCode code, String message) {
    super(code, message);
  }

  public static AuthorizationException notFriends(Object peer) {
    return new AuthorizationException(ErrorCode.NOT_FRIENDS, "Not friends with " + peer);
  }

  public static AuthorizationException noSuchRequest(Object requester) {
    return new AuthorizationException(ErrorCode.NO_SUCH_REQUEST, "No pending friend request from " + requester);
  }
}
