package com.social100.cipherrelay.friend;

import com.social100.cipherrelay.identity.Identity;

/**
 * A resolved or pending relationship negotiation between two identities.
 */
public record FriendRequest(Identity fromId, Identity toId, State state) {

  public enum State {
    PENDING,
    ACCEPTED,
    DECLINED
  }

  public boolean isAccepted() {
    return state == State.ACCEPTED;
  }
}
