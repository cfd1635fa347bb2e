package com.social100.cipherrelay.friend;

import com.social100.cipherrelay.identity.Identity;

/**
 * Receives relationship changes that the other party must hear about. Invoked after the store has
 * released its locks.
 */
public interface FriendEventListener {

  FriendEventListener NONE = new FriendEventListener() {
    @Override
    public void onRequest(Identity from, Identity to, RequestOutcome outcome) {
    }

    @Override
    public void onResponse(FriendRequest resolved) {
    }
  };

  /** {@code to} has a (possibly re-sent) pending request from {@code from}. */
  void onRequest(Identity from, Identity to, RequestOutcome outcome);

  /** The request was accepted or declined by its target; the requester should be told. */
  void onResponse(FriendRequest resolved);
}
