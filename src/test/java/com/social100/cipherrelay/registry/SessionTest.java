package com.social100.cipherrelay.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.social100.cipherrelay.identity.Identity;
import com.social100.cipherrelay.testing.RecordingPeerChannel;
import org.junit.jupiter.api.Test;

class SessionTest {

  @Test
  void lifecycle_followsConnectingRegisteredActiveClosed() {
    Session session = new Session(new RecordingPeerChannel(), 100L);
    assertThat(session.getState()).isEqualTo(Session.State.CONNECTING);

    assertThat(session.register(Identity.of("AB12CD"))).isTrue();
    assertThat(session.getState()).isEqualTo(Session.State.REGISTERED);

    assertThat(session.activate()).isTrue();
    assertThat(session.isActive()).isTrue();

    assertThat(session.markClosed()).isTrue();
    assertThat(session.markClosed()).isFalse();
    assertThat(session.getState()).isEqualTo(Session.State.CLOSED);
  }

  @Test
  void register_twice_throws() {
    Session session = new Session(new RecordingPeerChannel(), 0L);
    session.register(Identity.of("AB12CD"));

    assertThatThrownBy(() -> session.register(Identity.of("XY99ZZ")))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void register_afterClose_reportsFailure() {
    Session session = new Session(new RecordingPeerChannel(), 0L);
    session.markClosed();

    assertThat(session.register(Identity.of("AB12CD"))).isFalse();
    assertThat(session.activate()).isFalse();
  }

  @Test
  void touch_updatesLastSeen() {
    Session session = new Session(new RecordingPeerChannel(), 100L);
    assertThat(session.getLastSeenMillis()).isEqualTo(100L);

    session.touch(250L);

    assertThat(session.getLastSeenMillis()).isEqualTo(250L);
  }

  @Test
  void ageMillis_countsFromAcceptance() {
    Session session = new Session(new RecordingPeerChannel(), 1_000L);
    session.touch(4_000L);

    assertThat(session.ageMillis(6_500L)).isEqualTo(5_500L);
  }
}
