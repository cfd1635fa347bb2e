package com.social100.cipherrelay.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.social100.cipherrelay.audit.AuditEvent;
import com.social100.cipherrelay.audit.AuditSink;
import com.social100.cipherrelay.error.AuthorizationException;
import com.social100.cipherrelay.error.ErrorCode;
import com.social100.cipherrelay.error.NotFoundException;
import com.social100.cipherrelay.error.RelayException;
import com.social100.cipherrelay.friend.FriendEventListener;
import com.social100.cipherrelay.friend.FriendRelationshipStore;
import com.social100.cipherrelay.identity.Identity;
import com.social100.cipherrelay.protocol.FrameCodec;
import com.social100.cipherrelay.registry.ConnectionRegistry;
import com.social100.cipherrelay.registry.Session;
import com.social100.cipherrelay.testing.MutableClock;
import com.social100.cipherrelay.testing.RecordingPeerChannel;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MessageRouterTest {

  private static final Identity A = Identity.of("AB12CD");
  private static final Identity B = Identity.of("XY99ZZ");
  private static final long NOW = 1_700_000_000_000L;

  @Mock
  private AuditSink audit;

  private ConnectionRegistry registry;
  private FriendRelationshipStore friends;
  private RecordingPeerChannel channelB;
  private MessageRouter router;

  @BeforeEach
  void setUp() {
    registry = new ConnectionRegistry();
    friends = new FriendRelationshipStore(FriendEventListener.NONE);
    channelB = new RecordingPeerChannel();
    registry.register(A, new Session(new RecordingPeerChannel(), 0L));
    registry.register(B, new Session(channelB, 0L));
    friends.join(A);
    friends.join(B);
    router = new MessageRouter(friends, registry, new FrameCodec(), audit, new MutableClock(NOW));
  }

  private void befriend() {
    friends.request(A, B);
    friends.respond(B, A, true);
  }

  @Test
  void route_betweenFriends_deliversCiphertextUnmodified() {
    befriend();
    String ciphertext = "Qk1-----BEGIN PGP MESSAGE-----\n{\"type\":\"ping\"}é==";

    Envelope envelope = router.route(A, B, ciphertext);

    assertThat(envelope).isEqualTo(new Envelope(A, B, ciphertext, NOW));
    JsonNode delivered = channelB.last();
    assertThat(delivered.path("type").asText()).isEqualTo("message_incoming");
    assertThat(delivered.path("from_id").asText()).isEqualTo("AB12CD");
    assertThat(delivered.path("ciphertext").asText()).isEqualTo(ciphertext);
    assertThat(delivered.path("timestamp").asLong()).isEqualTo(NOW);
    verify(audit).record(AuditEvent.messageRelayed(A, B, NOW));
  }

  @Test
  void route_withoutFriendship_failsWithNotFriendsAndDeliversNothing() {
    assertThatThrownBy(() -> router.route(A, B, "secret"))
        .isInstanceOf(AuthorizationException.class)
        .satisfies(e -> assertThat(((RelayException) e).getCode()).isEqualTo(ErrorCode.NOT_FRIENDS));

    assertThat(channelB.rawFrames()).isEmpty();
    verify(audit, never()).record(any());
  }

  @Test
  void route_withPendingRequestOnly_failsWithNotFriends() {
    friends.request(A, B);

    assertThatThrownBy(() -> router.route(A, B, "secret"))
        .isInstanceOf(AuthorizationException.class);
    assertThat(channelB.rawFrames()).isEmpty();
  }

  @Test
  void route_toOfflineFriend_failsWithRecipientOffline() {
    befriend();
    registry.unregister(B);
    friends.depart(B);

    assertThatThrownBy(() -> router.route(A, B, "secret"))
        .isInstanceOf(NotFoundException.class)
        .satisfies(e -> assertThat(((RelayException) e).getCode()).isEqualTo(ErrorCode.RECIPIENT_OFFLINE));
  }

  @Test
  void route_toFriendWhoseChannelJustDied_failsWithRecipientOffline() {
    befriend();
    channelB.drop();

    assertThatThrownBy(() -> router.route(A, B, "secret"))
        .isInstanceOf(NotFoundException.class)
        .satisfies(e -> assertThat(((RelayException) e).getCode()).isEqualTo(ErrorCode.RECIPIENT_OFFLINE));
    verify(audit, never()).record(any());
  }

  @Test
  void route_preservesSendOrderPerSender() {
    befriend();

    for (int i = 0; i < 50; i++) {
      router.route(A, B, "c" + i);
    }

    List<String> delivered = channelB.framesOfType("message_incoming").stream()
        .map(node -> node.path("ciphertext").asText())
        .collect(Collectors.toList());
    assertThat(delivered).hasSize(50);
    for (int i = 0; i < 50; i++) {
      assertThat(delivered.get(i)).isEqualTo("c" + i);
    }
  }

  @Test
  void envelope_toString_omitsCiphertext() {
    Envelope envelope = new Envelope(A, B, "top-secret-ciphertext", NOW);

    assertThat(envelope.toString()).doesNotContain("top-secret-ciphertext").contains("AB12CD");
  }
}
