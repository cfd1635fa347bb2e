package com.social100.cipherrelay;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.social100.cipherrelay.audit.AuditSink;
import com.social100.cipherrelay.config.RelayConfig;
import com.social100.cipherrelay.identity.Identity;
import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.handshake.ServerHandshake;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CipherRelayEndToEndTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final long TIMEOUT_SECONDS = 5;

  private CipherRelay relay;

  @AfterEach
  void tearDown() {
    if (relay != null) {
      relay.stop();
    }
  }

  @Test
  void twoClients_becomeFriendsAndExchangeCiphertext() throws Exception {
    startRelay("");
    TestClient alice = connect("/");
    TestClient bob = connect("/");
    String aliceId = alice.next("identity_assigned").path("id").asText();
    String bobId = bob.next("identity_assigned").path("id").asText();
    assertThat(aliceId).isNotEqualTo(bobId);
    assertThat(Identity.parse(aliceId)).isPresent();

    alice.send("{\"type\":\"register_key\",\"public_key_blob\":\"pk-alice\"}");
    alice.next("key_registered");
    alice.send("{\"type\":\"friend_request\",\"to_id\":\"" + bobId.toLowerCase() + "\"}");
    alice.next("friend_request_sent");

    JsonNode incoming = bob.next("friend_request_incoming");
    assertThat(incoming.path("from_id").asText()).isEqualTo(aliceId);
    assertThat(incoming.path("public_key_blob").asText()).isEqualTo("pk-alice");

    bob.send("{\"type\":\"friend_response\",\"from_id\":\"" + aliceId + "\",\"accept\":true}");
    assertThat(alice.next("friend_response_result").path("accepted").asBoolean()).isTrue();
    bob.next("friend_added");
    assertThat(relay.getFriendStore().areFriends(Identity.of(aliceId), Identity.of(bobId))).isTrue();

    String ciphertext = "Qk1...é☃";
    alice.send("{\"type\":\"message\",\"to_id\":\"" + bobId + "\",\"ciphertext\":\"" + ciphertext + "\"}");
    JsonNode delivered = bob.next("message_incoming");
    assertThat(delivered.path("from_id").asText()).isEqualTo(aliceId);
    assertThat(delivered.path("ciphertext").asText()).isEqualTo(ciphertext);
    assertThat(delivered.path("timestamp").asLong()).isPositive();
    alice.next("message_sent");

    bob.closeBlocking();
    awaitOffline(bobId);
    alice.send("{\"type\":\"message\",\"to_id\":\"" + bobId + "\",\"ciphertext\":\"again\"}");
    assertThat(alice.next("error").path("code").asText()).isEqualTo("RecipientOffline");

    alice.closeBlocking();
  }

  @Test
  void messageToStranger_isRefused() throws Exception {
    startRelay("");
    TestClient alice = connect("/");
    TestClient bob = connect("/");
    alice.next("identity_assigned");
    String bobId = bob.next("identity_assigned").path("id").asText();

    alice.send("{\"type\":\"message\",\"to_id\":\"" + bobId + "\",\"ciphertext\":\"hi\"}");

    assertThat(alice.next("error").path("code").asText()).isEqualTo("NotFriends");
    bob.send("{\"type\":\"ping\"}");
    bob.next("pong");
    assertThat(bob.frames).isEmpty();
  }

  @Test
  void binaryFrame_isAnsweredWithError() throws Exception {
    startRelay("");
    TestClient client = connect("/");
    client.next("identity_assigned");

    client.send(ByteBuffer.wrap(new byte[] {1, 2, 3}));

    assertThat(client.next("error").path("code").asText()).isEqualTo("MalformedFrame");
  }

  @Test
  void wrongPath_isClosedWithProtocolError() throws Exception {
    startRelay("/relay");

    TestClient stray = new TestClient(URI.create("ws://127.0.0.1:" + relay.getPort() + "/elsewhere"));
    stray.connectBlocking(TIMEOUT_SECONDS, TimeUnit.SECONDS);

    assertThat(stray.closed.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
    assertThat(stray.closeCode).isEqualTo(CloseFrame.PROTOCOL_ERROR);
    assertThat(relay.getRegistry().size()).isZero();

    TestClient member = connect("/relay");
    member.next("identity_assigned");
  }

  private void startRelay(String path) throws InterruptedException {
    RelayConfig config = new RelayConfig();
    config.setBindAddress("127.0.0.1");
    config.setPort(0);
    config.setWebsocketPath(path);
    relay = new CipherRelay(config, AuditSink.NONE, Clock.systemUTC());
    relay.start(10_000);
  }

  private TestClient connect(String path) throws InterruptedException {
    TestClient client = new TestClient(URI.create("ws://127.0.0.1:" + relay.getPort() + path));
    assertThat(client.connectBlocking(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
    return client;
  }

  private void awaitOffline(String id) throws InterruptedException {
    long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS);
    while (relay.getRegistry().isLive(Identity.of(id))) {
      if (System.currentTimeMillis() > deadline) {
        throw new AssertionError(id + " still registered");
      }
      Thread.sleep(20);
    }
  }

  private static final class TestClient extends WebSocketClient {

    final BlockingQueue<JsonNode> frames = new LinkedBlockingQueue<>();
    final CountDownLatch closed = new CountDownLatch(1);
    volatile int closeCode;

    TestClient(URI uri) {
      super(uri);
    }

    /** Next frame of the given type; heartbeat pings in between are skipped. */
    JsonNode next(String type) throws InterruptedException {
      while (true) {
        JsonNode frame = frames.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (frame == null) {
          throw new AssertionError("no " + type + " frame within " + TIMEOUT_SECONDS + " s");
        }
        String actual = frame.path("type").asText();
        if (actual.equals(type)) {
          return frame;
        }
        if (!"ping".equals(actual)) {
          throw new AssertionError("expected " + type + " but got " + frame);
        }
      }
    }

    @Override
    public void onOpen(ServerHandshake handshake) {
    }

    @Override
    public void onMessage(String message) {
      try {
        frames.add(MAPPER.readTree(message));
      } catch (Exception e) {
        throw new IllegalStateException("Relay sent invalid JSON: " + message, e);
      }
    }

    @Override
    public void onClose(int code, String reason, boolean remote) {
      closeCode = code;
      closed.countDown();
    }

    @Override
    public void onError(Exception ex) {
      frames.add(MAPPER.createObjectNode().put("type", "client_error").put("message", String.valueOf(ex)));
    }
  }
}
