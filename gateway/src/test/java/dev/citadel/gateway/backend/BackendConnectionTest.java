package dev.citadel.gateway.backend;

import static dev.citadel.gateway.GatewayFixtures.awaitTrue;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.citadel.gateway.GatewayFixtures;
import dev.citadel.gateway.error.GatewayErrorKind;
import dev.citadel.gateway.error.GatewayErrors;
import dev.citadel.gateway.error.GatewayException;
import dev.citadel.transport.Envelope;
import dev.citadel.transport.EnvelopeCodec;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BackendConnectionTest {

    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
    private final List<Envelope.Notification> notifications = new CopyOnWriteArrayList<>();
    private final List<BackendConnection> closed = new CopyOnWriteArrayList<>();

    private FakeBackendTransport backend;
    private BackendConnection connection;

    @BeforeEach
    void setUp() throws Exception {
        backend = new FakeBackendTransport(true);
        connection = new BackendConnection("github", backend, new EnvelopeCodec(), timer, Duration.ofMillis(300),
                Clock.systemUTC(), new BackendConnection.Listener() {
                    @Override
                    public void onNotification(String serverName, Envelope.Notification notification) {
                        notifications.add(notification);
                    }

                    @Override
                    public void onClosed(BackendConnection c) {
                        closed.add(c);
                    }
                });
        connection.start();
        connection.handshake(GatewayFixtures.initializeParams(), Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS);
    }

    @AfterEach
    void tearDown() {
        connection.close();
        timer.shutdownNow();
    }

    @Test
    void handshakeCachesResultAndConfirms() throws Exception {
        assertThat(connection.handshakeState()).isEqualTo(BackendHandshakeState.DONE);
        assertThat(connection.initializeResult().at("/serverInfo/name").asText()).isEqualTo("fake");
        assertThat(backend.awaitRequest("initialize").params().at("/clientInfo/name").asText())
                .isEqualTo("mcp-citadel");
        backend.awaitNotification("notifications/initialized");
    }

    @Test
    void rejectedHandshakeFails() {
        FakeBackendTransport rejecting = new FakeBackendTransport(true);
        rejecting.setRejectInitialize(true);
        BackendConnection other = new BackendConnection("broken", rejecting, new EnvelopeCodec(), timer,
                Duration.ofSeconds(1), Clock.systemUTC(), new NoopListener());
        other.start();

        CompletableFuture<JsonNode> handshake = other.handshake(GatewayFixtures.initializeParams(),
                Duration.ofSeconds(1));

        assertThatThrownBy(() -> handshake.get(5, TimeUnit.SECONDS))
                .satisfies(e -> assertThat(GatewayErrors.unwrap(e).kind())
                        .isEqualTo(GatewayErrorKind.BACKEND_HANDSHAKE_FAILED));
        other.close();
    }

    @Test
    void collidingClientIdsGetDistinctGatewayIds() throws Exception {
        BackendConnection.Reply a = connection.forward("s1", IntNode.valueOf(1), "tools/list", null)
                .get(5, TimeUnit.SECONDS);
        BackendConnection.Reply b = connection.forward("s2", IntNode.valueOf(1), "tools/list", null)
                .get(5, TimeUnit.SECONDS);

        assertThat(a.call().clientId()).isEqualTo(IntNode.valueOf(1));
        assertThat(b.call().clientId()).isEqualTo(IntNode.valueOf(1));
        assertThat(a.call().sessionId()).isEqualTo("s1");
        assertThat(b.call().sessionId()).isEqualTo("s2");
        assertThat(a.call().gatewayId()).isNotEqualTo(b.call().gatewayId());
        assertThat(a.response().result().get("gatewayId").asLong()).isEqualTo(a.call().gatewayId());
    }

    @Test
    void unansweredCallTimesOutAndIsCancelledUpstream() throws Exception {
        backend.setAutoReply(false);

        CompletableFuture<BackendConnection.Reply> reply = connection.forward("s1", TextNode.valueOf("a"),
                "tools/call", null);
        long gatewayId = backend.awaitRequest("tools/call").id().asLong();
        assertThat(connection.pendingCount()).isEqualTo(1);

        assertThatThrownBy(() -> reply.get(5, TimeUnit.SECONDS))
                .satisfies(e -> assertThat(GatewayErrors.unwrap(e).kind()).isEqualTo(GatewayErrorKind.BACKEND_TIMEOUT));
        Envelope.Notification cancelled = backend.awaitNotification("notifications/cancelled");
        assertThat(cancelled.params().get("requestId").asLong()).isEqualTo(gatewayId);

        // A late answer is discarded without disturbing the connection.
        backend.reply(gatewayId, JsonNodeFactory.instance.objectNode());
        assertThat(connection.pendingCount()).isZero();
        assertThat(connection.isClosed()).isFalse();
    }

    @Test
    void cancelAbandonsCallAndNotifiesBackend() throws Exception {
        backend.setAutoReply(false);
        CompletableFuture<BackendConnection.Reply> reply = connection.forward("s1", IntNode.valueOf(5),
                "tools/call", null);
        long gatewayId = backend.awaitRequest("tools/call").id().asLong();

        connection.cancel("s1", IntNode.valueOf(5), "user pressed stop");

        Envelope.Notification cancelled = backend.awaitNotification("notifications/cancelled");
        assertThat(cancelled.params().get("requestId").asLong()).isEqualTo(gatewayId);
        assertThat(cancelled.params().get("reason").asText()).isEqualTo("user pressed stop");
        assertThat(reply).isCancelled();
    }

    @Test
    void releasingSessionFailsItsCallsOnly() throws Exception {
        backend.setAutoReply(false);
        CompletableFuture<BackendConnection.Reply> mine = connection.forward("s1", IntNode.valueOf(1), "a", null);
        CompletableFuture<BackendConnection.Reply> theirs = connection.forward("s2", IntNode.valueOf(1), "b", null);
        backend.awaitRequest("a");
        long theirsId = backend.awaitRequest("b").id().asLong();

        connection.releaseSession("s1");

        assertThatThrownBy(() -> mine.get(5, TimeUnit.SECONDS))
                .satisfies(e -> assertThat(GatewayErrors.unwrap(e).kind()).isEqualTo(GatewayErrorKind.SESSION_CLOSED));
        backend.reply(theirsId, TextNode.valueOf("ok"));
        assertThat(theirs.get(5, TimeUnit.SECONDS).response().result().asText()).isEqualTo("ok");
    }

    @Test
    void backendExitFailsPendingCalls() throws Exception {
        backend.setAutoReply(false);
        CompletableFuture<BackendConnection.Reply> reply = connection.forward("s1", IntNode.valueOf(1),
                "tools/list", null);
        backend.awaitRequest("tools/list");

        backend.disconnect();

        assertThatThrownBy(() -> reply.get(5, TimeUnit.SECONDS))
                .satisfies(e -> assertThat(GatewayErrors.unwrap(e).kind())
                        .isEqualTo(GatewayErrorKind.BACKEND_UNAVAILABLE));
        awaitTrue(() -> closed.contains(connection));
        assertThat(connection.isClosed()).isTrue();
        assertThat(backend.isClosed()).isTrue();

        CompletableFuture<BackendConnection.Reply> after = connection.forward("s1", IntNode.valueOf(2), "x", null);
        assertThatThrownBy(() -> after.get(5, TimeUnit.SECONDS))
                .satisfies(e -> assertThat(GatewayErrors.unwrap(e).kind())
                        .isEqualTo(GatewayErrorKind.BACKEND_UNREACHABLE));
    }

    @Test
    void notificationsAndPingsFromBackend() throws Exception {
        backend.deliver(new Envelope.Notification("notifications/tools/list_changed", null));
        backend.deliver(new Envelope.Request(IntNode.valueOf(99), "ping", null));
        backend.deliver(new Envelope.Request(IntNode.valueOf(100), "sampling/createMessage", null));

        awaitTrue(() -> notifications.size() == 1);
        Envelope.Response pong = backend.awaitResponse();
        assertThat(pong.id()).isEqualTo(IntNode.valueOf(99));
        assertThat(pong.isError()).isFalse();
        Envelope.Response refused = backend.awaitResponse();
        assertThat(refused.error().get("code").asInt()).isEqualTo(-32601);
    }

    @Test
    void malformedBackendFrameIsDropped() throws Exception {
        backend.deliverRaw("this is not json");

        assertThat(connection.forward("s1", IntNode.valueOf(1), "tools/list", null).get(5, TimeUnit.SECONDS))
                .isNotNull();
        assertThat(connection.isClosed()).isFalse();
    }

    @Test
    void parsesGatewayIds() {
        assertThat(BackendConnection.parseGatewayId(IntNode.valueOf(7))).hasValue(7);
        assertThat(BackendConnection.parseGatewayId(TextNode.valueOf("12"))).hasValue(12);
        assertThat(BackendConnection.parseGatewayId(TextNode.valueOf("abc"))).isEmpty();
        assertThat(BackendConnection.parseGatewayId(null)).isEmpty();
    }

    @Test
    void failuresCarryServerName() throws Exception {
        backend.disconnect();
        awaitTrue(connection::isClosed);

        CompletableFuture<BackendConnection.Reply> reply = connection.forward("s1", IntNode.valueOf(1), "x", null);

        assertThatThrownBy(reply::join).satisfies(e -> {
            GatewayException failure = GatewayErrors.unwrap(e);
            assertThat(failure.server()).isEqualTo("github");
        });
    }

    private static final class NoopListener implements BackendConnection.Listener {

        @Override
        public void onNotification(String serverName, Envelope.Notification notification) {
        }

        @Override
        public void onClosed(BackendConnection connection) {
        }
    }
}
