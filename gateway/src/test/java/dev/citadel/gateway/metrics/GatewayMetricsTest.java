package dev.citadel.gateway.metrics;

import static dev.citadel.gateway.GatewayFixtures.clientInitialize;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.IntNode;
import dev.citadel.gateway.GatewayFixtures;
import dev.citadel.gateway.backend.BackendRegistry;
import dev.citadel.gateway.backend.FakeBackendTransport;
import dev.citadel.gateway.backend.FakeConnector;
import dev.citadel.gateway.routing.Router;
import dev.citadel.gateway.session.Session;
import dev.citadel.gateway.session.SessionManager;
import dev.citadel.gateway.session.TransportKind;
import dev.citadel.gateway.transport.StreamConnection;
import dev.citadel.transport.Envelope;
import dev.citadel.transport.EnvelopeCodec;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class GatewayMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final GatewayFixtures.MutableClock clock = new GatewayFixtures.MutableClock();
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
    private final FakeConnector connector = new FakeConnector();
    private final SessionManager sessions = GatewayFixtures.sessions(clock);
    private final BackendRegistry backends = GatewayFixtures.registry(connector, timer, Duration.ofSeconds(5),
            "github");
    private final Router router = new Router(sessions, backends, Router.NotificationPolicy.BROADCAST,
            new GatewayMetrics(registry, clock));

    @AfterEach
    void tearDown() {
        sessions.stop();
        backends.stop();
        timer.shutdownNow();
    }

    @Test
    void sessionsAreCountedPerTransport() throws Exception {
        Session session = initialize();

        assertThat(registry.get(GatewayMetrics.SESSIONS_CREATED).tag("transport", "unix_socket").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get(GatewayMetrics.SESSIONS_ACTIVE).tag("transport", "unix_socket").gauge().value())
                .isEqualTo(1.0);
        assertThat(registry.get(GatewayMetrics.SESSIONS_ACTIVE).tag("transport", "http").gauge().value())
                .isZero();
        assertThat(registry.get(GatewayMetrics.BACKENDS_CONNECTED).gauge().value()).isEqualTo(1.0);

        clock.advance(Duration.ofSeconds(30));
        sessions.close(session.id());

        assertThat(registry.get(GatewayMetrics.SESSIONS_ACTIVE).tag("transport", "unix_socket").gauge().value())
                .isZero();
        assertThat(registry.get(GatewayMetrics.SESSION_DURATION).tag("transport", "unix_socket").timer()
                .totalTime(TimeUnit.SECONDS)).isEqualTo(30.0);
    }

    @Test
    void routedCallsAreTimedByOutcome() throws Exception {
        Session session = initialize();
        router.notify(session, new Envelope.Notification("notifications/initialized", null));

        router.dispatch(session, new Envelope.Request(IntNode.valueOf(1), "tools/list", null)).get(5, TimeUnit.SECONDS);

        assertThat(registry.get(GatewayMetrics.MESSAGES_ROUTED)
                .tags("server", "github", "method", "tools/list", "status", "success").timer().count()).isEqualTo(1);

        FakeBackendTransport backend = connector.last();
        backend.setAutoReply(false);
        CompletableFuture<Envelope.Response> call = router.dispatch(session,
                new Envelope.Request(IntNode.valueOf(2), "tools/call", null));
        backend.awaitRequest("tools/call");
        backend.disconnect();
        assertThatThrownBy(() -> call.get(5, TimeUnit.SECONDS));

        assertThat(registry.get(GatewayMetrics.MESSAGES_ROUTED)
                .tags("server", "github", "method", "tools/call", "status", "backend_unavailable").timer().count())
                .isEqualTo(1);
    }

    @Test
    void rejectedFramesAreCountedByKind() throws Exception {
        BlockingQueue<String> written = new LinkedBlockingQueue<>();
        StreamConnection connection = new StreamConnection("metrics-1", TransportKind.UNIX_SOCKET, router, sessions,
                new EnvelopeCodec(), written::add, Runnable::run);

        connection.onFrame("{oops");
        connection.onFrame("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":"
                + "{\"server\":\"gitlab\",\"protocolVersion\":\"2025-06-18\"}}");

        assertThat(written.poll(5, TimeUnit.SECONDS)).isNotNull();
        assertThat(written.poll(5, TimeUnit.SECONDS)).isNotNull();
        assertThat(registry.get(GatewayMetrics.ERRORS).tags("kind", "malformed", "server", "unknown").counter()
                .count()).isEqualTo(1.0);
        assertThat(registry.get(GatewayMetrics.ERRORS).tags("kind", "server_not_found", "server", "gitlab")
                .counter().count()).isEqualTo(1.0);
    }

    private Session initialize() throws Exception {
        return router.initialize(new Envelope.Request(IntNode.valueOf(0), "initialize",
                clientInitialize("github", "2025-06-18")), TransportKind.UNIX_SOCKET)
            .get(5, TimeUnit.SECONDS)
            .session();
    }
}
