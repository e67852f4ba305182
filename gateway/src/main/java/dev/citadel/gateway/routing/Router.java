package dev.citadel.gateway.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.citadel.gateway.backend.BackendConnection;
import dev.citadel.gateway.backend.BackendRegistry;
import dev.citadel.gateway.error.GatewayErrorKind;
import dev.citadel.gateway.error.GatewayErrors;
import dev.citadel.gateway.error.GatewayException;
import dev.citadel.gateway.metrics.GatewayMetrics;
import dev.citadel.gateway.session.ClientInfo;
import dev.citadel.gateway.session.NotificationSink;
import dev.citadel.gateway.session.Session;
import dev.citadel.gateway.session.SessionManager;
import dev.citadel.gateway.session.SessionState;
import dev.citadel.gateway.session.TransportKind;
import dev.citadel.transport.Envelope;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport-independent request handling: session handshake, server resolution, forwarding
 * and id restoration. Transports decode a frame, pick the session and hand it here.
 */
public class Router {

    private static final Logger LOGGER = LoggerFactory.getLogger(Router.class);

    static final String SERVER_PARAM = "server";

    /**
     * What happens to notifications a backend pushes on its shared connection.
     */
    public enum NotificationPolicy {
        BROADCAST,
        DROP
    }

    /**
     * A freshly created session and the {@code initialize} response to relay to its client.
     */
    public record Initialized(Session session, Envelope.Response response) {
    }

    private final SessionManager sessions;
    private final BackendRegistry backends;
    private final NotificationPolicy notificationPolicy;
    private final GatewayMetrics metrics;

    public Router(SessionManager sessions, BackendRegistry backends, NotificationPolicy notificationPolicy) {
        this(sessions, backends, notificationPolicy, new GatewayMetrics(new SimpleMeterRegistry(), Clock.systemUTC()));
    }

    public Router(SessionManager sessions, BackendRegistry backends, NotificationPolicy notificationPolicy,
            GatewayMetrics metrics) {
        this.sessions = sessions;
        this.backends = backends;
        this.notificationPolicy = notificationPolicy;
        this.metrics = metrics;
        backends.setNotificationListener(this::onBackendNotification);
        sessions.addCloseListener(this::onSessionClosed);
        metrics.bind(sessions, backends);
    }

    /**
     * Open a session for an {@code initialize} request and relay the backend's cached
     * {@code InitializeResult}. If the backend cannot be acquired the session is closed again.
     */
    public CompletableFuture<Initialized> initialize(Envelope.Request request, TransportKind transport) {
        Session session;
        try {
            String server = serverParam(request.params())
                .orElseThrow(() -> new GatewayException(GatewayErrorKind.MISSING_SERVER_PARAMETER,
                        "initialize requires params.server naming the backend"));
            if (!backends.isKnown(server)) {
                throw new GatewayException(GatewayErrorKind.SERVER_NOT_FOUND,
                        "Unknown server: " + server + " (available: " + backends.serverNames() + ")", server);
            }
            String protocolVersion = request.paramText("protocolVersion").orElse(null);
            JsonNode clientInfo = request.params() == null ? null : request.params().get("clientInfo");
            session = sessions.createSession(ClientInfo.from(clientInfo), protocolVersion, server, transport);
        } catch (GatewayException e) {
            return CompletableFuture.failedFuture(e);
        }
        return backends.acquire(session.boundServer()).handle((connection, failure) -> {
            if (failure != null) {
                sessions.close(session.id());
                throw GatewayErrors.propagate(failure);
            }
            ObjectNode result = (ObjectNode) connection.initializeResult().deepCopy();
            result.put("protocolVersion", session.protocolVersion());
            sessions.markInitializeRelayed(session);
            metrics.sessionCreated(transport);
            return new Initialized(session, Envelope.Response.success(request.id(), result));
        });
    }

    /**
     * Route a request of an established session. The returned response carries the client's
     * own id.
     */
    public CompletableFuture<Envelope.Response> dispatch(Session session, Envelope.Request request) {
        switch (MethodKind.of(request.method())) {
            case INITIALIZE:
                return CompletableFuture.failedFuture(new GatewayException(GatewayErrorKind.ALREADY_INITIALIZED,
                        "Session is already initialized", session.boundServer()));
            case INITIALIZED_NOTIFICATION:
            case CANCELLED_NOTIFICATION:
                return CompletableFuture.failedFuture(new GatewayException(GatewayErrorKind.INVALID_REQUEST,
                        request.method() + " is a notification and must not carry an id", session.boundServer()));
            default:
                return forward(session, request);
        }
    }

    private CompletableFuture<Envelope.Response> forward(Session session, Envelope.Request request) {
        String server;
        try {
            sessions.requireActive(session);
            server = resolveServer(session, serverParam(request.params()));
            sessions.touch(session.id());
        } catch (GatewayException e) {
            return CompletableFuture.failedFuture(e);
        }
        JsonNode params = withoutServer(request.params());
        Timer.Sample sample = metrics.startCall();
        return backends.acquire(server)
            .thenCompose(connection -> connection.forward(session.id(), request.id(), request.method(), params))
            .thenApply(reply -> {
                if (session.isClosed()) {
                    throw new GatewayException(GatewayErrorKind.SESSION_CLOSED,
                            "Session closed before the backend answered", server);
                }
                return reply.response().withId(reply.call().clientId());
            })
            .whenComplete((response, failure) -> metrics.callCompleted(sample, server, request.method(),
                    failure != null ? GatewayErrors.unwrap(failure).kind().type()
                            : response.isError() ? "error" : "success"));
    }

    /**
     * Handle a client notification. Failures are thrown synchronously; there is nothing to
     * answer on success.
     */
    public void notify(Session session, Envelope.Notification notification) {
        switch (MethodKind.of(notification.method())) {
            case INITIALIZED_NOTIFICATION:
                sessions.completeHandshake(session.id());
                break;
            case CANCELLED_NOTIFICATION:
                cancel(session, notification);
                break;
            case INITIALIZE:
                throw new GatewayException(GatewayErrorKind.INVALID_REQUEST, "initialize must carry an id",
                        session.boundServer());
            default:
                sessions.requireActive(session);
                resolveServer(session, serverParam(notification.params()));
                sessions.touch(session.id());
                Envelope.Notification stripped = notification.withParams(withoutServer(notification.params()));
                backends.live(session.boundServer())
                    .ifPresentOrElse(connection -> connection.sendNotification(stripped),
                            () -> LOGGER.debug("No live connection to {}, dropping {}", session.boundServer(),
                                    notification.method()));
                break;
        }
    }

    private void cancel(Session session, Envelope.Notification notification) {
        JsonNode requestId = notification.params() == null ? null : notification.params().get("requestId");
        if (requestId == null || requestId.isNull()) {
            LOGGER.debug("Cancellation without requestId from {}, dropped", session);
            return;
        }
        String reason = notification.params().path("reason").asText("cancelled by client");
        backends.live(session.boundServer())
            .ifPresent(connection -> connection.cancel(session.id(), requestId, reason));
    }

    private String resolveServer(Session session, Optional<String> requested) {
        if (requested.isPresent() && !requested.get().equals(session.boundServer())) {
            throw new GatewayException(GatewayErrorKind.INVALID_SERVER_BINDING,
                    "Session is bound to " + session.boundServer() + ", not " + requested.get(),
                    requested.get());
        }
        return session.boundServer();
    }

    /**
     * The {@code server} parameter, if one was sent. Anything but a non-blank string is rejected
     * rather than read as absent.
     */
    static Optional<String> serverParam(JsonNode params) {
        JsonNode value = params == null || !params.isObject() ? null : params.get(SERVER_PARAM);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new GatewayException(GatewayErrorKind.INVALID_REQUEST,
                    "params.server must be a non-empty string, got " + value);
        }
        return Optional.of(value.asText());
    }

    static JsonNode withoutServer(JsonNode params) {
        if (params == null || !params.isObject() || !params.has(SERVER_PARAM)) {
            return params;
        }
        ObjectNode copy = ((ObjectNode) params).deepCopy();
        copy.remove(SERVER_PARAM);
        return copy;
    }

    public GatewayMetrics metrics() {
        return metrics;
    }

    void onBackendNotification(String serverName, Envelope.Notification notification) {
        if (notificationPolicy == NotificationPolicy.DROP) {
            LOGGER.debug("Dropping {} from {}", notification.method(), serverName);
            return;
        }
        int delivered = 0;
        for (Session session : sessions.sessionsBoundTo(serverName)) {
            NotificationSink sink = session.notificationSink().orElse(null);
            if (sink == null || session.state() != SessionState.ACTIVE) {
                continue;
            }
            try {
                sink.deliver(notification);
                delivered++;
            } catch (RuntimeException e) {
                LOGGER.warn("Could not deliver {} to {}", notification.method(), session, e);
            }
        }
        LOGGER.debug("Broadcast {} from {} to {} sessions", notification.method(), serverName, delivered);
    }

    void onSessionClosed(Session session) {
        for (BackendConnection connection : backends.liveConnections()) {
            connection.releaseSession(session.id());
        }
    }
}
