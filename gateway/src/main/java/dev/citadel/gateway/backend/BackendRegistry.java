package dev.citadel.gateway.backend;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.citadel.gateway.error.GatewayErrorKind;
import dev.citadel.gateway.error.GatewayErrors;
import dev.citadel.gateway.error.GatewayException;
import dev.citadel.transport.Envelope;
import dev.citadel.transport.EnvelopeCodec;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps backend names to their single live connection, establishing it on first use.
 * <p>
 * Establishment is coalesced: the first caller for a name installs a promise and does the
 * work, everyone arriving meanwhile waits on the same promise. A failed establishment is
 * removed so that the next caller starts over.
 */
public class BackendRegistry implements BackendConnection.Listener {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackendRegistry.class);

    /**
     * Receives notifications pushed by any backend.
     */
    @FunctionalInterface
    public interface NotificationListener {

        void onNotification(String serverName, Envelope.Notification notification);
    }

    private final Map<String, BackendDefinition> definitions;
    private final BackendConnector connector;
    private final EnvelopeCodec codec;
    private final ScheduledExecutorService timer;
    private final Executor establishExecutor;
    private final Duration handshakeTimeout;
    private final Duration callTimeout;
    private final ObjectNode initializeParams;
    private final Clock clock;
    private final Map<String, CompletableFuture<BackendConnection>> connections = new ConcurrentHashMap<>();

    private volatile NotificationListener notificationListener = (server, notification) -> {
    };

    public BackendRegistry(Map<String, BackendDefinition> definitions, BackendConnector connector,
            EnvelopeCodec codec, ScheduledExecutorService timer, Executor establishExecutor,
            Duration handshakeTimeout, Duration callTimeout, ObjectNode initializeParams, Clock clock) {
        this.definitions = new LinkedHashMap<>(definitions);
        this.connector = connector;
        this.codec = codec;
        this.timer = timer;
        this.establishExecutor = establishExecutor;
        this.handshakeTimeout = handshakeTimeout;
        this.callTimeout = callTimeout;
        this.initializeParams = initializeParams;
        this.clock = clock;
    }

    /**
     * Live, handshaken connection for {@code serverName}.
     *
     * @return future failing with {@code SERVER_NOT_FOUND}, {@code BACKEND_UNREACHABLE} or
     *         {@code BACKEND_HANDSHAKE_FAILED}
     */
    public CompletableFuture<BackendConnection> acquire(String serverName) {
        BackendDefinition definition = definitions.get(serverName);
        if (definition == null) {
            return CompletableFuture.failedFuture(new GatewayException(GatewayErrorKind.SERVER_NOT_FOUND,
                    "Unknown server: " + serverName + " (available: " + definitions.keySet() + ")", serverName));
        }
        while (true) {
            CompletableFuture<BackendConnection> existing = connections.get(serverName);
            if (existing != null) {
                BackendConnection live = established(existing);
                if (live != null && live.isClosed()) {
                    connections.remove(serverName, existing);
                    continue;
                }
                return existing.copy();
            }
            CompletableFuture<BackendConnection> promise = new CompletableFuture<>();
            if (connections.putIfAbsent(serverName, promise) == null) {
                establishExecutor.execute(() -> establish(definition, promise));
                return promise.copy();
            }
        }
    }

    private void establish(BackendDefinition definition, CompletableFuture<BackendConnection> promise) {
        String name = definition.name();
        BackendTransport transport;
        try {
            transport = connector.open(definition);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Could not reach backend {}: {}", name, e.getMessage());
            fail(name, promise, new GatewayException(GatewayErrorKind.BACKEND_UNREACHABLE,
                    "Could not start backend " + name + ": " + e.getMessage(), name, e));
            return;
        }
        BackendConnection connection = new BackendConnection(name, transport, codec, timer, callTimeout, clock,
                this);
        connection.start();
        connection.handshake(initializeParams.deepCopy(), handshakeTimeout).whenComplete((result, failure) -> {
            if (failure != null) {
                GatewayException cause = GatewayErrors.unwrap(failure);
                LOGGER.warn("Backend {} handshake failed: {}", name, cause.getMessage());
                connection.close();
                fail(name, promise, cause);
            } else {
                promise.complete(connection);
            }
        });
    }

    private void fail(String name, CompletableFuture<BackendConnection> promise, GatewayException failure) {
        connections.remove(name, promise);
        promise.completeExceptionally(failure);
    }

    @Override
    public void onNotification(String serverName, Envelope.Notification notification) {
        notificationListener.onNotification(serverName, notification);
    }

    @Override
    public void onClosed(BackendConnection connection) {
        CompletableFuture<BackendConnection> entry = connections.get(connection.serverName());
        if (entry != null && established(entry) == connection
                && connections.remove(connection.serverName(), entry)) {
            LOGGER.info("Removed connection to {}; next request reconnects", connection.serverName());
        }
    }

    public void setNotificationListener(NotificationListener listener) {
        this.notificationListener = listener;
    }

    public boolean isKnown(String serverName) {
        return serverName != null && definitions.containsKey(serverName);
    }

    public Set<String> serverNames() {
        return definitions.keySet();
    }

    /**
     * Established connection for {@code serverName}, without connecting.
     */
    public Optional<BackendConnection> live(String serverName) {
        CompletableFuture<BackendConnection> entry = connections.get(serverName);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(established(entry)).filter(c -> !c.isClosed());
    }

    public List<BackendConnection> liveConnections() {
        List<BackendConnection> live = new ArrayList<>();
        for (CompletableFuture<BackendConnection> entry : connections.values()) {
            BackendConnection connection = established(entry);
            if (connection != null && !connection.isClosed()) {
                live.add(connection);
            }
        }
        return live;
    }

    private static BackendConnection established(CompletableFuture<BackendConnection> entry) {
        if (entry == null || !entry.isDone() || entry.isCompletedExceptionally()) {
            return null;
        }
        return entry.join();
    }

    public void stop() {
        List<BackendConnection> live = liveConnections();
        connections.clear();
        live.forEach(BackendConnection::close);
        LOGGER.info("Closed {} backend connections", live.size());
    }
}
