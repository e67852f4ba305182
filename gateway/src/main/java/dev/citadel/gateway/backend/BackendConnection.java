package dev.citadel.gateway.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.citadel.gateway.error.GatewayErrorKind;
import dev.citadel.gateway.error.GatewayErrors;
import dev.citadel.gateway.error.GatewayException;
import dev.citadel.transport.DecodeException;
import dev.citadel.transport.Envelope;
import dev.citadel.transport.EnvelopeCodec;
import dev.citadel.transport.Wire;
import io.modelcontextprotocol.spec.McpSchema;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One multiplexed stream to a named backend, shared by every session routed to it.
 * <p>
 * Client ids are never sent to the backend. Each forwarded call gets a fresh gateway id and a
 * {@link PendingCall} in the correlation table; the backend's reply is matched back through it.
 * The table and the outbound stream are only touched from the connection's owner thread, so
 * callers on any thread interact with it by submitting tasks.
 */
public class BackendConnection implements BackendTransport.Listener {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackendConnection.class);

    private static final String GATEWAY_SESSION = "<gateway>";

    private static final String CANCELLED_NOTIFICATION = "notifications/cancelled";

    /**
     * Events a connection reports upward.
     */
    public interface Listener {

        void onNotification(String serverName, Envelope.Notification notification);

        void onClosed(BackendConnection connection);
    }

    /**
     * Backend response together with the correlation record it resolved.
     */
    public record Reply(PendingCall call, Envelope.Response response) {
    }

    private final String serverName;
    private final BackendTransport transport;
    private final EnvelopeCodec codec;
    private final ScheduledExecutorService timer;
    private final Duration callTimeout;
    private final Clock clock;
    private final Listener listener;
    private final ExecutorService owner;
    private final CorrelationTable table;
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile BackendHandshakeState handshakeState = BackendHandshakeState.NOT_STARTED;
    private volatile JsonNode initializeResult;

    public BackendConnection(String serverName, BackendTransport transport, EnvelopeCodec codec,
            ScheduledExecutorService timer, Duration callTimeout, Clock clock, Listener listener) {
        this(serverName, transport, codec, timer, callTimeout, clock, listener, new CorrelationTable());
    }

    BackendConnection(String serverName, BackendTransport transport, EnvelopeCodec codec,
            ScheduledExecutorService timer, Duration callTimeout, Clock clock, Listener listener,
            CorrelationTable table) {
        this.serverName = serverName;
        this.transport = transport;
        this.codec = codec;
        this.timer = timer;
        this.callTimeout = callTimeout;
        this.clock = clock;
        this.listener = listener;
        this.table = table;
        this.owner = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "backend-" + serverName);
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        transport.start(this);
        LOGGER.debug("Connection to {} started ({})", serverName, transport.describe());
    }

    /**
     * Run the gateway's own initialize exchange. Completes with the backend's
     * {@code InitializeResult}, which is cached for every session that later binds here.
     */
    public CompletableFuture<JsonNode> handshake(ObjectNode initializeParams, Duration timeout) {
        CompletableFuture<Reply> reply = new CompletableFuture<>();
        execute(() -> {
            handshakeState = BackendHandshakeState.IN_FLIGHT;
            issue(GATEWAY_SESSION, NullNode.getInstance(), McpSchema.METHOD_INITIALIZE, initializeParams, timeout,
                    reply);
        }, reply);
        return reply.handle((r, failure) -> {
            if (failure != null) {
                GatewayException cause = GatewayErrors.unwrap(failure);
                throw new GatewayException(GatewayErrorKind.BACKEND_HANDSHAKE_FAILED,
                        "Handshake with " + serverName + " failed: " + cause.getMessage(), serverName, cause);
            }
            Envelope.Response response = r.response();
            if (response.isError() || response.result() == null || !response.result().isObject()) {
                String detail = response.isError() ? response.error().path("message").asText("error")
                        : "missing result";
                throw new GatewayException(GatewayErrorKind.BACKEND_HANDSHAKE_FAILED,
                        "Backend " + serverName + " rejected initialize: " + detail, serverName);
            }
            initializeResult = response.result().deepCopy();
            sendNotification(new Envelope.Notification(McpSchema.METHOD_NOTIFICATION_INITIALIZED, null));
            handshakeState = BackendHandshakeState.DONE;
            LOGGER.info("Handshake with {} complete (protocol {})", serverName,
                    initializeResult.path("protocolVersion").asText("?"));
            return initializeResult;
        });
    }

    /**
     * Send a client request under a fresh gateway id. The reply still carries the gateway id;
     * the caller restores the client's own id from {@link Reply#call()}.
     */
    public CompletableFuture<Reply> forward(String sessionId, JsonNode clientId, String method, JsonNode params) {
        CompletableFuture<Reply> reply = new CompletableFuture<>();
        if (closed.get()) {
            reply.completeExceptionally(unreachable("Connection to " + serverName + " is closed", null));
            return reply;
        }
        execute(() -> issue(sessionId, clientId, method, params, callTimeout, reply), reply);
        return reply;
    }

    public void sendNotification(Envelope.Notification notification) {
        execute(() -> write(notification));
    }

    /**
     * Abandon the call a session made under {@code clientId}, telling the backend to stop.
     */
    public void cancel(String sessionId, JsonNode clientId, String reason) {
        execute(() -> {
            PendingCall call = table.find(sessionId, clientId);
            if (call == null) {
                LOGGER.debug("No call {} of session in flight on {}, cancellation dropped", clientId, serverName);
                return;
            }
            table.resolve(call.gatewayId());
            table.markReleased(call.gatewayId());
            call.completion().cancel(false);
            sendCancelled(call.gatewayId(), reason);
        });
    }

    /**
     * Drop every call of a closed session.
     */
    public void releaseSession(String sessionId) {
        execute(() -> {
            List<PendingCall> calls = table.releaseSession(sessionId);
            if (calls.isEmpty()) {
                return;
            }
            LOGGER.debug("Released {} calls of closed session on {}", calls.size(), serverName);
            GatewayException failure = new GatewayException(GatewayErrorKind.SESSION_CLOSED, "Session closed",
                    serverName);
            for (PendingCall call : calls) {
                call.completion().completeExceptionally(failure);
                sendCancelled(call.gatewayId(), "session closed");
            }
        });
    }

    public void close() {
        execute(() -> teardown(null));
    }

    public String serverName() {
        return serverName;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public BackendHandshakeState handshakeState() {
        return handshakeState;
    }

    /**
     * The backend's cached {@code InitializeResult}, or {@code null} before the handshake is done.
     */
    public JsonNode initializeResult() {
        return initializeResult;
    }

    /**
     * Number of calls in flight. Does not wait for the owner thread, so the count may trail it.
     */
    public int pendingCount() {
        return closed.get() ? 0 : table.size();
    }

    @Override
    public void onFrame(String frame) {
        execute(() -> handleFrame(frame));
    }

    @Override
    public void onClosed(Throwable cause) {
        execute(() -> teardown(cause));
    }

    private void issue(String sessionId, JsonNode clientId, String method, JsonNode params, Duration timeout,
            CompletableFuture<Reply> reply) {
        if (closed.get()) {
            reply.completeExceptionally(unreachable("Connection to " + serverName + " is closed", null));
            return;
        }
        long gatewayId = table.nextId();
        PendingCall call = new PendingCall(gatewayId, sessionId, clientId, method, clock.instant(),
                new CompletableFuture<>());
        try {
            table.register(call);
        } catch (IllegalStateException e) {
            reply.completeExceptionally(new GatewayException(GatewayErrorKind.INTERNAL, e.getMessage(), serverName, e));
            teardown(e);
            return;
        }
        call.completion().whenComplete((response, failure) -> {
            if (failure != null) {
                reply.completeExceptionally(failure);
            } else {
                reply.complete(new Reply(call, response));
            }
        });
        try {
            send(new Envelope.Request(LongNode.valueOf(gatewayId), method, params));
        } catch (IOException e) {
            table.resolve(gatewayId);
            call.completion().completeExceptionally(unreachable("Write to " + serverName + " failed", e));
            teardown(e);
            return;
        }
        ScheduledFuture<?> timeoutTask = timer.schedule(() -> execute(() -> expire(gatewayId, timeout)),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
        call.completion().whenComplete((response, failure) -> timeoutTask.cancel(false));
    }

    private void expire(long gatewayId, Duration timeout) {
        PendingCall call = table.resolve(gatewayId);
        if (call == null) {
            return;
        }
        table.markReleased(gatewayId);
        LOGGER.warn("Call {} ({}) on {} timed out after {}", gatewayId, call.method(), serverName, timeout);
        call.completion().completeExceptionally(new GatewayException(GatewayErrorKind.BACKEND_TIMEOUT,
                "Backend " + serverName + " did not answer " + call.method() + " within " + timeout, serverName));
        sendCancelled(gatewayId, "timeout");
    }

    private void handleFrame(String frame) {
        Wire.rx(serverName, frame);
        Envelope envelope;
        try {
            envelope = codec.decode(frame);
        } catch (DecodeException e) {
            LOGGER.warn("Dropping malformed frame from {}: {}", serverName, e.getMessage());
            return;
        }
        if (envelope instanceof Envelope.Response response) {
            resolve(response);
        } else if (envelope instanceof Envelope.Notification notification) {
            try {
                listener.onNotification(serverName, notification);
            } catch (RuntimeException e) {
                LOGGER.warn("Notification listener failed for {} from {}", notification.method(), serverName, e);
            }
        } else if (envelope instanceof Envelope.Request request) {
            answerBackendRequest(request);
        }
    }

    private void resolve(Envelope.Response response) {
        OptionalLong gatewayId = parseGatewayId(response.id());
        if (gatewayId.isEmpty()) {
            LOGGER.warn("Dropping response with foreign id {} from {}", response.id(), serverName);
            return;
        }
        PendingCall call = table.resolve(gatewayId.getAsLong());
        if (call == null) {
            if (table.wasReleased(gatewayId.getAsLong())) {
                LOGGER.debug("Discarding late response {} from {}", gatewayId.getAsLong(), serverName);
            } else {
                LOGGER.warn("Dropping unmatched response {} from {}", gatewayId.getAsLong(), serverName);
            }
            return;
        }
        call.completion().complete(response);
    }

    private void answerBackendRequest(Envelope.Request request) {
        if (McpSchema.METHOD_PING.equals(request.method())) {
            write(Envelope.Response.success(request.id(), JsonNodeFactory.instance.objectNode()));
            return;
        }
        LOGGER.debug("Refusing {} request from {}", request.method(), serverName);
        write(Envelope.Response.error(request.id(), McpSchema.ErrorCodes.METHOD_NOT_FOUND,
                "Method not supported through the gateway: " + request.method(), null));
    }

    private void sendCancelled(long gatewayId, String reason) {
        ObjectNode params = JsonNodeFactory.instance.objectNode();
        params.put("requestId", gatewayId);
        params.put("reason", reason);
        write(new Envelope.Notification(CANCELLED_NOTIFICATION, params));
    }

    private void write(Envelope envelope) {
        if (closed.get()) {
            return;
        }
        try {
            send(envelope);
        } catch (IOException e) {
            teardown(e);
        }
    }

    private void send(Envelope envelope) throws IOException {
        String frame = codec.encode(envelope);
        transport.send(frame);
        Wire.tx(serverName, frame);
    }

    private void teardown(Throwable cause) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (cause != null) {
            LOGGER.warn("Connection to {} lost: {}", serverName, cause.toString());
        } else {
            LOGGER.info("Connection to {} closed", serverName);
        }
        GatewayException failure = new GatewayException(GatewayErrorKind.BACKEND_UNAVAILABLE,
                "Backend " + serverName + " became unavailable", serverName, cause);
        List<PendingCall> orphaned = table.drain();
        for (PendingCall call : orphaned) {
            call.completion().completeExceptionally(failure);
        }
        if (!orphaned.isEmpty()) {
            LOGGER.warn("Failed {} in-flight calls on {}", orphaned.size(), serverName);
        }
        transport.close();
        try {
            listener.onClosed(this);
        } catch (RuntimeException e) {
            LOGGER.warn("Close listener failed for {}", serverName, e);
        }
        owner.shutdown();
    }

    private void execute(Runnable task) {
        try {
            owner.execute(task);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("Connection to {} already shut down, task dropped", serverName);
        }
    }

    private void execute(Runnable task, CompletableFuture<?> onRejected) {
        try {
            owner.execute(task);
        } catch (RejectedExecutionException e) {
            onRejected.completeExceptionally(unreachable("Connection to " + serverName + " is closed", e));
        }
    }

    private GatewayException unreachable(String message, Throwable cause) {
        return new GatewayException(GatewayErrorKind.BACKEND_UNREACHABLE, message, serverName, cause);
    }

    static OptionalLong parseGatewayId(JsonNode id) {
        if (id == null) {
            return OptionalLong.empty();
        }
        if (id.isIntegralNumber() && id.canConvertToLong()) {
            return OptionalLong.of(id.longValue());
        }
        if (id.isTextual() && !id.asText().isEmpty() && id.asText().chars().allMatch(Character::isDigit)) {
            try {
                return OptionalLong.of(Long.parseLong(id.asText()));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }
}
