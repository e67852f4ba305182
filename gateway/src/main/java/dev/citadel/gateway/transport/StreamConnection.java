package dev.citadel.gateway.transport;

import com.fasterxml.jackson.databind.JsonNode;
import dev.citadel.gateway.error.GatewayErrorKind;
import dev.citadel.gateway.error.GatewayErrors;
import dev.citadel.gateway.error.GatewayException;
import dev.citadel.gateway.routing.MethodKind;
import dev.citadel.gateway.routing.Router;
import dev.citadel.gateway.session.Session;
import dev.citadel.gateway.session.SessionManager;
import dev.citadel.gateway.session.TransportKind;
import dev.citadel.transport.DecodeException;
import dev.citadel.transport.Envelope;
import dev.citadel.transport.EnvelopeCodec;
import dev.citadel.transport.Wire;
import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Protocol side of a persistent client connection (Unix socket or WebSocket): one session per
 * connection, created by its {@code initialize} and closed with the connection.
 * <p>
 * Frames arrive on a single reader thread. Outbound frames are queued and written in order by
 * one drain task at a time on the writer executor, so completing a call never blocks on the
 * client. A client that lets {@value #MAX_QUEUED_FRAMES} frames pile up is disconnected.
 */
public class StreamConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamConnection.class);

    static final int MAX_QUEUED_FRAMES = 1024;

    private final String connectionId;
    private final TransportKind transport;
    private final Router router;
    private final SessionManager sessions;
    private final EnvelopeCodec codec;
    private final FrameSink sink;
    private final Executor writer;
    private final BlockingQueue<String> outbound;
    private final AtomicBoolean draining = new AtomicBoolean();

    private Session session;
    private boolean initializing;
    private boolean closed;

    public StreamConnection(String connectionId, TransportKind transport, Router router, SessionManager sessions,
            EnvelopeCodec codec, FrameSink sink, Executor writer) {
        this(connectionId, transport, router, sessions, codec, sink, writer, MAX_QUEUED_FRAMES);
    }

    StreamConnection(String connectionId, TransportKind transport, Router router, SessionManager sessions,
            EnvelopeCodec codec, FrameSink sink, Executor writer, int maxQueuedFrames) {
        this.connectionId = connectionId;
        this.transport = transport;
        this.router = router;
        this.sessions = sessions;
        this.codec = codec;
        this.sink = sink;
        this.writer = writer;
        this.outbound = new LinkedBlockingQueue<>(maxQueuedFrames);
    }

    public void onFrame(String frame) {
        Wire.rx(connectionId, frame);
        Envelope envelope;
        try {
            envelope = codec.decode(frame);
        } catch (DecodeException e) {
            LOGGER.debug("Malformed frame on {}: {}", connectionId, e.getMessage());
            replyFailure(e.id(), GatewayErrors.fromDecode(e));
            return;
        }
        if (envelope instanceof Envelope.Request request) {
            onRequest(request);
        } else if (envelope instanceof Envelope.Notification notification) {
            onNotification(notification);
        } else if (envelope instanceof Envelope.Response response) {
            LOGGER.debug("Ignoring client response {} on {}", response.id(), connectionId);
        }
    }

    private void onRequest(Envelope.Request request) {
        if (MethodKind.of(request.method()) == MethodKind.INITIALIZE) {
            initialize(request);
            return;
        }
        Session current = currentSession();
        if (current == null) {
            replyFailure(request.id(), new GatewayException(GatewayErrorKind.HANDSHAKE_NOT_COMPLETE,
                    "Send initialize before " + request.method()));
            return;
        }
        router.dispatch(current, request).whenComplete((response, failure) -> {
            if (failure != null) {
                replyFailure(request.id(), failure);
            } else {
                reply(response);
            }
        });
    }

    private void initialize(Envelope.Request request) {
        synchronized (this) {
            if (session != null || initializing) {
                String server = session == null ? null : session.boundServer();
                replyFailure(request.id(), new GatewayException(GatewayErrorKind.ALREADY_INITIALIZED,
                        "Connection already has a session", server));
                return;
            }
            initializing = true;
        }
        router.initialize(request, transport).whenComplete((initialized, failure) -> {
            if (failure != null) {
                synchronized (this) {
                    initializing = false;
                }
                replyFailure(request.id(), failure);
                return;
            }
            Session created = initialized.session();
            synchronized (this) {
                initializing = false;
                if (closed) {
                    sessions.close(created.id());
                    return;
                }
                created.attachNotificationSink(this::push);
                created.attachCloseHandler(this::sessionEnded);
                session = created;
            }
            LOGGER.info("Connection {} bound to {}", connectionId, created);
            reply(initialized.response());
        });
    }

    private void onNotification(Envelope.Notification notification) {
        Session current = currentSession();
        if (current == null) {
            LOGGER.warn("Dropping {} received before initialize on {}", notification.method(), connectionId);
            return;
        }
        try {
            router.notify(current, notification);
        } catch (GatewayException e) {
            router.metrics().error(e.kind(), e.server());
            LOGGER.warn("Rejected {} on {}: {}", notification.method(), connectionId, e.getMessage());
        }
    }

    private void push(Envelope.Notification notification) {
        write(codec.encode(notification));
    }

    private void replyFailure(JsonNode id, Throwable failure) {
        GatewayException error = GatewayErrors.unwrap(failure);
        router.metrics().error(error.kind(), error.server());
        if (error.kind() == GatewayErrorKind.REQUEST_CANCELLED) {
            LOGGER.debug("Request {} on {} was cancelled, no reply", id, connectionId);
            return;
        }
        if (error.kind() == GatewayErrorKind.SESSION_CLOSED && isClosed()) {
            return;
        }
        if (error.kind() == GatewayErrorKind.INTERNAL) {
            LOGGER.error("Request {} on {} failed", id, connectionId, error);
        }
        reply(GatewayErrors.toResponse(id, error));
    }

    private void reply(Envelope.Response response) {
        write(codec.encode(response));
    }

    private void write(String frame) {
        if (!outbound.offer(frame)) {
            LOGGER.warn("Client on {} stopped reading with {} frames queued, disconnecting", connectionId,
                    outbound.size());
            outbound.clear();
            sink.close();
            return;
        }
        if (draining.compareAndSet(false, true)) {
            try {
                writer.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                LOGGER.debug("Writer for {} is shut down, dropping output", connectionId);
            }
        }
    }

    private void drain() {
        do {
            String frame;
            while ((frame = outbound.poll()) != null) {
                try {
                    sink.send(frame);
                    Wire.tx(connectionId, frame);
                } catch (IOException e) {
                    LOGGER.debug("Could not write to {}: {}", connectionId, e.getMessage());
                }
            }
            draining.set(false);
        } while (!outbound.isEmpty() && draining.compareAndSet(false, true));
    }

    // The session ended while the connection is still up, e.g. idle eviction.
    private void sessionEnded() {
        if (isClosed()) {
            return;
        }
        LOGGER.info("Session of {} ended, closing the connection", connectionId);
        sink.close();
    }

    /**
     * The peer went away; its session goes with it.
     */
    public void onClosed() {
        Session current;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            current = session;
        }
        if (current != null) {
            sessions.close(current.id());
        }
        LOGGER.info("Connection {} closed", connectionId);
    }

    public synchronized Session currentSession() {
        return session;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public String connectionId() {
        return connectionId;
    }
}
