package dev.citadel.gateway.session;

import java.time.Instant;
import java.util.Optional;

/**
 * One logical client conversation. Mutable state is only changed through
 * {@link SessionManager}; transports keep the reference or the id, never a copy.
 */
public final class Session {

    private final String id;
    private final String protocolVersion;
    private final ClientInfo clientInfo;
    private final String boundServer;
    private final TransportKind transport;
    private final Instant createdAt;

    private volatile SessionState state = SessionState.UNINITIALIZED;
    private volatile Instant lastActivity;
    private volatile NotificationSink notificationSink;
    private volatile Runnable closeHandler;

    Session(String id, String protocolVersion, ClientInfo clientInfo, String boundServer, TransportKind transport,
            Instant createdAt) {
        this.id = id;
        this.protocolVersion = protocolVersion;
        this.clientInfo = clientInfo;
        this.boundServer = boundServer;
        this.transport = transport;
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
    }

    public String id() {
        return id;
    }

    public String protocolVersion() {
        return protocolVersion;
    }

    public ClientInfo clientInfo() {
        return clientInfo;
    }

    public String boundServer() {
        return boundServer;
    }

    public TransportKind transport() {
        return transport;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public SessionState state() {
        return state;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public boolean isClosed() {
        return state == SessionState.CLOSED;
    }

    public Optional<NotificationSink> notificationSink() {
        return Optional.ofNullable(notificationSink);
    }

    public void attachNotificationSink(NotificationSink sink) {
        this.notificationSink = sink;
    }

    /**
     * Run {@code handler} once the session is closed by anyone other than its own transport,
     * for example the idle sweeper.
     */
    public void attachCloseHandler(Runnable handler) {
        this.closeHandler = handler;
    }

    Optional<Runnable> closeHandler() {
        return Optional.ofNullable(closeHandler);
    }

    synchronized boolean advance(SessionState expected, SessionState next) {
        if (state != expected) {
            return false;
        }
        state = next;
        return true;
    }

    synchronized boolean close() {
        if (state == SessionState.CLOSED) {
            return false;
        }
        state = SessionState.CLOSED;
        notificationSink = null;
        return true;
    }

    void touch(Instant now) {
        lastActivity = now;
    }

    @Override
    public String toString() {
        return "Session[" + id.substring(0, Math.min(8, id.length())) + ", server=" + boundServer + ", state=" + state
                + ", transport=" + transport + "]";
    }
}
