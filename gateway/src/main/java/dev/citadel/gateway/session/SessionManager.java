package dev.citadel.gateway.session;

import dev.citadel.gateway.error.GatewayErrorKind;
import dev.citadel.gateway.error.GatewayException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns every client session: creation, handshake ordering, lookup and idle eviction.
 */
public class SessionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

    private static final int TOKEN_BYTES = 32;

    private final Set<String> supportedVersions;
    private final Duration idleTimeout;
    private final Duration sweepInterval;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final List<Consumer<Session>> closeListeners = new CopyOnWriteArrayList<>();

    private ScheduledExecutorService sweeper;

    public SessionManager(Collection<String> supportedVersions, Duration idleTimeout, Duration sweepInterval,
            Clock clock) {
        if (supportedVersions.isEmpty()) {
            throw new IllegalArgumentException("At least one protocol version must be supported");
        }
        this.supportedVersions = new LinkedHashSet<>(supportedVersions);
        this.idleTimeout = idleTimeout;
        this.sweepInterval = sweepInterval;
        this.clock = clock;
    }

    public synchronized void start() {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-sweeper");
            t.setDaemon(true);
            return t;
        });
        long periodMillis = sweepInterval.toMillis();
        sweeper.scheduleAtFixedRate(this::sweep, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        LOGGER.info("Session sweeper started (idle timeout {}, interval {})", idleTimeout, sweepInterval);
    }

    public synchronized void stop() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
        for (String id : new ArrayList<>(sessions.keySet())) {
            close(id);
        }
        LOGGER.info("Session manager stopped");
    }

    private void sweep() {
        try {
            int evicted = evictIdle(idleTimeout);
            if (evicted > 0) {
                LOGGER.info("Evicted {} idle sessions, {} remain", evicted, sessions.size());
            }
        } catch (RuntimeException e) {
            LOGGER.error("Session sweep failed", e);
        }
    }

    /**
     * Register a new session in {@link SessionState#UNINITIALIZED}.
     *
     * @throws GatewayException {@code UNSUPPORTED_PROTOCOL_VERSION} when the version is not served
     */
    public Session createSession(ClientInfo clientInfo, String protocolVersion, String boundServer,
            TransportKind transport) {
        if (!isSupported(protocolVersion)) {
            throw new GatewayException(GatewayErrorKind.UNSUPPORTED_PROTOCOL_VERSION,
                    "Unsupported protocol version: " + protocolVersion + " (supported: " + supportedVersions + ")",
                    boundServer);
        }
        Session session;
        do {
            session = new Session(newToken(), protocolVersion, clientInfo, boundServer, transport, clock.instant());
        } while (sessions.putIfAbsent(session.id(), session) != null);
        LOGGER.info("Created {} for client {} {}", session, clientInfo.name(), clientInfo.version());
        return session;
    }

    public void markInitializeRelayed(Session session) {
        if (!session.advance(SessionState.UNINITIALIZED, SessionState.AWAITING_INITIALIZED_NOTIFICATION)) {
            throw new GatewayException(GatewayErrorKind.INVALID_REQUEST,
                    "Session is not awaiting an initialize result: " + session.state(), session.boundServer());
        }
    }

    /**
     * Handle {@code notifications/initialized}. Repeating it on an active session is a no-op.
     */
    public Session completeHandshake(String sessionId) {
        Session session = lookup(sessionId);
        if (session.advance(SessionState.AWAITING_INITIALIZED_NOTIFICATION, SessionState.ACTIVE)) {
            LOGGER.debug("Handshake complete for {}", session);
        } else if (session.state() == SessionState.UNINITIALIZED) {
            throw new GatewayException(GatewayErrorKind.HANDSHAKE_NOT_COMPLETE,
                    "initialized notification received before the initialize result", session.boundServer());
        } else if (session.state() == SessionState.CLOSED) {
            throw sessionNotFound(sessionId);
        }
        touch(session);
        return session;
    }

    public void requireActive(Session session) {
        SessionState state = session.state();
        if (state == SessionState.CLOSED) {
            throw sessionNotFound(session.id());
        }
        if (state != SessionState.ACTIVE) {
            throw new GatewayException(GatewayErrorKind.HANDSHAKE_NOT_COMPLETE,
                    "Session handshake not complete: send notifications/initialized first", session.boundServer());
        }
    }

    public Session lookup(String sessionId) {
        Session session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null || session.isClosed()) {
            throw sessionNotFound(sessionId);
        }
        return session;
    }

    public void touch(String sessionId) {
        touch(lookup(sessionId));
    }

    private void touch(Session session) {
        session.touch(clock.instant());
    }

    public boolean close(String sessionId) {
        Session session = sessions.remove(sessionId);
        if (session == null || !session.close()) {
            return false;
        }
        LOGGER.info("Closed {}", session);
        for (Consumer<Session> listener : closeListeners) {
            try {
                listener.accept(session);
            } catch (RuntimeException e) {
                LOGGER.warn("Session close listener failed for {}", session, e);
            }
        }
        session.closeHandler().ifPresent(handler -> {
            try {
                handler.run();
            } catch (RuntimeException e) {
                LOGGER.warn("Close handler failed for {}", session, e);
            }
        });
        return true;
    }

    /**
     * Close every session whose last activity is older than {@code maxIdle}.
     *
     * @return number of sessions evicted
     */
    public int evictIdle(Duration maxIdle) {
        Instant cutoff = clock.instant().minus(maxIdle);
        int evicted = 0;
        for (Session session : new ArrayList<>(sessions.values())) {
            if (session.lastActivity().isBefore(cutoff) && close(session.id())) {
                LOGGER.info("Evicted idle {}", session);
                evicted++;
            }
        }
        return evicted;
    }

    public List<Session> sessionsBoundTo(String serverName) {
        return sessions.values().stream()
            .filter(s -> s.boundServer().equals(serverName) && !s.isClosed())
            .collect(Collectors.toList());
    }

    public long count(TransportKind transport) {
        return sessions.values().stream().filter(s -> s.transport() == transport && !s.isClosed()).count();
    }

    public void addCloseListener(Consumer<Session> listener) {
        closeListeners.add(listener);
    }

    public boolean isSupported(String protocolVersion) {
        return protocolVersion != null && supportedVersions.contains(protocolVersion);
    }

    /**
     * The first configured version, used for the gateway's own backend handshakes.
     */
    public String preferredVersion() {
        return supportedVersions.iterator().next();
    }

    public int size() {
        return sessions.size();
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static GatewayException sessionNotFound(String sessionId) {
        return new GatewayException(GatewayErrorKind.SESSION_NOT_FOUND, "Session not found: " + sessionId);
    }
}
