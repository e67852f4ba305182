package dev.citadel.gateway.metrics;

import dev.citadel.gateway.backend.BackendRegistry;
import dev.citadel.gateway.error.GatewayErrorKind;
import dev.citadel.gateway.session.Session;
import dev.citadel.gateway.session.SessionManager;
import dev.citadel.gateway.session.TransportKind;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Gateway meters, published through whatever {@link MeterRegistry} the application runs with
 * (Prometheus in production, a simple registry in tests).
 * <p>
 * Routed-message and error tags use the server name as configured, or {@code unknown} when a
 * failure happened before a server was resolved.
 */
public class GatewayMetrics {

    public static final String SESSIONS_CREATED = "citadel.sessions.created";
    public static final String SESSIONS_ACTIVE = "citadel.sessions.active";
    public static final String SESSION_DURATION = "citadel.sessions.duration";
    public static final String BACKENDS_CONNECTED = "citadel.backends.connected";
    public static final String MESSAGES_ROUTED = "citadel.messages.routed";
    public static final String ERRORS = "citadel.errors";

    static final String UNKNOWN = "unknown";

    private final MeterRegistry registry;
    private final Clock clock;

    public GatewayMetrics(MeterRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Register the gauges that read live state, and time sessions as they close.
     */
    public void bind(SessionManager sessions, BackendRegistry backends) {
        for (TransportKind transport : TransportKind.values()) {
            Gauge.builder(SESSIONS_ACTIVE, sessions, s -> s.count(transport))
                .tag("transport", tag(transport))
                .description("Sessions currently open")
                .register(registry);
        }
        Gauge.builder(BACKENDS_CONNECTED, backends, b -> b.liveConnections().size())
            .description("Backend servers with a live shared connection")
            .register(registry);
        sessions.addCloseListener(this::sessionClosed);
    }

    public void sessionCreated(TransportKind transport) {
        registry.counter(SESSIONS_CREATED, "transport", tag(transport)).increment();
    }

    private void sessionClosed(Session session) {
        Timer.builder(SESSION_DURATION)
            .tag("transport", tag(session.transport()))
            .description("Lifetime of closed sessions")
            .register(registry)
            .record(Duration.between(session.createdAt(), clock.instant()));
    }

    public Timer.Sample startCall() {
        return Timer.start(registry);
    }

    /**
     * Stop {@code sample} against the routed-message timer. {@code status} is {@code success},
     * {@code error} for a backend error response, or the gateway error type.
     */
    public void callCompleted(Timer.Sample sample, String server, String method, String status) {
        sample.stop(Timer.builder(MESSAGES_ROUTED)
            .tag("server", server == null ? UNKNOWN : server)
            .tag("method", method)
            .tag("status", status)
            .description("Requests forwarded to backends, by outcome")
            .register(registry));
    }

    public void error(GatewayErrorKind kind, String server) {
        registry.counter(ERRORS, "kind", kind.type(), "server", server == null ? UNKNOWN : server).increment();
    }

    private static String tag(TransportKind transport) {
        return transport.name().toLowerCase(Locale.ROOT);
    }
}
