package dev.citadel.gateway;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.citadel.gateway.backend.BackendConnector;
import dev.citadel.gateway.backend.BackendDefinition;
import dev.citadel.gateway.backend.BackendRegistry;
import dev.citadel.gateway.session.SessionManager;
import dev.citadel.transport.EnvelopeCodec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.BooleanSupplier;

public final class GatewayFixtures {

    public static final List<String> VERSIONS = List.of("2025-06-18", "2025-03-26", "2024-11-05");

    private GatewayFixtures() {
    }

    public static SessionManager sessions(Clock clock) {
        return new SessionManager(VERSIONS, Duration.ofHours(1), Duration.ofMinutes(1), clock);
    }

    public static BackendRegistry registry(BackendConnector connector, ScheduledExecutorService timer,
            Duration callTimeout, String... servers) {
        Map<String, BackendDefinition> definitions = new LinkedHashMap<>();
        for (String server : servers) {
            definitions.put(server, BackendDefinition.of(server, "fake-" + server));
        }
        return new BackendRegistry(definitions, connector, new EnvelopeCodec(), timer,
                Executors.newCachedThreadPool(), Duration.ofSeconds(5), callTimeout, initializeParams(),
                Clock.systemUTC());
    }

    public static ObjectNode initializeParams() {
        ObjectNode params = JsonNodeFactory.instance.objectNode();
        params.put("protocolVersion", VERSIONS.get(0));
        params.putObject("capabilities");
        params.putObject("clientInfo").put("name", "mcp-citadel").put("version", "test");
        return params;
    }

    /**
     * Client {@code initialize} params for {@code server}.
     */
    public static ObjectNode clientInitialize(String server, String version) {
        ObjectNode params = JsonNodeFactory.instance.objectNode();
        if (server != null) {
            params.put("server", server);
        }
        if (version != null) {
            params.put("protocolVersion", version);
        }
        params.putObject("capabilities");
        params.putObject("clientInfo").put("name", "inspector").put("version", "0.9");
        return params;
    }

    public static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    /**
     * Clock the test moves by hand.
     */
    public static final class MutableClock extends Clock {

        private volatile Instant now = Instant.parse("2025-01-01T00:00:00Z");

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
