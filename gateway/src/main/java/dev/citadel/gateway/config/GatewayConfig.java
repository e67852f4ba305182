package dev.citadel.gateway.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.citadel.gateway.backend.BackendConnector;
import dev.citadel.gateway.backend.BackendRegistry;
import dev.citadel.gateway.backend.ProcessBackendConnector;
import dev.citadel.gateway.metrics.GatewayMetrics;
import dev.citadel.gateway.routing.Router;
import dev.citadel.gateway.session.SessionManager;
import dev.citadel.transport.EnvelopeCodec;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Spring configuration class that assembles the gateway core: sessions, the backend registry
 * and the router shared by every transport.
 */
@Configuration
@EnableConfigurationProperties({ GatewayProperties.class, HttpTransportProperties.class,
		UnixSocketProperties.class, WebSocketProperties.class })
public class GatewayConfig {

	private static final Logger logger = LoggerFactory.getLogger(GatewayConfig.class);

	@Bean
	public Clock gatewayClock() {
		return Clock.systemUTC();
	}

	@Bean
	public EnvelopeCodec envelopeCodec(ObjectMapper objectMapper) {
		return new EnvelopeCodec(objectMapper);
	}

	@Bean(initMethod = "start", destroyMethod = "stop")
	public SessionManager sessionManager(GatewayProperties properties, Clock gatewayClock) {
		return new SessionManager(properties.getSupportedProtocolVersions(), properties.getSession().getIdleTimeout(),
				properties.getSession().getSweepInterval(), gatewayClock);
	}

	@Bean(destroyMethod = "shutdownNow")
	public ScheduledExecutorService backendTimeoutScheduler() {
		return Executors.newSingleThreadScheduledExecutor(daemonThreads("backend-timeout"));
	}

	@Bean(destroyMethod = "shutdownNow")
	public ExecutorService backendConnectExecutor() {
		return Executors.newCachedThreadPool(daemonThreads("backend-connect"));
	}

	/**
	 * Drains queued frames to stream clients (WebSocket). A client that stops reading only ties
	 * up its own drain task.
	 */
	@Bean(destroyMethod = "shutdownNow")
	public ExecutorService clientWriteExecutor() {
		return Executors.newCachedThreadPool(daemonThreads("client-write"));
	}

	@Bean
	public BackendConnector backendConnector(GatewayProperties properties) {
		return new ProcessBackendConnector(properties.getBackend().getStartupGrace());
	}

	/**
	 * Build the registry of configured backends. Nothing is launched until a session asks for
	 * a server.
	 * @param properties gateway settings holding the server table and backend timeouts
	 * @return registry shared by every transport
	 */
	@Bean(destroyMethod = "stop")
	public BackendRegistry backendRegistry(GatewayProperties properties, BackendConnector backendConnector,
			EnvelopeCodec envelopeCodec, ScheduledExecutorService backendTimeoutScheduler,
			ExecutorService backendConnectExecutor, Clock gatewayClock) {
		GatewayProperties.Backend backend = properties.getBackend();
		BackendRegistry registry = new BackendRegistry(properties.backendDefinitions(), backendConnector,
				envelopeCodec, backendTimeoutScheduler, backendConnectExecutor, backend.getHandshakeTimeout(),
				backend.getCallTimeout(), initializeParams(properties, envelopeCodec.mapper()), gatewayClock);
		logger.info("Configured backends: {}", registry.serverNames());
		return registry;
	}

	@Bean
	public GatewayMetrics gatewayMetrics(MeterRegistry meterRegistry, Clock gatewayClock) {
		return new GatewayMetrics(meterRegistry, gatewayClock);
	}

	@Bean
	public Router router(SessionManager sessionManager, BackendRegistry backendRegistry,
			GatewayProperties properties, GatewayMetrics gatewayMetrics) {
		return new Router(sessionManager, backendRegistry, properties.getBackend().getNotificationPolicy(),
				gatewayMetrics);
	}

	private static ObjectNode initializeParams(GatewayProperties properties, ObjectMapper mapper) {
		GatewayProperties.Backend backend = properties.getBackend();
		McpSchema.InitializeRequest request = new McpSchema.InitializeRequest(
				properties.getSupportedProtocolVersions().get(0), McpSchema.ClientCapabilities.builder().build(),
				new McpSchema.Implementation(backend.getClientName(), backend.getClientVersion()));
		return mapper.valueToTree(request);
	}

	private static ThreadFactory daemonThreads(String prefix) {
		AtomicInteger counter = new AtomicInteger();
		return r -> {
			Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
			t.setDaemon(true);
			return t;
		};
	}

}
