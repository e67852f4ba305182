package dev.citadel.gateway.config;

import java.time.Duration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.ServerResponse;

import dev.citadel.gateway.backend.BackendRegistry;
import dev.citadel.gateway.routing.Router;
import dev.citadel.gateway.session.SessionManager;
import dev.citadel.gateway.web.HttpGatewayTransport;
import dev.citadel.transport.EnvelopeCodec;

/**
 * Exposes the HTTP transport through a functional Spring MVC endpoint unless
 * {@code gateway.http.enabled=false}.
 */
@Configuration
@ConditionalOnProperty(prefix = "gateway.http", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WebMvcTransportConfig {

	private static final Duration RESPONSE_GRACE = Duration.ofSeconds(5);

	@Bean
	public HttpGatewayTransport httpGatewayTransport(HttpTransportProperties httpProperties,
			GatewayProperties properties, Router router, SessionManager sessionManager,
			BackendRegistry backendRegistry, EnvelopeCodec envelopeCodec) {
		GatewayProperties.Backend backend = properties.getBackend();
		Duration responseTimeout = backend.getHandshakeTimeout().plus(backend.getCallTimeout()).plus(RESPONSE_GRACE);
		return new HttpGatewayTransport(httpProperties.getEndpoint(), httpProperties.isDisallowDelete(),
				httpProperties.getAllowedOrigins(), router, sessionManager, backendRegistry, envelopeCodec,
				responseTimeout);
	}

	@Bean
	public RouterFunction<ServerResponse> gatewayRouter(HttpGatewayTransport httpGatewayTransport) {
		return httpGatewayTransport.getRouterFunction();
	}

}
