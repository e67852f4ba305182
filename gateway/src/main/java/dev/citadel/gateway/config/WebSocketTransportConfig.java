package dev.citadel.gateway.config;

import java.util.concurrent.Executor;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import lombok.RequiredArgsConstructor;

import dev.citadel.gateway.routing.Router;
import dev.citadel.gateway.session.SessionManager;
import dev.citadel.gateway.web.WebSocketGatewayHandler;
import dev.citadel.transport.EnvelopeCodec;

/**
 * Declares and registers the WebSocket transport when {@code gateway.websocket.enabled=true}.
 */
@Configuration
@EnableWebSocket
@ConditionalOnProperty(prefix = "gateway.websocket", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
public class WebSocketTransportConfig implements WebSocketConfigurer {

	private final WebSocketProperties properties;

	private final Router router;

	private final SessionManager sessionManager;

	private final EnvelopeCodec envelopeCodec;

	private final Executor clientWriteExecutor;

	@Bean
	public WebSocketGatewayHandler webSocketGatewayHandler() {
		return new WebSocketGatewayHandler(this.router, this.sessionManager, this.envelopeCodec,
				this.clientWriteExecutor);
	}

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		registry.addHandler(webSocketGatewayHandler(), this.properties.getEndpoint())
			.setAllowedOriginPatterns(this.properties.getAllowedOriginPatterns().toArray(String[]::new));
	}

}
