package dev.citadel.gateway.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.citadel.gateway.routing.Router;
import dev.citadel.gateway.session.SessionManager;
import dev.citadel.gateway.transport.UnixSocketServer;
import dev.citadel.transport.EnvelopeCodec;

/**
 * Starts the Unix domain socket listener unless {@code gateway.unix-socket.enabled=false}.
 */
@Configuration
@ConditionalOnProperty(prefix = "gateway.unix-socket", name = "enabled", havingValue = "true",
		matchIfMissing = true)
public class UnixSocketTransportConfig {

	@Bean(initMethod = "start", destroyMethod = "stop")
	public UnixSocketServer unixSocketServer(UnixSocketProperties properties, Router router,
			SessionManager sessionManager, EnvelopeCodec envelopeCodec) {
		return new UnixSocketServer(properties.getPath(), router, sessionManager, envelopeCodec);
	}

}
