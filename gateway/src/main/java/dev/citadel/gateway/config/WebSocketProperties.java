package dev.citadel.gateway.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * WebSocket transport settings. The transport is off unless {@code gateway.websocket.enabled}
 * is set.
 */
@ConfigurationProperties(prefix = "gateway.websocket")
public class WebSocketProperties {

	private boolean enabled = false;

	private String endpoint = "/ws";

	/**
	 * Origin patterns accepted during the handshake. Clients sending no {@code Origin} header
	 * are not affected.
	 */
	private List<String> allowedOriginPatterns = new ArrayList<>(
			List.of("http://localhost:*", "http://127.0.0.1:*"));

	public boolean isEnabled() {
		return enabled;
	}

	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}

	public String getEndpoint() {
		return endpoint;
	}

	public void setEndpoint(String endpoint) {
		this.endpoint = endpoint;
	}

	public List<String> getAllowedOriginPatterns() {
		return allowedOriginPatterns;
	}

	public void setAllowedOriginPatterns(List<String> allowedOriginPatterns) {
		this.allowedOriginPatterns = allowedOriginPatterns;
	}

}
