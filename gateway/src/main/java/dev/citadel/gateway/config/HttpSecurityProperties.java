package dev.citadel.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Optional HTTP Basic credentials guarding the HTTP and WebSocket endpoints.
 */
@ConfigurationProperties("gateway.http.security")
public record HttpSecurityProperties(boolean enabled, String username, String password) {

	public HttpSecurityProperties {
		username = username == null || username.isBlank() ? "mcp" : username;
		password = password == null || password.isBlank() ? "change-me" : password;
	}

}
