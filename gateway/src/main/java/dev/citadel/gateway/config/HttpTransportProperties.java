package dev.citadel.gateway.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties of the HTTP transport: the endpoint path, the DELETE policy and the
 * origins allowed to call it.
 */
@ConfigurationProperties(prefix = "gateway.http")
public class HttpTransportProperties {

	/**
	 * Whether the HTTP endpoint is exposed at all.
	 */
	private boolean enabled = true;

	/**
	 * HTTP endpoint path that the gateway binds to. Defaults to {@code /mcp}.
	 */
	private String endpoint = "/mcp";

	/**
	 * Flag indicating whether HTTP DELETE requests closing a session should be rejected.
	 */
	private boolean disallowDelete = false;

	/**
	 * Host names accepted in an {@code Origin} header. Requests without the header are always
	 * accepted; the literal {@code null} origin is matched by the entry {@code "null"}.
	 */
	private List<String> allowedOrigins = new ArrayList<>(List.of("localhost", "127.0.0.1", "null"));

	/**
	 * Determine whether the HTTP endpoint is registered.
	 * @return {@code true} when the endpoint is exposed
	 */
	public boolean isEnabled() {
		return enabled;
	}

	/**
	 * Enable or disable the HTTP endpoint.
	 * @param enabled {@code false} to serve stream transports only
	 */
	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}

	/**
	 * Retrieve the configured endpoint path.
	 * @return the HTTP endpoint that exposes the gateway
	 */
	public String getEndpoint() {
		return endpoint;
	}

	/**
	 * Update the endpoint path used by the transport.
	 * @param endpoint the new HTTP endpoint path
	 */
	public void setEndpoint(String endpoint) {
		this.endpoint = endpoint;
	}

	/**
	 * Determine whether DELETE requests against the endpoint are rejected.
	 * @return {@code true} when DELETE requests should be rejected
	 */
	public boolean isDisallowDelete() {
		return disallowDelete;
	}

	/**
	 * Enable or disable HTTP DELETE handling.
	 * @param disallowDelete {@code true} to block DELETE requests
	 */
	public void setDisallowDelete(boolean disallowDelete) {
		this.disallowDelete = disallowDelete;
	}

	/**
	 * Retrieve the accepted origin hosts.
	 * @return host names accepted in the {@code Origin} header
	 */
	public List<String> getAllowedOrigins() {
		return allowedOrigins;
	}

	/**
	 * Replace the accepted origin hosts.
	 * @param allowedOrigins host names accepted in the {@code Origin} header
	 */
	public void setAllowedOrigins(List<String> allowedOrigins) {
		this.allowedOrigins = allowedOrigins;
	}

}
