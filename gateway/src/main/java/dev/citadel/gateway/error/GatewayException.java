package dev.citadel.gateway.error;

import java.util.Objects;

import org.springframework.lang.Nullable;

/**
 * Request-scoped gateway failure. Never fatal to the process; at worst it tears down the one
 * backend connection it concerns.
 */
public class GatewayException extends RuntimeException {

	private final GatewayErrorKind kind;

	@Nullable
	private final String server;

	public GatewayException(GatewayErrorKind kind, String message) {
		this(kind, message, null, null);
	}

	public GatewayException(GatewayErrorKind kind, String message, @Nullable String server) {
		this(kind, message, server, null);
	}

	public GatewayException(GatewayErrorKind kind, String message, @Nullable String server,
			@Nullable Throwable cause) {
		super(message, cause);
		this.kind = Objects.requireNonNull(kind, "kind");
		this.server = server;
	}

	public GatewayErrorKind kind() {
		return this.kind;
	}

	@Nullable
	public String server() {
		return this.server;
	}

}
