package dev.citadel.gateway.error;

import java.util.Locale;

import io.modelcontextprotocol.spec.McpSchema.ErrorCodes;

/**
 * Failure categories surfaced to clients. Each kind fixes the JSON-RPC error code and the HTTP
 * status used by the HTTP transport; stream transports only use the code.
 */
public enum GatewayErrorKind {

	MALFORMED(ErrorCodes.PARSE_ERROR, 400),

	INVALID_REQUEST(ErrorCodes.INVALID_REQUEST, 400),

	MISSING_SERVER_PARAMETER(ErrorCodes.INVALID_PARAMS, 400),

	SERVER_NOT_FOUND(-32001, 200),

	UNSUPPORTED_PROTOCOL_VERSION(ErrorCodes.INVALID_PARAMS, 400),

	HANDSHAKE_NOT_COMPLETE(ErrorCodes.INVALID_REQUEST, 400),

	ALREADY_INITIALIZED(ErrorCodes.INVALID_REQUEST, 400),

	INVALID_SERVER_BINDING(ErrorCodes.INVALID_PARAMS, 400),

	MISSING_SESSION_ID(ErrorCodes.INVALID_REQUEST, 400),

	SESSION_NOT_FOUND(-32004, 404),

	BACKEND_UNREACHABLE(-32005, 200),

	BACKEND_HANDSHAKE_FAILED(-32006, 200),

	BACKEND_TIMEOUT(-32002, 200),

	BACKEND_UNAVAILABLE(-32003, 200),

	SESSION_CLOSED(-32000, 200),

	REQUEST_CANCELLED(-32800, 200),

	INTERNAL(ErrorCodes.INTERNAL_ERROR, 500);

	private final int code;

	private final int httpStatus;

	GatewayErrorKind(int code, int httpStatus) {
		this.code = code;
		this.httpStatus = httpStatus;
	}

	public int code() {
		return this.code;
	}

	public int httpStatus() {
		return this.httpStatus;
	}

	/**
	 * Stable lower-case identifier placed in the {@code data.type} member of error responses.
	 */
	public String type() {
		return name().toLowerCase(Locale.ROOT);
	}

}
