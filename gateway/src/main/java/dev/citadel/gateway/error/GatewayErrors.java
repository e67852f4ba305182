package dev.citadel.gateway.error;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.citadel.transport.DecodeException;
import dev.citadel.transport.Envelope;

/**
 * Translation helpers between exceptions coming out of futures and the JSON-RPC error
 * envelopes sent to clients.
 */
public final class GatewayErrors {

	private GatewayErrors() {
	}

	/**
	 * Find the {@link GatewayException} behind an asynchronous failure, classifying anything
	 * else.
	 */
	public static GatewayException unwrap(Throwable failure) {
		Throwable current = failure;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		if (current instanceof GatewayException gatewayException) {
			return gatewayException;
		}
		if (current instanceof CancellationException) {
			return new GatewayException(GatewayErrorKind.REQUEST_CANCELLED, "Request cancelled");
		}
		if (current instanceof TimeoutException) {
			return new GatewayException(GatewayErrorKind.BACKEND_TIMEOUT, "Timed out waiting for backend", null,
					current);
		}
		return new GatewayException(GatewayErrorKind.INTERNAL, "Internal error: " + current.getMessage(), null,
				current);
	}

	/**
	 * Wrap for rethrowing from inside a future stage without losing the kind.
	 */
	public static CompletionException propagate(Throwable failure) {
		return new CompletionException(unwrap(failure));
	}

	public static GatewayException fromDecode(DecodeException e) {
		GatewayErrorKind kind = e.isParseFailure() ? GatewayErrorKind.MALFORMED : GatewayErrorKind.INVALID_REQUEST;
		return new GatewayException(kind, e.getMessage(), null, e);
	}

	public static Envelope.Response toResponse(JsonNode id, GatewayException e) {
		ObjectNode data = JsonNodeFactory.instance.objectNode();
		data.put("type", e.kind().type());
		if (e.server() != null) {
			data.put("server", e.server());
		}
		return Envelope.Response.error(id, e.kind().code(), e.getMessage(), data);
	}

}
