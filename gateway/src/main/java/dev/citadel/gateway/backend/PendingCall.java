package dev.citadel.gateway.backend;

import com.fasterxml.jackson.databind.JsonNode;
import dev.citadel.transport.Envelope;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Correlation record for one forwarded call: which session and client id the backend's reply to
 * {@code gatewayId} belongs to.
 */
public record PendingCall(long gatewayId, String sessionId, JsonNode clientId, String method, Instant issuedAt,
        CompletableFuture<Envelope.Response> completion) {
}
