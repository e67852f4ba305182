package dev.citadel.gateway.session;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Name and version a client announced in {@code initialize}. Informational only.
 */
public record ClientInfo(String name, String version) {

    public static final ClientInfo UNKNOWN = new ClientInfo("unknown", "unknown");

    public static ClientInfo from(JsonNode node) {
        if (node == null || !node.isObject()) {
            return UNKNOWN;
        }
        return new ClientInfo(node.path("name").asText("unknown"), node.path("version").asText("unknown"));
    }
}
