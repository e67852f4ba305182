package dev.citadel.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Adds {@code params.server} to every request and notification leaving the bridge, so that a
 * client unaware of the gateway reaches the backend it was configured for. Lines that are not
 * JSON objects, and responses, pass through untouched.
 */
public final class ServerNameInjector {

    private final String serverName;
    private final ObjectMapper mapper;

    public ServerNameInjector(String serverName) {
        this(serverName, new ObjectMapper());
    }

    public ServerNameInjector(String serverName, ObjectMapper mapper) {
        this.serverName = serverName;
        this.mapper = mapper;
    }

    public String inject(String line) {
        JsonNode tree;
        try {
            tree = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            return line;
        }
        if (tree == null || !tree.isObject() || !tree.has("method")) {
            return line;
        }
        ObjectNode message = (ObjectNode) tree;
        JsonNode params = message.get("params");
        if (params == null || params.isNull()) {
            message.putObject("params").put("server", serverName);
        } else if (params.isObject()) {
            ((ObjectNode) params).put("server", serverName);
        } else {
            return line;
        }
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to re-encode message", e);
        }
    }

    public String serverName() {
        return serverName;
    }
}
