package dev.citadel.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;
import java.util.Optional;

/**
 * One JSON-RPC unit travelling through the gateway. The payload members ({@code params},
 * {@code result}, {@code error}) are kept as Jackson trees so that routing never depends on
 * what a backend actually returns.
 */
public sealed interface Envelope permits Envelope.Request, Envelope.Response, Envelope.Notification {

    String JSONRPC_VERSION = "2.0";

    /**
     * Request carrying an id; {@code params} is {@code null} when the member was absent.
     */
    record Request(JsonNode id, String method, JsonNode params) implements Envelope {

        public Request {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(method, "method");
        }

        public Request withId(JsonNode newId) {
            return new Request(newId, method, params);
        }

        public Request withParams(JsonNode newParams) {
            return new Request(id, method, newParams);
        }

        /**
         * Text value of a top-level member of {@code params}, if present and non-blank.
         */
        public Optional<String> paramText(String name) {
            return Envelope.paramText(params, name);
        }
    }

    /**
     * Response carrying either {@code result} or {@code error}. A response to a request whose
     * id could not be determined uses {@link NullNode}.
     */
    record Response(JsonNode id, JsonNode result, JsonNode error) implements Envelope {

        public Response {
            id = id == null ? NullNode.getInstance() : id;
        }

        public static Response success(JsonNode id, JsonNode result) {
            return new Response(id, result == null ? NullNode.getInstance() : result, null);
        }

        public static Response error(JsonNode id, int code, String message, JsonNode data) {
            ObjectNode error = JsonNodeFactory.instance.objectNode();
            error.put("code", code);
            error.put("message", message);
            if (data != null && !data.isNull()) {
                error.set("data", data);
            }
            return new Response(id, null, error);
        }

        public boolean isError() {
            return error != null;
        }

        public Response withId(JsonNode newId) {
            return new Response(newId, result, error);
        }
    }

    /**
     * Message without an id; never answered.
     */
    record Notification(String method, JsonNode params) implements Envelope {

        public Notification {
            Objects.requireNonNull(method, "method");
        }

        public Notification withParams(JsonNode newParams) {
            return new Notification(method, newParams);
        }
    }

    private static Optional<String> paramText(JsonNode params, String name) {
        if (params == null || !params.isObject()) {
            return Optional.empty();
        }
        JsonNode value = params.get(name);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }
}
