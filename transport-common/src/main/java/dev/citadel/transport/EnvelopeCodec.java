package dev.citadel.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;

/**
 * Converts between raw JSON text and {@link Envelope}s. Stateless and safe to share.
 */
public final class EnvelopeCodec {

    private final ObjectMapper mapper;
    private final ObjectReader reader;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
        this.reader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public Envelope decode(byte[] bytes) throws DecodeException {
        return decode(new String(bytes, StandardCharsets.UTF_8));
    }

    public Envelope decode(String text) throws DecodeException {
        JsonNode tree;
        try {
            tree = reader.readTree(text);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (tree == null || tree.isMissingNode()) {
            throw new DecodeException("Empty message", true, null);
        }
        return fromTree(tree);
    }

    public Envelope fromTree(JsonNode tree) throws DecodeException {
        if (!tree.isObject()) {
            throw new DecodeException("JSON-RPC message must be an object", false, null);
        }
        JsonNode id = tree.get("id");
        if (id != null && !(id.isTextual() || id.isNumber() || id.isNull())) {
            throw new DecodeException("id must be a string, number or null", false, null);
        }
        JsonNode version = tree.get("jsonrpc");
        if (version == null || !version.isTextual() || !Envelope.JSONRPC_VERSION.equals(version.asText())) {
            throw new DecodeException("jsonrpc member must be \"2.0\"", false, id);
        }
        JsonNode method = tree.get("method");
        if (method != null) {
            if (!method.isTextual() || method.asText().isEmpty()) {
                throw new DecodeException("method must be a non-empty string", false, id);
            }
            JsonNode params = tree.get("params");
            if (id == null) {
                return new Envelope.Notification(method.asText(), params);
            }
            return new Envelope.Request(id, method.asText(), params);
        }
        if (id == null) {
            throw new DecodeException("Message has neither method nor id", false, null);
        }
        JsonNode result = tree.get("result");
        JsonNode error = tree.get("error");
        if ((result == null) == (error == null)) {
            throw new DecodeException("Response must carry exactly one of result or error", false, id);
        }
        if (error != null && !error.isObject()) {
            throw new DecodeException("error member must be an object", false, id);
        }
        return new Envelope.Response(id, result, error);
    }

    public ObjectNode toTree(Envelope envelope) {
        ObjectNode node = mapper.createObjectNode();
        node.put("jsonrpc", Envelope.JSONRPC_VERSION);
        if (envelope instanceof Envelope.Request request) {
            node.set("id", request.id());
            node.put("method", request.method());
            if (request.params() != null) {
                node.set("params", request.params());
            }
        } else if (envelope instanceof Envelope.Response response) {
            node.set("id", response.id());
            if (response.isError()) {
                node.set("error", response.error());
            } else {
                node.set("result", response.result());
            }
        } else if (envelope instanceof Envelope.Notification notification) {
            node.put("method", notification.method());
            if (notification.params() != null) {
                node.set("params", notification.params());
            }
        }
        return node;
    }

    public String encode(Envelope envelope) {
        try {
            return mapper.writeValueAsString(toTree(envelope));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode envelope", e);
        }
    }

    public byte[] encodeBytes(Envelope envelope) {
        return encode(envelope).getBytes(StandardCharsets.UTF_8);
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
