package dev.citadel.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raised when a frame is not a well-formed JSON-RPC 2.0 envelope. {@link #isParseFailure()}
 * distinguishes text that is not JSON at all from JSON with the wrong shape; {@link #id()}
 * carries the offending message's id when one could be read, so the error reply can be
 * correlated.
 */
public class DecodeException extends Exception {

    private final boolean parseFailure;

    private final transient JsonNode id;

    public DecodeException(String message, boolean parseFailure, JsonNode id) {
        super(message);
        this.parseFailure = parseFailure;
        this.id = id;
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
        this.parseFailure = true;
        this.id = null;
    }

    public boolean isParseFailure() {
        return parseFailure;
    }

    public JsonNode id() {
        return id;
    }
}
