package dev.citadel.gateway.routing;

import io.modelcontextprotocol.spec.McpSchema;

/**
 * How the gateway treats a client method. Everything not listed is forwarded untouched.
 */
public enum MethodKind {

    INITIALIZE,
    INITIALIZED_NOTIFICATION,
    CANCELLED_NOTIFICATION,
    FORWARD;

    public static final String CANCELLED_METHOD = "notifications/cancelled";

    public static MethodKind of(String method) {
        if (McpSchema.METHOD_INITIALIZE.equals(method)) {
            return INITIALIZE;
        }
        if (McpSchema.METHOD_NOTIFICATION_INITIALIZED.equals(method)) {
            return INITIALIZED_NOTIFICATION;
        }
        if (CANCELLED_METHOD.equals(method)) {
            return CANCELLED_NOTIFICATION;
        }
        return FORWARD;
    }
}
