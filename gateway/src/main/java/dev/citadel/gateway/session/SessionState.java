package dev.citadel.gateway.session;

/**
 * Handshake progression of a client session.
 *
 * <pre>
 *   UNINITIALIZED
 *      |  initialize result relayed
 *      v
 *   AWAITING_INITIALIZED_NOTIFICATION
 *      |  notifications/initialized
 *      v
 *   ACTIVE
 *      |
 *      v
 *   CLOSED   (also reachable from any state)
 * </pre>
 */
public enum SessionState {
    UNINITIALIZED,
    AWAITING_INITIALIZED_NOTIFICATION,
    ACTIVE,
    CLOSED
}
