package dev.citadel.gateway.backend;

/**
 * Progress of the gateway's own initialize exchange with a backend. Runs once per connection,
 * however many sessions share it.
 */
public enum BackendHandshakeState {
    NOT_STARTED,
    IN_FLIGHT,
    DONE
}
