package dev.citadel.gateway.backend;

import java.io.IOException;

/**
 * Opens the transport to a named backend.
 */
@FunctionalInterface
public interface BackendConnector {

    BackendTransport open(BackendDefinition definition) throws IOException;
}
