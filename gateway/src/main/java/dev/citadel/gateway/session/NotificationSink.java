package dev.citadel.gateway.session;

import dev.citadel.transport.Envelope;

/**
 * Push channel towards a client. Only stream transports have one.
 */
@FunctionalInterface
public interface NotificationSink {

    void deliver(Envelope.Notification notification);
}
