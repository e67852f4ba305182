package dev.citadel.gateway.session;

public enum TransportKind {
    HTTP,
    UNIX_SOCKET,
    WEBSOCKET
}
