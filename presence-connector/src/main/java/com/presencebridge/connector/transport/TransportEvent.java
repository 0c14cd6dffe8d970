package com.presencebridge.connector.transport;

/**
 * Connection lifecycle and inbound traffic as seen by the transport listener.
 */
public sealed interface TransportEvent {

    long clientId();

    record Connected(long clientId, ClientHandle handle) implements TransportEvent {
    }

    record Disconnected(long clientId) implements TransportEvent {
    }

    record InboundMessage(long clientId, SocketMessage message) implements TransportEvent {
    }
}
