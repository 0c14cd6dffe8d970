package com.presencebridge.connector.transport;

/**
 * Send side of one connected client.
 *
 * <p>
 * Implementations must not block on a slow peer and must treat a send to a
 * closed connection as a no-op.
 */
public interface ClientHandle {

    long getClientId();

    void send(SocketMessage message);

    default void sendText(String text) {
        send(SocketMessage.text(text));
    }

    boolean isOpen();
}
