package com.presencebridge.connector;

/**
 * An inbound message referenced a client id that is not registered. The
 * transport always announces a client before its messages, so this indicates a
 * bug rather than a race.
 */
public class UnknownClientException extends IllegalStateException {

    private final long clientId;

    public UnknownClientException(long clientId) {
        super("inbound message from unregistered client " + clientId);
        this.clientId = clientId;
    }

    public long getClientId() {
        return clientId;
    }
}
