package com.presencebridge.connector.transport;

/**
 * The WebSocket listener could not bind its address, typically because the
 * port is already in use. Not retried.
 */
public class TransportBindException extends RuntimeException {

    private final String host;
    private final int port;

    public TransportBindException(String host, int port, Throwable cause) {
        super("failed to bind " + host + ":" + port + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.host = host;
        this.port = port;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }
}
