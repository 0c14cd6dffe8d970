package com.presencebridge.connector;

import lombok.Builder;
import lombok.Getter;

/**
 * Startup options of the connector and its listener.
 */
@Getter
@Builder
public class ConnectorSettings {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 1337;
    public static final String DEFAULT_WELCOME_PAYLOAD = "{\"activity\":null,\"pid\":0,\"socketId\":\"0\"}";

    @Builder.Default
    private final String host = DEFAULT_HOST;

    @Builder.Default
    private final int port = DEFAULT_PORT;

    /** Sent verbatim to each client right after it connects. */
    @Builder.Default
    private final String welcomePayload = DEFAULT_WELCOME_PAYLOAD;

    /**
     * Fail fast instead of logging when an inbound message names a client the
     * registry does not know.
     */
    @Builder.Default
    private final boolean strictInvariants = false;

    public static ConnectorSettings defaults() {
        return ConnectorSettings.builder().build();
    }
}
