package com.presencebridge.connector.transport;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One WebSocket data frame, text or binary.
 */
public final class SocketMessage {

    private final String text;
    private final byte[] binary;

    private SocketMessage(String text, byte[] binary) {
        this.text = text;
        this.binary = binary;
    }

    public static SocketMessage text(String text) {
        return new SocketMessage(Objects.requireNonNull(text, "text"), null);
    }

    public static SocketMessage binary(byte[] data) {
        return new SocketMessage(null, Objects.requireNonNull(data, "data").clone());
    }

    public boolean isText() {
        return text != null;
    }

    /**
     * Text content; binary frames are decoded as UTF-8.
     */
    public String asText() {
        return text != null ? text : new String(binary, StandardCharsets.UTF_8);
    }

    public byte[] asBytes() {
        return text != null ? text.getBytes(StandardCharsets.UTF_8) : binary.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SocketMessage other))
            return false;
        return Objects.equals(text, other.text) && Arrays.equals(binary, other.binary);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(text) + Arrays.hashCode(binary);
    }

    @Override
    public String toString() {
        return isText() ? "Text(" + text + ")" : "Binary(" + binary.length + " bytes)";
    }
}
