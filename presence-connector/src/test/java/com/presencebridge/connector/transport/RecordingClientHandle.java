package com.presencebridge.connector.transport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory client that records what it is sent.
 */
public class RecordingClientHandle implements ClientHandle {

    private final long clientId;
    private final List<SocketMessage> sent = new CopyOnWriteArrayList<>();
    private volatile boolean failing;
    private volatile boolean open = true;

    public RecordingClientHandle(long clientId) {
        this.clientId = clientId;
    }

    /** Every send throws from now on. */
    public RecordingClientHandle failing() {
        this.failing = true;
        return this;
    }

    @Override
    public long getClientId() {
        return clientId;
    }

    @Override
    public void send(SocketMessage message) {
        if (failing) {
            throw new IllegalStateException("connection reset");
        }
        if (open) {
            sent.add(message);
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public void close() {
        open = false;
    }

    public List<SocketMessage> sent() {
        return sent;
    }

    public List<String> sentTexts() {
        return sent.stream().map(SocketMessage::asText).toList();
    }
}
