package com.presencebridge.connector.registry;

import com.presencebridge.connector.transport.ClientHandle;
import com.presencebridge.connector.transport.SocketMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Sends one serialized payload to every registered client.
 *
 * <p>
 * Delivery is best effort: a send that fails for one client is logged and the
 * remaining clients still receive the payload. The registry is snapshotted
 * first, so no lock is held while writing.
 */
@Slf4j
public class Broadcaster {

    private final ClientRegistry registry;

    public Broadcaster(ClientRegistry registry) {
        this.registry = registry;
    }

    /**
     * @return number of clients a send was attempted to
     */
    public int broadcast(String payload) {
        if (registry.isEmpty()) {
            return 0;
        }
        SocketMessage message = SocketMessage.text(payload);
        List<ClientHandle> targets = registry.snapshot();
        for (ClientHandle client : targets) {
            try {
                client.send(message);
            } catch (Exception e) {
                log.warn("Failed to broadcast to client {}: {}", client.getClientId(), e.getMessage());
            }
        }
        return targets.size();
    }

    public boolean hasAudience() {
        return !registry.isEmpty();
    }
}
