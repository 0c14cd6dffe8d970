package com.presencebridge.connector.registry;

import com.presencebridge.connector.transport.ClientHandle;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live clients eligible for broadcasts, keyed by connection id.
 *
 * <p>
 * The registry is the only owner of {@link ClientHandle}s; other components
 * look a handle up by id or take a {@link #snapshot()}. Changes are visible to
 * the next lookup or snapshot from any thread.
 */
public class ClientRegistry {

    private final Map<Long, ClientHandle> clients = new ConcurrentHashMap<>();

    /**
     * Register a handle, replacing any stale entry with the same id.
     */
    public void register(ClientHandle handle) {
        clients.put(handle.getClientId(), handle);
    }

    /**
     * @return the removed handle, if it was registered
     */
    public Optional<ClientHandle> remove(long clientId) {
        return Optional.ofNullable(clients.remove(clientId));
    }

    public Optional<ClientHandle> lookup(long clientId) {
        return Optional.ofNullable(clients.get(clientId));
    }

    public boolean isEmpty() {
        return clients.isEmpty();
    }

    public int size() {
        return clients.size();
    }

    /**
     * Point-in-time copy of the registered handles, safe to iterate while
     * clients come and go.
     */
    public List<ClientHandle> snapshot() {
        return new ArrayList<>(clients.values());
    }
}
