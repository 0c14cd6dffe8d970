package com.presencebridge.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.presencebridge.common.channel.EventChannel;
import com.presencebridge.common.logging.SubsystemLogger;
import com.presencebridge.common.model.ActivityArgs;
import com.presencebridge.common.model.ActivityCmd;
import com.presencebridge.common.model.ActivityPayload;
import com.presencebridge.common.model.ProcessDetectedEvent;
import com.presencebridge.common.normalize.ActivityNormalizer;
import com.presencebridge.connector.payload.ActivityPayloads;
import com.presencebridge.connector.presence.PresenceState;
import com.presencebridge.connector.presence.PresenceTransition;
import com.presencebridge.connector.registry.Broadcaster;
import com.presencebridge.connector.registry.ClientRegistry;
import com.presencebridge.connector.transport.ClientHandle;
import com.presencebridge.connector.transport.TransportEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Fans the three activity producers and the socket listener into one
 * broadcast stream.
 *
 * <p>
 * {@link #start()} runs four loops, one per receiving end:
 * <ul>
 * <li>transport: registers and removes clients, sends the welcome payload,
 * echoes inbound messages back to their sender</li>
 * <li>ipc: {@code SET_ACTIVITY} commands, relayed per message</li>
 * <li>process: detection reports, de-duplicated through
 * {@link PresenceState}</li>
 * <li>socket: commands from the socket control channel; anything other than
 * {@code SET_ACTIVITY} is relayed unchanged</li>
 * </ul>
 * Events from one producer are handled in arrival order; nothing orders one
 * producer's broadcasts against another's. Every producer drops its event
 * before any transform work when no client is connected.
 *
 * <p>
 * The {@code handle*} methods process a single event on the calling thread
 * and may be used directly by embedders that run their own loops.
 */
public class ClientConnector implements AutoCloseable {

    private static final SubsystemLogger log = SubsystemLogger.create("client-connector");
    private static final long JOIN_TIMEOUT_MS = 2_000;

    private final ConnectorSettings settings;
    private final ObjectMapper mapper;
    private final ClientRegistry registry;
    private final Broadcaster broadcaster;
    private final PresenceState presenceState;
    private final ActivityNormalizer normalizer;
    private final EventChannel<TransportEvent> transportEvents;
    private final ProducerChannels producers;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final List<Thread> loops = new ArrayList<>();

    public ClientConnector(ConnectorSettings settings,
            ObjectMapper mapper,
            ClientRegistry registry,
            PresenceState presenceState,
            EventChannel<TransportEvent> transportEvents,
            ProducerChannels producers) {
        this.settings = settings;
        this.mapper = mapper;
        this.registry = registry;
        this.broadcaster = new Broadcaster(registry);
        this.presenceState = presenceState;
        this.normalizer = new ActivityNormalizer(mapper);
        this.transportEvents = transportEvents;
        this.producers = producers;
    }

    public ClientConnector(ConnectorSettings settings, ObjectMapper mapper,
            EventChannel<TransportEvent> transportEvents, ProducerChannels producers) {
        this(settings, mapper, new ClientRegistry(), new PresenceState(), transportEvents, producers);
    }

    // ==================== Lifecycle ====================

    /**
     * Start the four dispatch loops on daemon threads.
     */
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            log.debug("Connector already started");
            return;
        }
        startLoop("connector-transport", transportEvents, this::handleTransportEvent);
        startLoop("connector-ipc", producers.ipc(), this::handleIpcActivity);
        startLoop("connector-process", producers.process(), this::handleProcessDetected);
        startLoop("connector-socket", producers.socketCommands(), this::handleSocketCommand);
        log.info("Connector started", Map.of("loops", loops.size()));
    }

    /**
     * Close every channel the connector reads from and wait briefly for the
     * loops to drain.
     */
    public synchronized void stop() {
        if (!started.get()) {
            return;
        }
        transportEvents.close();
        producers.closeAll();
        for (Thread loop : loops) {
            try {
                loop.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (loop.isAlive()) {
                log.warn("Loop did not stop in time", Map.of("loop", loop.getName()));
            }
        }
        loops.clear();
        started.set(false);
        log.info("Connector stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return started.get() && loops.stream().anyMatch(Thread::isAlive);
    }

    private <T> void startLoop(String name, EventChannel<T> channel, Consumer<T> handler) {
        Thread thread = new Thread(() -> runLoop(name, channel, handler), name);
        thread.setDaemon(true);
        loops.add(thread);
        thread.start();
    }

    private <T> void runLoop(String name, EventChannel<T> channel, Consumer<T> handler) {
        try {
            while (true) {
                Optional<T> next = channel.receive();
                if (next.isEmpty()) {
                    log.debug("Channel closed, loop exiting", Map.of("loop", name));
                    return;
                }
                try {
                    handler.accept(next.get());
                } catch (UnknownClientException e) {
                    log.error("Invariant violated, stopping " + name + ": " + e.getMessage());
                    throw e;
                } catch (RuntimeException e) {
                    log.error("Error handling event on " + name, e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Loop interrupted", Map.of("loop", name));
        }
    }

    // ==================== Transport ====================

    public void handleTransportEvent(TransportEvent event) {
        if (event instanceof TransportEvent.Connected connected) {
            log.info("Client connected", Map.of("clientId", connected.clientId()));
            try {
                connected.handle().sendText(settings.getWelcomePayload());
            } catch (RuntimeException e) {
                log.warn("Failed to send welcome payload",
                        Map.of("clientId", connected.clientId(), "error", String.valueOf(e.getMessage())));
            }
            registry.register(connected.handle());
        } else if (event instanceof TransportEvent.Disconnected disconnected) {
            registry.remove(disconnected.clientId());
            log.info("Client disconnected", Map.of("clientId", disconnected.clientId()));
        } else if (event instanceof TransportEvent.InboundMessage inbound) {
            echo(inbound);
        }
    }

    private void echo(TransportEvent.InboundMessage inbound) {
        log.debug("Received message from client",
                Map.of("clientId", inbound.clientId(), "message", inbound.message()));
        Optional<ClientHandle> sender = registry.lookup(inbound.clientId());
        if (sender.isEmpty()) {
            if (settings.isStrictInvariants()) {
                throw new UnknownClientException(inbound.clientId());
            }
            log.error("Inbound message from unregistered client dropped",
                    Map.of("clientId", inbound.clientId()));
            return;
        }
        sender.get().send(inbound.message());
    }

    // ==================== Producers ====================

    /**
     * IPC producer: relay every {@code SET_ACTIVITY} as-is, without
     * de-duplication.
     */
    public void handleIpcActivity(ActivityCmd command) {
        if (!broadcaster.hasAudience()) {
            log.debug("No clients connected, skipping");
            return;
        }
        dispatchSetActivity(command, "IPC");
    }

    /**
     * Process producer: announce a session once, close it with an empty payload
     * when it ends or is replaced.
     */
    public void handleProcessDetected(ProcessDetectedEvent event) {
        if (!broadcaster.hasAudience()) {
            log.debug("No clients connected, skipping");
            return;
        }
        PresenceTransition transition = presenceState.apply(event);
        switch (transition.kind()) {
            case IDLE -> {
                return;
            }
            case REPEAT -> {
                log.debug("Already sent payload for activity", Map.of("name", String.valueOf(event.name())));
                return;
            }
            case CLEARED -> log.info("Sending empty payload",
                    Map.of("socketId", transition.closing().getSocketId()));
            case SWITCHED -> log.info("Session changed, closing previous",
                    Map.of("from", transition.closing().getSocketId(), "to", event.id()));
            case OPENED -> log.info("Sending payload for activity",
                    Map.of("name", String.valueOf(event.name())));
        }
        for (ActivityPayload payload : transition.payloads()) {
            sendPayload(payload, "process");
        }
    }

    /**
     * Socket command producer: {@code SET_ACTIVITY} is handled like IPC, any
     * other command is broadcast exactly as it serializes.
     */
    public void handleSocketCommand(ActivityCmd command) {
        if (!broadcaster.hasAudience()) {
            log.debug("No clients connected, skipping");
            return;
        }
        if (!command.isSetActivity()) {
            String json;
            try {
                json = mapper.writeValueAsString(command);
            } catch (JsonProcessingException e) {
                log.error("Error serializing socket command: " + e.getOriginalMessage());
                return;
            }
            log.debug("Sending payload for socket command", Map.of("cmd", String.valueOf(command.getCmd())));
            broadcaster.broadcast(json);
            return;
        }
        dispatchSetActivity(command, "socket");
    }

    private void dispatchSetActivity(ActivityCmd raw, String source) {
        ActivityCmd command;
        try {
            command = normalizer.normalize(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid activity command, skipping", Map.of("source", source, "error", String.valueOf(e.getMessage())));
            return;
        }
        ActivityArgs args = command.getArgs();
        if (args == null) {
            log.warn("Invalid activity command, skipping", Map.of("source", source, "reason", "missing args"));
            return;
        }
        ActivityPayload payload = ActivityPayloads.fromCommand(command, args);
        if (payload.isEmpty()) {
            log.info("Sending empty payload", Map.of("source", source, "pid", payload.getPid()));
        } else {
            log.debug("Sending payload for activity", Map.of("source", source, "socketId", payload.getSocketId()));
        }
        sendPayload(payload, source);
    }

    private void sendPayload(ActivityPayload payload, String source) {
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("Error serializing " + source + " activity: " + e.getOriginalMessage());
            return;
        }
        broadcaster.broadcast(json);
    }

    // ==================== Accessors ====================

    public ClientRegistry getRegistry() {
        return registry;
    }

    public PresenceState getPresenceState() {
        return presenceState;
    }
}
