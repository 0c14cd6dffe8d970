package com.presencebridge.app.config;

import com.presencebridge.app.process.ProcessWatcher;
import com.presencebridge.connector.ClientConnector;
import com.presencebridge.connector.transport.PresenceSocketServer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Starts the listener, the connector loops and the process watcher with the
 * application context and stops them in reverse order.
 */
@Slf4j
@Component
public class BridgeBootstrap {

    private final PresenceSocketServer server;
    private final ClientConnector connector;
    private final ProcessWatcher processWatcher;

    public BridgeBootstrap(PresenceSocketServer server, ClientConnector connector, ProcessWatcher processWatcher) {
        this.server = server;
        this.connector = connector;
        this.processWatcher = processWatcher;
    }

    /**
     * A bind failure propagates and aborts context startup.
     */
    @PostConstruct
    public void start() {
        server.start();
        connector.start();
        processWatcher.start();
        log.info("Presence bridge ready on ws://{}:{}", server.getHost(), server.getBoundPort());
    }

    @PreDestroy
    public void stop() {
        processWatcher.stop();
        server.stop();
        connector.stop();
    }
}
