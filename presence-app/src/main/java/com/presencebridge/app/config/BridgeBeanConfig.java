package com.presencebridge.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.presencebridge.app.process.DetectableCatalog;
import com.presencebridge.app.process.ProcessWatcher;
import com.presencebridge.connector.ClientConnector;
import com.presencebridge.connector.ConnectorSettings;
import com.presencebridge.connector.ProducerChannels;
import com.presencebridge.connector.registry.ClientRegistry;
import com.presencebridge.connector.presence.PresenceState;
import com.presencebridge.connector.transport.PresenceSocketServer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Spring configuration for the bridge beans.
 */
@Configuration
public class BridgeBeanConfig {

    @Value("${presence.bridge.host:" + ConnectorSettings.DEFAULT_HOST + "}")
    private String host;
    @Value("${presence.bridge.port:" + ConnectorSettings.DEFAULT_PORT + "}")
    private int port;
    @Value("${presence.bridge.welcome-payload:}")
    private String welcomePayload;
    @Value("${presence.bridge.strict-invariants:false}")
    private boolean strictInvariants;

    @Value("${presence.bridge.process.enabled:false}")
    private boolean processEnabled;
    @Value("${presence.bridge.process.poll-interval-ms:5000}")
    private long processPollIntervalMs;
    @Value("${presence.bridge.process.detectables-path:~/.presence-bridge/detectables.json}")
    private String detectablesPath;

    @Bean
    public ConnectorSettings connectorSettings() {
        ConnectorSettings.ConnectorSettingsBuilder builder = ConnectorSettings.builder()
                .host(host)
                .port(port)
                .strictInvariants(strictInvariants);
        // Blank keeps the built-in empty payload.
        if (welcomePayload != null && !welcomePayload.isBlank()) {
            builder.welcomePayload(welcomePayload);
        }
        return builder.build();
    }

    @Bean
    public ProducerChannels producerChannels() {
        return ProducerChannels.create();
    }

    @Bean
    public ClientRegistry clientRegistry() {
        return new ClientRegistry();
    }

    @Bean
    public PresenceState presenceState() {
        return new PresenceState();
    }

    @Bean
    public PresenceSocketServer presenceSocketServer(ConnectorSettings settings) {
        return new PresenceSocketServer(settings.getHost(), settings.getPort());
    }

    @Bean
    public ClientConnector clientConnector(ConnectorSettings settings,
            ObjectMapper objectMapper,
            ClientRegistry clientRegistry,
            PresenceState presenceState,
            PresenceSocketServer presenceSocketServer,
            ProducerChannels producerChannels) {
        return new ClientConnector(settings, objectMapper, clientRegistry, presenceState,
                presenceSocketServer.events(), producerChannels);
    }

    @Bean
    public ProcessWatcher processWatcher(ProducerChannels producerChannels, ObjectMapper objectMapper) {
        Path catalogPath = resolveHome(detectablesPath);
        return new ProcessWatcher(
                producerChannels.process(),
                () -> DetectableCatalog.load(catalogPath, objectMapper),
                Duration.ofMillis(processPollIntervalMs),
                processEnabled);
    }

    private static Path resolveHome(String path) {
        if (path.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }
}
