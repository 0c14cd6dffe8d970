package com.presencebridge.common.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SubsystemLoggerTest {

    private Logger backend;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attachAppender() {
        backend = (Logger) LoggerFactory.getLogger("presence.logger-test");
        appender = new ListAppender<>() {
            @Override
            protected void append(ILoggingEvent event) {
                // freeze MDC and message while the tag is still set
                event.prepareForDeferredProcessing();
                super.append(event);
            }
        };
        appender.start();
        backend.addAppender(appender);
        backend.setLevel(Level.INFO);
    }

    @AfterEach
    void detachAppender() {
        backend.detachAppender(appender);
        backend.setLevel(null);
    }

    @Test
    void formatsSubsystemAndMeta() {
        SubsystemLogger log = SubsystemLogger.create("client-connector");
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("clientId", 3);
        meta.put("source", "IPC");

        assertEquals("[client-connector] Sending payload {clientId=3, source=IPC}",
                log.format("Sending payload", meta));
        assertEquals("[client-connector] Ready", log.format("Ready", Map.of()));
    }

    @Test
    void tagsEventsWithSubsystemInMdc() {
        SubsystemLogger log = SubsystemLogger.create("logger-test");

        log.warn("Invalid activity command, skipping", Map.of("source", "IPC"));

        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertEquals("[logger-test] Invalid activity command, skipping {source=IPC}", event.getFormattedMessage());
        assertEquals("logger-test", event.getMDCPropertyMap().get(SubsystemLogger.MDC_SUBSYSTEM));
        // the tag does not leak past the call
        assertNull(MDC.get(SubsystemLogger.MDC_SUBSYSTEM));
    }

    @Test
    void honoursBackendLevel() {
        SubsystemLogger log = SubsystemLogger.create("logger-test");

        log.debug("hidden");
        log.info("shown");

        assertEquals(1, appender.list.size());
        assertEquals("[logger-test] shown", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void errorCarriesThrowable() {
        SubsystemLogger log = SubsystemLogger.create("logger-test");

        log.error("Error handling event on connector-ipc", new IllegalStateException("boom"));

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.ERROR, event.getLevel());
        assertEquals("boom", event.getThrowableProxy().getMessage());
    }
}
