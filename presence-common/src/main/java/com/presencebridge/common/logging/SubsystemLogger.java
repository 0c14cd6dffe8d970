package com.presencebridge.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.event.Level;

import java.util.Map;

/**
 * SLF4J wrapper that tags every line with a bridge subsystem.
 *
 * <p>
 * Output reads {@code [client-connector] Sending empty payload {pid=42}}; the
 * subsystem is also pushed to the MDC under {@code subsystem} so logback
 * patterns can filter on it. The SLF4J logger name is
 * {@code presence.<subsystem>}, which gives per-subsystem level control in
 * logback configuration.
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("client-connector");
 * log.info("Client connected", Map.of("clientId", 7));
 * </pre>
 */
public class SubsystemLogger {

    static final String MDC_SUBSYSTEM = "subsystem";

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        this.logger = LoggerFactory.getLogger("presence." + subsystem);
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    public void debug(String message) {
        emit(Level.DEBUG, message, null, null);
    }

    public void debug(String message, Map<String, Object> meta) {
        emit(Level.DEBUG, message, meta, null);
    }

    public void info(String message) {
        emit(Level.INFO, message, null, null);
    }

    public void info(String message, Map<String, Object> meta) {
        emit(Level.INFO, message, meta, null);
    }

    public void warn(String message) {
        emit(Level.WARN, message, null, null);
    }

    public void warn(String message, Map<String, Object> meta) {
        emit(Level.WARN, message, meta, null);
    }

    public void error(String message) {
        emit(Level.ERROR, message, null, null);
    }

    public void error(String message, Map<String, Object> meta) {
        emit(Level.ERROR, message, meta, null);
    }

    public void error(String message, Throwable t) {
        emit(Level.ERROR, message, null, t);
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private void emit(Level level, String message, Map<String, Object> meta, Throwable t) {
        if (!logger.isEnabledForLevel(level)) {
            return;
        }
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            String formatted = format(message, meta);
            switch (level) {
                case TRACE -> logger.trace(formatted, t);
                case DEBUG -> logger.debug(formatted, t);
                case WARN -> logger.warn(formatted, t);
                case ERROR -> logger.error(formatted, t);
                default -> logger.info(formatted, t);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    String format(String message, Map<String, Object> meta) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(subsystem).append("] ").append(message);
        if (meta != null && !meta.isEmpty()) {
            sb.append(" {");
            boolean first = true;
            for (var entry : meta.entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(entry.getKey()).append('=').append(entry.getValue());
                first = false;
            }
            sb.append('}');
        }
        return sb.toString();
    }
}
