package com.fixiplug.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;

/**
 * Subsystem-aware logger that wraps SLF4J and adds structured subsystem
 * context.
 *
 * <p>
 * Usage:
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("plugin/cache");
 * log.info("Cache warmed", Map.of("entries", 42));
 * SubsystemLogger child = log.child("evict");
 * child.debug("Pruning expired entries");
 * </pre>
 */
public class SubsystemLogger {

    private static final String MDC_SUBSYSTEM = "subsystem";

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        // Subsystem doubles as the SLF4J logger name for per-subsystem control in
        // logback.xml
        this.logger = LoggerFactory.getLogger("fixiplug." + subsystem.replace('/', '.'));
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    /**
     * Create a child logger with extended subsystem path.
     */
    public SubsystemLogger child(String name) {
        return new SubsystemLogger(subsystem + "/" + name);
    }

    // -----------------------------------------------------------------------
    // Log methods
    // -----------------------------------------------------------------------

    public void debug(String message) {
        log(LogLevel.DEBUG, message, null);
    }

    public void debug(String message, Map<String, Object> meta) {
        log(LogLevel.DEBUG, message, meta);
    }

    public void info(String message) {
        log(LogLevel.INFO, message, null);
    }

    public void info(String message, Map<String, Object> meta) {
        log(LogLevel.INFO, message, meta);
    }

    public void warn(String message) {
        log(LogLevel.WARN, message, null);
    }

    public void warn(String message, Map<String, Object> meta) {
        log(LogLevel.WARN, message, meta);
    }

    public void error(String message) {
        log(LogLevel.ERROR, message, null);
    }

    public void error(String message, Throwable t) {
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            logger.error(formatMessage(message, null), t);
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    public void log(LogLevel level, String message) {
        log(level, message, null);
    }

    public void log(LogLevel level, String message, Map<String, Object> meta) {
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            String formatted = formatMessage(message, meta);
            switch (level) {
                case TRACE -> logger.trace(formatted);
                case DEBUG -> logger.debug(formatted);
                case INFO -> logger.info(formatted);
                case WARN -> logger.warn(formatted);
                case ERROR -> logger.error(formatted);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    // -----------------------------------------------------------------------
    // Accessors
    // -----------------------------------------------------------------------

    public String getSubsystem() {
        return subsystem;
    }

    public Logger getSlf4jLogger() {
        return logger;
    }

    String formatMessage(String message, Map<String, Object> meta) {
        if (meta == null || meta.isEmpty()) {
            return "[" + subsystem + "] " + message;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(subsystem).append("] ").append(message);
        sb.append(" {");
        boolean first = true;
        for (var entry : meta.entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        sb.append("}");
        return sb.toString();
    }
}
