package com.clawcron.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;

/**
 * Subsystem-aware logger that wraps SLF4J and appends structured metadata.
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("cron");
 * log.info("job added", Map.of("jobId", "a1b2c3d4"));
 * SubsystemLogger timer = log.child("timer");
 * </pre>
 *
 * The subsystem is also the SLF4J logger name suffix ({@code clawcron.cron}),
 * so levels can be tuned per subsystem in logback.xml.
 */
public class SubsystemLogger {

    /** Parent SLF4J logger name of every subsystem logger. */
    public static final String ROOT_LOGGER_NAME = "clawcron";
    private static final String MDC_SUBSYSTEM = "subsystem";
    private static volatile LogLevel minLevel = LogLevel.TRACE;

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        this.logger = LoggerFactory.getLogger(ROOT_LOGGER_NAME + "." + subsystem.replace('/', '.'));
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

    /**
     * Set the process-wide minimum level (from {@code logging.level}).
     * SLF4J/Logback levels still apply on top of this.
     */
    public static void setMinLevel(LogLevel level) {
        minLevel = level != null ? level : LogLevel.INFO;
    }

    public static LogLevel getMinLevel() {
        return minLevel;
    }

    // -----------------------------------------------------------------------
    // Log methods
    // -----------------------------------------------------------------------

    public void debug(String message) {
        emit(LogLevel.DEBUG, message, null, null);
    }

    public void debug(String message, Map<String, Object> meta) {
        emit(LogLevel.DEBUG, message, meta, null);
    }

    public void info(String message) {
        emit(LogLevel.INFO, message, null, null);
    }

    public void info(String message, Map<String, Object> meta) {
        emit(LogLevel.INFO, message, meta, null);
    }

    public void warn(String message) {
        emit(LogLevel.WARN, message, null, null);
    }

    public void warn(String message, Map<String, Object> meta) {
        emit(LogLevel.WARN, message, meta, null);
    }

    public void error(String message) {
        emit(LogLevel.ERROR, message, null, null);
    }

    public void error(String message, Map<String, Object> meta) {
        emit(LogLevel.ERROR, message, meta, null);
    }

    public void error(String message, Throwable t) {
        emit(LogLevel.ERROR, message, null, t);
    }

    public String getSubsystem() {
        return subsystem;
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private void emit(LogLevel level, String message, Map<String, Object> meta, Throwable t) {
        if (!level.isEnabledFor(minLevel))
            return;
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            String formatted = formatMessage(message, meta);
            switch (level) {
                case TRACE -> logger.trace(formatted);
                case DEBUG -> logger.debug(formatted);
                case WARN -> logger.warn(formatted);
                case ERROR -> {
                    if (t != null)
                        logger.error(formatted, t);
                    else
                        logger.error(formatted);
                }
                default -> logger.info(formatted);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    String formatMessage(String message, Map<String, Object> meta) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(subsystem).append("] ").append(message);
        if (meta == null || meta.isEmpty()) {
            return sb.toString();
        }
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
