package work.lcod.choiceimport.api;

import java.util.Locale;
import org.slf4j.event.Level;

/**
 * Import log thresholds, named after the SLF4J levels.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    public Level slf4jLevel() {
        return Level.valueOf(name());
    }

    /**
     * Value accepted by {@code org.slf4j.simpleLogger.defaultLogLevel}.
     */
    public String simpleLoggerName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
