package work.lcod.choiceimport.shared;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Import activity log. Carries its nesting depth so nested passes indent their output
 * without sharing mutable state between independent runs.
 *
 * <p>The threshold is applied on top of the backend's own configuration, so an embedding
 * caller can quieten one import without touching global logger settings.
 */
public final class LogContext {
    private static final int MAX_INDENT = 16;

    private final Logger logger;
    private final int depth;
    private final Level threshold;

    private LogContext(Logger logger, int depth, Level threshold) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.depth = depth;
        this.threshold = Objects.requireNonNull(threshold, "threshold");
    }

    public static LogContext root(Class<?> owner) {
        return root(owner, Level.TRACE);
    }

    public static LogContext root(Class<?> owner, Level threshold) {
        return new LogContext(LoggerFactory.getLogger(owner), 0, threshold);
    }

    public LogContext nested() {
        return new LogContext(logger, depth + 1, threshold);
    }

    public LogContext forOwner(Class<?> owner) {
        return new LogContext(LoggerFactory.getLogger(owner), depth, threshold);
    }

    public int depth() {
        return depth;
    }

    public Level threshold() {
        return threshold;
    }

    public boolean isEnabled(Level level) {
        return level.toInt() >= threshold.toInt() && logger.isEnabledForLevel(level);
    }

    public void debug(String format, Object... args) {
        if (isEnabled(Level.DEBUG)) {
            logger.debug(indent() + format, args);
        }
    }

    public void info(String format, Object... args) {
        if (isEnabled(Level.INFO)) {
            logger.info(indent() + format, args);
        }
    }

    public void warn(String format, Object... args) {
        if (isEnabled(Level.WARN)) {
            logger.warn(indent() + format, args);
        }
    }

    private String indent() {
        return "  ".repeat(Math.min(depth, MAX_INDENT));
    }
}
