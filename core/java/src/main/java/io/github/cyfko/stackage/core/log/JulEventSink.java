package io.github.cyfko.stackage.core.log;

import io.github.cyfko.stackage.core.config.LogLevel;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link EventSink} publishing to {@code java.util.logging}.
 * <p>
 * The event tag selects the JUL level (see {@link LogLevel#julLevel()}); {@code FATAL} events are
 * published at {@link Level#SEVERE}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class JulEventSink implements EventSink {

    private final Logger logger;

    /**
     * Publishes to the logger named after this package.
     */
    public JulEventSink() {
        this(Logger.getLogger(JulEventSink.class.getPackageName()));
    }

    public JulEventSink(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public void accept(Event event) {
        Level level = levelOf(event.tag());
        if (logger.isLoggable(level)) {
            logger.log(level, event.format());
        }
    }

    static Level levelOf(String tag) {
        if (LogLevel.FATAL_TAG.equals(tag)) return Level.SEVERE;
        return LogLevel.fromString(tag).map(LogLevel::julLevel).orElse(Level.INFO);
    }
}
