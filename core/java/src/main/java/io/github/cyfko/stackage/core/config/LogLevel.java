package io.github.cyfko.stackage.core.config;

import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;

/**
 * Categories of events a stack or condition can emit.
 * <p>
 * Levels are independent switches, not a threshold: enabling {@link #STATE} does not enable
 * {@link #CALLS}. Every level maps to a {@link java.util.logging.Level} used by
 * {@link io.github.cyfko.stackage.core.log.JulEventSink}.
 * </p>
 * <p>
 * The {@link #FATAL_TAG FATAL} severity is not a switch: it is always emitted, and reserved for
 * internal invariant violations.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum LogLevel {

    /** Method entry for public operations. */
    CALLS(Level.FINER),

    /** Outcome of caller-supplied policies. */
    POLICY(Level.FINE),

    /** Changes to configuration or contents. */
    STATE(Level.FINE),

    /** Internal diagnostics. */
    DEBUG(Level.FINEST),

    /** Recorded errors. */
    ERRORS(Level.WARNING),

    /** Traversal and rendering detail. */
    TRACE(Level.FINEST);

    /**
     * Severity tag of events reporting an invariant violation.
     */
    public static final String FATAL_TAG = "FATAL";

    private final Level julLevel;

    LogLevel(Level julLevel) {
        this.julLevel = julLevel;
    }

    /**
     * @return the java.util.logging level events of this category are published at
     */
    public Level julLevel() {
        return julLevel;
    }

    /**
     * Parses a level name, ignoring case.
     *
     * @param value the level name
     * @return the matching level, or empty
     */
    public static Optional<LogLevel> fromString(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
