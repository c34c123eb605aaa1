package io.github.cyfko.stackage.core.log;

import io.github.cyfko.stackage.core.config.LogLevel;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Per-instance logging state: the enabled {@link LogLevel levels} and the {@link EventSink}.
 * <p>
 * Events are built lazily: the supplier only runs when the level is enabled. Instances are owned by a
 * single node and are not shared.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LogSystem {

    private final Set<LogLevel> levels = Collections.synchronizedSet(EnumSet.noneOf(LogLevel.class));
    private volatile EventSink sink;

    public LogSystem(Collection<LogLevel> initialLevels, EventSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
        if (initialLevels != null) levels.addAll(initialLevels);
    }

    public boolean isEnabled(LogLevel level) {
        return levels.contains(level);
    }

    public void enable(LogLevel... toEnable) {
        if (toEnable == null) return;
        for (LogLevel level : toEnable) {
            if (level != null) levels.add(level);
        }
    }

    public void disable(LogLevel... toDisable) {
        if (toDisable == null) return;
        for (LogLevel level : toDisable) {
            if (level != null) levels.remove(level);
        }
    }

    /**
     * @return a snapshot of the enabled levels
     */
    public Set<LogLevel> levels() {
        synchronized (levels) {
            return levels.isEmpty() ? EnumSet.noneOf(LogLevel.class) : EnumSet.copyOf(levels);
        }
    }

    public EventSink sink() {
        return sink;
    }

    public void setSink(EventSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Publishes the event produced by {@code event} when {@code level} is enabled.
     *
     * @param level the event category
     * @param event lazily built event
     */
    public void emit(LogLevel level, Supplier<Event> event) {
        if (isEnabled(level)) {
            sink.accept(event.get());
        }
    }

    /**
     * Publishes a {@code FATAL} event unconditionally, then throws.
     *
     * @param event the invariant violation, tagged {@link LogLevel#FATAL_TAG}
     * @return never returns normally
     * @throws IllegalStateException always
     */
    public IllegalStateException fatal(Event event) {
        sink.accept(event);
        throw new IllegalStateException(event.message());
    }
}
