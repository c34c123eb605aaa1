package io.github.cyfko.stackage.core.log;

/**
 * Destination of emitted {@link Event events}.
 * <p>
 * Implementations must be thread-safe when shared across nodes used from several threads.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventSink {

    /**
     * @param event the event to publish, never null
     */
    void accept(Event event);
}
