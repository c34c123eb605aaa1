package io.github.cyfko.stackage.core.config;

import io.github.cyfko.stackage.core.log.EventSink;
import io.github.cyfko.stackage.core.log.JulEventSink;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable process-wide defaults consumed by every newly constructed stack and condition.
 * <p>
 * Instances are made with {@link #builder()} and installed through
 * {@link StackageDefaults#initialize(StackageConfig)}. Already constructed nodes keep the
 * settings they were created with.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * StackageDefaults.initialize(StackageConfig.builder()
 *     .stackLogLevels(LogLevel.STATE, LogLevel.ERRORS)
 *     .eventSink(event -> audit.add(event))
 *     .build());
 * }</pre>
 *
 * @param stackLogLevels     levels enabled on new stacks
 * @param conditionLogLevels levels enabled on new conditions
 * @param eventSink          destination of emitted events
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record StackageConfig(Set<LogLevel> stackLogLevels,
                             Set<LogLevel> conditionLogLevels,
                             EventSink eventSink) {

    public StackageConfig {
        Objects.requireNonNull(eventSink, "eventSink");
        stackLogLevels = immutableCopy(stackLogLevels);
        conditionLogLevels = immutableCopy(conditionLogLevels);
    }

    /**
     * No level enabled, events written to {@link JulEventSink}.
     *
     * @return the default configuration
     */
    public static StackageConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Set<LogLevel> immutableCopy(Collection<LogLevel> levels) {
        if (levels == null || levels.isEmpty()) return Collections.emptySet();
        return Collections.unmodifiableSet(EnumSet.copyOf(levels));
    }

    /**
     * Builder for {@link StackageConfig}.
     */
    public static final class Builder {
        private final Set<LogLevel> stackLogLevels = EnumSet.noneOf(LogLevel.class);
        private final Set<LogLevel> conditionLogLevels = EnumSet.noneOf(LogLevel.class);
        private EventSink eventSink = new JulEventSink();

        private Builder() {
        }

        public Builder stackLogLevels(LogLevel... levels) {
            stackLogLevels.clear();
            Collections.addAll(stackLogLevels, Objects.requireNonNull(levels, "levels"));
            return this;
        }

        public Builder conditionLogLevels(LogLevel... levels) {
            conditionLogLevels.clear();
            Collections.addAll(conditionLogLevels, Objects.requireNonNull(levels, "levels"));
            return this;
        }

        public Builder eventSink(EventSink sink) {
            this.eventSink = Objects.requireNonNull(sink, "eventSink");
            return this;
        }

        public StackageConfig build() {
            return new StackageConfig(stackLogLevels, conditionLogLevels, eventSink);
        }
    }
}
