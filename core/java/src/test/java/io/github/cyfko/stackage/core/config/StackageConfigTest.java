package io.github.cyfko.stackage.core.config;

import io.github.cyfko.stackage.core.log.EventSink;
import io.github.cyfko.stackage.core.log.JulEventSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StackageConfig")
class StackageConfigTest {

    @AfterEach
    void tearDown() {
        StackageDefaults.reset();
    }

    @Test
    @DisplayName("Should log nothing to JUL by default")
    void shouldProvideQuietDefaults() {
        StackageConfig defaults = StackageConfig.defaults();

        assertTrue(defaults.stackLogLevels().isEmpty());
        assertTrue(defaults.conditionLogLevels().isEmpty());
        assertInstanceOf(JulEventSink.class, defaults.eventSink());
    }

    @Test
    @DisplayName("Should build immutable level sets")
    void shouldBuildImmutableLevels() {
        EventSink sink = event -> { };
        StackageConfig config = StackageConfig.builder()
                .stackLogLevels(LogLevel.CALLS, LogLevel.ERRORS)
                .eventSink(sink)
                .build();

        assertEquals(Set.of(LogLevel.CALLS, LogLevel.ERRORS), config.stackLogLevels());
        assertSame(sink, config.eventSink());
        assertThrows(UnsupportedOperationException.class, () -> config.stackLogLevels().add(LogLevel.TRACE));
    }

    @Test
    @DisplayName("Should reject a null sink")
    void shouldRejectNullSink() {
        assertThrows(NullPointerException.class, () -> StackageConfig.builder().eventSink(null));
    }

    @Test
    @DisplayName("Should install and reset process defaults")
    void shouldInstallAndReset() {
        StackageConfig config = StackageConfig.builder().conditionLogLevels(LogLevel.DEBUG).build();

        StackageDefaults.initialize(config);
        assertSame(config, StackageDefaults.current());

        StackageDefaults.reset();
        assertTrue(StackageDefaults.current().conditionLogLevels().isEmpty());
        assertThrows(NullPointerException.class, () -> StackageDefaults.initialize(null));
    }

    @Test
    @DisplayName("Should parse level names and map them to JUL levels")
    void shouldParseLevels() {
        assertEquals(Optional.of(LogLevel.TRACE), LogLevel.fromString(" trace "));
        assertTrue(LogLevel.fromString("verbose").isEmpty());
        assertTrue(LogLevel.fromString(null).isEmpty());
        assertEquals(Level.WARNING, LogLevel.ERRORS.julLevel());
        assertEquals(Level.FINER, LogLevel.CALLS.julLevel());
    }
}
