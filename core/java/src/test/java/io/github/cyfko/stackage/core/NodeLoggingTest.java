package io.github.cyfko.stackage.core;

import io.github.cyfko.stackage.core.api.ComparisonOperator;
import io.github.cyfko.stackage.core.config.LogLevel;
import io.github.cyfko.stackage.core.config.StackageConfig;
import io.github.cyfko.stackage.core.config.StackageDefaults;
import io.github.cyfko.stackage.core.log.Event;
import io.github.cyfko.stackage.core.log.EventSink;
import io.github.cyfko.stackage.core.utils.ValidationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Node logging")
class NodeLoggingTest {

    @Mock
    private EventSink sink;

    @BeforeEach
    void setUp() {
        StackageDefaults.reset();
    }

    @AfterEach
    void tearDown() {
        StackageDefaults.reset();
    }

    @Test
    @DisplayName("Should stay silent by default")
    void shouldStaySilentByDefault() {
        Stack.and().setEventSink(sink).push("a").pop();

        verifyNoInteractions(sink);
    }

    @Test
    @DisplayName("Should emit call events with the stack's state")
    void shouldEmitCallEvents() {
        Stack stack = Stack.list(4).setEventSink(sink).setId("filter").setCategory("ldap").setLogLevel(LogLevel.CALLS);

        stack.push("a");

        ArgumentCaptor<Event> captor = ArgumentCaptor.forClass(Event.class);
        verify(sink).accept(captor.capture());
        Event event = captor.getValue();
        assertEquals("CALLS", event.tag());
        assertEquals("S_ldap", event.type());
        assertEquals("filter", event.id());
        assertEquals(1, event.length());
        assertEquals(4, event.capacity());
        assertEquals(stack.getAddress(), event.address());
        assertTrue(event.message().startsWith("push"));
    }

    @Test
    @DisplayName("Should emit recorded errors")
    void shouldEmitErrors() {
        Stack stack = Stack.list().setEventSink(sink).setLogLevel(LogLevel.ERRORS)
                .setPushPolicy(v -> ValidationResult.failure("refused"));

        stack.push("a");

        verify(sink).accept(argThat(event -> "ERRORS".equals(event.tag()) && "refused".equals(event.message())));
    }

    @Test
    @DisplayName("Should toggle levels per instance")
    void shouldToggleLevels() {
        Stack stack = Stack.and().setLogLevel(LogLevel.STATE, LogLevel.TRACE);
        assertEquals(EnumSet.of(LogLevel.STATE, LogLevel.TRACE), stack.logLevels());

        stack.unsetLogLevel(LogLevel.TRACE);

        assertEquals(Set.of(LogLevel.STATE), stack.logLevels());
        assertEquals(Set.of(), Stack.and().logLevels());
    }

    @Test
    @DisplayName("Should copy process-wide defaults at construction")
    void shouldUseProcessDefaults() {
        StackageDefaults.initialize(StackageConfig.builder()
                .stackLogLevels(LogLevel.STATE)
                .conditionLogLevels(LogLevel.STATE)
                .eventSink(sink)
                .build());

        Stack stack = Stack.and();
        Condition condition = new Condition();

        verify(sink, times(2)).accept(any(Event.class));
        assertEquals(Set.of(LogLevel.STATE), stack.logLevels());
        assertEquals(Set.of(LogLevel.STATE), condition.logLevels());

        StackageDefaults.reset();
        assertEquals(Set.of(), Stack.and().logLevels());
        assertEquals(Set.of(LogLevel.STATE), stack.logLevels());
    }

    @Test
    @DisplayName("Should tag condition events")
    void shouldTagConditionEvents() {
        Condition condition = new Condition().setEventSink(sink).setCategory("acl").setLogLevel(LogLevel.STATE);

        condition.setKeyword("cn").setOperator(ComparisonOperator.EQ).setExpression("Jesse");

        ArgumentCaptor<Event> captor = ArgumentCaptor.forClass(Event.class);
        verify(sink, times(3)).accept(captor.capture());
        List<Event> events = captor.getAllValues();
        assertTrue(events.stream().allMatch(e -> "C_acl".equals(e.type()) && "STATE".equals(e.tag())));
        assertEquals(1, events.get(2).length());
    }
}
