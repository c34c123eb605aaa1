package io.github.cyfko.stackage.core.codec;

import io.github.cyfko.stackage.core.Condition;
import io.github.cyfko.stackage.core.Stack;
import io.github.cyfko.stackage.core.api.ComparisonOperator;
import io.github.cyfko.stackage.core.api.Kind;
import io.github.cyfko.stackage.core.api.SymbolicOperator;
import io.github.cyfko.stackage.core.exception.MarshalException;
import io.github.cyfko.stackage.core.exception.PolicyViolationException;
import io.github.cyfko.stackage.core.spi.PushPolicy;
import io.github.cyfko.stackage.core.utils.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Neutral form transcoding")
class NeutralCodecTest {

    private static Stack sample() {
        return Stack.and().push(
                "a",
                Condition.of("cn", ComparisonOperator.EQ, "Jesse"),
                Stack.or().push(1, 2),
                Condition.of("ou", ComparisonOperator.NE, Stack.list().push("x", "y")),
                Stack.not().push("b"));
    }

    @Nested
    @DisplayName("Unmarshal")
    class Unmarshal {

        @Test
        @DisplayName("Should lead with the kind tag and encode nodes recursively")
        void shouldEncodeRecursively() {
            List<Object> expected = List.of(
                    "AND",
                    "a",
                    List.of("CONDITION", "cn", "=", "Jesse"),
                    List.of("OR", 1, 2),
                    List.of("CONDITION", "ou", "!=", List.of("LIST", "x", "y")),
                    List.of("NOT", "b"));

            assertEquals(expected, sample().unmarshal());
        }

        @Test
        @DisplayName("Should use the unmarshal policy when set")
        void shouldUseUnmarshalPolicy() {
            Stack stack = Stack.list().push("x")
                    .setUnmarshalPolicy(node -> List.of("custom", node.len()));

            assertEquals(List.of("custom", 1), stack.unmarshal());
            assertEquals(List.of("AND", List.of("custom", 1)), Stack.and().push(stack).unmarshal());
        }

        @Test
        @DisplayName("Should wrap unmarshal policy failures")
        void shouldWrapUnmarshalFailures() {
            Stack stack = Stack.list().setUnmarshalPolicy(node -> {
                throw new IOException("disk full");
            });

            MarshalException e = assertThrows(MarshalException.class, stack::unmarshal);
            assertInstanceOf(IOException.class, e.getCause());
        }

        @Test
        @DisplayName("Should refuse uninitialized nodes")
        void shouldRefuseUninitialized() {
            Stack stack = Stack.and();
            stack.free();
            Condition condition = new Condition();
            condition.free();

            assertThrows(MarshalException.class, stack::unmarshal);
            assertThrows(MarshalException.class, condition::unmarshal);
        }
    }

    @Nested
    @DisplayName("Marshal")
    class Marshal {

        @Test
        @DisplayName("Should reproduce the rendering and structure after a round trip")
        void shouldRoundTrip() {
            Stack original = sample();

            Stack copy = Stack.basic().marshal(original.unmarshal());

            assertEquals(Kind.AND, copy.getKind());
            assertEquals(original.toString(), copy.toString());
            assertTrue(original.isEqual(copy).isValid(), () -> original.isEqual(copy).getErrorMessage());
        }

        @Test
        @DisplayName("Should clear and re-kind the receiver")
        void shouldReplaceReceiverContents() {
            Stack receiver = Stack.and().push("old", "values");

            receiver.marshal(List.of("LIST", "x", "y"));

            assertEquals(Kind.LIST, receiver.getKind());
            assertEquals(List.of("x", "y"), receiver.toList());
        }

        @Test
        @DisplayName("Should decode untagged lists as BASIC stacks")
        void shouldDecodeUntaggedAsBasic() {
            Stack stack = NeutralCodec.decodeStack(List.of("x", "y"));

            assertEquals(Kind.BASIC, stack.getKind());
            assertEquals(List.of("x", "y"), stack.toList());
            assertEquals(Kind.BASIC, NeutralCodec.decodeStack(List.of()).getKind());
        }

        @Test
        @DisplayName("Should resolve operator symbols")
        void shouldResolveOperators() {
            Condition le = NeutralCodec.decodeCondition(List.of("CONDITION", "age", "<=", 30));
            Condition approx = NeutralCodec.decodeCondition(List.of("CONDITION", "cn", "~=", "Jesse"));

            assertSame(ComparisonOperator.LE, le.getOperator());
            assertEquals(new SymbolicOperator("~=", SymbolicOperator.CUSTOM_CONTEXT), approx.getOperator());
            assertEquals("cn ~= Jesse", approx.toString());
        }

        @Test
        @DisplayName("Should keep custom operators spelled like comparison codes")
        void shouldKeepCustomOperatorsSpelledLikeCodes() {
            Stack original = Stack.and().push(
                    Condition.of("age", new SymbolicOperator("gt", SymbolicOperator.CUSTOM_CONTEXT), "5"), "b");

            Stack copy = Stack.basic().marshal(original.unmarshal());

            assertEquals("age gt 5 AND b", copy.toString());
            assertEquals(original.toString(), copy.toString());
            Condition eq = NeutralCodec.decodeCondition(List.of("CONDITION", "cn", "EQ", "Jesse"));
            assertEquals(new SymbolicOperator("EQ", SymbolicOperator.CUSTOM_CONTEXT), eq.getOperator());
        }

        @Test
        @DisplayName("Should apply the receiver's push policy to decoded values")
        void shouldApplyPushPolicy() {
            PushPolicy okOnly = value -> String.valueOf(value).startsWith("ok")
                    ? ValidationResult.success()
                    : ValidationResult.failure("only ok* values");
            Stack receiver = Stack.and().noNesting().setPushPolicy(okOnly);

            receiver.marshal(List.of("AND", "bad", List.of("OR", "x"), "okay"));

            assertEquals(List.of("okay"), receiver.toList());
            assertFalse(receiver.isNesting());
            assertInstanceOf(PolicyViolationException.class, receiver.err());

            Stack pushed = Stack.and().setPushPolicy(okOnly).push("bad", Stack.or().push("x"), "okay");
            assertTrue(receiver.isEqual(pushed).isValid());
        }

        @Test
        @DisplayName("Should refuse nested stacks when nesting is disabled")
        void shouldRefuseNestedStacksWithoutNesting() {
            Stack receiver = Stack.and().noNesting();

            receiver.marshal(List.of("OR", "a", List.of("AND", "x", "y"), List.of("CONDITION", "cn", "=", "b")));

            assertEquals(2, receiver.len());
            assertEquals("a OR cn = b", receiver.toString());
            assertInstanceOf(PolicyViolationException.class, receiver.err());
        }

        @Test
        @DisplayName("Should drop configuration a BASIC kind cannot carry")
        void shouldDropConfigurationOnBasic() {
            Stack receiver = Stack.and().setSymbol("&&").setPresentationPolicy(elements -> "custom");

            receiver.marshal(List.of("x", "y"));

            assertEquals(Kind.BASIC, receiver.getKind());
            assertEquals("", receiver.symbol());
            assertEquals("a AND b", receiver.marshal(List.of("AND", "a", "b")).toString());
        }

        @Test
        @DisplayName("Should refuse a decoded expression the condition does not admit")
        void shouldRefuseDecodedExpression() {
            Condition condition = Condition.of("cn", ComparisonOperator.EQ, "Jesse").noNesting();

            MarshalException e = assertThrows(MarshalException.class, () ->
                    condition.marshal(List.of("CONDITION", "ou", "=", List.of("OR", "People", "Groups"))));

            assertInstanceOf(PolicyViolationException.class, e.getCause());
            assertEquals("cn = Jesse", condition.toString());
        }

        @Test
        @DisplayName("Should round-trip a condition")
        void shouldRoundTripCondition() {
            Condition original = Condition.of("ou", ComparisonOperator.EQ, Stack.or().push("People", "Groups"));

            Condition copy = new Condition().marshal(original.unmarshal());

            assertEquals("ou = People OR Groups", copy.toString());
            assertTrue(original.isEqual(copy).isValid());
        }

        @Test
        @DisplayName("Should reject malformed conditions")
        void shouldRejectMalformedConditions() {
            assertThrows(MarshalException.class,
                    () -> NeutralCodec.decodeCondition(List.of("CONDITION", "cn", "=")));
            assertThrows(MarshalException.class,
                    () -> NeutralCodec.decodeCondition(Arrays.asList("CONDITION", "cn", null, "x")));
            assertThrows(MarshalException.class,
                    () -> NeutralCodec.decodeCondition(Arrays.asList("CONDITION", "cn", "=", null)));
            assertThrows(MarshalException.class,
                    () -> Stack.and().marshal(List.of("AND", List.of("CONDITION", "cn"))));
        }

        @Test
        @DisplayName("Should reject null input and uninitialized receivers")
        void shouldRejectNullAndUninitialized() {
            Stack freed = Stack.and();
            freed.free();

            assertThrows(MarshalException.class, () -> Stack.and().marshal(null));
            assertThrows(MarshalException.class, () -> freed.marshal(List.of("AND")));
        }

        @Test
        @DisplayName("Should leave read-only receivers untouched")
        void shouldSkipReadOnlyReceiver() {
            Stack receiver = Stack.list().push("keep").readOnly();

            receiver.marshal(List.of("AND", "x"));

            assertEquals(Kind.LIST, receiver.getKind());
            assertEquals(List.of("keep"), receiver.toList());
        }

        @Test
        @DisplayName("Should respect the receiver's capacity")
        void shouldRespectCapacity() {
            Stack receiver = Stack.list(2).marshal(List.of("OR", 1, 2, 3));

            assertEquals(List.of(1, 2), receiver.toList());
        }

        @Test
        @DisplayName("Should use the marshal policy when set")
        void shouldUseMarshalPolicy() {
            Stack receiver = Stack.list().setMarshalPolicy((target, neutral) ->
                    ((Stack) target).push(neutral.size()));

            receiver.marshal(List.of("a", "b", "c"));

            assertEquals(List.of(3), receiver.toList());
        }

        @Test
        @DisplayName("Should wrap marshal policy failures")
        void shouldWrapMarshalFailures() {
            Stack receiver = Stack.list().setMarshalPolicy((target, neutral) -> {
                throw new IllegalArgumentException("bad shape");
            });

            MarshalException e = assertThrows(MarshalException.class, () -> receiver.marshal(List.of()));
            assertEquals("marshal policy failed: bad shape", e.getMessage());
        }
    }
}
