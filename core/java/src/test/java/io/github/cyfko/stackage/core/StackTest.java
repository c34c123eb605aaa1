package io.github.cyfko.stackage.core;

import io.github.cyfko.stackage.core.api.ComparisonOperator;
import io.github.cyfko.stackage.core.api.Kind;
import io.github.cyfko.stackage.core.exception.EvaluationException;
import io.github.cyfko.stackage.core.exception.PolicyViolationException;
import io.github.cyfko.stackage.core.exception.UninitializedInstanceException;
import io.github.cyfko.stackage.core.utils.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Stack")
class StackTest {

    private static Stack abc() {
        return Stack.list().push("a", "b", "c");
    }

    @Nested
    @DisplayName("Push and pop")
    class PushAndPop {

        @Test
        @DisplayName("Should pop the last pushed value in LIFO order")
        void shouldPopLifo() {
            assertEquals(Optional.of("c"), abc().pop());
        }

        @Test
        @DisplayName("Should pop the first pushed value in FIFO order")
        void shouldPopFifo() {
            Stack stack = abc().setFifo(true);

            assertEquals(Optional.of("a"), stack.pop());
            assertEquals(Optional.of("b"), stack.pop());
        }

        @Test
        @DisplayName("Should never revert from FIFO to LIFO")
        void shouldKeepFifo() {
            Stack stack = abc().setFifo(true).setFifo(false);

            assertTrue(stack.isFifo());
            assertEquals(Optional.of("a"), stack.pop());
        }

        @Test
        @DisplayName("Should return empty when popping an empty stack")
        void shouldPopNothingFromEmpty() {
            Stack stack = Stack.and();

            assertTrue(stack.pop().isEmpty());
            assertNull(stack.err());
        }

        @Test
        @DisplayName("Should skip null values")
        void shouldSkipNulls() {
            Stack stack = Stack.list().push("a", null, "b");

            assertEquals(2, stack.len());
            assertEquals(List.of("a", "b"), stack.toList());
        }

        @Test
        @DisplayName("Should refuse nested stacks when nesting is disabled")
        void shouldRefuseNestingWhenDisabled() {
            Stack stack = Stack.and().noNesting().push("a", Stack.or().push("b"), "c");

            assertEquals(List.of("a", "c"), stack.toList());
            assertFalse(stack.canNest());
            assertInstanceOf(PolicyViolationException.class, stack.err());
        }

        @Test
        @DisplayName("Should let the push policy decide over the nesting switch")
        void shouldLetPolicyDecide() {
            Stack nested = Stack.or().push("b");
            Stack stack = Stack.and().noNesting()
                    .setPushPolicy(v -> ValidationResult.success())
                    .push(nested);

            assertEquals(1, stack.len());
            assertTrue(stack.isNesting());
        }

        @Test
        @DisplayName("Should veto single values refused by the push policy")
        void shouldVetoRefusedValues() {
            Stack stack = Stack.list()
                    .setPushPolicy(v -> v instanceof Number
                            ? ValidationResult.success()
                            : ValidationResult.failure("Only numbers accepted, got %s", v))
                    .push(1, "x", 2);

            assertEquals(List.of(1, 2), stack.toList());
            assertEquals("Only numbers accepted, got x", stack.err().getMessage());
        }

        @Test
        @DisplayName("Should clear the last error on request")
        void shouldClearError() {
            Stack stack = Stack.and().noNesting().push(Stack.or());
            assertNotNull(stack.err());

            stack.setErr(null);

            assertNull(stack.err());
        }
    }

    @Nested
    @DisplayName("Insert, remove, replace")
    class InsertRemoveReplace {

        @ParameterizedTest
        @ValueSource(ints = {0, 1, 2, 3})
        @DisplayName("Should find the inserted value at its index")
        void shouldInsertAtIndex(int index) {
            Stack stack = abc();

            assertTrue(stack.insert("x", index));
            assertEquals(Optional.of("x"), stack.index(index));
            assertEquals(4, stack.len());
        }

        @Test
        @DisplayName("Should clamp insertion positions")
        void shouldClampInsertion() {
            Stack stack = abc();

            assertTrue(stack.insert("first", -5));
            assertTrue(stack.insert("last", 99));
            assertEquals(List.of("first", "a", "b", "c", "last"), stack.toList());
        }

        @Test
        @DisplayName("Should never insert null")
        void shouldNotInsertNull() {
            assertFalse(abc().insert(null, 0));
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 1, 2})
        @DisplayName("Should compact leftward on removal")
        void shouldCompactOnRemoval(int index) {
            Stack stack = abc();

            assertTrue(stack.remove(index).isPresent());
            assertEquals(2, stack.len());
            for (int j = 0; j < stack.len(); j++) {
                assertTrue(stack.index(j).isPresent());
            }
        }

        @Test
        @DisplayName("Should return the removed value")
        void shouldReturnRemovedValue() {
            Stack stack = abc();

            assertEquals(Optional.of("b"), stack.remove(1));
            assertEquals(List.of("a", "c"), stack.toList());
            assertTrue(stack.remove(10).isEmpty());
        }

        @Test
        @DisplayName("Should replace in place")
        void shouldReplaceInPlace() {
            Stack stack = abc();

            assertTrue(stack.replace("z", 0));
            assertFalse(stack.replace(null, 1));
            assertFalse(stack.replace("z", 9));
            assertEquals(List.of("z", "b", "c"), stack.toList());
        }
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("Should reverse elements")
        void shouldReverse() {
            assertEquals(List.of("c", "b", "a"), abc().reverse().toList());
        }

        @Test
        @DisplayName("Should swap elements")
        void shouldSwap() {
            Stack stack = abc();

            assertTrue(stack.swap(0, 2));
            assertFalse(stack.swap(0, 7));
            assertEquals(List.of("c", "b", "a"), stack.toList());
        }

        @Test
        @DisplayName("Should sort by rendered text without an ordering policy")
        void shouldSortByText() {
            Stack stack = Stack.list().push("c", 1, "a", "b");

            assertEquals(List.of(1, "a", "b", "c"), stack.sort().toList());
        }

        @Test
        @DisplayName("Should sort with the ordering policy")
        void shouldSortWithPolicy() {
            Comparator<Object> descending = Comparator.comparing(Object::toString).reversed();
            Stack stack = abc().setOrderingPolicy(descending).sort();

            assertEquals(List.of("c", "b", "a"), stack.toList());
        }

        @Test
        @DisplayName("Should empty the stack on reset and keep its configuration")
        void shouldReset() {
            Stack stack = Stack.list().setDelimiter(",").push("a", "b").reset();

            assertEquals(0, stack.len());
            assertEquals(",", stack.delimiter());
        }
    }

    @Nested
    @DisplayName("Indexing")
    class Indexing {

        @Test
        @DisplayName("Should not resolve negative indices by default")
        void shouldRefuseNegativeIndices() {
            assertTrue(abc().index(-1).isEmpty());
        }

        @ParameterizedTest
        @CsvSource({"-1, c", "-3, a", "-4, c", "-5, b"})
        @DisplayName("Should wrap negative indices when enabled")
        void shouldWrapNegativeIndices(int index, String expected) {
            assertEquals(Optional.of(expected), abc().negativeIndices().index(index));
        }

        @Test
        @DisplayName("Should clamp forward indices when enabled")
        void shouldClampForwardIndices() {
            Stack stack = abc();
            assertTrue(stack.index(3).isEmpty());

            stack.forwardIndices();

            assertEquals(Optional.of("c"), stack.index(3));
            assertEquals(Optional.of("c"), stack.index(Integer.MAX_VALUE));
        }

        @Test
        @DisplayName("Should find nothing in an empty stack")
        void shouldFindNothingWhenEmpty() {
            Stack stack = Stack.list().negativeIndices().forwardIndices();

            assertTrue(stack.index(0).isEmpty());
            assertTrue(stack.index(-1).isEmpty());
        }
    }

    @Nested
    @DisplayName("Capacity")
    class Capacity {

        @Test
        @DisplayName("Should drop values beyond capacity")
        void shouldDropOverflow() {
            Stack stack = Stack.list(2).push("a", "b", "c");

            assertEquals(2, stack.len());
            assertEquals(2, stack.cap());
            assertEquals(0, stack.avail());
            assertTrue(stack.capReached());
            assertFalse(stack.insert("x", 0));
        }

        @Test
        @DisplayName("Should report unbounded stacks")
        void shouldReportUnbounded() {
            Stack stack = Stack.and(0).push("a");

            assertEquals(0, stack.cap());
            assertEquals(-1, stack.avail());
            assertFalse(stack.capReached());
        }

        @Test
        @DisplayName("Should transfer every element")
        void shouldTransfer() {
            Stack destination = Stack.or();

            assertTrue(abc().transfer(destination));
            assertEquals(List.of("a", "b", "c"), destination.toList());
        }

        @Test
        @DisplayName("Should report an incomplete transfer")
        void shouldReportIncompleteTransfer() {
            Stack destination = Stack.or(1);

            assertFalse(abc().transfer(destination));
            assertEquals(1, destination.len());
        }
    }

    @Nested
    @DisplayName("Read-only")
    class ReadOnly {

        @Test
        @DisplayName("Should ignore every mutator")
        void shouldIgnoreMutators() {
            Stack stack = abc().readOnly();

            stack.push("d");
            stack.reverse();
            stack.sort();
            stack.reset();

            assertTrue(stack.pop().isEmpty());
            assertFalse(stack.insert("x", 0));
            assertTrue(stack.remove(0).isEmpty());
            assertFalse(stack.replace("x", 0));
            assertFalse(stack.swap(0, 1));
            assertFalse(Stack.list().transfer(stack));
            assertEquals(List.of("a", "b", "c"), stack.toList());
        }

        @Test
        @DisplayName("Should accept mutations again once cleared")
        void shouldResumeWhenCleared() {
            Stack stack = abc().readOnly(true);
            assertTrue(stack.isReadOnly());

            stack.readOnly(false).push("d");

            assertEquals(4, stack.len());
        }
    }

    @Nested
    @DisplayName("Traversal")
    class Traversal {

        @Test
        @DisplayName("Should follow an index path into nested stacks")
        void shouldTraverseNestedStacks() {
            Stack stack = Stack.and().push("a", Stack.or().push("b", "c"));

            assertEquals(Optional.of("b"), stack.traverse(1, 0));
            assertEquals(Optional.of("c"), stack.traverse(1, 1));
        }

        @Test
        @DisplayName("Should return intermediate nodes when the path ends on them")
        void shouldReturnIntermediateNode() {
            Stack inner = Stack.or().push("b");
            Stack stack = Stack.and().push("a", inner);

            assertSame(inner, stack.traverse(1).orElseThrow());
        }

        @Test
        @DisplayName("Should descend through condition expressions")
        void shouldTraverseConditions() {
            Condition condition = Condition.of("k", ComparisonOperator.EQ, Stack.or().push("x", "y"));
            Stack stack = Stack.and().push(condition);

            assertSame(condition, stack.traverse(0).orElseThrow());
            assertEquals(Optional.of("y"), stack.traverse(0, 1));
        }

        @Test
        @DisplayName("Should abort when descending into a plain value")
        void shouldAbortOnPlainValue() {
            Stack stack = Stack.and().push("a", Stack.or().push("b"));

            assertTrue(stack.traverse(0, 0).isEmpty());
            assertTrue(stack.traverse(5).isEmpty());
            assertTrue(stack.traverse().isEmpty());
        }

        @Test
        @DisplayName("Should apply each stack's own index rules")
        void shouldApplyPerStackIndexRules() {
            Stack stack = Stack.and().negativeIndices().push("a", Stack.or().push("b", "c"));

            assertEquals(Optional.of("b"), stack.traverse(-1, 0));
            assertTrue(stack.traverse(-1, -1).isEmpty());
        }
    }

    @Nested
    @DisplayName("Reveal")
    class Reveal {

        @Test
        @DisplayName("Should collapse single-element nested stacks")
        void shouldCollapseSingletons() {
            Stack stack = Stack.and().push(Stack.or().push("x"), "y");
            String before = stack.toString();

            stack.reveal();

            assertEquals("x", stack.index(0).orElseThrow());
            assertEquals(before, stack.toString());
        }

        @Test
        @DisplayName("Should collapse at any depth")
        void shouldCollapseDeeply() {
            Stack stack = Stack.and().push(Stack.or().push(Stack.and().push("z")), "y").reveal();

            assertEquals("z", stack.index(0).orElseThrow());
        }

        @Test
        @DisplayName("Should keep NOT and parenthesized stacks")
        void shouldKeepNotAndParen() {
            Stack stack = Stack.and().push(Stack.not().push("x"), Stack.or().paren().push("y")).reveal();

            assertTrue(stack.index(0).orElseThrow() instanceof Stack);
            assertTrue(stack.index(1).orElseThrow() instanceof Stack);
            assertEquals("NOT x AND (y)", stack.toString());
        }

        @Test
        @DisplayName("Should collapse stacks held by conditions")
        void shouldCollapseConditionExpressions() {
            Condition condition = Condition.of("k", ComparisonOperator.EQ, Stack.and().push("v"));
            Stack stack = Stack.and().push(condition).reveal();

            assertEquals("v", condition.getExpression());
            assertEquals("k = v", stack.toString());
        }

        @Test
        @DisplayName("Should keep plain singletons under an encapsulating parent")
        void shouldKeepWhenParentEncapsulates() {
            Stack stack = Stack.and().encap("'").push(Stack.or().push("x"), "y");
            String before = stack.toString();

            stack.reveal();

            assertEquals(before, stack.toString());
            assertTrue(stack.index(0).orElseThrow() instanceof Stack);
        }
    }

    @Nested
    @DisplayName("Identity and introspection")
    class Identity {

        @Test
        @DisplayName("Should generate random identifiers")
        void shouldGenerateRandomId() {
            String id = Stack.and().setId(Stack.RANDOM_ID).getId();

            assertTrue(id.matches("[A-Z0-9]{24}"), id);
        }

        @Test
        @DisplayName("Should use the address as identifier")
        void shouldUseAddressAsId() {
            Stack stack = Stack.and().setId(Stack.ADDRESS_ID);

            assertEquals(stack.getAddress(), stack.getId());
            assertTrue(stack.getId().startsWith("0x"));
        }

        @Test
        @DisplayName("Should normalize categories")
        void shouldNormalizeCategory() {
            assertEquals("ldap", Stack.and().setCategory(" LDAP ").getCategory());
        }

        @Test
        @DisplayName("Should report kind and flags")
        void shouldReportKindAndFlags() {
            Stack stack = Stack.and().paren().noPadding().leadOnce();

            assertEquals(Kind.AND, stack.getKind());
            assertEquals("AND", stack.kind());
            assertEquals("and", stack.fold().kind());
            assertTrue(stack.isParen());
            assertFalse(stack.isPadded());
            assertTrue(stack.isLeadOnce());
            assertFalse(stack.paren().isParen());
            assertFalse(stack.isNesting());
            assertTrue(stack.push(Condition.of("a", ComparisonOperator.EQ, 1)).isNesting());
        }

        @Test
        @DisplayName("Should allocate the auxiliary store lazily")
        void shouldAllocateAuxiliaryLazily() {
            Stack stack = Stack.and();
            stack.auxiliary().set("owner", "directory");

            assertSame(stack.auxiliary(), stack.auxiliary());
            assertEquals(Optional.of("directory"), stack.auxiliary().get("owner", String.class));

            Auxiliary replacement = new Auxiliary().set("k", 1);
            assertSame(replacement, stack.setAuxiliary(replacement).auxiliary());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should become inert once freed")
        void shouldBecomeInertWhenFreed() {
            Stack stack = abc();

            stack.free();

            assertFalse(stack.isInit());
            assertEquals("", stack.toString());
            assertEquals(0, stack.len());
            assertFalse(stack.valid().isValid());
            assertNull(stack.auxiliary());
            assertNull(stack.getKind());
            assertEquals(0, stack.push("x").len());
            assertTrue(stack.index(0).isEmpty());
        }

        @Test
        @DisplayName("Should refuse freed nodes as elements")
        void shouldRefuseFreedElements() {
            Stack freed = Stack.or().push("x");
            freed.free();
            Condition released = Condition.of("cn", ComparisonOperator.EQ, "Jesse");
            released.free();

            Stack stack = Stack.and().push("a", freed, released);

            assertEquals(List.of("a"), stack.toList());
            assertInstanceOf(UninitializedInstanceException.class, stack.err());
            assertFalse(stack.insert(freed, 0));
            assertFalse(stack.replace(released, 0));
        }

        @Test
        @DisplayName("Should record a transfer into a freed stack")
        void shouldRecordTransferIntoFreedStack() {
            Stack source = abc();
            Stack destination = Stack.or();
            destination.free();

            assertFalse(source.transfer(destination));
            assertInstanceOf(UninitializedInstanceException.class, source.err());
        }

        @Test
        @DisplayName("Should reject a null kind")
        void shouldRejectNullKind() {
            assertThrows(NullPointerException.class, () -> Stack.of(null));
        }
    }

    @Nested
    @DisplayName("Evaluation")
    class Evaluation {

        @Test
        @DisplayName("Should fail without an evaluator")
        void shouldFailWithoutEvaluator() {
            EvaluationException e = assertThrows(EvaluationException.class, () -> Stack.and().evaluate());

            assertEquals("no evaluator configured", e.getMessage());
        }

        @Test
        @DisplayName("Should pass itself and the inputs to the evaluator")
        void shouldEvaluate() {
            Stack stack = Stack.list().push(1, 2, 3)
                    .setEvaluator((node, inputs) -> node.len() + (Integer) inputs[0]);

            assertEquals(13, stack.evaluate(10));
        }
    }
}
