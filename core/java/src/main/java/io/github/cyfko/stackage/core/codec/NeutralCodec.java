package io.github.cyfko.stackage.core.codec;

import io.github.cyfko.stackage.core.Condition;
import io.github.cyfko.stackage.core.Node;
import io.github.cyfko.stackage.core.Stack;
import io.github.cyfko.stackage.core.api.Kind;
import io.github.cyfko.stackage.core.api.Operator;
import io.github.cyfko.stackage.core.api.SymbolicOperator;
import io.github.cyfko.stackage.core.exception.MarshalException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Default transcoder between nodes and their neutral form.
 * <p>
 * The neutral form is made only of lists and plain values so it can be handed to any serializer:
 * </p>
 * <ul>
 *   <li>a stack becomes {@code [KIND, element...]} where {@code KIND} is one of
 *       {@code AND}, {@code OR}, {@code NOT}, {@code LIST}, {@code BASIC}</li>
 *   <li>a condition becomes {@code ["CONDITION", keyword, operatorSymbol, expression]}</li>
 *   <li>nested nodes are encoded recursively; any other value is kept as is</li>
 * </ul>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * Stack s = Stack.and().push("a", Condition.of("cn", ComparisonOperator.EQ, "Jesse"));
 * NeutralCodec.encode(s);
 * // ["AND", "a", ["CONDITION", "cn", "=", "Jesse"]]
 *
 * NeutralCodec.decodeStack(List.of("x", "y")); // BASIC stack holding "x" and "y"
 * }</pre>
 *
 * <p>
 * Decoding a list without a known leading tag produces a BASIC stack holding every entry. Operator
 * symbols resolve to {@link io.github.cyfko.stackage.core.api.ComparisonOperator} when possible and
 * to a {@link SymbolicOperator} with the {@value SymbolicOperator#CUSTOM_CONTEXT} context otherwise.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NeutralCodec {

    private static final Logger log = Logger.getLogger(NeutralCodec.class.getName());

    /**
     * Leading tag of an encoded condition.
     */
    public static final String CONDITION_TAG = "CONDITION";

    private static final int CONDITION_SIZE = 4;

    private NeutralCodec() {
    }

    /**
     * Encodes a stack with the default convention, ignoring its unmarshal policy. Nested nodes are
     * encoded through their own {@code unmarshal()}, so their policies apply.
     *
     * @param stack the stack to encode
     * @return the neutral form
     * @throws MarshalException if the stack is uninitialized
     */
    public static List<Object> encode(Stack stack) {
        if (stack == null || !stack.isInit()) throw new MarshalException("cannot encode an uninitialized stack");
        List<Object> elements = stack.toList();
        List<Object> out = new ArrayList<>(elements.size() + 1);
        out.add(stack.getKind().name());
        for (Object element : elements) {
            out.add(encodeValue(element));
        }
        return out;
    }

    /**
     * Encodes a condition with the default convention, ignoring its unmarshal policy.
     *
     * @param condition the condition to encode
     * @return {@code ["CONDITION", keyword, operatorSymbol, expression]}
     * @throws MarshalException if the condition is uninitialized
     */
    public static List<Object> encode(Condition condition) {
        if (condition == null || !condition.isInit()) {
            throw new MarshalException("cannot encode an uninitialized condition");
        }
        Operator operator = condition.getOperator();
        List<Object> out = new ArrayList<>(CONDITION_SIZE);
        out.add(CONDITION_TAG);
        out.add(condition.getKeyword());
        out.add(operator == null ? null : operator.getSymbol());
        out.add(encodeValue(condition.getExpression()));
        return out;
    }

    private static Object encodeValue(Object value) {
        Optional<Stack> stack = Node.toStack(value);
        if (stack.isPresent()) return stack.get().unmarshal();
        Optional<Condition> condition = Node.toCondition(value);
        if (condition.isPresent()) return condition.get().unmarshal();
        return value;
    }

    /**
     * Builds a new stack from its neutral form.
     *
     * @param neutral tag-led list; an unknown or missing tag yields a BASIC stack
     * @return the decoded stack
     * @throws MarshalException if the input or a nested condition is malformed
     */
    public static Stack decodeStack(List<?> neutral) {
        if (neutral == null) throw new MarshalException("neutral form must not be null");

        Optional<Kind> kind = neutral.isEmpty() ? Optional.empty() : Kind.fromTag(neutral.get(0));
        if (kind.isEmpty() && !neutral.isEmpty()) {
            log.fine(() -> String.format("No kind tag in neutral form of %d entries; decoding as BASIC", neutral.size()));
        }

        Stack stack = Stack.of(kind.orElse(Kind.BASIC));
        List<?> entries = kind.isPresent() ? neutral.subList(1, neutral.size()) : neutral;
        for (Object entry : entries) {
            Object decoded = decodeValue(entry);
            if (decoded != null) stack.push(decoded);
        }
        return stack;
    }

    /**
     * Builds a new condition from its neutral form.
     *
     * @param neutral {@code ["CONDITION", keyword, operatorSymbol, expression]}
     * @return the decoded condition
     * @throws MarshalException if the input is not a well-formed condition
     */
    public static Condition decodeCondition(List<?> neutral) {
        if (neutral == null || neutral.size() != CONDITION_SIZE || !CONDITION_TAG.equals(neutral.get(0))) {
            throw new MarshalException("condition neutral form must be [\"" + CONDITION_TAG
                    + "\", keyword, operator, expression], got " + neutral);
        }

        Operator operator = decodeOperator(neutral.get(2));
        Object expression = decodeValue(neutral.get(3));
        if (expression == null) throw new MarshalException("condition expression must not be null");

        Condition condition = Condition.of(neutral.get(1) == null ? "" : neutral.get(1), operator, expression);
        if (condition.err() != null) {
            throw new MarshalException("cannot rebuild condition: " + condition.err().getMessage(), condition.err());
        }
        return condition;
    }

    private static Operator decodeOperator(Object value) {
        if (value instanceof Operator operator) return operator;
        if (value instanceof String symbol && !symbol.isBlank()) return SymbolicOperator.resolve(symbol);
        throw new MarshalException("condition operator must be a non-empty symbol, got " + value);
    }

    private static Object decodeValue(Object value) {
        if (value instanceof List<?> list) {
            if (!list.isEmpty() && CONDITION_TAG.equals(list.get(0))) return decodeCondition(list);
            return decodeStack(list);
        }
        return value;
    }
}
