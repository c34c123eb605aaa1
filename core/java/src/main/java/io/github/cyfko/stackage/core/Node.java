package io.github.cyfko.stackage.core;

import io.github.cyfko.stackage.core.config.LogLevel;
import io.github.cyfko.stackage.core.exception.StackageException;
import io.github.cyfko.stackage.core.utils.ValidationResult;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read surface shared by {@link Stack} and {@link Condition}.
 * <p>
 * Policies in the {@code spi} package receive nodes through this interface. Use
 * {@link #toStack(Object)} and {@link #toCondition(Object)} to recognize elements, including
 * values that merely wrap a stack or a condition.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface Node {

    /**
     * @return false once {@code free()} has been called
     */
    boolean isInit();

    int len();

    ValidationResult valid();

    /**
     * Compares this node with any value, see {@link io.github.cyfko.stackage.core.utils.EqualityUtils}.
     *
     * @param other value to compare with
     * @return the verdict
     */
    ValidationResult isEqual(Object other);

    /**
     * Encodes this node in neutral form.
     *
     * @return a tag-led nested list
     * @throws io.github.cyfko.stackage.core.exception.MarshalException if encoding fails
     */
    List<Object> unmarshal();

    /**
     * Runs the configured evaluator.
     *
     * @param inputs caller-supplied arguments
     * @return the evaluator's result
     * @throws io.github.cyfko.stackage.core.exception.EvaluationException if no evaluator is set or it fails
     */
    Object evaluate(Object... inputs);

    boolean isParen();

    boolean isPadded();

    boolean isEncap();

    boolean isNesting();

    boolean canNest();

    String getId();

    String getCategory();

    /**
     * @return the identity hash code in {@code 0x} hex form
     */
    String getAddress();

    /**
     * @return the most recently recorded error, or null
     */
    StackageException err();

    /**
     * @return the auxiliary store, allocated on first access, or null when uninitialized
     */
    Auxiliary auxiliary();

    Set<LogLevel> logLevels();

    /**
     * Recognizes stacks and values wrapping one.
     *
     * @param value any value
     * @return the stack, or empty
     */
    static Optional<Stack> toStack(Object value) {
        if (value instanceof Stack stack) return Optional.of(stack);
        if (value instanceof StackConvertible convertible) return Optional.ofNullable(convertible.asStack());
        return Optional.empty();
    }

    /**
     * Recognizes conditions and values wrapping one.
     *
     * @param value any value
     * @return the condition, or empty
     */
    static Optional<Condition> toCondition(Object value) {
        if (value instanceof Condition condition) return Optional.of(condition);
        if (value instanceof ConditionConvertible convertible) return Optional.ofNullable(convertible.asCondition());
        return Optional.empty();
    }
}
