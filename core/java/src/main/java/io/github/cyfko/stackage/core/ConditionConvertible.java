package io.github.cyfko.stackage.core;

/**
 * Capability of types that wrap a {@link Condition}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see StackConvertible
 */
public interface ConditionConvertible {

    /**
     * @return the underlying condition, never null
     */
    Condition asCondition();
}
