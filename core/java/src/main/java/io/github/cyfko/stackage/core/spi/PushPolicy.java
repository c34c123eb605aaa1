package io.github.cyfko.stackage.core.spi;

import io.github.cyfko.stackage.core.utils.ValidationResult;

/**
 * Functional interface deciding whether a value may enter a stack or become a condition's expression.
 * <p>
 * When a push policy is installed it runs once per candidate value and fully replaces the built-in
 * nesting guard. A failed {@link ValidationResult} vetoes that single value; the failure message is
 * recorded as the owner's last error and the remaining values are still considered.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * Stack numbers = Stack.list()
 *     .setPushPolicy(v -> v instanceof Number
 *         ? ValidationResult.success()
 *         : ValidationResult.failure("Only numbers accepted, got %s", v.getClass().getSimpleName()));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface PushPolicy {

    /**
     * Checks a single candidate value.
     *
     * @param value the candidate, never null
     * @return success to accept the value, failure to veto it
     */
    ValidationResult check(Object value);
}
