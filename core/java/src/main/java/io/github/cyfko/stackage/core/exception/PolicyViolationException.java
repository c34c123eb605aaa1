package io.github.cyfko.stackage.core.exception;

/**
 * Recorded when a caller-supplied policy declines a value or a state.
 * <p>
 * A push policy rejecting a pushed value, or a condition push policy rejecting an expression,
 * produces one of these. It is stored on the instance as its last error rather than thrown:
 * </p>
 *
 * <pre>{@code
 * Stack evens = Stack.list().setPushPolicy(v -> v instanceof Integer i && i % 2 == 0
 *         ? ValidationResult.success()
 *         : ValidationResult.failure("%s is not even", v));
 * evens.push(2, 3);
 * evens.err(); // PolicyViolationException: 3 is not even
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PolicyViolationException extends StackageException {

    /**
     * @param message explanation of the rejection, usually the policy's failure message
     */
    public PolicyViolationException(String message) {
        super(message);
    }
}
