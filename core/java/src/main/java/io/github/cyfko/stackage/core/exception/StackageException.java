package io.github.cyfko.stackage.core.exception;

/**
 * Base class of every exception raised or recorded by Stackage.
 * <p>
 * Mutating operations on stacks and conditions never throw for ordinary failures: they record the
 * most recent {@code StackageException} on the instance (see {@code Stack#err()}) and leave the
 * structure untouched. Equality, marshaling and evaluation report their failures directly to the
 * caller instead.
 * </p>
 *
 * <p><strong>Taxonomy:</strong></p>
 * <ul>
 *   <li>{@link UninitializedInstanceException} - construction or state errors</li>
 *   <li>{@link PolicyViolationException} - a push or validity policy declined a value or state</li>
 *   <li>{@link MarshalException} - incompatible shapes during neutral-form transcoding</li>
 *   <li>{@link EvaluationException} - missing or failing evaluator</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class StackageException extends RuntimeException {

    /**
     * @param message explanation of the failure
     */
    public StackageException(String message) {
        super(message);
    }

    /**
     * @param message explanation of the failure
     * @param cause   underlying exception
     */
    public StackageException(String message, Throwable cause) {
        super(message, cause);
    }
}
