package io.github.cyfko.stackage.core.exception;

/**
 * Thrown by {@code evaluate(..)} when no evaluator is configured, or when the configured
 * evaluator fails.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EvaluationException extends StackageException {

    /**
     * @param message explanation of the failure
     */
    public EvaluationException(String message) {
        super(message);
    }

    /**
     * @param message explanation of the failure
     * @param cause   exception raised by the evaluator
     */
    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
