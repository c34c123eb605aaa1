package io.github.cyfko.stackage.core.exception;

/**
 * Thrown when a stack or condition cannot be transcoded to or from the neutral nested-list form.
 * <p>
 * Typical causes are a condition list that does not carry exactly four entries, an operator entry
 * that is neither a string nor an operator, or a custom marshal policy that failed. The exception is
 * reported to the immediate caller and is never recorded on the instance.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MarshalException extends StackageException {

    /**
     * @param message explanation of the incompatibility
     */
    public MarshalException(String message) {
        super(message);
    }

    /**
     * @param message explanation of the incompatibility
     * @param cause   underlying exception, e.g. one thrown by a custom policy
     */
    public MarshalException(String message, Throwable cause) {
        super(message, cause);
    }
}
