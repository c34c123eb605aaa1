package io.github.cyfko.stackage.core.exception;

/**
 * Signals an operation attempted on a stack or condition whose configuration record was released
 * (see {@code free()}), or which never carried a valid kind.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UninitializedInstanceException extends StackageException {

    /**
     * @param message explanation of the state error
     */
    public UninitializedInstanceException(String message) {
        super(message);
    }
}
