package io.github.cyfko.stackage.core.utils;

/**
 * Class representing the outcome of a validity check, a policy decision or an equality comparison.
 * <p>
 * The result indicates either success or a failure with an associated error message.
 * Stacks and conditions return it from {@code valid()} and {@code isEqual(..)}, and every
 * caller-supplied policy answers with it.
 * </p>
 *
 * <p>Instances are immutable and created via the static methods
 * {@link #success()} and {@link #failure(String)}.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ValidationResult result = Stack.and().push("a").isEqual(Stack.or().push("a"));
 * if (!result.isValid()) {
 *     System.out.println("Not equal: " + result.getErrorMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(true, null);

    private final boolean valid;
    private final String errorMessage;

    /**
     * Private constructor - use via the static creation methods.
     *
     * @param valid        true if validation succeeded, false otherwise
     * @param errorMessage error message in case of failure, or null if valid
     */
    private ValidationResult(boolean valid, String errorMessage) {
        this.valid = valid;
        this.errorMessage = errorMessage;
    }

    /**
     * Returns the shared successful result.
     *
     * @return a valid result with no error message
     */
    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * Creates an instance indicating a failure with an error message.
     *
     * @param errorMessage message explaining the reason for failure
     * @return an invalid result containing the provided error message
     */
    public static ValidationResult failure(String errorMessage) {
        return new ValidationResult(false, errorMessage);
    }

    /**
     * Creates a failure whose message is built with {@link String#format(String, Object...)}.
     *
     * @param format message format
     * @param args   format arguments
     * @return an invalid result
     */
    public static ValidationResult failure(String format, Object... args) {
        return new ValidationResult(false, String.format(format, args));
    }

    /**
     * Indicates whether the check succeeded.
     *
     * @return true if valid, false otherwise
     */
    public boolean isValid() {
        return valid;
    }

    /**
     * Returns the error message associated with a failure.
     *
     * @return error message if invalid, or null if valid
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, error=" + errorMessage + "]";
    }
}
