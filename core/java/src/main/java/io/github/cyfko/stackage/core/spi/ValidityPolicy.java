package io.github.cyfko.stackage.core.spi;

import io.github.cyfko.stackage.core.Node;
import io.github.cyfko.stackage.core.utils.ValidationResult;

/**
 * Replaces the built-in validity check of a stack or condition.
 * <p>
 * Invalid nodes render as a fixed sentinel instead of their content.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface ValidityPolicy {

    /**
     * @param node the node being checked
     * @return the verdict
     */
    ValidationResult validate(Node node);
}
