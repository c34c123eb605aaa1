package io.github.cyfko.stackage.core.spi;

import io.github.cyfko.stackage.core.utils.ValidationResult;

/**
 * Replaces the structural comparison of a stack or condition.
 * <p>
 * When installed on either side of a comparison it fully supersedes the default algorithm.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface EqualityPolicy {

    /**
     * @param self  the node owning the policy
     * @param other the value compared against
     * @return success when both are considered equal
     */
    ValidationResult compare(Object self, Object other);
}
