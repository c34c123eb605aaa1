package io.github.cyfko.stackage.core.spi;

import io.github.cyfko.stackage.core.Node;

import java.util.List;

/**
 * Replaces the default neutral-form decoder when filling a stack or condition.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see UnmarshalPolicy
 */
@FunctionalInterface
public interface MarshalPolicy {

    /**
     * Populates {@code target} from {@code neutral}.
     *
     * @param target  the receiver being filled
     * @param neutral the neutral-form input
     * @throws Exception if the input cannot be decoded
     */
    void marshal(Node target, List<?> neutral) throws Exception;
}
