package io.github.cyfko.stackage.core.spi;

import io.github.cyfko.stackage.core.Node;

import java.util.List;

/**
 * Replaces the default neutral-form encoder of a stack or condition.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see MarshalPolicy
 */
@FunctionalInterface
public interface UnmarshalPolicy {

    /**
     * @param source the node being encoded
     * @return its neutral form
     * @throws Exception if the node cannot be encoded
     */
    List<Object> unmarshal(Node source) throws Exception;
}
