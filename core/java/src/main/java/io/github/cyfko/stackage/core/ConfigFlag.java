package io.github.cyfko.stackage.core;

/**
 * Boolean switches held by a {@link NodeConfig}.
 */
enum ConfigFlag {
    PAREN,
    FOLD,
    NO_PAD,
    LEAD_ONCE,
    NEGATIVE_INDICES,
    FORWARD_INDICES,
    READ_ONLY,
    NO_NEST,
    FIFO
}
