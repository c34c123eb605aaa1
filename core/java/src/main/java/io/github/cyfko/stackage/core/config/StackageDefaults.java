package io.github.cyfko.stackage.core.config;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Holder of the process-wide {@link StackageConfig}.
 * <p>
 * Construction routines read {@link #current()} once and copy what they need, so changing the
 * defaults never affects existing nodes.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class StackageDefaults {

    private static final Logger log = Logger.getLogger(StackageDefaults.class.getName());

    private static volatile StackageConfig current = StackageConfig.defaults();

    private StackageDefaults() {
    }

    /**
     * Installs new defaults for subsequently constructed nodes.
     *
     * @param config the configuration to install
     * @throws NullPointerException if {@code config} is null
     */
    public static void initialize(StackageConfig config) {
        current = Objects.requireNonNull(config, "config");
        log.fine(() -> String.format("Stackage defaults installed: stacks=%s, conditions=%s",
                config.stackLogLevels(), config.conditionLogLevels()));
    }

    /**
     * Restores {@link StackageConfig#defaults()}.
     */
    public static void reset() {
        current = StackageConfig.defaults();
    }

    public static StackageConfig current() {
        return current;
    }
}
