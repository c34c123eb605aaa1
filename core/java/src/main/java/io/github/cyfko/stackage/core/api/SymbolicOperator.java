package io.github.cyfko.stackage.core.api;

import java.util.Objects;

/**
 * Free-form {@link Operator} made of a symbol and a context label.
 * <p>
 * The neutral-form decoder produces instances of this type for operator symbols that are not
 * {@link ComparisonOperator comparison operators}; callers can use it directly for one-off operators.
 * </p>
 *
 * @param symbol  rendered operator text
 * @param context operator family label
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SymbolicOperator(String symbol, String context) implements Operator {

    /**
     * Context assigned to operators recovered from the neutral form.
     */
    public static final String CUSTOM_CONTEXT = "custom";

    /**
     * @throws NullPointerException if either component is null
     * @throws IllegalArgumentException if either component is blank
     */
    public SymbolicOperator {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(context, "context");
        if (symbol.isBlank() || context.isBlank()) {
            throw new IllegalArgumentException("Operator symbol and context must not be blank");
        }
    }

    /**
     * Resolves a symbol to the comparison operator rendering the same symbol, else to a custom
     * symbolic operator. Operator codes such as {@code EQ} are not recognized here.
     *
     * @param symbol operator text
     * @return the resolved operator
     */
    public static Operator resolve(String symbol) {
        return ComparisonOperator.fromSymbol(symbol)
                .<Operator>map(op -> op)
                .orElseGet(() -> new SymbolicOperator(symbol.trim(), CUSTOM_CONTEXT));
    }

    @Override
    public String getSymbol() {
        return symbol;
    }

    @Override
    public String getContext() {
        return context;
    }
}
