package io.github.cyfko.stackage.core.api;

/**
 * Capability shared by every operator a {@code Condition} can carry.
 * <p>
 * The library ships {@link ComparisonOperator} for the usual comparison symbols, but any type
 * that can render a symbol and name its context qualifies. This allows conditions such as LDAP
 * extensible matches or approximate matches to be represented without touching the core.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * Operator approx = new SymbolicOperator("~=", "ldap");
 * Condition c = Condition.of("cn", approx, "Jesse");
 * c.toString(); // "cn ~= Jesse"
 * }</pre>
 *
 * @see ComparisonOperator
 * @see SymbolicOperator
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface Operator {

    /**
     * Returns the text rendered between a condition's keyword and its expression, e.g. {@code "="}
     * or {@code "~="}.
     *
     * @return the operator symbol, never empty for a usable operator
     */
    String getSymbol();

    /**
     * Returns a short label describing the family of the operator, e.g. {@code "comparison"}.
     *
     * @return the operator context, never empty for a usable operator
     */
    String getContext();
}
