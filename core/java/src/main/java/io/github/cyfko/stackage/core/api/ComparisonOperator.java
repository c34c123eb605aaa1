package io.github.cyfko.stackage.core.api;

import java.util.Optional;

/**
 * Enumeration of the built-in comparison operators.
 * <p>
 * Each operator defines its display symbol and a short code. All of them share the
 * {@value #CONTEXT} context.
 * </p>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * Condition c = Condition.of("person", ComparisonOperator.EQ, "Jesse");
 * c.toString(); // "person = Jesse"
 *
 * // Parse operator from symbol or code string
 * ComparisonOperator op = ComparisonOperator.fromString(">=").orElseThrow(); // GE
 * }</pre>
 *
 * <p><strong>Symbol and code mappings:</strong></p>
 * <ul>
 *     <li>EQ / =</li>
 *     <li>NE / !=</li>
 *     <li>LT / &lt;</li>
 *     <li>GT / &gt;</li>
 *     <li>LE / &lt;=</li>
 *     <li>GE / &gt;=</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ComparisonOperator implements Operator {

    /** Equality operator: "=" */
    EQ("=", "EQ"),

    /** Not equal operator: "!=" */
    NE("!=", "NE"),

    /** Less than operator: "&lt;" */
    LT("<", "LT"),

    /** Greater than operator: ">" */
    GT(">", "GT"),

    /** Less than or equal operator: "&lt;=" */
    LE("<=", "LE"),

    /** Greater than or equal operator: ">=" */
    GE(">=", "GE");

    /**
     * Context label reported by every comparison operator.
     */
    public static final String CONTEXT = "comparison";

    private final String symbol;
    private final String code;

    ComparisonOperator(String symbol, String code) {
        this.symbol = symbol;
        this.code = code;
    }

    /**
     * Returns the display symbol of the operator, such as "=" or "&lt;=".
     *
     * @return the symbol representing the operator
     */
    @Override
    public String getSymbol() {
        return symbol;
    }

    /**
     * @return {@value #CONTEXT}
     */
    @Override
    public String getContext() {
        return CONTEXT;
    }

    /**
     * Returns the short code identifier for the operator, e.g. "EQ".
     *
     * @return the short code string identifying the operator
     */
    public String getCode() {
        return code;
    }

    /**
     * Finds a {@code ComparisonOperator} by its display symbol only. Codes are not matched, so a
     * custom operator spelled {@code gt} is never mistaken for {@link #GT}.
     *
     * @param symbol exact symbol, surrounding blanks ignored
     * @return the matching operator, or empty
     */
    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        if (symbol == null) return Optional.empty();
        String trimmed = symbol.trim();
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(trimmed)) return Optional.of(op);
        }
        return Optional.empty();
    }

    /**
     * Finds a {@code ComparisonOperator} by its symbol or code, ignoring case and surrounding blanks.
     *
     * @param value symbol or code string to search for
     * @return the matching operator, or empty when nothing matches
     */
    public static Optional<ComparisonOperator> fromString(String value) {
        if (value == null) return Optional.empty();
        String trimmed = value.trim();

        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(trimmed) || op.code.equalsIgnoreCase(trimmed)) return Optional.of(op);
        }

        return Optional.empty();
    }
}
