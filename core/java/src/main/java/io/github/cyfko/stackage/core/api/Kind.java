package io.github.cyfko.stackage.core.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of a {@code Stack}, governing how its elements are joined when rendered.
 *
 * <ul>
 *   <li>{@link #AND}, {@link #OR}, {@link #NOT} - Boolean stacks joined by their operator word or a custom symbol</li>
 *   <li>{@link #LIST} - plain lists joined by a delimiter</li>
 *   <li>{@link #BASIC} - storage only; never rendered</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Kind {
    AND,
    OR,
    NOT,
    LIST,
    BASIC;

    /**
     * Tells whether stacks of this kind inject an operator between (or before) their elements.
     *
     * @return true for AND, OR and NOT
     */
    public boolean isBoolean() {
        return this == AND || this == OR || this == NOT;
    }

    /**
     * Returns the operator word, optionally case-folded.
     *
     * @param fold true to fold to lower case
     * @return e.g. {@code "AND"} or {@code "and"}
     */
    public String word(boolean fold) {
        return fold ? name().toLowerCase(Locale.ROOT) : name();
    }

    /**
     * Resolves a neutral-form tag (case-sensitive, as written by the encoder).
     *
     * @param tag candidate tag
     * @return the kind, or empty when the value is not a kind tag
     */
    public static Optional<Kind> fromTag(Object tag) {
        if (!(tag instanceof String s)) return Optional.empty();
        for (Kind kind : values()) {
            if (kind.name().equals(s)) return Optional.of(kind);
        }
        return Optional.empty();
    }
}
