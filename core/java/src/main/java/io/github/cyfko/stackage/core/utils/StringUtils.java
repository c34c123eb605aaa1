package io.github.cyfko.stackage.core.utils;

import java.util.List;
import java.util.regex.Pattern;

/**
 * String helpers shared by the stack and condition renderers.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class StringUtils {

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t]+");

    private StringUtils() {
    }

    /**
     * Collapses every run of spaces and tabs to a single space and trims the result.
     *
     * @param value text to condense, may be null
     * @return the condensed text, empty for null
     */
    public static String condense(String value) {
        if (value == null || value.isEmpty()) return "";
        return HORIZONTAL_WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    /**
     * Wraps {@code value} with every scheme, the first scheme ending up outermost.
     * <p>
     * With schemes {@code ["\"", "\""]} then {@code ["<", ">"]}, {@code x} becomes {@code "<x>"}.
     * </p>
     *
     * @param schemes left/right pairs in registration order
     * @param value   text to wrap
     * @return the wrapped text
     */
    public static String encapsulate(List<String[]> schemes, String value) {
        if (schemes == null || schemes.isEmpty()) return value;
        String result = value;
        for (int i = schemes.size() - 1; i >= 0; i--) {
            String[] scheme = schemes.get(i);
            result = scheme[0] + result + scheme[1];
        }
        return result;
    }

    /**
     * Tells whether any character of {@code candidate} already occurs in one of the schemes.
     *
     * @param schemes  registered left/right pairs
     * @param candidate characters about to be registered
     * @return true on conflict
     */
    public static boolean usesAnyChar(List<String[]> schemes, String candidate) {
        for (String[] scheme : schemes) {
            for (int i = 0; i < candidate.length(); i++) {
                char c = candidate.charAt(i);
                if (scheme[0].indexOf(c) >= 0 || scheme[1].indexOf(c) >= 0) return true;
            }
        }
        return false;
    }
}
