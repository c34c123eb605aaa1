package io.github.cyfko.stackage.core.spi;

import java.util.List;

/**
 * Fully replaces the rendering algorithm of a stack or condition.
 * <p>
 * A stack hands over a read-only snapshot of its elements. A condition hands over a three-element
 * list: keyword, operator (possibly null) and expression.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * Stack csv = Stack.list().setPresentationPolicy(elements ->
 *     elements.stream().map(String::valueOf).collect(Collectors.joining(";")));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface PresentationPolicy {

    /**
     * @param parts read-only snapshot of what would otherwise be rendered
     * @return the rendered text
     */
    String present(List<Object> parts);
}
