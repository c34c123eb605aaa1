package io.github.cyfko.stackage.core;

/**
 * Capability of types that wrap a {@link Stack}.
 * <p>
 * Values implementing this interface are treated exactly like the stack they expose: they are
 * rendered, traversed, compared and transcoded as nested stacks.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * public final class SearchFilter implements StackConvertible {
 *     private final Stack stack = Stack.and().symbol("&").leadOnce().noPadding().paren();
 *
 *     public SearchFilter require(String clause) {
 *         stack.push(clause);
 *         return this;
 *     }
 *
 *     @Override
 *     public Stack asStack() {
 *         return stack;
 *     }
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface StackConvertible {

    /**
     * @return the underlying stack, never null
     */
    Stack asStack();
}
