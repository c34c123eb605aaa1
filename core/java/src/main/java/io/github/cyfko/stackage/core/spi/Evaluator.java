package io.github.cyfko.stackage.core.spi;

import io.github.cyfko.stackage.core.Node;

/**
 * Computes an arbitrary result from a node and caller-supplied inputs.
 * <p>
 * The core never interprets the result. Checked exceptions thrown by an evaluator are wrapped in an
 * {@link io.github.cyfko.stackage.core.exception.EvaluationException} by the caller-facing
 * {@code evaluate} methods.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * Condition adult = Condition.of("age", ComparisonOperator.GE, 18)
 *     .setEvaluator((node, inputs) -> ((Integer) inputs[0]) >= 18);
 *
 * adult.evaluate(21); // true
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface Evaluator {

    /**
     * @param subject the stack or condition being evaluated
     * @param inputs  caller-supplied arguments, possibly empty
     * @return the evaluation result
     * @throws Exception if the evaluation fails
     */
    Object evaluate(Node subject, Object... inputs) throws Exception;
}
