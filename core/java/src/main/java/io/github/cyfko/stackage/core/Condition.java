package io.github.cyfko.stackage.core;

import io.github.cyfko.stackage.core.api.Operator;
import io.github.cyfko.stackage.core.codec.NeutralCodec;
import io.github.cyfko.stackage.core.config.LogLevel;
import io.github.cyfko.stackage.core.config.StackageConfig;
import io.github.cyfko.stackage.core.config.StackageDefaults;
import io.github.cyfko.stackage.core.exception.EvaluationException;
import io.github.cyfko.stackage.core.exception.MarshalException;
import io.github.cyfko.stackage.core.exception.PolicyViolationException;
import io.github.cyfko.stackage.core.exception.StackageException;
import io.github.cyfko.stackage.core.exception.UninitializedInstanceException;
import io.github.cyfko.stackage.core.log.Event;
import io.github.cyfko.stackage.core.log.EventSink;
import io.github.cyfko.stackage.core.spi.EqualityPolicy;
import io.github.cyfko.stackage.core.spi.Evaluator;
import io.github.cyfko.stackage.core.spi.MarshalPolicy;
import io.github.cyfko.stackage.core.spi.PresentationPolicy;
import io.github.cyfko.stackage.core.spi.PushPolicy;
import io.github.cyfko.stackage.core.spi.UnmarshalPolicy;
import io.github.cyfko.stackage.core.spi.ValidityPolicy;
import io.github.cyfko.stackage.core.utils.EqualityUtils;
import io.github.cyfko.stackage.core.utils.StringUtils;
import io.github.cyfko.stackage.core.utils.ValidationResult;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * A single evaluative statement: keyword, operator and expression.
 * <p>
 * The expression may be a string, a number or any other value, or a {@link Stack} (directly or through
 * a {@link StackConvertible}) when nesting is allowed.
 * </p>
 *
 * <p><strong>Examples:</strong></p>
 * <pre>{@code
 * Condition.of("person", ComparisonOperator.EQ, "Jesse").paren().toString();
 * // "( person = Jesse )"
 *
 * Condition.of("person", ComparisonOperator.EQ, "Jesse").paren().noPadding().encap("\"").toString();
 * // "(person=\"Jesse\")"
 *
 * Condition.of("ou", ComparisonOperator.EQ, Stack.or().paren().push("People", "Groups")).toString();
 * // "ou = (People OR Groups)"
 * }</pre>
 *
 * <p>
 * A condition without an expression is invalid and renders {@value #INVALID_CONDITION}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Condition implements Node, ConditionConvertible {

    /**
     * Rendering of a condition that fails its validity check.
     */
    public static final String INVALID_CONDITION = "<invalid_condition>";

    private volatile NodeConfig config;
    private volatile String keyword = "";
    private volatile Operator operator;
    private volatile Object expression;

    /**
     * Creates an empty, initialized condition; it stays invalid until an expression is set.
     */
    public Condition() {
        StackageConfig defaults = StackageDefaults.current();
        this.config = new NodeConfig(null, 0, defaults.conditionLogLevels(), defaults.eventSink());
        log(LogLevel.STATE, () -> "allocated condition");
    }

    /**
     * Creates a condition in one call.
     *
     * @param keyword    the keyword; non-string values are rendered with {@code toString()}
     * @param operator   the operator
     * @param expression the expression
     * @return the condition; check {@link #err()} if a component was refused
     */
    public static Condition of(Object keyword, Operator operator, Object expression) {
        return new Condition()
                .setKeyword(keyword)
                .setOperator(operator)
                .setExpression(expression);
    }

    /**
     * Releases the configuration and components. The condition becomes uninitialized.
     */
    public void free() {
        if (config == null) return;
        log(LogLevel.STATE, () -> "freeing condition");
        config = null;
        keyword = "";
        operator = null;
        expression = null;
    }

    @Override
    public boolean isInit() {
        return config != null;
    }

    @Override
    public Condition asCondition() {
        return this;
    }

    // ---------------------------------------------------------------- components

    public Condition setKeyword(Object keyword) {
        if (config == null || keyword == null) return this;
        String text = keyword instanceof String s ? s : String.valueOf(keyword);
        this.keyword = text.trim();
        log(LogLevel.STATE, () -> "keyword=" + this.keyword);
        return this;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Sets the operator. Operators with an empty symbol or context are refused.
     *
     * @param operator the operator
     * @return this condition
     */
    public Condition setOperator(Operator operator) {
        if (config == null) return this;
        if (operator == null || isBlank(operator.getSymbol()) || isBlank(operator.getContext())) {
            recordError(new PolicyViolationException("operator must provide a symbol and a context"));
            return this;
        }
        this.operator = operator;
        log(LogLevel.STATE, () -> "operator=" + operator.getSymbol());
        return this;
    }

    public Operator getOperator() {
        return operator;
    }

    /**
     * Sets the expression.
     * <p>
     * Null, empty strings and freed nodes are refused. When a push policy is set it decides;
     * otherwise stacks are refused when nesting is disabled. Refusals are recorded as the last error
     * and leave the previous expression in place. Values wrapping a stack are stored as the stack
     * itself.
     * </p>
     *
     * @param expression the expression
     * @return this condition
     */
    public Condition setExpression(Object expression) {
        NodeConfig cfg = config;
        if (cfg == null) return this;
        StackageException refusal = refuseExpression(cfg, expression);
        if (refusal != null) {
            recordError(refusal);
            return this;
        }

        Optional<Stack> stack = Node.toStack(expression);
        this.expression = stack.isPresent() ? stack.get() : expression;
        log(LogLevel.STATE, () -> "expression set (" + this.expression.getClass().getSimpleName() + ")");
        return this;
    }

    /**
     * Applies the expression admission rules shared by {@link #setExpression(Object)} and
     * {@link #marshal(List)}.
     *
     * @return the reason for refusal, or null when the expression is admitted
     */
    private StackageException refuseExpression(NodeConfig cfg, Object expression) {
        if (expression == null || (expression instanceof String s && s.isEmpty())) {
            return new PolicyViolationException("expression must not be null or empty");
        }
        if (Stack.isReleased(expression)) {
            return new UninitializedInstanceException("a freed stack or condition cannot be an expression");
        }

        PushPolicy policy = cfg.pushPolicy;
        if (policy != null) {
            ValidationResult verdict = policy.check(expression);
            log(LogLevel.POLICY, () -> "push policy: " + verdict);
            if (verdict.isValid()) return null;
            return new PolicyViolationException(verdict.getErrorMessage() == null
                    ? "expression rejected by push policy"
                    : verdict.getErrorMessage());
        }
        if (Node.toStack(expression).isPresent() && cfg.positive(ConfigFlag.NO_NEST)) {
            return new PolicyViolationException("nesting is disabled; stack expression rejected");
        }
        return null;
    }

    public Object getExpression() {
        return expression;
    }

    /**
     * @return 0 without an expression, the stack's length for a stack expression, 1 otherwise
     */
    @Override
    public int len() {
        Object current = expression;
        if (current == null) return 0;
        return Node.toStack(current).map(Stack::len).orElse(1);
    }

    @Override
    public boolean isNesting() {
        return Node.toStack(expression).isPresent();
    }

    void revealExpression() {
        NodeConfig cfg = config;
        Object current = expression;
        if (cfg == null || current == null) return;
        Optional<Stack> stack = Node.toStack(current);
        if (stack.isEmpty()) return;
        Object revealed = Stack.revealElement(stack.get(), cfg.isEncap());
        if (revealed != current) expression = revealed;
    }

    // ---------------------------------------------------------------- configuration

    /**
     * Toggles parentheses around the rendered condition.
     *
     * @return this condition
     */
    public Condition paren() {
        return toggle(ConfigFlag.PAREN);
    }

    public Condition paren(boolean on) {
        return setFlag(ConfigFlag.PAREN, on);
    }

    @Override
    public boolean isParen() {
        return flag(ConfigFlag.PAREN);
    }

    /**
     * Toggles the spaces around the operator and inside parentheses.
     *
     * @return this condition
     */
    public Condition noPadding() {
        return toggle(ConfigFlag.NO_PAD);
    }

    public Condition noPadding(boolean on) {
        return setFlag(ConfigFlag.NO_PAD, on);
    }

    @Override
    public boolean isPadded() {
        return isInit() && !flag(ConfigFlag.NO_PAD);
    }

    public Condition noNesting() {
        return toggle(ConfigFlag.NO_NEST);
    }

    public Condition noNesting(boolean on) {
        return setFlag(ConfigFlag.NO_NEST, on);
    }

    @Override
    public boolean canNest() {
        return isInit() && !flag(ConfigFlag.NO_NEST);
    }

    /**
     * Registers an encapsulation scheme for the expression, same text on both sides.
     *
     * @param both left and right text
     * @return this condition
     */
    public Condition encap(String both) {
        return encap(both, both);
    }

    /**
     * Registers an encapsulation scheme for the expression. The first registered scheme is outermost;
     * a scheme reusing a registered character is refused.
     *
     * @param left  text before the expression
     * @param right text after the expression
     * @return this condition
     */
    public Condition encap(String left, String right) {
        NodeConfig cfg = config;
        if (cfg == null) return this;
        if (!cfg.addEncapsulation(left, right)) {
            recordError(new StackageException(String.format(
                    "encapsulation scheme [%s, %s] is empty or reuses a registered character", left, right)));
        }
        return this;
    }

    public Condition encap(List<String> scheme) {
        if (scheme == null || scheme.isEmpty() || scheme.size() > 2) {
            recordError(new StackageException("encapsulation scheme must hold one or two strings"));
            return this;
        }
        return encap(scheme.get(0), scheme.size() == 2 ? scheme.get(1) : scheme.get(0));
    }

    /**
     * Removes every encapsulation scheme.
     *
     * @return this condition
     */
    public Condition encap() {
        NodeConfig cfg = config;
        if (cfg != null) cfg.clearEncapsulation();
        return this;
    }

    @Override
    public boolean isEncap() {
        NodeConfig cfg = config;
        return cfg != null && cfg.isEncap();
    }

    // ---------------------------------------------------------------- identity

    public Condition setId(String id) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.id = Stack.resolveId(id, this);
        return this;
    }

    @Override
    public String getId() {
        NodeConfig cfg = config;
        return cfg == null ? "" : cfg.id;
    }

    public Condition setCategory(String category) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.category = category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
        return this;
    }

    @Override
    public String getCategory() {
        NodeConfig cfg = config;
        return cfg == null ? "" : cfg.category;
    }

    @Override
    public String getAddress() {
        return "0x" + Integer.toHexString(System.identityHashCode(this));
    }

    @Override
    public Auxiliary auxiliary() {
        NodeConfig cfg = config;
        return cfg == null ? null : cfg.auxiliary();
    }

    public Condition setAuxiliary(Auxiliary auxiliary) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.auxiliary = auxiliary;
        return this;
    }

    // ---------------------------------------------------------------- policies

    public Condition setPushPolicy(PushPolicy policy) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.pushPolicy = policy;
        return this;
    }

    public Condition setValidityPolicy(ValidityPolicy policy) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.validityPolicy = policy;
        return this;
    }

    public Condition setPresentationPolicy(PresentationPolicy policy) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.presentationPolicy = policy;
        return this;
    }

    public Condition setEvaluator(Evaluator evaluator) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.evaluator = evaluator;
        return this;
    }

    public Condition setEqualityPolicy(EqualityPolicy policy) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.equalityPolicy = policy;
        return this;
    }

    public Condition setMarshalPolicy(MarshalPolicy policy) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.marshalPolicy = policy;
        return this;
    }

    public Condition setUnmarshalPolicy(UnmarshalPolicy policy) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.unmarshalPolicy = policy;
        return this;
    }

    // ---------------------------------------------------------------- validity, equality, evaluation

    /**
     * The validity policy decides when set; otherwise an expression must be present.
     *
     * @return the verdict
     */
    @Override
    public ValidationResult valid() {
        NodeConfig cfg = config;
        if (cfg == null) return ValidationResult.failure("condition is not initialized");
        if (cfg.validityPolicy != null) {
            ValidationResult result = cfg.validityPolicy.validate(this);
            log(LogLevel.POLICY, () -> "validity policy: " + result);
            return result;
        }
        if (expression == null) return ValidationResult.failure("condition has no expression");
        return ValidationResult.success();
    }

    /**
     * Compares with another condition, or a value wrapping one.
     * <p>
     * An equality policy on either side decides. Otherwise keyword, operator symbol and context,
     * parentheses, padding, encapsulation and expression must match.
     * </p>
     *
     * @param other the value to compare with
     * @return the verdict
     */
    @Override
    public ValidationResult isEqual(Object other) {
        NodeConfig cfg = config;
        if (cfg != null && cfg.equalityPolicy != null) return cfg.equalityPolicy.compare(this, other);

        Object unwrapped = EqualityUtils.unwrap(other);
        Optional<Condition> candidate = Node.toCondition(unwrapped);
        if (candidate.isEmpty()) {
            return ValidationResult.failure("type mismatch: Condition vs %s",
                    unwrapped == null ? "null" : unwrapped.getClass().getSimpleName());
        }
        Condition that = candidate.get();
        NodeConfig theirs = that.config;
        if (theirs != null && theirs.equalityPolicy != null) return theirs.equalityPolicy.compare(that, this);
        if (that == this) return ValidationResult.success();

        if (cfg == null || theirs == null) {
            return cfg == theirs
                    ? ValidationResult.success()
                    : ValidationResult.failure("initialization mismatch");
        }
        if (!keyword.equals(that.keyword)) {
            return ValidationResult.failure("keyword mismatch: '%s' vs '%s'", keyword, that.keyword);
        }
        if (!sameOperator(operator, that.operator)) {
            return ValidationResult.failure("operator mismatch: %s vs %s",
                    describe(operator), describe(that.operator));
        }
        if (cfg.positive(ConfigFlag.PAREN) != theirs.positive(ConfigFlag.PAREN)
                || cfg.positive(ConfigFlag.NO_PAD) != theirs.positive(ConfigFlag.NO_PAD)) {
            return ValidationResult.failure("rendering flag mismatch");
        }
        if (!cfg.sameEncapsulation(theirs)) return ValidationResult.failure("encapsulation mismatch");

        ValidationResult expressions = EqualityUtils.isEqual(expression, that.expression);
        return expressions.isValid()
                ? expressions
                : ValidationResult.failure("expression differs: %s", expressions.getErrorMessage());
    }

    private static boolean sameOperator(Operator a, Operator b) {
        if (a == null || b == null) return a == b;
        return Objects.equals(a.getSymbol(), b.getSymbol()) && Objects.equals(a.getContext(), b.getContext());
    }

    private static String describe(Operator op) {
        return op == null ? "null" : op.getSymbol() + " (" + op.getContext() + ")";
    }

    /**
     * @throws EvaluationException if no evaluator is set or the evaluator fails
     */
    @Override
    public Object evaluate(Object... inputs) {
        NodeConfig cfg = config;
        Evaluator evaluator = cfg == null ? null : cfg.evaluator;
        if (evaluator == null) throw new EvaluationException("no evaluator configured");
        try {
            return evaluator.evaluate(this, inputs);
        } catch (EvaluationException e) {
            throw e;
        } catch (Exception e) {
            throw new EvaluationException("evaluator failed: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------- transcoding

    /**
     * Encodes the condition as {@code ["CONDITION", keyword, operatorSymbol, expression]}, or through
     * the unmarshal policy.
     *
     * @return the neutral form
     * @throws MarshalException if the condition is uninitialized or the policy fails
     */
    @Override
    public List<Object> unmarshal() {
        NodeConfig cfg = config;
        if (cfg == null) throw new MarshalException("cannot unmarshal an uninitialized condition");
        if (cfg.unmarshalPolicy == null) return NeutralCodec.encode(this);
        try {
            return cfg.unmarshalPolicy.unmarshal(this);
        } catch (MarshalException e) {
            throw e;
        } catch (Exception e) {
            throw new MarshalException("unmarshal policy failed: " + e.getMessage(), e);
        }
    }

    /**
     * Replaces keyword, operator and expression with those decoded from {@code neutral}. The decoded
     * expression goes through the same admission rules as {@link #setExpression(Object)}; a refusal
     * leaves the condition unchanged.
     *
     * @param neutral {@code ["CONDITION", keyword, operatorSymbol, expression]}
     * @return this condition
     * @throws MarshalException if the condition is uninitialized, the input cannot be decoded or the
     *                          decoded expression is refused
     */
    public Condition marshal(List<?> neutral) {
        NodeConfig cfg = config;
        if (cfg == null) throw new MarshalException("cannot marshal into an uninitialized condition");
        if (neutral == null) throw new MarshalException("neutral form must not be null");

        if (cfg.marshalPolicy != null) {
            try {
                cfg.marshalPolicy.marshal(this, neutral);
            } catch (MarshalException e) {
                throw e;
            } catch (Exception e) {
                throw new MarshalException("marshal policy failed: " + e.getMessage(), e);
            }
            return this;
        }

        Condition decoded = NeutralCodec.decodeCondition(neutral);
        StackageException refusal = refuseExpression(cfg, decoded.expression);
        if (refusal != null) {
            throw new MarshalException("decoded expression refused: " + refusal.getMessage(), refusal);
        }
        keyword = decoded.keyword;
        operator = decoded.operator;
        expression = decoded.expression;
        log(LogLevel.STATE, () -> "marshaled condition " + keyword);
        return this;
    }

    // ---------------------------------------------------------------- errors and logging

    @Override
    public StackageException err() {
        NodeConfig cfg = config;
        return cfg == null ? null : cfg.lastError;
    }

    public Condition setErr(StackageException error) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.lastError = error;
        return this;
    }

    public Condition setLogLevel(LogLevel... levels) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.log.enable(levels);
        return this;
    }

    public Condition unsetLogLevel(LogLevel... levels) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.log.disable(levels);
        return this;
    }

    @Override
    public Set<LogLevel> logLevels() {
        NodeConfig cfg = config;
        return cfg == null ? Collections.emptySet() : cfg.log.levels();
    }

    public Condition setEventSink(EventSink sink) {
        NodeConfig cfg = config;
        if (cfg != null && sink != null) cfg.log.setSink(sink);
        return this;
    }

    // ---------------------------------------------------------------- rendering

    /**
     * Renders {@code keyword operator expression}; {@code ""} when uninitialized,
     * {@value #INVALID_CONDITION} when invalid.
     */
    @Override
    public String toString() {
        NodeConfig cfg = config;
        if (cfg == null) return "";
        if (!valid().isValid()) return INVALID_CONDITION;

        if (cfg.presentationPolicy != null) {
            return cfg.presentationPolicy.present(Collections.unmodifiableList(
                    Arrays.asList(keyword, operator, expression)));
        }

        String pad = cfg.pad();
        String op = operator == null ? "" : operator.getSymbol();
        String rendered = keyword + pad + op + pad + renderExpression(cfg);
        if (cfg.positive(ConfigFlag.PAREN)) rendered = "(" + pad + rendered + pad + ")";
        String result = StringUtils.condense(rendered);
        log(LogLevel.TRACE, () -> "rendered: " + result);
        return result;
    }

    private String renderExpression(NodeConfig cfg) {
        Object current = expression;
        Optional<Stack> stack = Node.toStack(current);
        if (stack.isPresent()) return stack.get().toString();
        Optional<Condition> nested = Node.toCondition(current);
        if (nested.isPresent()) return nested.get().toString();
        return cfg.encapsulate(StackRenderer.plainText(current));
    }

    // ---------------------------------------------------------------- internals

    private boolean flag(ConfigFlag flag) {
        NodeConfig cfg = config;
        return cfg != null && cfg.positive(flag);
    }

    private Condition setFlag(ConfigFlag flag, boolean on) {
        NodeConfig cfg = config;
        if (cfg == null) return this;
        cfg.set(flag, on);
        log(LogLevel.STATE, () -> flag + "=" + on);
        return this;
    }

    private Condition toggle(ConfigFlag flag) {
        NodeConfig cfg = config;
        if (cfg == null) return this;
        cfg.toggle(flag);
        log(LogLevel.STATE, () -> flag + " toggled");
        return this;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private void recordError(StackageException error) {
        NodeConfig cfg = config;
        if (cfg == null) return;
        cfg.lastError = error;
        log(LogLevel.ERRORS, error::getMessage);
    }

    private void log(LogLevel level, Supplier<String> message) {
        NodeConfig cfg = config;
        if (cfg == null) return;
        cfg.log.emit(level, () -> new Event(cfg.id, cfg.eventType("C"), level.name(), message.get(),
                Instant.now(), len(), 0, getAddress(), null));
    }
}
