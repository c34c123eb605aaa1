package io.github.cyfko.stackage.core;

import io.github.cyfko.stackage.core.api.Kind;
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
import io.github.cyfko.stackage.core.utils.ValidationResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Ordered, mutable container of values, conditions and nested stacks.
 * <p>
 * A stack's {@link Kind} decides how its elements are joined when rendered: Boolean stacks
 * (AND, OR, NOT) place an operator word or a custom symbol between elements, LIST stacks use a
 * delimiter, and BASIC stacks are storage only and never rendered.
 * </p>
 *
 * <h2>Mutation contract</h2>
 * <ul>
 *   <li>{@code null} is never stored; removals compact leftward</li>
 *   <li>a positive capacity is never exceeded, overflow is dropped silently</li>
 *   <li>read-only stacks ignore every mutator</li>
 *   <li>ordinary failures never throw: they are recorded and exposed through {@link #err()}</li>
 * </ul>
 *
 * <h2>Rendering</h2>
 * <pre>{@code
 * Stack.and().paren().push("a", "b", "c").toString();          // "(a AND b AND c)"
 * Stack.list().setDelimiter(",").push("x", "y").toString();    // "x,y"
 *
 * Stack ldap = Stack.and().setSymbol("&").leadOnce().noPadding().paren().encap("(", ")")
 *     .push("objectClass=employee",
 *           Stack.or().setSymbol("|").leadOnce().noPadding().paren().encap("(", ")").push("a", "b"));
 * ldap.toString(); // "(&(objectClass=employee)(|(a)(b)))"
 * }</pre>
 *
 * <h2>Concurrency</h2>
 * <p>
 * Stacks are not synchronized unless {@link #mutex()} is called, after which every structural
 * mutation runs under a non-recursive lock. Reads never lock.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Stack implements Node, StackConvertible {

    /**
     * Rendering of a stack that fails its validity check.
     */
    public static final String INVALID_STACK = "<invalid_stack>";

    /**
     * Reserved identifier requesting a random 24-character identifier.
     */
    public static final String RANDOM_ID = "_random";

    /**
     * Reserved identifier requesting the identity address of the stack.
     */
    public static final String ADDRESS_ID = "_addr";

    private static final String ID_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int RANDOM_ID_LENGTH = 24;

    private volatile NodeConfig config;
    private final ArrayList<Object> elements;

    private Stack(Kind kind, int capacity) {
        StackageConfig defaults = StackageDefaults.current();
        this.config = new NodeConfig(kind, capacity, defaults.stackLogLevels(), defaults.eventSink());
        this.elements = capacity > 0 ? new ArrayList<>(capacity) : new ArrayList<>();
        log(LogLevel.STATE, () -> String.format("allocated %s stack (capacity=%d)", kind, config.capacity));
    }

    // ---------------------------------------------------------------- construction

    /**
     * Creates a stack of the given kind.
     *
     * @param kind     the stack kind
     * @param capacity maximum number of elements; zero or negative means unbounded
     * @return a new stack
     * @throws NullPointerException if {@code kind} is null
     */
    public static Stack of(Kind kind, int capacity) {
        if (kind == null) throw new NullPointerException("kind");
        return new Stack(kind, capacity);
    }

    public static Stack of(Kind kind) {
        return of(kind, 0);
    }

    public static Stack and() {
        return of(Kind.AND, 0);
    }

    public static Stack and(int capacity) {
        return of(Kind.AND, capacity);
    }

    public static Stack or() {
        return of(Kind.OR, 0);
    }

    public static Stack or(int capacity) {
        return of(Kind.OR, capacity);
    }

    public static Stack not() {
        return of(Kind.NOT, 0);
    }

    public static Stack not(int capacity) {
        return of(Kind.NOT, capacity);
    }

    public static Stack list() {
        return of(Kind.LIST, 0);
    }

    public static Stack list(int capacity) {
        return of(Kind.LIST, capacity);
    }

    /**
     * BASIC stacks hold values without ever rendering them.
     *
     * @return a new unbounded BASIC stack
     */
    public static Stack basic() {
        return of(Kind.BASIC, 0);
    }

    public static Stack basic(int capacity) {
        return of(Kind.BASIC, capacity);
    }

    /**
     * Releases the configuration, policies and auxiliary store, and empties the stack.
     * <p>
     * The instance is left uninitialized: mutators become no-ops and rendering yields {@code ""}.
     * </p>
     */
    public void free() {
        NodeConfig cfg = config;
        if (cfg == null) return;
        ReentrantLock lock = acquire();
        try {
            log(LogLevel.STATE, () -> "freeing stack");
            elements.clear();
            elements.trimToSize();
            config = null;
        } finally {
            release(lock);
        }
    }

    @Override
    public boolean isInit() {
        return config != null;
    }

    @Override
    public Stack asStack() {
        return this;
    }

    // ---------------------------------------------------------------- structural mutation

    /**
     * Appends values in order.
     * <p>
     * Null values are skipped and freed stacks or conditions are refused. Once capacity is reached the
     * remaining values are dropped. Each value is checked by the push policy when one is set;
     * otherwise stacks are refused when nesting is disabled. A refused value is recorded as the last
     * error and the next value is considered.
     * </p>
     *
     * @param values values to append
     * @return this stack
     */
    public Stack push(Object... values) {
        NodeConfig cfg = config;
        if (!canMutate(cfg) || values == null || values.length == 0) return this;

        ReentrantLock lock = acquire();
        try {
            int before = elements.size();
            for (Object value : values) {
                if (reachedCapacity(cfg)) {
                    log(LogLevel.STATE, () -> "capacity reached; remaining values dropped");
                    break;
                }
                if (value == null || !admit(cfg, value)) continue;
                elements.add(value);
            }
            int added = elements.size() - before;
            log(LogLevel.CALLS, () -> String.format("push(%d values): %d appended", values.length, added));
        } finally {
            release(lock);
        }
        return this;
    }

    /**
     * Removes the last element, or the first one when FIFO ordering is enabled.
     *
     * @return the removed element, or empty when nothing could be removed
     */
    public Optional<Object> pop() {
        NodeConfig cfg = config;
        if (!canMutate(cfg)) return Optional.empty();

        ReentrantLock lock = acquire();
        try {
            if (elements.isEmpty()) return Optional.empty();
            Object removed = cfg.positive(ConfigFlag.FIFO)
                    ? elements.remove(0)
                    : elements.remove(elements.size() - 1);
            log(LogLevel.CALLS, () -> "pop: removed " + removed);
            return Optional.of(removed);
        } finally {
            release(lock);
        }
    }

    /**
     * Inserts {@code value} before the element currently at {@code left}.
     * <p>
     * The position is clamped to {@code [0, len()]}, so a large index appends. The same admission
     * rules as {@link #push(Object...)} apply.
     * </p>
     *
     * @param value the value to insert
     * @param left  target position
     * @return true when the value was inserted
     */
    public boolean insert(Object value, int left) {
        NodeConfig cfg = config;
        if (!canMutate(cfg) || value == null) return false;

        ReentrantLock lock = acquire();
        try {
            if (reachedCapacity(cfg) || !admit(cfg, value)) return false;
            int at = Math.max(0, Math.min(left, elements.size()));
            elements.add(at, value);
            log(LogLevel.CALLS, () -> "insert at " + at);
            return true;
        } finally {
            release(lock);
        }
    }

    /**
     * Removes the element at {@code index}, resolved with the negative and forward index rules.
     *
     * @param index position of the element
     * @return the removed element, or empty when the index cannot be resolved
     */
    public Optional<Object> remove(int index) {
        NodeConfig cfg = config;
        if (!canMutate(cfg)) return Optional.empty();

        ReentrantLock lock = acquire();
        try {
            int at = resolveIndex(cfg, index, elements.size());
            if (at < 0) return Optional.empty();
            Object removed = elements.remove(at);
            log(LogLevel.CALLS, () -> "remove at " + at);
            return Optional.of(removed);
        } finally {
            release(lock);
        }
    }

    /**
     * Overwrites the element at {@code index} in place.
     *
     * @param value replacement, never null
     * @param index position, resolved like {@link #index(int)}
     * @return true when the element was replaced
     */
    public boolean replace(Object value, int index) {
        NodeConfig cfg = config;
        if (!canMutate(cfg) || value == null) return false;

        ReentrantLock lock = acquire();
        try {
            int at = resolveIndex(cfg, index, elements.size());
            if (at < 0 || !admit(cfg, value)) return false;
            elements.set(at, value);
            log(LogLevel.CALLS, () -> "replace at " + at);
            return true;
        } finally {
            release(lock);
        }
    }

    /**
     * Reverses the element order; configuration is untouched.
     *
     * @return this stack
     */
    public Stack reverse() {
        NodeConfig cfg = config;
        if (!canMutate(cfg)) return this;

        ReentrantLock lock = acquire();
        try {
            Collections.reverse(elements);
            log(LogLevel.CALLS, () -> "reverse");
        } finally {
            release(lock);
        }
        return this;
    }

    /**
     * Removes every element while keeping the configuration.
     *
     * @return this stack
     */
    public Stack reset() {
        NodeConfig cfg = config;
        if (!canMutate(cfg)) return this;

        ReentrantLock lock = acquire();
        try {
            elements.clear();
            log(LogLevel.CALLS, () -> "reset");
        } finally {
            release(lock);
        }
        return this;
    }

    /**
     * Swaps two elements. Both indices follow the negative and forward index rules.
     *
     * @return true when both indices resolved
     */
    public boolean swap(int i, int j) {
        NodeConfig cfg = config;
        if (!canMutate(cfg)) return false;

        ReentrantLock lock = acquire();
        try {
            int a = resolveIndex(cfg, i, elements.size());
            int b = resolveIndex(cfg, j, elements.size());
            if (a < 0 || b < 0) return false;
            Collections.swap(elements, a, b);
            log(LogLevel.CALLS, () -> String.format("swap %d <-> %d", a, b));
            return true;
        } finally {
            release(lock);
        }
    }

    /**
     * Sorts the elements with the ordering policy, or by their rendered text when none is set.
     *
     * @return this stack
     */
    public Stack sort() {
        NodeConfig cfg = config;
        if (!canMutate(cfg)) return this;

        Comparator<Object> ordering = cfg.ordering != null
                ? cfg.ordering
                : Comparator.comparing(StackRenderer::plainText);
        ReentrantLock lock = acquire();
        try {
            elements.sort(ordering);
            log(LogLevel.CALLS, () -> "sort");
        } finally {
            release(lock);
        }
        return this;
    }

    /**
     * Copies every element into {@code destination} through its {@link #push(Object...)}.
     *
     * @param destination receiving stack
     * @return true when the destination grew by exactly {@link #len()} elements
     */
    public boolean transfer(Stack destination) {
        if (!isInit() || destination == null || destination == this) return false;
        if (!destination.isInit()) {
            recordError(new UninitializedInstanceException("transfer destination is not initialized"));
            return false;
        }
        if (destination.isReadOnly()) return false;
        Object[] snapshot = toList().toArray();
        int before = destination.len();
        destination.push(snapshot);
        boolean complete = destination.len() - before == snapshot.length;
        log(LogLevel.CALLS, () -> "transfer of " + snapshot.length + " elements complete=" + complete);
        return complete;
    }

    /**
     * Collapses nested, unadorned, single-element stacks into their element, at any depth.
     * <p>
     * NOT stacks, parenthesized stacks and stacks with encapsulation, lead-once or a presentation
     * policy are kept. Stacks held as condition expressions are revealed as well. The rendering of the
     * receiver does not change.
     * </p>
     *
     * @return this stack
     */
    public Stack reveal() {
        NodeConfig cfg = config;
        if (!canMutate(cfg)) return this;

        ReentrantLock lock = acquire();
        try {
            for (int i = 0; i < elements.size(); i++) {
                elements.set(i, revealElement(elements.get(i), cfg.isEncap()));
            }
            log(LogLevel.CALLS, () -> "reveal");
        } finally {
            release(lock);
        }
        return this;
    }

    static Object revealElement(Object element, boolean parentEncapsulates) {
        Optional<Condition> condition = Node.toCondition(element);
        if (condition.isPresent()) {
            condition.get().revealExpression();
            return element;
        }

        Optional<Stack> nested = Node.toStack(element);
        if (nested.isEmpty()) return element;

        Stack stack = nested.get();
        stack.reveal();
        if (!stack.isCollapsible()) return element;

        Object only = stack.elements.get(0);
        boolean isNode = Node.toStack(only).isPresent() || Node.toCondition(only).isPresent();
        return isNode || !parentEncapsulates ? only : element;
    }

    boolean isCollapsible() {
        NodeConfig cfg = config;
        return cfg != null
                && cfg.kind != Kind.NOT
                && cfg.kind != Kind.BASIC
                && elements.size() == 1
                && cfg.presentationPolicy == null
                && cfg.validityPolicy == null
                && !cfg.isEncap()
                && !cfg.positive(ConfigFlag.PAREN)
                && !cfg.positive(ConfigFlag.LEAD_ONCE);
    }

    // ---------------------------------------------------------------- access

    /**
     * Returns the element at {@code i}.
     * <p>
     * Negative indices resolve modulo the length when {@link #negativeIndices()} is on
     * ({@code -1} is the last element). Indices past the end resolve to the last element when
     * {@link #forwardIndices()} is on. Otherwise such indices are not found.
     * </p>
     *
     * @param i position
     * @return the element, or empty
     */
    public Optional<Object> index(int i) {
        NodeConfig cfg = config;
        if (cfg == null) return Optional.empty();
        List<Object> snapshot = toList();
        int at = resolveIndex(cfg, i, snapshot.size());
        if (at < 0) {
            log(LogLevel.DEBUG, () -> "index " + i + " not found");
            return Optional.empty();
        }
        return Optional.of(snapshot.get(at));
    }

    /**
     * Follows a path of indices through nested stacks and condition expressions.
     * <p>
     * Each index is resolved against the stack reached so far. When indices remain, the element must
     * be a stack or a condition whose expression is a stack; anything else ends the walk with no
     * result.
     * </p>
     *
     * <pre>{@code
     * Stack s = Stack.and().push("a", Stack.or().push("b", "c"));
     * s.traverse(1, 0); // Optional["b"]
     * }</pre>
     *
     * @param path indices, outermost first
     * @return the element found at the end of the path, or empty
     */
    public Optional<Object> traverse(int... path) {
        if (!isInit() || path == null || path.length == 0) return Optional.empty();
        return descend(this, path, 0);
    }

    private static Optional<Object> descend(Stack current, int[] path, int depth) {
        Optional<Object> slot = current.index(path[depth]);
        current.log(LogLevel.TRACE, () -> String.format("traverse depth=%d index=%d found=%s",
                depth, path[depth], slot.isPresent()));
        if (slot.isEmpty() || depth == path.length - 1) return slot;

        Object value = slot.get();
        Optional<Stack> next = Node.toStack(value);
        if (next.isEmpty()) {
            next = Node.toCondition(value).flatMap(c -> Node.toStack(c.getExpression()));
        }
        if (next.isEmpty() || !next.get().isInit()) return Optional.empty();
        return descend(next.get(), path, depth + 1);
    }

    /**
     * @return a snapshot of the elements in order
     */
    public List<Object> toList() {
        if (config == null) return Collections.emptyList();
        return new ArrayList<>(elements);
    }

    @Override
    public int len() {
        return elements.size();
    }

    /**
     * @return the capacity, {@code 0} when unbounded
     */
    public int cap() {
        NodeConfig cfg = config;
        return cfg == null ? 0 : cfg.capacity;
    }

    /**
     * @return the number of free slots, {@code -1} when unbounded
     */
    public int avail() {
        int cap = cap();
        return cap <= 0 ? -1 : Math.max(cap - len(), 0);
    }

    public boolean capReached() {
        NodeConfig cfg = config;
        return cfg != null && reachedCapacity(cfg);
    }

    /**
     * @return the kind, or null when uninitialized
     */
    public Kind getKind() {
        NodeConfig cfg = config;
        return cfg == null ? null : cfg.kind;
    }

    /**
     * @return the kind name, lower case when case folding is on, empty when uninitialized
     */
    public String kind() {
        NodeConfig cfg = config;
        if (cfg == null || cfg.kind == null) return "";
        return cfg.kind.word(cfg.positive(ConfigFlag.FOLD));
    }

    /**
     * @return true when any element is a stack or a condition
     */
    @Override
    public boolean isNesting() {
        for (Object element : toList()) {
            if (Node.toStack(element).isPresent() || Node.toCondition(element).isPresent()) return true;
        }
        return false;
    }

    // ---------------------------------------------------------------- configuration

    /**
     * Toggles parentheses around the rendered stack.
     *
     * @return this stack
     */
    public Stack paren() {
        return toggle(ConfigFlag.PAREN);
    }

    public Stack paren(boolean on) {
        return setFlag(ConfigFlag.PAREN, on);
    }

    @Override
    public boolean isParen() {
        return flag(ConfigFlag.PAREN);
    }

    /**
     * Toggles lower-case operator words ({@code and} instead of {@code AND}).
     *
     * @return this stack
     */
    public Stack fold() {
        return toggle(ConfigFlag.FOLD);
    }

    public Stack fold(boolean on) {
        return setFlag(ConfigFlag.FOLD, on);
    }

    /**
     * Toggles padding around custom symbols.
     *
     * @return this stack
     */
    public Stack noPadding() {
        return toggle(ConfigFlag.NO_PAD);
    }

    public Stack noPadding(boolean on) {
        return setFlag(ConfigFlag.NO_PAD, on);
    }

    @Override
    public boolean isPadded() {
        return isInit() && !flag(ConfigFlag.NO_PAD);
    }

    /**
     * Toggles prefix notation: the operator is written once, before the elements.
     *
     * @return this stack
     */
    public Stack leadOnce() {
        return toggle(ConfigFlag.LEAD_ONCE);
    }

    public Stack leadOnce(boolean on) {
        return setFlag(ConfigFlag.LEAD_ONCE, on);
    }

    public boolean isLeadOnce() {
        return flag(ConfigFlag.LEAD_ONCE);
    }

    public Stack negativeIndices() {
        return toggle(ConfigFlag.NEGATIVE_INDICES);
    }

    public Stack negativeIndices(boolean on) {
        return setFlag(ConfigFlag.NEGATIVE_INDICES, on);
    }

    public Stack forwardIndices() {
        return toggle(ConfigFlag.FORWARD_INDICES);
    }

    public Stack forwardIndices(boolean on) {
        return setFlag(ConfigFlag.FORWARD_INDICES, on);
    }

    /**
     * Toggles read-only mode. Configuration setters keep working so the mode can be cleared.
     *
     * @return this stack
     */
    public Stack readOnly() {
        return toggle(ConfigFlag.READ_ONLY);
    }

    public Stack readOnly(boolean on) {
        return setFlag(ConfigFlag.READ_ONLY, on);
    }

    public boolean isReadOnly() {
        return flag(ConfigFlag.READ_ONLY);
    }

    /**
     * Toggles refusal of nested stacks. Ignored for admission when a push policy is set.
     *
     * @return this stack
     */
    public Stack noNesting() {
        return toggle(ConfigFlag.NO_NEST);
    }

    public Stack noNesting(boolean on) {
        return setFlag(ConfigFlag.NO_NEST, on);
    }

    @Override
    public boolean canNest() {
        return isInit() && !flag(ConfigFlag.NO_NEST);
    }

    /**
     * Switches {@link #pop()} to first-in-first-out. The switch is one-way: {@code false} is
     * ignored once FIFO is enabled.
     *
     * @param fifo true to enable FIFO ordering
     * @return this stack
     */
    public Stack setFifo(boolean fifo) {
        if (fifo) setFlag(ConfigFlag.FIFO, true);
        return this;
    }

    public boolean isFifo() {
        return flag(ConfigFlag.FIFO);
    }

    /**
     * Registers an encapsulation scheme using the same text on both sides.
     *
     * @param both left and right text
     * @return this stack
     */
    public Stack encap(String both) {
        return encap(both, both);
    }

    /**
     * Registers an encapsulation scheme. Schemes stack up, the first registered being outermost.
     * A scheme reusing a character of a registered scheme is refused and recorded as the last error.
     *
     * @param left  text written before each value
     * @param right text written after each value
     * @return this stack
     */
    public Stack encap(String left, String right) {
        NodeConfig cfg = config;
        if (cfg == null) return this;
        if (!cfg.addEncapsulation(left, right)) {
            recordError(new StackageException(String.format(
                    "encapsulation scheme [%s, %s] is empty or reuses a registered character", left, right)));
        }
        return this;
    }

    /**
     * Registers an encapsulation scheme given as a one- or two-element list.
     *
     * @param scheme {@code [both]} or {@code [left, right]}
     * @return this stack
     */
    public Stack encap(List<String> scheme) {
        if (scheme == null || scheme.isEmpty() || scheme.size() > 2) {
            recordError(new StackageException("encapsulation scheme must hold one or two strings"));
            return this;
        }
        return encap(scheme.get(0), scheme.size() == 2 ? scheme.get(1) : scheme.get(0));
    }

    /**
     * Removes every encapsulation scheme.
     *
     * @return this stack
     */
    public Stack encap() {
        NodeConfig cfg = config;
        if (cfg != null) cfg.clearEncapsulation();
        return this;
    }

    @Override
    public boolean isEncap() {
        NodeConfig cfg = config;
        return cfg != null && cfg.isEncap();
    }

    /**
     * Replaces the operator word with a custom symbol, e.g. {@code &&} or {@code &}.
     * Ignored on LIST and BASIC stacks.
     *
     * @param symbol the symbol, empty to restore the word
     * @return this stack
     */
    public Stack setSymbol(String symbol) {
        NodeConfig cfg = config;
        if (cfg == null) return this;
        if (cfg.kind == Kind.LIST || cfg.kind == Kind.BASIC) {
            log(LogLevel.DEBUG, () -> "symbol ignored on " + cfg.kind + " stack");
            return this;
        }
        cfg.symbol = symbol == null ? "" : symbol.trim();
        return this;
    }

    public Stack setSymbol(Operator operator) {
        return setSymbol(operator == null ? null : operator.getSymbol());
    }

    public String symbol() {
        NodeConfig cfg = config;
        return cfg == null ? "" : cfg.symbol;
    }

    /**
     * Sets the text joining LIST elements. Ignored on other kinds.
     *
     * @param delimiter the delimiter, empty to restore the default
     * @return this stack
     */
    public Stack setDelimiter(String delimiter) {
        NodeConfig cfg = config;
        if (cfg == null) return this;
        if (cfg.kind != Kind.LIST) {
            log(LogLevel.DEBUG, () -> "delimiter ignored on " + cfg.kind + " stack");
            return this;
        }
        cfg.delimiter = delimiter == null ? "" : delimiter;
        return this;
    }

    public String delimiter() {
        NodeConfig cfg = config;
        return cfg == null ? "" : cfg.delimiter;
    }

    /**
     * Equips the stack with a non-recursive lock guarding structural mutations. Idempotent.
     *
     * @return this stack
     */
    public Stack mutex() {
        NodeConfig cfg = config;
        if (cfg == null) return this;
        synchronized (cfg) {
            if (cfg.mutex == null) cfg.mutex = new ReentrantLock();
        }
        return this;
    }

    public boolean canMutex() {
        NodeConfig cfg = config;
        return cfg != null && cfg.mutex != null;
    }

    // ---------------------------------------------------------------- identity

    /**
     * Sets the identifier. {@value #RANDOM_ID} generates 24 random upper-case alphanumerics and
     * {@value #ADDRESS_ID} uses {@link #getAddress()}.
     *
     * @param id the identifier
     * @return this stack
     */
    public Stack setId(String id) {
        NodeConfig cfg = config;
        if (cfg == null) return this;
        cfg.id = resolveId(id, this);
        return this;
    }

    @Override
    public String getId() {
        NodeConfig cfg = config;
        return cfg == null ? "" : cfg.id;
    }

    public Stack setCategory(String category) {
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

    static String resolveId(String id, Object owner) {
        if (id == null) return "";
        if (RANDOM_ID.equals(id)) {
            ThreadLocalRandom random = ThreadLocalRandom.current();
            StringBuilder sb = new StringBuilder(RANDOM_ID_LENGTH);
            for (int i = 0; i < RANDOM_ID_LENGTH; i++) {
                sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
            }
            return sb.toString();
        }
        if (ADDRESS_ID.equals(id)) return "0x" + Integer.toHexString(System.identityHashCode(owner));
        return id;
    }

    @Override
    public Auxiliary auxiliary() {
        NodeConfig cfg = config;
        return cfg == null ? null : cfg.auxiliary();
    }

    public Stack setAuxiliary(Auxiliary auxiliary) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.auxiliary = auxiliary;
        return this;
    }

    // ---------------------------------------------------------------- policies

    public Stack setPushPolicy(PushPolicy policy) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.pushPolicy = policy;
        return this;
    }

    public Stack setValidityPolicy(ValidityPolicy policy) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.validityPolicy = policy;
        return this;
    }

    /**
     * Replaces the rendering algorithm. Ignored on BASIC stacks, which never render.
     *
     * @param policy the presentation policy, null to restore the default rendering
     * @return this stack
     */
    public Stack setPresentationPolicy(PresentationPolicy policy) {
        NodeConfig cfg = config;
        if (cfg == null) return this;
        if (cfg.kind == Kind.BASIC) {
            recordError(new PolicyViolationException("presentation policies cannot be assigned to BASIC stacks"));
            return this;
        }
        cfg.presentationPolicy = policy;
        return this;
    }

    public Stack setEvaluator(Evaluator evaluator) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.evaluator = evaluator;
        return this;
    }

    public Stack setEqualityPolicy(EqualityPolicy policy) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.equalityPolicy = policy;
        return this;
    }

    public Stack setMarshalPolicy(MarshalPolicy policy) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.marshalPolicy = policy;
        return this;
    }

    public Stack setUnmarshalPolicy(UnmarshalPolicy policy) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.unmarshalPolicy = policy;
        return this;
    }

    /**
     * Sets the comparator used by {@link #sort()}.
     *
     * @param ordering the comparator, null to sort by rendered text
     * @return this stack
     */
    public Stack setOrderingPolicy(Comparator<Object> ordering) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.ordering = ordering;
        return this;
    }

    // ---------------------------------------------------------------- validity, equality, evaluation

    /**
     * The validity policy decides when set; otherwise an initialized stack is valid.
     *
     * @return the verdict
     */
    @Override
    public ValidationResult valid() {
        NodeConfig cfg = config;
        if (cfg == null) return ValidationResult.failure("stack is not initialized");
        if (cfg.validityPolicy != null) {
            ValidationResult result = cfg.validityPolicy.validate(this);
            log(LogLevel.POLICY, () -> "validity policy: " + result);
            return result;
        }
        if (cfg.kind == null) return ValidationResult.failure("stack has no kind");
        return ValidationResult.success();
    }

    /**
     * Compares with another stack, or a value wrapping one.
     * <p>
     * An equality policy on either side decides. Otherwise kinds, rendering flags (parentheses, case
     * folding, padding, lead-once, FIFO), symbol, delimiter, encapsulation and elements must all match.
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
        Optional<Stack> candidate = Node.toStack(unwrapped);
        if (candidate.isEmpty()) {
            return ValidationResult.failure("type mismatch: Stack vs %s",
                    unwrapped == null ? "null" : unwrapped.getClass().getSimpleName());
        }
        Stack that = candidate.get();
        NodeConfig theirs = that.config;
        if (theirs != null && theirs.equalityPolicy != null) return theirs.equalityPolicy.compare(that, this);
        if (that == this) return ValidationResult.success();

        if (cfg == null || theirs == null) {
            return cfg == theirs
                    ? ValidationResult.success()
                    : ValidationResult.failure("initialization mismatch");
        }
        if (cfg.kind != theirs.kind) {
            return ValidationResult.failure("kind mismatch: %s vs %s", cfg.kind, theirs.kind);
        }
        for (ConfigFlag flag : new ConfigFlag[]{ConfigFlag.PAREN, ConfigFlag.FOLD, ConfigFlag.NO_PAD,
                ConfigFlag.LEAD_ONCE, ConfigFlag.FIFO}) {
            if (cfg.positive(flag) != theirs.positive(flag)) {
                return ValidationResult.failure("flag mismatch: %s", flag);
            }
        }
        if (!cfg.symbol.equals(theirs.symbol)) {
            return ValidationResult.failure("symbol mismatch: '%s' vs '%s'", cfg.symbol, theirs.symbol);
        }
        if (!cfg.delimiter.equals(theirs.delimiter)) {
            return ValidationResult.failure("delimiter mismatch: '%s' vs '%s'", cfg.delimiter, theirs.delimiter);
        }
        if (!cfg.sameEncapsulation(theirs)) return ValidationResult.failure("encapsulation mismatch");

        List<Object> mine = toList();
        List<Object> others = that.toList();
        if (mine.size() != others.size()) {
            return ValidationResult.failure("length mismatch: %d vs %d", mine.size(), others.size());
        }
        for (int i = 0; i < mine.size(); i++) {
            ValidationResult element = EqualityUtils.isEqual(mine.get(i), others.get(i));
            if (!element.isValid()) {
                return ValidationResult.failure("element %d differs: %s", i, element.getErrorMessage());
            }
        }
        return ValidationResult.success();
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
     * Encodes the stack with the unmarshal policy, or the default neutral form:
     * {@code [KIND, element...]}.
     *
     * @return the neutral form
     * @throws MarshalException if the stack is uninitialized or the policy fails
     */
    @Override
    public List<Object> unmarshal() {
        NodeConfig cfg = config;
        if (cfg == null) throw new MarshalException("cannot unmarshal an uninitialized stack");
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
     * Clears the stack, then re-kinds and fills it from a neutral form (or through the marshal
     * policy). Configuration flags and policies are kept, except what the new kind cannot carry: a
     * symbol on LIST and BASIC, a delimiter outside LIST, a presentation policy on BASIC. Decoded
     * values pass the same admission rules as {@link #push(Object...)}, refusals being recorded in
     * {@link #err()}. A read-only stack is left untouched.
     *
     * @param neutral tag-led nested list
     * @return this stack
     * @throws MarshalException if the stack is uninitialized or the input cannot be decoded
     */
    public Stack marshal(List<?> neutral) {
        NodeConfig cfg = config;
        if (cfg == null) throw new MarshalException("cannot marshal into an uninitialized stack");
        if (neutral == null) throw new MarshalException("neutral form must not be null");
        if (cfg.positive(ConfigFlag.READ_ONLY)) return this;

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

        Stack decoded = NeutralCodec.decodeStack(neutral);
        ReentrantLock lock = acquire();
        try {
            rekind(cfg, decoded.getKind());
            elements.clear();
            for (Object value : decoded.toList()) {
                if (reachedCapacity(cfg)) break;
                if (admit(cfg, value)) elements.add(value);
            }
            log(LogLevel.STATE, () -> String.format("marshaled %s stack with %d elements", cfg.kind, elements.size()));
        } finally {
            release(lock);
        }
        return this;
    }

    /**
     * Switches the kind, dropping the symbol, delimiter and presentation policy the new kind cannot carry.
     */
    private void rekind(NodeConfig cfg, Kind kind) {
        cfg.kind = kind;
        if (kind == Kind.LIST || kind == Kind.BASIC) cfg.symbol = "";
        if (kind != Kind.LIST) cfg.delimiter = "";
        if (kind == Kind.BASIC && cfg.presentationPolicy != null) {
            cfg.presentationPolicy = null;
            log(LogLevel.STATE, () -> "presentation policy dropped: BASIC stacks never render");
        }
    }

    // ---------------------------------------------------------------- errors and logging

    @Override
    public StackageException err() {
        NodeConfig cfg = config;
        return cfg == null ? null : cfg.lastError;
    }

    /**
     * Overwrites the last recorded error; null clears it.
     *
     * @param error the error
     * @return this stack
     */
    public Stack setErr(StackageException error) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.lastError = error;
        return this;
    }

    public Stack setLogLevel(LogLevel... levels) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.log.enable(levels);
        return this;
    }

    public Stack unsetLogLevel(LogLevel... levels) {
        NodeConfig cfg = config;
        if (cfg != null) cfg.log.disable(levels);
        return this;
    }

    @Override
    public Set<LogLevel> logLevels() {
        NodeConfig cfg = config;
        return cfg == null ? Collections.emptySet() : cfg.log.levels();
    }

    public Stack setEventSink(EventSink sink) {
        NodeConfig cfg = config;
        if (cfg != null && sink != null) cfg.log.setSink(sink);
        return this;
    }

    // ---------------------------------------------------------------- rendering

    /**
     * Renders the stack; {@code ""} for BASIC or uninitialized stacks, {@value #INVALID_STACK} for
     * invalid ones.
     */
    @Override
    public String toString() {
        NodeConfig cfg = config;
        if (cfg == null) return "";
        if (!valid().isValid()) return INVALID_STACK;
        if (cfg.kind == Kind.BASIC) return "";
        String rendered = StackRenderer.render(cfg, toList());
        log(LogLevel.TRACE, () -> "rendered: " + rendered);
        return rendered;
    }

    // ---------------------------------------------------------------- internals

    private boolean canMutate(NodeConfig cfg) {
        if (cfg == null) return false;
        if (cfg.positive(ConfigFlag.READ_ONLY)) {
            log(LogLevel.DEBUG, () -> "mutation ignored: stack is read-only");
            return false;
        }
        return true;
    }

    private boolean reachedCapacity(NodeConfig cfg) {
        return cfg.capacity > 0 && elements.size() >= cfg.capacity;
    }

    private boolean admit(NodeConfig cfg, Object value) {
        if (isReleased(value)) {
            recordError(new UninitializedInstanceException("freed stacks and conditions cannot be nested"));
            return false;
        }
        PushPolicy policy = cfg.pushPolicy;
        if (policy != null) {
            ValidationResult verdict = policy.check(value);
            log(LogLevel.POLICY, () -> "push policy: " + verdict);
            if (!verdict.isValid()) {
                recordError(new PolicyViolationException(verdict.getErrorMessage() == null
                        ? "value rejected by push policy"
                        : verdict.getErrorMessage()));
                return false;
            }
            return true;
        }
        if (cfg.positive(ConfigFlag.NO_NEST) && Node.toStack(value).isPresent()) {
            recordError(new PolicyViolationException("nesting is disabled; stack value rejected"));
            return false;
        }
        return true;
    }

    static boolean isReleased(Object value) {
        Optional<Stack> stack = Node.toStack(value);
        if (stack.isPresent()) return !stack.get().isInit();
        return Node.toCondition(value).map(c -> !c.isInit()).orElse(false);
    }

    static int resolveIndex(NodeConfig cfg, int index, int length) {
        if (length == 0) return -1;
        if (index < 0) {
            return cfg.positive(ConfigFlag.NEGATIVE_INDICES) ? Math.floorMod(index, length) : -1;
        }
        if (index >= length) {
            return cfg.positive(ConfigFlag.FORWARD_INDICES) ? length - 1 : -1;
        }
        return index;
    }

    private boolean flag(ConfigFlag flag) {
        NodeConfig cfg = config;
        return cfg != null && cfg.positive(flag);
    }

    private Stack setFlag(ConfigFlag flag, boolean on) {
        NodeConfig cfg = config;
        if (cfg == null) return this;
        if (flag == ConfigFlag.FIFO && !on) return this;
        cfg.set(flag, on);
        log(LogLevel.STATE, () -> flag + "=" + on);
        return this;
    }

    private Stack toggle(ConfigFlag flag) {
        NodeConfig cfg = config;
        if (cfg == null) return this;
        cfg.toggle(flag);
        log(LogLevel.STATE, () -> flag + " toggled");
        return this;
    }

    private void recordError(StackageException error) {
        NodeConfig cfg = config;
        if (cfg == null) return;
        cfg.lastError = error;
        log(LogLevel.ERRORS, error::getMessage);
    }

    private ReentrantLock acquire() {
        NodeConfig cfg = config;
        ReentrantLock lock = cfg == null ? null : cfg.mutex;
        if (lock == null) return null;
        if (lock.isHeldByCurrentThread()) {
            throw cfg.log.fatal(event(cfg, LogLevel.FATAL_TAG,
                    "non-recursive stack lock acquired twice by thread " + Thread.currentThread().getName()));
        }
        lock.lock();
        return lock;
    }

    private static void release(ReentrantLock lock) {
        if (lock != null) lock.unlock();
    }

    private void log(LogLevel level, Supplier<String> message) {
        NodeConfig cfg = config;
        if (cfg == null) return;
        cfg.log.emit(level, () -> event(cfg, level.name(), message.get()));
    }

    private Event event(NodeConfig cfg, String tag, String message) {
        return new Event(cfg.id, cfg.eventType("S"), tag, message, Instant.now(),
                elements.size(), cfg.capacity, getAddress(), null);
    }
}
