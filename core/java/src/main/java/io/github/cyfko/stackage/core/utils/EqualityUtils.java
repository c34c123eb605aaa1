package io.github.cyfko.stackage.core.utils;

import io.github.cyfko.stackage.core.Condition;
import io.github.cyfko.stackage.core.Node;
import io.github.cyfko.stackage.core.Stack;

import java.lang.ref.Reference;
import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.nio.channels.Channel;
import java.util.AbstractList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;

/**
 * Structural equality engine used by {@code Stack#isEqual} and {@code Condition#isEqual}.
 * <p>
 * Values are compared by shape:
 * </p>
 * <ul>
 *   <li>{@link Optional}, {@link AtomicReference} and {@link Reference} wrappers are dereferenced first</li>
 *   <li>numbers compare numerically across boxed types ({@code 1 == 1L == 1.0})</li>
 *   <li>stacks and conditions (or anything convertible to them) delegate to their own {@code isEqual}</li>
 *   <li>records compare component by component</li>
 *   <li>arrays and lists compare in order; an array equals a list holding the same elements</li>
 *   <li>maps and sets compare regardless of iteration order; map keys match structurally</li>
 *   <li>lambdas compare by single abstract method signature</li>
 *   <li>channels, queues, threads and locks compare by identity</li>
 * </ul>
 * <p>
 * Every verdict is a {@link ValidationResult}: a failure explains the first difference found.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * EqualityUtils.isEqual(List.of(1, 2), new long[]{1L, 2L}).isValid(); // true
 * EqualityUtils.isEqual(Map.of("a", 1), Map.of("a", 2)).getErrorMessage(); // "map value mismatch for key a: ..."
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EqualityUtils {

    private EqualityUtils() {
    }

    /**
     * Compares two arbitrary values structurally.
     *
     * @param a first value, may be null
     * @param b second value, may be null
     * @return success when equal, otherwise a failure describing the mismatch
     */
    public static ValidationResult isEqual(Object a, Object b) {
        Object left = unwrap(a);
        Object right = unwrap(b);

        if (left == null && right == null) return ValidationResult.success();
        if (left == null || right == null) {
            return ValidationResult.failure("null mismatch: %s vs %s", describe(left), describe(right));
        }
        if (left == right) return ValidationResult.success();

        Optional<Stack> stack = Node.toStack(left);
        if (stack.isPresent()) return stack.get().isEqual(right);
        stack = Node.toStack(right);
        if (stack.isPresent()) return stack.get().isEqual(left);

        Optional<Condition> condition = Node.toCondition(left);
        if (condition.isPresent()) return condition.get().isEqual(right);
        condition = Node.toCondition(right);
        if (condition.isPresent()) return condition.get().isEqual(left);

        if (left instanceof Number x && right instanceof Number y) return compareNumbers(x, y);
        if (left instanceof CharSequence x && right instanceof CharSequence y) {
            return x.toString().equals(y.toString())
                    ? ValidationResult.success()
                    : ValidationResult.failure("string mismatch: '%s' vs '%s'", x, y);
        }
        if (isScalar(left) || isScalar(right)) return compareScalars(left, right);

        if (isOpaqueHandle(left) || isOpaqueHandle(right)) {
            return ValidationResult.failure("distinct handles: %s vs %s", describe(left), describe(right));
        }

        if (left.getClass().isRecord() && right.getClass().isRecord()) return compareRecords((Record) left, (Record) right);

        List<?> leftSequence = asSequence(left);
        List<?> rightSequence = asSequence(right);
        if (leftSequence != null && rightSequence != null) return compareSequences(leftSequence, rightSequence);

        if (left instanceof Map<?, ?> x && right instanceof Map<?, ?> y) return compareMaps(x, y);
        if (left instanceof Set<?> x && right instanceof Set<?> y) return compareSets(x, y);

        Method leftFunction = functionalMethod(left);
        Method rightFunction = functionalMethod(right);
        if (leftFunction != null && rightFunction != null) return compareFunctions(leftFunction, rightFunction);

        if (!shapeOf(left).equals(shapeOf(right))) {
            return ValidationResult.failure("type mismatch: %s vs %s", describe(left), describe(right));
        }
        return left.equals(right)
                ? ValidationResult.success()
                : ValidationResult.failure("value mismatch: %s vs %s", left, right);
    }

    /**
     * Dereferences {@link Optional}, {@link AtomicReference} and {@link Reference} wrappers to any depth.
     *
     * @param value the possibly wrapped value
     * @return the innermost value, or null
     */
    public static Object unwrap(Object value) {
        Object current = value;
        while (true) {
            if (current instanceof Optional<?> optional) {
                current = optional.orElse(null);
            } else if (current instanceof AtomicReference<?> reference) {
                current = reference.get();
            } else if (current instanceof Reference<?> reference) {
                current = reference.get();
            } else {
                return current;
            }
        }
    }

    private static ValidationResult compareNumbers(Number x, Number y) {
        if (isNonFinite(x) || isNonFinite(y)) {
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0
                    ? ValidationResult.success()
                    : ValidationResult.failure("number mismatch: %s vs %s", x, y);
        }
        return toBigDecimal(x).compareTo(toBigDecimal(y)) == 0
                ? ValidationResult.success()
                : ValidationResult.failure("number mismatch: %s vs %s", x, y);
    }

    private static boolean isNonFinite(Number n) {
        return (n instanceof Double d && !Double.isFinite(d)) || (n instanceof Float f && !Float.isFinite(f));
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) return bd;
        try {
            return new BigDecimal(n.toString());
        } catch (NumberFormatException e) {
            return BigDecimal.valueOf(n.doubleValue());
        }
    }

    private static boolean isScalar(Object value) {
        return value instanceof Number || value instanceof CharSequence || value instanceof Boolean
                || value instanceof Character || value instanceof Enum<?>;
    }

    private static ValidationResult compareScalars(Object x, Object y) {
        if (x.getClass() != y.getClass() && !(x instanceof Enum<?> && y instanceof Enum<?>)) {
            return ValidationResult.failure("type mismatch: %s vs %s", describe(x), describe(y));
        }
        return x.equals(y)
                ? ValidationResult.success()
                : ValidationResult.failure("value mismatch: %s vs %s", x, y);
    }

    private static boolean isOpaqueHandle(Object value) {
        return value instanceof Channel || value instanceof BlockingQueue<?>
                || value instanceof Thread || value instanceof Lock;
    }

    private static ValidationResult compareRecords(Record x, Record y) {
        RecordComponent[] xs = x.getClass().getRecordComponents();
        RecordComponent[] ys = y.getClass().getRecordComponents();
        if (xs.length != ys.length) {
            return ValidationResult.failure("record shape mismatch: %s vs %s", describe(x), describe(y));
        }
        for (int i = 0; i < xs.length; i++) {
            if (!xs[i].getName().equals(ys[i].getName())) {
                return ValidationResult.failure("record component mismatch at %d: %s vs %s",
                        i, xs[i].getName(), ys[i].getName());
            }
            ValidationResult component = isEqual(read(xs[i], x), read(ys[i], y));
            if (!component.isValid()) {
                return ValidationResult.failure("record component '%s' differs: %s",
                        xs[i].getName(), component.getErrorMessage());
            }
        }
        return ValidationResult.success();
    }

    private static Object read(RecordComponent component, Record owner) {
        Method accessor = component.getAccessor();
        try {
            accessor.trySetAccessible();
            return accessor.invoke(owner);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot read record component " + component.getName(), e);
        }
    }

    private static List<?> asSequence(Object value) {
        if (value instanceof List<?> list) return list;
        if (value.getClass().isArray()) {
            return new AbstractList<Object>() {
                @Override
                public Object get(int index) {
                    return Array.get(value, index);
                }

                @Override
                public int size() {
                    return Array.getLength(value);
                }
            };
        }
        return null;
    }

    private static ValidationResult compareSequences(List<?> x, List<?> y) {
        if (x.size() != y.size()) {
            return ValidationResult.failure("length mismatch: %d vs %d", x.size(), y.size());
        }
        Iterator<?> xi = x.iterator();
        Iterator<?> yi = y.iterator();
        for (int i = 0; xi.hasNext(); i++) {
            ValidationResult element = isEqual(xi.next(), yi.next());
            if (!element.isValid()) {
                return ValidationResult.failure("element %d differs: %s", i, element.getErrorMessage());
            }
        }
        return ValidationResult.success();
    }

    private static ValidationResult compareMaps(Map<?, ?> x, Map<?, ?> y) {
        if (x.size() != y.size()) {
            return ValidationResult.failure("map size mismatch: %d vs %d", x.size(), y.size());
        }
        for (Map.Entry<?, ?> entry : x.entrySet()) {
            Map.Entry<?, ?> match = findEntry(y, entry.getKey());
            if (match == null) {
                return ValidationResult.failure("map key missing: %s", entry.getKey());
            }
            ValidationResult value = isEqual(entry.getValue(), match.getValue());
            if (!value.isValid()) {
                return ValidationResult.failure("map value mismatch for key %s: %s",
                        entry.getKey(), value.getErrorMessage());
            }
        }
        return ValidationResult.success();
    }

    /**
     * Finds the entry of {@code map} whose key matches {@code key}: by {@code equals} when the map
     * supports the lookup, else structurally, so {@code 1} finds {@code 1L}.
     *
     * @return the matching entry, or null
     */
    private static Map.Entry<?, ?> findEntry(Map<?, ?> map, Object key) {
        Map.Entry<?, ?> structural = null;
        for (Map.Entry<?, ?> candidate : map.entrySet()) {
            if (Objects.equals(candidate.getKey(), key)) return candidate;
            if (structural == null && isEqual(candidate.getKey(), key).isValid()) structural = candidate;
        }
        return structural;
    }

    private static ValidationResult compareSets(Set<?> x, Set<?> y) {
        if (x.size() != y.size()) {
            return ValidationResult.failure("set size mismatch: %d vs %d", x.size(), y.size());
        }
        for (Object member : x) {
            if (!y.contains(member) && !containsEqual(y, member)) {
                return ValidationResult.failure("set member missing: %s", member);
            }
        }
        return ValidationResult.success();
    }

    private static boolean containsEqual(Collection<?> haystack, Object needle) {
        for (Object candidate : haystack) {
            if (isEqual(candidate, needle).isValid()) return true;
        }
        return false;
    }

    private static Method functionalMethod(Object value) {
        Class<?> type = value.getClass();
        boolean lambdaLike = type.isSynthetic() || type.isHidden();
        for (Class<?> iface : type.getInterfaces()) {
            if (!lambdaLike && !iface.isAnnotationPresent(FunctionalInterface.class)) continue;
            Method single = null;
            int abstractCount = 0;
            for (Method method : iface.getMethods()) {
                if (Modifier.isAbstract(method.getModifiers()) && !isObjectMethod(method)) {
                    single = method;
                    abstractCount++;
                }
            }
            if (abstractCount == 1) return single;
        }
        return null;
    }

    private static boolean isObjectMethod(Method method) {
        try {
            Object.class.getMethod(method.getName(), method.getParameterTypes());
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    private static ValidationResult compareFunctions(Method x, Method y) {
        boolean sameSignature = x.getReturnType().equals(y.getReturnType())
                && Arrays.equals(x.getParameterTypes(), y.getParameterTypes());
        return sameSignature
                ? ValidationResult.success()
                : ValidationResult.failure("function signature mismatch: %s vs %s", x, y);
    }

    private static String shapeOf(Object value) {
        if (value instanceof Map<?, ?>) return "map";
        if (value instanceof Set<?>) return "set";
        if (value instanceof Collection<?> || value.getClass().isArray()) return "sequence";
        return value.getClass().getName();
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
