package io.github.cyfko.stackage.core;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Free-form key/value store attached to a stack or condition.
 * <p>
 * The library never reads it; callers use it to keep application data next to a node.
 * Keys and values are non-null: assigning {@code null} removes the key. Safe for concurrent use.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * Stack filter = Stack.and();
 * filter.auxiliary().set("owner", "directory-service");
 * String owner = filter.auxiliary().get("owner", String.class).orElse("unknown");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Auxiliary {

    private final Map<String, Object> entries = new ConcurrentHashMap<>();

    public Auxiliary set(String key, Object value) {
        if (key == null) return this;
        if (value == null) {
            entries.remove(key);
        } else {
            entries.put(key, value);
        }
        return this;
    }

    public Optional<Object> get(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(entries.get(key));
    }

    /**
     * Returns the value of {@code key} when it is an instance of {@code type}.
     *
     * @param key  the key
     * @param type expected value type
     * @param <T>  expected value type
     * @return the typed value, or empty when absent or of another type
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    public Auxiliary unset(String key) {
        if (key != null) entries.remove(key);
        return this;
    }

    public boolean has(String key) {
        return key != null && entries.containsKey(key);
    }

    public int len() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void clear() {
        entries.clear();
    }

    /**
     * @return the keys in natural order
     */
    public Set<String> keys() {
        return Collections.unmodifiableSet(new TreeSet<>(entries.keySet()));
    }

    @Override
    public String toString() {
        return "Auxiliary" + new TreeMap<>(entries);
    }
}
