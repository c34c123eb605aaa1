package io.github.cyfko.stackage.core;

import io.github.cyfko.stackage.core.api.Kind;
import io.github.cyfko.stackage.core.config.LogLevel;
import io.github.cyfko.stackage.core.exception.StackageException;
import io.github.cyfko.stackage.core.log.EventSink;
import io.github.cyfko.stackage.core.log.LogSystem;
import io.github.cyfko.stackage.core.spi.EqualityPolicy;
import io.github.cyfko.stackage.core.spi.Evaluator;
import io.github.cyfko.stackage.core.spi.MarshalPolicy;
import io.github.cyfko.stackage.core.spi.PresentationPolicy;
import io.github.cyfko.stackage.core.spi.PushPolicy;
import io.github.cyfko.stackage.core.spi.UnmarshalPolicy;
import io.github.cyfko.stackage.core.spi.ValidityPolicy;
import io.github.cyfko.stackage.core.utils.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Private state block of a single {@link Stack} or {@link Condition}: flags, capacity, policies,
 * identity and logging. Never shared between owners.
 */
final class NodeConfig {

    volatile Kind kind;
    final int capacity;

    private final Set<ConfigFlag> flags = Collections.synchronizedSet(EnumSet.noneOf(ConfigFlag.class));
    private final List<String[]> encapsulation = new CopyOnWriteArrayList<>();

    volatile String symbol = "";
    volatile String delimiter = "";
    volatile String id = "";
    volatile String category = "";

    volatile ReentrantLock mutex;

    volatile PushPolicy pushPolicy;
    volatile ValidityPolicy validityPolicy;
    volatile PresentationPolicy presentationPolicy;
    volatile Evaluator evaluator;
    volatile EqualityPolicy equalityPolicy;
    volatile MarshalPolicy marshalPolicy;
    volatile UnmarshalPolicy unmarshalPolicy;
    volatile Comparator<Object> ordering;

    volatile Auxiliary auxiliary;
    volatile StackageException lastError;

    final LogSystem log;

    NodeConfig(Kind kind, int capacity, Collection<LogLevel> levels, EventSink sink) {
        this.kind = kind;
        this.capacity = Math.max(capacity, 0);
        this.log = new LogSystem(levels, sink);
    }

    boolean positive(ConfigFlag flag) {
        return flags.contains(flag);
    }

    void set(ConfigFlag flag, boolean on) {
        if (on) {
            flags.add(flag);
        } else {
            flags.remove(flag);
        }
    }

    void toggle(ConfigFlag flag) {
        synchronized (flags) {
            set(flag, !flags.contains(flag));
        }
    }

    /**
     * Registers a left/right pair unless one of its characters is already used.
     *
     * @return false on conflict or empty pair
     */
    boolean addEncapsulation(String left, String right) {
        if (left == null || right == null || (left.isEmpty() && right.isEmpty())) return false;
        synchronized (encapsulation) {
            if (StringUtils.usesAnyChar(encapsulation, left + right)) return false;
            encapsulation.add(new String[]{left, right});
            return true;
        }
    }

    void clearEncapsulation() {
        encapsulation.clear();
    }

    boolean isEncap() {
        return !encapsulation.isEmpty();
    }

    List<String[]> encapsulation() {
        List<String[]> copy = new ArrayList<>(encapsulation.size());
        for (String[] scheme : encapsulation) copy.add(scheme.clone());
        return copy;
    }

    String encapsulate(String value) {
        return StringUtils.encapsulate(encapsulation, value);
    }

    String pad() {
        return positive(ConfigFlag.NO_PAD) ? "" : " ";
    }

    Auxiliary auxiliary() {
        Auxiliary current = auxiliary;
        if (current == null) {
            synchronized (this) {
                if (auxiliary == null) auxiliary = new Auxiliary();
                current = auxiliary;
            }
        }
        return current;
    }

    /**
     * @param prefix {@code S} or {@code C}
     * @return the event type, suffixed with the category when set
     */
    String eventType(String prefix) {
        String c = category;
        return c.isEmpty() ? prefix : prefix + "_" + c;
    }

    boolean sameEncapsulation(NodeConfig other) {
        List<String[]> mine = encapsulation();
        List<String[]> theirs = other.encapsulation();
        if (mine.size() != theirs.size()) return false;
        for (int i = 0; i < mine.size(); i++) {
            if (!mine.get(i)[0].equals(theirs.get(i)[0]) || !mine.get(i)[1].equals(theirs.get(i)[1])) return false;
        }
        return true;
    }
}
