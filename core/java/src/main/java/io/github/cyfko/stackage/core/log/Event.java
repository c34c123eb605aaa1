package io.github.cyfko.stackage.core.log;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single diagnostic event emitted by a stack or condition.
 *
 * @param id       the emitter's identifier, possibly empty
 * @param type     {@code "S"} for stacks, {@code "C"} for conditions, followed by {@code _category} when one is set
 * @param tag      the level name, or {@code FATAL}
 * @param message  human readable description
 * @param time     emission instant
 * @param length   the emitter's length at emission time
 * @param capacity the emitter's capacity ({@code 0} when unbounded)
 * @param address  the emitter's identity in {@code 0x} hex form
 * @param data     optional structured payload, never null
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Event(String id,
                    String type,
                    String tag,
                    String message,
                    Instant time,
                    int length,
                    int capacity,
                    String address,
                    Map<String, Object> data) {

    public Event {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(time, "time");
        id = id == null ? "" : id;
        type = type == null ? "" : type;
        message = message == null ? "" : message;
        address = address == null ? "" : address;
        data = data == null || data.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Single-line rendering used by {@link JulEventSink}.
     *
     * @return e.g. {@code [S_filter] id=abc addr=0x1b6d3586 len=2 cap=0 :: push accepted 2 values}
     */
    public String format() {
        StringBuilder sb = new StringBuilder()
                .append('[').append(type).append("] ")
                .append("id=").append(id)
                .append(" addr=").append(address)
                .append(" len=").append(length)
                .append(" cap=").append(capacity)
                .append(" :: ").append(message);
        if (!data.isEmpty()) sb.append(' ').append(data);
        return sb.toString();
    }
}
