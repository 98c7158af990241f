package com.example.crosstab.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable vector clock keyed by tab id.
 * <p>
 * On the wire it is a flat JSON object of counters; the reserved {@code timestamp}
 * key carries the wall clock of the last change and never takes part in ordering.
 */
public final class VectorClock {

    public static final String TIMESTAMP_KEY = "timestamp";

    public enum Ordering {
        BEFORE,
        AFTER,
        EQUAL,
        CONCURRENT
    }

    private static final VectorClock EMPTY = new VectorClock(new TreeMap<>(), 0L);

    private final SortedMap<String, Long> counters;
    private final long timestamp;

    private VectorClock(SortedMap<String, Long> counters, long timestamp) {
        this.counters = Collections.unmodifiableSortedMap(counters);
        this.timestamp = timestamp;
    }

    public static VectorClock empty() {
        return EMPTY;
    }

    public static VectorClock of(Map<String, Long> counters) {
        return new VectorClock(new TreeMap<>(counters), System.currentTimeMillis());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static VectorClock fromJson(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, Long> counters = new TreeMap<>();
        long timestamp = 0L;
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            if (!(entry.getValue() instanceof Number number)) {
                throw new IllegalArgumentException("Vector clock entry '" + entry.getKey() + "' is not a number");
            }
            if (TIMESTAMP_KEY.equals(entry.getKey())) {
                timestamp = number.longValue();
            } else {
                counters.put(entry.getKey(), number.longValue());
            }
        }
        return new VectorClock(counters, timestamp);
    }

    @JsonValue
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>(counters);
        if (timestamp > 0) {
            json.put(TIMESTAMP_KEY, timestamp);
        }
        return json;
    }

    public Map<String, Long> getCounters() {
        return counters;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public long get(String tabId) {
        return counters.getOrDefault(tabId, 0L);
    }

    public boolean isEmpty() {
        return counters.isEmpty();
    }

    public VectorClock tick(String tabId) {
        TreeMap<String, Long> next = new TreeMap<>(counters);
        next.merge(tabId, 1L, Long::sum);
        return new VectorClock(next, System.currentTimeMillis());
    }

    /**
     * Per-key maximum of both clocks.
     */
    public VectorClock merge(VectorClock other) {
        TreeMap<String, Long> next = new TreeMap<>(counters);
        other.counters.forEach((tabId, counter) -> next.merge(tabId, counter, Math::max));
        return new VectorClock(next, Math.max(timestamp, other.timestamp));
    }

    /**
     * Orders this clock against {@code other}. Missing keys count as zero.
     */
    public Ordering compareWith(VectorClock other) {
        boolean anyGreater = false;
        boolean anyLess = false;
        TreeSet<String> keys = new TreeSet<>(counters.keySet());
        keys.addAll(other.counters.keySet());
        for (String key : keys) {
            long mine = get(key);
            long theirs = other.get(key);
            if (mine > theirs) {
                anyGreater = true;
            } else if (mine < theirs) {
                anyLess = true;
            }
        }
        if (anyGreater && anyLess) {
            return Ordering.CONCURRENT;
        }
        if (anyGreater) {
            return Ordering.AFTER;
        }
        if (anyLess) {
            return Ordering.BEFORE;
        }
        return Ordering.EQUAL;
    }

    public boolean isNewerThan(VectorClock other) {
        return compareWith(other) == Ordering.AFTER;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VectorClock that)) return false;
        return counters.equals(that.counters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(counters);
    }

    @Override
    public String toString() {
        return counters.toString();
    }
}
