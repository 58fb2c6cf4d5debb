package com.libragraph.provenance.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A mapping whose insertion order is part of its identity.
 *
 * <p>Plain {@link Map} instances are treated as unordered regardless of their
 * iteration order. Wrapping the entries in an {@code OrderedMapping} marks the
 * order as meaningful: two mappings with the same entries in a different order
 * are different values.
 *
 * <p>Keys are unique; values may be {@code null}. Instances are immutable.
 */
public final class OrderedMapping {

    private final Map<Object, Object> entries;

    private OrderedMapping(LinkedHashMap<Object, Object> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * Copies the given map, preserving its iteration order.
     */
    public static OrderedMapping of(Map<?, ?> map) {
        Objects.requireNonNull(map, "map cannot be null");
        return new OrderedMapping(new LinkedHashMap<>(map));
    }

    /**
     * Creates a mapping from alternating keys and values.
     *
     * @throws IllegalArgumentException on an odd argument count or a repeated key
     */
    public static OrderedMapping of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "Expected alternating keys and values, got " + keysAndValues.length + " arguments");
        }
        LinkedHashMap<Object, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            Object key = keysAndValues[i];
            if (map.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate key: " + key);
            }
            map.put(key, keysAndValues[i + 1]);
        }
        return new OrderedMapping(map);
    }

    public static OrderedMapping empty() {
        return new OrderedMapping(new LinkedHashMap<>());
    }

    /**
     * Returns the entries as an unmodifiable map in insertion order.
     */
    public Map<Object, Object> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof OrderedMapping other)) return false;
        // Map.equals ignores order, so compare entry by entry
        if (entries.size() != other.entries.size()) return false;
        var mine = entries.entrySet().iterator();
        var theirs = other.entries.entrySet().iterator();
        while (mine.hasNext()) {
            if (!mine.next().equals(theirs.next())) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (Map.Entry<Object, Object> e : entries.entrySet()) {
            h = 31 * h + e.hashCode();
        }
        return h;
    }

    @Override
    public String toString() {
        return "OrderedMapping" + entries;
    }
}
