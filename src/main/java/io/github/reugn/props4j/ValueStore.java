package io.github.reugn.props4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-instance container mapping wire names to values.
 *
 * <p>The backing map is created on the first write, or supplied wholesale by
 * {@link #replaceAll(Map)} when an output type is initialized from a payload. A store that was
 * never written compares equal to an empty one.
 *
 * <p>All access is guarded by the store's monitor, so a shared instance may be written from
 * several threads.
 */
public final class ValueStore {

    private Map<String, Object> values;

    /**
     * Looks up a value.
     *
     * @param name the wire name
     * @return the stored value, or {@code null} if none
     */
    public synchronized Object get(String name) {
        return values == null ? null : values.get(name);
    }

    /**
     * Writes a value, overwriting any previous one.
     */
    public synchronized void put(String name, Object value) {
        if (values == null) {
            values = new LinkedHashMap<>();
        }
        values.put(name, value);
    }

    /**
     * Replaces the whole content of this store with the entries of {@code payload}.
     */
    public synchronized void replaceAll(Map<String, ?> payload) {
        values = new LinkedHashMap<>(payload);
    }

    public synchronized boolean contains(String name) {
        return values != null && values.containsKey(name);
    }

    /**
     * @return {@code true} if the backing map has not been created yet
     */
    public synchronized boolean isUnset() {
        return values == null;
    }

    /**
     * Returns a mutable copy of the current content, in insertion order.
     */
    public synchronized Map<String, Object> snapshot() {
        return values == null ? new LinkedHashMap<>() : new LinkedHashMap<>(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValueStore)) {
            return false;
        }
        return snapshot().equals(((ValueStore) o).snapshot());
    }

    @Override
    public int hashCode() {
        return snapshot().hashCode();
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}
