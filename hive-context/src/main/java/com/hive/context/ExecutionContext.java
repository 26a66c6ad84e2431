package com.hive.context;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Key/value state of one run. Owned by exactly one in-flight run and never shared, so it is not synchronized.
 * {@link #merge(Map)} is the only mutator; null values are legal and count as present.
 */
public final class ExecutionContext {

    private final Map<String, Object> values;

    public ExecutionContext() {
        this.values = new LinkedHashMap<>();
    }

    /** Context seeded from caller input (or a snapshot); the map is copied. */
    public ExecutionContext(Map<String, ?> initial) {
        this.values = initial != null ? new LinkedHashMap<>(initial) : new LinkedHashMap<>();
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    /**
     * Returns the values at {@code keys} in request order.
     *
     * @throws MissingKeyException naming every absent key
     */
    public Map<String, Object> get(Collection<String> keys) {
        List<String> missing = missingKeys(keys);
        if (!missing.isEmpty()) throw new MissingKeyException(missing);
        Map<String, Object> subset = new LinkedHashMap<>();
        for (String k : keys) {
            subset.put(k, values.get(k));
        }
        return Collections.unmodifiableMap(subset);
    }

    /** Keys from {@code keys} that are not present, in request order. */
    public List<String> missingKeys(Collection<String> keys) {
        List<String> missing = new ArrayList<>();
        if (keys == null) return missing;
        for (String k : keys) {
            if (!values.containsKey(k) && !missing.contains(k)) missing.add(k);
        }
        return missing;
    }

    /**
     * Merges {@code produced} into the context, overwriting existing keys. Whether a node may overwrite is a
     * structural concern checked at validation time, so this never fails on collision.
     */
    public void merge(Map<String, ?> produced) {
        if (produced == null || produced.isEmpty()) return;
        values.putAll(produced);
    }

    /** Immutable copy of the current state (insertion order kept, nulls allowed). */
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "ExecutionContext" + values.keySet();
    }
}
