package com.structuredtables.model.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Mapping from child term names to their values, in first-insertion order.
 */
@EqualsAndHashCode
@ToString
public class NestedValue implements TermValue {
    private final Map<String, TermValue> entries = new LinkedHashMap<>();

    /**
     * Add a value for {@code key}. The first value is stored as is; a second one
     * turns the entry into a list of both; later ones are appended to that list.
     */
    public void merge(String key, TermValue value) {
        TermValue existing = entries.get(key);

        if (existing == null) {
            entries.put(key, value);
        } else if (existing instanceof ListValue list) {
            list.add(value);
        } else if (existing instanceof ScalarValue || existing instanceof NestedValue) {
            entries.put(key, new ListValue(existing, value));
        } else {
            throw new IllegalStateException("Unknown value type: " + existing.getClass().getName());
        }
    }

    /**
     * Store {@code value} under {@code key}, replacing whatever was there.
     */
    public void put(String key, TermValue value) {
        entries.put(key, value);
    }

    public Optional<TermValue> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public Map<String, TermValue> getEntries() {
        return Collections.unmodifiableMap(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public Object toPlainObject() {
        Map<String, Object> plain = new LinkedHashMap<>();
        for (Map.Entry<String, TermValue> e : entries.entrySet()) {
            plain.put(e.getKey(), e.getValue().toPlainObject());
        }
        return plain;
    }
}
