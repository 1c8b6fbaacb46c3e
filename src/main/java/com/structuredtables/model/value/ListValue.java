package com.structuredtables.model.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Values of a term that occurs more than once under the same parent, in order.
 */
@EqualsAndHashCode
@ToString
public class ListValue implements TermValue {
    private final List<TermValue> values = new ArrayList<>();

    public ListValue(TermValue first, TermValue second) {
        values.add(first);
        values.add(second);
    }

    public void add(TermValue value) {
        values.add(value);
    }

    public List<TermValue> getValues() {
        return Collections.unmodifiableList(values);
    }

    public int size() {
        return values.size();
    }

    @Override
    public Object toPlainObject() {
        List<Object> plain = new ArrayList<>(values.size());
        for (TermValue v : values) {
            plain.add(v.toPlainObject());
        }
        return plain;
    }
}
