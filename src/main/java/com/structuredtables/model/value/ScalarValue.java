package com.structuredtables.model.value;

import lombok.Value;

/**
 * A leaf value. May hold null for a record that never had one.
 */
@Value
public class ScalarValue implements TermValue {
    String value;

    public static ScalarValue of(String value) {
        return new ScalarValue(value);
    }

    @Override
    public Object toPlainObject() {
        return value;
    }
}
