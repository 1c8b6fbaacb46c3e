package com.structuredtables.model.value;

/**
 * Converted form of a record subtree: a scalar, a list of values for a repeated
 * term, or a nested mapping.
 */
public interface TermValue {

    /**
     * Plain Java form: {@code String} (possibly null), {@code List<Object>} or
     * {@code Map<String, Object>}.
     */
    Object toPlainObject();
}
