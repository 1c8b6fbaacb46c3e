package com.structuredtables.tree;

import java.util.LinkedHashMap;
import java.util.Map;

import com.structuredtables.model.Record;
import com.structuredtables.model.value.NestedValue;
import com.structuredtables.model.value.ScalarValue;
import com.structuredtables.model.value.TermValue;

/**
 * Converts a record subtree into nested values.
 */
public class RecordConverter {

    /**
     * A record without children converts to its scalar value. A record with
     * children converts to a mapping keyed by child term; repeated child terms
     * collect into a list, and a non-empty own value is stored under the
     * record's term value name.
     */
    public TermValue convert(Record record) {
        if (!record.hasChildren()) {
            return ScalarValue.of(record.getValue());
        }

        NestedValue nested = new NestedValue();
        for (Record child : record.getChildren()) {
            nested.merge(child.getTerm(), convert(child));
        }

        if (record.getValue() != null && !record.getValue().isEmpty()) {
            nested.put(record.getTermValueName(), ScalarValue.of(record.getValue()));
        }
        return nested;
    }

    /**
     * Plain mapping of a root's children; empty for a root without children.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> toMap(Record root) {
        TermValue value = convert(root);
        if (value instanceof NestedValue nested) {
            return (Map<String, Object>) nested.toPlainObject();
        }
        return new LinkedHashMap<>();
    }
}
