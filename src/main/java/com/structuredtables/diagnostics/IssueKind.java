package com.structuredtables.diagnostics;

/**
 * Kinds of recoverable problems collected while parsing.
 */
public enum IssueKind {
    /**
     * A synonym row without a target argument.
     */
    MALFORMED_SYNONYM,

    /**
     * A row with fewer than two cells, or a term cell with an empty name.
     */
    MALFORMED_ROW,

    /**
     * A termvaluename row without the value key argument.
     */
    MALFORMED_TERM_VALUE_NAME,

    /**
     * A term whose parent was never seen; it is attached to the root instead.
     */
    UNKNOWN_PARENT
}
