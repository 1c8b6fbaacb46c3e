package com.structuredtables.parser.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A row that cannot be turned into a term. Recoverable: the parser records it
 * and moves on to the next row.
 */
public class MalformedRowException extends ParseException {

    private static final long serialVersionUID = 1L;

    private final List<String> row;

    public MalformedRowException(String message, List<String> row) {
        super(message);
        this.row = row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row));
    }

    public List<String> getRow() {
        return row;
    }
}
