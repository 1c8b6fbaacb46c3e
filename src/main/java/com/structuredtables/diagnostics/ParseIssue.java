package com.structuredtables.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * One recoverable problem, with the raw row that caused it.
 */
@Value
public class ParseIssue {
    @NonNull IssueKind kind;
    @NonNull String message;
    List<String> row;

    public static ParseIssue of(IssueKind kind, String message, List<String> row) {
        return new ParseIssue(kind, message, row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row)));
    }

    @Override
    public String toString() {
        return kind + ": " + message + (row.isEmpty() ? "" : " " + row);
    }
}
