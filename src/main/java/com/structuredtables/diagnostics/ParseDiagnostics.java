package com.structuredtables.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Recoverable issues accumulated during a parse, in the order they were found.
 *
 * Pure structure only: no logging, no formatting, no IO. A parser and all of its
 * nested include parsers write into the same instance.
 */
public class ParseDiagnostics {
    private final List<ParseIssue> issues = new ArrayList<>();

    public void add(IssueKind kind, String message, List<String> row) {
        issues.add(ParseIssue.of(kind, message, row));
    }

    public List<ParseIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public List<ParseIssue> getIssues(IssueKind kind) {
        return issues.stream()
                .filter(i -> i.getKind() == kind)
                .toList();
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    public int size() {
        return issues.size();
    }
}
