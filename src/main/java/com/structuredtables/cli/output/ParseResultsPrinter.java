package com.structuredtables.cli.output;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structuredtables.TableDocument;
import com.structuredtables.diagnostics.ParseIssue;
import com.structuredtables.model.Record;

/**
 * Responsible only for printing CLI output for the "parse" command.
 * No validation, no execution.
 */
public class ParseResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ParseResultsPrinter.class);

    private final PrintWriter out;

    public ParseResultsPrinter(PrintWriter out) {
        this.out = out;
    }

    public void printTree(TableDocument document) {
        for (Record child : document.getRoot().getChildren()) {
            out.print(child.dump());
        }
        out.flush();
    }

    public void printMapping(TableDocument document) {
        printValue(document.toMap(), 0);
        out.flush();
    }

    public void printIssues(TableDocument document) {
        if (!document.hasIssues()) {
            return;
        }
        List<ParseIssue> issues = document.getDiagnostics().getIssues();
        log.warn("{} issue(s) while parsing {}:", issues.size(), document.getSourcePath());
        for (ParseIssue issue : issues) {
            log.warn("  {}", issue);
        }
    }

    public void printFailure(String message) {
        log.error("Parse failed: {}", message);
    }

    private void printValue(Object value, int level) {
        String indent = "  ".repeat(level);
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (e.getValue() instanceof Map<?, ?> || e.getValue() instanceof List<?>) {
                    out.println(indent + e.getKey() + ":");
                    printValue(e.getValue(), level + 1);
                } else {
                    out.println(indent + e.getKey() + ": " + e.getValue());
                }
            }
        } else if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> || item instanceof List<?>) {
                    out.println(indent + "-");
                    printValue(item, level + 1);
                } else {
                    out.println(indent + "- " + item);
                }
            }
        } else {
            out.println(indent + value);
        }
    }
}
