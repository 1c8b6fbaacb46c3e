package com.structuredtables.parser;

import java.util.ArrayList;
import java.util.List;

import com.structuredtables.parser.exception.MalformedRowException;

import lombok.Getter;
import lombok.Setter;

/**
 * One parsed row: a possibly dotted term name, a value and positional arguments.
 *
 * A term cell without a dot has no parent ({@link #NO_TERM}); a cell with a
 * leading dot has an elided parent ({@link #ELIDED_TERM}), which the tree builder
 * resolves to the most recent eligible record.
 */
@Getter
public class Term {

    /** Parent marker for a term cell without a dot. */
    public static final String NO_TERM = "<no_term>";

    /** Parent marker for a term cell with a leading dot. */
    public static final String ELIDED_TERM = "<elided_term>";

    public static final String DEFAULT_VALUE_NAME = "@value";

    private final String parentTerm;
    private final String recordTerm;
    private final String value;
    private final List<String> args;
    private final boolean argChild;

    @Setter
    private String termValueName = DEFAULT_VALUE_NAME;

    public Term(String term, String value, List<String> args, boolean argChild) {
        String cell = term == null ? "" : term;
        int dot = cell.indexOf('.');

        if (dot >= 0) {
            String prefix = cell.substring(0, dot).trim();
            this.parentTerm = prefix.isEmpty() ? ELIDED_TERM : prefix;
            this.recordTerm = cell.substring(dot + 1).trim();
        } else {
            this.parentTerm = NO_TERM;
            this.recordTerm = cell.trim();
        }

        this.value = value == null ? "" : value.trim();

        List<String> trimmed = new ArrayList<>();
        if (args != null) {
            for (String arg : args) {
                trimmed.add(arg == null ? "" : arg.trim());
            }
        }
        this.args = List.copyOf(trimmed);
        this.argChild = argChild;
    }

    /**
     * Parse a raw row {@code [term, value, args...]}.
     *
     * @throws MalformedRowException if the row has fewer than two cells or the
     *         term name after the dot is empty
     */
    public static Term parse(List<String> row) {
        if (row == null || row.size() < 2) {
            throw new MalformedRowException("Row needs a term and a value cell, got "
                    + (row == null ? 0 : row.size()) + " cell(s)", row);
        }

        Term term = new Term(row.get(0), row.get(1), row.subList(2, row.size()), false);
        if (term.getRecordTerm().isEmpty()) {
            throw new MalformedRowException("Empty term name in cell '" + row.get(0) + "'", row);
        }
        return term;
    }

    /**
     * Expand positional arguments into child terms named {@code recordTerm.param}.
     * Pairs are taken positionally up to the shorter of the two lists; pairs with
     * a blank name or blank argument are dropped.
     */
    public List<Term> childTerms(List<String> paramMap) {
        List<Term> children = new ArrayList<>();
        if (paramMap == null) {
            return children;
        }

        int n = Math.min(paramMap.size(), args.size());
        for (int i = 0; i < n; i++) {
            String param = paramMap.get(i) == null ? "" : paramMap.get(i).trim();
            String arg = args.get(i);
            if (!param.isEmpty() && !arg.isEmpty()) {
                children.add(new Term(recordTerm + "." + param, arg, List.of(), true));
            }
        }
        return children;
    }

    public boolean hasNoParent() {
        return NO_TERM.equals(parentTerm);
    }

    public boolean hasElidedParent() {
        return ELIDED_TERM.equals(parentTerm);
    }

    @Override
    public String toString() {
        if (hasNoParent()) {
            return recordTerm + ": " + value;
        } else if (hasElidedParent()) {
            return "." + recordTerm + ": " + value;
        }
        return parentTerm + "." + recordTerm + ": " + value;
    }
}
