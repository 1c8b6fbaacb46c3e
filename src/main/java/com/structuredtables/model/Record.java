package com.structuredtables.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Builder;
import lombok.Getter;

/**
 * A node of the record tree: a term name, an optional value and ordered children.
 * Children are owned by this node and keep their arrival order.
 */
@Getter
public class Record {
    public static final String ROOT_TERM = "Root";
    public static final String DEFAULT_VALUE_NAME = "@value";

    private final String term;
    private final String value;
    private final String termValueName;
    private final List<Record> children = new ArrayList<>();

    @Builder
    public Record(String term, String value, String termValueName) {
        this.term = term == null ? "" : term.trim();
        this.value = value;
        this.termValueName = (termValueName == null || termValueName.isEmpty()) ? DEFAULT_VALUE_NAME : termValueName;
    }

    public static Record root() {
        return new Record(ROOT_TERM, null, null);
    }

    public void addChild(Record child) {
        children.add(child);
    }

    public List<Record> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * @return true if a direct child has exactly this term name
     */
    public boolean contains(String childTerm) {
        for (Record c : children) {
            if (c.term.equals(childTerm)) {
                return true;
            }
        }
        return false;
    }

    /**
     * All direct children with exactly this term name, in order.
     */
    public List<Record> get(String childTerm) {
        List<Record> records = new ArrayList<>();
        for (Record c : children) {
            if (c.term.equals(childTerm)) {
                records.add(c);
            }
        }
        return records;
    }

    /**
     * Indented rendering of this subtree, one record per line.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        dump(this, 0, sb);
        return sb.toString();
    }

    private static void dump(Record r, int level, StringBuilder sb) {
        sb.append("  ".repeat(level)).append(r).append(System.lineSeparator());
        for (Record c : r.children) {
            dump(c, level + 1, sb);
        }
    }

    @Override
    public String toString() {
        return "<record: " + term + ": " + termValueName + " = " + value + ">";
    }
}
