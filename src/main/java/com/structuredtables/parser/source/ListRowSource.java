package com.structuredtables.parser.source;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Row source over rows already held in memory.
 */
public class ListRowSource implements RowSource {
    private final String name;
    private final Iterator<List<String>> rows;

    public ListRowSource(String name, List<List<String>> rows) {
        this.name = name;
        this.rows = rows == null ? List.<List<String>>of().iterator() : rows.iterator();
    }

    @Override
    public Optional<List<String>> nextRow() {
        if (!rows.hasNext()) {
            return Optional.empty();
        }
        List<String> row = rows.next();
        // Callers may hold immutable rows; hand out a private copy
        return Optional.of(row == null ? new ArrayList<>() : new ArrayList<>(row));
    }

    @Override
    public String getName() {
        return name;
    }
}
