package com.structuredtables.parser.source;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Producer of rows, each an ordered list of cells: index 0 is the term cell,
 * index 1 the value cell, the rest positional arguments.
 *
 * A source is read once, front to back.
 */
public interface RowSource extends Closeable {

    /**
     * @return the next row, or empty once the source is exhausted
     */
    Optional<List<String>> nextRow() throws IOException;

    /**
     * Name used in log and diagnostic messages (file name, URL, ...).
     */
    String getName();

    @Override
    default void close() throws IOException {
    }

    static RowSource of(List<List<String>> rows) {
        return new ListRowSource("<memory>", rows);
    }
}
