package com.structuredtables.parser.source;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delimiter-separated row source backed by Commons CSV. Owns the underlying
 * reader and closes it with the source.
 */
public class CsvRowSource implements RowSource {
    private static final Logger log = LoggerFactory.getLogger(CsvRowSource.class);

    private final String name;
    private final CSVParser parser;
    private final Iterator<CSVRecord> records;

    public CsvRowSource(String name, Reader reader, char delimiter) throws IOException {
        this.name = name;
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .build();
        this.parser = format.parse(reader);
        this.records = parser.iterator();
    }

    public static CsvRowSource open(Path path, char delimiter, Charset charset) throws IOException {
        log.debug("Opening row file: {}", path);
        return new CsvRowSource(path.toString(), Files.newBufferedReader(path, charset), delimiter);
    }

    public static CsvRowSource open(String name, InputStream in, char delimiter, Charset charset) throws IOException {
        return new CsvRowSource(name, new InputStreamReader(in, charset), delimiter);
    }

    @Override
    public Optional<List<String>> nextRow() throws IOException {
        try {
            if (!records.hasNext()) {
                return Optional.empty();
            }
            CSVRecord record = records.next();
            List<String> row = new ArrayList<>(record.size());
            record.forEach(row::add);
            return Optional.of(row);
        } catch (UncheckedIOException e) {
            // Commons CSV surfaces read failures from its iterator this way
            throw e.getCause();
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
