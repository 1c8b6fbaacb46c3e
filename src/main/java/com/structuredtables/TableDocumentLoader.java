package com.structuredtables;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structuredtables.diagnostics.ParseDiagnostics;
import com.structuredtables.model.Record;
import com.structuredtables.parser.ParserConfig;
import com.structuredtables.parser.TermParser;
import com.structuredtables.parser.source.RowSource;
import com.structuredtables.tree.RecordTreeBuilder;

/**
 * Runs rows through the term parser and the tree builder.
 */
public class TableDocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(TableDocumentLoader.class);

    private final ParserConfig config;

    public TableDocumentLoader() {
        this(ParserConfig.defaults());
    }

    public TableDocumentLoader(ParserConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Load a delimiter-separated file. Includes resolve relative to its directory.
     *
     * @throws IOException if the file itself cannot be opened
     * @throws com.structuredtables.parser.exception.UnresolvableIncludeException if an include fails
     */
    public TableDocument load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Not a file: " + file);
        }

        log.info("Parsing structured table: {}", file.getFileName());

        ParseDiagnostics diagnostics = new ParseDiagnostics();
        try (TermParser parser = TermParser.forFile(file, config, diagnostics)) {
            Record root = new RecordTreeBuilder(diagnostics).generateRecords(parser);
            log.info("Parsed {}: {} top-level records, {} issue(s)",
                    file.getFileName(), root.getChildren().size(), diagnostics.size());
            return TableDocument.builder()
                    .name(stem(file))
                    .sourcePath(file.toAbsolutePath().normalize().toString())
                    .root(root)
                    .diagnostics(diagnostics)
                    .build();
        }
    }

    /**
     * Load rows from any source. Includes resolve against the configured root directory.
     */
    public TableDocument load(String name, RowSource rows) {
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        try (TermParser parser = new TermParser(rows, config, diagnostics)) {
            Record root = new RecordTreeBuilder(diagnostics).generateRecords(parser);
            log.debug("Parsed {}: {} top-level records", name, root.getChildren().size());
            return TableDocument.builder()
                    .name(name)
                    .sourcePath(rows.getName())
                    .root(root)
                    .diagnostics(diagnostics)
                    .build();
        }
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
