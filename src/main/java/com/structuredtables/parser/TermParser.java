package com.structuredtables.parser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structuredtables.diagnostics.IssueKind;
import com.structuredtables.diagnostics.ParseDiagnostics;
import com.structuredtables.parser.exception.MalformedRowException;
import com.structuredtables.parser.exception.ParseException;
import com.structuredtables.parser.exception.UnresolvableIncludeException;
import com.structuredtables.parser.include.IncludedSource;
import com.structuredtables.parser.source.CsvRowSource;
import com.structuredtables.parser.source.RowSource;
import com.structuredtables.util.TermNameUtil;

/**
 * Single-pass cursor that turns a row source into a flat stream of terms.
 *
 * Control rows ({@code termvaluename}, {@code section}, {@code term},
 * {@code synonym}) update the parser state and produce nothing. An
 * {@code include} row is replaced by every term of the included resource, in
 * place. Any other row produces its term followed by the child terms built from
 * its arguments and the current parameter map.
 *
 * Reading consumes the row source: once {@link #nextTerm()} has returned empty
 * it keeps doing so. Close the parser (or the stream from {@link #stream()}) to
 * release the source and any include still open.
 */
public class TermParser implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TermParser.class);

    static final String TERM_VALUE_NAME = "termvaluename";
    static final String SECTION = "section";
    static final String TERM = "term";
    static final String SYNONYM = "synonym";
    static final String INCLUDE = "include";

    private final RowSource source;
    private final ParserConfig config;
    private final ParserState state;
    private final ParseDiagnostics diagnostics;

    /** Locations of this resource and everything including it, outermost first. */
    private final Set<String> includeChain;

    private final Deque<Term> pending = new ArrayDeque<>();
    private TermParser include;
    private boolean exhausted;
    private boolean closed;
    private int rowCount;
    private int termCount;

    public TermParser(RowSource source) {
        this(source, ParserConfig.defaults(), new ParseDiagnostics());
    }

    public TermParser(RowSource source, ParserConfig config) {
        this(source, config, new ParseDiagnostics());
    }

    public TermParser(RowSource source, ParserConfig config, ParseDiagnostics diagnostics) {
        this(source, config, new ParserState(), diagnostics, Set.of());
    }

    TermParser(RowSource source, ParserConfig config, ParserState state,
               ParseDiagnostics diagnostics, Set<String> includeChain) {
        this.source = source;
        // Resolve once so nested parsers share a single resolver (and HTTP client)
        this.config = config.getIncludeResolver() != null
                ? config
                : config.toBuilder().includeResolver(config.resolver()).build();
        this.state = state;
        this.diagnostics = diagnostics;
        this.includeChain = includeChain;
    }

    /**
     * Open a parser over a local file. Relative includes resolve against the
     * file's directory.
     */
    public static TermParser forFile(Path file, ParserConfig config, ParseDiagnostics diagnostics) throws IOException {
        Path path = file.toAbsolutePath().normalize();
        RowSource rows = CsvRowSource.open(path, config.getDelimiter(), config.getCharset());
        Path directory = path.getParent() != null ? path.getParent() : config.getRootDirectory();
        return new TermParser(rows, config.withRootDirectory(directory), new ParserState(), diagnostics,
                Set.of(path.toString()));
    }

    /**
     * Pull the next term.
     *
     * @return the next term, or empty once the source (and every include) is exhausted
     * @throws UnresolvableIncludeException if an include target cannot be opened
     */
    public Optional<Term> nextTerm() {
        while (true) {
            if (include != null) {
                Optional<Term> included = include.nextTerm();
                if (included.isPresent()) {
                    return included;
                }
                closeInclude();
                continue;
            }

            if (!pending.isEmpty()) {
                termCount++;
                return Optional.of(pending.poll());
            }

            if (exhausted || closed) {
                return Optional.empty();
            }

            Optional<List<String>> row = readRow();
            if (row.isEmpty()) {
                exhausted = true;
                log.debug("Finished {}: {} rows, {} terms", source.getName(), rowCount, termCount);
                closeSource();
                return Optional.empty();
            }

            rowCount++;
            handleRow(row.get());
        }
    }

    /**
     * Lazy stream over the remaining terms. Closing the stream closes the parser.
     */
    public Stream<Term> stream() {
        Spliterator<Term> spliterator = new Spliterators.AbstractSpliterator<Term>(Long.MAX_VALUE,
                Spliterator.ORDERED | Spliterator.NONNULL) {
            @Override
            public boolean tryAdvance(Consumer<? super Term> action) {
                Optional<Term> next = nextTerm();
                next.ifPresent(action);
                return next.isPresent();
            }
        };
        return StreamSupport.stream(spliterator, false).onClose(this::close);
    }

    public ParseDiagnostics getDiagnostics() {
        return diagnostics;
    }

    public ParserState getState() {
        return state;
    }

    private void handleRow(List<String> raw) {
        if (raw.isEmpty() || TermNameUtil.isBlank(raw.get(0))) {
            return;
        }

        List<String> row = new ArrayList<>(raw);

        Optional<String> synonym = state.synonymFor(row.get(0));
        if (synonym.isPresent()) {
            row.set(0, synonym.get());
        }

        if (config.isLowercaseTermNames()) {
            row.set(0, TermNameUtil.key(row.get(0)));
        }

        Term term;
        try {
            term = Term.parse(row);
        } catch (MalformedRowException e) {
            log.warn("Skipping malformed row {} in {}: {}", raw, source.getName(), e.getMessage());
            diagnostics.add(IssueKind.MALFORMED_ROW, e.getMessage() + " in " + source.getName(), raw);
            return;
        }

        String name = TermNameUtil.key(term.getRecordTerm());

        if (name.equals(TERM_VALUE_NAME)) {
            if (term.getArgs().isEmpty()) {
                addIssue(IssueKind.MALFORMED_TERM_VALUE_NAME,
                        "termvaluename for '" + term.getValue() + "' has no value key", raw);
            } else {
                state.addValueName(term.getValue(), term.getArgs().get(0));
            }
            return;
        }

        term.setTermValueName(state.valueNameFor(term.getRecordTerm()));

        if (name.equals(SECTION) || name.equals(TERM)) {
            state.setParamMap(term.getArgs());
            log.debug("Parameter map is now {}", term.getArgs());
            return;
        }

        if (name.equals(SYNONYM)) {
            if (term.getArgs().isEmpty()) {
                addIssue(IssueKind.MALFORMED_SYNONYM,
                        "synonym for '" + term.getValue() + "' has no target term", raw);
            } else {
                state.addSynonym(term.getValue(), term.getArgs().get(0));
            }
            return;
        }

        if (name.equals(INCLUDE)) {
            openInclude(term.getValue());
            return;
        }

        pending.add(term);
        pending.addAll(term.childTerms(state.getParamMap()));
    }

    private void openInclude(String target) {
        String location = config.getIncludeResolver().locate(target, config.getRootDirectory());
        if (includeChain.contains(location)) {
            String msg = "Cyclic include of " + location + " from " + source.getName();
            log.error(msg);
            throw new UnresolvableIncludeException(target, msg);
        }

        IncludedSource included = config.getIncludeResolver().open(target, config.getRootDirectory());

        Set<String> chain = new LinkedHashSet<>(includeChain);
        chain.add(location);

        ParserState nestedState = config.isInheritIncludeState() ? state.copy() : new ParserState();
        include = new TermParser(included.getRows(), config.withRootDirectory(included.getRootDirectory()),
                nestedState, diagnostics, chain);

        log.info("Including {} from {}", included.getLocation(), source.getName());
    }

    private Optional<List<String>> readRow() {
        try {
            return source.nextRow();
        } catch (IOException e) {
            throw new ParseException("Failed to read rows from " + source.getName() + " (" + e.getMessage() + ")", e);
        }
    }

    private void addIssue(IssueKind kind, String message, List<String> row) {
        log.warn("{} in {}: {}", kind, source.getName(), message);
        diagnostics.add(kind, message, row);
    }

    private void closeInclude() {
        TermParser nested = include;
        include = null;
        if (nested != null) {
            nested.close();
        }
    }

    private void closeSource() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            source.close();
        } catch (IOException e) {
            throw new ParseException("Failed to close " + source.getName() + " (" + e.getMessage() + ")", e);
        }
    }

    /**
     * Release the row source and any include still open. Safe to call more than once.
     */
    @Override
    public void close() {
        try {
            closeInclude();
        } finally {
            closeSource();
        }
    }
}
