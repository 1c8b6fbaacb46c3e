package com.structuredtables.parser;

import com.structuredtables.diagnostics.IssueKind;
import com.structuredtables.diagnostics.ParseDiagnostics;
import com.structuredtables.diagnostics.ParseIssue;
import com.structuredtables.parser.exception.UnresolvableIncludeException;
import com.structuredtables.parser.include.IncludeResolver;
import com.structuredtables.parser.include.IncludedSource;
import com.structuredtables.parser.source.ListRowSource;
import com.structuredtables.parser.source.RowSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TermParser.
 */
class TermParserTest {

    @TempDir
    Path tempDir;

    @Test
    void testPlainRowsEmitOneTermEach() {
        List<Term> terms = parse(List.of(
                List.of("title", "Hello"),
                List.of("description", "World")));

        assertThat(terms).extracting(Term::toString).containsExactly("title: Hello", "description: World");
    }

    @Test
    void testSectionDeclaresParameterMapForFollowingRows() {
        List<Term> terms = parse(List.of(
                List.of("section", "", "a", "b"),
                List.of("table", "v1", "x1", "x2")));

        assertThat(terms).extracting(Term::toString)
                .containsExactly("table: v1", "table.a: x1", "table.b: x2");
        assertThat(terms.get(1).isArgChild()).isTrue();
        assertThat(terms.get(2).isArgChild()).isTrue();
    }

    @Test
    void testTermRowAlsoReplacesParameterMap() {
        List<Term> terms = parse(List.of(
                List.of("section", "", "a", "b"),
                List.of("term", "", "c"),
                List.of("table", "v1", "x1", "x2")));

        assertThat(terms).extracting(Term::toString).containsExactly("table: v1", "table.c: x1");
    }

    @Test
    void testBlankFirstCellRowsAreSkipped() {
        List<Term> terms = parse(List.of(
                List.of("", "ignored"),
                List.of("   ", "ignored too"),
                List.of(),
                List.of("title", "Kept")));

        assertThat(terms).extracting(Term::getRecordTerm).containsExactly("title");
    }

    @Test
    void testTermNamesAreLowercasedByDefault() {
        List<Term> terms = parse(List.of(List.of("Table.Name", "Mixed Case")));

        assertThat(terms.get(0).getParentTerm()).isEqualTo("table");
        assertThat(terms.get(0).getRecordTerm()).isEqualTo("name");
        assertThat(terms.get(0).getValue()).isEqualTo("Mixed Case");
    }

    @Test
    void testTermCaseCanBePreserved() {
        ParserConfig config = ParserConfig.builder().lowercaseTermNames(false).build();

        List<Term> terms = parse(List.of(List.of("Table", "t")), config, new ParseDiagnostics());

        assertThat(terms.get(0).getRecordTerm()).isEqualTo("Table");
    }

    @Test
    void testSynonymSubstitutesTermName() {
        List<Term> terms = parse(List.of(
                List.of("synonym", "Heading", "Title"),
                List.of("HEADING", "Hello")));

        assertThat(terms).hasSize(1);
        assertThat(terms.get(0).getRecordTerm()).isEqualTo("title");
        assertThat(terms.get(0).getValue()).isEqualTo("Hello");
    }

    @Test
    void testSynonymSubstitutionHappensOncePerRow() {
        List<Term> terms = parse(List.of(
                List.of("synonym", "a", "b"),
                List.of("synonym", "b", "c"),
                List.of("a", "1"),
                List.of("b", "2")));

        assertThat(terms).extracting(Term::getRecordTerm).containsExactly("b", "c");
    }

    @Test
    void testLaterSynonymReplacesEarlier() {
        List<Term> terms = parse(List.of(
                List.of("synonym", "a", "b"),
                List.of("synonym", "A", "c"),
                List.of("a", "1")));

        assertThat(terms).extracting(Term::getRecordTerm).containsExactly("c");
    }

    @Test
    void testSynonymWithoutTargetIsRecordedAndSkipped() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();

        List<Term> terms = parse(List.of(
                List.of("synonym", "heading"),
                List.of("heading", "Hello")), ParserConfig.defaults(), diagnostics);

        assertThat(terms).extracting(Term::getRecordTerm).containsExactly("heading");
        assertThat(diagnostics.getIssues()).hasSize(1);
        assertThat(diagnostics.getIssues().get(0).getKind()).isEqualTo(IssueKind.MALFORMED_SYNONYM);
        assertThat(diagnostics.getIssues().get(0).getRow()).containsExactly("synonym", "heading");
    }

    @Test
    void testTermValueNameRemapsValueKey() {
        List<Term> terms = parse(List.of(
                List.of("termvaluename", "Table", "name"),
                List.of("table", "t1"),
                List.of("column", "c1")));

        assertThat(terms.get(0).getTermValueName()).isEqualTo("name");
        assertThat(terms.get(1).getTermValueName()).isEqualTo("@value");
    }

    @Test
    void testTermValueNameWithoutKeyIsRecorded() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();

        List<Term> terms = parse(List.of(
                List.of("termvaluename", "table"),
                List.of("table", "t1")), ParserConfig.defaults(), diagnostics);

        assertThat(terms.get(0).getTermValueName()).isEqualTo("@value");
        assertThat(diagnostics.getIssues(IssueKind.MALFORMED_TERM_VALUE_NAME)).hasSize(1);
    }

    @Test
    void testShortRowIsRecordedAndParsingContinues() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();

        List<Term> terms = parse(List.of(
                List.of("title"),
                List.of("description", "still here")), ParserConfig.defaults(), diagnostics);

        assertThat(terms).extracting(Term::getRecordTerm).containsExactly("description");
        assertThat(diagnostics.getIssues(IssueKind.MALFORMED_ROW)).hasSize(1);
    }

    @Test
    void testNullCellsInMalformedRowsAreRecorded() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();

        List<Term> terms = parse(List.of(
                Arrays.asList("synonym", null),
                Arrays.asList("termvaluename", null),
                Arrays.asList("a.", null),
                Arrays.asList("title", "t")), ParserConfig.defaults(), diagnostics);

        assertThat(terms).extracting(Term::toString).containsExactly("title: t");
        assertThat(diagnostics.getIssues()).extracting(ParseIssue::getKind).containsExactly(
                IssueKind.MALFORMED_SYNONYM, IssueKind.MALFORMED_TERM_VALUE_NAME, IssueKind.MALFORMED_ROW);
        assertThat(diagnostics.getIssues().get(0).getRow()).containsExactly("synonym", null);
    }

    @Test
    void testCursorIsNotRestartable() {
        TermParser parser = new TermParser(RowSource.of(List.of(List.of("title", "t"))));

        assertThat(parser.nextTerm()).isPresent();
        assertThat(parser.nextTerm()).isEmpty();
        assertThat(parser.nextTerm()).isEmpty();
    }

    @Test
    void testClosingStreamEarlyReleasesSource() {
        TrackingRowSource rows = new TrackingRowSource(List.of(
                List.of("a", "1"),
                List.of("b", "2"),
                List.of("c", "3")));

        try (Stream<Term> stream = new TermParser(rows).stream()) {
            assertThat(stream.findFirst()).map(Term::getRecordTerm).contains("a");
        }

        assertThat(rows.closed).isTrue();
        assertThat(rows.read).isEqualTo(1);
    }

    @Test
    void testExhaustionReleasesSource() {
        TrackingRowSource rows = new TrackingRowSource(List.of(List.of("a", "1")));

        List<Term> terms = new TermParser(rows).stream().collect(Collectors.toList());

        assertThat(terms).hasSize(1);
        assertThat(rows.closed).isTrue();
    }

    @Test
    void testIncludeIsFlattenedInPlace() throws IOException {
        Files.createDirectories(tempDir.resolve("sub"));
        Files.writeString(tempDir.resolve("main.csv"), "title,Main\ninclude,sub/part.csv\nfooter,End\n");
        Files.writeString(tempDir.resolve("sub/part.csv"), "a,1\ninclude,deeper.csv\nc,3\n");
        Files.writeString(tempDir.resolve("sub/deeper.csv"), "b,2\n");

        List<Term> terms = parseFile(tempDir.resolve("main.csv"), ParserConfig.defaults());

        assertThat(terms).extracting(Term::getRecordTerm).containsExactly("title", "a", "b", "c", "footer");
    }

    @Test
    void testIncludeWithLeadingSlashResolvesAgainstRoot() throws IOException {
        Files.writeString(tempDir.resolve("part.csv"), "a,1\n");

        ParserConfig config = ParserConfig.builder().rootDirectory(tempDir).build();
        List<Term> terms = parse(List.of(List.of("include", "/part.csv")), config, new ParseDiagnostics());

        assertThat(terms).extracting(Term::getRecordTerm).containsExactly("a");
    }

    @Test
    void testMissingIncludeIsFatal() {
        ParserConfig config = ParserConfig.builder().rootDirectory(tempDir).build();
        TermParser parser = new TermParser(RowSource.of(List.of(
                List.of("title", "t"),
                List.of("include", "missing.csv"))), config);

        assertThat(parser.nextTerm()).isPresent();
        assertThatThrownBy(parser::nextTerm)
                .isInstanceOf(UnresolvableIncludeException.class)
                .hasMessageContaining("missing.csv");
        parser.close();
    }

    @Test
    void testCyclicIncludeIsFatal() throws IOException {
        Files.writeString(tempDir.resolve("a.csv"), "title,A\ninclude,b.csv\n");
        Files.writeString(tempDir.resolve("b.csv"), "title,B\ninclude,a.csv\n");

        assertThatThrownBy(() -> parseFile(tempDir.resolve("a.csv"), ParserConfig.defaults()))
                .isInstanceOf(UnresolvableIncludeException.class)
                .hasMessageContaining("Cyclic include");
    }

    @Test
    void testIncludeStartsWithFreshStateByDefault() throws IOException {
        Files.writeString(tempDir.resolve("main.csv"),
                "synonym,alias,title\nsection,,x\ninclude,part.csv\nalias,After\n");
        Files.writeString(tempDir.resolve("part.csv"), "alias,Inside,arg\nsynonym,after,changed\n");

        List<Term> terms = parseFile(tempDir.resolve("main.csv"), ParserConfig.defaults());

        assertThat(terms).extracting(Term::toString).containsExactly("alias: Inside", "title: After");
    }

    @Test
    void testIncludeCanInheritState() throws IOException {
        Files.writeString(tempDir.resolve("main.csv"),
                "synonym,alias,title\nsection,,x\ninclude,part.csv\nfoo,After\n");
        Files.writeString(tempDir.resolve("part.csv"), "alias,Inside,arg\nsynonym,foo,bar\n");

        ParserConfig config = ParserConfig.builder().inheritIncludeState(true).build();
        List<Term> terms = parseFile(tempDir.resolve("main.csv"), config);

        // the include sees the includer's synonym and parameter map, but its own
        // synonym does not leak back out
        assertThat(terms).extracting(Term::toString).containsExactly("title: Inside", "title.x: arg", "foo: After");
    }

    @Test
    void testIncludeIssuesReachTopLevelDiagnostics() throws IOException {
        Files.writeString(tempDir.resolve("main.csv"), "include,part.csv\n");
        Files.writeString(tempDir.resolve("part.csv"), "synonym,orphan\n");

        ParseDiagnostics diagnostics = new ParseDiagnostics();
        try (TermParser parser = TermParser.forFile(tempDir.resolve("main.csv"), ParserConfig.defaults(), diagnostics)) {
            assertThat(parser.nextTerm()).isEmpty();
        }

        assertThat(diagnostics.getIssues(IssueKind.MALFORMED_SYNONYM)).hasSize(1);
    }

    @Test
    void testUrlIncludeGoesThroughResolver() {
        RecordingResolver resolver = new RecordingResolver(List.of(List.of("remote", "r1")));
        ParserConfig config = ParserConfig.builder().includeResolver(resolver).rootDirectory(tempDir).build();

        List<Term> terms = parse(List.of(
                List.of("include", "http://example.com/tables/remote.csv"),
                List.of("local", "l1")), config, new ParseDiagnostics());

        assertThat(resolver.targets).containsExactly("http://example.com/tables/remote.csv");
        assertThat(terms).extracting(Term::getRecordTerm).containsExactly("remote", "local");
    }

    @Test
    void testClosingParserReleasesOpenInclude() {
        RecordingResolver resolver = new RecordingResolver(List.of(List.of("x", "1"), List.of("y", "2")));
        ParserConfig config = ParserConfig.builder().includeResolver(resolver).build();

        TermParser parser = new TermParser(RowSource.of(List.of(List.of("include", "part.csv"))), config);
        assertThat(parser.nextTerm()).map(Term::getRecordTerm).contains("x");
        parser.close();

        assertThat(resolver.opened).hasSize(1);
        assertThat(resolver.opened.get(0).closed).isTrue();
    }

    private static List<Term> parse(List<List<String>> rows) {
        return parse(rows, ParserConfig.defaults(), new ParseDiagnostics());
    }

    private static List<Term> parse(List<List<String>> rows, ParserConfig config, ParseDiagnostics diagnostics) {
        try (Stream<Term> stream = new TermParser(RowSource.of(rows), config, diagnostics).stream()) {
            return stream.collect(Collectors.toList());
        }
    }

    private static List<Term> parseFile(Path file, ParserConfig config) throws IOException {
        try (Stream<Term> stream = TermParser.forFile(file, config, new ParseDiagnostics()).stream()) {
            return stream.collect(Collectors.toList());
        }
    }

    private static class TrackingRowSource extends ListRowSource {
        boolean closed;
        int read;

        TrackingRowSource(List<List<String>> rows) {
            super("tracking", rows);
        }

        @Override
        public Optional<List<String>> nextRow() {
            Optional<List<String>> row = super.nextRow();
            if (row.isPresent()) {
                read++;
            }
            return row;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private static class RecordingResolver implements IncludeResolver {
        final List<List<String>> rows;
        final List<String> targets = new ArrayList<>();
        final List<TrackingRowSource> opened = new ArrayList<>();

        RecordingResolver(List<List<String>> rows) {
            this.rows = rows;
        }

        @Override
        public IncludedSource open(String target, Path rootDirectory) {
            targets.add(target);
            TrackingRowSource source = new TrackingRowSource(rows);
            opened.add(source);
            return new IncludedSource(source, rootDirectory, target);
        }

        @Override
        public String locate(String target, Path rootDirectory) {
            return target;
        }
    }
}
