package com.structuredtables.tree;

import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structuredtables.diagnostics.IssueKind;
import com.structuredtables.diagnostics.ParseDiagnostics;
import com.structuredtables.model.Record;
import com.structuredtables.parser.Term;
import com.structuredtables.parser.TermParser;
import com.structuredtables.util.TermNameUtil;

/**
 * Builds a record tree from a stream of terms.
 *
 * Each term becomes a record attached under the most recent record whose name
 * matches the term's parent. Terms without a parent attach to the root; terms
 * with an elided parent attach to the most recent record that was neither an
 * argument child nor itself elided.
 */
public class RecordTreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(RecordTreeBuilder.class);

    private final ParseDiagnostics diagnostics;

    public RecordTreeBuilder() {
        this(null);
    }

    /**
     * @param diagnostics where unknown parents are reported; may be null
     */
    public RecordTreeBuilder(ParseDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Consume every remaining term of {@code parser}. The caller still owns and
     * closes the parser.
     */
    public Record generateRecords(TermParser parser) {
        return generateRecords(parser.stream());
    }

    public Record generateRecords(Iterable<Term> terms) {
        return generateRecords(terms.iterator());
    }

    public Record generateRecords(Stream<Term> terms) {
        return generateRecords(terms.iterator());
    }

    private Record generateRecords(Iterator<Term> terms) {
        Record root = Record.root();
        Map<String, Record> lastTermMap = new HashMap<>();
        lastTermMap.put(Term.NO_TERM, root);

        while (terms.hasNext()) {
            addTerm(root, lastTermMap, terms.next());
        }
        return root;
    }

    private void addTerm(Record root, Map<String, Record> lastTermMap, Term term) {
        Record record = Record.builder()
                .term(term.getRecordTerm())
                .value(term.getValue())
                .termValueName(term.getTermValueName())
                .build();

        Record parent = lastTermMap.get(TermNameUtil.key(term.getParentTerm()));
        if (parent == null) {
            String msg = "No record named '" + term.getParentTerm() + "' for " + term + "; attached to root";
            log.warn(msg);
            if (diagnostics != null) {
                diagnostics.add(IssueKind.UNKNOWN_PARENT, msg, List.of(term.toString()));
            }
            parent = root;
        }
        parent.addChild(record);

        // Argument children and elided-parent records never become an anchor
        if (!term.isArgChild() && !term.hasElidedParent()) {
            lastTermMap.put(Term.ELIDED_TERM, record);
            lastTermMap.put(TermNameUtil.key(term.getRecordTerm()), record);
        }
    }
}
