package com.structuredtables;

import java.util.Map;

import com.structuredtables.diagnostics.ParseDiagnostics;
import com.structuredtables.model.Record;
import com.structuredtables.tree.RecordConverter;

import lombok.Builder;
import lombok.Value;

/**
 * A fully parsed structured table: its record tree and the issues found on the way.
 */
@Value
@Builder
public class TableDocument {
    String name;
    String sourcePath;
    Record root;
    ParseDiagnostics diagnostics;

    public Map<String, Object> toMap() {
        return new RecordConverter().toMap(root);
    }

    public boolean hasIssues() {
        return diagnostics != null && diagnostics.hasIssues();
    }
}
