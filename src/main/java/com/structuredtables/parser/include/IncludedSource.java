package com.structuredtables.parser.include;

import java.nio.file.Path;

import com.structuredtables.parser.source.RowSource;

import lombok.Value;

/**
 * An opened include target.
 */
@Value
public class IncludedSource {
    /** Rows of the included resource; the caller closes it. */
    RowSource rows;

    /** Directory that relative includes inside this resource resolve against. */
    Path rootDirectory;

    /** Normalized identity (absolute path or URL) used for cycle detection. */
    String location;
}
