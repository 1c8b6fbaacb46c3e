package com.structuredtables.cli.model;

import java.nio.file.Path;

import com.structuredtables.parser.ParserConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed to run a parse. Keeps ParseCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedParseOptions {
    Path file;
    ParserConfig parserConfig;
}
