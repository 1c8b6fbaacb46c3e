package com.structuredtables;

import com.structuredtables.cli.ParseCommand;
import picocli.CommandLine;

/**
 * Main entry point: parses a structured table file and prints its record tree
 * or converted mapping.
 */
public class StructuredTablesApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ParseCommand())
                .execute(args);
        System.exit(exitCode);
    }
}
