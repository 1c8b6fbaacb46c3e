package com.structuredtables.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "parse" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ParseOptions {

	@Parameters(index = "0", description = "Structured table file to parse")
	private Path file;

	@Option(names = { "--delimiter", "-d" }, defaultValue = ",", description = "Cell delimiter (default: ,)")
	private String delimiter;

	@Option(names = { "--charset" }, defaultValue = "UTF-8", description = "Character set of the file and its includes (default: UTF-8)")
	private String charset;

	@Option(names = { "--inherit-include-state" }, description = "Included files start with the includer's synonyms, value names and parameter map")
	private boolean inheritIncludeState;

	@Option(names = { "--preserve-case" }, description = "Keep term names as written instead of lowercasing them")
	private boolean preserveCase;

	@Option(names = { "--tree", "-t" }, description = "Print the record tree instead of the converted mapping")
	private boolean tree;

	@Option(names = { "--http-timeout-seconds" }, defaultValue = "30", description = "Timeout for fetching URL includes")
	private int httpTimeoutSeconds;
}
