package com.structuredtables.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structuredtables.TableDocument;
import com.structuredtables.TableDocumentLoader;
import com.structuredtables.cli.exception.OptionsValidationException;
import com.structuredtables.cli.model.ParseOptions;
import com.structuredtables.cli.model.ValidatedParseOptions;
import com.structuredtables.cli.output.ParseResultsPrinter;
import com.structuredtables.cli.validation.ParseOptionsValidator;
import com.structuredtables.parser.exception.ParseException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command that parses a structured table file and prints the result.
 */
@Command(
        name = "parse",
        mixinStandardHelpOptions = true,
        version = "structured-tables 1.0.0",
        description = "Parses a structured table file into a record tree and prints it as nested values."
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    @Mixin
    private ParseOptions options;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        ParseResultsPrinter printer = new ParseResultsPrinter(spec.commandLine().getOut());

        ValidatedParseOptions validated;
        try {
            validated = new ParseOptionsValidator().validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        try {
            TableDocument document = new TableDocumentLoader(validated.getParserConfig()).load(validated.getFile());

            if (options.isTree()) {
                printer.printTree(document);
            } else {
                printer.printMapping(document);
            }
            printer.printIssues(document);
            return 0;
        } catch (IOException | ParseException e) {
            printer.printFailure(e.getMessage());
            log.debug("Parse failure", e);
            return 1;
        }
    }
}
