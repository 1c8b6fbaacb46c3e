package com.structuredtables.cli.validation;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.structuredtables.cli.exception.OptionError;
import com.structuredtables.cli.exception.OptionsValidationException;
import com.structuredtables.cli.model.ParseOptions;
import com.structuredtables.cli.model.ValidatedParseOptions;
import com.structuredtables.parser.ParserConfig;

public class ParseOptionsValidator {

	static final String FILE = "<file>";
	static final String DELIMITER = "--delimiter";
	static final String CHARSET = "--charset";
	static final String HTTP_TIMEOUT = "--http-timeout-seconds";

	public ValidatedParseOptions validate(ParseOptions o) {
		List<OptionError> errors = new ArrayList<>();

		Path file = o.getFile();
		if (file == null) {
			errors.add(new OptionError(FILE, "A structured table file is required."));
		} else if (!Files.isRegularFile(file)) {
			errors.add(new OptionError(FILE, "File does not exist or is not a regular file: " + file));
		}

		String delimiter = o.getDelimiter();
		if (delimiter == null || delimiter.length() != 1) {
			errors.add(new OptionError(DELIMITER, "Must be a single character. Got: '" + delimiter + "'"));
		}

		Charset charset = parseCharset(o.getCharset(), errors);

		if (o.getHttpTimeoutSeconds() <= 0) {
			errors.add(new OptionError(HTTP_TIMEOUT, "HTTP timeout must be > 0. Got: " + o.getHttpTimeoutSeconds()));
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Path normalizedFile = file.toAbsolutePath().normalize();

		ParserConfig config = ParserConfig.builder()
				.rootDirectory(normalizedFile.getParent())
				.delimiter(delimiter.charAt(0))
				.charset(charset)
				.lowercaseTermNames(!o.isPreserveCase())
				.inheritIncludeState(o.isInheritIncludeState())
				.httpRequestTimeout(Duration.ofSeconds(o.getHttpTimeoutSeconds()))
				.build();

		return new ValidatedParseOptions(normalizedFile, config);
	}

	private static Charset parseCharset(String name, List<OptionError> errors) {
		try {
			return Charset.forName(name);
		} catch (IllegalArgumentException e) {
			errors.add(new OptionError(CHARSET, "Unsupported charset: " + name));
			return null;
		}
	}
}
