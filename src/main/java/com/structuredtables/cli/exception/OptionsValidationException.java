package com.structuredtables.cli.exception;

import java.util.List;

/**
 * All option errors of one "parse" invocation, reported together.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final transient List<OptionError> optionErrors;

	public OptionsValidationException(List<OptionError> optionErrors) {
		super(optionErrors.stream().map(OptionError::toString)
				.reduce((a, b) -> a + System.lineSeparator() + b).orElse(""));
		this.optionErrors = List.copyOf(optionErrors);
	}

	public List<OptionError> getOptionErrors() {
		return optionErrors;
	}

	/**
	 * Messages prefixed with their option, e.g. {@code --delimiter: must be a single character}.
	 */
	public List<String> getErrors() {
		return optionErrors.stream().map(OptionError::toString).toList();
	}

	public List<String> getErrorsFor(String option) {
		return optionErrors.stream()
				.filter(e -> e.getOption().equals(option))
				.map(OptionError::getMessage)
				.toList();
	}
}
