package com.structuredtables.cli.exception;

import lombok.NonNull;
import lombok.Value;

/**
 * One rejected command line value, keyed by the option (or parameter label) it came from.
 */
@Value
public class OptionError {
	@NonNull String option;
	@NonNull String message;

	@Override
	public String toString() {
		return option + ": " + message;
	}
}
