package com.structuredtables.parser.exception;

/**
 * Base exception for failures while turning rows into terms.
 */
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
