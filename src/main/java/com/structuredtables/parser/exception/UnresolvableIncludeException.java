package com.structuredtables.parser.exception;

/**
 * An include target that could not be opened: missing file, failed fetch,
 * or a cyclic include. Fatal for the parse that hit it.
 */
public class UnresolvableIncludeException extends ParseException {

    private static final long serialVersionUID = 1L;

    private final String target;

    public UnresolvableIncludeException(String target, String message) {
        super(message);
        this.target = target;
    }

    public UnresolvableIncludeException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
