package com.morris.core.error;

/** Malformed expression or template text. Raised before anything is mutated. */
public class ParseError extends MorrisError {

    private static final long serialVersionUID = 1L;

    public ParseError(String message) {
        super(Kind.PARSE, message);
    }

    public ParseError(String message, Throwable cause) {
        super(Kind.PARSE, message, cause);
    }
}
