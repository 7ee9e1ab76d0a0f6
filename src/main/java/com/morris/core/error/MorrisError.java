package com.morris.core.error;

/**
 * Base for every error raised by the Morris core. Never thrown directly; use one of the
 * concrete kinds. The message always names the offending identifier or type.
 */
public abstract class MorrisError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        PARSE("Parse error"),
        EVALUATION("Evaluation error"),
        GRAPH("Graph error"),
        TRANSACTION("Transaction error");

        public final String label;

        Kind(String label) {
            this.label = label;
        }
    }

    private final Kind kind;

    protected MorrisError(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected MorrisError(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    /** Message prefixed with the error kind, as shown to users. */
    public String describe() {
        return kind.label + ": " + getMessage();
    }
}
