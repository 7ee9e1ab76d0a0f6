package com.morris.core.error;

/** Type mismatch, unknown name, division by zero, bad index, unknown function or no matching branch. */
public class EvaluationError extends MorrisError {

    private static final long serialVersionUID = 1L;

    public EvaluationError(String message) {
        super(Kind.EVALUATION, message);
    }

    public EvaluationError(String message, Throwable cause) {
        super(Kind.EVALUATION, message, cause);
    }
}
