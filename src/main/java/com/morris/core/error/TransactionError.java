package com.morris.core.error;

public class TransactionError extends MorrisError {

    private static final long serialVersionUID = 1L;

    public enum Reason { NO_ACTIVE, ALREADY_ACTIVE, NESTED_LIMIT, INVALID_STATE, MERGE_CONFLICT, FORGE_FAILED }

    private final Reason reason;

    public TransactionError(Reason reason, String message) {
        super(Kind.TRANSACTION, message);
        this.reason = reason;
    }

    public TransactionError(Reason reason, String message, Throwable cause) {
        super(Kind.TRANSACTION, message, cause);
        this.reason = reason;
    }

    public static TransactionError noActive() {
        return new TransactionError(Reason.NO_ACTIVE, "No active transaction");
    }

    public Reason reason() {
        return reason;
    }
}
