package com.morris.intent;

import java.util.List;

import com.morris.core.parser.Value;

/** What a handler reports back. {@code value} is set when the verb produces one. */
public final class IntentResult {

    public final boolean success;
    public final String message;
    public final Value value;
    public final List<String> details;

    private IntentResult(boolean success, String message, Value value, List<String> details) {
        this.success = success;
        this.message = message;
        this.value = value;
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public static IntentResult ok(String message) {
        return new IntentResult(true, message, null, null);
    }

    public static IntentResult ok(String message, Value value) {
        return new IntentResult(true, message, value, null);
    }

    public static IntentResult ok(String message, List<String> details) {
        return new IntentResult(true, message, null, details);
    }

    public static IntentResult ok(String message, Value value, List<String> details) {
        return new IntentResult(true, message, value, details);
    }

    public static IntentResult failure(String message) {
        return new IntentResult(false, message, null, null);
    }

    public String render() {
        StringBuilder sb = new StringBuilder(message == null ? "" : message);
        for (String d : details) {
            if (sb.length() > 0) sb.append('\n');
            sb.append("  ").append(d);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return (success ? "ok: " : "failed: ") + render();
    }
}
