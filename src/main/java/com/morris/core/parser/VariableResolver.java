package com.morris.core.parser;

import java.util.Map;

/**
 * Name lookup used during evaluation.
 */
@FunctionalInterface
public interface VariableResolver {

    /** The current value of {@code name}, or null when it is not defined. */
    Value lookup(String name);

    static VariableResolver of(Map<String, Value> values) {
        return values::get;
    }

    static VariableResolver empty() {
        return name -> null;
    }

    /** Looks in {@code overlay} first, then falls back to {@code base}. */
    static VariableResolver overlay(Map<String, Value> overlay, VariableResolver base) {
        return name -> {
            Value v = overlay.get(name);
            return v != null ? v : base.lookup(name);
        };
    }
}
