package com.morris.core.env;

/** Where a variable's current value came from. */
public enum VariableSource {
    DIRECT,
    COMPUTED,
    PROPAGATED;

    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }

    public static VariableSource parse(String s) {
        if (s == null) return DIRECT;
        try {
            return valueOf(s.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown variable source: " + s, e);
        }
    }
}
