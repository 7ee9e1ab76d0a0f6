package com.morris.core.graph;

import java.util.Locale;

/** Kind of a dependency edge. Determines how the edge is drawn; propagation treats all kinds alike. */
public enum DependencyType {
    DIRECT("black", "solid"),
    INVERSE("blue", "solid"),
    STATISTICAL("green", "solid"),
    TEMPORAL("purple", "solid"),
    CONDITIONAL("orange", "solid"),
    WEAK("gray", "dashed"),
    BIDIRECTIONAL("red", "solid");

    public final String color;
    public final String style;

    DependencyType(String color, String style) {
        this.color = color;
        this.style = style;
    }

    public static DependencyType parse(String s) {
        if (s == null || s.trim().isEmpty()) return DIRECT;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown dependency type: " + s, e);
        }
    }
}
