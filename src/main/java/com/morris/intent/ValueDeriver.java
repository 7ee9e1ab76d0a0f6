package com.morris.intent;

import java.util.Locale;

import com.morris.core.env.DeclaredType;
import com.morris.core.parser.Value;

/**
 * Turns string values into typed ones.
 * Without a target type, tries int, then float, then bool; other text is returned unchanged.
 */
public final class ValueDeriver {

    private ValueDeriver() {}

    public static Value derive(Value v) {
        if (v.type != Value.Type.STRING) return v;
        String s = v.asString().trim();
        try {
            return Value.integer(Long.parseLong(s));
        } catch (NumberFormatException ignored) {
            // not an integer
        }
        try {
            double d = Double.parseDouble(s);
            if (!Double.isNaN(d) && !Double.isInfinite(d)) return Value.floating(d);
        } catch (NumberFormatException ignored) {
            // not a number
        }
        String lower = s.toLowerCase(Locale.ROOT);
        if (lower.equals("true")) return Value.bool(true);
        if (lower.equals("false")) return Value.bool(false);
        return v;
    }

    /** {@code as} = int | float | bool | json | string | list | dict; null means auto. */
    public static Value derive(Value v, String as) {
        DeclaredType type = DeclaredType.parse(as);
        return type == null ? derive(v) : type.coerce(v);
    }
}
