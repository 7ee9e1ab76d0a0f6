package com.morris.core.env;

import java.util.Locale;

import com.morris.core.error.EvaluationError;
import com.morris.core.parser.Value;
import com.morris.core.parser.ValueCodec;

/**
 * Optional type attached to a variable with {@code set ... type=...}.
 * Every value written to the variable, direct or propagated, passes through {@link #coerce(Value)}.
 */
public enum DeclaredType {
    STRING("string"),
    INT("int"),
    FLOAT("float"),
    BOOL("bool"),
    LIST("list"),
    DICT("dict"),
    JSON("json");

    public final String label;

    DeclaredType(String label) {
        this.label = label;
    }

    /** Accepts the type names plus a few aliases; a leading ':' is ignored. Null or blank gives null. */
    public static DeclaredType parse(String text) {
        if (text == null) return null;
        String t = text.trim().toLowerCase(Locale.ROOT);
        if (t.startsWith(":")) t = t.substring(1).trim();
        if (t.isEmpty()) return null;
        switch (t) {
            case "string":
            case "str":
                return STRING;
            case "int":
            case "integer":
                return INT;
            case "float":
            case "number":
                return FLOAT;
            case "bool":
            case "boolean":
                return BOOL;
            case "list":
                return LIST;
            case "dict":
            case "map":
                return DICT;
            case "json":
                return JSON;
            default:
                throw new IllegalArgumentException("Unknown type: " + text);
        }
    }

    public Value coerce(Value v) {
        switch (this) {
            case STRING:
                return v.type == Value.Type.STRING ? v : Value.string(v.toString());
            case INT:
                return toInt(v);
            case FLOAT:
                return toFloat(v);
            case BOOL:
                return toBool(v);
            case LIST:
                return toContainer(v, Value.Type.LIST);
            case DICT:
                return toContainer(v, Value.Type.DICT);
            case JSON:
            default:
                return toJson(v);
        }
    }

    private Value toInt(Value v) {
        switch (v.type) {
            case INT:
                return v;
            case FLOAT: {
                double d = v.asFloat();
                if (Double.isNaN(d) || Double.isInfinite(d)) throw fail(v);
                return Value.integer((long) d);
            }
            case BOOL:
                return Value.integer(v.asBool() ? 1 : 0);
            case STRING:
                try {
                    return Value.integer(Long.parseLong(v.asString().trim()));
                } catch (NumberFormatException e) {
                    throw fail(v);
                }
            default:
                throw fail(v);
        }
    }

    private Value toFloat(Value v) {
        switch (v.type) {
            case FLOAT:
                return v;
            case INT:
                return Value.floating(v.asInt());
            case BOOL:
                return Value.floating(v.asBool() ? 1.0 : 0.0);
            case STRING:
                try {
                    return Value.floating(Double.parseDouble(v.asString().trim()));
                } catch (NumberFormatException e) {
                    throw fail(v);
                }
            default:
                throw fail(v);
        }
    }

    private Value toBool(Value v) {
        switch (v.type) {
            case BOOL:
                return v;
            case INT:
                return Value.bool(v.asInt() != 0);
            case STRING: {
                String s = v.asString().trim();
                if (s.equalsIgnoreCase("true")) return Value.bool(true);
                if (s.equalsIgnoreCase("false")) return Value.bool(false);
                throw fail(v);
            }
            default:
                throw fail(v);
        }
    }

    private Value toContainer(Value v, Value.Type wanted) {
        Value m = ValueCodec.materialize(v);
        if (m.type != wanted) throw fail(v);
        return m;
    }

    private static Value toJson(Value v) {
        switch (v.type) {
            case JSON:
                return v;
            case STRING:
                ValueCodec.readTree(v.asString());
                return Value.json(v.asString());
            default:
                return Value.json(ValueCodec.toJsonText(v));
        }
    }

    private EvaluationError fail(Value v) {
        return new EvaluationError("Cannot convert " + v.typeName() + " " + v.display() + " to " + label);
    }
}
