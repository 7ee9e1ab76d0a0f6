package com.morris.core.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.morris.core.error.EvaluationError;

/**
 * Immutable tagged value. Lists and dicts are copied on construction and exposed read-only,
 * so "mutating" operations always build a new Value.
 */
public final class Value {
    public enum Type { STRING, INT, FLOAT, BOOL, LIST, DICT, JSON }

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s)); }
    public static Value integer(long i) { return new Value(Type.INT, i); }
    public static Value floating(double d) { return new Value(Type.FLOAT, d); }
    public static Value bool(boolean b) { return new Value(Type.BOOL, b); }
    public static Value json(String text) { return new Value(Type.JSON, new JsonText(text)); }

    public static Value list(List<Value> items) {
        return new Value(Type.LIST, Collections.unmodifiableList(new ArrayList<>(items)));
    }

    public static Value dict(Map<String, Value> entries) {
        return new Value(Type.DICT, Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    /**
     * Raw JSON text. Stored as given; parsed on first use and cached.
     */
    public static final class JsonText {
        public final String text;
        private volatile JsonNode parsed;

        JsonText(String text) {
            this.text = Objects.requireNonNull(text);
        }

        public JsonNode node() {
            JsonNode n = parsed;
            if (n == null) {
                n = ValueCodec.readTree(text);
                parsed = n;
            }
            return n;
        }

        public boolean isParsed() {
            return parsed != null;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof JsonText && ((JsonText) o).text.equals(text);
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }
    }

    public Type getType() { return type; }

    public boolean isNumeric() {
        return type == Type.INT || type == Type.FLOAT;
    }

    public String asString() {
        if (type != Type.STRING) throw new EvaluationError("Expected string, got " + typeName());
        return (String) value;
    }

    public long asInt() {
        if (type != Type.INT) throw new EvaluationError("Expected int, got " + typeName());
        return (long) value;
    }

    public double asFloat() {
        if (type != Type.FLOAT) throw new EvaluationError("Expected float, got " + typeName());
        return (double) value;
    }

    /** Int or float, widened to double. */
    public double asNumber() {
        if (type == Type.INT) return (double) (long) value;
        if (type == Type.FLOAT) return (double) value;
        throw new EvaluationError("Expected number, got " + typeName());
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new EvaluationError("Expected bool, got " + typeName());
        return (boolean) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != Type.LIST) throw new EvaluationError("Expected list, got " + typeName());
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asDict() {
        if (type != Type.DICT) throw new EvaluationError("Expected dict, got " + typeName());
        return (Map<String, Value>) value;
    }

    public JsonText asJson() {
        if (type != Type.JSON) throw new EvaluationError("Expected json, got " + typeName());
        return (JsonText) value;
    }

    public String typeName() {
        switch (type) {
            case STRING: return "string";
            case INT: return "int";
            case FLOAT: return "float";
            case BOOL: return "bool";
            case LIST: return "list";
            case DICT: return "dict";
            case JSON: return "json";
            default: return type.name().toLowerCase();
        }
    }

    /** Display form: strings quoted, json tagged. */
    public String display() {
        switch (type) {
            case STRING: return "\"" + value + "\"";
            case JSON: return "json!" + ((JsonText) value).text;
            default: return toString();
        }
    }

    /** Plain form: strings unquoted, nested elements in display form. */
    @Override
    public String toString() {
        switch (type) {
            case STRING: return (String) value;
            case INT: return Long.toString((long) value);
            case FLOAT: return formatFloat((double) value);
            case BOOL: return Boolean.toString((boolean) value);
            case LIST: {
                StringBuilder sb = new StringBuilder("[");
                List<Value> items = asList();
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(items.get(i).display());
                }
                return sb.append(']').toString();
            }
            case DICT: {
                StringBuilder sb = new StringBuilder("{");
                boolean first = true;
                for (Map.Entry<String, Value> e : new TreeMap<>(asDict()).entrySet()) {
                    if (!first) sb.append(", ");
                    first = false;
                    sb.append('"').append(e.getKey()).append("\": ").append(e.getValue().display());
                }
                return sb.append('}').toString();
            }
            case JSON: return ((JsonText) value).text;
            default: return String.valueOf(value);
        }
    }

    static String formatFloat(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return Double.toString(d);
        if (d == 0.0) return "0";
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return type == other.type && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + value.hashCode();
    }
}
