package com.morris.core.parser;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

import com.morris.core.error.EvaluationError;

/**
 * Fixed function and method table.
 *
 * Functions are keyed by (name, arity); methods by (receiver type, method name).
 * Methods that "modify" a list or dict return a new value and leave the receiver untouched.
 * Json receivers are materialized into list/dict/scalar values before dispatch.
 */
public final class Builtins {

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    /** Functional interface for built-in methods. */
    public interface BuiltinMethod {
        Value call(Value receiver, List<Value> args);
    }

    private static final DateTimeFormatter NOW_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Builtins STANDARD = new Builtins(Clock.systemUTC());

    private final Map<String, BuiltinFunction> functions;
    private final Map<String, BuiltinMethod> methods;
    private final Clock clock;

    private Builtins(Clock clock) {
        this.clock = clock;
        Map<String, BuiltinFunction> f = new HashMap<>();
        Map<String, BuiltinMethod> m = new HashMap<>();
        registerFunctions(f);
        registerStringMethods(m);
        registerListMethods(m);
        registerDictMethods(m);
        this.functions = Collections.unmodifiableMap(f);
        this.methods = Collections.unmodifiableMap(m);
    }

    public static Builtins standard() {
        return STANDARD;
    }

    /** Same table with {@code now()} reading from the given clock. */
    public static Builtins withClock(Clock clock) {
        return new Builtins(clock);
    }

    public Value call(String name, List<Value> args) {
        BuiltinFunction fn = functions.get(name + "/" + args.size());
        if (fn == null) {
            throw new EvaluationError("Unknown function or wrong arity: " + name + "/" + args.size());
        }
        return fn.call(args);
    }

    public Value invoke(Value receiver, String method, List<Value> args) {
        Value target = ValueCodec.materialize(receiver);
        BuiltinMethod m = methods.get(methodKey(target.type, method));
        if (m == null) {
            throw new EvaluationError("Method '" + method + "' not implemented for " + target.typeName());
        }
        return m.call(target, args);
    }

    // -------------------------
    // Functions
    // -------------------------

    private void registerFunctions(Map<String, BuiltinFunction> f) {
        f.put("count/2", args -> {
            Value subject = args.get(0);
            if (subject.type != Value.Type.STRING) {
                throw new EvaluationError("Cannot count in type: " + subject.typeName());
            }
            if (args.get(1).type != Value.Type.STRING) {
                throw new EvaluationError("Pattern must be a string");
            }
            String s = subject.asString();
            String pattern = args.get(1).asString();
            if (pattern.isEmpty()) throw new EvaluationError("Pattern must not be empty");

            long count = 0;
            int from = 0;
            while ((from = s.indexOf(pattern, from)) >= 0) {
                count++;
                from += pattern.length();
            }
            return Value.integer(count);
        });

        f.put("now/0", args -> Value.string(ZonedDateTime.now(clock.withZone(ZoneOffset.UTC)).format(NOW_FORMAT)));

        f.put("len/1", args -> length(args.get(0)));

        f.put("upper/1", args -> Value.string(requireString(args.get(0), "Cannot convert to uppercase: ")
                .toUpperCase(Locale.ROOT)));
        f.put("lower/1", args -> Value.string(requireString(args.get(0), "Cannot convert to lowercase: ")
                .toLowerCase(Locale.ROOT)));
        f.put("trim/1", args -> Value.string(requireString(args.get(0), "Cannot trim: ").trim()));

        f.put("keys/1", args -> {
            Value d = ValueCodec.materialize(args.get(0));
            if (d.type != Value.Type.DICT) {
                throw new EvaluationError("keys() requires dictionary, got " + d.typeName());
            }
            return sortedKeys(d);
        });
    }

    private static Value length(Value raw) {
        Value v = ValueCodec.materialize(raw);
        switch (v.type) {
            case STRING: return Value.integer(v.asString().length());
            case INT:
            case FLOAT:
            case BOOL: return Value.integer(v.toString().length());
            case LIST: return Value.integer(v.asList().size());
            case DICT: return Value.integer(v.asDict().size());
            default: throw new EvaluationError("Cannot take length of " + v.typeName());
        }
    }

    // -------------------------
    // Methods
    // -------------------------

    private void registerStringMethods(Map<String, BuiltinMethod> m) {
        m.put(methodKey(Value.Type.STRING, "len"), (s, args) -> {
            requireArgCount("len", args, 0);
            return Value.integer(s.asString().length());
        });
        m.put(methodKey(Value.Type.STRING, "upper"), (s, args) -> {
            requireArgCount("upper", args, 0);
            return Value.string(s.asString().toUpperCase(Locale.ROOT));
        });
        m.put(methodKey(Value.Type.STRING, "lower"), (s, args) -> {
            requireArgCount("lower", args, 0);
            return Value.string(s.asString().toLowerCase(Locale.ROOT));
        });
        m.put(methodKey(Value.Type.STRING, "trim"), (s, args) -> {
            requireArgCount("trim", args, 0);
            return Value.string(s.asString().trim());
        });
    }

    private void registerListMethods(Map<String, BuiltinMethod> m) {
        m.put(methodKey(Value.Type.LIST, "len"), (l, args) -> {
            requireArgCount("len", args, 0);
            return Value.integer(l.asList().size());
        });
        m.put(methodKey(Value.Type.LIST, "push"), (l, args) -> {
            requireArgCount("push", args, 1);
            List<Value> items = new ArrayList<>(l.asList());
            items.add(args.get(0));
            return Value.list(items);
        });
        m.put(methodKey(Value.Type.LIST, "pop"), (l, args) -> {
            requireArgCount("pop", args, 0);
            List<Value> items = new ArrayList<>(l.asList());
            if (items.isEmpty()) throw new EvaluationError("Cannot pop from empty list");
            items.remove(items.size() - 1);
            return Value.list(items);
        });
    }

    private void registerDictMethods(Map<String, BuiltinMethod> m) {
        m.put(methodKey(Value.Type.DICT, "len"), (d, args) -> {
            requireArgCount("len", args, 0);
            return Value.integer(d.asDict().size());
        });
        m.put(methodKey(Value.Type.DICT, "keys"), (d, args) -> {
            requireArgCount("keys", args, 0);
            return sortedKeys(d);
        });
        m.put(methodKey(Value.Type.DICT, "has"), (d, args) -> {
            requireArgCount("has", args, 1);
            return Value.bool(d.asDict().containsKey(key(args.get(0))));
        });
        m.put(methodKey(Value.Type.DICT, "get"), (d, args) -> {
            requireArgCount("get", args, 1);
            String k = key(args.get(0));
            Value v = d.asDict().get(k);
            if (v == null) throw new EvaluationError("Key '" + k + "' not found in dictionary");
            return v;
        });
        m.put(methodKey(Value.Type.DICT, "set"), (d, args) -> {
            requireArgCount("set", args, 2);
            Map<String, Value> copy = new LinkedHashMap<>(d.asDict());
            copy.put(key(args.get(0)), args.get(1));
            return Value.dict(copy);
        });
        m.put(methodKey(Value.Type.DICT, "remove"), (d, args) -> {
            requireArgCount("remove", args, 1);
            String k = key(args.get(0));
            if (!d.asDict().containsKey(k)) throw new EvaluationError("Key '" + k + "' not found in dictionary");
            Map<String, Value> copy = new LinkedHashMap<>(d.asDict());
            copy.remove(k);
            return Value.dict(copy);
        });
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static String methodKey(Value.Type type, String method) {
        return type.name() + ":" + method;
    }

    private static Value sortedKeys(Value dict) {
        List<Value> keys = new ArrayList<>();
        for (String k : new TreeSet<>(dict.asDict().keySet())) keys.add(Value.string(k));
        return Value.list(keys);
    }

    private static String key(Value v) {
        if (v.type != Value.Type.STRING) {
            throw new EvaluationError("Dictionary key must be a string, got " + v.typeName());
        }
        return v.asString();
    }

    private static String requireString(Value v, String message) {
        if (v.type != Value.Type.STRING) throw new EvaluationError(message + v.typeName());
        return v.asString();
    }

    private static void requireArgCount(String name, List<Value> args, int expected) {
        if (args.size() != expected) {
            throw new EvaluationError(name + "() expects " + expected + " argument" + (expected == 1 ? "" : "s")
                    + ", got " + args.size());
        }
    }
}
