package com.morris.intent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.morris.core.error.EvaluationError;
import com.morris.core.parser.Value;
import com.morris.core.parser.ValueCodec;

/**
 * parse-json, to-json, from-json, json-get, json-set.
 *
 * Paths are dotted: {@code user.tags.0} reads key "user", key "tags", then list index 0.
 */
public final class JsonVerbs {

    private JsonVerbs() {}

    public static void register(IntentDispatcher d) {
        d.register(Verb.PARSE_JSON, JsonVerbs::parseJson);
        d.register(Verb.TO_JSON, (s, i) -> {
            String name = i.requireTarget();
            Value json = Value.json(ValueCodec.toJsonText(s.value(name)));
            return VariableVerbs.describe(s, s.setValue(i.param("into", name), json, null));
        });
        d.register(Verb.FROM_JSON, JsonVerbs::fromJson);
        d.register(Verb.JSON_GET, JsonVerbs::jsonGet);
        d.register(Verb.JSON_SET, JsonVerbs::jsonSet);
    }

    static IntentResult parseJson(Session s, Intent i) {
        String name = i.requireTarget();
        String text = i.param("json");
        if (text == null) text = i.requireParam("value");
        text = text.trim();
        ValueCodec.readTree(text);
        return VariableVerbs.describe(s, s.setValue(name, Value.json(text), null));
    }

    static IntentResult fromJson(Session s, Intent i) {
        String name = i.requireTarget();
        Value source = s.value(name);
        Value out;
        if (source.type == Value.Type.JSON) {
            out = ValueCodec.materialize(source);
        } else if (source.type == Value.Type.STRING) {
            out = ValueCodec.fromJsonText(source.asString());
        } else {
            throw new EvaluationError("from-json requires json or string, got " + source.typeName());
        }
        return VariableVerbs.describe(s, s.setValue(i.param("into", name), out, null));
    }

    static IntentResult jsonGet(Session s, Intent i) {
        String name = i.requireTarget();
        Value found = get(s.value(name), segments(i.requireParam("path")));
        String into = i.param("into");
        if (into != null) return VariableVerbs.describe(s, s.setValue(into, found, null));
        return IntentResult.ok(name + "." + i.param("path") + " = " + found.display(), found);
    }

    static IntentResult jsonSet(Session s, Intent i) {
        String name = i.requireTarget();
        Value current = s.value(name);
        Value replacement = s.evaluate(i.requireParam("value"));
        Value updated = set(ValueCodec.materialize(current), segments(i.requireParam("path")), 0, replacement);
        if (current.type == Value.Type.JSON || current.type == Value.Type.STRING) {
            updated = Value.json(ValueCodec.toJsonText(updated));
        }
        return VariableVerbs.describe(s, s.setValue(name, updated, null));
    }

    static List<String> segments(String path) {
        String p = path.trim();
        if (p.isEmpty()) throw new IllegalArgumentException("Empty JSON path");
        List<String> out = new ArrayList<>(Arrays.asList(p.split("\\.")));
        for (String seg : out) {
            if (seg.isEmpty()) throw new IllegalArgumentException("Empty segment in JSON path: " + path);
        }
        return out;
    }

    static Value get(Value root, List<String> path) {
        Value cur = root.type == Value.Type.STRING ? ValueCodec.fromJsonText(root.asString()) : root;
        for (String seg : path) {
            cur = ValueCodec.materialize(cur);
            if (cur.type == Value.Type.DICT) {
                Value next = cur.asDict().get(seg);
                if (next == null) throw new EvaluationError("Path segment '" + seg + "' not found");
                cur = next;
            } else if (cur.type == Value.Type.LIST) {
                List<Value> items = cur.asList();
                int idx = index(seg);
                if (idx < 0 || idx >= items.size()) {
                    throw new EvaluationError("Index " + seg + " out of bounds for list of length " + items.size());
                }
                cur = items.get(idx);
            } else {
                throw new EvaluationError("Cannot read '" + seg + "' from " + cur.typeName());
            }
        }
        return cur;
    }

    /** Copy of {@code node} with the value at {@code path[at..]} replaced. Missing keys are created. */
    static Value set(Value node, List<String> path, int at, Value replacement) {
        if (at == path.size()) return replacement;
        Value cur = node.type == Value.Type.STRING && at == 0
                ? ValueCodec.fromJsonText(node.asString())
                : ValueCodec.materialize(node);
        String seg = path.get(at);

        if (cur.type == Value.Type.DICT) {
            Map<String, Value> copy = new LinkedHashMap<>(cur.asDict());
            Value child = copy.get(seg);
            if (child == null) {
                child = at + 1 == path.size() ? replacement : Value.dict(new LinkedHashMap<>());
            }
            copy.put(seg, set(child, path, at + 1, replacement));
            return Value.dict(copy);
        }
        if (cur.type == Value.Type.LIST) {
            List<Value> copy = new ArrayList<>(cur.asList());
            int idx = index(seg);
            if (idx == copy.size()) {
                copy.add(set(Value.dict(new LinkedHashMap<>()), path, at + 1, replacement));
            } else if (idx >= 0 && idx < copy.size()) {
                copy.set(idx, set(copy.get(idx), path, at + 1, replacement));
            } else {
                throw new EvaluationError("Index " + seg + " out of bounds for list of length " + copy.size());
            }
            return Value.list(copy);
        }
        throw new EvaluationError("Cannot set '" + seg + "' on " + cur.typeName());
    }

    private static int index(String seg) {
        try {
            return Integer.parseInt(seg);
        } catch (NumberFormatException e) {
            throw new EvaluationError("List index must be an integer, got '" + seg + "'");
        }
    }
}
