package com.morris.intent;

import java.util.List;
import java.util.Locale;

import com.morris.core.parser.Builtins;
import com.morris.core.parser.Value;

/**
 * collection (op = push | pop | len) and dictionary (op = set | get | has | remove | keys | len).
 * Mutating ops write the new collection back to the target variable.
 */
public final class CollectionVerbs {

    private CollectionVerbs() {}

    public static void register(IntentDispatcher d) {
        d.register(Verb.COLLECTION, CollectionVerbs::collection);
        d.register(Verb.DICTIONARY, CollectionVerbs::dictionary);
    }

    static IntentResult collection(Session s, Intent i) {
        String name = i.requireTarget();
        Value list = s.value(name);
        String op = op(i);
        Builtins b = s.propagation().builtins();
        switch (op) {
            case "push":
                return store(s, name, b.invoke(list, "push", List.of(s.evaluate(i.requireParam("item")))));
            case "pop":
                return store(s, name, b.invoke(list, "pop", List.of()));
            case "len": {
                Value n = b.invoke(list, "len", List.of());
                return IntentResult.ok(name + " has " + n + " item(s)", n);
            }
            default:
                throw new IllegalArgumentException("Unknown collection op: " + op);
        }
    }

    static IntentResult dictionary(Session s, Intent i) {
        String name = i.requireTarget();
        Value dict = s.value(name);
        String op = op(i);
        Builtins b = s.propagation().builtins();
        switch (op) {
            case "set": {
                Value key = Value.string(i.requireParam("key"));
                return store(s, name, b.invoke(dict, "set", List.of(key, s.evaluate(i.requireParam("value")))));
            }
            case "remove":
                return store(s, name, b.invoke(dict, "remove", List.of(Value.string(i.requireParam("key")))));
            case "get": {
                Value v = b.invoke(dict, "get", List.of(Value.string(i.requireParam("key"))));
                return IntentResult.ok(name + "[" + i.param("key") + "] = " + v.display(), v);
            }
            case "has": {
                Value v = b.invoke(dict, "has", List.of(Value.string(i.requireParam("key"))));
                return IntentResult.ok(name + (v.asBool() ? " has " : " lacks ") + i.param("key"), v);
            }
            case "keys": {
                Value v = b.invoke(dict, "keys", List.of());
                return IntentResult.ok(v.display(), v);
            }
            case "len": {
                Value v = b.invoke(dict, "len", List.of());
                return IntentResult.ok(name + " has " + v + " key(s)", v);
            }
            default:
                throw new IllegalArgumentException("Unknown dictionary op: " + op);
        }
    }

    private static String op(Intent i) {
        return i.requireParam("op").trim().toLowerCase(Locale.ROOT);
    }

    private static IntentResult store(Session s, String name, Value updated) {
        return VariableVerbs.describe(s, s.setValue(name, updated, null));
    }
}
