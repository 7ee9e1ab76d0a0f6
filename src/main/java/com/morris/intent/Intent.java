package com.morris.intent;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.morris.core.parser.ValueCodec;

/**
 * A structured request: verb, optional target and string parameters.
 *
 * JSON form: {@code {"verb":"set","target":"a","params":{"value":"5"}}}
 */
public final class Intent {

    private final Verb verb;
    private final String target;
    private final Map<String, String> params;

    public Intent(Verb verb, String target, Map<String, String> params) {
        if (verb == null) throw new IllegalArgumentException("verb must not be null");
        this.verb = verb;
        this.target = target == null || target.trim().isEmpty() ? null : target.trim();
        this.params = params == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static Intent of(Verb verb) {
        return new Intent(verb, null, null);
    }

    public static Intent of(Verb verb, String target) {
        return new Intent(verb, target, null);
    }

    public static Intent of(Verb verb, String target, Map<String, String> params) {
        return new Intent(verb, target, params);
    }

    /** Reads the JSON form. Non-text parameter values are kept as their JSON text. */
    public static Intent fromJson(String json) {
        JsonNode node = ValueCodec.readTree(json);
        if (!node.isObject()) throw new IllegalArgumentException("Intent must be a JSON object");

        Verb verb = Verb.fromKeyword(node.path("verb").asText(null));
        String target = node.hasNonNull("target") ? node.get("target").asText() : null;

        Map<String, String> params = new LinkedHashMap<>();
        JsonNode p = node.get("params");
        if (p != null && !p.isNull()) {
            if (!p.isObject()) throw new IllegalArgumentException("params must be a JSON object");
            Iterator<Map.Entry<String, JsonNode>> it = p.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                JsonNode v = e.getValue();
                params.put(e.getKey(), v.isTextual() ? v.asText() : v.toString());
            }
        }
        return new Intent(verb, target, params);
    }

    public Verb verb() { return verb; }
    public String target() { return target; }
    public Map<String, String> params() { return params; }

    public String param(String key) {
        return params.get(key);
    }

    public String param(String key, String fallback) {
        String v = params.get(key);
        return v == null ? fallback : v;
    }

    public String requireTarget() {
        if (target == null) throw new IllegalArgumentException(verb.keyword + " requires a target");
        return target;
    }

    public String requireParam(String key) {
        String v = params.get(key);
        if (v == null) throw new IllegalArgumentException(verb.keyword + " requires parameter '" + key + "'");
        return v;
    }

    public int intParam(String key, int fallback) {
        String v = params.get(key);
        if (v == null) return fallback;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be an integer, got " + v, e);
        }
    }

    @Override
    public String toString() {
        return verb.keyword + (target == null ? "" : " " + target) + (params.isEmpty() ? "" : " " + params);
    }
}
