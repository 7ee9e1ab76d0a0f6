package com.morris.core.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.morris.core.error.EvaluationError;

/**
 * Conversions between {@link Value} and Jackson trees.
 *
 * Two shapes are supported:
 *  - plain JSON (what to-json / from-json produce and read)
 *  - tagged JSON ({"type":"int","value":5}), used for persistence so every variant round-trips
 */
public final class ValueCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ValueCodec() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static JsonNode readTree(String text) {
        try {
            JsonNode node = MAPPER.readTree(text);
            if (node == null || node.isMissingNode()) {
                throw new EvaluationError("Invalid JSON: empty document");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new EvaluationError("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    // ---------------- plain JSON ----------------

    public static Value fromJsonNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Value.string("null");
        if (node.isTextual()) return Value.string(node.asText());
        if (node.isBoolean()) return Value.bool(node.asBoolean());
        if (node.isIntegralNumber() && node.canConvertToLong()) return Value.integer(node.asLong());
        if (node.isNumber()) return Value.floating(node.asDouble());

        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node) items.add(fromJsonNode(item));
            return Value.list(items);
        }

        if (node.isObject()) {
            Map<String, Value> out = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                out.put(e.getKey(), fromJsonNode(e.getValue()));
            }
            return Value.dict(out);
        }

        return Value.string(node.asText());
    }

    /** Parses JSON text into a list/dict/scalar Value. */
    public static Value fromJsonText(String text) {
        return fromJsonNode(readTree(text));
    }

    /** Turns a json-variant value into ordinary values; other variants are returned as is. */
    public static Value materialize(Value v) {
        if (v.type != Value.Type.JSON) return v;
        return fromJsonNode(v.asJson().node());
    }

    public static JsonNode toJsonNode(Value v) {
        switch (v.type) {
            case STRING: return NODES.textNode(v.asString());
            case INT: return NODES.numberNode(v.asInt());
            case FLOAT: return NODES.numberNode(v.asFloat());
            case BOOL: return NODES.booleanNode(v.asBool());
            case LIST: {
                ArrayNode arr = NODES.arrayNode();
                for (Value item : v.asList()) arr.add(toJsonNode(item));
                return arr;
            }
            case DICT: {
                ObjectNode obj = NODES.objectNode();
                for (Map.Entry<String, Value> e : new TreeMap<>(v.asDict()).entrySet()) {
                    obj.set(e.getKey(), toJsonNode(e.getValue()));
                }
                return obj;
            }
            case JSON: return v.asJson().node();
            default: throw new EvaluationError("Cannot convert " + v.typeName() + " to JSON");
        }
    }

    public static String toJsonText(Value v) {
        try {
            return MAPPER.writeValueAsString(toJsonNode(v));
        } catch (JsonProcessingException e) {
            throw new EvaluationError("Cannot serialize " + v.typeName() + ": " + e.getOriginalMessage(), e);
        }
    }

    // ---------------- tagged JSON ----------------

    public static ObjectNode toTagged(Value v) {
        ObjectNode out = NODES.objectNode();
        out.put("type", v.typeName());
        switch (v.type) {
            case STRING: out.put("value", v.asString()); break;
            case INT: out.put("value", v.asInt()); break;
            case FLOAT: out.put("value", v.asFloat()); break;
            case BOOL: out.put("value", v.asBool()); break;
            case JSON: out.put("value", v.asJson().text); break;
            case LIST: {
                ArrayNode arr = out.putArray("value");
                for (Value item : v.asList()) arr.add(toTagged(item));
                break;
            }
            case DICT: {
                ObjectNode obj = out.putObject("value");
                for (Map.Entry<String, Value> e : new TreeMap<>(v.asDict()).entrySet()) {
                    obj.set(e.getKey(), toTagged(e.getValue()));
                }
                break;
            }
            default:
                throw new EvaluationError("Cannot tag " + v.typeName());
        }
        return out;
    }

    public static Value fromTagged(JsonNode node) {
        if (node == null || !node.isObject() || !node.has("type") || !node.has("value")) {
            throw new EvaluationError("Tagged value must be an object with 'type' and 'value'");
        }
        String type = node.get("type").asText();
        JsonNode raw = node.get("value");
        switch (type) {
            case "string": return Value.string(raw.asText());
            case "int": return Value.integer(raw.asLong());
            case "float": return Value.floating(raw.asDouble());
            case "bool": return Value.bool(raw.asBoolean());
            case "json": return Value.json(raw.asText());
            case "list": {
                List<Value> items = new ArrayList<>();
                for (JsonNode item : raw) items.add(fromTagged(item));
                return Value.list(items);
            }
            case "dict": {
                Map<String, Value> out = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> it = raw.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    out.put(e.getKey(), fromTagged(e.getValue()));
                }
                return Value.dict(out);
            }
            default:
                throw new EvaluationError("Unknown value type tag: " + type);
        }
    }
}
