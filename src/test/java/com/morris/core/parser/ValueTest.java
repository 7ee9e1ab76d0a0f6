package com.morris.core.parser;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.morris.core.error.EvaluationError;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValueTest {

    @Test
    void display_and_plain_forms() {
        assertEquals("2.5", Value.floating(2.5).toString());
        assertEquals("3", Value.floating(3.0).toString());
        assertEquals("\"hi\"", Value.string("hi").display());
        assertEquals("hi", Value.string("hi").toString());
        assertEquals("json!{\"a\":1}", Value.json("{\"a\":1}").display());
        assertEquals("[1, \"x\"]", Value.list(List.of(Value.integer(1), Value.string("x"))).toString());

        Map<String, Value> m = new LinkedHashMap<>();
        m.put("b", Value.integer(1));
        m.put("a", Value.bool(true));
        assertEquals("{\"a\": true, \"b\": 1}", Value.dict(m).toString());
    }

    @Test
    void accessors_check_the_variant() {
        EvaluationError e = assertThrows(EvaluationError.class, () -> Value.string("x").asInt());
        assertEquals("Expected int, got string", e.getMessage());
        assertEquals(3.0, Value.integer(3).asNumber(), 0.0);
    }

    @Test
    void containers_are_read_only_copies() {
        List<Value> items = new java.util.ArrayList<>(List.of(Value.integer(1)));
        Value v = Value.list(items);
        items.add(Value.integer(2));
        assertEquals(1, v.asList().size());
        assertThrows(UnsupportedOperationException.class, () -> v.asList().add(Value.integer(3)));
    }

    @Test
    void json_text_is_parsed_lazily() {
        Value bad = Value.json("{bad");
        assertFalse(bad.asJson().isParsed());
        assertThrows(EvaluationError.class, () -> ValueCodec.materialize(bad));

        Value good = Value.json("{\"a\": [1, 2.5, \"s\", true]}");
        Value m = ValueCodec.materialize(good);
        assertTrue(good.asJson().isParsed());
        List<Value> a = m.asDict().get("a").asList();
        assertEquals(List.of(Value.integer(1), Value.floating(2.5), Value.string("s"), Value.bool(true)), a);
    }

    @Test
    void json_text_output_sorts_keys() {
        Map<String, Value> m = new LinkedHashMap<>();
        m.put("b", Value.integer(1));
        m.put("a", Value.list(List.of(Value.bool(true))));
        assertEquals("{\"a\":[true],\"b\":1}", ValueCodec.toJsonText(Value.dict(m)));
    }

    @Test
    void tagged_form_keeps_the_variant() {
        Value nested = Value.dict(Map.of(
                "n", Value.integer(7),
                "f", Value.floating(1.5),
                "raw", Value.json("[1]"),
                "xs", Value.list(List.of(Value.string("a")))));
        ObjectNode tagged = ValueCodec.toTagged(nested);
        assertEquals("dict", tagged.get("type").asText());
        assertEquals("json", tagged.get("value").get("raw").get("type").asText());
        assertEquals("[1]", tagged.get("value").get("raw").get("value").asText());
        assertEquals(nested, ValueCodec.fromTagged(tagged));
    }

    @Test
    void tagged_form_rejects_unknown_tags() {
        ObjectNode node = ValueCodec.mapper().createObjectNode();
        node.put("type", "blob");
        node.put("value", "x");
        EvaluationError e = assertThrows(EvaluationError.class, () -> ValueCodec.fromTagged(node));
        assertEquals("Unknown value type tag: blob", e.getMessage());
    }
}
