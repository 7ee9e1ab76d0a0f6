package com.morris.core.env;

import org.junit.jupiter.api.Test;

import com.morris.core.error.EvaluationError;
import com.morris.core.parser.Value;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DeclaredTypeTest {

    @Test
    void parses_names_and_aliases() {
        assertEquals(DeclaredType.INT, DeclaredType.parse("integer"));
        assertEquals(DeclaredType.FLOAT, DeclaredType.parse(":float"));
        assertEquals(DeclaredType.DICT, DeclaredType.parse("Map"));
        assertNull(DeclaredType.parse(null));
        assertNull(DeclaredType.parse("  "));
        assertThrows(IllegalArgumentException.class, () -> DeclaredType.parse("blob"));
    }

    @Test
    void scalar_conversions() {
        assertEquals(Value.integer(12), DeclaredType.INT.coerce(Value.string(" 12 ")));
        assertEquals(Value.integer(1), DeclaredType.INT.coerce(Value.bool(true)));
        assertEquals(Value.floating(3.0), DeclaredType.FLOAT.coerce(Value.integer(3)));
        assertEquals(Value.bool(false), DeclaredType.BOOL.coerce(Value.integer(0)));
        assertEquals(Value.bool(true), DeclaredType.BOOL.coerce(Value.string("TRUE")));
        assertEquals(Value.string("5"), DeclaredType.STRING.coerce(Value.integer(5)));
    }

    @Test
    void containers_come_from_json() {
        assertEquals(Value.list(List.of(Value.integer(1), Value.integer(2))),
                DeclaredType.LIST.coerce(Value.json("[1,2]")));
        assertThrows(EvaluationError.class, () -> DeclaredType.DICT.coerce(Value.json("[1]")));
    }

    @Test
    void json_conversion() {
        Value j = DeclaredType.JSON.coerce(Value.dict(Map.of("a", Value.integer(1))));
        assertEquals(Value.json("{\"a\":1}"), j);
        assertEquals(Value.json("[1]"), DeclaredType.JSON.coerce(Value.string("[1]")));
        assertThrows(EvaluationError.class, () -> DeclaredType.JSON.coerce(Value.string("{bad")));
    }

    @Test
    void failure_names_value_and_target() {
        EvaluationError e = assertThrows(EvaluationError.class, () -> DeclaredType.INT.coerce(Value.string("abc")));
        assertEquals("Cannot convert string \"abc\" to int", e.getMessage());
    }
}
