package com.morris.core.parser;

import org.junit.jupiter.api.Test;

import com.morris.core.error.EvaluationError;
import com.morris.core.error.ParseError;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TemplateTest {

    private final VariableResolver env = VariableResolver.of(Map.of(
            "a", Value.integer(2),
            "b", Value.integer(3),
            "x", Value.floating(4.5)));

    @Test
    void braces_evaluate_expressions() {
        assertEquals("Total: 5", Template.render("Total: {a + b}", env));
    }

    @Test
    void dollar_forms_prefer_parameters() {
        Map<String, String> params = Map.of("who", "Ann", "a", "param");
        assertEquals("Ann and Ann", Template.render("$who and ${who}", params, env));
        assertEquals("param", Template.render("$a", params, env));
        assertEquals("4.5", Template.render("$x", params, env));
        assertEquals("Ann", Template.render("{who}", params, env));
    }

    @Test
    void doubled_and_escaped_characters_are_literal() {
        assertEquals("{literal}", Template.render("{{literal}}", env));
        assertEquals("$5 {x}", Template.render("\\$5 \\{x\\}", env));
    }

    @Test
    void unresolved_names_are_errors() {
        EvaluationError p = assertThrows(EvaluationError.class, () -> Template.render("$nobody", env));
        assertEquals("Parameter 'nobody' not provided", p.getMessage());

        EvaluationError v = assertThrows(EvaluationError.class, () -> Template.render("{missing}", env));
        assertEquals("Variable not found: missing", v.getMessage());
    }

    @Test
    void malformed_templates_are_parse_errors() {
        assertThrows(ParseError.class, () -> Template.render("open {a", env));
        assertThrows(ParseError.class, () -> Template.render("${a", env));
        assertThrows(ParseError.class, () -> Template.render("{ }", env));
    }

    @Test
    void referenced_names_cover_every_form() {
        assertEquals(List.of("a", "b", "c", "d"), List.copyOf(Template.referencedNames("{a + b} $c ${d} {{e}}")));
    }

    @Test
    void detects_template_text() {
        assertTrue(Template.isTemplate("hi $x"));
        assertTrue(Template.isTemplate("{a}"));
        assertFalse(Template.isTemplate("plain text"));
    }
}
