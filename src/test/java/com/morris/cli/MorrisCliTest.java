package com.morris.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.morris.core.parser.Value;
import com.morris.core.parser.ValueCodec;
import com.morris.intent.IntentDispatcher;
import com.morris.intent.Session;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class MorrisCliTest {

    private MorrisCli cli;

    @BeforeEach
    void setUp() {
        cli = new MorrisCli(new Session(), IntentDispatcher.standard());
    }

    @Test
    void set_returns_tagged_value() {
        ObjectNode r = cli.process("{\"verb\":\"set\",\"target\":\"a\",\"params\":{\"value\":\"5\"}}");
        assertTrue(r.get("ok").asBoolean());
        assertEquals("a = 5", r.get("message").asText());
        assertEquals("int", r.get("value").get("type").asText());
        assertEquals(5, r.get("value").get("value").asInt());
        assertTrue(r.get("details").isArray());
        assertEquals(Value.integer(5), cli.session().value("a"));
    }

    @Test
    void bad_input_becomes_a_failed_response() {
        ObjectNode notJson = cli.process("{verb");
        assertFalse(notJson.get("ok").asBoolean());
        assertTrue(notJson.get("message").asText().startsWith("Evaluation error: Invalid JSON"));

        ObjectNode unknown = cli.process("{\"verb\":\"jump\"}");
        assertEquals("Invalid intent: Unknown verb: jump", unknown.get("message").asText());

        ObjectNode missing = cli.process("{\"target\":\"a\"}");
        assertEquals("Invalid intent: Missing verb", missing.get("message").asText());
        assertNull(missing.get("value"));
    }

    @Test
    void run_answers_each_line_and_skips_comments() throws Exception {
        String input = String.join("\n",
                "# setup",
                "{\"verb\":\"set\",\"target\":\"a\",\"params\":{\"value\":\"2\"}}",
                "",
                "{\"verb\":\"set\",\"target\":\"b\",\"params\":{\"value\":\"a * 3\"}}",
                "{\"verb\":\"env\"}");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        cli.run(new StringReader(input), new PrintStream(bytes, true, StandardCharsets.UTF_8));

        String[] lines = bytes.toString(StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(3, lines.length);
        JsonNode second = ValueCodec.readTree(lines[1]);
        assertEquals("b = 6", second.get("message").asText());
        JsonNode env = ValueCodec.readTree(lines[2]);
        assertEquals("2 variable(s)", env.get("message").asText());
        assertEquals(2, env.get("details").size());
    }
}
