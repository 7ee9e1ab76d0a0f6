package com.morris.debug;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.morris.intent.Session;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class Slf4jDebugSinkTest {

    @AfterEach
    void resetSink() {
        Debug.get().setSink(null);
    }

    @Test
    void logger_per_tag() {
        Slf4jDebugSink sink = new Slf4jDebugSink();
        assertEquals("morris.graph", sink.loggerFor("graph").getName());
        assertEquals("morris.core", sink.loggerFor(null).getName());
        assertEquals("morris.core", sink.loggerFor("").getName());
        assertSame(sink.loggerFor("graph"), sink.loggerFor("graph"));
    }

    @Test
    void every_level_reaches_slf4j() {
        Slf4jDebugSink sink = new Slf4jDebugSink();
        for (DebugLevel level : DebugLevel.values()) {
            assertDoesNotThrow(() -> sink.log(level, "test", "message at " + level, null));
            assertDoesNotThrow(() -> sink.log(level, "test", "failure at " + level, new IllegalStateException("x")));
        }
    }

    @Test
    void engine_warnings_go_through_the_hub() {
        List<String> lines = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> lines.add(level + " " + tag + " " + message));

        Session s = new Session();
        s.set("a", "1", null);
        s.set("b", "10 / a", null);
        s.set("a", "0", null);

        assertTrue(lines.contains("WARN propagation Propagation to b failed: Division by zero"), lines.toString());
    }

    @Test
    void null_sink_silences_output() {
        Debug.get().setSink(null);
        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> Debug.get().e("test", "dropped", new RuntimeException("x")));
    }
}
