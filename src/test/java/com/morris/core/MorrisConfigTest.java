package com.morris.core;

import org.junit.jupiter.api.Test;

import com.morris.core.propagation.PropagationStrategy;

import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class MorrisConfigTest {

    private static Properties props(String... kv) {
        Properties p = new Properties();
        for (int i = 0; i + 1 < kv.length; i += 2) p.setProperty(kv[i], kv[i + 1]);
        return p;
    }

    @Test
    void defaults() {
        MorrisConfig c = MorrisConfig.defaults();
        assertEquals(PropagationStrategy.immediate(), c.propagationStrategy());
        assertEquals(1000, c.propagationHistoryLimit());
        assertEquals(1000, c.transactionLogLimit());
        assertEquals(10, c.maxNestedTransactions());
        assertEquals(10_000, c.maxVariables());
        assertTrue(c.propagateOnAnneal());
    }

    @Test
    void reads_prefixed_properties() {
        MorrisConfig c = MorrisConfig.fromProperties(props(
                "morris.propagation.strategy", "batched",
                "morris.propagation.batchSize", "5",
                "morris.propagation.historyLimit", "50",
                "morris.maxVariables", " 200 ",
                "morris.anneal.propagate", "false"));

        assertEquals(PropagationStrategy.batched(5), c.propagationStrategy());
        assertEquals("Batched(5)", c.propagationStrategy().toString());
        assertEquals(50, c.propagationHistoryLimit());
        assertEquals(200, c.maxVariables());
        assertFalse(c.propagateOnAnneal());
        assertEquals(1000, c.transactionLogLimit());
    }

    @Test
    void debounce_window_comes_from_milliseconds() {
        MorrisConfig c = MorrisConfig.fromProperties(props(
                "morris.propagation.strategy", "Debounced",
                "morris.propagation.debounceMs", "250"));
        assertEquals(PropagationStrategy.debounced(Duration.ofMillis(250)), c.propagationStrategy());
        assertEquals("Debounced(250ms)", c.propagationStrategy().toString());
    }

    @Test
    void rejects_bad_values() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> MorrisConfig.fromProperties(props("morris.maxVariables", "lots")));
        assertEquals("Invalid integer for morris.maxVariables: lots", e.getMessage());

        assertThrows(IllegalArgumentException.class,
                () -> MorrisConfig.fromProperties(props("morris.propagation.strategy", "eventually")));
        assertThrows(IllegalArgumentException.class, () -> MorrisConfig.defaults().withMaxVariables(0));
        assertThrows(IllegalArgumentException.class, () -> MorrisConfig.defaults().withClock(null));
    }

    @Test
    void null_properties_give_defaults() {
        assertEquals(PropagationStrategy.immediate(), MorrisConfig.fromProperties(null).propagationStrategy());
    }

    @Test
    void bundled_properties_match_defaults() throws Exception {
        Properties p = new Properties();
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("morris.properties")) {
            assertNotNull(in);
            p.load(in);
        }
        MorrisConfig c = MorrisConfig.fromProperties(p);
        assertEquals(PropagationStrategy.immediate(), c.propagationStrategy());
        assertEquals(MorrisConfig.defaults().maxVariables(), c.maxVariables());
    }
}
