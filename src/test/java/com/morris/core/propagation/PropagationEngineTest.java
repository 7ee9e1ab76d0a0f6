package com.morris.core.propagation;

import org.junit.jupiter.api.Test;

import com.morris.core.MorrisConfig;
import com.morris.core.env.Environment;
import com.morris.core.env.PropagationControl;
import com.morris.core.error.EvaluationError;
import com.morris.core.error.GraphError;
import com.morris.core.graph.DependencyEdge;
import com.morris.core.graph.DependencyType;
import com.morris.core.parser.Parser;
import com.morris.core.parser.Value;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PropagationEngineTest {

    /** Clock the test moves by hand. */
    static final class ManualClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private Environment env;
    private PropagationEngine engine;

    private void init(MorrisConfig config) {
        env = new Environment(config);
        engine = new PropagationEngine(env, config);
    }

    private PropagationEngine engine() {
        if (engine == null) init(MorrisConfig.defaults());
        return engine;
    }

    private PropagationResult set(String name, long value) {
        return engine().setDirect(name, Value.integer(value), null, null);
    }

    private PropagationResult computed(String name, String expr) {
        return engine().setComputed(name, Parser.parse(expr), expr, null, null);
    }

    private PropagationResult computed(String name, String expr, PropagationControl control) {
        return engine().setComputed(name, Parser.parse(expr), expr, null, control);
    }

    private Value value(String name) {
        return env.getValue(name);
    }

    @Test
    void dependent_follows_its_source() {
        set("a", 5);
        computed("b", "a + 1");
        PropagationResult r = set("a", 10);

        assertEquals(Value.integer(11), value("b"));
        assertEquals(List.of("a", "b"), r.changedVariables);
        assertEquals(List.of("a -> b"), r.propagationPaths);
        assertFalse(r.deferred);
    }

    @Test
    void chains_recompute_in_dependency_order() {
        set("a", 1);
        computed("b", "a * 2");
        computed("c", "b + a");
        PropagationResult r = set("a", 3);

        assertEquals(Value.integer(6), value("b"));
        assertEquals(Value.integer(9), value("c"));
        assertEquals(List.of("a", "b", "c"), r.changedVariables);
    }

    @Test
    void one_failing_dependent_does_not_stop_the_others() {
        set("a", 1);
        computed("b", "10 / a");
        computed("c", "a + 1");
        PropagationResult r = set("a", 0);

        assertEquals(List.of("b"), r.failedPropagations);
        assertTrue(r.hasFailures());
        assertEquals(Value.floating(10.0), value("b"));
        assertEquals(Value.integer(1), value("c"));
        assertEquals(List.of("a", "c"), r.changedVariables);
    }

    @Test
    void frozen_dependent_keeps_its_value() {
        set("a", 1);
        computed("b", "a + 1");
        engine().freeze("b");
        PropagationResult r = set("a", 5);

        assertEquals(Value.integer(2), value("b"));
        assertEquals(List.of("b"), r.failedPropagations);
    }

    @Test
    void frozen_root_rejects_direct_writes() {
        set("a", 1);
        engine().freeze("a");
        GraphError e = assertThrows(GraphError.class, () -> set("a", 2));
        assertEquals(GraphError.Reason.FROZEN, e.reason());
        assertEquals(Value.integer(1), value("a"));
        assertEquals(Value.integer(1), engine().graph().valueOf("a"));
    }

    @Test
    void expression_closing_a_cycle_is_refused() {
        set("a", 1);
        computed("b", "a + 1");

        GraphError e = assertThrows(GraphError.class, () -> computed("a", "b + 1"));
        assertEquals(GraphError.Reason.CYCLE, e.reason());
        assertEquals(Value.integer(1), value("a"));
        assertFalse(env.get("a").isComputed());
        assertEquals(List.of("b"), engine().graph().directDependents("a"));
        assertTrue(engine().graph().directDependencies("a").isEmpty());
    }

    @Test
    void unresolvable_expression_creates_nothing() {
        EvaluationError e = assertThrows(EvaluationError.class, () -> computed("x", "nope + 1"));
        assertEquals("Variable not found: nope", e.getMessage());
        assertFalse(env.contains("x"));
        assertFalse(engine().graph().contains("x"));
    }

    @Test
    void conditional_expressions_create_conditional_edges() {
        set("a", 1);
        computed("b", "1 when a > 0 | 2");
        DependencyEdge edge = engine().graph().edge("a", "b");
        assertEquals(DependencyType.CONDITIONAL, edge.type());
        assertEquals("(a > 0)", edge.guard());

        set("a", -1);
        assertEquals(Value.integer(2), value("b"));
    }

    @Test
    void rewriting_an_expression_replaces_its_edges() {
        set("a", 1);
        set("c", 5);
        computed("b", "a + 1");
        computed("b", "c * 2");
        assertTrue(engine().graph().directDependents("a").isEmpty());
        assertEquals(List.of("c"), engine().graph().directDependencies("b"));

        set("a", 100);
        assertEquals(Value.integer(10), value("b"));
    }

    @Test
    void unchanged_results_are_not_reported() {
        set("a", 1);
        computed("b", "a > 0");
        PropagationResult r = set("a", 2);
        assertEquals(List.of("a"), r.changedVariables);
        assertEquals(Value.bool(true), value("b"));
    }

    @Test
    void batched_drains_when_the_batch_fills() {
        set("a", 1);
        set("c", 1);
        computed("b", "a + c");
        engine().setStrategy(PropagationStrategy.batched(2));

        PropagationResult first = set("a", 2);
        assertTrue(first.deferred);
        assertEquals(Value.integer(2), value("a"));
        assertEquals(Value.integer(2), value("b"));
        assertEquals(1, engine().queuedCount());

        PropagationResult second = set("c", 5);
        assertFalse(second.deferred);
        assertEquals(Value.integer(7), value("b"));
        assertEquals(List.of("a", "c", "b"), second.changedVariables);
        assertEquals(0, engine().queuedCount());
    }

    @Test
    void lazy_waits_for_flush() {
        set("a", 1);
        computed("b", "a + 1");
        engine().setStrategy(PropagationStrategy.lazy());

        set("a", 2);
        set("a", 3);
        assertEquals(Value.integer(2), value("b"));
        assertEquals(1, engine().queuedCount());

        PropagationResult r = engine().flush();
        assertEquals(Value.integer(4), value("b"));
        assertTrue(r.changedVariables.contains("b"));
        assertTrue(engine().flush().changedVariables.isEmpty());
    }

    @Test
    void debounced_drains_when_a_change_arrives_after_the_window() {
        ManualClock clock = new ManualClock();
        init(MorrisConfig.defaults().withClock(clock));
        set("a", 1);
        computed("b", "a + 1");
        engine.setStrategy(PropagationStrategy.debounced(Duration.ofMillis(100)));

        assertTrue(set("a", 2).deferred);
        clock.advance(Duration.ofMillis(50));
        assertTrue(set("a", 3).deferred);
        assertEquals(Value.integer(2), value("b"));

        clock.advance(Duration.ofMillis(100));
        PropagationResult r = set("a", 4);
        assertFalse(r.deferred);
        assertEquals(Value.integer(5), value("b"));
        assertEquals(1, engine.queuedCount());
    }

    @Test
    void switching_strategy_drains_the_queue() {
        set("a", 1);
        computed("b", "a + 1");
        engine().setStrategy(PropagationStrategy.lazy());
        set("a", 2);

        PropagationResult drained = engine().setStrategy(PropagationStrategy.immediate());
        assertEquals(Value.integer(3), value("b"));
        assertTrue(drained.changedVariables.contains("b"));
        assertEquals(PropagationStrategy.immediate(), engine().strategy());
    }

    @Test
    void skip_control_withholds_the_next_updates() {
        set("a", 1);
        computed("b", "a + 1", PropagationControl.skipNext(1));

        PropagationResult r = set("a", 2);
        assertEquals(Value.integer(2), value("b"));
        assertEquals(1, r.conflictsResolved);

        set("a", 3);
        assertEquals(Value.integer(4), value("b"));
    }

    @Test
    void accept_control_applies_n_updates_then_stops() {
        set("a", 1);
        computed("b", "a + 1", PropagationControl.acceptNext(1));

        set("a", 2);
        assertEquals(Value.integer(3), value("b"));

        PropagationResult r = set("a", 3);
        assertEquals(Value.integer(3), value("b"));
        assertEquals(1, r.conflictsResolved);
    }

    @Test
    void history_ring_drops_oldest_entries() {
        init(MorrisConfig.defaults().withPropagationHistoryLimit(3));
        for (int i = 1; i <= 5; i++) set("a", i);

        assertEquals(3, engine.historySize());
        List<PropagationEvent> events = engine.recentHistory(10);
        assertEquals(Value.integer(3), events.get(0).newValue);
        assertEquals(Value.integer(5), events.get(2).newValue);
        assertEquals(1, engine.recentHistory(1).size());
    }

    @Test
    void rebuild_derives_edges_from_expressions() {
        set("a", 1);
        computed("b", "a + 1");
        engine().graph().clear();
        engine().rebuild();

        assertEquals(List.of("b"), engine().graph().directDependents("a"));
        set("a", 7);
        assertEquals(Value.integer(8), value("b"));
    }

    @Test
    void removing_a_variable_leaves_dependents_with_their_last_value() {
        set("a", 1);
        computed("b", "a + 1");
        engine().remove("a");

        assertFalse(env.contains("a"));
        assertFalse(engine().graph().contains("a"));
        assertEquals(Value.integer(2), value("b"));
    }

    @Test
    void recreated_source_is_relinked_to_existing_dependents() {
        set("a", 1);
        computed("b", "a + 1");
        engine().remove("a");
        set("a", 10);
        assertEquals(Value.integer(11), value("b"));
    }

    @Test
    void self_reference_is_rejected_and_leaves_the_variable_alone() {
        set("x", 5);
        GraphError e = assertThrows(GraphError.class, () -> computed("x", "x + 1"));
        assertEquals(GraphError.Reason.SELF_DEPENDENCY, e.reason());
        assertEquals(List.of("x", "x"), e.cyclePath());

        assertEquals(Value.integer(5), value("x"));
        assertFalse(env.get("x").isComputed());
        assertTrue(engine.graph().directDependents("x").isEmpty());
    }

    @Test
    void now_reads_the_configured_clock() {
        Clock fixed = Clock.fixed(Instant.parse("2024-03-05T06:07:08Z"), ZoneOffset.UTC);
        init(MorrisConfig.defaults().withClock(fixed));

        assertEquals(Value.string("20240305_060708"), engine.interpreter(env).evaluate(Parser.parse("now()")));
        assertEquals(Value.string("at 20240305_060708"),
                engine.interpreter(env).evaluate(Parser.parse("\"at {now()}\"")));
        assertEquals(Value.string("20240305_060708"), engine.builtins().call("now", List.of()));
    }
}
