package com.morris.core.graph;

import org.junit.jupiter.api.Test;

import com.morris.core.error.GraphError;
import com.morris.core.parser.Value;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DependencyGraphTest {

    private static DependencyGraph graph(String... names) {
        DependencyGraph g = new DependencyGraph();
        for (String n : names) g.addVariable(n, Value.integer(0), false);
        return g;
    }

    private static String edgesOf(DependencyGraph g) {
        StringBuilder sb = new StringBuilder();
        for (DependencyEdge e : g.edges()) sb.append(e).append(';');
        return sb.toString();
    }

    @Test
    void add_variable_is_idempotent() {
        DependencyGraph g = new DependencyGraph();
        g.addVariable("a", Value.integer(1), false);
        g.addVariable("a", Value.integer(2), true);
        assertEquals(1, g.size());
        assertEquals(Value.integer(1), g.valueOf("a"));
        assertFalse(g.node("a").isConstant());
    }

    @Test
    void closing_a_cycle_fails_and_changes_nothing() {
        DependencyGraph g = graph("a", "b", "c");
        g.addDependency("a", "b");
        g.addDependency("b", "c");
        String before = edgesOf(g);

        GraphError e = assertThrows(GraphError.class, () -> g.addDependency("c", "a"));
        assertEquals(GraphError.Reason.CYCLE, e.reason());
        assertEquals(List.of("c", "a", "b", "c"), e.cyclePath());
        assertEquals("Cycle detected: c -> a -> b -> c", e.getMessage());

        assertEquals(before, edgesOf(g));
        assertNull(g.edge("c", "a"));
        assertEquals(List.of("a", "b", "c"), g.getTopologicalOrder());
    }

    @Test
    void self_dependency_and_unknown_names_are_rejected() {
        DependencyGraph g = graph("a");
        assertEquals(GraphError.Reason.SELF_DEPENDENCY,
                assertThrows(GraphError.class, () -> g.addDependency("a", "a")).reason());
        assertEquals(GraphError.Reason.NOT_FOUND,
                assertThrows(GraphError.class, () -> g.addDependency("a", "zz")).reason());
        assertEquals(GraphError.Reason.NOT_FOUND,
                assertThrows(GraphError.class, () -> g.updateVariable("zz", Value.integer(1))).reason());
    }

    @Test
    void re_adding_an_edge_updates_it_in_place() {
        DependencyGraph g = graph("a", "b");
        g.addDependency("a", "b");
        g.addDependency("a", "b", DependencyType.WEAK, 0.5, "a > 1");

        assertEquals(1, g.edges().size());
        DependencyEdge e = g.edge("a", "b");
        assertEquals(DependencyType.WEAK, e.type());
        assertEquals(0.5, e.weight(), 0.0);
        assertEquals("a > 1", e.guard());
    }

    @Test
    void update_returns_the_transitive_closure() {
        DependencyGraph g = graph("a", "b", "c", "d", "e", "x");
        g.addDependency("a", "b");
        g.addDependency("b", "c");
        g.addDependency("a", "d");
        g.addDependency("d", "c");
        g.addDependency("c", "e");
        g.addDependency("x", "e");

        Set<String> affected = g.updateVariable("a", Value.integer(9));

        Set<String> expected = new LinkedHashSet<>();
        Deque<String> todo = new ArrayDeque<>(g.directDependents("a"));
        while (!todo.isEmpty()) {
            String n = todo.poll();
            if (expected.add(n)) todo.addAll(g.directDependents(n));
        }
        assertEquals(expected, affected);
        assertEquals(Set.of("b", "c", "d", "e"), affected);
        assertEquals(Value.integer(9), g.valueOf("a"));
        assertEquals(1, g.node("a").updateCount());
    }

    @Test
    void frozen_nodes_refuse_updates() {
        DependencyGraph g = graph("a");
        g.setConstant("a", true);
        GraphError e = assertThrows(GraphError.class, () -> g.updateVariable("a", Value.integer(5)));
        assertEquals(GraphError.Reason.FROZEN, e.reason());
        assertEquals(Value.integer(0), g.valueOf("a"));
    }

    @Test
    void topological_order_breaks_ties_by_name() {
        DependencyGraph g = graph("d", "c", "b", "a");
        g.addDependency("a", "c");
        g.addDependency("a", "b");
        g.addDependency("b", "d");
        g.addDependency("c", "d");
        assertEquals(List.of("a", "b", "c", "d"), g.getTopologicalOrder());
        assertEquals(List.of("b", "d"), g.order(List.of("d", "b")));
    }

    @Test
    void bidirectional_edges_insert_a_reverse_half() {
        DependencyGraph g = graph("x", "y");
        g.addDependency("x", "y", DependencyType.BIDIRECTIONAL, 1.0, null);

        DependencyEdge reverse = g.edge("y", "x");
        assertNotNull(reverse);
        assertTrue(reverse.isReverse());
        assertEquals(List.of("x"), g.directDependents("y"));
        assertEquals(List.of("x"), g.directDependencies("y"));
        assertTrue(g.directDependencies("x").isEmpty());
        assertEquals(List.of("x", "y"), g.getTopologicalOrder());
        assertEquals(Set.of("y"), g.transitiveDependents("x"));

        assertTrue(g.removeDependency("x", "y"));
        assertTrue(g.edges().isEmpty());
    }

    @Test
    void removing_a_node_removes_its_edges() {
        DependencyGraph g = graph("a", "b", "c");
        g.addDependency("a", "b");
        g.addDependency("b", "c");
        g.removeVariable("b");

        assertFalse(g.contains("b"));
        assertTrue(g.edges().isEmpty());
        assertTrue(g.directDependents("a").isEmpty());
        assertTrue(g.directDependencies("c").isEmpty());
    }

    @Test
    void clear_dependencies_returns_removed_edges() {
        DependencyGraph g = graph("a", "b", "c");
        g.addDependency("a", "c");
        g.addDependency("b", "c");
        List<DependencyEdge> removed = g.clearDependencies("c");
        assertEquals(2, removed.size());
        assertTrue(g.directDependencies("c").isEmpty());
    }

    @Test
    void path_and_fan_out() {
        DependencyGraph g = graph("a", "b", "c", "d");
        g.addDependency("a", "b");
        g.addDependency("a", "c");
        g.addDependency("b", "d");
        assertEquals(List.of("a", "b", "d"), g.path("a", "d"));
        assertNull(g.path("d", "a"));

        List<String> ranked = List.copyOf(g.fanOut().keySet());
        assertEquals("a", ranked.get(0));
        assertEquals(Integer.valueOf(2), g.fanOut().get("a"));
    }

    @Test
    void visualization_is_stable_dot() {
        DependencyGraph g = new DependencyGraph();
        g.addVariable("a", Value.integer(1), false);
        g.addVariable("b", Value.string("s"), true);
        g.addVariable("c", null, false);
        g.addDependency("a", "b");
        g.addDependency("a", "c", DependencyType.WEAK, 0.25, null);

        String dot = g.visualize();
        assertTrue(dot.startsWith("digraph dependencies {\n  rankdir=LR;\n"), dot);
        assertTrue(dot.contains("  \"a\" [label=\"a=1\"];\n"), dot);
        assertTrue(dot.contains("  \"b\" [label=\"b=\\\"s\\\"\", style=filled, fillcolor=lightgray];\n"), dot);
        assertTrue(dot.contains("  \"c\" [label=\"c=?\"];\n"), dot);
        assertTrue(dot.contains("  \"a\" -> \"b\" [color=black];\n"), dot);
        assertTrue(dot.contains("  \"a\" -> \"c\" [color=gray, style=dashed, label=\"w=0.25\"];\n"), dot);
        assertTrue(dot.endsWith("}\n"));
        assertEquals(dot, g.visualize());
    }
}
