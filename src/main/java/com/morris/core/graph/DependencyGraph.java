package com.morris.core.graph;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;

import com.morris.core.error.GraphError;
import com.morris.core.parser.Value;
import com.morris.debug.Debug;

/**
 * Directed graph of variables. An edge {@code a -> b} means b is computed from a.
 *
 * Invariants:
 * - the graph formed by non-reverse edges is acyclic; an edge that would close a cycle is refused
 *   before anything is inserted
 * - removing a node removes every incident edge first
 */
public final class DependencyGraph {

    private static final String TAG = "graph";

    private final Map<String, DependencyNode> nodes = new TreeMap<>();
    // source -> (target -> edge)
    private final Map<String, Map<String, DependencyEdge>> outgoing = new HashMap<>();
    // target -> (source -> edge)
    private final Map<String, Map<String, DependencyEdge>> incoming = new HashMap<>();

    private final Clock clock;

    public DependencyGraph() {
        this(Clock.systemUTC());
    }

    public DependencyGraph(Clock clock) {
        this.clock = clock;
    }

    // -------------------------
    // Nodes
    // -------------------------

    /** Adds a node. Adding a name that already exists changes nothing. */
    public DependencyNode addVariable(String name, Value value, boolean constant) {
        DependencyNode existing = nodes.get(name);
        if (existing != null) return existing;
        DependencyNode node = new DependencyNode(name, value, constant, clock.instant());
        nodes.put(name, node);
        return node;
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    public DependencyNode node(String name) {
        return nodes.get(name);
    }

    public Value valueOf(String name) {
        DependencyNode n = nodes.get(name);
        return n == null ? null : n.value();
    }

    public int size() {
        return nodes.size();
    }

    public void setConstant(String name, boolean constant) {
        require(name).setConstant(constant);
    }

    /** Stores a value without counting it as an update and without returning dependents. */
    public void syncValue(String name, Value value) {
        require(name).setValue(value);
    }

    /**
     * Writes a new value and returns every variable that transitively depends on {@code name}.
     * Frozen nodes are refused and keep their value.
     */
    public Set<String> updateVariable(String name, Value value) {
        DependencyNode node = require(name);
        if (node.isConstant()) throw GraphError.frozen(name);
        node.update(value, clock.instant());
        return transitiveDependents(name);
    }

    /** Removes the node and all of its edges. */
    public void removeVariable(String name) {
        require(name);
        for (DependencyEdge e : new ArrayList<>(edgesFrom(name))) unlink(e);
        for (DependencyEdge e : new ArrayList<>(edgesInto(name))) unlink(e);
        outgoing.remove(name);
        incoming.remove(name);
        nodes.remove(name);
    }

    public void clear() {
        nodes.clear();
        outgoing.clear();
        incoming.clear();
    }

    // -------------------------
    // Edges
    // -------------------------

    public DependencyEdge addDependency(String source, String target) {
        return addDependency(source, target, DependencyType.DIRECT, 1.0, null);
    }

    /**
     * Inserts {@code source -> target}. An existing edge between the pair is updated in place.
     * A bidirectional edge also inserts {@code target -> source}, flagged as reverse.
     */
    public DependencyEdge addDependency(String source, String target, DependencyType type, double weight, String guard) {
        require(source);
        require(target);
        if (source.equals(target)) throw GraphError.selfDependency(source);

        DependencyEdge existing = edge(source, target);
        if (existing != null && !existing.isReverse()) {
            existing.update(type, weight, guard);
            if (type == DependencyType.BIDIRECTIONAL) linkReverse(source, target, weight, guard);
            return existing;
        }

        List<String> back = findPath(target, source);
        if (back != null) {
            List<String> cycle = new ArrayList<>();
            cycle.add(source);
            cycle.addAll(back);
            Debug.get().d(TAG, "Rejected " + source + " -> " + target + ": " + String.join(" -> ", cycle));
            throw GraphError.cycle(cycle);
        }

        DependencyEdge edge = new DependencyEdge(source, target, type, weight, guard, false);
        link(edge);
        if (type == DependencyType.BIDIRECTIONAL) linkReverse(source, target, weight, guard);
        return edge;
    }

    private void linkReverse(String source, String target, double weight, String guard) {
        DependencyEdge reverse = edge(target, source);
        if (reverse != null) {
            reverse.update(DependencyType.BIDIRECTIONAL, weight, guard);
            return;
        }
        link(new DependencyEdge(target, source, DependencyType.BIDIRECTIONAL, weight, guard, true));
    }

    /** Removes {@code source -> target} and its reverse half, if any. Returns false when there was no edge. */
    public boolean removeDependency(String source, String target) {
        DependencyEdge e = edge(source, target);
        if (e == null) return false;
        unlink(e);
        if (e.type() == DependencyType.BIDIRECTIONAL) {
            DependencyEdge other = edge(target, source);
            if (other != null && other.isReverse() != e.isReverse()) unlink(other);
        }
        return true;
    }

    /** Removes every forward edge into {@code target} and returns them, for later re-insertion. */
    public List<DependencyEdge> clearDependencies(String target) {
        List<DependencyEdge> removed = new ArrayList<>();
        for (DependencyEdge e : new ArrayList<>(edgesInto(target))) {
            if (e.isReverse()) continue;
            removeDependency(e.source(), e.target());
            removed.add(e);
        }
        return removed;
    }

    public DependencyEdge edge(String source, String target) {
        Map<String, DependencyEdge> out = outgoing.get(source);
        return out == null ? null : out.get(target);
    }

    public List<DependencyEdge> edges() {
        List<DependencyEdge> all = new ArrayList<>();
        for (String name : nodes.keySet()) all.addAll(edgesFrom(name));
        return all;
    }

    private Collection<DependencyEdge> edgesFrom(String name) {
        Map<String, DependencyEdge> out = outgoing.get(name);
        return out == null ? Collections.emptyList() : new TreeMap<>(out).values();
    }

    private Collection<DependencyEdge> edgesInto(String name) {
        Map<String, DependencyEdge> in = incoming.get(name);
        return in == null ? Collections.emptyList() : new TreeMap<>(in).values();
    }

    private void link(DependencyEdge e) {
        outgoing.computeIfAbsent(e.source(), k -> new HashMap<>()).put(e.target(), e);
        incoming.computeIfAbsent(e.target(), k -> new HashMap<>()).put(e.source(), e);
    }

    private void unlink(DependencyEdge e) {
        Map<String, DependencyEdge> out = outgoing.get(e.source());
        if (out != null) out.remove(e.target());
        Map<String, DependencyEdge> in = incoming.get(e.target());
        if (in != null) in.remove(e.source());
    }

    // -------------------------
    // Queries
    // -------------------------

    /** Names computed directly from {@code name}, reverse halves included. */
    public List<String> directDependents(String name) {
        List<String> out = new ArrayList<>();
        for (DependencyEdge e : edgesFrom(name)) out.add(e.target());
        return out;
    }

    /** Names {@code name} is computed from, reverse halves excluded. */
    public List<String> directDependencies(String name) {
        List<String> out = new ArrayList<>();
        for (DependencyEdge e : edgesInto(name)) {
            if (!e.isReverse()) out.add(e.source());
        }
        return out;
    }

    /** Breadth-first closure of {@link #directDependents}, excluding {@code name} itself. */
    public Set<String> transitiveDependents(String name) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(name);
        while (!queue.isEmpty()) {
            for (String next : directDependents(queue.poll())) {
                if (!next.equals(name) && seen.add(next)) queue.add(next);
            }
        }
        return seen;
    }

    /** Route a change takes from {@code from} to {@code to}, reverse halves included; null when unreachable. */
    public List<String> path(String from, String to) {
        return findPath(from, to, true);
    }

    /** Path {@code from -> ... -> to} along forward edges, or null. */
    List<String> findPath(String from, String to) {
        return findPath(from, to, false);
    }

    private List<String> findPath(String from, String to, boolean viaReverse) {
        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        queue.add(from);
        seen.add(from);
        while (!queue.isEmpty()) {
            String cur = queue.poll();
            if (cur.equals(to)) {
                List<String> path = new ArrayList<>();
                for (String at = to; at != null; at = parent.get(at)) path.add(0, at);
                return path;
            }
            for (DependencyEdge e : edgesFrom(cur)) {
                if (e.isReverse() && !viaReverse) continue;
                if (seen.add(e.target())) {
                    parent.put(e.target(), cur);
                    queue.add(e.target());
                }
            }
        }
        return null;
    }

    /**
     * Every node ordered so that each comes after the nodes it is computed from.
     * Ties are broken by name. Fails naming one node on a cycle if one exists.
     */
    public List<String> getTopologicalOrder() {
        Map<String, Integer> inDegree = new HashMap<>();
        for (String name : nodes.keySet()) inDegree.put(name, 0);
        for (DependencyEdge e : edges()) {
            if (!e.isReverse()) inDegree.merge(e.target(), 1, Integer::sum);
        }

        PriorityQueue<String> ready = new PriorityQueue<>();
        for (Map.Entry<String, Integer> en : inDegree.entrySet()) {
            if (en.getValue() == 0) ready.add(en.getKey());
        }

        List<String> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            String cur = ready.poll();
            order.add(cur);
            for (DependencyEdge e : edgesFrom(cur)) {
                if (e.isReverse()) continue;
                if (inDegree.merge(e.target(), -1, Integer::sum) == 0) ready.add(e.target());
            }
        }

        if (order.size() != nodes.size()) {
            for (Map.Entry<String, Integer> en : new TreeMap<>(inDegree).entrySet()) {
                if (en.getValue() > 0) throw GraphError.cycle(List.of(en.getKey(), en.getKey()));
            }
        }
        return order;
    }

    /** The members of {@code subset} in topological order. */
    public List<String> order(Collection<String> subset) {
        Set<String> wanted = new HashSet<>(subset);
        List<String> out = new ArrayList<>(wanted.size());
        for (String name : getTopologicalOrder()) {
            if (wanted.contains(name)) out.add(name);
        }
        return out;
    }

    /** Direct dependent count per node, largest first. */
    public Map<String, Integer> fanOut() {
        List<Map.Entry<String, Integer>> counts = new ArrayList<>();
        for (String name : nodes.keySet()) {
            counts.add(Map.entry(name, directDependents(name).size()));
        }
        counts.sort((a, b) -> {
            int c = Integer.compare(b.getValue(), a.getValue());
            return c != 0 ? c : a.getKey().compareTo(b.getKey());
        });
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : counts) out.put(e.getKey(), e.getValue());
        return out;
    }

    // -------------------------
    // Diagnostics
    // -------------------------

    /** Graphviz DOT text. Output is stable for a given graph. */
    public String visualize() {
        StringBuilder sb = new StringBuilder("digraph dependencies {\n");
        sb.append("  rankdir=LR;\n");
        for (DependencyNode n : nodes.values()) {
            sb.append("  \"").append(escape(n.name())).append("\" [label=\"")
                    .append(escape(n.name())).append('=')
                    .append(escape(n.value() == null ? "?" : n.value().display())).append('"');
            if (n.isConstant()) sb.append(", style=filled, fillcolor=lightgray");
            sb.append("];\n");
        }
        for (DependencyEdge e : edges()) {
            sb.append("  \"").append(escape(e.source())).append("\" -> \"").append(escape(e.target()))
                    .append("\" [color=").append(e.type().color);
            if (!"solid".equals(e.type().style)) sb.append(", style=").append(e.type().style);
            if (e.weight() != 1.0) sb.append(String.format(Locale.ROOT, ", label=\"w=%.2f\"", e.weight()));
            sb.append("];\n");
        }
        return sb.append("}\n").toString();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private DependencyNode require(String name) {
        DependencyNode n = nodes.get(name);
        if (n == null) throw GraphError.notFound(name);
        return n;
    }
}
