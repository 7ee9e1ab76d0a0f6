package com.morris.core.propagation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.morris.core.MorrisConfig;
import com.morris.core.env.DeclaredType;
import com.morris.core.env.Environment;
import com.morris.core.env.PropagationControl;
import com.morris.core.env.Variable;
import com.morris.core.error.EvaluationError;
import com.morris.core.error.GraphError;
import com.morris.core.error.MorrisError;
import com.morris.core.graph.DependencyEdge;
import com.morris.core.graph.DependencyGraph;
import com.morris.core.graph.DependencyType;
import com.morris.core.parser.Builtins;
import com.morris.core.parser.Expr;
import com.morris.core.parser.Expr.ExprInterface;
import com.morris.core.parser.Interpreter;
import com.morris.core.parser.Value;
import com.morris.core.parser.VariableCollector;
import com.morris.core.parser.VariableResolver;
import com.morris.debug.Debug;

/**
 * Single writer for live (non-transactional) variable changes.
 *
 * Every write goes to the {@link Environment} and the {@link DependencyGraph} together, then
 * recomputes the dependents according to the current {@link PropagationStrategy}.
 *
 * Recomputation is best effort: a dependent that fails to evaluate is reported in
 * {@link PropagationResult#failedPropagations} and the remaining dependents are still processed.
 */
public final class PropagationEngine {

    private static final String TAG = "propagation";

    private final Environment env;
    private final DependencyGraph graph;
    private final Clock clock;
    private final int historyLimit;
    private final Builtins builtins;

    private PropagationStrategy strategy;
    private final Deque<PropagationEvent> history = new ArrayDeque<>();

    // queued roots -> value before the first queued write
    private final Map<String, Value> queue = new LinkedHashMap<>();
    private Instant lastQueued;

    public PropagationEngine(Environment env, MorrisConfig config) {
        this.env = env;
        this.clock = config.clock();
        this.graph = new DependencyGraph(clock);
        this.builtins = Builtins.withClock(clock);
        this.historyLimit = config.propagationHistoryLimit();
        this.strategy = config.propagationStrategy();
    }

    public Environment environment() {
        return env;
    }

    public DependencyGraph graph() {
        return graph;
    }

    /** Function table bound to the configured clock. */
    public Builtins builtins() {
        return builtins;
    }

    public Interpreter interpreter(VariableResolver resolver) {
        return new Interpreter(resolver, builtins);
    }

    public PropagationStrategy strategy() {
        return strategy;
    }

    /** Switches strategy. Work still queued under the old strategy is drained first. */
    public PropagationResult setStrategy(PropagationStrategy next) {
        PropagationResult drained = queue.isEmpty() ? PropagationResult.empty() : flush();
        Debug.get().i(TAG, "Strategy " + strategy + " -> " + next);
        this.strategy = next;
        return drained;
    }

    // -------------------------
    // Writes
    // -------------------------

    public PropagationResult setDirect(String name, Value value, DeclaredType type, PropagationControl control) {
        Value old = env.getValue(name);
        Variable v = env.setDirect(name, value, type, control);
        ensureNode(name);
        graph.clearDependencies(name);
        return afterWrite(name, old, v.value());
    }

    /**
     * Evaluates {@code expr} and stores the result together with the expression. The graph edges of
     * {@code name} are replaced by edges from every referenced name; if that would close a cycle the
     * previous edges are restored and nothing is written.
     */
    public PropagationResult setComputed(String name, ExprInterface expr, String raw,
                                         DeclaredType type, PropagationControl control) {
        Variable existing = env.get(name);
        if (existing != null && existing.isConstant()) throw GraphError.frozen(name);

        Value value = interpreter(env).evaluate(expr);
        Value old = existing == null ? null : existing.value();

        boolean created = !graph.contains(name);
        ensureNode(name);
        List<DependencyEdge> previous = graph.clearDependencies(name);
        Variable v;
        try {
            linkExpression(name, expr);
            v = env.setComputed(name, value, expr, raw, type, control);
        } catch (MorrisError e) {
            graph.clearDependencies(name);
            for (DependencyEdge edge : previous) {
                graph.addDependency(edge.source(), edge.target(), edge.type(), edge.weight(), edge.guard());
            }
            if (created) graph.removeVariable(name);
            throw e;
        }
        return afterWrite(name, old, v.value());
    }

    public Variable freeze(String name) {
        Variable v = env.freeze(name);
        ensureNode(name);
        graph.setConstant(name, true);
        return v;
    }

    public Variable unfreeze(String name) {
        Variable v = env.unfreeze(name);
        ensureNode(name);
        graph.setConstant(name, false);
        return v;
    }

    /** Deletes the variable. Dependents keep their last value. */
    public Variable remove(String name) {
        Variable v = env.require(name);
        if (v.isConstant()) throw GraphError.frozen(name);
        env.remove(name);
        if (graph.contains(name)) graph.removeVariable(name);
        queue.remove(name);
        return v;
    }

    private void linkExpression(String name, ExprInterface expr) {
        DependencyType type = DependencyType.DIRECT;
        String guard = null;
        if (expr instanceof Expr.Conditional) {
            type = DependencyType.CONDITIONAL;
            List<String> guards = new ArrayList<>();
            for (Expr.Branch b : ((Expr.Conditional) expr).branches) {
                if (!b.isFallback()) guards.add(b.guard.toString());
            }
            guard = String.join(" | ", guards);
        }
        for (String dep : VariableCollector.collect(expr)) {
            if (!graph.contains(dep)) {
                Variable d = env.get(dep);
                graph.addVariable(dep, d == null ? null : d.value(), d != null && d.isConstant());
            }
            graph.addDependency(dep, name, type, 1.0, guard);
        }
    }

    /** Creates the graph node for an environment variable, reattaching dependents recorded in the environment. */
    private void ensureNode(String name) {
        Variable v = env.get(name);
        if (graph.contains(name)) {
            if (v != null) {
                graph.syncValue(name, v.value());
                graph.setConstant(name, v.isConstant());
            }
            return;
        }
        graph.addVariable(name, v == null ? null : v.value(), v != null && v.isConstant());
        for (String dependent : env.dependentsOf(name)) {
            if (!graph.contains(dependent)) continue;
            try {
                graph.addDependency(name, dependent);
            } catch (GraphError e) {
                Debug.get().w(TAG, "Could not relink " + name + " -> " + dependent + ": " + e.getMessage());
            }
        }
    }

    /**
     * Clears the graph and derives it again from the expressions stored in the environment.
     * Used after the environment was restored wholesale.
     */
    public void rebuild() {
        graph.clear();
        queue.clear();
        for (Variable v : env.list()) {
            graph.addVariable(v.name(), v.value(), v.isConstant());
        }
        for (Variable v : env.list()) {
            if (!v.isComputed()) continue;
            try {
                linkExpression(v.name(), v.expression());
            } catch (GraphError e) {
                Debug.get().w(TAG, "Dropped dependencies of " + v.name() + " on rebuild: " + e.getMessage());
                graph.clearDependencies(v.name());
            }
        }
    }

    // -------------------------
    // Propagation
    // -------------------------

    private PropagationResult afterWrite(String name, Value old, Value now) {
        Set<String> affected = graph.updateVariable(name, now);
        record(name, old, now, affected);

        switch (strategy.kind()) {
            case DEBOUNCED: {
                PropagationResult drained = PropagationResult.empty();
                Instant t = clock.instant();
                if (!queue.isEmpty() && lastQueued != null
                        && !t.isBefore(lastQueued.plus(strategy.window()))) {
                    drained = flush();
                }
                enqueue(name, old, t);
                return drained.changedVariables.isEmpty()
                        ? PropagationResult.deferred(name)
                        : drained.merge(PropagationResult.deferred(name));
            }
            case BATCHED:
                enqueue(name, old, clock.instant());
                if (queue.size() >= strategy.batchSize()) return flush();
                return PropagationResult.deferred(name);
            case LAZY:
                enqueue(name, old, clock.instant());
                return PropagationResult.deferred(name);
            default:
                return propagate(List.of(name), affected);
        }
    }

    private void enqueue(String name, Value old, Instant at) {
        queue.putIfAbsent(name, old);
        lastQueued = at;
    }

    /** Recomputes everything affected by queued changes, as one batch. */
    public PropagationResult flush() {
        if (queue.isEmpty()) return PropagationResult.empty();
        List<String> roots = new ArrayList<>(queue.keySet());
        queue.clear();
        lastQueued = null;

        Set<String> affected = new LinkedHashSet<>();
        for (String root : roots) {
            if (graph.contains(root)) affected.addAll(graph.transitiveDependents(root));
        }
        Debug.get().d(TAG, "Draining " + roots.size() + " queued change(s), " + affected.size() + " affected");
        return propagate(roots, affected);
    }

    public int queuedCount() {
        return queue.size();
    }

    private PropagationResult propagate(List<String> roots, Collection<String> affected) {
        long start = System.nanoTime();
        List<String> changed = new ArrayList<>(roots);
        List<String> paths = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        int withheld = 0;

        VariableResolver current = graphResolver();
        for (String name : graph.order(affected)) {
            Variable v = env.get(name);
            if (v == null || !v.isComputed() || v.isPending()) continue;

            if (v.isConstant()) {
                failed.add(name);
                Debug.get().w(TAG, "Propagation to " + name + " blocked: variable is frozen");
                continue;
            }

            Value next;
            try {
                next = interpreter(current).evaluate(v.expression());
                if (v.declaredType() != null) next = v.declaredType().coerce(next);
            } catch (MorrisError e) {
                failed.add(name);
                Debug.get().w(TAG, "Propagation to " + name + " failed: " + e.getMessage());
                continue;
            }
            if (next.equals(v.value())) continue;

            if (!v.control().admit()) {
                withheld++;
                Debug.get().d(TAG, "Propagation to " + name + " withheld (" + v.control() + ")");
                continue;
            }

            env.updatePropagated(name, next);
            graph.updateVariable(name, next);
            v.control().applied();
            changed.add(name);
            paths.add(pathTo(roots, name));
        }

        return new PropagationResult(changed, paths, Duration.ofNanos(System.nanoTime() - start),
                withheld, failed, false);
    }

    private VariableResolver graphResolver() {
        return name -> {
            Variable v = env.get(name);
            if (v != null && v.isPending()) {
                throw new EvaluationError("Variable '" + name + "' is pending in the active transaction");
            }
            return graph.valueOf(name);
        };
    }

    private String pathTo(List<String> roots, String target) {
        for (String root : roots) {
            if (!graph.contains(root)) continue;
            List<String> p = graph.path(root, target);
            if (p != null) return String.join(" -> ", p);
        }
        return target;
    }

    // -------------------------
    // History
    // -------------------------

    private void record(String name, Value old, Value now, Set<String> affected) {
        history.addLast(new PropagationEvent(name, old, now, new ArrayList<>(affected), clock.instant()));
        while (history.size() > historyLimit) history.removeFirst();
    }

    /** Up to {@code limit} most recent events, oldest first. */
    public List<PropagationEvent> recentHistory(int limit) {
        List<PropagationEvent> all = new ArrayList<>(history);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return Collections.unmodifiableList(all.subList(from, all.size()));
    }

    public int historySize() {
        return history.size();
    }
}
