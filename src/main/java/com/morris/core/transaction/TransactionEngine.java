package com.morris.core.transaction;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.morris.core.MorrisConfig;
import com.morris.core.env.DeclaredType;
import com.morris.core.env.Environment;
import com.morris.core.env.PropagationControl;
import com.morris.core.env.Variable;
import com.morris.core.error.GraphError;
import com.morris.core.error.MorrisError;
import com.morris.core.error.TransactionError;
import com.morris.core.graph.DependencyGraph;
import com.morris.core.parser.Expr.ExprInterface;
import com.morris.core.parser.Value;
import com.morris.core.parser.VariableCollector;
import com.morris.core.parser.VariableResolver;
import com.morris.core.propagation.PropagationEngine;
import com.morris.core.propagation.PropagationResult;
import com.morris.debug.Debug;

/**
 * Buffers edits into one active {@link Transaction} and commits or discards them.
 *
 * forge is all or nothing: any failed change restores the craft-time snapshot and the transaction
 * ends Smelted. quench applies each change as-is without ordering or propagation. anneal applies
 * a few changes at a time and leaves the transaction open.
 */
public final class TransactionEngine {

    private static final String TAG = "transaction";

    private final Environment env;
    private final PropagationEngine propagation;
    private final Clock clock;
    private final int logLimit;
    private final int maxNested;
    private final boolean propagateOnAnneal;

    private Transaction active;
    private final Deque<TransactionLogEntry> log = new ArrayDeque<>();

    public TransactionEngine(PropagationEngine propagation, MorrisConfig config) {
        this.env = propagation.environment();
        this.propagation = propagation;
        this.clock = config.clock();
        this.logLimit = config.transactionLogLimit();
        this.maxNested = config.maxNestedTransactions();
        this.propagateOnAnneal = config.propagateOnAnneal();
    }

    public boolean isActive() {
        return active != null;
    }

    public Transaction active() {
        return active;
    }

    private Transaction requireActive() {
        if (active == null) throw TransactionError.noActive();
        return active;
    }

    // -------------------------
    // Lifecycle
    // -------------------------

    public Transaction craft(String name) {
        if (active != null) {
            throw new TransactionError(TransactionError.Reason.ALREADY_ACTIVE,
                    "Transaction " + active.id() + " is already active");
        }
        if (maxNested < 1) {
            throw new TransactionError(TransactionError.Reason.NESTED_LIMIT,
                    "Nested transaction limit of " + maxNested + " reached");
        }
        active = new Transaction(name, env.snapshot(), clock.instant());
        Debug.get().i(TAG, "Crafting " + active.id() + (name == null ? "" : " (" + name + ")"));
        return active;
    }

    /** Buffers a direct write. The variable reads as pending until the transaction settles. */
    public ValueChange stage(String name, Value value, DeclaredType type, PropagationControl control) {
        return stage(name, value, null, null, type, control);
    }

    /** Buffers an expression. It is evaluated when the transaction is forged. */
    public ValueChange stage(String name, ExprInterface expr, String raw, DeclaredType type, PropagationControl control) {
        return stage(name, null, expr, raw, type, control);
    }

    private ValueChange stage(String name, Value value, ExprInterface expr, String raw,
                              DeclaredType type, PropagationControl control) {
        Transaction tx = requireActive();
        if (tx.state().isTerminal()) {
            throw new TransactionError(TransactionError.Reason.INVALID_STATE,
                    "Cannot change a " + tx.state() + " transaction");
        }
        List<String> deps = expr == null ? List.of() : new ArrayList<>(VariableCollector.collect(expr));
        if (deps.contains(name)) throw GraphError.selfDependency(name);
        Variable before = tx.snapshot().get(name);
        env.markPending(name);
        ValueChange change = new ValueChange(name, before == null ? null : before.value(), value, expr, raw,
                deps, type, control);
        tx.record(change);
        if (tx.state().kind() == TransactionState.Kind.TEMPERED) tx.setState(TransactionState.CRAFTING);
        return tx.change(name);
    }

    /** Applies every change in dependency order, or none of them. Returns the applied names. */
    public List<String> forge() {
        Transaction tx = requireActive();
        active = null;

        if (tx.isEmpty()) {
            finish(tx, TransactionState.FORGED);
            return Collections.emptyList();
        }

        List<String> order;
        try {
            order = evaluationOrder(tx);
        } catch (GraphError e) {
            rollback(tx);
            finish(tx, TransactionState.SMELTED);
            throw new TransactionError(TransactionError.Reason.FORGE_FAILED,
                    "Circular dependency among pending changes: " + String.join(" -> ", e.cyclePath()), e);
        }

        List<String> applied = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (String name : order) {
            ValueChange c = tx.change(name);
            if (c.isComputed()) continue;
            try {
                env.clearPending(name);
                log(tx, propagation.setDirect(name, c.newValue, c.declaredType, c.control));
                applied.add(name);
            } catch (MorrisError e) {
                failures.add(name + ": " + e.getMessage());
            }
        }
        for (String name : order) {
            ValueChange c = tx.change(name);
            if (!c.isComputed()) continue;
            try {
                env.clearPending(name);
                log(tx, propagation.setComputed(name, c.expression, c.rawExpression, c.declaredType, c.control));
                applied.add(name);
            } catch (MorrisError e) {
                failures.add("Cannot evaluate " + name + ": " + e.getMessage());
            }
        }

        if (!failures.isEmpty()) {
            rollback(tx);
            finish(tx, TransactionState.SMELTED);
            Debug.get().w(TAG, "Forge of " + tx.id() + " rolled back: " + String.join(", ", failures));
            throw new TransactionError(TransactionError.Reason.FORGE_FAILED,
                    "Forging failed: " + String.join(", ", failures));
        }

        finish(tx, TransactionState.FORGED);
        return applied;
    }

    /** Discards every change and restores the craft-time snapshot. */
    public void smelt() {
        Transaction tx = requireActive();
        active = null;
        rollback(tx);
        finish(tx, TransactionState.SMELTED);
    }

    /**
     * Writes each change straight into the environment in the order it was staged.
     * No propagation runs; a change that cannot be applied is reverted and left out of the result.
     */
    public List<String> quench() {
        Transaction tx = requireActive();
        active = null;

        List<String> applied = new ArrayList<>();
        for (ValueChange c : tx.changes().values()) {
            try {
                env.clearPending(c.variable);
                if (c.isComputed()) {
                    Value v = propagation.interpreter(env).evaluate(c.expression);
                    env.setComputed(c.variable, v, c.expression, c.rawExpression, c.declaredType, c.control);
                } else {
                    env.setDirect(c.variable, c.newValue, c.declaredType, c.control);
                }
                applied.add(c.variable);
            } catch (MorrisError e) {
                Debug.get().w(TAG, "Quench skipped " + c.variable + ": " + e.getMessage());
                revert(tx, c.variable);
            }
        }
        propagation.rebuild();
        finish(tx, TransactionState.QUENCHED);
        return applied;
    }

    /**
     * Applies up to {@code steps} pending changes in name order, removing each from the transaction.
     * Stops at the first failure; changes applied before it stay applied.
     */
    public List<String> anneal(int steps) {
        Transaction tx = requireActive();
        if (steps <= 0) throw new IllegalArgumentException("anneal steps must be > 0, got " + steps);

        List<String> names = new ArrayList<>(new TreeSet<>(tx.changes().keySet()));
        List<String> applied = new ArrayList<>();
        int limit = Math.min(steps, names.size());
        for (int i = 0; i < limit; i++) {
            String name = names.get(i);
            ValueChange c = tx.change(name);
            try {
                env.clearPending(name);
                applyStaged(tx, c);
            } catch (MorrisError e) {
                env.markPending(name);
                throw new TransactionError(TransactionError.Reason.INVALID_STATE,
                        "Failed to anneal " + name + ": " + e.getMessage(), e);
            }
            tx.removeChange(name);
            applied.add(name);
            tx.setState(TransactionState.annealing(tx.state().step() + 1));
        }
        Debug.get().i(TAG, "Annealed " + applied + " in " + tx.id() + ", " + tx.changeCount() + " left");
        return applied;
    }

    private void applyStaged(Transaction tx, ValueChange c) {
        if (propagateOnAnneal) {
            PropagationResult r = c.isComputed()
                    ? propagation.setComputed(c.variable, c.expression, c.rawExpression, c.declaredType, c.control)
                    : propagation.setDirect(c.variable, c.newValue, c.declaredType, c.control);
            log(tx, r);
            return;
        }
        if (c.isComputed()) {
            Value v = propagation.interpreter(env).evaluate(c.expression);
            env.setComputed(c.variable, v, c.expression, c.rawExpression, c.declaredType, c.control);
        } else {
            env.setDirect(c.variable, c.newValue, c.declaredType, c.control);
        }
        propagation.rebuild();
    }

    // -------------------------
    // Analysis
    // -------------------------

    /** Non-mutating preview of forging the active transaction. Moves Crafting to Tempered. */
    public TransactionPreview temper() {
        Transaction tx = requireActive();
        DependencyGraph graph = propagation.graph();

        List<String> conflicts = new ArrayList<>();
        List<String> blocked = new ArrayList<>();
        List<String> paths = new ArrayList<>();
        List<String> typeIssues = new ArrayList<>();
        Set<String> affected = new LinkedHashSet<>();

        for (ValueChange c : tx.changes().values()) {
            Variable current = env.get(c.variable);
            if (current != null && current.isConstant()) {
                conflicts.add(c.variable + " is frozen");
            }
            DeclaredType type = c.declaredType != null ? c.declaredType
                    : current == null ? null : current.declaredType();
            if (type != null && !c.isComputed()) {
                try {
                    type.coerce(c.newValue);
                } catch (MorrisError e) {
                    typeIssues.add(c.variable + ": " + e.getMessage());
                }
            }
            if (!graph.contains(c.variable)) continue;

            for (String dependent : graph.transitiveDependents(c.variable)) {
                affected.add(dependent);
                Variable d = env.get(dependent);
                if (d != null && d.isConstant()) {
                    blocked.add(dependent + " depends on " + c.variable + " but is frozen");
                }
            }
            for (String dependent : graph.directDependents(c.variable)) {
                Variable d = env.get(dependent);
                boolean computed = d != null && d.isComputed();
                paths.add(c.variable + " -> " + dependent + (computed ? " (computed)" : " (direct)"));
            }
        }

        List<String> bottlenecks = new ArrayList<>();
        for (Map.Entry<String, Integer> e : graph.fanOut().entrySet()) {
            if (bottlenecks.size() == 5 || e.getValue() == 0) break;
            if (affected.contains(e.getKey()) || tx.change(e.getKey()) != null) bottlenecks.add(e.getKey());
        }

        PerformanceEstimate perf = new PerformanceEstimate(tx.changeCount(), affected.size(), bottlenecks);
        if (tx.state().kind() == TransactionState.Kind.CRAFTING) tx.setState(TransactionState.TEMPERED);
        return new TransactionPreview(new ArrayList<>(tx.changes().values()), conflicts, blocked, paths,
                typeIssues, affected.size(), perf);
    }

    /**
     * Predicts the effect of writing {@code scenario} without writing anything. Works with or
     * without an active transaction; the safety delta is relative to the active one if present.
     */
    public ScenarioOutcome whatIf(Map<String, Value> scenario) {
        DependencyGraph graph = propagation.graph();
        Set<String> affected = new TreeSet<>(scenario.keySet());
        List<String> conflicts = new ArrayList<>();
        List<String> impacts = new ArrayList<>();
        int blocked = 0;

        for (Map.Entry<String, Value> e : scenario.entrySet()) {
            Variable current = env.get(e.getKey());
            String old = current == null || current.value() == null ? "undefined" : current.value().display();
            impacts.add(e.getKey() + ": " + old + " -> " + e.getValue().display() + " (hypothetical)");
            if (current != null && current.isConstant()) conflicts.add(e.getKey() + " would still be frozen");
            if (graph.contains(e.getKey())) affected.addAll(graph.transitiveDependents(e.getKey()));
        }

        Map<String, Value> predicted = new LinkedHashMap<>(scenario);
        VariableResolver overlay = VariableResolver.overlay(predicted, graphValues(graph));
        List<String> dependents = new ArrayList<>(affected);
        dependents.removeAll(scenario.keySet());
        for (String name : graph.order(dependents)) {
            Variable v = env.get(name);
            if (v == null || !v.isComputed()) continue;
            if (v.isConstant()) {
                blocked++;
                impacts.add(name + ": frozen, propagation blocked");
                continue;
            }
            try {
                Value next = propagation.interpreter(overlay).evaluate(v.expression());
                predicted.put(name, next);
                impacts.add(name + ": " + (v.value() == null ? "undefined" : v.value().display())
                        + " -> " + next.display() + " (recomputed)");
            } catch (MorrisError e) {
                impacts.add(name + ": would fail (" + e.getMessage() + ")");
            }
        }
        for (String name : scenario.keySet()) predicted.remove(name);

        int baseConflicts = 0;
        if (active != null) {
            for (ValueChange c : active.changes().values()) {
                Variable v = env.get(c.variable);
                if (v != null && v.isConstant()) baseConflicts++;
            }
        }
        double base = TransactionPreview.score(baseConflicts, 0);
        double hypothetical = TransactionPreview.score(baseConflicts + conflicts.size(), blocked);
        return new ScenarioOutcome(new ArrayList<>(affected), conflicts, impacts, predicted, hypothetical - base);
    }

    private VariableResolver graphValues(DependencyGraph graph) {
        return name -> {
            Value v = graph.valueOf(name);
            return v != null ? v : env.getValue(name);
        };
    }

    /** The active transaction; fails when there is none. */
    public Transaction inspect() {
        return requireActive();
    }

    public String status() {
        if (active == null) return "No active transaction";
        return "Transaction " + active.id() + " " + active.state() + " (" + active.changeCount() + " changes)";
    }

    /** Up to {@code limit} most recent finished transactions, oldest first. */
    public List<TransactionLogEntry> history(int limit) {
        List<TransactionLogEntry> all = new ArrayList<>(log);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return Collections.unmodifiableList(all.subList(from, all.size()));
    }

    // -------------------------
    // Internals
    // -------------------------

    /** Pending changes ordered so each comes after the pending changes it reads. */
    private static List<String> evaluationOrder(Transaction tx) {
        DependencyGraph local = new DependencyGraph();
        for (String name : tx.changes().keySet()) local.addVariable(name, null, false);
        for (ValueChange c : tx.changes().values()) {
            for (String dep : c.dependencies) {
                if (tx.change(dep) != null) local.addDependency(dep, c.variable);
            }
        }
        return local.getTopologicalOrder();
    }

    private void rollback(Transaction tx) {
        env.restore(tx.snapshot());
        propagation.rebuild();
    }

    private void revert(Transaction tx, String name) {
        Variable before = tx.snapshot().get(name);
        if (before != null) env.restoreVariable(before);
        else env.remove(name);
    }

    private void log(Transaction tx, PropagationResult r) {
        for (String p : r.propagationPaths) tx.logPropagation(p);
    }

    private void finish(Transaction tx, TransactionState terminal) {
        tx.end(terminal, clock.instant());
        log.addLast(new TransactionLogEntry(tx));
        while (log.size() > logLimit) log.removeFirst();
        Debug.get().i(TAG, "Transaction " + tx.id() + " " + terminal);
    }
}
