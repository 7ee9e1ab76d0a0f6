package com.morris.core.env;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.morris.core.MorrisConfig;
import com.morris.core.error.EvaluationError;
import com.morris.core.error.GraphError;
import com.morris.core.parser.Expr.ExprInterface;
import com.morris.core.parser.Value;
import com.morris.core.parser.VariableCollector;
import com.morris.core.parser.VariableResolver;

/**
 * Named variables plus the dependency index derived from their expressions.
 *
 * The environment stores values; it does not recompute anything. Recomputation is the
 * propagation engine's job, which keeps its graph in step with the index kept here.
 */
public final class Environment implements VariableResolver {

    private final Map<String, Variable> variables = new TreeMap<>();

    // name -> names its expression reads
    private final Map<String, Set<String>> dependencies = new HashMap<>();
    // name -> names whose expressions read it
    private final Map<String, Set<String>> dependents = new HashMap<>();

    private final int maxVariables;
    private final Clock clock;

    public Environment() {
        this(MorrisConfig.defaults());
    }

    public Environment(MorrisConfig config) {
        this.maxVariables = config.maxVariables();
        this.clock = config.clock();
    }

    // -------------------------
    // Reads
    // -------------------------

    @Override
    public Value lookup(String name) {
        Variable v = variables.get(name);
        if (v == null) return null;
        if (v.isPending()) {
            throw new EvaluationError("Variable '" + name + "' is pending in the active transaction");
        }
        return v.value();
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public Variable get(String name) {
        return variables.get(name);
    }

    /** Like {@link #get} but fails when absent. */
    public Variable require(String name) {
        Variable v = variables.get(name);
        if (v == null) throw GraphError.notFound(name);
        return v;
    }

    /** Stored value regardless of the pending flag; null when absent. */
    public Value getValue(String name) {
        Variable v = variables.get(name);
        return v == null ? null : v.value();
    }

    public int size() {
        return variables.size();
    }

    public List<String> names() {
        return new ArrayList<>(variables.keySet());
    }

    /** All variables ordered by name. */
    public List<Variable> list() {
        return Collections.unmodifiableList(new ArrayList<>(variables.values()));
    }

    /** Values of every non-pending variable. */
    public Map<String, Value> values() {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Variable v : variables.values()) {
            if (!v.isPending() && v.value() != null) out.put(v.name(), v.value());
        }
        return out;
    }

    // -------------------------
    // Writes
    // -------------------------

    public Variable setDirect(String name, Value value, DeclaredType declaredType, PropagationControl control) {
        return write(name, value, null, null, VariableSource.DIRECT, declaredType, control);
    }

    public Variable setComputed(String name, Value value, ExprInterface expr, String raw,
                                DeclaredType declaredType, PropagationControl control) {
        return write(name, value, expr, raw, VariableSource.COMPUTED, declaredType, control);
    }

    /** Write coming from propagation. Keeps the expression; refuses frozen variables. */
    public Variable updatePropagated(String name, Value value) {
        Variable v = require(name);
        if (v.isConstant()) throw GraphError.frozen(name);
        v.write(coerce(v, value), VariableSource.PROPAGATED, clock.instant());
        return v;
    }

    private Variable write(String name, Value value, ExprInterface expr, String raw, VariableSource source,
                           DeclaredType declaredType, PropagationControl control) {
        Variable v = variables.get(name);
        if (v != null && v.isConstant()) throw GraphError.frozen(name);

        DeclaredType effective = declaredType != null ? declaredType : (v == null ? null : v.declaredType());
        Value coerced = effective == null ? value : effective.coerce(value);

        if (v == null) v = create(name);
        v.setDeclaredType(effective);
        if (control != null) v.setControl(control);
        v.setExpression(expr, raw);
        v.write(coerced, source, clock.instant());
        index(name, expr);
        return v;
    }

    /**
     * Marks {@code name} as pending. An absent variable is created without a value so that
     * expressions reading it fail until the transaction settles.
     */
    public Variable markPending(String name) {
        Variable v = variables.get(name);
        if (v == null) v = create(name);
        v.setPending(true);
        return v;
    }

    public void clearPending(String name) {
        Variable v = variables.get(name);
        if (v != null) v.setPending(false);
    }

    public Variable freeze(String name) {
        Variable v = require(name);
        v.setConstant(true);
        return v;
    }

    public Variable unfreeze(String name) {
        Variable v = require(name);
        v.setConstant(false);
        return v;
    }

    /** Removes the variable and its outgoing index entries. Returns the removed record or null. */
    public Variable remove(String name) {
        Variable v = variables.remove(name);
        if (v != null) index(name, null);
        return v;
    }

    private Variable create(String name) {
        if (variables.size() >= maxVariables) throw GraphError.capacity(name, maxVariables);
        Variable v = new Variable(name, clock.instant());
        variables.put(name, v);
        return v;
    }

    private static Value coerce(Variable v, Value value) {
        return v.declaredType() == null ? value : v.declaredType().coerce(value);
    }

    // -------------------------
    // Dependency index
    // -------------------------

    private void index(String name, ExprInterface expr) {
        Set<String> old = dependencies.remove(name);
        if (old != null) {
            for (String dep : old) {
                Set<String> back = dependents.get(dep);
                if (back != null) {
                    back.remove(name);
                    if (back.isEmpty()) dependents.remove(dep);
                }
            }
        }
        if (expr == null) return;

        Set<String> deps = new LinkedHashSet<>(VariableCollector.collect(expr));
        if (deps.isEmpty()) return;
        dependencies.put(name, deps);
        for (String dep : deps) {
            dependents.computeIfAbsent(dep, k -> new TreeSet<>()).add(name);
        }
    }

    /** Names the expression of {@code name} reads, in reference order. */
    public List<String> dependenciesOf(String name) {
        Set<String> deps = dependencies.get(name);
        return deps == null ? Collections.emptyList() : new ArrayList<>(deps);
    }

    /** Direct dependents of {@code name}, sorted. */
    public List<String> dependentsOf(String name) {
        Set<String> deps = dependents.get(name);
        return deps == null ? Collections.emptyList() : new ArrayList<>(deps);
    }

    // -------------------------
    // Snapshot
    // -------------------------

    /** Deep copy of every variable record. */
    public Map<String, Variable> snapshot() {
        Map<String, Variable> out = new LinkedHashMap<>();
        for (Variable v : variables.values()) out.put(v.name(), v.copy());
        return out;
    }

    /** Puts back one record taken by {@link #snapshot()}, replacing whatever is stored under its name. */
    public void restoreVariable(Variable record) {
        Variable c = record.copy();
        variables.put(c.name(), c);
        index(c.name(), c.expression());
    }

    /** Replaces the whole environment with copies of the records in {@code snapshot}. */
    public void restore(Map<String, Variable> snapshot) {
        variables.clear();
        dependencies.clear();
        dependents.clear();
        for (Variable v : snapshot.values()) {
            Variable c = v.copy();
            variables.put(c.name(), c);
            index(c.name(), c.expression());
        }
    }
}
