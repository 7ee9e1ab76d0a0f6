package com.morris.persistence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.morris.core.env.Environment;
import com.morris.core.env.Variable;
import com.morris.core.error.EvaluationError;
import com.morris.core.error.GraphError;
import com.morris.core.error.MorrisError;
import com.morris.core.error.TransactionError;
import com.morris.core.graph.DependencyGraph;
import com.morris.core.parser.Expr.ExprInterface;
import com.morris.core.parser.Parser;
import com.morris.core.parser.ValueCodec;
import com.morris.core.parser.VariableCollector;
import com.morris.core.propagation.PropagationEngine;
import com.morris.debug.Debug;
import com.morris.intent.Session;

/**
 * Saves and restores variable values as JSON.
 *
 * Usage:
 *   String json = new StateStore().capture(session.environment()).toJson();
 *   StateStore.fromJson(json).restoreInto(otherSession);
 *
 * Format:
 * {
 *   "version": 1,
 *   "variables": [ {"name":"a","value":{"type":"int","value":5},"constant":false,"source":"direct"}, ... ]
 * }
 */
public final class StateStore {

    private static final String TAG = "persistence";
    public static final int FORMAT_VERSION = 1;

    private final Map<String, VariableRecord> records = new LinkedHashMap<>();

    public StateStore() {}

    public StateStore(List<VariableRecord> initial) {
        if (initial != null) {
            for (VariableRecord r : initial) records.put(r.name, r);
        }
    }

    /** Adds every settled variable. Variables pending in a transaction are skipped. */
    public StateStore capture(Environment env) {
        for (Variable v : env.list()) {
            if (v.isPending() || v.value() == null) continue;
            records.put(v.name(), VariableRecord.of(v));
        }
        return this;
    }

    public List<VariableRecord> records() {
        return Collections.unmodifiableList(new ArrayList<>(records.values()));
    }

    public String toJson() {
        ObjectNode root = ValueCodec.mapper().createObjectNode();
        root.put("version", FORMAT_VERSION);
        ArrayNode vars = root.putArray("variables");
        for (VariableRecord r : records.values()) vars.add(r.toJson());
        try {
            return ValueCodec.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new EvaluationError("Cannot serialize state: " + e.getOriginalMessage(), e);
        }
    }

    public static StateStore fromJson(String json) {
        JsonNode root = ValueCodec.readTree(json);
        int version = root.path("version").asInt(FORMAT_VERSION);
        if (version != FORMAT_VERSION) {
            throw new EvaluationError("Unsupported state version: " + version);
        }
        JsonNode vars = root.get("variables");
        if (vars == null || !vars.isArray()) throw new EvaluationError("State must contain a 'variables' array");
        List<VariableRecord> out = new ArrayList<>();
        for (JsonNode n : vars) out.add(VariableRecord.fromJson(n));
        return new StateStore(out);
    }

    /**
     * Writes the records into {@code session}: direct values first, then computed variables in
     * dependency order so their graph edges are rebuilt, then freezes. A computed variable whose
     * expression no longer evaluates keeps its saved value as a direct value.
     *
     * All or nothing: if a record cannot be written (a frozen name in the session, the variable
     * limit) the session is put back as it was and the error is rethrown.
     */
    public void restoreInto(Session session) {
        if (session.transactions().isActive()) {
            throw new TransactionError(TransactionError.Reason.INVALID_STATE,
                    "Cannot restore state while a transaction is active");
        }
        PropagationEngine p = session.propagation();
        Environment env = session.environment();
        Map<String, Variable> before = env.snapshot();
        try {
            write(p);
        } catch (MorrisError e) {
            env.restore(before);
            p.rebuild();
            Debug.get().w(TAG, "Restore abandoned, session unchanged: " + e.getMessage());
            throw e;
        }
        Debug.get().i(TAG, "Restored " + records.size() + " variable(s)");
    }

    private void write(PropagationEngine p) {
        Map<String, ExprInterface> computed = new LinkedHashMap<>();
        for (VariableRecord r : records.values()) {
            if (r.expression != null) {
                try {
                    computed.put(r.name, Parser.parse(r.expression));
                } catch (MorrisError e) {
                    Debug.get().w(TAG, "Expression of " + r.name + " no longer parses: " + e.getMessage());
                }
            }
            p.setDirect(r.name, r.value, r.declaredType, null);
        }

        for (String name : order(computed)) {
            VariableRecord r = records.get(name);
            try {
                p.setComputed(name, computed.get(name), r.expression, r.declaredType, null);
            } catch (MorrisError e) {
                Debug.get().w(TAG, "Kept saved value of " + name + ": " + e.getMessage());
            }
        }

        for (VariableRecord r : records.values()) {
            if (r.constant) p.freeze(r.name);
        }
    }

    private static List<String> order(Map<String, ExprInterface> computed) {
        DependencyGraph local = new DependencyGraph();
        for (String name : computed.keySet()) local.addVariable(name, null, false);
        for (Map.Entry<String, ExprInterface> e : computed.entrySet()) {
            for (String dep : VariableCollector.collect(e.getValue())) {
                if (!computed.containsKey(dep)) continue;
                try {
                    local.addDependency(dep, e.getKey());
                } catch (GraphError cycle) {
                    Debug.get().w(TAG, "Ignoring cyclic dependency " + dep + " -> " + e.getKey());
                }
            }
        }
        return local.getTopologicalOrder();
    }
}
