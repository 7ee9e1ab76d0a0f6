package com.morris.intent;

import java.util.LinkedHashMap;
import java.util.Map;

import com.morris.core.MorrisConfig;
import com.morris.core.env.DeclaredType;
import com.morris.core.env.Environment;
import com.morris.core.env.PropagationControl;
import com.morris.core.env.Variable;
import com.morris.core.error.EvaluationError;
import com.morris.core.parser.Expr;
import com.morris.core.parser.Expr.ExprInterface;
import com.morris.core.parser.Parser;
import com.morris.core.parser.Template;
import com.morris.core.parser.Value;
import com.morris.core.parser.VariableCollector;
import com.morris.core.propagation.PropagationEngine;
import com.morris.core.propagation.PropagationResult;
import com.morris.core.transaction.TransactionEngine;
import com.morris.core.transaction.ValueChange;

/**
 * One user's workspace: environment, propagation and transaction engines wired together.
 * Writes go through here so that an active transaction buffers them instead of applying them.
 */
public final class Session {

    /** Outcome of a write: either staged in the active transaction or applied with its propagation. */
    public static final class Assignment {
        public final String name;
        public final ValueChange staged;
        public final PropagationResult propagation;

        private Assignment(String name, ValueChange staged, PropagationResult propagation) {
            this.name = name;
            this.staged = staged;
            this.propagation = propagation;
        }

        public boolean isStaged() {
            return staged != null;
        }
    }

    private final MorrisConfig config;
    private final Environment env;
    private final PropagationEngine propagation;
    private final TransactionEngine transactions;

    public Session() {
        this(MorrisConfig.defaults());
    }

    public Session(MorrisConfig config) {
        this.config = config;
        this.env = new Environment(config);
        this.propagation = new PropagationEngine(env, config);
        this.transactions = new TransactionEngine(propagation, config);
    }

    public MorrisConfig config() { return config; }
    public Environment environment() { return env; }
    public PropagationEngine propagation() { return propagation; }
    public TransactionEngine transactions() { return transactions; }

    /**
     * Parses {@code text} (after stripping a {@code ~-N}/{@code ~+N} suffix) and writes it.
     * An expression that reads no variables is evaluated once and stored as a direct value;
     * anything else keeps its expression.
     */
    public Assignment set(String name, String text, DeclaredType type) {
        requireName(name);
        PropagationControl.Suffixed s = PropagationControl.strip(text);
        ExprInterface expr = Parser.parse(s.text);

        if (expr instanceof Expr.Literal && !((Expr.Literal) expr).template) {
            return write(name, ((Expr.Literal) expr).value, type, s.control);
        }
        if (VariableCollector.collect(expr).isEmpty()) {
            return write(name, propagation.interpreter(env).evaluate(expr), type, s.control);
        }
        if (transactions.isActive()) {
            return new Assignment(name, transactions.stage(name, expr, s.text.trim(), type, s.control), null);
        }
        return new Assignment(name, null, propagation.setComputed(name, expr, s.text.trim(), type, s.control));
    }

    /** Writes an already computed value. */
    public Assignment setValue(String name, Value value, DeclaredType type) {
        requireName(name);
        return write(name, value, type, null);
    }

    private Assignment write(String name, Value value, DeclaredType type, PropagationControl control) {
        if (transactions.isActive()) {
            return new Assignment(name, transactions.stage(name, value, type, control), null);
        }
        return new Assignment(name, null, propagation.setDirect(name, value, type, control));
    }

    /** Current value of {@code name}; fails when absent or pending. */
    public Value value(String name) {
        Value v = env.lookup(name);
        if (v == null) throw new EvaluationError("Variable not found: " + name);
        return v;
    }

    public Variable variable(String name) {
        return env.require(name);
    }

    public Value evaluate(String expression) {
        return propagation.interpreter(env).evaluate(Parser.parse(expression));
    }

    public String render(String template, Map<String, String> params) {
        return Template.render(template, params, env, propagation.builtins());
    }

    /** Evaluates each hypothetical value text against the current environment. */
    public Map<String, Value> scenario(Map<String, String> texts) {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : texts.entrySet()) {
            out.put(e.getKey(), evaluate(e.getValue()));
        }
        return out;
    }

    private static void requireName(String name) {
        if (name == null || !name.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("Invalid variable name: " + name);
        }
    }
}
