package com.morris.core.env;

import java.time.Instant;

import com.morris.core.parser.Expr.ExprInterface;
import com.morris.core.parser.Value;

/**
 * One named slot in the {@link Environment}. Mutated only through the environment.
 */
public final class Variable {

    private final String name;
    private Value value;
    private boolean constant;
    private ExprInterface expression;
    private String rawExpression;
    private VariableSource source;
    private Instant lastUpdated;
    private long updateCount;
    private DeclaredType declaredType;
    private boolean pending;
    private PropagationControl control;

    Variable(String name, Instant created) {
        this.name = name;
        this.source = VariableSource.DIRECT;
        this.lastUpdated = created;
        this.control = PropagationControl.open();
    }

    public String name() { return name; }

    /** Null only for a variable that was created inside a transaction and is still pending. */
    public Value value() { return value; }

    public boolean isConstant() { return constant; }
    public ExprInterface expression() { return expression; }
    public String rawExpression() { return rawExpression; }
    public boolean isComputed() { return expression != null; }
    public VariableSource source() { return source; }
    public Instant lastUpdated() { return lastUpdated; }
    public long updateCount() { return updateCount; }
    public DeclaredType declaredType() { return declaredType; }
    public boolean isPending() { return pending; }
    public PropagationControl control() { return control; }

    void write(Value v, VariableSource src, Instant at) {
        this.value = v;
        this.source = src;
        this.lastUpdated = at;
        this.updateCount++;
        this.pending = false;
    }

    void setExpression(ExprInterface expr, String raw) {
        this.expression = expr;
        this.rawExpression = expr == null ? null : (raw != null ? raw : expr.toString());
    }

    void setConstant(boolean constant) { this.constant = constant; }
    void setDeclaredType(DeclaredType type) { this.declaredType = type; }
    void setPending(boolean pending) { this.pending = pending; }
    void setControl(PropagationControl control) { this.control = control; }

    Variable copy() {
        Variable v = new Variable(name, lastUpdated);
        v.value = value;
        v.constant = constant;
        v.expression = expression;
        v.rawExpression = rawExpression;
        v.source = source;
        v.updateCount = updateCount;
        v.declaredType = declaredType;
        v.pending = pending;
        v.control = control.copy();
        return v;
    }

    /** {@code name = value}, with the expression and flags appended when present. */
    public String describe() {
        StringBuilder sb = new StringBuilder(name).append(" = ");
        sb.append(pending ? "<pending>" : value.display());
        if (rawExpression != null) sb.append("  := ").append(rawExpression);
        if (declaredType != null) sb.append("  :").append(declaredType.label);
        if (constant) sb.append("  [frozen]");
        if (!control.isOpen()) sb.append("  ").append(control);
        return sb.toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}
