package com.morris.core.transaction;

import java.util.List;

import com.morris.core.env.DeclaredType;
import com.morris.core.env.PropagationControl;
import com.morris.core.parser.Expr.ExprInterface;
import com.morris.core.parser.Value;

/**
 * A buffered edit. Either {@code newValue} (direct) or {@code expression} (computed) is set.
 * {@code oldValue} is the value at craft time, null when the variable did not exist.
 */
public final class ValueChange {

    public final String variable;
    public final Value oldValue;
    public final Value newValue;
    public final ExprInterface expression;
    public final String rawExpression;
    public final List<String> dependencies;
    public final DeclaredType declaredType;
    public final PropagationControl control;

    public ValueChange(String variable, Value oldValue, Value newValue, ExprInterface expression,
                       String rawExpression, List<String> dependencies,
                       DeclaredType declaredType, PropagationControl control) {
        this.variable = variable;
        this.oldValue = oldValue;
        this.newValue = newValue;
        this.expression = expression;
        this.rawExpression = expression == null ? null : (rawExpression != null ? rawExpression : expression.toString());
        this.dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        this.declaredType = declaredType;
        this.control = control;
    }

    public boolean isComputed() {
        return expression != null;
    }

    /** Same edit with the craft-time value of an earlier edit to the same name. */
    ValueChange withOldValue(Value old) {
        return new ValueChange(variable, old, newValue, expression, rawExpression, dependencies, declaredType, control);
    }

    public String describe() {
        String old = oldValue == null ? "<new>" : oldValue.display();
        if (isComputed()) return variable + " := " + rawExpression + " (was " + old + ")";
        return variable + ": " + old + " -> " + newValue.display();
    }

    @Override
    public String toString() {
        return describe();
    }
}
