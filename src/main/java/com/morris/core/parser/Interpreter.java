package com.morris.core.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.morris.core.error.EvaluationError;
import com.morris.core.parser.Expr.ExprInterface;
import com.morris.core.parser.Expr.Operator;

/**
 * Reduces an expression tree to a {@link Value} against a {@link VariableResolver}.
 *
 * Arithmetic: int op int stays int (except division, which always yields float); a float
 * operand promotes the result. '+' with a string on either side concatenates. Division by
 * zero is an error, never infinity. and/or/not take booleans only; both sides of and/or are always evaluated.
 */
public final class Interpreter implements Expr.ExprVisitor<Value> {

    private final VariableResolver resolver;
    private final Builtins builtins;

    public Interpreter(VariableResolver resolver) {
        this(resolver, Builtins.standard());
    }

    public Interpreter(VariableResolver resolver, Builtins builtins) {
        this.resolver = resolver == null ? VariableResolver.empty() : resolver;
        this.builtins = builtins == null ? Builtins.standard() : builtins;
    }

    public static Value evaluate(ExprInterface expr, VariableResolver resolver) {
        return new Interpreter(resolver).evaluate(expr);
    }

    public Value evaluate(ExprInterface expr) {
        return expr.accept(this);
    }

    // -------------------------
    // Leaves
    // -------------------------

    @Override
    public Value visitLiteralExpr(Expr.Literal expr) {
        if (expr.template) {
            return Value.string(Template.render(expr.value.asString(), Collections.emptyMap(), resolver, builtins));
        }
        return expr.value;
    }

    @Override
    public Value visitVariableExpr(Expr.Variable expr) {
        Value v = resolver.lookup(expr.name);
        if (v == null) throw new EvaluationError("Variable not found: " + expr.name);
        return v;
    }

    @Override
    public Value visitListExpr(Expr.ListLiteral expr) {
        List<Value> items = new ArrayList<>(expr.items.size());
        for (ExprInterface item : expr.items) items.add(evaluate(item));
        return Value.list(items);
    }

    @Override
    public Value visitDictExpr(Expr.DictLiteral expr) {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, ExprInterface> e : expr.entries.entrySet()) {
            out.put(e.getKey(), evaluate(e.getValue()));
        }
        return Value.dict(out);
    }

    // -------------------------
    // Operators
    // -------------------------

    @Override
    public Value visitBinaryExpr(Expr.Binary expr) {
        if (expr.operator == Operator.AND || expr.operator == Operator.OR) {
            return logical(expr);
        }

        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);

        switch (expr.operator) {
            case ADD: return add(left, right);
            case SUBTRACT:
            case MULTIPLY:
                return arithmetic(expr.operator, left, right);
            case DIVIDE: return divide(left, right);
            case EQUAL: return Value.bool(valuesEqual(left, right));
            case NOT_EQUAL: return Value.bool(!valuesEqual(left, right));
            default: return compare(expr.operator, left, right);
        }
    }

    private Value logical(Expr.Binary expr) {
        String op = expr.operator.symbol;
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);
        if (left.type != Value.Type.BOOL) {
            throw new EvaluationError("Logical '" + op + "' requires boolean operands, got " + left.typeName());
        }
        if (right.type != Value.Type.BOOL) {
            throw new EvaluationError("Logical '" + op + "' requires boolean operands, got " + right.typeName());
        }
        if (expr.operator == Operator.AND) return Value.bool(left.asBool() && right.asBool());
        return Value.bool(left.asBool() || right.asBool());
    }

    private static Value add(Value left, Value right) {
        if (left.type == Value.Type.STRING || right.type == Value.Type.STRING) {
            return Value.string(left.toString() + right.toString());
        }
        if (left.isNumeric() && right.isNumeric()) {
            return arithmetic(Operator.ADD, left, right);
        }
        throw new EvaluationError("Cannot add " + left.typeName() + " and " + right.typeName());
    }

    private static Value arithmetic(Operator op, Value left, Value right) {
        if (!left.isNumeric() || !right.isNumeric()) {
            if (op == Operator.SUBTRACT) {
                throw new EvaluationError("Cannot subtract " + right.typeName() + " from " + left.typeName()
                        + " - must be int or float");
            }
            throw new EvaluationError("Cannot multiply " + left.typeName() + " and " + right.typeName()
                    + " - must be int or float");
        }

        if (left.type == Value.Type.INT && right.type == Value.Type.INT) {
            long a = left.asInt();
            long b = right.asInt();
            try {
                switch (op) {
                    case ADD: return Value.integer(Math.addExact(a, b));
                    case SUBTRACT: return Value.integer(Math.subtractExact(a, b));
                    default: return Value.integer(Math.multiplyExact(a, b));
                }
            } catch (ArithmeticException e) {
                throw new EvaluationError("Integer overflow in " + a + " " + op.symbol + " " + b, e);
            }
        }

        double a = left.asNumber();
        double b = right.asNumber();
        switch (op) {
            case ADD: return Value.floating(a + b);
            case SUBTRACT: return Value.floating(a - b);
            default: return Value.floating(a * b);
        }
    }

    private static Value divide(Value left, Value right) {
        if (!left.isNumeric() || !right.isNumeric()) {
            throw new EvaluationError("Cannot divide " + left.typeName() + " by " + right.typeName()
                    + " - must be int or float");
        }
        double divisor = right.asNumber();
        if (divisor == 0.0) throw new EvaluationError("Division by zero");
        return Value.floating(left.asNumber() / divisor);
    }

    private static Value compare(Operator op, Value left, Value right) {
        if (!left.isNumeric() || !right.isNumeric()) {
            throw new EvaluationError("Cannot compare " + left.typeName() + " and " + right.typeName());
        }
        int c;
        if (left.type == Value.Type.INT && right.type == Value.Type.INT) {
            c = Long.compare(left.asInt(), right.asInt());
        } else {
            c = Double.compare(left.asNumber(), right.asNumber());
        }
        switch (op) {
            case GREATER: return Value.bool(c > 0);
            case GREATER_EQUAL: return Value.bool(c >= 0);
            case LESS: return Value.bool(c < 0);
            case LESS_EQUAL: return Value.bool(c <= 0);
            default: throw new EvaluationError("Unsupported comparison: " + op.symbol);
        }
    }

    /** Structural, except that int and float compare by numeric value. */
    private static boolean valuesEqual(Value left, Value right) {
        if (left.isNumeric() && right.isNumeric() && left.type != right.type) {
            return left.asNumber() == right.asNumber();
        }
        return left.equals(right);
    }

    @Override
    public Value visitNotExpr(Expr.Not expr) {
        Value v = evaluate(expr.operand);
        if (v.type != Value.Type.BOOL) {
            throw new EvaluationError("Logical 'not' requires boolean operand, got " + v.typeName());
        }
        return Value.bool(!v.asBool());
    }

    // -------------------------
    // Calls and access
    // -------------------------

    @Override
    public Value visitCallExpr(Expr.Call expr) {
        return builtins.call(expr.name, evaluateAll(expr.args));
    }

    @Override
    public Value visitMethodCallExpr(Expr.MethodCall expr) {
        Value receiver = evaluate(expr.receiver);
        return builtins.invoke(receiver, expr.method, evaluateAll(expr.args));
    }

    @Override
    public Value visitIndexExpr(Expr.Index expr) {
        Value container = ValueCodec.materialize(evaluate(expr.container));
        Value index = evaluate(expr.index);

        if (container.type == Value.Type.LIST && index.type == Value.Type.INT) {
            List<Value> items = container.asList();
            long i = index.asInt();
            if (i < 0 || i >= items.size()) {
                throw new EvaluationError("Index " + i + " out of bounds for list of length " + items.size());
            }
            return items.get((int) i);
        }
        if (container.type == Value.Type.DICT && index.type == Value.Type.STRING) {
            Value v = container.asDict().get(index.asString());
            if (v == null) throw new EvaluationError("Key '" + index.asString() + "' not found in dictionary");
            return v;
        }
        throw new EvaluationError("Cannot index " + container.typeName() + " with " + index.typeName());
    }

    // -------------------------
    // Conditional
    // -------------------------

    @Override
    public Value visitConditionalExpr(Expr.Conditional expr) {
        for (Expr.Branch branch : expr.branches) {
            if (branch.isFallback()) {
                return evaluate(branch.value);
            }
            Value guard = evaluate(branch.guard);
            if (guard.type != Value.Type.BOOL) {
                throw new EvaluationError("Condition must evaluate to boolean, got " + guard.typeName());
            }
            if (guard.asBool()) {
                return evaluate(branch.value);
            }
        }
        throw new EvaluationError("No matching condition in conditional expression");
    }

    private List<Value> evaluateAll(List<ExprInterface> exprs) {
        List<Value> out = new ArrayList<>(exprs.size());
        for (ExprInterface e : exprs) out.add(evaluate(e));
        return out;
    }
}
