package com.morris.core.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expression tree. Nodes are immutable once built; child lists are copied read-only.
 * {@code toString()} renders a node back to expression text.
 */
public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitVariableExpr(Variable expr);
        R visitListExpr(ListLiteral expr);
        R visitDictExpr(DictLiteral expr);
        R visitBinaryExpr(Binary expr);
        R visitNotExpr(Not expr);
        R visitCallExpr(Call expr);
        R visitMethodCallExpr(MethodCall expr);
        R visitIndexExpr(Index expr);
        R visitConditionalExpr(Conditional expr);
    }

    public enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        GREATER(">"),
        GREATER_EQUAL(">="),
        LESS("<"),
        LESS_EQUAL("<="),
        EQUAL("=="),
        NOT_EQUAL("!="),
        AND("and"),
        OR("or");

        public final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }
    }

    // -------------------------
    // Leaves
    // -------------------------

    public static final class Literal implements ExprInterface {
        public final Value value;
        // quoted text from the source; interpolated on evaluation
        public final boolean template;

        public Literal(Value value) {
            this(value, false);
        }

        private Literal(Value value, boolean template) {
            this.value = value;
            this.template = template;
        }

        /** A string literal whose text is rendered through {@link Template} when evaluated. */
        public static Literal template(String text) {
            return new Literal(Value.string(text), Template.isTemplate(text));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }

        @Override
        public String toString() {
            if (value.type == Value.Type.STRING) {
                return "\"" + value.asString().replace("\"", "\\\"") + "\"";
            }
            return value.display();
        }
    }

    public static final class Variable implements ExprInterface {
        public final String name;

        public Variable(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    // -------------------------
    // Collections
    // -------------------------

    public static final class ListLiteral implements ExprInterface {
        public final List<ExprInterface> items;

        public ListLiteral(List<ExprInterface> items) {
            this.items = List.copyOf(items);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListExpr(this);
        }

        @Override
        public String toString() {
            return "[" + join(items) + "]";
        }
    }

    public static final class DictLiteral implements ExprInterface {
        public final Map<String, ExprInterface> entries;

        public DictLiteral(Map<String, ExprInterface> entries) {
            this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitDictExpr(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("{");
            boolean first = true;
            for (Map.Entry<String, ExprInterface> e : entries.entrySet()) {
                if (!first) sb.append(", ");
                first = false;
                sb.append('"').append(e.getKey()).append("\": ").append(e.getValue());
            }
            return sb.append('}').toString();
        }
    }

    // -------------------------
    // Operators
    // -------------------------

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Operator operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Operator operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.symbol + " " + right + ")";
        }
    }

    public static final class Not implements ExprInterface {
        public final ExprInterface operand;

        public Not(ExprInterface operand) {
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNotExpr(this);
        }

        @Override
        public String toString() {
            return "(not " + operand + ")";
        }
    }

    // -------------------------
    // Calls and access
    // -------------------------

    public static final class Call implements ExprInterface {
        public final String name;
        public final List<ExprInterface> args;

        public Call(String name, List<ExprInterface> args) {
            this.name = name;
            this.args = List.copyOf(args);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }

        @Override
        public String toString() {
            return name + "(" + join(args) + ")";
        }
    }

    public static final class MethodCall implements ExprInterface {
        public final ExprInterface receiver;
        public final String method;
        public final List<ExprInterface> args;

        public MethodCall(ExprInterface receiver, String method, List<ExprInterface> args) {
            this.receiver = receiver;
            this.method = method;
            this.args = List.copyOf(args);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMethodCallExpr(this);
        }

        @Override
        public String toString() {
            return receiver + "." + method + "(" + join(args) + ")";
        }
    }

    public static final class Index implements ExprInterface {
        public final ExprInterface container;
        public final ExprInterface index;

        public Index(ExprInterface container, ExprInterface index) {
            this.container = container;
            this.index = index;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }

        @Override
        public String toString() {
            return container + "[" + index + "]";
        }
    }

    // -------------------------
    // Conditional
    // -------------------------

    /** One arm of a conditional. A null guard makes it the fallback. */
    public static final class Branch {
        public final ExprInterface value;
        public final ExprInterface guard;

        public Branch(ExprInterface value, ExprInterface guard) {
            this.value = value;
            this.guard = guard;
        }

        public boolean isFallback() {
            return guard == null;
        }

        @Override
        public String toString() {
            return guard == null ? value.toString() : value + " when " + guard;
        }
    }

    public static final class Conditional implements ExprInterface {
        public final List<Branch> branches;

        public Conditional(List<Branch> branches) {
            this.branches = List.copyOf(branches);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConditionalExpr(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < branches.size(); i++) {
                if (i > 0) sb.append(" | ");
                sb.append(branches.get(i));
            }
            return sb.toString();
        }
    }

    private static String join(List<ExprInterface> parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(parts.get(i));
        }
        return sb.toString();
    }
}
