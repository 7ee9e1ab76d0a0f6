package com.morris.core.parser;

import java.util.LinkedHashSet;
import java.util.Set;

import com.morris.core.parser.Expr.ExprInterface;

/**
 * Collects every distinct variable name an expression reads, including names referenced
 * from templates inside string literals. Order is first appearance.
 */
public final class VariableCollector implements Expr.ExprVisitor<Void> {

    private final Set<String> names = new LinkedHashSet<>();

    private VariableCollector() {}

    public static Set<String> collect(ExprInterface expr) {
        VariableCollector c = new VariableCollector();
        expr.accept(c);
        return c.names;
    }

    private void visit(ExprInterface expr) {
        expr.accept(this);
    }

    @Override
    public Void visitLiteralExpr(Expr.Literal expr) {
        if (expr.template) {
            names.addAll(Template.referencedNames(expr.value.asString()));
        }
        return null;
    }

    @Override
    public Void visitVariableExpr(Expr.Variable expr) {
        names.add(expr.name);
        return null;
    }

    @Override
    public Void visitListExpr(Expr.ListLiteral expr) {
        expr.items.forEach(this::visit);
        return null;
    }

    @Override
    public Void visitDictExpr(Expr.DictLiteral expr) {
        expr.entries.values().forEach(this::visit);
        return null;
    }

    @Override
    public Void visitBinaryExpr(Expr.Binary expr) {
        visit(expr.left);
        visit(expr.right);
        return null;
    }

    @Override
    public Void visitNotExpr(Expr.Not expr) {
        visit(expr.operand);
        return null;
    }

    @Override
    public Void visitCallExpr(Expr.Call expr) {
        expr.args.forEach(this::visit);
        return null;
    }

    @Override
    public Void visitMethodCallExpr(Expr.MethodCall expr) {
        visit(expr.receiver);
        expr.args.forEach(this::visit);
        return null;
    }

    @Override
    public Void visitIndexExpr(Expr.Index expr) {
        visit(expr.container);
        visit(expr.index);
        return null;
    }

    @Override
    public Void visitConditionalExpr(Expr.Conditional expr) {
        for (Expr.Branch b : expr.branches) {
            visit(b.value);
            if (b.guard != null) visit(b.guard);
        }
        return null;
    }
}
