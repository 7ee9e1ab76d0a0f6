package com.morris.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.morris.core.env.DeclaredType;
import com.morris.core.env.Variable;
import com.morris.core.env.VariableSource;
import com.morris.core.error.EvaluationError;
import com.morris.core.parser.Value;
import com.morris.core.parser.ValueCodec;

/** Flat persisted form of one variable. Graph edges are not stored; they come back from {@code expression}. */
public final class VariableRecord {

    public final String name;
    public final Value value;
    public final boolean constant;
    public final VariableSource source;
    public final String expression;
    public final DeclaredType declaredType;

    public VariableRecord(String name, Value value, boolean constant, VariableSource source,
                          String expression, DeclaredType declaredType) {
        this.name = name;
        this.value = value;
        this.constant = constant;
        this.source = source == null ? VariableSource.DIRECT : source;
        this.expression = expression;
        this.declaredType = declaredType;
    }

    public static VariableRecord of(Variable v) {
        return new VariableRecord(v.name(), v.value(), v.isConstant(), v.source(), v.rawExpression(), v.declaredType());
    }

    public ObjectNode toJson() {
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        out.put("name", name);
        out.set("value", ValueCodec.toTagged(value));
        out.put("constant", constant);
        out.put("source", source.label());
        if (expression != null) out.put("expression", expression);
        if (declaredType != null) out.put("type", declaredType.label);
        return out;
    }

    public static VariableRecord fromJson(JsonNode node) {
        if (node == null || !node.isObject()) throw new EvaluationError("Variable record must be a JSON object");
        String name = node.path("name").asText("");
        if (name.isEmpty()) throw new EvaluationError("Variable record without a name");
        return new VariableRecord(
                name,
                ValueCodec.fromTagged(node.get("value")),
                node.path("constant").asBoolean(false),
                VariableSource.parse(node.path("source").asText("direct")),
                node.hasNonNull("expression") ? node.get("expression").asText() : null,
                DeclaredType.parse(node.hasNonNull("type") ? node.get("type").asText() : null));
    }

    @Override
    public String toString() {
        return name + " = " + value.display() + (expression == null ? "" : " := " + expression)
                + (constant ? " [frozen]" : "");
    }
}
