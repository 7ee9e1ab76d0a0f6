package com.morris.core.error;

import java.util.Collections;
import java.util.List;

public class GraphError extends MorrisError {

    private static final long serialVersionUID = 1L;

    public enum Reason { NOT_FOUND, CYCLE, FROZEN, SELF_DEPENDENCY, CAPACITY }

    private final Reason reason;
    private final String variable;
    private final List<String> cyclePath;

    private GraphError(Reason reason, String variable, List<String> cyclePath, String message) {
        super(Kind.GRAPH, message);
        this.reason = reason;
        this.variable = variable;
        this.cyclePath = cyclePath == null ? Collections.emptyList() : List.copyOf(cyclePath);
    }

    public static GraphError notFound(String name) {
        return new GraphError(Reason.NOT_FOUND, name, null, "Variable '" + name + "' not found");
    }

    public static GraphError frozen(String name) {
        return new GraphError(Reason.FROZEN, name, null, "Variable '" + name + "' is frozen");
    }

    public static GraphError selfDependency(String name) {
        return new GraphError(Reason.SELF_DEPENDENCY, name, List.of(name, name), "Variable '" + name + "' cannot depend on itself");
    }

    public static GraphError capacity(String name, int max) {
        return new GraphError(Reason.CAPACITY, name, null,
                "Cannot create '" + name + "': variable limit of " + max + " reached");
    }

    /** {@code path} runs from the rejected edge's source around the loop back to it. */
    public static GraphError cycle(List<String> path) {
        String first = path.isEmpty() ? null : path.get(0);
        return new GraphError(Reason.CYCLE, first, path, "Cycle detected: " + String.join(" -> ", path));
    }

    public Reason reason() {
        return reason;
    }

    public String variable() {
        return variable;
    }

    public List<String> cyclePath() {
        return cyclePath;
    }
}
