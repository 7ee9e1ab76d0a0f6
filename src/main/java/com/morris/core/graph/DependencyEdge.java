package com.morris.core.graph;

/**
 * {@code source -> target}: target is computed from source.
 *
 * A bidirectional edge is stored as two edges; the second one carries {@code reverse = true}
 * and is skipped by cycle checks and topological ordering.
 */
public final class DependencyEdge {

    private final String source;
    private final String target;
    private final boolean reverse;
    private DependencyType type;
    private double weight;
    private String guard;

    DependencyEdge(String source, String target, DependencyType type, double weight, String guard, boolean reverse) {
        this.source = source;
        this.target = target;
        this.type = type;
        this.weight = weight;
        this.guard = guard;
        this.reverse = reverse;
    }

    public String source() { return source; }
    public String target() { return target; }
    public DependencyType type() { return type; }
    public double weight() { return weight; }
    public String guard() { return guard; }
    public boolean isReverse() { return reverse; }

    void update(DependencyType type, double weight, String guard) {
        this.type = type;
        this.weight = weight;
        this.guard = guard;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(source).append(" -> ").append(target)
                .append(" [").append(type.name().toLowerCase(java.util.Locale.ROOT));
        if (weight != 1.0) sb.append(String.format(java.util.Locale.ROOT, ", w=%.2f", weight));
        if (guard != null) sb.append(", when ").append(guard);
        if (reverse) sb.append(", reverse");
        return sb.append(']').toString();
    }
}
