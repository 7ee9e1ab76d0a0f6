package com.morris.core.transaction;

import java.util.List;
import java.util.Locale;

/** Result of tempering: what forging the active transaction would do. Nothing is applied. */
public final class TransactionPreview {

    public final List<ValueChange> changes;
    public final List<String> conflicts;
    public final List<String> blockedPropagations;
    public final List<String> propagationPaths;
    public final List<String> typeIssues;
    public final int estimatedAffected;
    public final PerformanceEstimate performance;
    public final double safetyScore;

    TransactionPreview(List<ValueChange> changes, List<String> conflicts, List<String> blockedPropagations,
                       List<String> propagationPaths, List<String> typeIssues, int estimatedAffected,
                       PerformanceEstimate performance) {
        this.changes = List.copyOf(changes);
        this.conflicts = List.copyOf(conflicts);
        this.blockedPropagations = List.copyOf(blockedPropagations);
        this.propagationPaths = List.copyOf(propagationPaths);
        this.typeIssues = List.copyOf(typeIssues);
        this.estimatedAffected = estimatedAffected;
        this.performance = performance;
        this.safetyScore = score(conflicts.size() + typeIssues.size(), blockedPropagations.size());
    }

    /** 1.0 minus 0.3 per conflict and 0.1 per blocked propagation, clamped to [0, 1]. */
    static double score(int conflicts, int blocked) {
        double s = 1.0 - 0.3 * conflicts - 0.1 * blocked;
        return Math.max(0.0, Math.min(1.0, s));
    }

    public boolean isSafe() {
        return conflicts.isEmpty() && typeIssues.isEmpty();
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Preview: ").append(changes.size()).append(" change(s), ")
                .append(estimatedAffected).append(" affected\n");
        for (ValueChange c : changes) sb.append("  ").append(c.describe()).append('\n');
        for (String p : propagationPaths) sb.append("  path: ").append(p).append('\n');
        for (String c : conflicts) sb.append("  conflict: ").append(c).append('\n');
        for (String b : blockedPropagations) sb.append("  blocked: ").append(b).append('\n');
        for (String t : typeIssues) sb.append("  type: ").append(t).append('\n');
        sb.append("  performance: ").append(performance).append('\n');
        sb.append(String.format(Locale.ROOT, "  safety: %.2f%n", safetyScore));
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
