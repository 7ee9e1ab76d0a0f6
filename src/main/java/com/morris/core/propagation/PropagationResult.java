package com.morris.core.propagation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Outcome of one write or one drained batch.
 *
 * {@code conflictsResolved} counts propagated updates withheld by a {@code ~-N}/{@code ~+N} gate.
 * {@code deferred} is set when recomputation was queued instead of run.
 */
public final class PropagationResult {

    public final List<String> changedVariables;
    public final List<String> propagationPaths;
    public final Duration timeTaken;
    public final int conflictsResolved;
    public final List<String> failedPropagations;
    public final boolean deferred;

    public PropagationResult(List<String> changedVariables, List<String> propagationPaths, Duration timeTaken,
                             int conflictsResolved, List<String> failedPropagations, boolean deferred) {
        this.changedVariables = Collections.unmodifiableList(new ArrayList<>(changedVariables));
        this.propagationPaths = Collections.unmodifiableList(new ArrayList<>(propagationPaths));
        this.timeTaken = timeTaken;
        this.conflictsResolved = conflictsResolved;
        this.failedPropagations = Collections.unmodifiableList(new ArrayList<>(failedPropagations));
        this.deferred = deferred;
    }

    public static PropagationResult empty() {
        return new PropagationResult(List.of(), List.of(), Duration.ZERO, 0, List.of(), false);
    }

    static PropagationResult deferred(String name) {
        return new PropagationResult(List.of(name), List.of(), Duration.ZERO, 0, List.of(), true);
    }

    public boolean hasFailures() {
        return !failedPropagations.isEmpty();
    }

    /** Both results combined; changed names keep first-seen order without repeats. */
    public PropagationResult merge(PropagationResult other) {
        LinkedHashSet<String> changed = new LinkedHashSet<>(changedVariables);
        changed.addAll(other.changedVariables);
        List<String> paths = new ArrayList<>(propagationPaths);
        paths.addAll(other.propagationPaths);
        LinkedHashSet<String> failed = new LinkedHashSet<>(failedPropagations);
        failed.addAll(other.failedPropagations);
        return new PropagationResult(new ArrayList<>(changed), paths, timeTaken.plus(other.timeTaken),
                conflictsResolved + other.conflictsResolved, new ArrayList<>(failed), deferred && other.deferred);
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(deferred ? "queued " : "updated ").append(String.join(", ", changedVariables));
        if (conflictsResolved > 0) sb.append("; ").append(conflictsResolved).append(" withheld");
        if (!failedPropagations.isEmpty()) sb.append("; failed: ").append(String.join(", ", failedPropagations));
        return sb.toString();
    }

    @Override
    public String toString() {
        return summary();
    }
}
