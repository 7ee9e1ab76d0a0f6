package com.morris.core.transaction;

import java.util.List;

public final class PerformanceEstimate {

    public final int variableCount;
    public final int propagationSteps;
    public final long estimatedTimeMs;
    public final String memoryImpact;
    public final List<String> bottlenecks;

    PerformanceEstimate(int variableCount, int propagationSteps, List<String> bottlenecks) {
        this.variableCount = variableCount;
        this.propagationSteps = propagationSteps;
        this.estimatedTimeMs = variableCount * 10L + propagationSteps * 5L;
        this.memoryImpact = variableCount > 100 ? "high" : variableCount > 10 ? "medium" : "low";
        this.bottlenecks = List.copyOf(bottlenecks);
    }

    @Override
    public String toString() {
        return variableCount + " variable(s), " + propagationSteps + " propagation step(s), ~" + estimatedTimeMs
                + "ms, memory " + memoryImpact
                + (bottlenecks.isEmpty() ? "" : ", bottlenecks: " + String.join(", ", bottlenecks));
    }
}
