package com.morris.core.transaction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.morris.core.parser.Value;

/** What a hypothetical set of writes would do. Produced without touching any state. */
public final class ScenarioOutcome {

    public final List<String> affected;
    public final List<String> conflicts;
    public final List<String> propagationImpacts;
    public final Map<String, Value> predictedValues;
    public final double safetyDelta;

    ScenarioOutcome(List<String> affected, List<String> conflicts, List<String> propagationImpacts,
                    Map<String, Value> predictedValues, double safetyDelta) {
        this.affected = List.copyOf(affected);
        this.conflicts = List.copyOf(conflicts);
        this.propagationImpacts = List.copyOf(propagationImpacts);
        this.predictedValues = Collections.unmodifiableMap(new LinkedHashMap<>(predictedValues));
        this.safetyDelta = safetyDelta;
    }

    public String render() {
        StringBuilder sb = new StringBuilder("What-if: ").append(affected.size()).append(" affected");
        if (!affected.isEmpty()) sb.append(" (").append(String.join(", ", affected)).append(')');
        sb.append('\n');
        for (String i : propagationImpacts) sb.append("  ").append(i).append('\n');
        for (String c : conflicts) sb.append("  conflict: ").append(c).append('\n');
        sb.append(String.format(Locale.ROOT, "  safety delta: %+.2f%n", safetyDelta));
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
