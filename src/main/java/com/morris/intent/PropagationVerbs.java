package com.morris.intent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.morris.core.propagation.PropagationEngine;
import com.morris.core.propagation.PropagationEvent;
import com.morris.core.propagation.PropagationResult;
import com.morris.core.propagation.PropagationStrategy;

/**
 * propagation, strategy, flush, graph.
 */
public final class PropagationVerbs {

    private PropagationVerbs() {}

    public static void register(IntentDispatcher d) {
        d.register(Verb.PROPAGATION, PropagationVerbs::status);
        d.register(Verb.STRATEGY, PropagationVerbs::strategy);
        d.register(Verb.FLUSH, (s, i) -> {
            PropagationResult r = s.propagation().flush();
            return IntentResult.ok(r.changedVariables.isEmpty() ? "Nothing queued" : "Flushed: " + r.summary());
        });
        d.register(Verb.GRAPH, (s, i) -> IntentResult.ok(s.propagation().graph().visualize()));
    }

    static IntentResult status(Session s, Intent i) {
        PropagationEngine p = s.propagation();
        List<String> lines = new ArrayList<>();
        lines.add("queued: " + p.queuedCount());
        for (PropagationEvent e : p.recentHistory(i.intParam("limit", 10))) lines.add(e.toString());
        return IntentResult.ok("Strategy " + p.strategy(), lines);
    }

    static IntentResult strategy(Session s, Intent i) {
        String mode = i.param("mode", i.target());
        if (mode == null) return IntentResult.ok("Strategy " + s.propagation().strategy());
        PropagationStrategy next = PropagationStrategy.parse(mode,
                Duration.ofMillis(i.intParam("ms", 100)), i.intParam("count", 10));
        PropagationResult drained = s.propagation().setStrategy(next);
        List<String> lines = new ArrayList<>();
        if (!drained.changedVariables.isEmpty()) lines.add("drained: " + drained.summary());
        return IntentResult.ok("Strategy " + next, lines);
    }
}
