package com.morris.intent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.morris.core.env.DeclaredType;
import com.morris.core.env.Environment;
import com.morris.core.env.Variable;
import com.morris.core.parser.Value;
import com.morris.core.propagation.PropagationEngine;

/**
 * set, ensure, writeout, derive, freeze, unfreeze, delete, show, env.
 */
public final class VariableVerbs {

    private VariableVerbs() {}

    public static void register(IntentDispatcher d) {
        d.register(Verb.SET, VariableVerbs::set);
        d.register(Verb.ENSURE, VariableVerbs::ensure);
        d.register(Verb.WRITEOUT, VariableVerbs::writeout);
        d.register(Verb.DERIVE, VariableVerbs::derive);
        d.register(Verb.FREEZE, (s, i) -> {
            Variable v = s.propagation().freeze(i.requireTarget());
            return IntentResult.ok("Froze " + v.name());
        });
        d.register(Verb.UNFREEZE, (s, i) -> {
            Variable v = s.propagation().unfreeze(i.requireTarget());
            return IntentResult.ok("Unfroze " + v.name());
        });
        d.register(Verb.DELETE, (s, i) -> {
            Variable v = s.propagation().remove(i.requireTarget());
            return IntentResult.ok("Deleted " + v.name());
        });
        d.register(Verb.SHOW, VariableVerbs::show);
        d.register(Verb.ENV, VariableVerbs::env);
    }

    static IntentResult set(Session s, Intent i) {
        String name = i.requireTarget();
        Session.Assignment a = s.set(name, i.requireParam("value"), DeclaredType.parse(i.param("type")));
        return describe(s, a);
    }

    static IntentResult ensure(Session s, Intent i) {
        String name = i.requireTarget();
        if (s.environment().contains(name)) {
            return IntentResult.ok(name + " already exists", s.environment().getValue(name));
        }
        return set(s, i);
    }

    static IntentResult describe(Session s, Session.Assignment a) {
        if (a.isStaged()) {
            return IntentResult.ok("Staged " + a.staged.describe());
        }
        Value v = s.environment().getValue(a.name);
        List<String> details = new ArrayList<>();
        if (a.propagation.changedVariables.size() > 1 || a.propagation.deferred
                || a.propagation.hasFailures() || a.propagation.conflictsResolved > 0) {
            details.add(a.propagation.summary());
        }
        return IntentResult.ok(a.name + " = " + v.display(), v, details);
    }

    static IntentResult writeout(Session s, Intent i) {
        String template = i.param("template", i.param("value", i.target()));
        if (template == null) throw new IllegalArgumentException("writeout requires a template");
        Map<String, String> params = new LinkedHashMap<>(i.params());
        params.remove("template");
        params.remove("value");
        String text = s.render(template, params);
        return IntentResult.ok(text, Value.string(text));
    }

    static IntentResult derive(Session s, Intent i) {
        String name = i.requireTarget();
        Value current = s.value(name);
        Value derived = ValueDeriver.derive(current, i.param("as"));
        if (derived.equals(current)) {
            return IntentResult.ok(name + " unchanged: " + current.display(), current);
        }
        return describe(s, s.setValue(name, derived, null));
    }

    static IntentResult show(Session s, Intent i) {
        String name = i.requireTarget();
        Environment env = s.environment();
        Variable v = env.require(name);
        List<String> details = new ArrayList<>();
        details.add("source: " + v.source().label());
        if (v.declaredType() != null) details.add("type: " + v.declaredType().label);
        details.add("updates: " + v.updateCount() + ", last at " + v.lastUpdated());
        List<String> deps = env.dependenciesOf(name);
        if (!deps.isEmpty()) details.add("depends on: " + String.join(", ", deps));
        PropagationEngine p = s.propagation();
        List<String> dependents = p.graph().contains(name) ? p.graph().directDependents(name) : env.dependentsOf(name);
        if (!dependents.isEmpty()) details.add("dependents: " + String.join(", ", dependents));
        return IntentResult.ok(v.describe(), details);
    }

    static IntentResult env(Session s, Intent i) {
        List<String> lines = new ArrayList<>();
        for (Variable v : s.environment().list()) lines.add(v.describe());
        return IntentResult.ok(lines.size() + " variable(s)", lines);
    }
}
