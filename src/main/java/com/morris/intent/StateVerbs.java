package com.morris.intent;

import java.util.ArrayList;
import java.util.List;

import com.morris.core.parser.Value;
import com.morris.persistence.StateStore;
import com.morris.persistence.VariableRecord;

/** save and load. The state travels as a JSON string value. */
public final class StateVerbs {

    private StateVerbs() {}

    public static void register(IntentDispatcher d) {
        d.register(Verb.SAVE, StateVerbs::save);
        d.register(Verb.LOAD, StateVerbs::load);
    }

    static IntentResult save(Session s, Intent i) {
        StateStore store = new StateStore().capture(s.environment());
        String json = store.toJson();
        return IntentResult.ok("Saved " + store.records().size() + " variable(s)", Value.string(json));
    }

    static IntentResult load(Session s, Intent i) {
        String json = i.param("json");
        if (json == null) json = i.requireParam("state");
        StateStore store = StateStore.fromJson(json);
        store.restoreInto(s);
        List<String> names = new ArrayList<>();
        for (VariableRecord r : store.records()) names.add(r.toString());
        return IntentResult.ok("Loaded " + names.size() + " variable(s)", names);
    }
}
