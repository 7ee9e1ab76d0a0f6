package com.morris.intent;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import com.morris.core.error.MorrisError;
import com.morris.debug.Debug;

/**
 * Verb lookup table. Built once; each verb group registers its handlers.
 *
 * Usage:
 *   IntentDispatcher d = IntentDispatcher.standard();
 *   IntentResult r = d.dispatch(session, Intent.of(Verb.SET, "a", Map.of("value", "5")));
 */
public final class IntentDispatcher {

    private static final String TAG = "intent";

    private final Map<Verb, IntentHandler> handlers = new EnumMap<>(Verb.class);

    public static IntentDispatcher standard() {
        IntentDispatcher d = new IntentDispatcher();
        VariableVerbs.register(d);
        TransactionVerbs.register(d);
        PropagationVerbs.register(d);
        JsonVerbs.register(d);
        CollectionVerbs.register(d);
        StateVerbs.register(d);
        return d;
    }

    public IntentDispatcher register(Verb verb, IntentHandler handler) {
        if (handlers.containsKey(verb)) {
            throw new IllegalStateException("Handler already registered for " + verb.keyword);
        }
        handlers.put(verb, handler);
        return this;
    }

    public Set<Verb> verbs() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    /** Runs the handler for the intent's verb. Core errors come back as failed results. */
    public IntentResult dispatch(Session session, Intent intent) {
        IntentHandler handler = handlers.get(intent.verb());
        if (handler == null) return IntentResult.failure("No handler for verb: " + intent.verb().keyword);
        try {
            return handler.handle(session, intent);
        } catch (MorrisError e) {
            Debug.get().d(TAG, intent + " failed: " + e.describe());
            return IntentResult.failure(e.describe());
        } catch (IllegalArgumentException e) {
            Debug.get().d(TAG, intent + " rejected: " + e.getMessage());
            return IntentResult.failure("Invalid intent: " + e.getMessage());
        }
    }
}
