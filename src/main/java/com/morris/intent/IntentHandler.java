package com.morris.intent;

@FunctionalInterface
public interface IntentHandler {
    IntentResult handle(Session session, Intent intent);
}
