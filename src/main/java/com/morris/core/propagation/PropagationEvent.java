package com.morris.core.propagation;

import java.time.Instant;
import java.util.List;

import com.morris.core.parser.Value;

/** One entry of the propagation history ring. */
public final class PropagationEvent {

    public final String variable;
    public final Value oldValue; // null when the variable was created by this write
    public final Value newValue;
    public final List<String> affected;
    public final Instant timestamp;

    public PropagationEvent(String variable, Value oldValue, Value newValue, List<String> affected, Instant timestamp) {
        this.variable = variable;
        this.oldValue = oldValue;
        this.newValue = newValue;
        this.affected = List.copyOf(affected);
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return variable + ": " + (oldValue == null ? "<new>" : oldValue.display()) + " -> " + newValue.display()
                + (affected.isEmpty() ? "" : " (affects " + String.join(", ", affected) + ")");
    }
}
