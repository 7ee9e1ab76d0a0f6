package com.morris.core.transaction;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.morris.core.env.Variable;

/**
 * Pending edits plus the full environment snapshot taken at craft time.
 * Edits to the same name collapse into one change that keeps the craft-time old value.
 */
public final class Transaction {

    private final UUID id;
    private final String name;
    private final Instant createdAt;
    private final Map<String, Variable> snapshot;
    private final Map<String, ValueChange> changes = new LinkedHashMap<>();
    private final List<String> propagationLog = new ArrayList<>();

    private TransactionState state = TransactionState.CRAFTING;
    private Instant endedAt;

    Transaction(String name, Map<String, Variable> snapshot, Instant createdAt) {
        this.id = UUID.randomUUID();
        this.name = name;
        this.snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(snapshot));
        this.createdAt = createdAt;
    }

    public UUID id() { return id; }
    public String name() { return name; }
    public Instant createdAt() { return createdAt; }
    public Instant endedAt() { return endedAt; }
    public TransactionState state() { return state; }

    public Map<String, ValueChange> changes() {
        return Collections.unmodifiableMap(changes);
    }

    public ValueChange change(String variable) {
        return changes.get(variable);
    }

    public int changeCount() {
        return changes.size();
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    /** Records as they were when the transaction was crafted. */
    public Map<String, Variable> snapshot() {
        return snapshot;
    }

    public List<String> propagationLog() {
        return Collections.unmodifiableList(propagationLog);
    }

    void record(ValueChange change) {
        ValueChange earlier = changes.get(change.variable);
        changes.put(change.variable, earlier == null ? change : change.withOldValue(earlier.oldValue));
    }

    void removeChange(String variable) {
        changes.remove(variable);
    }

    void logPropagation(String line) {
        propagationLog.add(line);
    }

    void setState(TransactionState state) {
        this.state = state;
    }

    void end(TransactionState terminal, Instant at) {
        this.state = terminal;
        this.endedAt = at;
    }

    /** Multi-line summary: id, name, state, age and every pending change. */
    public String describe(Instant now) {
        StringBuilder sb = new StringBuilder();
        sb.append("Transaction ").append(id).append('\n');
        if (name != null) sb.append("  Name: ").append(name).append('\n');
        sb.append("  State: ").append(state).append('\n');
        sb.append("  Elapsed: ").append(Duration.between(createdAt, now).toMillis()).append("ms\n");
        sb.append("  Changes: ").append(changes.size()).append('\n');
        int i = 1;
        for (ValueChange c : changes.values()) {
            sb.append(String.format("    %2d. %s%n", i++, c.describe()));
            if (!c.dependencies.isEmpty()) {
                sb.append("        depends on: ").append(String.join(", ", c.dependencies)).append('\n');
            }
        }
        return sb.toString();
    }
}
