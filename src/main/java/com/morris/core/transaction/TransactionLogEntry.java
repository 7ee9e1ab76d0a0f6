package com.morris.core.transaction;

import java.time.Instant;
import java.util.UUID;

/** Archived summary of a finished transaction. */
public final class TransactionLogEntry {

    public final UUID id;
    public final String name;
    public final TransactionState state;
    public final int changeCount;
    public final Instant startedAt;
    public final Instant endedAt;

    TransactionLogEntry(Transaction tx) {
        this.id = tx.id();
        this.name = tx.name();
        this.state = tx.state();
        this.changeCount = tx.changeCount();
        this.startedAt = tx.createdAt();
        this.endedAt = tx.endedAt();
    }

    @Override
    public String toString() {
        return state + " " + (name == null ? "unnamed" : name) + " @ " + startedAt + " (" + changeCount + " changes)";
    }
}
