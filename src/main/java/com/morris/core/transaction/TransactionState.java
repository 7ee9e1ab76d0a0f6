package com.morris.core.transaction;

import java.util.Objects;

/**
 * Crafting -> (Tempered)* -> Forged | Smelted | Quenched.
 * Annealing(step) is entered by staged commits and is still non-terminal.
 */
public final class TransactionState {

    public enum Kind { CRAFTING, TEMPERED, ANNEALING, FORGED, SMELTED, QUENCHED }

    public static final TransactionState CRAFTING = new TransactionState(Kind.CRAFTING, 0);
    public static final TransactionState TEMPERED = new TransactionState(Kind.TEMPERED, 0);
    public static final TransactionState FORGED = new TransactionState(Kind.FORGED, 0);
    public static final TransactionState SMELTED = new TransactionState(Kind.SMELTED, 0);
    public static final TransactionState QUENCHED = new TransactionState(Kind.QUENCHED, 0);

    private final Kind kind;
    private final int step;

    private TransactionState(Kind kind, int step) {
        this.kind = kind;
        this.step = step;
    }

    public static TransactionState annealing(int step) {
        return new TransactionState(Kind.ANNEALING, step);
    }

    public Kind kind() { return kind; }

    /** Annealing step; 0 for every other state. */
    public int step() { return step; }

    public boolean isTerminal() {
        return kind == Kind.FORGED || kind == Kind.SMELTED || kind == Kind.QUENCHED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransactionState)) return false;
        TransactionState other = (TransactionState) o;
        return kind == other.kind && step == other.step;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, step);
    }

    @Override
    public String toString() {
        String n = kind.name().charAt(0) + kind.name().substring(1).toLowerCase(java.util.Locale.ROOT);
        return kind == Kind.ANNEALING ? n + "(step " + step + ")" : n;
    }
}
