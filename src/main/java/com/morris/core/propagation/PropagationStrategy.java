package com.morris.core.propagation;

import java.time.Duration;
import java.util.Locale;

/**
 * How a change reaches its dependents.
 *
 * IMMEDIATE recomputes the affected set on every write. DEBOUNCED and BATCHED write the value
 * right away but queue the recomputation; the queue drains on {@link PropagationEngine#flush()},
 * when a batch fills up, or (debounced) when a new change arrives after the quiet window.
 * LAZY only drains on flush. CONDITIONAL and TRANSACTIONAL behave like IMMEDIATE.
 */
public final class PropagationStrategy {

    public enum Kind { IMMEDIATE, DEBOUNCED, BATCHED, LAZY, CONDITIONAL, TRANSACTIONAL }

    private static final PropagationStrategy IMMEDIATE = new PropagationStrategy(Kind.IMMEDIATE, Duration.ZERO, 0);

    private final Kind kind;
    private final Duration window;
    private final int batchSize;

    private PropagationStrategy(Kind kind, Duration window, int batchSize) {
        this.kind = kind;
        this.window = window;
        this.batchSize = batchSize;
    }

    public static PropagationStrategy immediate() {
        return IMMEDIATE;
    }

    public static PropagationStrategy debounced(Duration window) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("Debounce window must be >= 0");
        }
        return new PropagationStrategy(Kind.DEBOUNCED, window, 0);
    }

    public static PropagationStrategy batched(int batchSize) {
        if (batchSize <= 0) throw new IllegalArgumentException("Batch size must be > 0, got " + batchSize);
        return new PropagationStrategy(Kind.BATCHED, Duration.ZERO, batchSize);
    }

    public static PropagationStrategy lazy() {
        return new PropagationStrategy(Kind.LAZY, Duration.ZERO, 0);
    }

    public static PropagationStrategy conditional() {
        return new PropagationStrategy(Kind.CONDITIONAL, Duration.ZERO, 0);
    }

    public static PropagationStrategy transactional() {
        return new PropagationStrategy(Kind.TRANSACTIONAL, Duration.ZERO, 0);
    }

    public static PropagationStrategy parse(String mode, Duration window, int batchSize) {
        String m = mode == null ? "" : mode.trim().toLowerCase(Locale.ROOT);
        switch (m) {
            case "immediate": return immediate();
            case "debounced":
            case "debounce": return debounced(window);
            case "batched":
            case "batch": return batched(batchSize);
            case "lazy": return lazy();
            case "conditional": return conditional();
            case "transactional": return transactional();
            default: throw new IllegalArgumentException("Unknown propagation strategy: " + mode);
        }
    }

    public Kind kind() { return kind; }
    public Duration window() { return window; }
    public int batchSize() { return batchSize; }

    /** True when recomputation waits in a queue. */
    public boolean isDeferred() {
        return kind == Kind.DEBOUNCED || kind == Kind.BATCHED || kind == Kind.LAZY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropagationStrategy)) return false;
        PropagationStrategy other = (PropagationStrategy) o;
        return kind == other.kind && batchSize == other.batchSize && window.equals(other.window);
    }

    @Override
    public int hashCode() {
        return (kind.hashCode() * 31 + window.hashCode()) * 31 + batchSize;
    }

    @Override
    public String toString() {
        switch (kind) {
            case DEBOUNCED: return "Debounced(" + window.toMillis() + "ms)";
            case BATCHED: return "Batched(" + batchSize + ")";
            default:
                String n = kind.name().toLowerCase(Locale.ROOT);
                return Character.toUpperCase(n.charAt(0)) + n.substring(1);
        }
    }
}
