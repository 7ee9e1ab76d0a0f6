package com.morris.core;

import java.time.Clock;
import java.time.Duration;
import java.util.Properties;

import com.morris.core.propagation.PropagationStrategy;

/**
 * Engine options. Immutable; every withX returns a modified copy.
 *
 * <pre>
 * MorrisConfig cfg = MorrisConfig.defaults()
 *         .withPropagationStrategy(PropagationStrategy.batched(5))
 *         .withMaxVariables(500);
 * </pre>
 */
public final class MorrisConfig {

    public static final String PREFIX = "morris.";

    private final PropagationStrategy propagationStrategy;
    private final int propagationHistoryLimit;
    private final int transactionLogLimit;
    private final int maxNestedTransactions;
    private final int maxVariables;
    private final boolean propagateOnAnneal;
    private final Clock clock;

    private MorrisConfig(PropagationStrategy propagationStrategy, int propagationHistoryLimit,
                         int transactionLogLimit, int maxNestedTransactions, int maxVariables,
                         boolean propagateOnAnneal, Clock clock) {
        this.propagationStrategy = propagationStrategy;
        this.propagationHistoryLimit = propagationHistoryLimit;
        this.transactionLogLimit = transactionLogLimit;
        this.maxNestedTransactions = maxNestedTransactions;
        this.maxVariables = maxVariables;
        this.propagateOnAnneal = propagateOnAnneal;
        this.clock = clock;
    }

    public static MorrisConfig defaults() {
        return new MorrisConfig(PropagationStrategy.immediate(), 1000, 1000, 10, 10_000, true, Clock.systemUTC());
    }

    /**
     * Reads {@code morris.*} keys over the defaults. Recognised keys:
     * propagation.strategy (immediate|debounced|batched|lazy), propagation.debounceMs,
     * propagation.batchSize, propagation.historyLimit, transaction.logLimit,
     * transaction.maxNested, maxVariables, anneal.propagate.
     */
    public static MorrisConfig fromProperties(Properties props) {
        MorrisConfig cfg = defaults();
        if (props == null) return cfg;

        String mode = props.getProperty(PREFIX + "propagation.strategy");
        if (mode != null) {
            long ms = longProp(props, "propagation.debounceMs", 100);
            int count = intProp(props, "propagation.batchSize", 10);
            cfg = cfg.withPropagationStrategy(PropagationStrategy.parse(mode, Duration.ofMillis(ms), count));
        }
        cfg = cfg.withPropagationHistoryLimit(intProp(props, "propagation.historyLimit", cfg.propagationHistoryLimit));
        cfg = cfg.withTransactionLogLimit(intProp(props, "transaction.logLimit", cfg.transactionLogLimit));
        cfg = cfg.withMaxNestedTransactions(intProp(props, "transaction.maxNested", cfg.maxNestedTransactions));
        cfg = cfg.withMaxVariables(intProp(props, "maxVariables", cfg.maxVariables));

        String anneal = props.getProperty(PREFIX + "anneal.propagate");
        if (anneal != null) cfg = cfg.withPropagateOnAnneal(Boolean.parseBoolean(anneal.trim()));
        return cfg;
    }

    public MorrisConfig withPropagationStrategy(PropagationStrategy strategy) {
        if (strategy == null) throw new IllegalArgumentException("propagationStrategy must not be null");
        return new MorrisConfig(strategy, propagationHistoryLimit, transactionLogLimit,
                maxNestedTransactions, maxVariables, propagateOnAnneal, clock);
    }

    public MorrisConfig withPropagationHistoryLimit(int limit) {
        return new MorrisConfig(propagationStrategy, positive("propagationHistoryLimit", limit), transactionLogLimit,
                maxNestedTransactions, maxVariables, propagateOnAnneal, clock);
    }

    public MorrisConfig withTransactionLogLimit(int limit) {
        return new MorrisConfig(propagationStrategy, propagationHistoryLimit, positive("transactionLogLimit", limit),
                maxNestedTransactions, maxVariables, propagateOnAnneal, clock);
    }

    public MorrisConfig withMaxNestedTransactions(int limit) {
        return new MorrisConfig(propagationStrategy, propagationHistoryLimit, transactionLogLimit,
                positive("maxNestedTransactions", limit), maxVariables, propagateOnAnneal, clock);
    }

    public MorrisConfig withMaxVariables(int limit) {
        return new MorrisConfig(propagationStrategy, propagationHistoryLimit, transactionLogLimit,
                maxNestedTransactions, positive("maxVariables", limit), propagateOnAnneal, clock);
    }

    public MorrisConfig withPropagateOnAnneal(boolean propagate) {
        return new MorrisConfig(propagationStrategy, propagationHistoryLimit, transactionLogLimit,
                maxNestedTransactions, maxVariables, propagate, clock);
    }

    /** Clock used for timestamps and the debounce window. */
    public MorrisConfig withClock(Clock clock) {
        if (clock == null) throw new IllegalArgumentException("clock must not be null");
        return new MorrisConfig(propagationStrategy, propagationHistoryLimit, transactionLogLimit,
                maxNestedTransactions, maxVariables, propagateOnAnneal, clock);
    }

    public PropagationStrategy propagationStrategy() { return propagationStrategy; }
    public int propagationHistoryLimit() { return propagationHistoryLimit; }
    public int transactionLogLimit() { return transactionLogLimit; }
    public int maxNestedTransactions() { return maxNestedTransactions; }
    public int maxVariables() { return maxVariables; }
    public boolean propagateOnAnneal() { return propagateOnAnneal; }
    public Clock clock() { return clock; }

    private static int positive(String name, int v) {
        if (v <= 0) throw new IllegalArgumentException(name + " must be > 0, got " + v);
        return v;
    }

    private static int intProp(Properties props, String key, int fallback) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + raw, e);
        }
    }

    private static long longProp(Properties props, String key, long fallback) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null) return fallback;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + raw, e);
        }
    }
}
