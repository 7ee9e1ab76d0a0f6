package com.morris.core.graph;

import java.time.Instant;

import com.morris.core.parser.Value;

public final class DependencyNode {

    private final String name;
    private Value value;
    private boolean constant;
    private Instant lastUpdated;
    private long updateCount;

    DependencyNode(String name, Value value, boolean constant, Instant created) {
        this.name = name;
        this.value = value;
        this.constant = constant;
        this.lastUpdated = created;
    }

    public String name() { return name; }
    public Value value() { return value; }
    public boolean isConstant() { return constant; }
    public Instant lastUpdated() { return lastUpdated; }
    public long updateCount() { return updateCount; }

    void update(Value v, Instant at) {
        this.value = v;
        this.lastUpdated = at;
        this.updateCount++;
    }

    void setValue(Value v) {
        this.value = v;
    }

    void setConstant(boolean constant) {
        this.constant = constant;
    }
}
