package com.example.netorchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a provisioned node.
 * PENDING -> PROVISIONING -> CONFIGURING -> RUNNING or FAILED
 */
public enum NodeState {
    PENDING,
    PROVISIONING,
    CONFIGURING,
    RUNNING,
    FAILED;

    public boolean isTerminal() {
        return this == RUNNING || this == FAILED;
    }

    /**
     * Returns true if the state machine has an edge from this state to {@code target}.
     */
    public boolean canTransitionTo(NodeState target) {
        return switch (this) {
            case PENDING -> target == PROVISIONING;
            case PROVISIONING -> target == CONFIGURING;
            case CONFIGURING -> target == RUNNING || target == FAILED;
            case RUNNING, FAILED -> false;
        };
    }

    /**
     * States the lifecycle scheduler still has work to do for.
     */
    public static Set<NodeState> inFlight() {
        return EnumSet.of(PENDING, PROVISIONING, CONFIGURING);
    }
}
