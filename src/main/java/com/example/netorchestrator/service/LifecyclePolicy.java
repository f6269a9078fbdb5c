package com.example.netorchestrator.service;

import com.example.netorchestrator.model.NodeState;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Deterministic timing and outcome rules for the node state machine.
 * <p>
 * Everything here is a pure function of the node's numeric id and deployment id, so replaying a
 * simulation over the same data reproduces the same timings and the same failed nodes. The mappings
 * are part of the contract:
 * <ul>
 *   <li>PROVISIONING lasts {@code 3 + (id mod 5)} seconds</li>
 *   <li>CONFIGURING lasts {@code 5 + (id mod 7)} seconds</li>
 *   <li>configuration fails when {@code (id + deploymentId) mod 20 == 0}</li>
 *   <li>the address is {@code 10.<deploymentId mod 256>.<(id >> 8) & 255>.<id & 255>}</li>
 * </ul>
 */
public final class LifecyclePolicy {

    private LifecyclePolicy() {
    }

    public static Duration provisioningDuration(long nodeId) {
        return Duration.ofSeconds(3 + Math.floorMod(nodeId, 5));
    }

    public static Duration configuringDuration(long nodeId) {
        return Duration.ofSeconds(5 + Math.floorMod(nodeId, 7));
    }

    public static boolean failsConfiguration(long nodeId, long deploymentId) {
        return Math.floorMod(nodeId + deploymentId, 20) == 0;
    }

    /**
     * Simulated management address. Distinct for any two nodes of a deployment whose ids differ by less than 65536.
     */
    public static String ipAddress(long deploymentId, long nodeId) {
        return String.format("10.%d.%d.%d",
            Math.floorMod(deploymentId, 256),
            (nodeId >> 8) & 0xFF,
            nodeId & 0xFF);
    }

    /**
     * Time a node must spend in {@code state} before it may leave it.
     */
    public static Duration requiredDuration(NodeState state, long nodeId) {
        return switch (state) {
            case PENDING -> Duration.ZERO;
            case PROVISIONING -> provisioningDuration(nodeId);
            case CONFIGURING -> configuringDuration(nodeId);
            case RUNNING, FAILED -> throw new IllegalArgumentException(state + " is terminal");
        };
    }

    /**
     * The state a node should move to at {@code now}, or empty if it must stay where it is.
     */
    public static Optional<NodeState> nextState(long nodeId, long deploymentId, NodeState state,
                                                Instant stateChangedAt, Instant now) {
        if (state.isTerminal()) {
            return Optional.empty();
        }
        if (state == NodeState.PENDING) {
            return Optional.of(NodeState.PROVISIONING);
        }

        Duration elapsed = Duration.between(stateChangedAt, now);
        if (elapsed.compareTo(requiredDuration(state, nodeId)) < 0) {
            return Optional.empty();
        }

        return switch (state) {
            case PROVISIONING -> Optional.of(NodeState.CONFIGURING);
            case CONFIGURING -> Optional.of(failsConfiguration(nodeId, deploymentId)
                ? NodeState.FAILED
                : NodeState.RUNNING);
            default -> Optional.empty();
        };
    }
}
