package com.example.netorchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the NodeState state machine edges.
 */
class NodeStateTest {

    @Test
    void testAllowedEdges() {
        assertTrue(NodeState.PENDING.canTransitionTo(NodeState.PROVISIONING));
        assertTrue(NodeState.PROVISIONING.canTransitionTo(NodeState.CONFIGURING));
        assertTrue(NodeState.CONFIGURING.canTransitionTo(NodeState.RUNNING));
        assertTrue(NodeState.CONFIGURING.canTransitionTo(NodeState.FAILED));
    }

    @Test
    void testNoOtherEdges() {
        int allowed = 0;
        for (NodeState from : NodeState.values()) {
            for (NodeState to : NodeState.values()) {
                if (from.canTransitionTo(to)) {
                    allowed++;
                }
            }
        }
        assertEquals(4, allowed);

        assertFalse(NodeState.PENDING.canTransitionTo(NodeState.CONFIGURING));
        assertFalse(NodeState.PROVISIONING.canTransitionTo(NodeState.RUNNING));
        assertFalse(NodeState.CONFIGURING.canTransitionTo(NodeState.PENDING));
    }

    @Test
    void testTerminalStatesHaveNoExit() {
        for (NodeState target : NodeState.values()) {
            assertFalse(NodeState.RUNNING.canTransitionTo(target));
            assertFalse(NodeState.FAILED.canTransitionTo(target));
        }
        assertTrue(NodeState.RUNNING.isTerminal());
        assertTrue(NodeState.FAILED.isTerminal());
        assertFalse(NodeState.PENDING.isTerminal());
    }

    @Test
    void testInFlightExcludesTerminalStates() {
        Set<NodeState> inFlight = NodeState.inFlight();

        assertEquals(EnumSet.of(NodeState.PENDING, NodeState.PROVISIONING, NodeState.CONFIGURING), inFlight);
        inFlight.forEach(state -> assertFalse(state.isTerminal()));
    }
}
