package com.example.netorchestrator.service;

import com.example.netorchestrator.config.OrchestratorConfig;
import com.example.netorchestrator.model.NodeState;
import com.example.netorchestrator.persistence.NodeEntity;
import com.example.netorchestrator.persistence.OrchestratorPersistenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for LifecycleScheduler.
 * Covers transition eligibility, address assignment, failure injection and per-node error isolation.
 */
class LifecycleSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private LifecycleScheduler scheduler;
    private OrchestratorPersistenceService store;

    @BeforeEach
    void setUp() {
        OrchestratorConfig config = new OrchestratorConfig();
        config.getWorkers().setAutoStart(false);

        store = Mockito.mock(OrchestratorPersistenceService.class);
        when(store.transitionNode(anyLong(), any(), any(), anyString(), any()))
            .thenAnswer(invocation -> Optional.of(new NodeEntity()));

        scheduler = new LifecycleScheduler(config, store, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testPendingNodeStartsProvisioningWithAddress() {
        NodeEntity node = node(9L, 1L, NodeState.PENDING, NOW);

        assertTrue(scheduler.advance(node, NOW));

        verify(store).transitionNode(9L, NodeState.PENDING, NodeState.PROVISIONING,
            "Starting hardware provisioning for node-009", "10.1.0.9");
    }

    @Test
    void testProvisioningNodeWaitsUntilEligible() {
        // node 9 provisions for 7 seconds
        NodeEntity node = node(9L, 1L, NodeState.PROVISIONING, NOW.minusSeconds(6));

        assertFalse(scheduler.advance(node, NOW));

        verify(store, never()).transitionNode(anyLong(), any(), any(), anyString(), any());
    }

    @Test
    void testProvisioningNodeMovesToConfiguringWithoutNewAddress() {
        NodeEntity node = node(9L, 1L, NodeState.PROVISIONING, NOW.minusSeconds(7));

        assertTrue(scheduler.advance(node, NOW));

        verify(store).transitionNode(eq(9L), eq(NodeState.PROVISIONING), eq(NodeState.CONFIGURING),
            contains("starting configuration"), isNull());
    }

    @Test
    void testFailureSubsetEndsFailed() {
        // (19 + 1) mod 20 == 0, configuring lasts 10 seconds
        NodeEntity failing = node(19L, 1L, NodeState.CONFIGURING, NOW.minusSeconds(10));
        NodeEntity healthy = node(20L, 1L, NodeState.CONFIGURING, NOW.minusSeconds(11));

        assertTrue(scheduler.advance(failing, NOW));
        assertTrue(scheduler.advance(healthy, NOW));

        verify(store).transitionNode(19L, NodeState.CONFIGURING, NodeState.FAILED,
            "Configuration failed for node-019", null);
        verify(store).transitionNode(20L, NodeState.CONFIGURING, NodeState.RUNNING,
            "Node node-020 is now running", null);
    }

    @Test
    void testStaleStateIsNotCountedAsTransition() {
        when(store.transitionNode(anyLong(), any(), any(), anyString(), any())).thenReturn(Optional.empty());

        assertFalse(scheduler.advance(node(4L, 1L, NodeState.PENDING, NOW), NOW));
    }

    @Test
    void testCycleQueriesOnlyInFlightNodes() {
        when(store.findNodesInStates(NodeState.inFlight())).thenReturn(List.of());

        scheduler.runCycle();

        verify(store).findNodesInStates(NodeState.inFlight());
        verifyNoMoreInteractions(store);
    }

    @Test
    void testFailingNodeDoesNotStopCycle() {
        NodeEntity broken = node(1L, 1L, NodeState.PENDING, NOW);
        NodeEntity fine = node(2L, 1L, NodeState.PENDING, NOW);
        when(store.findNodesInStates(NodeState.inFlight())).thenReturn(List.of(broken, fine));
        when(store.transitionNode(eq(1L), any(), any(), anyString(), any()))
            .thenThrow(new IllegalStateException("database unavailable"));

        assertDoesNotThrow(() -> scheduler.runCycle());

        verify(store).transitionNode(eq(2L), eq(NodeState.PENDING), eq(NodeState.PROVISIONING), anyString(), eq("10.1.0.2"));
    }

    @Test
    void testSameInputsGiveSameTransitions() {
        List<NodeEntity> nodes = List.of(
            node(5L, 2L, NodeState.PROVISIONING, NOW.minusSeconds(3)),
            node(6L, 2L, NodeState.PROVISIONING, NOW.minusSeconds(3)),
            node(18L, 2L, NodeState.CONFIGURING, NOW.minusSeconds(9)),
            node(40L, 2L, NodeState.CONFIGURING, NOW.minusSeconds(10)));

        for (int run = 0; run < 2; run++) {
            for (NodeEntity node : nodes) {
                scheduler.advance(node, NOW);
            }
        }

        verify(store, times(2)).transitionNode(eq(5L), any(), eq(NodeState.CONFIGURING), anyString(), isNull());
        verify(store, never()).transitionNode(eq(6L), any(), any(), anyString(), any());
        verify(store, times(2)).transitionNode(eq(18L), any(), eq(NodeState.FAILED), anyString(), isNull());
        verify(store, times(2)).transitionNode(eq(40L), any(), eq(NodeState.RUNNING), anyString(), isNull());
    }

    private static NodeEntity node(Long id, Long deploymentId, NodeState state, Instant stateChangedAt) {
        NodeEntity node = new NodeEntity();
        node.setId(id);
        node.setDeploymentId(deploymentId);
        node.setNodeIdentifier(String.format("node-%03d", id));
        node.setState(state);
        node.setCreatedAt(stateChangedAt);
        node.setUpdatedAt(stateChangedAt);
        node.setStateChangedAt(stateChangedAt);
        return node;
    }
}
