package com.example.netorchestrator.service;

import com.example.netorchestrator.config.OrchestratorConfig;
import com.example.netorchestrator.model.NodeState;
import com.example.netorchestrator.persistence.NodeEntity;
import com.example.netorchestrator.persistence.OrchestratorPersistenceService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Drives nodes through PENDING -> PROVISIONING -> CONFIGURING -> RUNNING/FAILED.
 * Each cycle looks only at nodes in non-terminal states and applies at most one transition per node,
 * each in its own transaction.
 */
@Service
@Slf4j
public class LifecycleScheduler extends PeriodicTask {

    private final OrchestratorConfig config;
    private final OrchestratorPersistenceService store;
    private final Clock clock;

    public LifecycleScheduler(OrchestratorConfig config, OrchestratorPersistenceService store, Clock clock) {
        super("lifecycle-scheduler",
            config.getLifecycle().getInterval(),
            config.getLifecycle().getBackoff(),
            config.getWorkers().getShutdownTimeout());
        this.config = config;
        this.store = store;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (config.getWorkers().isAutoStart()) {
            start();
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    @Override
    public void runCycle() {
        List<NodeEntity> nodes = store.findNodesInStates(NodeState.inFlight());
        Instant now = clock.instant();

        int advanced = 0;
        for (NodeEntity node : nodes) {
            try {
                if (advance(node, now)) {
                    advanced++;
                }
            } catch (Exception e) {
                log.warn("Failed to advance node {} (id={}) from {}: {}",
                        node.getNodeIdentifier(), node.getId(), node.getState(), e.getMessage(), e);
            }
        }

        if (advanced > 0) {
            log.debug("Lifecycle cycle advanced {} of {} in-flight nodes", advanced, nodes.size());
        }
    }

    /**
     * Apply the transition {@link LifecyclePolicy} allows at {@code now}, if any.
     *
     * @return true if a transition was committed
     */
    boolean advance(NodeEntity node, Instant now) {
        Optional<NodeState> next = LifecyclePolicy.nextState(
            node.getId(), node.getDeploymentId(), node.getState(), node.getStateChangedAt(), now);
        if (next.isEmpty()) {
            return false;
        }

        NodeState target = next.get();
        String ipAddress = node.getState() == NodeState.PENDING
            ? LifecyclePolicy.ipAddress(node.getDeploymentId(), node.getId())
            : null;

        return store.transitionNode(node.getId(), node.getState(), target, describe(node, target), ipAddress)
            .isPresent();
    }

    private static String describe(NodeEntity node, NodeState target) {
        return switch (target) {
            case PROVISIONING -> "Starting hardware provisioning for " + node.getNodeIdentifier();
            case CONFIGURING -> "Hardware provisioned, starting configuration for " + node.getNodeIdentifier();
            case RUNNING -> "Node " + node.getNodeIdentifier() + " is now running";
            case FAILED -> "Configuration failed for " + node.getNodeIdentifier();
            case PENDING -> throw new IllegalArgumentException("PENDING is never a transition target");
        };
    }
}
