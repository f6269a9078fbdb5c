package com.example.netorchestrator.service;

import com.example.netorchestrator.config.OrchestratorConfig;
import com.example.netorchestrator.model.NodeState;
import com.example.netorchestrator.model.TelemetryMetrics;
import com.example.netorchestrator.persistence.NodeEntity;
import com.example.netorchestrator.persistence.OrchestratorPersistenceService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Writes one synthetic telemetry sample per RUNNING node per cycle.
 */
@Service
@Slf4j
public class TelemetryGenerator extends PeriodicTask {

    private final OrchestratorConfig config;
    private final OrchestratorPersistenceService store;
    private final Clock clock;

    public TelemetryGenerator(OrchestratorConfig config, OrchestratorPersistenceService store, Clock clock) {
        super("telemetry-generator",
            config.getTelemetry().getInterval(),
            config.getTelemetry().getBackoff(),
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
        List<NodeEntity> running = store.findNodesInStates(EnumSet.of(NodeState.RUNNING));
        Instant now = clock.instant();

        int written = 0;
        for (NodeEntity node : running) {
            try {
                TelemetryMetrics metrics = TelemetryWaveform.sample(node.getId(), now.getEpochSecond());
                store.appendSample(node.getId(), node.getDeploymentId(), metrics, now);
                written++;
            } catch (Exception e) {
                log.warn("Failed to record telemetry for node {} (id={}): {}",
                        node.getNodeIdentifier(), node.getId(), e.getMessage(), e);
            }
        }

        if (written > 0) {
            log.debug("Telemetry cycle wrote {} samples for {} running nodes", written, running.size());
        }
    }
}
