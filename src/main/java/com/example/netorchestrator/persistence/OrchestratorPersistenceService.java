package com.example.netorchestrator.persistence;

import com.example.netorchestrator.model.NodeState;
import com.example.netorchestrator.model.TelemetryMetrics;
import com.example.netorchestrator.service.DeploymentNotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Store for deployments, nodes, telemetry and audit events.
 * Every mutating method is one transaction: it lands completely or not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrchestratorPersistenceService {

    private final DeploymentRepository deploymentRepository;
    private final NodeRepository nodeRepository;
    private final TelemetrySampleRepository sampleRepository;
    private final EventRepository eventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // ==================== Deployments ====================

    /**
     * Create a deployment with {@code targetNodeCount} PENDING nodes and its creation event.
     */
    @Transactional
    public DeploymentEntity createDeployment(String name, String description, int targetNodeCount) {
        Instant now = clock.instant();
        DeploymentEntity deployment = deploymentRepository.save(
            new DeploymentEntity(null, name, description, targetNodeCount, now, now));

        List<NodeEntity> nodes = new ArrayList<>(targetNodeCount);
        for (int i = 1; i <= targetNodeCount; i++) {
            nodes.add(new NodeEntity(
                null,
                deployment.getId(),
                String.format("node-%03d", i),
                NodeState.PENDING,
                String.format("switch-%d-%03d", deployment.getId(), i),
                null,
                now,
                now,
                now
            ));
        }
        nodeRepository.saveAll(nodes);

        eventRepository.save(new EventEntity(
            null,
            deployment.getId(),
            null,
            EventEntity.EventType.DEPLOYMENT_CREATED,
            String.format("Deployment '%s' created with %d nodes", name, targetNodeCount),
            null,
            now
        ));

        log.info("Created deployment {} ('{}') with {} nodes", deployment.getId(), name, targetNodeCount);
        return deployment;
    }

    public Optional<DeploymentEntity> findDeployment(Long deploymentId) {
        return deploymentRepository.findById(deploymentId);
    }

    public DeploymentEntity requireDeployment(Long deploymentId) {
        return deploymentRepository.findById(deploymentId)
            .orElseThrow(() -> new DeploymentNotFoundException(deploymentId));
    }

    /**
     * Deployments, most recent first.
     */
    public List<DeploymentEntity> listDeployments(int skip, int limit) {
        return deploymentRepository.findAll(new OffsetPageRequest(skip, limit, Sort.by(Sort.Direction.DESC, "id")))
            .getContent();
    }

    public long countDeployments() {
        return deploymentRepository.count();
    }

    public long countNodes(Long deploymentId) {
        return nodeRepository.countByDeploymentId(deploymentId);
    }

    /**
     * Delete a deployment together with its nodes, samples and events.
     */
    @Transactional
    public void deleteDeployment(Long deploymentId) {
        DeploymentEntity deployment = requireDeployment(deploymentId);

        sampleRepository.deleteByDeploymentId(deploymentId);
        eventRepository.deleteByDeploymentId(deploymentId);
        nodeRepository.deleteByDeploymentId(deploymentId);
        deploymentRepository.delete(deployment);

        log.info("Deleted deployment {} ('{}')", deploymentId, deployment.getName());
    }

    // ==================== Nodes ====================

    public List<NodeEntity> findNodesByDeployment(Long deploymentId) {
        return nodeRepository.findByDeploymentIdOrderByIdAsc(deploymentId);
    }

    public List<NodeEntity> findNodesInStates(Collection<NodeState> states) {
        return nodeRepository.findByStateInOrderByIdAsc(states);
    }

    public Optional<NodeEntity> findNode(Long nodeId) {
        return nodeRepository.findById(nodeId);
    }

    /**
     * Move a node from {@code expected} to {@code target} and append the STATE_CHANGE event.
     * Returns empty when the node is gone or no longer in {@code expected}, which makes a repeated
     * evaluation of the same node harmless.
     *
     * @param ipAddress address to assign, or null to leave the current one untouched
     * @throws IllegalStateException if the state machine has no edge from {@code expected} to {@code target}
     */
    @Transactional
    public Optional<NodeEntity> transitionNode(Long nodeId, NodeState expected, NodeState target,
                                               String message, String ipAddress) {
        if (!expected.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal transition " + expected + " -> " + target);
        }

        Optional<NodeEntity> found = nodeRepository.findById(nodeId);
        if (found.isEmpty()) {
            log.debug("Node {} disappeared before transition to {}", nodeId, target);
            return Optional.empty();
        }

        NodeEntity node = found.get();
        if (node.getState() != expected) {
            log.debug("Node {} is {} rather than {}, skipping transition", nodeId, node.getState(), expected);
            return Optional.empty();
        }

        Instant now = clock.instant();
        node.setState(target);
        node.setStateChangedAt(now);
        node.setUpdatedAt(now);
        if (ipAddress != null && node.getIpAddress() == null) {
            node.setIpAddress(ipAddress);
        }
        NodeEntity saved = nodeRepository.save(node);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("old_state", expected.name());
        metadata.put("new_state", target.name());
        metadata.put("node_id", node.getNodeIdentifier());

        eventRepository.save(new EventEntity(
            null,
            node.getDeploymentId(),
            node.getId(),
            EventEntity.EventType.STATE_CHANGE,
            message,
            toJson(metadata),
            now
        ));

        log.info("Node {} ({}) {} -> {}", node.getNodeIdentifier(), nodeId, expected, target);
        return Optional.of(saved);
    }

    // ==================== Telemetry ====================

    @Transactional
    public TelemetrySampleEntity appendSample(Long nodeId, Long deploymentId, TelemetryMetrics metrics, Instant timestamp) {
        TelemetrySampleEntity sample = sampleRepository.save(new TelemetrySampleEntity(
            null,
            nodeId,
            deploymentId,
            timestamp,
            metrics.getLatencyMs(),
            metrics.getThroughputGbps(),
            metrics.getErrorRate()
        ));
        log.debug("Persisted sample for node {}: latency={}ms, throughput={}Gbps, errors={}%",
                nodeId, metrics.getLatencyMs(), metrics.getThroughputGbps(), metrics.getErrorRate());
        return sample;
    }

    /**
     * Samples of a deployment with {@code from <= timestamp <= to}, unordered.
     */
    public List<TelemetrySampleEntity> findSamplesInWindow(Long deploymentId, Instant from, Instant to) {
        return sampleRepository.findByDeploymentIdAndTimestampBetween(deploymentId, from, to);
    }

    /**
     * Newest-first listing with optional node and time range filters.
     */
    public List<TelemetrySampleEntity> searchSamples(Long deploymentId, Long nodeId,
                                                     Instant startTime, Instant endTime, int limit) {
        Specification<TelemetrySampleEntity> filter = (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("deploymentId"), deploymentId));
            if (nodeId != null) {
                predicates.add(cb.equal(root.get("nodeId"), nodeId));
            }
            if (startTime != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("timestamp"), startTime));
            }
            if (endTime != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("timestamp"), endTime));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };

        Sort newestFirst = Sort.by(Sort.Direction.DESC, "timestamp").and(Sort.by(Sort.Direction.DESC, "id"));
        return sampleRepository.findAll(filter, PageRequest.of(0, limit, newestFirst)).getContent();
    }

    // ==================== Events ====================

    public List<EventEntity> findEvents(Long deploymentId) {
        return eventRepository.findByDeploymentIdOrderByIdAsc(deploymentId);
    }

    public List<EventEntity> findNodeEvents(Long nodeId) {
        return eventRepository.findByNodeIdOrderByIdAsc(nodeId);
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event metadata", e);
        }
    }
}
