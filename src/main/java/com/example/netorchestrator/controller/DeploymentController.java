package com.example.netorchestrator.controller;

import com.example.netorchestrator.model.BottleneckReport;
import com.example.netorchestrator.model.DeploymentDetail;
import com.example.netorchestrator.model.DeploymentRequest;
import com.example.netorchestrator.persistence.DeploymentEntity;
import com.example.netorchestrator.persistence.EventEntity;
import com.example.netorchestrator.persistence.NodeEntity;
import com.example.netorchestrator.persistence.OrchestratorPersistenceService;
import com.example.netorchestrator.persistence.TelemetrySampleEntity;
import com.example.netorchestrator.service.BottleneckDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for deployments, their nodes, telemetry, audit events and bottleneck analysis.
 */
@RestController
@RequestMapping("/deployments")
@RequiredArgsConstructor
@Slf4j
public class DeploymentController {

    static final int MAX_NODES = 1000;
    static final int MAX_LIMIT = 1000;
    static final int MAX_WINDOW_MINUTES = 60;

    private final OrchestratorPersistenceService store;
    private final BottleneckDetector bottleneckDetector;

    @PostMapping
    public ResponseEntity<?> createDeployment(@RequestBody DeploymentRequest request) {
        String name = request.getName();
        if (name == null || name.trim().isEmpty() || name.length() > 255) {
            return badRequest("name must be between 1 and 255 characters");
        }
        Integer count = request.getTargetNodeCount();
        if (count == null || count < 1 || count > MAX_NODES) {
            return badRequest("target_node_count must be between 1 and " + MAX_NODES);
        }

        log.debug("Creating deployment '{}' with {} nodes", name, count);
        DeploymentEntity deployment = store.createDeployment(name, request.getDescription(), count);
        return ResponseEntity.status(HttpStatus.CREATED).body(deployment);
    }

    @GetMapping
    public ResponseEntity<?> listDeployments(@RequestParam(defaultValue = "0") int skip,
                                             @RequestParam(defaultValue = "100") int limit) {
        if (skip < 0) {
            return badRequest("skip must not be negative");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            return badRequest("limit must be between 1 and " + MAX_LIMIT);
        }
        return ResponseEntity.ok(store.listDeployments(skip, limit));
    }

    @GetMapping("/{deploymentId}")
    public ResponseEntity<DeploymentDetail> getDeployment(@PathVariable Long deploymentId) {
        DeploymentEntity deployment = store.requireDeployment(deploymentId);
        return ResponseEntity.ok(new DeploymentDetail(deployment, store.countNodes(deploymentId)));
    }

    @DeleteMapping("/{deploymentId}")
    public ResponseEntity<Void> deleteDeployment(@PathVariable Long deploymentId) {
        store.deleteDeployment(deploymentId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{deploymentId}/nodes")
    public ResponseEntity<Map<String, Object>> getNodes(@PathVariable Long deploymentId) {
        store.requireDeployment(deploymentId);
        List<NodeEntity> nodes = store.findNodesByDeployment(deploymentId);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("nodes", nodes);
        response.put("total", nodes.size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{deploymentId}/telemetry")
    public ResponseEntity<?> getTelemetry(@PathVariable Long deploymentId,
                                          @RequestParam(name = "node_id", required = false) Long nodeId,
                                          @RequestParam(name = "start_time", required = false) String startTime,
                                          @RequestParam(name = "end_time", required = false) String endTime,
                                          @RequestParam(defaultValue = "100") int limit) {
        store.requireDeployment(deploymentId);
        if (limit < 1 || limit > MAX_LIMIT) {
            return badRequest("limit must be between 1 and " + MAX_LIMIT);
        }

        List<TelemetrySampleEntity> samples = store.searchSamples(
            deploymentId, nodeId, parseInstant("start_time", startTime), parseInstant("end_time", endTime), limit);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("samples", samples);
        response.put("total", samples.size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{deploymentId}/events")
    public ResponseEntity<Map<String, Object>> getEvents(@PathVariable Long deploymentId) {
        store.requireDeployment(deploymentId);
        List<EventEntity> events = store.findEvents(deploymentId);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("events", events);
        response.put("total", events.size());
        return ResponseEntity.ok(response);
    }

    /**
     * Detect bottlenecks from the telemetry of the last {@code analysis_window_minutes}.
     */
    @GetMapping("/{deploymentId}/bottlenecks")
    public ResponseEntity<?> getBottlenecks(@PathVariable Long deploymentId,
                                            @RequestParam(name = "analysis_window_minutes", defaultValue = "10") int windowMinutes,
                                            @RequestParam(required = false) Double threshold) {
        if (windowMinutes < 1 || windowMinutes > MAX_WINDOW_MINUTES) {
            return badRequest("analysis_window_minutes must be between 1 and " + MAX_WINDOW_MINUTES);
        }
        if (threshold != null && !(threshold > 0)) {
            return badRequest("threshold must be positive");
        }

        Duration window = Duration.ofMinutes(windowMinutes);
        BottleneckReport report = threshold != null
            ? bottleneckDetector.detect(deploymentId, window, threshold)
            : bottleneckDetector.detect(deploymentId, window);
        return ResponseEntity.ok(report);
    }

    /**
     * Accepts ISO-8601 instants ({@code 2024-01-01T10:00:00Z}) and zone-less local date-times, read as UTC.
     */
    static Instant parseInstant(String parameter, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException nested) {
                throw new IllegalArgumentException(parameter + " is not an ISO-8601 timestamp: " + value, nested);
            }
        }
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String detail) {
        return ResponseEntity.badRequest().body(Map.of("detail", detail));
    }
}
