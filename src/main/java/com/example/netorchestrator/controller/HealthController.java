package com.example.netorchestrator.controller;

import com.example.netorchestrator.persistence.OrchestratorPersistenceService;
import com.example.netorchestrator.service.LifecycleScheduler;
import com.example.netorchestrator.service.TelemetryGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check for monitoring and load balancers: database reachability and worker liveness.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;
    private final OrchestratorPersistenceService store;
    private final LifecycleScheduler lifecycleScheduler;
    private final TelemetryGenerator telemetryGenerator;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseHealthy = isDatabaseHealthy();
        long deployments = 0;
        if (databaseHealthy) {
            try {
                deployments = store.countDeployments();
            } catch (Exception e) {
                log.warn("Failed to count deployments for health check: {}", e.getMessage());
                databaseHealthy = false;
            }
        }

        boolean lifecycleAlive = lifecycleScheduler.isAlive();
        boolean telemetryAlive = telemetryGenerator.isAlive();
        boolean workersActive = lifecycleAlive && telemetryAlive;

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", databaseHealthy && workersActive ? "healthy" : "degraded");
        health.put("timestamp", clock.instant());
        health.put("database", databaseHealthy ? "healthy" : "unhealthy");
        health.put("active_deployments", deployments);
        health.put("lifecycle_worker", lifecycleAlive);
        health.put("telemetry_worker", telemetryAlive);
        health.put("active_workers", workersActive);
        return ResponseEntity.ok(health);
    }

    private boolean isDatabaseHealthy() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return true;
        } catch (Exception e) {
            log.warn("Database health probe failed: {}", e.getMessage());
            return false;
        }
    }
}
