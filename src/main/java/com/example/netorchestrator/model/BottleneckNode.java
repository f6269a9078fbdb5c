package com.example.netorchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A node whose averaged metrics deviate from the deployment baseline.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BottleneckNode {
    private Long nodeId;
    private String nodeIdentifier;
    private Long deploymentId;

    private double latencyMs;
    private double throughputGbps;
    private double errorRate;

    /**
     * Weighted sum of the positive per-metric z-scores, used for ranking.
     */
    private double deviationScore;

    /**
     * Timestamp of the newest sample that went into the averages.
     */
    private Instant timestamp;
}
