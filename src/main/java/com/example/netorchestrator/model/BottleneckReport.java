package com.example.netorchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Result of one bottleneck analysis over a deployment. Bottlenecks are ordered worst first.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BottleneckReport {
    private Long deploymentId;
    private Instant detectedAt;
    private List<BottleneckNode> bottlenecks;
    private int totalBottlenecks;
    private long analysisWindowMinutes;
    private double deviationThreshold;
}
