package com.example.netorchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One reading of the three node metrics.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryMetrics {
    private double latencyMs;
    private double throughputGbps;

    /**
     * Percentage, 0-100.
     */
    private double errorRate;
}
