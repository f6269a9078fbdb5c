package com.example.netorchestrator.service;

import com.example.netorchestrator.model.TelemetryMetrics;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Synthetic metrics for a node at a given wall-clock second.
 * <p>
 * Nodes with {@code id mod 10 > 7} are bottleneck-prone and get clearly worse baselines; the rest
 * improve slightly with their offset. A slow sine wave, phase-shifted by node id, perturbs every
 * baseline by a fixed proportion. Results are clamped and rounded to two decimals.
 */
public final class TelemetryWaveform {

    public static final double MIN_LATENCY_MS = 1.0;
    public static final double MAX_LATENCY_MS = 200.0;
    public static final double MIN_THROUGHPUT_GBPS = 1.0;
    public static final double MAX_THROUGHPUT_GBPS = 10.0;
    public static final double MIN_ERROR_RATE = 0.0;
    public static final double MAX_ERROR_RATE = 5.0;

    private static final double TIME_SCALE = 100.0;
    private static final double WAVE_AMPLITUDE = 0.3;
    private static final double LATENCY_SWING = 0.2;
    private static final double THROUGHPUT_SWING = 0.1;
    private static final double ERROR_RATE_SWING = 0.1;

    private TelemetryWaveform() {
    }

    public static boolean isBottleneckProne(long nodeId) {
        return bucketOffset(nodeId) > 7;
    }

    /**
     * Unperturbed metrics for the node's bucket.
     */
    public static TelemetryMetrics baseline(long nodeId) {
        int factor = bucketOffset(nodeId);
        if (factor > 7) {
            int severity = factor - 7;
            return new TelemetryMetrics(
                50.0 + severity * 20.0,
                8.0 - severity * 1.5,
                0.5 + severity * 0.3);
        }
        return new TelemetryMetrics(
            10.0 + factor * 2.0,
            9.5 - factor * 0.1,
            0.1 + factor * 0.02);
    }

    public static TelemetryMetrics sample(long nodeId, long epochSecond) {
        TelemetryMetrics base = baseline(nodeId);
        double variation = Math.sin(epochSecond / TIME_SCALE + nodeId) * WAVE_AMPLITUDE;

        double latency = base.getLatencyMs() * (1.0 + variation * LATENCY_SWING);
        double throughput = base.getThroughputGbps() * (1.0 + variation * THROUGHPUT_SWING);
        double errorRate = Math.max(0.0, base.getErrorRate() + variation * ERROR_RATE_SWING);

        return new TelemetryMetrics(
            round(clamp(latency, MIN_LATENCY_MS, MAX_LATENCY_MS)),
            round(clamp(throughput, MIN_THROUGHPUT_GBPS, MAX_THROUGHPUT_GBPS)),
            round(clamp(errorRate, MIN_ERROR_RATE, MAX_ERROR_RATE)));
    }

    private static int bucketOffset(long nodeId) {
        return (int) Math.floorMod(nodeId, 10L);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
