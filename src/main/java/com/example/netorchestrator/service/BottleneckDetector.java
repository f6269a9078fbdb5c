package com.example.netorchestrator.service;

import com.example.netorchestrator.config.OrchestratorConfig;
import com.example.netorchestrator.model.BottleneckNode;
import com.example.netorchestrator.model.BottleneckReport;
import com.example.netorchestrator.persistence.NodeEntity;
import com.example.netorchestrator.persistence.OrchestratorPersistenceService;
import com.example.netorchestrator.persistence.TelemetrySampleEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Flags nodes whose averaged metrics deviate from the deployment-wide baseline.
 * <p>
 * The baseline is the mean and sample standard deviation of each metric over every sample in the
 * window. Per node, latency and error rate deviate upwards and throughput downwards; a node is a
 * bottleneck when any single deviation reaches the threshold. Nodes are ranked by
 * {@code 0.4 * latency + 0.4 * throughput + 0.2 * errorRate}, counting only positive deviations.
 * <p>
 * Holds no state; concurrent calls see whatever samples were committed when they read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BottleneckDetector {

    static final double LATENCY_WEIGHT = 0.4;
    static final double THROUGHPUT_WEIGHT = 0.4;
    static final double ERROR_RATE_WEIGHT = 0.2;

    private final OrchestratorPersistenceService store;
    private final OrchestratorConfig config;
    private final Clock clock;

    /**
     * Analysis with the configured default window and threshold.
     */
    public BottleneckReport detect(Long deploymentId) {
        OrchestratorConfig.AnalysisConfig analysis = config.getAnalysis();
        return detect(deploymentId, Duration.ofMinutes(analysis.getDefaultWindowMinutes()), analysis.getDefaultThreshold());
    }

    public BottleneckReport detect(Long deploymentId, Duration window) {
        return detect(deploymentId, window, config.getAnalysis().getDefaultThreshold());
    }

    /**
     * @param window    trailing duration ending now, in whole minutes
     * @param threshold deviation, in standard deviations, at which a node is flagged
     * @throws DeploymentNotFoundException if the deployment does not exist
     */
    @Transactional(readOnly = true)
    public BottleneckReport detect(Long deploymentId, Duration window, double threshold) {
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Analysis window must be positive");
        }
        if (!window.equals(Duration.ofMinutes(window.toMinutes()))) {
            throw new IllegalArgumentException("Analysis window must be a whole number of minutes");
        }
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("Deviation threshold must be positive");
        }
        store.requireDeployment(deploymentId);

        Instant now = clock.instant();
        List<TelemetrySampleEntity> samples = store.findSamplesInWindow(deploymentId, now.minus(window), now);

        List<BottleneckNode> bottlenecks = samples.isEmpty()
            ? List.of()
            : analyze(deploymentId, samples, threshold, nodeIdentifiers(deploymentId));

        if (!bottlenecks.isEmpty()) {
            log.info("Deployment {}: {} bottleneck(s) among {} samples in the last {}",
                    deploymentId, bottlenecks.size(), samples.size(), window);
        }
        return new BottleneckReport(deploymentId, now, bottlenecks, bottlenecks.size(), window.toMinutes(), threshold);
    }

    /**
     * Score and flag nodes over the given samples. Ranked by score descending, then node id.
     */
    static List<BottleneckNode> analyze(Long deploymentId, List<TelemetrySampleEntity> samples,
                                        double threshold, Map<Long, String> identifiers) {
        MetricBaseline latency = MetricBaseline.of(samples, TelemetrySampleEntity::getLatencyMs);
        MetricBaseline throughput = MetricBaseline.of(samples, TelemetrySampleEntity::getThroughputGbps);
        MetricBaseline errorRate = MetricBaseline.of(samples, TelemetrySampleEntity::getErrorRate);

        Map<Long, List<TelemetrySampleEntity>> byNode = samples.stream()
            .collect(Collectors.groupingBy(TelemetrySampleEntity::getNodeId, TreeMap::new, Collectors.toList()));

        List<BottleneckNode> flagged = new ArrayList<>();
        for (Map.Entry<Long, List<TelemetrySampleEntity>> entry : byNode.entrySet()) {
            List<TelemetrySampleEntity> own = entry.getValue();
            double nodeLatency = mean(own, TelemetrySampleEntity::getLatencyMs);
            double nodeThroughput = mean(own, TelemetrySampleEntity::getThroughputGbps);
            double nodeErrorRate = mean(own, TelemetrySampleEntity::getErrorRate);

            double latencyDeviation = latency.deviationAbove(nodeLatency);
            double throughputDeviation = throughput.deviationBelow(nodeThroughput);
            double errorRateDeviation = errorRate.deviationAbove(nodeErrorRate);

            boolean bottleneck = latencyDeviation >= threshold
                || throughputDeviation >= threshold
                || errorRateDeviation >= threshold;
            if (!bottleneck) {
                continue;
            }

            double score = LATENCY_WEIGHT * Math.max(0, latencyDeviation)
                + THROUGHPUT_WEIGHT * Math.max(0, throughputDeviation)
                + ERROR_RATE_WEIGHT * Math.max(0, errorRateDeviation);

            Instant latest = own.stream()
                .map(TelemetrySampleEntity::getTimestamp)
                .max(Comparator.naturalOrder())
                .orElse(null);

            flagged.add(new BottleneckNode(
                entry.getKey(),
                identifiers.get(entry.getKey()),
                deploymentId,
                nodeLatency,
                nodeThroughput,
                nodeErrorRate,
                score,
                latest
            ));
        }

        flagged.sort(Comparator.comparingDouble(BottleneckNode::getDeviationScore).reversed()
            .thenComparing(BottleneckNode::getNodeId));
        return flagged;
    }

    private Map<Long, String> nodeIdentifiers(Long deploymentId) {
        return store.findNodesByDeployment(deploymentId).stream()
            .collect(Collectors.toMap(NodeEntity::getId, NodeEntity::getNodeIdentifier));
    }

    private static double mean(List<TelemetrySampleEntity> samples, ToDoubleFunction<TelemetrySampleEntity> metric) {
        return samples.stream().mapToDouble(metric).average().orElse(0.0);
    }

    /**
     * Mean and sample standard deviation of one metric. A deviation is 0 whenever the standard deviation is 0.
     * Spreads below rounding noise count as 0, so identical readings never produce a signal.
     */
    static final class MetricBaseline {
        private static final double RELATIVE_EPSILON = 1e-9;

        private final double mean;
        private final double stdDev;

        MetricBaseline(double mean, double stdDev) {
            this.mean = mean;
            this.stdDev = stdDev;
        }

        static MetricBaseline of(List<TelemetrySampleEntity> samples, ToDoubleFunction<TelemetrySampleEntity> metric) {
            int n = samples.size();
            double mean = mean(samples, metric);
            if (n < 2) {
                return new MetricBaseline(mean, 0.0);
            }
            double sumOfSquares = 0.0;
            for (TelemetrySampleEntity sample : samples) {
                double diff = metric.applyAsDouble(sample) - mean;
                sumOfSquares += diff * diff;
            }
            double stdDev = Math.sqrt(sumOfSquares / (n - 1));
            if (stdDev <= RELATIVE_EPSILON * Math.max(1.0, Math.abs(mean))) {
                stdDev = 0.0;
            }
            return new MetricBaseline(mean, stdDev);
        }

        double deviationAbove(double value) {
            return stdDev > 0 ? (value - mean) / stdDev : 0.0;
        }

        double deviationBelow(double value) {
            return stdDev > 0 ? (mean - value) / stdDev : 0.0;
        }

        double getMean() {
            return mean;
        }

        double getStdDev() {
            return stdDev;
        }
    }
}
