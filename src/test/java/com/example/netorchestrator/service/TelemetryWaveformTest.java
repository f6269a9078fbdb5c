package com.example.netorchestrator.service;

import com.example.netorchestrator.model.TelemetryMetrics;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for synthetic telemetry generation.
 */
class TelemetryWaveformTest {

    private static final long EPOCH = 1_714_564_800L;

    @Test
    void testSamplesStayWithinBounds() {
        for (long id = 1; id <= 300; id++) {
            for (long t = EPOCH; t < EPOCH + 3600; t += 37) {
                TelemetryMetrics m = TelemetryWaveform.sample(id, t);
                assertTrue(m.getLatencyMs() >= 1.0 && m.getLatencyMs() <= 200.0, "latency " + m);
                assertTrue(m.getThroughputGbps() >= 1.0 && m.getThroughputGbps() <= 10.0, "throughput " + m);
                assertTrue(m.getErrorRate() >= 0.0 && m.getErrorRate() <= 5.0, "error rate " + m);
            }
        }
    }

    @Test
    void testSameNodeAndSecondGiveSameSample() {
        assertEquals(TelemetryWaveform.sample(42, EPOCH), TelemetryWaveform.sample(42, EPOCH));
        assertEquals(TelemetryWaveform.sample(9, EPOCH + 5), TelemetryWaveform.sample(9, EPOCH + 5));
    }

    @Test
    void testValuesRoundedToTwoDecimals() {
        for (long id = 1; id <= 50; id++) {
            TelemetryMetrics m = TelemetryWaveform.sample(id, EPOCH + id);
            assertTwoDecimals(m.getLatencyMs());
            assertTwoDecimals(m.getThroughputGbps());
            assertTwoDecimals(m.getErrorRate());
        }
    }

    @Test
    void testBottleneckBucket() {
        assertFalse(TelemetryWaveform.isBottleneckProne(7));
        assertTrue(TelemetryWaveform.isBottleneckProne(8));
        assertTrue(TelemetryWaveform.isBottleneckProne(19));
        assertFalse(TelemetryWaveform.isBottleneckProne(20));
    }

    @Test
    void testBaselines() {
        TelemetryMetrics worst = TelemetryWaveform.baseline(9);
        assertEquals(90.0, worst.getLatencyMs(), 1e-9);
        assertEquals(5.0, worst.getThroughputGbps(), 1e-9);
        assertEquals(1.1, worst.getErrorRate(), 1e-9);

        TelemetryMetrics normal = TelemetryWaveform.baseline(3);
        assertEquals(16.0, normal.getLatencyMs(), 1e-9);
        assertEquals(9.2, normal.getThroughputGbps(), 1e-9);
        assertEquals(0.16, normal.getErrorRate(), 1e-9);
    }

    @Test
    void testBottleneckProneNodesAreWorseOnAverage() {
        double proneLatency = 0, normalLatency = 0, proneThroughput = 0, normalThroughput = 0;
        int prone = 0, normal = 0;
        for (long id = 1; id <= 100; id++) {
            for (long t = EPOCH; t < EPOCH + 86_400; t += 600) {
                TelemetryMetrics m = TelemetryWaveform.sample(id, t);
                if (TelemetryWaveform.isBottleneckProne(id)) {
                    proneLatency += m.getLatencyMs();
                    proneThroughput += m.getThroughputGbps();
                    prone++;
                } else {
                    normalLatency += m.getLatencyMs();
                    normalThroughput += m.getThroughputGbps();
                    normal++;
                }
            }
        }

        assertTrue(proneLatency / prone > 2 * (normalLatency / normal));
        assertTrue(proneThroughput / prone < normalThroughput / normal);
    }

    private static void assertTwoDecimals(double value) {
        double scaled = value * 100;
        assertEquals(Math.round(scaled), scaled, 1e-6, "not rounded to two decimals: " + value);
    }
}
