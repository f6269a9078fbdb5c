package com.example.netorchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Settings for the background workers and the bottleneck analysis.
 * Bound from the {@code orchestrator.*} properties.
 */
@Configuration
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorConfig {

    private WorkersConfig workers = new WorkersConfig();
    private TaskConfig lifecycle = new TaskConfig(Duration.ofSeconds(2), Duration.ofSeconds(5));
    private TaskConfig telemetry = new TaskConfig(Duration.ofSeconds(5), Duration.ofSeconds(5));
    private AnalysisConfig analysis = new AnalysisConfig();

    @Data
    public static class WorkersConfig {
        /**
         * Start the lifecycle scheduler and telemetry generator with the application context.
         */
        private boolean autoStart = true;

        /**
         * How long shutdown waits for an in-flight cycle to finish.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class TaskConfig {
        private Duration interval;

        /**
         * Delay before the next cycle after a cycle failed.
         */
        private Duration backoff;

        public TaskConfig() {
        }

        public TaskConfig(Duration interval, Duration backoff) {
            this.interval = interval;
            this.backoff = backoff;
        }
    }

    @Data
    public static class AnalysisConfig {
        private int defaultWindowMinutes = 10;
        private double defaultThreshold = 2.0;
    }
}
