package com.example.netorchestrator.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only metric reading for one node.
 */
@Entity
@Table(name = "telemetry_samples", indexes = {
    @Index(name = "idx_sample_deployment_time", columnList = "deploymentId,timestamp"),
    @Index(name = "idx_sample_node", columnList = "nodeId")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TelemetrySampleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long nodeId;

    /**
     * Copied from the node so window queries need no join.
     */
    @Column(nullable = false)
    private Long deploymentId;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(nullable = false)
    private double latencyMs;

    @Column(nullable = false)
    private double throughputGbps;

    @Column(nullable = false)
    private double errorRate;
}
