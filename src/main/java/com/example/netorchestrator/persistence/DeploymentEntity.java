package com.example.netorchestrator.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A named group of nodes provisioned together.
 * Owns its nodes, telemetry samples and events.
 */
@Entity
@Table(name = "deployments", indexes = {
    @Index(name = "idx_deployment_name", columnList = "name")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 4000)
    private String description;

    /**
     * Number of nodes requested when the deployment was created.
     */
    @Column(nullable = false)
    private int targetNodeCount;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;
}
