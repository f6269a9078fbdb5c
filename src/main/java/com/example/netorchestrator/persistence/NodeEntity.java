package com.example.netorchestrator.persistence;

import com.example.netorchestrator.model.NodeState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single simulated switch/router and its lifecycle position.
 */
@Entity
@Table(name = "nodes", indexes = {
    @Index(name = "idx_node_deployment", columnList = "deploymentId"),
    @Index(name = "idx_node_state", columnList = "state")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NodeEntity {

    /**
     * Stable numeric identity. Transition timing, failure injection and telemetry are all derived from it.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long deploymentId;

    /**
     * Human readable identifier, unique within the deployment (node-001, node-002, ...).
     */
    @Column(nullable = false, length = 100)
    private String nodeIdentifier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private NodeState state;

    @Column(length = 255)
    private String hostname;

    /**
     * Assigned on the first transition, null before that.
     */
    @Column(length = 45)
    private String ipAddress;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    /**
     * Changed on every state transition and only then.
     */
    @Column(nullable = false)
    private Instant stateChangedAt;
}
