package com.example.netorchestrator.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit trail entry. Written for deployment creation and every node state change.
 */
@Entity
@Table(name = "events", indexes = {
    @Index(name = "idx_event_deployment", columnList = "deploymentId"),
    @Index(name = "idx_event_type", columnList = "type")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column
    private Long deploymentId;

    @Column
    private Long nodeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private EventType type;

    @Column(nullable = false, length = 1000)
    private String message;

    /**
     * JSON object with additional context, may be null.
     */
    @Column(length = 4000)
    private String metadata;

    @Column(nullable = false)
    private Instant createdAt;

    public enum EventType {
        DEPLOYMENT_CREATED,
        STATE_CHANGE
    }
}
