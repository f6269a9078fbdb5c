package com.example.netorchestrator.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Repository for audit events.
 */
@Repository
public interface EventRepository extends JpaRepository<EventEntity, Long> {

    List<EventEntity> findByDeploymentIdOrderByIdAsc(Long deploymentId);

    List<EventEntity> findByNodeIdOrderByIdAsc(Long nodeId);

    @Modifying
    @Transactional
    void deleteByDeploymentId(Long deploymentId);
}
