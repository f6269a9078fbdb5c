package com.example.netorchestrator.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Repository for telemetry samples.
 */
@Repository
public interface TelemetrySampleRepository extends JpaRepository<TelemetrySampleEntity, Long>,
        JpaSpecificationExecutor<TelemetrySampleEntity> {

    /**
     * All samples of a deployment with from <= timestamp <= to.
     */
    List<TelemetrySampleEntity> findByDeploymentIdAndTimestampBetween(Long deploymentId, Instant from, Instant to);

    long countByNodeId(Long nodeId);

    @Modifying
    @Transactional
    void deleteByDeploymentId(Long deploymentId);
}
