package com.example.netorchestrator.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for deployments.
 */
@Repository
public interface DeploymentRepository extends JpaRepository<DeploymentEntity, Long> {
}
