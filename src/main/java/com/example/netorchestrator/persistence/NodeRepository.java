package com.example.netorchestrator.persistence;

import com.example.netorchestrator.model.NodeState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Repository for nodes.
 */
@Repository
public interface NodeRepository extends JpaRepository<NodeEntity, Long> {

    /**
     * Nodes in any of the given states, oldest first.
     */
    List<NodeEntity> findByStateInOrderByIdAsc(Collection<NodeState> states);

    List<NodeEntity> findByDeploymentIdOrderByIdAsc(Long deploymentId);

    long countByDeploymentId(Long deploymentId);

    @Modifying
    @Transactional
    void deleteByDeploymentId(Long deploymentId);
}
