package com.example.netorchestrator.model;

import com.example.netorchestrator.persistence.DeploymentEntity;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Deployment together with the number of nodes it currently owns.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentDetail {

    @JsonUnwrapped
    private DeploymentEntity deployment;

    private long currentNodeCount;
}
