package com.example.netorchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentRequest {
    private String name;
    private String description;
    private Integer targetNodeCount;
}
