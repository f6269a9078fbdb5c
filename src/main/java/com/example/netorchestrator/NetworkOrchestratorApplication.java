package com.example.netorchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NetworkOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetworkOrchestratorApplication.class, args);
    }
}
