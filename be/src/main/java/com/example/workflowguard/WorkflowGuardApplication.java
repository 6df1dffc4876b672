package com.example.workflowguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkflowGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkflowGuardApplication.class, args);
    }
}
