package com.harness.remediation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RemediationWorkflowApplication {
  public static void main(String[] args) {
    SpringApplication.run(RemediationWorkflowApplication.class, args);
  }
}
