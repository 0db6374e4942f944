package com.harness.remediation.enums;

public enum ExecutionStatus {
  RUNNING,
  SUCCEEDED,
  FAILED
}
