package com.harness.remediation.enums;

public enum ErrorKind {
  /** Target resource is gone or renamed since evaluation; recoverable. */
  RESOURCE_NOT_FOUND,
  /** The action has no desired value to apply; a deployment defect. */
  CONFIGURATION_MISSING
}
