package com.harness.remediation.enums;

public enum ComplianceType {
  COMPLIANT,
  NON_COMPLIANT
}
