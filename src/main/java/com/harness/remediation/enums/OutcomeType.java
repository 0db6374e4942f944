package com.harness.remediation.enums;

public enum OutcomeType {
  EXECUTED("The remediation for the non-compliance resource has been executed"),
  RESOURCE_NOT_FOUND("The non-compliance resource was not found"),
  UNKNOWN_DIRECTIVE("Remediation type not found");

  private final String message;

  OutcomeType(String message) {
    this.message = message;
  }

  public String message() {
    return message;
  }
}
