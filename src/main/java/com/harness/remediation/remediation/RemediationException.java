package com.harness.remediation.remediation;

import com.harness.remediation.enums.ErrorKind;

/**
 * Failure raised by a remediation action. Callers branch on {@link #kind()}.
 */
public class RemediationException extends RuntimeException {

  private final ErrorKind kind;

  public RemediationException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public static RemediationException resourceNotFound(String identifier) {
    return new RemediationException(
        ErrorKind.RESOURCE_NOT_FOUND, "Cluster with resourceId=" + identifier + " not found");
  }

  public static RemediationException configurationMissing(String setting) {
    return new RemediationException(
        ErrorKind.CONFIGURATION_MISSING, "Desired " + setting + " not configured");
  }

  public ErrorKind kind() {
    return kind;
  }
}
