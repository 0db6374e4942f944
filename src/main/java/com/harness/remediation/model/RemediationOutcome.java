package com.harness.remediation.model;

import com.harness.remediation.enums.OutcomeType;
import com.harness.remediation.enums.RemediationDirective;

public record RemediationOutcome(
    OutcomeType type,
    RemediationDirective directive,
    String resourceId
) {

  public static RemediationOutcome executed(RemediationDirective directive, String resourceId) {
    return new RemediationOutcome(OutcomeType.EXECUTED, directive, resourceId);
  }

  public static RemediationOutcome resourceNotFound(RemediationDirective directive,
                                                    String resourceId) {
    return new RemediationOutcome(OutcomeType.RESOURCE_NOT_FOUND, directive, resourceId);
  }

  public static RemediationOutcome unknownDirective(String resourceId) {
    return new RemediationOutcome(
        OutcomeType.UNKNOWN_DIRECTIVE, RemediationDirective.UNKNOWN, resourceId);
  }

  public String message() {
    return type.message();
  }
}
