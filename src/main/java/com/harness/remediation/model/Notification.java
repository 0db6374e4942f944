package com.harness.remediation.model;

import com.harness.remediation.enums.OutcomeType;

/**
 * {@code outcome} is null for the entry notification and set on the exit one.
 */
public record Notification(
    String subject,
    String body,
    OutcomeType outcome
) {

  public static Notification entry(String subject, String body) {
    return new Notification(subject, body, null);
  }

  public boolean isExit() {
    return outcome != null;
  }
}
