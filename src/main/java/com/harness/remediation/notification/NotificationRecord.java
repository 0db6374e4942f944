package com.harness.remediation.notification;

import com.harness.remediation.enums.OutcomeType;
import java.time.Instant;

public record NotificationRecord(
    String id,
    Instant timestamp,
    NotificationStage stage,
    OutcomeType outcome,
    String subject,
    String body
) {

  public enum NotificationStage {
    NON_COMPLIANCE,
    RESULT
  }
}
