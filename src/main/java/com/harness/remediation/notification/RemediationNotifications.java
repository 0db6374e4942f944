package com.harness.remediation.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.remediation.model.ComplianceEvent;
import com.harness.remediation.model.Notification;
import com.harness.remediation.model.RemediationOutcome;
import org.springframework.stereotype.Component;

/**
 * Builds the entry and exit notifications of a workflow execution.
 */
@Component
public class RemediationNotifications {

  static final String NON_COMPLIANCE_SUBJECT = "A non-compliant event has occurred";

  private final ObjectMapper objectMapper;

  public RemediationNotifications(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Notification nonCompliance(ComplianceEvent event) {
    try {
      return Notification.entry(NON_COMPLIANCE_SUBJECT, objectMapper.writeValueAsString(event));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize compliance event", e);
    }
  }

  public Notification result(RemediationOutcome outcome) {
    String body = outcome.message()
        + "\nremediationType=" + outcome.directive()
        + "\nresourceId=" + outcome.resourceId();
    return new Notification(outcome.message(), body, outcome.type());
  }
}
