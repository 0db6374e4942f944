package com.harness.remediation.model;

import com.harness.remediation.enums.ComplianceType;
import com.harness.remediation.enums.ResourceType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Inbound compliance-change payload. {@code resourceId} is deliberately
 * optional: a missing identifier resolves to no resource downstream.
 */
public record ComplianceEventRequest(
    @NotBlank String configRuleName,
    @NotNull ResourceType resourceType,
    String resourceId,
    @NotNull ComplianceType complianceType
) {

  public ComplianceEvent toEvent() {
    return new ComplianceEvent(configRuleName, resourceType, resourceId, complianceType);
  }
}
