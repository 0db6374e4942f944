package com.harness.remediation.model;

import com.harness.remediation.enums.ComplianceType;
import com.harness.remediation.enums.ResourceType;

public record ComplianceEvent(
    String configRuleName,
    ResourceType resourceType,
    String resourceId,
    ComplianceType complianceType
) {}
