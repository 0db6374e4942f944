package com.harness.remediation.service;

import com.harness.remediation.enums.ComplianceType;
import com.harness.remediation.model.ComplianceEvent;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Decides which compliance-change events start a remediation: non-compliant
 * results for rules carrying the configured prefix.
 */
@Component
public class ComplianceEventFilter {

  private final String rulePrefix;

  public ComplianceEventFilter(
      @Value("${remediation.event-filter.rule-prefix:documentdb-}") String rulePrefix) {
    this.rulePrefix = rulePrefix;
  }

  public boolean accepts(ComplianceEvent event) {
    return event.complianceType() == ComplianceType.NON_COMPLIANT
        && event.resourceType() != null
        && event.configRuleName() != null
        && event.configRuleName().startsWith(rulePrefix);
  }
}
