package com.harness.remediation.workflow;

import com.harness.remediation.enums.RemediationDirective;
import com.harness.remediation.model.ComplianceEvent;
import org.springframework.stereotype.Component;

@Component
public class EventClassifier {

  public RemediationDirective classify(ComplianceEvent event) {
    return RemediationDirective.fromRuleName(event.configRuleName());
  }
}
