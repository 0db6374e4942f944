package com.harness.remediation.remediation;

import com.harness.remediation.controlplane.ControlPlaneClient;
import com.harness.remediation.enums.ConfigurationField;
import com.harness.remediation.enums.RemediationDirective;
import org.springframework.stereotype.Component;

@Component
public class DeletionProtectionRemediation extends ClusterRemediationAction {

  public DeletionProtectionRemediation(ResourceResolver resolver, ControlPlaneClient controlPlane) {
    super(resolver, controlPlane);
  }

  @Override
  public RemediationDirective directive() {
    return RemediationDirective.DELETION_PROTECTION;
  }

  @Override
  protected ConfigurationField field() {
    return ConfigurationField.DELETION_PROTECTION;
  }

  @Override
  protected String desiredValue() {
    return Boolean.TRUE.toString();
  }
}
