package com.harness.remediation.remediation;

import com.harness.remediation.controlplane.ControlPlaneClient;
import com.harness.remediation.enums.ConfigurationField;
import com.harness.remediation.enums.RemediationDirective;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ParameterGroupRemediation extends ClusterRemediationAction {

  private final String desiredParameterGroup;

  public ParameterGroupRemediation(
      ResourceResolver resolver,
      ControlPlaneClient controlPlane,
      @Value("${remediation.desired-parameter-group:}") String desiredParameterGroup) {
    super(resolver, controlPlane);
    this.desiredParameterGroup = desiredParameterGroup;
  }

  @Override
  public RemediationDirective directive() {
    return RemediationDirective.PARAMETER_GROUP;
  }

  @Override
  protected ConfigurationField field() {
    return ConfigurationField.PARAMETER_GROUP;
  }

  @Override
  protected String desiredValue() {
    if (desiredParameterGroup == null || desiredParameterGroup.isBlank()) {
      throw RemediationException.configurationMissing("cluster parameter group");
    }
    return desiredParameterGroup;
  }
}
