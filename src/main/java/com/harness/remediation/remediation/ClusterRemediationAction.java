package com.harness.remediation.remediation;

import com.harness.remediation.controlplane.ControlPlaneClient;
import com.harness.remediation.enums.ConfigurationField;
import com.harness.remediation.enums.ResourceType;
import com.harness.remediation.model.ResolvedResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared shape of the cluster remediations: check the desired value, resolve
 * the cluster, then issue one idempotent field update.
 */
public abstract class ClusterRemediationAction implements RemediationAction {

  private static final Logger log = LoggerFactory.getLogger(ClusterRemediationAction.class);

  private final ResourceResolver resolver;
  private final ControlPlaneClient controlPlane;

  protected ClusterRemediationAction(ResourceResolver resolver, ControlPlaneClient controlPlane) {
    this.resolver = resolver;
    this.controlPlane = controlPlane;
  }

  protected abstract ConfigurationField field();

  /**
   * Value written to {@link #field()}. Must fail with a
   * {@code CONFIGURATION_MISSING} error before any lookup when unset.
   */
  protected abstract String desiredValue();

  @Override
  public final void remediate(String resourceId) {
    String value = desiredValue();
    ResolvedResource cluster = resolver.resolve(ResourceType.CLUSTER, resourceId);
    controlPlane.applyConfiguration(cluster.currentName(), field(), value);
    log.info("Remediation applied: directive={}, resourceId={}, name={}, {}={}",
        directive(), cluster.identifier(), cluster.currentName(), field().attributeName(), value);
  }
}
