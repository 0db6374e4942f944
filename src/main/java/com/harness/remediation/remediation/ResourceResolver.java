package com.harness.remediation.remediation;

import com.harness.remediation.controlplane.ControlPlaneClient;
import com.harness.remediation.enums.ResourceType;
import com.harness.remediation.model.ManagedResource;
import com.harness.remediation.model.ResolvedResource;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Translates a durable resource identifier into the resource's current name.
 * Every call queries the control plane; names can change between evaluation
 * and remediation, so nothing is cached.
 */
@Component
public class ResourceResolver {

  private final ControlPlaneClient controlPlane;

  public ResourceResolver(ControlPlaneClient controlPlane) {
    this.controlPlane = controlPlane;
  }

  /**
   * @throws RemediationException of kind {@code RESOURCE_NOT_FOUND} when no
   *     listed resource carries {@code identifier}
   */
  public ResolvedResource resolve(ResourceType type, String identifier) {
    List<ManagedResource> resources = controlPlane.listResources(type);
    if (identifier == null || identifier.isBlank()) {
      throw RemediationException.resourceNotFound(identifier);
    }
    return resources.stream()
        .filter(resource -> identifier.equals(resource.identifier()))
        .findFirst()
        .map(resource -> new ResolvedResource(resource.identifier(), resource.currentName()))
        .orElseThrow(() -> RemediationException.resourceNotFound(identifier));
  }
}
