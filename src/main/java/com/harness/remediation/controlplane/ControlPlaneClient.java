package com.harness.remediation.controlplane;

import com.harness.remediation.enums.ConfigurationField;
import com.harness.remediation.enums.ResourceType;
import com.harness.remediation.model.ManagedResource;
import java.util.List;

public interface ControlPlaneClient {

  /**
   * Read-only inventory query. One call, no retry.
   */
  List<ManagedResource> listResources(ResourceType type);

  /**
   * Sets a single configuration field on the resource currently addressed by
   * {@code currentName}. Applying the same value twice leaves the resource unchanged.
   *
   * @throws ControlPlaneException if the call cannot be completed
   */
  void applyConfiguration(String currentName, ConfigurationField field, String value);
}
