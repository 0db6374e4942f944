package com.harness.remediation.model;

import com.harness.remediation.enums.ResourceType;
import java.util.HashMap;
import java.util.Map;

/**
 * A database resource as reported by the control plane inventory.
 */
public record ManagedResource(
    String identifier,
    String currentName,
    ResourceType type,
    Map<String, String> attributes
) {

  public ManagedResource {
    attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
  }

  public ManagedResource withAttribute(String name, String value) {
    Map<String, String> updated = new HashMap<>(attributes);
    updated.put(name, value);
    return new ManagedResource(identifier, currentName, type, updated);
  }
}
