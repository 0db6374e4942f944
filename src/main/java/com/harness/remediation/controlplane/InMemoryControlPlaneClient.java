package com.harness.remediation.controlplane;

import com.harness.remediation.enums.ConfigurationField;
import com.harness.remediation.enums.ResourceType;
import com.harness.remediation.model.ManagedResource;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class InMemoryControlPlaneClient implements ControlPlaneClient {

  private static final Logger log = LoggerFactory.getLogger(InMemoryControlPlaneClient.class);

  // keyed by durable identifier
  private final Map<String, ManagedResource> resources = new ConcurrentHashMap<>();

  /**
   * Adds or replaces the resource with the same identifier. Names are unique
   * across the inventory since updates address resources by name.
   */
  public synchronized void register(ManagedResource resource) {
    if (resource.identifier() == null || resource.identifier().isBlank()) {
      throw new IllegalArgumentException("Resource identifier is required");
    }
    if (resource.currentName() == null || resource.currentName().isBlank()) {
      throw new IllegalArgumentException("Resource name is required");
    }
    boolean nameTaken = resources.values().stream()
        .anyMatch(existing -> existing.currentName().equals(resource.currentName())
            && !existing.identifier().equals(resource.identifier()));
    if (nameTaken) {
      throw new IllegalArgumentException(
          "Resource name already in use: " + resource.currentName());
    }
    resources.put(resource.identifier(), resource);
    log.info("Registered resource: identifier={}, name={}, type={}",
        resource.identifier(), resource.currentName(), resource.type());
  }

  public boolean remove(String identifier) {
    return resources.remove(identifier) != null;
  }

  public Optional<ManagedResource> find(String identifier) {
    return Optional.ofNullable(resources.get(identifier));
  }

  @Override
  public List<ManagedResource> listResources(ResourceType type) {
    return resources.values().stream()
        .filter(resource -> resource.type() == type)
        .sorted(Comparator.comparing(ManagedResource::currentName))
        .toList();
  }

  @Override
  public void applyConfiguration(String currentName, ConfigurationField field, String value) {
    ManagedResource target = resources.values().stream()
        .filter(resource -> resource.currentName().equals(currentName))
        .findFirst()
        .orElseThrow(() -> new ControlPlaneException(
            "DBClusterNotFoundFault: no resource named " + currentName));
    ManagedResource updated = resources.computeIfPresent(target.identifier(),
        (id, existing) -> existing.currentName().equals(currentName)
            ? existing.withAttribute(field.attributeName(), value)
            : existing);
    if (updated == null || !updated.currentName().equals(currentName)) {
      throw new ControlPlaneException(
          "DBClusterNotFoundFault: resource " + currentName + " changed during update");
    }
    log.debug("Applied configuration: name={}, field={}, value={}",
        currentName, field.attributeName(), value);
  }
}
