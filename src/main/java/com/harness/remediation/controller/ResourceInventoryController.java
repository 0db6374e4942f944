package com.harness.remediation.controller;

import com.harness.remediation.controlplane.InMemoryControlPlaneClient;
import com.harness.remediation.enums.ResourceType;
import com.harness.remediation.model.ManagedResource;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Seeds and inspects the in-memory resource inventory.
 */
@RestController
@RequestMapping("/api/v1/resources")
public class ResourceInventoryController {

  private final InMemoryControlPlaneClient inventory;

  public ResourceInventoryController(InMemoryControlPlaneClient inventory) {
    this.inventory = inventory;
  }

  @GetMapping
  public ResponseEntity<List<ManagedResource>> listResources(
      @RequestParam(value = "type", defaultValue = "Cluster") String type) {
    return ResponseEntity.ok(inventory.listResources(ResourceType.fromValue(type)));
  }

  @PutMapping
  public ResponseEntity<ManagedResource> register(@RequestBody ManagedResource resource) {
    inventory.register(resource);
    return ResponseEntity.ok(resource);
  }

  @DeleteMapping("/{identifier}")
  public ResponseEntity<Void> remove(@PathVariable String identifier) {
    return inventory.remove(identifier)
        ? ResponseEntity.noContent().build()
        : ResponseEntity.notFound().build();
  }
}
