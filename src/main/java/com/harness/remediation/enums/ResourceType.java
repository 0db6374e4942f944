package com.harness.remediation.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ResourceType {
  CLUSTER("Cluster", "AWS::RDS::DBCluster"),
  INSTANCE("Instance", "AWS::RDS::DBInstance");

  private final String displayName;
  private final String configResourceType;

  ResourceType(String displayName, String configResourceType) {
    this.displayName = displayName;
    this.configResourceType = configResourceType;
  }

  @JsonValue
  public String displayName() {
    return displayName;
  }

  public String configResourceType() {
    return configResourceType;
  }

  /**
   * Accepts the short name ("Cluster"), the enum constant ("CLUSTER") or the
   * AWS Config resource type ("AWS::RDS::DBCluster").
   */
  @JsonCreator
  public static ResourceType fromValue(String value) {
    if (value == null) {
      return null;
    }
    for (ResourceType type : values()) {
      if (type.displayName.equalsIgnoreCase(value)
          || type.name().equalsIgnoreCase(value)
          || type.configResourceType.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unsupported resource type: " + value);
  }
}
