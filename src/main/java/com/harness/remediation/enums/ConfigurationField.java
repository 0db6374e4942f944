package com.harness.remediation.enums;

public enum ConfigurationField {
  DELETION_PROTECTION("DeletionProtection"),
  PARAMETER_GROUP("DBClusterParameterGroupName"),
  BACKUP_RETENTION_PERIOD("BackupRetentionPeriod");

  private final String attributeName;

  ConfigurationField(String attributeName) {
    this.attributeName = attributeName;
  }

  public String attributeName() {
    return attributeName;
  }
}
