package com.harness.remediation.enums;

import java.util.Optional;

/**
 * Routing key derived from the name of the config rule that reported the
 * non-compliance. Rule names are unique, so at most one constant matches.
 */
public enum RemediationDirective {
  PARAMETER_GROUP("documentdb-cluster-parameter-group"),
  BACKUP_RETENTION("documentdb-cluster-backup-retention"),
  DELETION_PROTECTION("documentdb-cluster-deletion-protection-enabled"),
  UNKNOWN(null);

  private final String ruleName;

  RemediationDirective(String ruleName) {
    this.ruleName = ruleName;
  }

  public Optional<String> ruleName() {
    return Optional.ofNullable(ruleName);
  }

  public static RemediationDirective fromRuleName(String configRuleName) {
    if (configRuleName == null) {
      return UNKNOWN;
    }
    for (RemediationDirective directive : values()) {
      if (configRuleName.equals(directive.ruleName)) {
        return directive;
      }
    }
    return UNKNOWN;
  }
}
