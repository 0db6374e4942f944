package com.harness.remediation.workflow;

import com.harness.remediation.enums.RemediationDirective;

/**
 * Result reported by a state, used to look up the next state.
 */
public enum WorkflowSignal {
  PROCEED,
  PARAMETER_GROUP,
  BACKUP_RETENTION,
  DELETION_PROTECTION,
  UNMATCHED,
  REMEDIATED,
  RESOURCE_NOT_FOUND;

  public static WorkflowSignal classified(RemediationDirective directive) {
    return switch (directive) {
      case PARAMETER_GROUP -> PARAMETER_GROUP;
      case BACKUP_RETENTION -> BACKUP_RETENTION;
      case DELETION_PROTECTION -> DELETION_PROTECTION;
      case UNKNOWN -> UNMATCHED;
    };
  }
}
