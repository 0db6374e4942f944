package com.harness.remediation.workflow;

import com.harness.remediation.enums.RemediationDirective;
import java.util.Optional;

public enum WorkflowState {
  NOTIFY_ENTRY(null, false),
  CLASSIFY(null, false),
  PARAMETER_GROUP(RemediationDirective.PARAMETER_GROUP, false),
  BACKUP_RETENTION(RemediationDirective.BACKUP_RETENTION, false),
  DELETION_PROTECTION(RemediationDirective.DELETION_PROTECTION, false),
  UNKNOWN_DIRECTIVE(null, false),
  EXECUTED(null, false),
  NOT_FOUND_FALLBACK(null, false),
  NOTIFY_EXIT(null, true);

  private final RemediationDirective directive;
  private final boolean terminal;

  WorkflowState(RemediationDirective directive, boolean terminal) {
    this.directive = directive;
    this.terminal = terminal;
  }

  /**
   * Directive carried out by this state, present only for remediation states.
   */
  public Optional<RemediationDirective> directive() {
    return Optional.ofNullable(directive);
  }

  public boolean isTerminal() {
    return terminal;
  }
}
