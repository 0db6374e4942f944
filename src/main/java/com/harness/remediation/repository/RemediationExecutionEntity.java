package com.harness.remediation.repository;

import com.harness.remediation.enums.ExecutionStatus;
import com.harness.remediation.enums.OutcomeType;
import com.harness.remediation.enums.RemediationDirective;
import com.harness.remediation.workflow.WorkflowState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "remediation_executions")
public class RemediationExecutionEntity {

  @Id
  @Column(name = "execution_id", nullable = false, updatable = false, length = 36)
  private String executionId;

  public static final int MAX_RULE_NAME = 255;
  public static final int MAX_RESOURCE_ID = 255;
  public static final int MAX_FAILURE_MESSAGE = 1024;

  @Column(name = "config_rule_name", length = MAX_RULE_NAME)
  private String configRuleName;

  @Column(name = "resource_id", length = MAX_RESOURCE_ID)
  private String resourceId;

  @Enumerated(EnumType.STRING)
  @Column(name = "directive", length = 32)
  private RemediationDirective directive;

  @Enumerated(EnumType.STRING)
  @Column(name = "final_state", length = 32)
  private WorkflowState finalState;

  @Enumerated(EnumType.STRING)
  @Column(name = "outcome", length = 32)
  private OutcomeType outcome;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 16)
  private ExecutionStatus status;

  @Column(name = "failure_message", length = MAX_FAILURE_MESSAGE)
  private String failureMessage;

  @Column(name = "started_at", nullable = false, updatable = false)
  private Instant startedAt;

  @Column(name = "finished_at")
  private Instant finishedAt;

  public RemediationExecutionEntity() {}

  public String getExecutionId() {
    return executionId;
  }

  public void setExecutionId(String executionId) {
    this.executionId = executionId;
  }

  public String getConfigRuleName() {
    return configRuleName;
  }

  public void setConfigRuleName(String configRuleName) {
    this.configRuleName = configRuleName;
  }

  public String getResourceId() {
    return resourceId;
  }

  public void setResourceId(String resourceId) {
    this.resourceId = resourceId;
  }

  public RemediationDirective getDirective() {
    return directive;
  }

  public void setDirective(RemediationDirective directive) {
    this.directive = directive;
  }

  public WorkflowState getFinalState() {
    return finalState;
  }

  public void setFinalState(WorkflowState finalState) {
    this.finalState = finalState;
  }

  public OutcomeType getOutcome() {
    return outcome;
  }

  public void setOutcome(OutcomeType outcome) {
    this.outcome = outcome;
  }

  public ExecutionStatus getStatus() {
    return status;
  }

  public void setStatus(ExecutionStatus status) {
    this.status = status;
  }

  public String getFailureMessage() {
    return failureMessage;
  }

  public void setFailureMessage(String failureMessage) {
    this.failureMessage = failureMessage;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public void setStartedAt(Instant startedAt) {
    this.startedAt = startedAt;
  }

  public Instant getFinishedAt() {
    return finishedAt;
  }

  public void setFinishedAt(Instant finishedAt) {
    this.finishedAt = finishedAt;
  }
}
