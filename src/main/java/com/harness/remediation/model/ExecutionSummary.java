package com.harness.remediation.model;

import com.harness.remediation.enums.ExecutionStatus;
import com.harness.remediation.enums.OutcomeType;
import com.harness.remediation.enums.RemediationDirective;
import com.harness.remediation.workflow.WorkflowState;
import java.time.Instant;

public record ExecutionSummary(
    String executionId,
    String configRuleName,
    String resourceId,
    RemediationDirective directive,
    WorkflowState finalState,
    OutcomeType outcome,
    ExecutionStatus status,
    String failureMessage,
    Instant startedAt,
    Instant finishedAt
) {}
