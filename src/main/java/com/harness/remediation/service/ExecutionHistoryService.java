package com.harness.remediation.service;

import com.harness.remediation.enums.ExecutionStatus;
import com.harness.remediation.enums.RemediationDirective;
import com.harness.remediation.model.ComplianceEvent;
import com.harness.remediation.model.ExecutionSummary;
import com.harness.remediation.model.RemediationOutcome;
import com.harness.remediation.repository.RemediationExecutionEntity;
import com.harness.remediation.repository.RemediationExecutionRepository;
import com.harness.remediation.workflow.WorkflowState;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Audit trail of workflow executions. Write-only from the workflow's side:
 * no execution reads what an earlier one recorded.
 *
 * <p>Recording is best-effort. Each write is flushed in its own repository
 * transaction and storage failures are logged, never thrown, so the audit
 * trail cannot change the outcome of an execution.
 */
@Service
public class ExecutionHistoryService {

  private static final Logger log = LoggerFactory.getLogger(ExecutionHistoryService.class);

  private final RemediationExecutionRepository repository;

  public ExecutionHistoryService(RemediationExecutionRepository repository) {
    this.repository = repository;
  }

  public void started(String executionId, ComplianceEvent event) {
    RemediationExecutionEntity entity = new RemediationExecutionEntity();
    entity.setExecutionId(executionId);
    entity.setConfigRuleName(
        truncate(event.configRuleName(), RemediationExecutionEntity.MAX_RULE_NAME));
    entity.setResourceId(
        truncate(event.resourceId(), RemediationExecutionEntity.MAX_RESOURCE_ID));
    entity.setStatus(ExecutionStatus.RUNNING);
    entity.setStartedAt(Instant.now());
    save(executionId, "start", entity);
  }

  public void completed(String executionId,
                        RemediationDirective directive,
                        WorkflowState finalState,
                        RemediationOutcome outcome) {
    update(executionId, "completion", entity -> {
      entity.setDirective(directive);
      entity.setFinalState(finalState);
      entity.setOutcome(outcome.type());
      entity.setStatus(ExecutionStatus.SUCCEEDED);
      entity.setFinishedAt(Instant.now());
    });
  }

  public void failed(String executionId,
                     RemediationDirective directive,
                     WorkflowState failedState,
                     Throwable error) {
    update(executionId, "failure", entity -> {
      entity.setDirective(directive);
      entity.setFinalState(failedState);
      entity.setStatus(ExecutionStatus.FAILED);
      entity.setFailureMessage(truncate(
          error.getClass().getSimpleName() + ": " + error.getMessage(),
          RemediationExecutionEntity.MAX_FAILURE_MESSAGE));
      entity.setFinishedAt(Instant.now());
    });
  }

  @Transactional(readOnly = true)
  public List<ExecutionSummary> listRecent(ExecutionStatus status) {
    List<RemediationExecutionEntity> entities = status != null
        ? repository.findTop50ByStatusOrderByStartedAtDesc(status)
        : repository.findTop50ByOrderByStartedAtDesc();
    return entities.stream().map(this::toSummary).toList();
  }

  @Transactional(readOnly = true)
  public Optional<ExecutionSummary> getExecution(String executionId) {
    return repository.findById(executionId).map(this::toSummary);
  }

  private void update(String executionId,
                      String step,
                      Consumer<RemediationExecutionEntity> change) {
    Optional<RemediationExecutionEntity> existing;
    try {
      existing = repository.findById(executionId);
    } catch (DataAccessException e) {
      log.error("Failed to load execution record: executionId={}, step={}", executionId, step, e);
      return;
    }
    if (existing.isEmpty()) {
      log.warn("No execution record to update: executionId={}, step={}", executionId, step);
      return;
    }
    RemediationExecutionEntity entity = existing.get();
    change.accept(entity);
    save(executionId, step, entity);
  }

  private void save(String executionId, String step, RemediationExecutionEntity entity) {
    try {
      repository.saveAndFlush(entity);
    } catch (DataAccessException e) {
      log.error("Failed to record execution {}: executionId={}", step, executionId, e);
    }
  }

  private static String truncate(String value, int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength);
  }

  private ExecutionSummary toSummary(RemediationExecutionEntity entity) {
    return new ExecutionSummary(
        entity.getExecutionId(),
        entity.getConfigRuleName(),
        entity.getResourceId(),
        entity.getDirective(),
        entity.getFinalState(),
        entity.getOutcome(),
        entity.getStatus(),
        entity.getFailureMessage(),
        entity.getStartedAt(),
        entity.getFinishedAt()
    );
  }
}
