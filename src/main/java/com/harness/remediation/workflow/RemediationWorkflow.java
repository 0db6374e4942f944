package com.harness.remediation.workflow;

import com.harness.remediation.enums.RemediationDirective;
import com.harness.remediation.model.ComplianceEvent;
import com.harness.remediation.model.RemediationOutcome;
import com.harness.remediation.notification.NotificationService;
import com.harness.remediation.notification.RemediationNotifications;
import com.harness.remediation.remediation.RemediationAction;
import com.harness.remediation.remediation.RemediationException;
import com.harness.remediation.service.ExecutionHistoryService;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one remediation execution per compliance event:
 * notify entry, classify, remediate or fall back, notify the outcome.
 *
 * <p>All per-execution data lives in locals of {@link #handle}; concurrent
 * calls share nothing but the collaborators.
 */
@Service
public class RemediationWorkflow {

  private static final Logger log = LoggerFactory.getLogger(RemediationWorkflow.class);

  private final EventClassifier classifier;
  private final Map<RemediationDirective, RemediationAction> actions;
  private final NotificationService notificationService;
  private final RemediationNotifications notifications;
  private final ExecutionHistoryService history;
  private final WorkflowTransitionTable transitions = WorkflowTransitionTable.remediationWorkflow();

  public RemediationWorkflow(EventClassifier classifier,
                             List<RemediationAction> actions,
                             NotificationService notificationService,
                             RemediationNotifications notifications,
                             ExecutionHistoryService history) {
    this.classifier = classifier;
    this.actions = indexByDirective(actions);
    this.notificationService = notificationService;
    this.notifications = notifications;
    this.history = history;
  }

  /**
   * @return the outcome announced by the exit notification
   * @throws WorkflowExecutionException when a failure other than a missing
   *     resource escapes a state; no exit notification is sent in that case
   */
  public RemediationOutcome handle(ComplianceEvent event) {
    String executionId = UUID.randomUUID().toString();
    recordHistory(executionId, "start", () -> history.started(executionId, event));
    log.info("Workflow started: executionId={}, configRuleName={}, resourceId={}",
        executionId, event.configRuleName(), event.resourceId());

    WorkflowState state = WorkflowState.NOTIFY_ENTRY;
    RemediationDirective directive = RemediationDirective.UNKNOWN;
    RemediationOutcome outcome = null;
    try {
      while (true) {
        WorkflowSignal signal = switch (state) {
          case NOTIFY_ENTRY -> {
            notificationService.send(notifications.nonCompliance(event));
            yield WorkflowSignal.PROCEED;
          }
          case CLASSIFY -> {
            directive = classifier.classify(event);
            yield WorkflowSignal.classified(directive);
          }
          case PARAMETER_GROUP, BACKUP_RETENTION, DELETION_PROTECTION ->
              remediate(executionId, state.directive().orElseThrow(), event);
          case EXECUTED -> {
            outcome = RemediationOutcome.executed(directive, event.resourceId());
            yield WorkflowSignal.PROCEED;
          }
          case NOT_FOUND_FALLBACK -> {
            outcome = RemediationOutcome.resourceNotFound(directive, event.resourceId());
            yield WorkflowSignal.PROCEED;
          }
          case UNKNOWN_DIRECTIVE -> {
            outcome = RemediationOutcome.unknownDirective(event.resourceId());
            yield WorkflowSignal.PROCEED;
          }
          case NOTIFY_EXIT -> {
            notificationService.send(notifications.result(outcome));
            yield null;
          }
        };
        if (state.isTerminal()) {
          break;
        }
        WorkflowState next = transitions.next(state, signal);
        log.debug("Workflow transition: executionId={}, {} -[{}]-> {}",
            executionId, state, signal, next);
        state = next;
      }
    } catch (RuntimeException e) {
      log.error("Workflow failed: executionId={}, state={}, configRuleName={}, resourceId={}",
          executionId, state, event.configRuleName(), event.resourceId(), e);
      WorkflowState failedState = state;
      RemediationDirective failedDirective = directive;
      recordHistory(executionId, "failure",
          () -> history.failed(executionId, failedDirective, failedState, e));
      throw new WorkflowExecutionException(executionId, state, e);
    }

    WorkflowState finalState = state;
    RemediationDirective finalDirective = directive;
    RemediationOutcome finalOutcome = outcome;
    recordHistory(executionId, "completion",
        () -> history.completed(executionId, finalDirective, finalState, finalOutcome));
    log.info("Workflow completed: executionId={}, outcome={}, directive={}",
        executionId, outcome.type(), directive);
    return outcome;
  }

  private WorkflowSignal remediate(String executionId,
                                   RemediationDirective directive,
                                   ComplianceEvent event) {
    RemediationAction action = actions.get(directive);
    try {
      action.remediate(event.resourceId());
      return WorkflowSignal.REMEDIATED;
    } catch (RemediationException e) {
      return switch (e.kind()) {
        case RESOURCE_NOT_FOUND -> {
          log.warn("Resource not found, falling back: executionId={}, directive={}, resourceId={}",
              executionId, directive, event.resourceId());
          yield WorkflowSignal.RESOURCE_NOT_FOUND;
        }
        case CONFIGURATION_MISSING -> throw e;
      };
    }
  }

  /**
   * The audit trail never decides an outcome: bookkeeping failures are logged
   * and the execution carries on.
   */
  private void recordHistory(String executionId, String step, Runnable write) {
    try {
      write.run();
    } catch (RuntimeException e) {
      log.error("Execution history {} not recorded: executionId={}", step, executionId, e);
    }
  }

  private static Map<RemediationDirective, RemediationAction> indexByDirective(
      List<RemediationAction> actions) {
    Map<RemediationDirective, RemediationAction> index = new EnumMap<>(RemediationDirective.class);
    for (RemediationAction action : actions) {
      if (index.putIfAbsent(action.directive(), action) != null) {
        throw new IllegalStateException("Duplicate remediation action for " + action.directive());
      }
    }
    for (RemediationDirective directive : RemediationDirective.values()) {
      if (directive != RemediationDirective.UNKNOWN && !index.containsKey(directive)) {
        throw new IllegalStateException("No remediation action registered for " + directive);
      }
    }
    return index;
  }
}
