package com.harness.remediation.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.remediation.controlplane.ControlPlaneClient;
import com.harness.remediation.controlplane.ControlPlaneException;
import com.harness.remediation.enums.ComplianceType;
import com.harness.remediation.enums.ConfigurationField;
import com.harness.remediation.enums.ErrorKind;
import com.harness.remediation.enums.OutcomeType;
import com.harness.remediation.enums.RemediationDirective;
import com.harness.remediation.enums.ResourceType;
import com.harness.remediation.model.ComplianceEvent;
import com.harness.remediation.model.ManagedResource;
import com.harness.remediation.model.Notification;
import com.harness.remediation.model.RemediationOutcome;
import com.harness.remediation.notification.NotificationService;
import com.harness.remediation.notification.RemediationNotifications;
import com.harness.remediation.remediation.BackupRetentionRemediation;
import com.harness.remediation.remediation.DeletionProtectionRemediation;
import com.harness.remediation.remediation.ParameterGroupRemediation;
import com.harness.remediation.remediation.RemediationException;
import com.harness.remediation.remediation.ResourceResolver;
import com.harness.remediation.service.ExecutionHistoryService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class RemediationWorkflowTest {

  private static final String DELETION_RULE = "documentdb-cluster-deletion-protection-enabled";
  private static final String PARAMETER_GROUP_RULE = "documentdb-cluster-parameter-group";
  private static final String BACKUP_RULE = "documentdb-cluster-backup-retention";

  private ControlPlaneClient controlPlane;
  private NotificationService notificationService;
  private ExecutionHistoryService history;

  @BeforeEach
  void setUp() {
    controlPlane = mock(ControlPlaneClient.class);
    notificationService = mock(NotificationService.class);
    history = mock(ExecutionHistoryService.class);
    given(controlPlane.listResources(ResourceType.CLUSTER)).willReturn(List.of(
        new ManagedResource("db-123", "orders-cluster", ResourceType.CLUSTER, Map.of())
    ));
  }

  @Test
  void existingClusterIsRemediatedAndExecutedOutcomeReturned() {
    RemediationOutcome outcome = workflow(7).handle(event(DELETION_RULE, "db-123"));

    assertThat(outcome).isEqualTo(
        RemediationOutcome.executed(RemediationDirective.DELETION_PROTECTION, "db-123"));
    verify(controlPlane, times(1))
        .applyConfiguration("orders-cluster", ConfigurationField.DELETION_PROTECTION, "true");
    verify(history).completed(anyString(), eq(RemediationDirective.DELETION_PROTECTION),
        eq(WorkflowState.NOTIFY_EXIT), eq(outcome));
  }

  @Test
  void eachKnownRuleAppliesItsOwnMutation() {
    RemediationWorkflow workflow = workflow(7);

    workflow.handle(event(PARAMETER_GROUP_RULE, "db-123"));
    workflow.handle(event(BACKUP_RULE, "db-123"));

    verify(controlPlane).applyConfiguration(
        "orders-cluster", ConfigurationField.PARAMETER_GROUP, "blogpost-param-group");
    verify(controlPlane).applyConfiguration(
        "orders-cluster", ConfigurationField.BACKUP_RETENTION_PERIOD, "7");
    verify(controlPlane, never()).applyConfiguration(
        anyString(), eq(ConfigurationField.DELETION_PROTECTION), anyString());
  }

  @Test
  void missingResourceTakesFallbackWithoutMutation() {
    RemediationOutcome outcome = workflow(7).handle(event(PARAMETER_GROUP_RULE, "db-999"));

    assertThat(outcome.type()).isEqualTo(OutcomeType.RESOURCE_NOT_FOUND);
    assertThat(outcome.resourceId()).isEqualTo("db-999");
    assertThat(outcome.directive()).isEqualTo(RemediationDirective.PARAMETER_GROUP);
    verify(controlPlane, never()).applyConfiguration(anyString(), any(), anyString());
  }

  @Test
  void absentResourceIdIsTreatedAsNotFound() {
    RemediationOutcome outcome = workflow(7).handle(event(DELETION_RULE, null));

    assertThat(outcome.type()).isEqualTo(OutcomeType.RESOURCE_NOT_FOUND);
    verify(controlPlane, never()).applyConfiguration(anyString(), any(), anyString());
  }

  @Test
  void unknownRuleSkipsResolutionAndMutation() {
    RemediationOutcome outcome = workflow(7).handle(event("documentdb-something-else", "db-1"));

    assertThat(outcome.type()).isEqualTo(OutcomeType.UNKNOWN_DIRECTIVE);
    verifyNoInteractions(controlPlane);
  }

  @Test
  void entryPrecedesExitAndExitIsSentOnceWithOutcomeMessage() {
    workflow(7).handle(event("documentdb-something-else", "db-1"));

    ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
    verify(notificationService, times(2)).send(captor.capture());
    List<Notification> sent = captor.getAllValues();

    assertThat(sent.get(0).subject()).isEqualTo("A non-compliant event has occurred");
    assertThat(sent.get(0).body()).contains("documentdb-something-else");
    assertThat(sent.get(1).subject()).isEqualTo("Remediation type not found");
    assertThat(sent.get(1).body()).startsWith("Remediation type not found");
  }

  @Test
  void notFoundExitNotificationNamesTheFailedRemediation() {
    workflow(7).handle(event(BACKUP_RULE, "db-404"));

    ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
    verify(notificationService, times(2)).send(captor.capture());
    Notification exit = captor.getAllValues().get(1);

    assertThat(exit.subject()).isEqualTo("The non-compliance resource was not found");
    assertThat(exit.body()).contains("BACKUP_RETENTION").contains("db-404");
  }

  @Test
  void entryNotificationIsSentBeforeAnyControlPlaneCall() {
    workflow(7).handle(event(DELETION_RULE, "db-123"));

    InOrder order = inOrder(notificationService, controlPlane);
    order.verify(notificationService).send(any(Notification.class));
    order.verify(controlPlane).listResources(ResourceType.CLUSTER);
    order.verify(controlPlane).applyConfiguration(anyString(), any(), anyString());
    order.verify(notificationService).send(any(Notification.class));
  }

  @Test
  void missingConfigurationFailsTheExecutionAfterEntryNotificationOnly() {
    RemediationWorkflow workflow = workflow(null);

    assertThatThrownBy(() -> workflow.handle(event(BACKUP_RULE, "db-123")))
        .isInstanceOfSatisfying(WorkflowExecutionException.class, failure -> {
          assertThat(failure.getFailedState()).isEqualTo(WorkflowState.BACKUP_RETENTION);
          assertThat(failure.getCause()).isInstanceOf(RemediationException.class);
          assertThat(((RemediationException) failure.getCause()).kind())
              .isEqualTo(ErrorKind.CONFIGURATION_MISSING);
        });

    verify(notificationService, times(1)).send(any(Notification.class));
    verifyNoInteractions(controlPlane);
    verify(history).failed(anyString(), eq(RemediationDirective.BACKUP_RETENTION),
        eq(WorkflowState.BACKUP_RETENTION), any(RemediationException.class));
    verify(history, never()).completed(anyString(), any(), any(), any());
  }

  @Test
  void controlPlaneFailureIsNotCaught() {
    willThrow(new ControlPlaneException("Throttling: rate exceeded"))
        .given(controlPlane)
        .applyConfiguration(anyString(), any(), anyString());

    assertThatThrownBy(() -> workflow(7).handle(event(DELETION_RULE, "db-123")))
        .isInstanceOf(WorkflowExecutionException.class)
        .hasCauseInstanceOf(ControlPlaneException.class)
        .hasMessageContaining("DELETION_PROTECTION");

    verify(notificationService, times(1)).send(any(Notification.class));
  }

  @Test
  void duplicateDeliveriesRunIndependently() {
    RemediationWorkflow workflow = workflow(7);

    RemediationOutcome first = workflow.handle(event(DELETION_RULE, "db-123"));
    RemediationOutcome second = workflow.handle(event(DELETION_RULE, "db-123"));

    assertThat(second).isEqualTo(first);
    verify(controlPlane, times(2))
        .applyConfiguration("orders-cluster", ConfigurationField.DELETION_PROTECTION, "true");
    verify(notificationService, times(4)).send(any(Notification.class));
  }

  @Test
  void historyFailuresDoNotChangeTheOutcome() {
    willThrow(new IllegalStateException("history store down"))
        .given(history).started(anyString(), any(ComplianceEvent.class));
    willThrow(new IllegalStateException("history store down"))
        .given(history).completed(anyString(), any(), any(), any());

    RemediationOutcome outcome = workflow(7).handle(event(DELETION_RULE, "db-123"));

    assertThat(outcome.type()).isEqualTo(OutcomeType.EXECUTED);
    verify(notificationService, times(2)).send(any(Notification.class));
  }

  @Test
  void historyFailureKeepsTheOriginalWorkflowError() {
    willThrow(new IllegalStateException("history store down"))
        .given(history).failed(anyString(), any(), any(), any());

    assertThatThrownBy(() -> workflow(null).handle(event(BACKUP_RULE, "db-123")))
        .isInstanceOfSatisfying(WorkflowExecutionException.class, failure -> {
          assertThat(failure.getExecutionId()).isNotBlank();
          assertThat(failure.getFailedState()).isEqualTo(WorkflowState.BACKUP_RETENTION);
          assertThat(failure.getCause()).isInstanceOf(RemediationException.class);
        });
  }

  private RemediationWorkflow workflow(Integer retentionDays) {
    ResourceResolver resolver = new ResourceResolver(controlPlane);
    return new RemediationWorkflow(
        new EventClassifier(),
        List.of(
            new ParameterGroupRemediation(resolver, controlPlane, "blogpost-param-group"),
            new BackupRetentionRemediation(resolver, controlPlane, retentionDays),
            new DeletionProtectionRemediation(resolver, controlPlane)
        ),
        notificationService,
        new RemediationNotifications(new ObjectMapper()),
        history
    );
  }

  private ComplianceEvent event(String ruleName, String resourceId) {
    return new ComplianceEvent(
        ruleName, ResourceType.CLUSTER, resourceId, ComplianceType.NON_COMPLIANT);
  }
}
