package com.harness.remediation.remediation;

import com.harness.remediation.controlplane.ControlPlaneClient;
import com.harness.remediation.controlplane.InMemoryControlPlaneClient;
import com.harness.remediation.enums.ConfigurationField;
import com.harness.remediation.enums.ErrorKind;
import com.harness.remediation.enums.ResourceType;
import com.harness.remediation.model.ManagedResource;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class ClusterRemediationActionsTest {

  private InMemoryControlPlaneClient controlPlane;
  private ResourceResolver resolver;

  @BeforeEach
  void setUp() {
    controlPlane = new InMemoryControlPlaneClient();
    resolver = new ResourceResolver(controlPlane);
    controlPlane.register(new ManagedResource(
        "cluster-123",
        "orders-db",
        ResourceType.CLUSTER,
        Map.of(
            "DeletionProtection", "false",
            "DBClusterParameterGroupName", "default.docdb4.0",
            "BackupRetentionPeriod", "1"
        )
    ));
  }

  @Test
  void deletionProtectionIsEnabled() {
    new DeletionProtectionRemediation(resolver, controlPlane).remediate("cluster-123");

    assertThat(attribute(ConfigurationField.DELETION_PROTECTION)).isEqualTo("true");
  }

  @Test
  void parameterGroupIsSetToDesiredValue() {
    new ParameterGroupRemediation(resolver, controlPlane, "blogpost-param-group")
        .remediate("cluster-123");

    assertThat(attribute(ConfigurationField.PARAMETER_GROUP)).isEqualTo("blogpost-param-group");
  }

  @Test
  void backupRetentionIsSetToDesiredValue() {
    new BackupRetentionRemediation(resolver, controlPlane, 7).remediate("cluster-123");

    assertThat(attribute(ConfigurationField.BACKUP_RETENTION_PERIOD)).isEqualTo("7");
  }

  @Test
  void repeatedRemediationLeavesSameState() {
    BackupRetentionRemediation action = new BackupRetentionRemediation(resolver, controlPlane, 7);

    action.remediate("cluster-123");
    ManagedResource afterFirst = controlPlane.find("cluster-123").orElseThrow();
    action.remediate("cluster-123");
    ManagedResource afterSecond = controlPlane.find("cluster-123").orElseThrow();

    assertThat(afterSecond).isEqualTo(afterFirst);
  }

  @Test
  void remediationTargetsCurrentNameAfterRename() {
    controlPlane.register(new ManagedResource(
        "cluster-123", "orders-db-renamed", ResourceType.CLUSTER, Map.of()));

    new DeletionProtectionRemediation(resolver, controlPlane).remediate("cluster-123");

    ManagedResource cluster = controlPlane.find("cluster-123").orElseThrow();
    assertThat(cluster.currentName()).isEqualTo("orders-db-renamed");
    assertThat(cluster.attributes()).containsEntry("DeletionProtection", "true");
  }

  @Test
  void missingClusterPropagatesResourceNotFound() {
    DeletionProtectionRemediation action = new DeletionProtectionRemediation(resolver, controlPlane);

    assertThatThrownBy(() -> action.remediate("cluster-gone"))
        .isInstanceOfSatisfying(RemediationException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.RESOURCE_NOT_FOUND));
  }

  @Test
  void missingParameterGroupFailsBeforeAnyControlPlaneCall() {
    ControlPlaneClient untouched = mock(ControlPlaneClient.class);
    ParameterGroupRemediation action = new ParameterGroupRemediation(
        new ResourceResolver(untouched), untouched, "");

    assertThatThrownBy(() -> action.remediate("cluster-123"))
        .hasMessageContaining("parameter group")
        .isInstanceOfSatisfying(RemediationException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.CONFIGURATION_MISSING));
    verifyNoInteractions(untouched);
  }

  @Test
  void missingRetentionPeriodFailsBeforeAnyControlPlaneCall() {
    ControlPlaneClient untouched = mock(ControlPlaneClient.class);
    BackupRetentionRemediation action = new BackupRetentionRemediation(
        new ResourceResolver(untouched), untouched, null);

    assertThatThrownBy(() -> action.remediate("cluster-123"))
        .isInstanceOfSatisfying(RemediationException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.CONFIGURATION_MISSING));
    verifyNoInteractions(untouched);
  }

  private String attribute(ConfigurationField field) {
    return controlPlane.find("cluster-123").orElseThrow().attributes().get(field.attributeName());
  }
}
