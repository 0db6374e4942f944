package com.harness.remediation.remediation;

import com.harness.remediation.controlplane.ControlPlaneClient;
import com.harness.remediation.enums.ConfigurationField;
import com.harness.remediation.enums.RemediationDirective;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class BackupRetentionRemediation extends ClusterRemediationAction {

  // days
  private final Integer desiredBackupRetentionPeriod;

  public BackupRetentionRemediation(
      ResourceResolver resolver,
      ControlPlaneClient controlPlane,
      @Value("${remediation.desired-backup-retention-period:#{null}}")
      Integer desiredBackupRetentionPeriod) {
    super(resolver, controlPlane);
    this.desiredBackupRetentionPeriod = desiredBackupRetentionPeriod;
  }

  @Override
  public RemediationDirective directive() {
    return RemediationDirective.BACKUP_RETENTION;
  }

  @Override
  protected ConfigurationField field() {
    return ConfigurationField.BACKUP_RETENTION_PERIOD;
  }

  @Override
  protected String desiredValue() {
    if (desiredBackupRetentionPeriod == null) {
      throw RemediationException.configurationMissing("cluster backup retention period");
    }
    return Integer.toString(desiredBackupRetentionPeriod);
  }
}
