package com.harness.remediation.repository;

import com.harness.remediation.enums.ExecutionStatus;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RemediationExecutionRepository
    extends JpaRepository<RemediationExecutionEntity, String> {

  List<RemediationExecutionEntity> findTop50ByOrderByStartedAtDesc();

  List<RemediationExecutionEntity> findTop50ByStatusOrderByStartedAtDesc(ExecutionStatus status);
}
