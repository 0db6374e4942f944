package com.harness.remediation.pipeline.queue;

import com.harness.remediation.model.ComplianceEvent;

public interface EventBus {

  /**
   * @return false if the queue is full and the event was not accepted
   */
  boolean publish(ComplianceEvent event);

  ComplianceEvent take() throws InterruptedException;

  int size();
}
