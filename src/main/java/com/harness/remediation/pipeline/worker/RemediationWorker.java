package com.harness.remediation.pipeline.worker;

import com.harness.remediation.model.ComplianceEvent;
import com.harness.remediation.model.RemediationOutcome;
import com.harness.remediation.pipeline.queue.EventBus;
import com.harness.remediation.workflow.RemediationWorkflow;
import com.harness.remediation.workflow.WorkflowExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RemediationWorker implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(RemediationWorker.class);

  private final EventBus eventBus;
  private final RemediationWorkflow workflow;

  private volatile boolean running = true;

  public RemediationWorker(EventBus eventBus, RemediationWorkflow workflow) {
    this.eventBus = eventBus;
    this.workflow = workflow;
  }

  @Override
  public void run() {
    log.info("RemediationWorker started");
    while (running && !Thread.currentThread().isInterrupted()) {
      try {
        ComplianceEvent event = eventBus.take();
        RemediationOutcome outcome = workflow.handle(event);
        log.debug("Event processed: configRuleName={}, resourceId={}, outcome={}",
            event.configRuleName(), event.resourceId(), outcome.type());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (WorkflowExecutionException e) {
        // terminal for this delivery; the event is not re-queued
        log.error("Delivery failed: executionId={}, state={}",
            e.getExecutionId(), e.getFailedState());
      } catch (Exception e) {
        log.error("Error in RemediationWorker loop", e);
      }
    }
    log.info("RemediationWorker stopped");
  }

  public void shutdown() {
    this.running = false;
  }
}
