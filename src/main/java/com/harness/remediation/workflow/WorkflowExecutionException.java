package com.harness.remediation.workflow;

/**
 * An execution ended without its exit notification. Terminal for the
 * delivery that triggered it.
 */
public class WorkflowExecutionException extends RuntimeException {

  private final String executionId;
  private final WorkflowState failedState;

  public WorkflowExecutionException(String executionId, WorkflowState failedState, Throwable cause) {
    super("Workflow execution " + executionId + " failed in state " + failedState
        + ": " + cause.getMessage(), cause);
    this.executionId = executionId;
    this.failedState = failedState;
  }

  public String getExecutionId() {
    return executionId;
  }

  public WorkflowState getFailedState() {
    return failedState;
  }
}
