package com.harness.remediation.controller;

import com.harness.remediation.workflow.WorkflowExecutionException;
import com.harness.remediation.workflow.WorkflowState;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class RestExceptionHandler {

  @ExceptionHandler(WorkflowExecutionException.class)
  public ResponseEntity<WorkflowErrorResponse> workflowFailed(WorkflowExecutionException e) {
    String cause = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
    return ResponseEntity
        .status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new WorkflowErrorResponse(e.getExecutionId(), e.getFailedState(), cause));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<String> badRequest(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(e.getMessage());
  }

  public record WorkflowErrorResponse(String executionId, WorkflowState failedState, String error) {}
}
