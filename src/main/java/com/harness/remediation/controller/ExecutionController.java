package com.harness.remediation.controller;

import com.harness.remediation.enums.ExecutionStatus;
import com.harness.remediation.model.ExecutionSummary;
import com.harness.remediation.service.ExecutionHistoryService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/executions")
public class ExecutionController {

  private final ExecutionHistoryService historyService;

  public ExecutionController(ExecutionHistoryService historyService) {
    this.historyService = historyService;
  }

  @GetMapping
  public ResponseEntity<List<ExecutionSummary>> listRecent(
      @RequestParam(value = "status", required = false) ExecutionStatus status) {
    return ResponseEntity.ok(historyService.listRecent(status));
  }

  @GetMapping("/{executionId}")
  public ResponseEntity<ExecutionSummary> getExecution(@PathVariable String executionId) {
    return historyService.getExecution(executionId)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }
}
