package com.harness.remediation.controller;

import com.harness.remediation.model.ComplianceEventRequest;
import com.harness.remediation.model.RemediationOutcome;
import com.harness.remediation.service.ComplianceEventIngestionService;
import com.harness.remediation.service.ComplianceEventIngestionService.IngestionResult;
import com.harness.remediation.workflow.RemediationWorkflow;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/compliance-events")
public class ComplianceEventController {

  private final ComplianceEventIngestionService ingestionService;
  private final RemediationWorkflow workflow;

  public ComplianceEventController(ComplianceEventIngestionService ingestionService,
                                   RemediationWorkflow workflow) {
    this.ingestionService = ingestionService;
    this.workflow = workflow;
  }

  @PostMapping
  public ResponseEntity<IngestionResponse> ingest(@Valid @RequestBody ComplianceEventRequest request) {
    IngestionResult result = ingestionService.ingest(request);
    HttpStatus status = switch (result) {
      case QUEUED -> HttpStatus.ACCEPTED;
      case IGNORED -> HttpStatus.OK;
      case REJECTED -> HttpStatus.SERVICE_UNAVAILABLE;
    };
    return ResponseEntity.status(status).body(new IngestionResponse(result));
  }

  /**
   * Runs the workflow on the calling thread, skipping the event filter.
   */
  @PostMapping("/remediate")
  public ResponseEntity<RemediationOutcome> remediate(
      @Valid @RequestBody ComplianceEventRequest request) {
    return ResponseEntity.ok(workflow.handle(request.toEvent()));
  }

  public record IngestionResponse(IngestionResult result) {}
}
