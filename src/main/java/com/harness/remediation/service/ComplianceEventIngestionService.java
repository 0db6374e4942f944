package com.harness.remediation.service;

import com.harness.remediation.model.ComplianceEvent;
import com.harness.remediation.model.ComplianceEventRequest;
import com.harness.remediation.pipeline.queue.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ComplianceEventIngestionService {

  private static final Logger log = LoggerFactory.getLogger(ComplianceEventIngestionService.class);

  private final EventBus eventBus;
  private final ComplianceEventFilter filter;

  public ComplianceEventIngestionService(EventBus eventBus, ComplianceEventFilter filter) {
    this.eventBus = eventBus;
    this.filter = filter;
  }

  public IngestionResult ingest(ComplianceEventRequest request) {
    ComplianceEvent event = request.toEvent();
    if (!filter.accepts(event)) {
      log.debug("Compliance event ignored: configRuleName={}, complianceType={}",
          event.configRuleName(), event.complianceType());
      return IngestionResult.IGNORED;
    }
    if (!eventBus.publish(event)) {
      log.warn("Remediation queue full, event rejected: configRuleName={}, resourceId={}",
          event.configRuleName(), event.resourceId());
      return IngestionResult.REJECTED;
    }
    return IngestionResult.QUEUED;
  }

  public enum IngestionResult {
    QUEUED,
    IGNORED,
    REJECTED
  }
}
