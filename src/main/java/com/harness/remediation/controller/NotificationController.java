package com.harness.remediation.controller;

import com.harness.remediation.enums.OutcomeType;
import com.harness.remediation.notification.NotificationBuffer;
import com.harness.remediation.notification.NotificationRecord;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/v1/notifications")
public class NotificationController {

  private final NotificationBuffer buffer;

  public NotificationController(NotificationBuffer buffer) {
    this.buffer = buffer;
  }

  @GetMapping
  public ResponseEntity<List<NotificationRecord>> getRecent(
      @RequestParam(value = "outcome", required = false) OutcomeType outcome) {
    return ResponseEntity.ok(buffer.recent(outcome));
  }

  @GetMapping("/outcomes")
  public ResponseEntity<Map<OutcomeType, Long>> outcomeCounts() {
    return ResponseEntity.ok(buffer.outcomeCounts());
  }

  @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter stream() {
    return buffer.subscribe();
  }
}
