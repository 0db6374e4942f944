package com.harness.remediation.notification;

import com.harness.remediation.model.Notification;
import com.harness.remediation.notification.NotificationRecord.NotificationStage;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LoggingNotificationService implements NotificationService {

  private static final Logger log = LoggerFactory.getLogger(LoggingNotificationService.class);

  private final NotificationBuffer buffer;

  public LoggingNotificationService(NotificationBuffer buffer) {
    this.buffer = buffer;
  }

  @Override
  public void send(Notification notification) {
    NotificationStage stage = notification.isExit()
        ? NotificationStage.RESULT
        : NotificationStage.NON_COMPLIANCE;
    log.warn("COMPLIANCE NOTIFICATION: stage={}, outcome={}, subject={}, body={}",
        stage, notification.outcome(), notification.subject(), notification.body());

    buffer.record(new NotificationRecord(
        UUID.randomUUID().toString(),
        Instant.now(),
        stage,
        notification.outcome(),
        notification.subject(),
        notification.body()
    ));
  }
}
