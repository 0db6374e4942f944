package com.harness.remediation.notification;

import com.harness.remediation.model.Notification;

public interface NotificationService {

  /**
   * Fire-and-forget; no delivery confirmation is returned.
   */
  void send(Notification notification);
}
