package com.harness.remediation.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.remediation.enums.OutcomeType;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Window over the latest compliance notifications plus running counts of
 * exit notifications per outcome. Entry notifications carry no outcome and are
 * only windowed. Each recorded notification is also pushed to SSE subscribers,
 * as an event named after its stage.
 */
@Component
public class NotificationBuffer {

  private static final Logger log = LoggerFactory.getLogger(NotificationBuffer.class);

  private final Deque<NotificationRecord> window = new ConcurrentLinkedDeque<>();
  private final Map<OutcomeType, AtomicLong> outcomeCounts = new EnumMap<>(OutcomeType.class);
  private final List<SseEmitter> subscribers = new CopyOnWriteArrayList<>();
  private final ObjectMapper objectMapper;
  private final int windowSize;

  public NotificationBuffer(ObjectMapper objectMapper,
                            @Value("${remediation.notifications.buffer-size:100}") int windowSize) {
    this.objectMapper = objectMapper;
    this.windowSize = windowSize;
    for (OutcomeType type : OutcomeType.values()) {
      outcomeCounts.put(type, new AtomicLong());
    }
  }

  public void record(NotificationRecord notification) {
    window.addFirst(notification);
    while (window.size() > windowSize) {
      window.pollLast();
    }
    if (notification.outcome() != null) {
      outcomeCounts.get(notification.outcome()).incrementAndGet();
    }
    fanOut(notification);
  }

  /**
   * Newest first. A non-null {@code outcome} keeps only exit notifications
   * reporting that outcome.
   */
  public List<NotificationRecord> recent(OutcomeType outcome) {
    List<NotificationRecord> matching = new ArrayList<>();
    for (NotificationRecord notification : window) {
      if (outcome == null || outcome == notification.outcome()) {
        matching.add(notification);
      }
    }
    return matching;
  }

  public List<NotificationRecord> getRecent() {
    return recent(null);
  }

  /**
   * Exit notifications seen per outcome since startup, including those that
   * already left the window.
   */
  public Map<OutcomeType, Long> outcomeCounts() {
    Map<OutcomeType, Long> snapshot = new EnumMap<>(OutcomeType.class);
    outcomeCounts.forEach((type, count) -> snapshot.put(type, count.get()));
    return snapshot;
  }

  public SseEmitter subscribe() {
    SseEmitter emitter = new SseEmitter(0L);
    subscribers.add(emitter);
    emitter.onCompletion(() -> subscribers.remove(emitter));
    emitter.onTimeout(() -> subscribers.remove(emitter));
    emitter.onError(e -> subscribers.remove(emitter));
    return emitter;
  }

  private void fanOut(NotificationRecord notification) {
    if (subscribers.isEmpty()) {
      return;
    }
    String payload;
    try {
      payload = objectMapper.writeValueAsString(notification);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize notification id={}", notification.id(), e);
      return;
    }
    String eventName = notification.stage().name().toLowerCase(Locale.ROOT);
    for (SseEmitter emitter : subscribers) {
      try {
        emitter.send(SseEmitter.event().id(notification.id()).name(eventName).data(payload));
      } catch (IOException | IllegalStateException e) {
        log.debug("Dropping notification subscriber: {}", e.getMessage());
        subscribers.remove(emitter);
      }
    }
  }
}
