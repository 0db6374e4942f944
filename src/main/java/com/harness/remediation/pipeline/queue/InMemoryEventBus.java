package com.harness.remediation.pipeline.queue;

import com.harness.remediation.model.ComplianceEvent;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

public class InMemoryEventBus implements EventBus {

  private final BlockingQueue<ComplianceEvent> queue;

  public InMemoryEventBus(int capacity) {
    this.queue = new LinkedBlockingQueue<>(capacity);
  }

  @Override
  public boolean publish(ComplianceEvent event) {
    return queue.offer(event);
  }

  @Override
  public ComplianceEvent take() throws InterruptedException {
    return queue.take();
  }

  @Override
  public int size() {
    return queue.size();
  }
}
