package com.harness.remediation.pipeline.worker;

import com.harness.remediation.pipeline.queue.EventBus;
import com.harness.remediation.workflow.RemediationWorkflow;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class RemediationWorkerPool {

  private static final Logger log = LoggerFactory.getLogger(RemediationWorkerPool.class);

  private final EventBus eventBus;
  private final RemediationWorkflow workflow;
  private final int workerCount;

  private final List<RemediationWorker> workers = new ArrayList<>();
  private final List<Thread> threads = new ArrayList<>();

  public RemediationWorkerPool(EventBus eventBus,
                               RemediationWorkflow workflow,
                               @Value("${remediation.worker.count:2}") int workerCount) {
    this.eventBus = eventBus;
    this.workflow = workflow;
    this.workerCount = workerCount;
  }

  @PostConstruct
  public void start() {
    for (int i = 0; i < workerCount; i++) {
      RemediationWorker worker = new RemediationWorker(eventBus, workflow);
      Thread thread = new Thread(worker, "remediation-worker-" + i);
      thread.setDaemon(true);
      workers.add(worker);
      threads.add(thread);
      thread.start();
    }
    log.info("Started {} remediation worker threads", workerCount);
  }

  @PreDestroy
  public void stop() {
    workers.forEach(RemediationWorker::shutdown);
    threads.forEach(Thread::interrupt);
  }
}
