package com.harness.remediation.config;

import com.harness.remediation.pipeline.queue.EventBus;
import com.harness.remediation.pipeline.queue.InMemoryEventBus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RemediationConfig {

  @Bean
  public EventBus eventBus(@Value("${remediation.queue.capacity:1000}") int capacity) {
    return new InMemoryEventBus(capacity);
  }
}
