package com.flamingo.ai.docqa.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the thread pool that runs embedding/generation calls under a time limit. */
@Configuration
public class AsyncConfig {

  static final int CAPABILITY_THREADS = 16;
  static final int CAPABILITY_QUEUE_CAPACITY = 32;

  @Bean(name = "capabilityExecutor")
  public Executor capabilityExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    // Grow to the full pool before queueing: queue time counts against the call timeout
    executor.setCorePoolSize(CAPABILITY_THREADS);
    executor.setMaxPoolSize(CAPABILITY_THREADS);
    executor.setAllowCoreThreadTimeOut(true);
    executor.setKeepAliveSeconds(60);
    executor.setQueueCapacity(CAPABILITY_QUEUE_CAPACITY);
    executor.setThreadNamePrefix("capability-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
