package com.flamingo.ai.corpusprep.config;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/** Creates the bounded pool that extracts and chunks sources in parallel. */
@Component
public class WorkerExecutorFactory {

  static final String THREAD_NAME_PREFIX = "corpus-worker-";

  /**
   * Creates and initializes an executor with a fixed number of worker threads. The caller owns
   * the executor and must shut it down.
   *
   * @param workers number of threads, at least 1
   */
  public ThreadPoolTaskExecutor create(int workers) {
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be at least 1: " + workers);
    }
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    executor.setThreadNamePrefix(THREAD_NAME_PREFIX);
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
