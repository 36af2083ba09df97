package com.scholary.chaptify.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for batch execution.
 *
 * <p>Sets up a bounded thread pool for processing files in parallel. When the queue is full the
 * submitting thread runs the file itself, which throttles submission.
 */
@Configuration
public class BatchConfig {

  @Bean(name = "batchExecutor")
  public Executor batchExecutor(ChapterProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.batchThreads());
    executor.setMaxPoolSize(properties.batchThreads());
    executor.setQueueCapacity(properties.batchQueueSize());
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setThreadNamePrefix("chaptify-");
    executor.initialize();
    return executor;
  }
}
