package com.flamingo.ai.casestudy.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for executors that isolate blocking work from callers. */
@Configuration
public class AsyncConfig {

  /** Runs generative backend calls so that a hung call can be timed out and cancelled. */
  @Bean(name = "generationExecutor")
  public AsyncTaskExecutor generationExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("casestudy-gen-");
    executor.initialize();
    return executor;
  }

  /** Bounded pool for PDF page rasterisation. */
  @Bean(name = "renderExecutor")
  public AsyncTaskExecutor renderExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(20);
    executor.setThreadNamePrefix("casestudy-render-");
    executor.initialize();
    return executor;
  }
}
