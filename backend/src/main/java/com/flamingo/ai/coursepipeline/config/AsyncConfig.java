package com.flamingo.ai.coursepipeline.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for executors used outside the job worker pools. */
@Configuration
public class AsyncConfig {

  /** Runs structuring calls so they can be abandoned once the configured timeout elapses. */
  @Bean(name = "structuringExecutor")
  public Executor structuringExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(20);
    executor.setThreadNamePrefix("structuring-");
    executor.initialize();
    return executor;
  }
}
