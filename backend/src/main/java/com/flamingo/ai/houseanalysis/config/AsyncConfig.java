package com.flamingo.ai.houseanalysis.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the executor that runs outbound completion calls. */
@Configuration
public class AsyncConfig {

  /**
   * Executor for completion calls raced against the invocation deadline.
   *
   * <p>Tasks are handed straight to a thread and never queued, so a completion that has been
   * abandoned cannot delay the start of a later one. Abandoned calls hold their thread until the
   * HTTP call itself times out.
   */
  @Bean(name = "inferenceExecutor")
  public Executor inferenceExecutor(InferenceConfig inferenceConfig) {
    InferenceConfig.Invocation invocation = inferenceConfig.getInvocation();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(invocation.getCorePoolSize());
    executor.setMaxPoolSize(invocation.getMaxPoolSize());
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("inference-");
    executor.initialize();
    return executor;
  }
}
