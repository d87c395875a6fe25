package com.flamingo.ai.houseanalysis.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Resilience4j policies for outbound inference calls. */
@Configuration
public class ResilienceConfig {

  public static final String INFERENCE_TIME_LIMITER = "inference";

  /**
   * Deadline for the completion call. The running future is left alone on expiry: the remote call
   * is abandoned, never interrupted.
   */
  @Bean
  public TimeLimiter inferenceTimeLimiter(
      TimeLimiterRegistry timeLimiterRegistry, InferenceConfig inferenceConfig) {
    TimeLimiterConfig config =
        TimeLimiterConfig.custom()
            .timeoutDuration(inferenceConfig.getInvocation().getDeadline())
            .cancelRunningFuture(false)
            .build();
    return timeLimiterRegistry.timeLimiter(INFERENCE_TIME_LIMITER, config);
  }
}
