package com.flamingo.ai.houseanalysis.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.config.MeterFilter;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Metrics wiring: {@code @Timed} support and a common service tag. */
@Configuration
public class ObservabilityConfig {

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterFilter serviceTagFilter(
      @Value("${spring.application.name:house-analysis}") String applicationName) {
    return MeterFilter.commonTags(List.of(Tag.of("service", applicationName)));
  }
}
