package com.flamingo.ai.houseanalysis.service.analysis;

import com.flamingo.ai.houseanalysis.domain.model.Verdict;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Supplies {@link Verdict#FALLBACK} when the completion times out, fails in transport, or cannot be
 * reduced to a valid verdict. The substitution is logged and counted but never raised.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FallbackVerdictPolicy {

  private final MeterRegistry meterRegistry;

  public Verdict apply(FallbackReason reason, String detail) {
    log.warn("Returning fallback verdict ({}): {}", reason, detail);
    meterRegistry.counter("analysis.verdict", "source", "fallback", "reason", reason.tag())
        .increment();
    return Verdict.FALLBACK;
  }
}
