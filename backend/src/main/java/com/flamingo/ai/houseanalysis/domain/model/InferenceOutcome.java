package com.flamingo.ai.houseanalysis.domain.model;

import java.time.Duration;

/** Result of a bounded completion call: success, deadline expiry or transport failure. */
public sealed interface InferenceOutcome
    permits InferenceOutcome.Success, InferenceOutcome.TimedOut, InferenceOutcome.UpstreamFailure {

  static InferenceOutcome success(String rawText) {
    return new Success(rawText);
  }

  static InferenceOutcome timedOut(Duration deadline) {
    return new TimedOut(deadline);
  }

  static InferenceOutcome upstreamFailure(String reason) {
    return new UpstreamFailure(reason);
  }

  /** The service answered within the deadline. */
  record Success(String rawText) implements InferenceOutcome {}

  /** The deadline elapsed first; the in-flight call was abandoned. */
  record TimedOut(Duration deadline) implements InferenceOutcome {}

  /** Transport-level failure before or during the wait. */
  record UpstreamFailure(String reason) implements InferenceOutcome {}
}
