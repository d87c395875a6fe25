package com.flamingo.ai.houseanalysis.service.analysis;

/** Why the fallback verdict was returned. */
public enum FallbackReason {
  TIMED_OUT,
  UPSTREAM_FAILURE,
  EXTRACTION_FAILED;

  public String tag() {
    return name().toLowerCase();
  }
}
