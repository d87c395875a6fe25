package com.flamingo.ai.houseanalysis.domain.model;

import java.util.List;

/**
 * A single multimodal completion request: fixed instructions followed by the ordered asset
 * references. Immutable once built.
 */
public record InferenceRequest(String instructionText, List<AssetReference> assetRefs) {

  public InferenceRequest {
    assetRefs = List.copyOf(assetRefs);
  }
}
