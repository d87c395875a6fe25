package com.flamingo.ai.houseanalysis.service.analysis.inference;

import com.flamingo.ai.houseanalysis.domain.model.AssetReference;
import com.flamingo.ai.houseanalysis.domain.model.InferenceRequest;

/**
 * Outbound boundary to the multimodal inference service.
 *
 * <p>Both calls are blocking. Implementations report every transport problem (connection errors,
 * non-2xx statuses, malformed bodies) as an {@link InferenceTransportException}.
 */
public interface InferenceClient {

  /**
   * Uploads one visual asset to the service's asset store.
   *
   * @param assetName name to register the asset under
   * @param bytes image bytes
   * @param purpose purpose tag expected by the store
   * @return opaque handle for the stored asset
   */
  AssetReference registerAsset(String assetName, byte[] bytes, String purpose);

  /**
   * Runs a single completion over the instructions and the referenced assets.
   *
   * @param request instructions plus ordered asset references
   * @return the model's free-form answer text
   */
  String complete(InferenceRequest request);
}
