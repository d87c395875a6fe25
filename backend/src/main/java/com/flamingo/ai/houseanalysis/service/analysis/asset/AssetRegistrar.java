package com.flamingo.ai.houseanalysis.service.analysis.asset;

import com.flamingo.ai.houseanalysis.config.InferenceConfig;
import com.flamingo.ai.houseanalysis.domain.model.AssetReference;
import com.flamingo.ai.houseanalysis.domain.model.VisualAsset;
import com.flamingo.ai.houseanalysis.exception.UpstreamServiceException;
import com.flamingo.ai.houseanalysis.service.analysis.inference.InferenceClient;
import com.flamingo.ai.houseanalysis.service.analysis.inference.InferenceTransportException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Registers visual assets with the inference service's asset store.
 *
 * <p>Registration is sequential and synchronous so that the returned references line up with the
 * submitted assets: the model tells documents and pages apart only by position. The first failure
 * aborts the request; handles already obtained are not released.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetRegistrar {

  private final InferenceClient inferenceClient;
  private final InferenceConfig inferenceConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Registers all assets in order.
   *
   * @param assets assets in global submission order
   * @return one reference per asset, in the same order
   * @throws UpstreamServiceException naming the source file of the first asset that fails
   */
  @Timed(value = "analysis.register_assets", description = "Time to register all visual assets")
  public List<AssetReference> registerAll(List<VisualAsset> assets) {
    List<AssetReference> references = new ArrayList<>(assets.size());
    for (VisualAsset asset : assets) {
      references.add(register(asset));
    }
    return List.copyOf(references);
  }

  private AssetReference register(VisualAsset asset) {
    String purpose = inferenceConfig.getOpenai().getAssetPurpose();
    try {
      AssetReference reference =
          inferenceClient.registerAsset(asset.assetName(), asset.bytes(), purpose);
      meterRegistry.counter("analysis.assets.registered").increment();
      log.info("Registered asset {} as {}", asset.assetName(), reference.handle());
      return reference;
    } catch (InferenceTransportException e) {
      meterRegistry.counter("analysis.assets.failed").increment();
      log.error("Asset registration failed for {}: {}", asset.assetName(), e.getMessage());
      throw new UpstreamServiceException(
          asset.sourceFileName(),
          "Asset registration failed for " + asset.assetName() + ": " + e.getMessage(),
          e);
    }
  }
}
