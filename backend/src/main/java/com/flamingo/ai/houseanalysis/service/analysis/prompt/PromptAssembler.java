package com.flamingo.ai.houseanalysis.service.analysis.prompt;

import com.flamingo.ai.houseanalysis.domain.model.AssetReference;
import com.flamingo.ai.houseanalysis.domain.model.InferenceRequest;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the single completion request for an analysis: the fixed {@link LeaseRiskInstructions}
 * followed by every asset reference in submission order. Output depends only on the references.
 */
@Component
@Slf4j
public class PromptAssembler {

  public InferenceRequest assemble(List<AssetReference> references) {
    if (references.isEmpty()) {
      throw new IllegalArgumentException("Cannot assemble a request without asset references");
    }
    log.debug("Assembling request with {} asset reference(s)", references.size());
    return new InferenceRequest(LeaseRiskInstructions.TEXT, references);
  }
}
