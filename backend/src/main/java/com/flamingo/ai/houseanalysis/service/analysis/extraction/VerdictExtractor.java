package com.flamingo.ai.houseanalysis.service.analysis.extraction;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.houseanalysis.domain.model.Verdict;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reduces free-form model output to a {@link Verdict}.
 *
 * <p>The first strategy that yields a JSON object wins; later strategies are not consulted even if
 * that object turns out to be incomplete. The object must carry all six verdict keys, and each
 * value goes through {@link BooleanTokens#normalize}.
 */
@Service
@Slf4j
public class VerdictExtractor {

  private final List<ExtractionStrategy> strategies;

  public VerdictExtractor(List<ExtractionStrategy> strategies) {
    this.strategies = List.copyOf(strategies);
  }

  /**
   * Extracts and validates a verdict.
   *
   * @param rawText model output
   * @return the verdict, or empty when no object is found or a key is missing
   */
  public Optional<Verdict> extract(String rawText) {
    if (rawText == null || rawText.isBlank()) {
      log.warn("Model output is empty");
      return Optional.empty();
    }

    Optional<ObjectNode> candidate = firstObject(rawText);
    if (candidate.isEmpty()) {
      log.warn("No JSON object found in model output");
      return Optional.empty();
    }

    ObjectNode object = candidate.get();
    List<String> missing = Verdict.KEYS.stream().filter(key -> !object.has(key)).toList();
    if (!missing.isEmpty()) {
      log.warn("Model output is missing required keys {}: {}", missing, object);
      return Optional.empty();
    }

    return Optional.of(
        new Verdict(
            BooleanTokens.normalize(object.get(Verdict.EXCESSIVE_LOAN)),
            BooleanTokens.normalize(object.get(Verdict.RIGHTS_RESTRICTION)),
            BooleanTokens.normalize(object.get(Verdict.TRUST_PROPERTY)),
            BooleanTokens.normalize(object.get(Verdict.RESIDENTIAL_USE)),
            BooleanTokens.normalize(object.get(Verdict.TAX_DELINQUENCY)),
            BooleanTokens.normalize(object.get(Verdict.OWNER_VERIFICATION))));
  }

  private Optional<ObjectNode> firstObject(String rawText) {
    for (ExtractionStrategy strategy : strategies) {
      Optional<ObjectNode> result = strategy.extract(rawText);
      if (result.isPresent()) {
        log.debug("Extracted JSON object with {}", strategy.getClass().getSimpleName());
        return result;
      }
    }
    return Optional.empty();
  }
}
