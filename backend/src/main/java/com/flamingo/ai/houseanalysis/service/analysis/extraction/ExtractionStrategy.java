package com.flamingo.ai.houseanalysis.service.analysis.extraction;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;

/**
 * One way of pulling a JSON object out of free-form model output.
 *
 * <p>Strategies are stateless and side-effect free. {@link VerdictExtractor} tries them in
 * {@code @Order} order and keeps the first object found.
 */
@FunctionalInterface
public interface ExtractionStrategy {

  /**
   * Attempts extraction.
   *
   * @param text raw model output
   * @return the parsed object, or empty when this strategy finds nothing parseable
   */
  Optional<ObjectNode> extract(String text);
}
