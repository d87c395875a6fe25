package com.flamingo.ai.houseanalysis.service.analysis.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/** Lenient parse of a candidate string into a JSON object. */
@Slf4j
final class JsonObjects {

  private JsonObjects() {}

  static Optional<ObjectNode> parseObject(ObjectMapper objectMapper, String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return Optional.empty();
    }
    try {
      JsonNode node = objectMapper.readTree(candidate);
      return node != null && node.isObject() ? Optional.of((ObjectNode) node) : Optional.empty();
    } catch (JsonProcessingException e) {
      log.debug("Candidate is not valid JSON: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }
}
