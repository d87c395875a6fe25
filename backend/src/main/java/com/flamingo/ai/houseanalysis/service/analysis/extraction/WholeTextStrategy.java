package com.flamingo.ai.houseanalysis.service.analysis.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Last resort: the whole trimmed answer must itself be a JSON object. */
@Component
@Order(3)
@RequiredArgsConstructor
public class WholeTextStrategy implements ExtractionStrategy {

  private final ObjectMapper objectMapper;

  @Override
  public Optional<ObjectNode> extract(String text) {
    return JsonObjects.parseObject(objectMapper, text.trim());
  }
}
