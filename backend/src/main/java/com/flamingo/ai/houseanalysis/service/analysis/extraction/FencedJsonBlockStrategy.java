package com.flamingo.ai.houseanalysis.service.analysis.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Parses the first fenced block tagged {@code json}. */
@Component
@Order(1)
@RequiredArgsConstructor
public class FencedJsonBlockStrategy implements ExtractionStrategy {

  private static final Pattern FENCED_JSON =
      Pattern.compile("```json\\s*(\\{.*?})\\s*```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

  private final ObjectMapper objectMapper;

  @Override
  public Optional<ObjectNode> extract(String text) {
    Matcher matcher = FENCED_JSON.matcher(text);
    return matcher.find()
        ? JsonObjects.parseObject(objectMapper, matcher.group(1))
        : Optional.empty();
  }
}
