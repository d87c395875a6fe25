package com.flamingo.ai.houseanalysis.service.analysis.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.houseanalysis.domain.model.Verdict;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Parses the first flat brace-delimited object that mentions the {@code excessive_loan} key. */
@Component
@Order(2)
@RequiredArgsConstructor
public class InlineVerdictObjectStrategy implements ExtractionStrategy {

  private static final Pattern INLINE_OBJECT =
      Pattern.compile("\\{[^{}]*\"" + Verdict.EXCESSIVE_LOAN + "\"[^{}]*}", Pattern.DOTALL);

  private final ObjectMapper objectMapper;

  @Override
  public Optional<ObjectNode> extract(String text) {
    Matcher matcher = INLINE_OBJECT.matcher(text);
    return matcher.find()
        ? JsonObjects.parseObject(objectMapper, matcher.group())
        : Optional.empty();
  }
}
