package com.flamingo.ai.houseanalysis.service.analysis.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;
import java.util.Set;

/**
 * Total normalization of model-provided values to booleans.
 *
 * <p>JSON booleans are kept. Scalars whose text form is one of {@code true}, {@code 1} or {@code
 * yes} (trimmed, case-insensitive) become {@code true}. Everything else, including null, objects
 * and arrays, becomes {@code false}.
 */
public final class BooleanTokens {

  public static final Set<String> TRUTHY = Set.of("true", "1", "yes");

  private BooleanTokens() {}

  public static boolean normalize(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode() || value.isContainerNode()) {
      return false;
    }
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    return TRUTHY.contains(value.asText().trim().toLowerCase(Locale.ROOT));
  }
}
