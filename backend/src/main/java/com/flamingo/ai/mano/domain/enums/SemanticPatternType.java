package com.flamingo.ai.mano.domain.enums;

import java.util.Arrays;
import java.util.Optional;

/** Cross-conversation pattern kinds reported by semantic search. */
public enum SemanticPatternType {
  RECURRING_THEME,
  ESCALATING_ISSUE,
  COLLABORATION_OPPORTUNITY,
  COMMUNICATION_GAP;

  public static Optional<SemanticPatternType> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(t -> t.name().equalsIgnoreCase(value.trim())).findFirst();
  }
}
