package com.flamingo.ai.mano.service.context.model;

import com.flamingo.ai.mano.domain.enums.SemanticPatternType;
import com.flamingo.ai.mano.domain.enums.TrendDirection;
import java.util.List;
import java.util.UUID;

/** A pattern spanning several semantically similar conversations. */
public record SemanticPattern(
    SemanticPatternType type,
    String description,
    List<UUID> supportingConversations,
    double confidence,
    TrendDirection trend) {

  public SemanticPattern {
    supportingConversations = List.copyOf(supportingConversations);
  }
}
