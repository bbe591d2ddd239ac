package com.flamingo.ai.mano.service.learning;

import com.flamingo.ai.mano.domain.enums.PatternType;
import java.util.List;

/** A pattern extracted from one conversation, before it is merged or stored. */
public record PatternCandidate(
    PatternType type,
    String description,
    List<String> keywords,
    double confidence,
    List<String> people,
    List<String> suggestedActions) {

  public PatternCandidate {
    keywords = keywords != null ? List.copyOf(keywords) : List.of();
    people = people != null ? List.copyOf(people) : List.of();
    suggestedActions = suggestedActions != null ? List.copyOf(suggestedActions) : List.of();
  }
}
