package com.flamingo.ai.mano.service.insight;

import com.flamingo.ai.mano.domain.enums.InsightType;
import com.flamingo.ai.mano.domain.enums.Priority;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.Builder;

/** A suggestion surfaced to the manager before they ask for it. */
@Builder
public record ProactiveInsight(
    String id,
    InsightType type,
    String title,
    String description,
    Priority priority,
    UUID personId,
    String personName,
    List<String> actionableSteps,
    double relevanceScore,
    LocalDateTime createdAt,
    LocalDateTime expiresAt) {

  public ProactiveInsight {
    actionableSteps = actionableSteps == null ? List.of() : List.copyOf(actionableSteps);
    priority = priority == null ? Priority.MEDIUM : priority;
  }

  /** Ranking score: priority weight times relevance. */
  public double rankScore() {
    return priority.getWeight() * relevanceScore;
  }
}
