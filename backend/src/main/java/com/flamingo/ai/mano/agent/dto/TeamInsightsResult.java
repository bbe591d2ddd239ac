package com.flamingo.ai.mano.agent.dto;

import java.util.List;

/** Structured output of TeamInsightAgent. */
public record TeamInsightsResult(List<TeamInsight> insights) {

  /** A single team-wide observation. */
  public record TeamInsight(
      String type,
      String title,
      String description,
      List<String> steps,
      String priority,
      Double relevance) {}
}
