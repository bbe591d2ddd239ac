package com.flamingo.ai.mano.agent.dto;

import java.util.List;

/** Structured output of SemanticPatternAgent. */
public record SemanticPatternsResult(List<DetectedPattern> patterns) {

  /** One pattern as reported by the model; type and trend are free strings until validated. */
  public record DetectedPattern(String type, String description, Double confidence, String trend) {}
}
