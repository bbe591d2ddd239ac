package com.flamingo.ai.mano.agent.dto;

import java.util.List;

/** Structured output of PersonValidationAgent. */
public record PersonValidationResult(List<NameScore> validations) {

  /** Plausibility (1-10) that {@code name} is a real person. */
  public record NameScore(String name, Integer score, String reasoning) {}
}
