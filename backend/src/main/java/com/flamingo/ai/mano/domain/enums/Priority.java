package com.flamingo.ai.mano.domain.enums;

import java.util.Arrays;

/** Priority of an insight, with the weight used when ranking insights. */
public enum Priority {
  HIGH(3),
  MEDIUM(2),
  LOW(1);

  private final int weight;

  Priority(int weight) {
    this.weight = weight;
  }

  public int getWeight() {
    return weight;
  }

  /** Parses a model-provided priority, falling back to {@code defaultValue} when unknown. */
  public static Priority fromValue(String value, Priority defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Arrays.stream(values())
        .filter(p -> p.name().equalsIgnoreCase(value.trim()))
        .findFirst()
        .orElse(defaultValue);
  }
}
