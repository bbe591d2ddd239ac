package com.flamingo.ai.mano.domain.enums;

import java.util.Arrays;

/** Direction a semantic pattern is moving in. */
public enum TrendDirection {
  IMPROVING,
  WORSENING,
  STABLE,
  EMERGING;

  public static TrendDirection fromValue(String value) {
    if (value == null) {
      return STABLE;
    }
    return Arrays.stream(values())
        .filter(t -> t.name().equalsIgnoreCase(value.trim()))
        .findFirst()
        .orElse(STABLE);
  }
}
