package com.flamingo.ai.mano.domain.enums;

/** Which tier of the person detector produced the final result. */
public enum DetectionMethod {
  AI_VALIDATED,
  PATTERN_ONLY,
  BASIC_FALLBACK
}
