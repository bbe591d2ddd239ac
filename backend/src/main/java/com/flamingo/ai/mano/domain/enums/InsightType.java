package com.flamingo.ai.mano.domain.enums;

/** Kind of proactive insight surfaced to the manager. */
public enum InsightType {
  CONVERSATION_STARTER,
  FOLLOW_UP,
  PATTERN_ALERT,
  PREVENTIVE_ACTION,
  GROWTH_OPPORTUNITY
}
