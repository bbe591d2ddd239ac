package com.flamingo.ai.mano.domain.enums;

/** Kind of recurring pattern tracked by the learning engine. */
public enum PatternType {
  CHALLENGE,
  TOPIC,
  RELATIONSHIP,
  COMMUNICATION
}
