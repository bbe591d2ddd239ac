package com.flamingo.ai.mano.domain.enums;

import java.util.Arrays;
import java.util.Optional;

/** How a roster member relates to the manager using the coach. */
public enum RelationshipType {
  DIRECT_REPORT("direct_report"),
  MANAGER("manager"),
  PEER("peer"),
  STAKEHOLDER("stakeholder"),
  /** The manager themselves, used for self-reflection conversations. */
  SELF("self");

  private final String value;

  RelationshipType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /** Human readable label used in prompts, e.g. "direct report". */
  public String getLabel() {
    return value.replace('_', ' ');
  }

  public static Optional<RelationshipType> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase().replace(' ', '_').replace('-', '_');
    return Arrays.stream(values()).filter(t -> t.value.equals(normalized)).findFirst();
  }
}
