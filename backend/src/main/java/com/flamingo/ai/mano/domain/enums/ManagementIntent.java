package com.flamingo.ai.mano.domain.enums;

import java.util.List;

/** Search intents that bias semantic search towards a management concern. */
public enum ManagementIntent {
  COACHING_MOMENTS(List.of("coaching", "feedback", "development", "mentoring", "guidance")),
  PERFORMANCE_PATTERNS(
      List.of("performance", "goals", "achievements", "challenges", "improvement")),
  TEAM_DYNAMICS(List.of("collaboration", "communication", "conflict", "teamwork", "relationships")),
  GROWTH_OPPORTUNITIES(List.of("career", "skills", "learning", "promotion", "opportunities"));

  private final List<String> keywords;

  ManagementIntent(List<String> keywords) {
    this.keywords = keywords;
  }

  public List<String> getKeywords() {
    return keywords;
  }
}
