package com.flamingo.ai.mano.service.context.model;

import com.flamingo.ai.mano.service.insight.ProactiveInsight;
import java.util.List;
import lombok.Builder;

/**
 * Transient per-turn view of the manager's team, themes, challenges and related past discussions.
 * Only {@code semanticContext} and {@code proactiveInsights} may be null; every other field is
 * always present, possibly empty.
 */
@Builder(toBuilder = true)
public record ManagementContext(
    List<PersonSummary> people,
    TeamSize teamSize,
    List<ConversationTheme> recentThemes,
    List<String> currentChallenges,
    ConversationPatterns conversationPatterns,
    SemanticContext semanticContext,
    List<ProactiveInsight> proactiveInsights) {

  public ManagementContext {
    people = people == null ? List.of() : List.copyOf(people);
    teamSize = teamSize == null ? TeamSize.EMPTY : teamSize;
    recentThemes = recentThemes == null ? List.of() : List.copyOf(recentThemes);
    currentChallenges = currentChallenges == null ? List.of() : List.copyOf(currentChallenges);
    conversationPatterns =
        conversationPatterns == null ? ConversationPatterns.EMPTY : conversationPatterns;
    proactiveInsights = proactiveInsights == null ? null : List.copyOf(proactiveInsights);
  }

  public static ManagementContext empty() {
    return ManagementContext.builder().build();
  }

  public boolean hasTeam() {
    return !people.isEmpty();
  }
}
