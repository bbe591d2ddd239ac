package com.flamingo.ai.mano.service.prompt;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.mano.domain.enums.ConversationType;
import com.flamingo.ai.mano.domain.enums.RelationshipType;
import com.flamingo.ai.mano.service.context.model.ConversationTheme;
import com.flamingo.ai.mano.service.context.model.ManagementContext;
import com.flamingo.ai.mano.service.context.model.PersonSummary;
import com.flamingo.ai.mano.service.context.model.SemanticContext;
import com.flamingo.ai.mano.service.context.model.TeamSize;
import com.flamingo.ai.mano.service.context.model.VectorSearchResult;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ContextFormatterTest {

  private final ContextFormatter formatter = new ContextFormatter();

  private final UUID sarahId = UUID.randomUUID();
  private final UUID tomId = UUID.randomUUID();

  private ManagementContext teamContext(SemanticContext semantic) {
    return ManagementContext.builder()
        .people(
            List.of(
                PersonSummary.builder()
                    .id(sarahId)
                    .name("Sarah")
                    .role("Senior Engineer")
                    .relationshipType(RelationshipType.DIRECT_REPORT)
                    .recentThemes(List.of("career", "goals"))
                    .build(),
                PersonSummary.builder()
                    .id(tomId)
                    .name("Tom")
                    .relationshipType(RelationshipType.STAKEHOLDER)
                    .build()))
        .teamSize(new TeamSize(1, 1, 0, 0))
        .recentThemes(
            List.of(
                new ConversationTheme(
                    "performance", 4, List.of(sarahId.toString()), null, List.of())))
        .currentChallenges(List.of("Workload Management"))
        .semanticContext(semantic)
        .build();
  }

  private static VectorSearchResult hit(UUID personId, String content, double similarity) {
    return VectorSearchResult.builder()
        .id(UUID.randomUUID())
        .personId(personId)
        .content(content)
        .similarity(similarity)
        .build();
  }

  @Nested
  @DisplayName("empty team")
  class EmptyTeamTests {

    @Test
    @DisplayName("should render the onboarding message for general conversations")
    void shouldRenderGeneralOnboarding() {
      String text =
          formatter.formatContext(ManagementContext.empty(), ConversationType.GENERAL, null);

      assertThat(text)
          .isEqualTo(
              PromptTemplates.EMPTY_TEAM
                  + PromptTemplates.EMPTY_TEAM_GENERAL_NOTE
                  + "\n\n"
                  + PromptTemplates.EMPTY_TEAM_CLOSING);
    }

    @Test
    @DisplayName("should render the individual note for person conversations")
    void shouldRenderIndividualNote() {
      String text = formatter.formatContext(null, ConversationType.PERSON, "Sarah");

      assertThat(text).contains("Individual discussion - no broader team context available yet");
    }
  }

  @Test
  @DisplayName("should render team, themes and challenges sections")
  void shouldRenderTeamSections() {
    String text = formatter.formatContext(teamContext(null), ConversationType.GENERAL, null);

    assertThat(text)
        .contains(
            "You manage 1 direct reports, work with 1 stakeholders, and coordinate with 0 peers.")
        .contains("- Sarah: Senior Engineer (direct_report) - Recent topics: career, goals")
        .contains("- Tom: No role specified (stakeholder)")
        .contains("- performance: discussed 4 times across 1 conversations")
        .contains("CURRENT CHALLENGES DETECTED:\n- Workload Management")
        .contains("General management discussion - use full team context")
        .doesNotContain("RELEVANT PAST DISCUSSIONS")
        .endsWith(PromptTemplates.CLOSING);
  }

  @Test
  @DisplayName("should name the focus person in person conversations")
  void shouldRenderFocusedNote() {
    String text = formatter.formatContext(teamContext(null), ConversationType.PERSON, "Sarah");

    assertThat(text).contains("CONVERSATION TYPE: Focused discussion about Sarah");
  }

  @Test
  @DisplayName("should render at most three past discussions and two cross-person insights")
  void shouldRenderSemanticSections() {
    SemanticContext semantic =
        new SemanticContext(
            List.of(
                hit(sarahId, "x".repeat(150), 0.876),
                hit(null, "Team offsite planning", 0.8),
                hit(UUID.randomUUID(), "Someone else", 0.79),
                hit(sarahId, "Fourth hit", 0.78)),
            List.of(hit(tomId, "Budget", 0.8), hit(tomId, "Second", 0.8), hit(tomId, "Third", 0.8)),
            List.of());

    String text = formatter.formatContext(teamContext(semantic), ConversationType.GENERAL, null);

    assertThat(text)
        .contains("- Sarah: \"" + "x".repeat(100) + "...\" (88% relevant)")
        .contains("- General discussion: \"Team offsite planning...\" (80% relevant)")
        .contains("- Unknown: \"Someone else...\" (79% relevant)")
        .doesNotContain("Fourth hit")
        .contains("RELATED INSIGHTS FROM OTHER CONVERSATIONS:\n- Tom: \"Budget...\"")
        .doesNotContain("Third");
  }

  @Test
  @DisplayName("should produce identical output for identical input")
  void shouldBeDeterministic() {
    ManagementContext context = teamContext(null);

    assertThat(formatter.formatContext(context, ConversationType.SELF, "Me"))
        .isEqualTo(formatter.formatContext(context, ConversationType.SELF, "Me"));
  }
}
