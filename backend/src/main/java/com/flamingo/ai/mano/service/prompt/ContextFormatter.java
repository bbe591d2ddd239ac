package com.flamingo.ai.mano.service.prompt;

import com.flamingo.ai.mano.domain.enums.ConversationType;
import com.flamingo.ai.mano.service.context.model.ConversationTheme;
import com.flamingo.ai.mano.service.context.model.ManagementContext;
import com.flamingo.ai.mano.service.context.model.PersonSummary;
import com.flamingo.ai.mano.service.context.model.SemanticContext;
import com.flamingo.ai.mano.service.context.model.TeamSize;
import com.flamingo.ai.mano.service.context.model.VectorSearchResult;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Renders a {@link ManagementContext} as the plain-text block embedded in system prompts. */
@Component
public class ContextFormatter {

  private static final int SIMILAR_LIMIT = 3;
  private static final int CROSS_PERSON_LIMIT = 2;
  private static final int EXCERPT_LENGTH = 100;

  /**
   * Formats the context.
   *
   * @param context the aggregated context
   * @param conversationType the kind of conversation the prompt is for
   * @param focusName name of the person being discussed, used in the conversation-type note
   */
  public String formatContext(
      ManagementContext context, ConversationType conversationType, String focusName) {
    ManagementContext safe = context != null ? context : ManagementContext.empty();
    boolean general = conversationType == null || conversationType == ConversationType.GENERAL;

    if (!safe.hasTeam()) {
      return PromptTemplates.EMPTY_TEAM
          + (general
              ? PromptTemplates.EMPTY_TEAM_GENERAL_NOTE
              : PromptTemplates.EMPTY_TEAM_INDIVIDUAL_NOTE)
          + "\n\n"
          + PromptTemplates.EMPTY_TEAM_CLOSING;
    }

    Map<UUID, String> names =
        safe.people().stream()
            .filter(person -> person.id() != null)
            .collect(Collectors.toMap(PersonSummary::id, PersonSummary::name, (a, b) -> a));

    StringBuilder text = new StringBuilder();
    appendTeam(text, safe.teamSize(), safe.people());
    appendThemes(text, safe.recentThemes());
    appendChallenges(text, safe.currentChallenges());
    appendSemantic(text, safe.semanticContext(), names);
    String focus = Objects.requireNonNullElse(focusName, "team member");
    text.append(
        general
            ? PromptTemplates.GENERAL_NOTE
            : String.format(PromptTemplates.FOCUSED_NOTE, focus));
    text.append("\n\n").append(PromptTemplates.CLOSING);
    return text.toString();
  }

  private void appendTeam(StringBuilder text, TeamSize teamSize, List<PersonSummary> people) {
    text.append("\nTEAM OVERVIEW:\n")
        .append("You manage ")
        .append(teamSize.directReports())
        .append(" direct reports, work with ")
        .append(teamSize.stakeholders())
        .append(" stakeholders, and coordinate with ")
        .append(teamSize.peers())
        .append(" peers.\n\nTEAM MEMBERS:\n")
        .append(people.stream().map(this::memberLine).collect(Collectors.joining("\n")));
  }

  private String memberLine(PersonSummary person) {
    String line =
        "- "
            + person.name()
            + ": "
            + (person.role() == null || person.role().isBlank()
                ? "No role specified"
                : person.role())
            + " ("
            + (person.relationshipType() != null ? person.relationshipType().getValue() : "unknown")
            + ")";
    if (!person.recentThemes().isEmpty()) {
      line += " - Recent topics: " + String.join(", ", person.recentThemes());
    }
    return line;
  }

  private void appendThemes(StringBuilder text, List<ConversationTheme> themes) {
    if (themes.isEmpty()) {
      return;
    }
    text.append("\nRECENT MANAGEMENT THEMES (Last 30 days):\n")
        .append(
            themes.stream()
                .map(
                    theme ->
                        "- "
                            + theme.theme()
                            + ": discussed "
                            + theme.frequency()
                            + " times across "
                            + theme.peopleInvolved().size()
                            + " conversations")
                .collect(Collectors.joining("\n")));
  }

  private void appendChallenges(StringBuilder text, List<String> challenges) {
    if (challenges.isEmpty()) {
      return;
    }
    text.append("\nCURRENT CHALLENGES DETECTED:\n")
        .append(challenges.stream().map(c -> "- " + c).collect(Collectors.joining("\n")));
  }

  private void appendSemantic(
      StringBuilder text, SemanticContext semantic, Map<UUID, String> names) {
    if (semantic == null) {
      return;
    }
    Function<VectorSearchResult, String> speaker =
        hit ->
            hit.personId() == null
                ? "General discussion"
                : names.getOrDefault(hit.personId(), "Unknown");

    if (!semantic.similarConversations().isEmpty()) {
      text.append("\nRELEVANT PAST DISCUSSIONS:\n")
          .append(
              semantic.similarConversations().stream()
                  .limit(SIMILAR_LIMIT)
                  .map(
                      hit ->
                          "- "
                              + speaker.apply(hit)
                              + ": \""
                              + excerpt(hit.content())
                              + "...\" ("
                              + Math.round(hit.similarity() * 100)
                              + "% relevant)")
                  .collect(Collectors.joining("\n")));
    }
    if (!semantic.crossPersonInsights().isEmpty()) {
      text.append("\nRELATED INSIGHTS FROM OTHER CONVERSATIONS:\n")
          .append(
              semantic.crossPersonInsights().stream()
                  .limit(CROSS_PERSON_LIMIT)
                  .map(
                      hit ->
                          "- "
                              + names.getOrDefault(hit.personId(), "Unknown")
                              + ": \""
                              + excerpt(hit.content())
                              + "...\"")
                  .collect(Collectors.joining("\n")));
    }
  }

  private static String excerpt(String content) {
    String value = content != null ? content : "";
    return value.length() > EXCERPT_LENGTH ? value.substring(0, EXCERPT_LENGTH) : value;
  }
}
