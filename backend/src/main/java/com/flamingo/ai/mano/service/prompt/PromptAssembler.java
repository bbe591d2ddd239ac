package com.flamingo.ai.mano.service.prompt;

import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.domain.entity.UserProfile;
import com.flamingo.ai.mano.domain.enums.ConversationType;
import com.flamingo.ai.mano.service.context.model.ConversationTarget;
import com.flamingo.ai.mano.service.context.model.ManagementContext;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Renders the system prompt for a coaching turn. Rendering is pure: the same target, context,
 * history and profile always produce the same text.
 */
@Component
@RequiredArgsConstructor
public class PromptAssembler {

  static final int HISTORY_LIMIT = 10;

  private static final Pattern PLACEHOLDER =
      Pattern.compile(
          "\\{(user_context|name|role|relationship_type|management_context"
              + "|conversation_history)\\}");

  private final ContextFormatter contextFormatter;

  /**
   * Renders the prompt.
   *
   * @param target who or what the conversation is about
   * @param context the aggregated management context
   * @param history conversation so far, oldest first; only the last ten messages are used
   * @param userProfile the manager's profile, may be null
   */
  public String render(
      ConversationTarget target,
      ManagementContext context,
      List<ChatMessage> history,
      UserProfile userProfile) {
    ConversationTarget safeTarget = target != null ? target : ConversationTarget.general();
    ConversationType type = safeTarget.type();

    String template =
        switch (type) {
          case PERSON -> PromptTemplates.PERSON;
          case SELF -> PromptTemplates.SELF;
          case GENERAL -> PromptTemplates.GENERAL;
        };

    String managementContext = contextFormatter.formatContext(context, type, safeTarget.name());
    if (type != ConversationType.GENERAL) {
      managementContext += profileSection(userProfile);
    }

    Map<String, String> values =
        Map.of(
            "user_context", userContext(userProfile),
            "name", Objects.requireNonNullElse(safeTarget.name(), "General"),
            "role", isBlank(safeTarget.role()) ? "Team member" : safeTarget.role(),
            "relationship_type",
                safeTarget.relationshipType() != null
                    ? safeTarget.relationshipType().getValue()
                    : "colleague",
            "management_context", managementContext,
            "conversation_history", historyText(history));
    return substitute(template, values);
  }

  /** "You are speaking with ..." line built from the profile. */
  String userContext(UserProfile profile) {
    if (profile == null || isBlank(profile.getCallName())) {
      return "You are speaking with a manager.";
    }
    StringBuilder text = new StringBuilder("You are speaking with ").append(profile.getCallName());
    if (!isBlank(profile.getJobRole())) {
      text.append(", ").append(profile.getJobRole());
    }
    if (!isBlank(profile.getCompany())) {
      text.append(" at ").append(profile.getCompany());
    }
    return text.append('.').toString();
  }

  /** The last ten messages as "Manager:" and "Mano:" lines. */
  String historyText(List<ChatMessage> history) {
    if (history == null || history.isEmpty()) {
      return "";
    }
    return history.subList(Math.max(0, history.size() - HISTORY_LIMIT), history.size()).stream()
        .map(message -> (message.isFromUser() ? "Manager: " : "Mano: ") + message.getContent())
        .collect(Collectors.joining("\n"));
  }

  private String profileSection(UserProfile profile) {
    if (profile == null || isBlank(profile.getProfileContext())) {
      return "";
    }
    String who = isBlank(profile.getCallName()) ? "the manager" : profile.getCallName();
    return String.format(PromptTemplates.PROFILE_SECTION, who, profile.getProfileContext().trim());
  }

  private static String substitute(String template, Map<String, String> values) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder result = new StringBuilder(template.length() + 1024);
    while (matcher.find()) {
      matcher.appendReplacement(result, Matcher.quoteReplacement(values.get(matcher.group(1))));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
