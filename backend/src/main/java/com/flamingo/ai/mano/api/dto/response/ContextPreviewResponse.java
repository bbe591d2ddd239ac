package com.flamingo.ai.mano.api.dto.response;

import com.flamingo.ai.mano.domain.enums.ConversationType;
import com.flamingo.ai.mano.service.context.model.ConversationTheme;
import com.flamingo.ai.mano.service.context.model.ManagementContext;
import com.flamingo.ai.mano.service.context.model.TeamSize;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** The context Mano would use for a turn, structured and as prompt text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextPreviewResponse {

  private ConversationType conversationType;
  private TeamSize teamSize;
  private List<String> themes;
  private List<String> challenges;
  private int similarConversations;
  private int crossPersonInsights;
  private boolean semanticSearchUsed;
  private String formattedContext;

  public static ContextPreviewResponse from(
      ConversationType type, ManagementContext context, String formattedContext) {
    boolean semantic = context.semanticContext() != null;
    return ContextPreviewResponse.builder()
        .conversationType(type)
        .teamSize(context.teamSize())
        .themes(context.recentThemes().stream().map(ConversationTheme::theme).toList())
        .challenges(context.currentChallenges())
        .similarConversations(
            semantic ? context.semanticContext().similarConversations().size() : 0)
        .crossPersonInsights(semantic ? context.semanticContext().crossPersonInsights().size() : 0)
        .semanticSearchUsed(semantic)
        .formattedContext(formattedContext)
        .build();
  }
}
