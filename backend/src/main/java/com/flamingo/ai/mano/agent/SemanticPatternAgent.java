package com.flamingo.ai.mano.agent;

import com.flamingo.ai.mano.agent.dto.SemanticPatternsResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Finds patterns that span several related conversations. */
public interface SemanticPatternAgent {

  @SystemMessage(
      """
        You identify management patterns across related conversations.

        Pattern types: recurring_theme, escalating_issue, collaboration_opportunity,
        communication_gap. Trends: improving, worsening, stable, emerging.

        Return 1-2 patterns as JSON:
        {"patterns": [{"type": "...", "description": "...", "confidence": 0.0-1.0,
                       "trend": "..."}]}
        Return {"patterns": []} if no clear pattern exists.
        """)
  @UserMessage(
      """
        Query: {{query}}

        Conversations:
        {{conversations}}
        """)
  SemanticPatternsResult detect(
      @V("query") String query, @V("conversations") String conversations);
}
