package com.flamingo.ai.mano.agent;

import com.flamingo.ai.mano.agent.dto.ConversationStarterResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Suggests how to reconnect with a team member the manager has not discussed lately. */
public interface ConversationStarterAgent {

  @SystemMessage(
      """
        You suggest conversation starters for a manager who has not talked about a team
        member for a while. Be specific to the person's role and relationship.

        Return ONLY JSON:
        {"title": "...", "description": "...", "suggestedQuestions": ["..."],
         "priority": "high|medium|low", "relevance": 0.0-1.0}
        """)
  @UserMessage(
      """
        Person: {{name}}
        Role: {{role}}
        Relationship: {{relationship}}
        Days since last conversation: {{days}}
        Team themes: {{themes}}
        """)
  ConversationStarterResult suggest(
      @V("name") String name,
      @V("role") String role,
      @V("relationship") String relationship,
      @V("days") String days,
      @V("themes") String themes);
}
