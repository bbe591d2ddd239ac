package com.flamingo.ai.mano.agent;

import com.flamingo.ai.mano.agent.dto.PatternInsightResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Turns a recurring pattern into advice for the manager. */
public interface PatternInsightAgent {

  @SystemMessage(
      """
        You are a management coach. Given a recurring pattern in a manager's conversations,
        write one concise insight and 2-3 actionable suggestions.

        Return ONLY JSON:
        {"insight": "...", "actionableSuggestions": ["..."],
         "priority": "high|medium|low", "relevanceScore": 0.0-1.0}
        """)
  @UserMessage(
      """
        Pattern type: {{type}}
        Description: {{description}}
        Seen {{frequency}} times, confidence {{confidence}}
        Keywords: {{keywords}}
        """)
  PatternInsightResult explain(
      @V("type") String type,
      @V("description") String description,
      @V("frequency") int frequency,
      @V("confidence") String confidence,
      @V("keywords") String keywords);
}
