package com.flamingo.ai.mano.agent;

import com.flamingo.ai.mano.agent.dto.TeamInsightsResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Looks at the whole team for cohesion, communication gaps, growth and risk. */
public interface TeamInsightAgent {

  @SystemMessage(
      """
        You are a management coach reviewing a manager's whole team. Identify at most two
        insights about team cohesion, communication gaps, growth opportunities or risk areas.

        Return ONLY JSON:
        {"insights": [{"type": "preventive_action|growth_opportunity", "title": "...",
                       "description": "...", "steps": ["..."],
                       "priority": "high|medium|low", "relevance": 0.0-1.0}]}
        """)
  @UserMessage(
      """
        Team members:
        {{team}}

        Recent themes: {{themes}}
        Current challenges: {{challenges}}
        """)
  TeamInsightsResult analyse(
      @V("team") String team, @V("themes") String themes, @V("challenges") String challenges);
}
