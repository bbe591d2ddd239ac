package com.flamingo.ai.mano.agent;

import com.flamingo.ai.mano.agent.dto.FollowUpResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Decides whether an earlier coaching reply implies a follow-up the manager should do. */
public interface FollowUpAgent {

  @SystemMessage(
      """
        You review advice a coach gave a manager and decide whether it implies a concrete
        follow-up action that is still due.

        Return ONLY JSON:
        {"needsFollowup": true|false, "title": "...", "description": "...",
         "steps": ["..."], "context": "...", "urgency": "high|medium|low",
         "relevance": 0.0-1.0}
        """)
  @UserMessage(
      """
        Earlier advice ({{age}}):
        {{content}}
        """)
  FollowUpResult review(@V("content") String content, @V("age") String age);
}
