package com.flamingo.ai.mano.agent;

import com.flamingo.ai.mano.agent.dto.ConversationAnalysis;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Extracts themes, challenges and relationship notes from a coaching transcript. */
public interface ConversationAnalysisAgent {

  @SystemMessage(
      """
        You analyse management coaching conversations to learn recurring patterns.

        Return ONLY JSON with short phrases in each list:
        {"themes": [], "challenges": [], "relationships": [],
         "communicationPatterns": [], "followUpNeeded": [], "learningOpportunities": []}
        """)
  @UserMessage(
      """
        Conversation about: {{subject}}

        Transcript:
        {{transcript}}
        """)
  ConversationAnalysis analyse(@V("subject") String subject, @V("transcript") String transcript);
}
