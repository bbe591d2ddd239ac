package com.flamingo.ai.mano.agent;

import com.flamingo.ai.mano.agent.dto.RelevanceAnalysis;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Scores how relevant a past conversation snippet is to the manager's current question. */
public interface RelevanceAnalysisAgent {

  @SystemMessage(
      """
        You analyse past management conversations. Judge how relevant a past snippet is to
        the current query and what a manager could do with it.

        Return ONLY JSON:
        {"relevanceScore": 0.0-1.0,
         "contextMatch": "why it matches",
         "relationshipToQuery": "how it relates",
         "actionableInsights": ["insight", "..."]}
        """)
  @UserMessage(
      """
        Query: {{query}}
        Past conversation: {{content}}
        Original similarity: {{similarity}}
        """)
  RelevanceAnalysis analyse(
      @V("query") String query, @V("content") String content, @V("similarity") String similarity);
}
