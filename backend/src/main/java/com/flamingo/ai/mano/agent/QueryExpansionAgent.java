package com.flamingo.ai.mano.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Rewrites a search query with management vocabulary before it is embedded. */
public interface QueryExpansionAgent {

  @SystemMessage(
      """
        You expand search queries for a management coaching assistant. Add related
        management concepts and synonyms that help find relevant past conversations.
        Keep the original intent. Reply with the expanded query only, on one line.
        """)
  @UserMessage(
      """
        Original query: {{query}}
        Context hints: {{hints}}

        Expanded query:
        """)
  String expand(@V("query") String query, @V("hints") String hints);
}
