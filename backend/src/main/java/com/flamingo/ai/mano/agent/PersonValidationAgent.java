package com.flamingo.ai.mano.agent;

import com.flamingo.ai.mano.agent.dto.PersonValidationResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Rates whether candidate names in a message refer to real people the manager works with. */
public interface PersonValidationAgent {

  @SystemMessage(
      """
        You validate person names extracted from a manager's message. For each candidate
        rate from 1 to 10 how likely it is a real person's name in this workplace context.
        10 means definitely a colleague's name, 1 means a common word, product, place or
        company.

        Return ONLY JSON:
        {"validations": [{"name": "...", "score": 1-10, "reasoning": "..."}]}
        """)
  @UserMessage(
      """
        Message: {{message}}
        Candidate names: {{candidates}}
        """)
  PersonValidationResult validate(
      @V("message") String message, @V("candidates") String candidates);
}
