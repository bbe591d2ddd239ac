package com.flamingo.ai.mano.config;

import com.flamingo.ai.mano.agent.CoachingStreamingAgent;
import com.flamingo.ai.mano.agent.ConversationAnalysisAgent;
import com.flamingo.ai.mano.agent.ConversationStarterAgent;
import com.flamingo.ai.mano.agent.FollowUpAgent;
import com.flamingo.ai.mano.agent.PatternInsightAgent;
import com.flamingo.ai.mano.agent.PersonValidationAgent;
import com.flamingo.ai.mano.agent.QueryExpansionAgent;
import com.flamingo.ai.mano.agent.RelevanceAnalysisAgent;
import com.flamingo.ai.mano.agent.SemanticPatternAgent;
import com.flamingo.ai.mano.agent.TeamInsightAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * AI agents built with LangChain4j AI Services. Structured agents use the JSON chat model; query
 * expansion uses {@code textChatModel}.
 */
@Configuration
public class AiAgentConfig {

  @Bean
  public QueryExpansionAgent queryExpansionAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(QueryExpansionAgent.class).chatModel(textChatModel).build();
  }

  @Bean
  public RelevanceAnalysisAgent relevanceAnalysisAgent(ChatModel chatModel) {
    return AiServices.builder(RelevanceAnalysisAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public SemanticPatternAgent semanticPatternAgent(ChatModel chatModel) {
    return AiServices.builder(SemanticPatternAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public PersonValidationAgent personValidationAgent(ChatModel chatModel) {
    return AiServices.builder(PersonValidationAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public ConversationAnalysisAgent conversationAnalysisAgent(ChatModel chatModel) {
    return AiServices.builder(ConversationAnalysisAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public PatternInsightAgent patternInsightAgent(ChatModel chatModel) {
    return AiServices.builder(PatternInsightAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public ConversationStarterAgent conversationStarterAgent(ChatModel chatModel) {
    return AiServices.builder(ConversationStarterAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public FollowUpAgent followUpAgent(ChatModel chatModel) {
    return AiServices.builder(FollowUpAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public TeamInsightAgent teamInsightAgent(ChatModel chatModel) {
    return AiServices.builder(TeamInsightAgent.class).chatModel(chatModel).build();
  }

  /** Streams the coach's reply token by token. */
  @Bean
  public CoachingStreamingAgent coachingStreamingAgent(StreamingChatModel streamingChatModel) {
    return AiServices.builder(CoachingStreamingAgent.class)
        .streamingChatModel(streamingChatModel)
        .build();
  }
}
