package com.flamingo.ai.mano.agent.dto;

import java.util.List;

/** Structured output of ConversationAnalysisAgent. Lists may be null when the model omits them. */
public record ConversationAnalysis(
    List<String> themes,
    List<String> challenges,
    List<String> relationships,
    List<String> communicationPatterns,
    List<String> followUpNeeded,
    List<String> learningOpportunities) {

  public List<String> themesOrEmpty() {
    return themes != null ? themes : List.of();
  }

  public List<String> challengesOrEmpty() {
    return challenges != null ? challenges : List.of();
  }

  public List<String> relationshipsOrEmpty() {
    return relationships != null ? relationships : List.of();
  }

  public List<String> communicationPatternsOrEmpty() {
    return communicationPatterns != null ? communicationPatterns : List.of();
  }

  public List<String> learningOpportunitiesOrEmpty() {
    return learningOpportunities != null ? learningOpportunities : List.of();
  }
}
