package com.flamingo.ai.mano.service.context.model;

import java.util.List;

/**
 * A similarity hit after the relevance pass, with messages from around the same time.
 *
 * @param result the raw hit
 * @param relevanceScore model relevance, or the raw similarity when the relevance pass failed
 * @param contextMatch why the hit matches the query
 * @param relationshipToQuery how the hit relates to the query
 * @param actionableInsights suggestions derived from the hit
 * @param connectedConversations same-person messages close in time
 */
public record EnhancedSearchResult(
    VectorSearchResult result,
    double relevanceScore,
    String contextMatch,
    String relationshipToQuery,
    List<String> actionableInsights,
    List<VectorSearchResult> connectedConversations) {

  public EnhancedSearchResult {
    actionableInsights = actionableInsights == null ? List.of() : List.copyOf(actionableInsights);
    connectedConversations =
        connectedConversations == null ? List.of() : List.copyOf(connectedConversations);
  }

  public EnhancedSearchResult withConnectedConversations(List<VectorSearchResult> connected) {
    return new EnhancedSearchResult(
        result, relevanceScore, contextMatch, relationshipToQuery, actionableInsights, connected);
  }
}
