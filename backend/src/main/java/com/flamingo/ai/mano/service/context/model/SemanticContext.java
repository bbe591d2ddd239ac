package com.flamingo.ai.mano.service.context.model;

import java.util.List;

/** Semantic search contribution to a {@link ManagementContext}. */
public record SemanticContext(
    List<VectorSearchResult> similarConversations,
    List<VectorSearchResult> crossPersonInsights,
    List<SemanticPattern> patterns) {

  public SemanticContext {
    similarConversations = List.copyOf(similarConversations);
    crossPersonInsights = List.copyOf(crossPersonInsights);
    patterns = patterns == null ? List.of() : List.copyOf(patterns);
  }

  public boolean isEmpty() {
    return similarConversations.isEmpty() && crossPersonInsights.isEmpty() && patterns.isEmpty();
  }
}
