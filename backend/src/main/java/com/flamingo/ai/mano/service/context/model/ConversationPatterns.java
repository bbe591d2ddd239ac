package com.flamingo.ai.mano.service.context.model;

import java.util.List;
import java.util.UUID;

/** Who and what the manager has been discussing recently. */
public record ConversationPatterns(
    List<UUID> mostDiscussed,
    List<String> trendingTopics,
    List<CrossPersonMention> crossPersonMentions) {

  public static final ConversationPatterns EMPTY =
      new ConversationPatterns(List.of(), List.of(), List.of());

  public ConversationPatterns {
    mostDiscussed = List.copyOf(mostDiscussed);
    trendingTopics = List.copyOf(trendingTopics);
    crossPersonMentions = List.copyOf(crossPersonMentions);
  }
}
