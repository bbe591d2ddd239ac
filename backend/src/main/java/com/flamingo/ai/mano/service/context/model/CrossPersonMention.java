package com.flamingo.ai.mano.service.context.model;

import java.util.List;
import java.util.UUID;

/**
 * A roster member named inside conversations about other people.
 *
 * @param personId the mentioned person
 * @param name the mentioned person's name
 * @param mentionedInConversations ids of the people whose conversations contain the mention
 * @param mentionCount number of messages containing the mention
 */
public record CrossPersonMention(
    UUID personId, String name, List<UUID> mentionedInConversations, int mentionCount) {

  public CrossPersonMention {
    mentionedInConversations = List.copyOf(mentionedInConversations);
  }
}
