package com.flamingo.ai.mano.service.context.model;

import com.flamingo.ai.mano.domain.entity.Person;
import com.flamingo.ai.mano.domain.entity.Topic;
import com.flamingo.ai.mano.domain.enums.ConversationType;
import com.flamingo.ai.mano.domain.enums.RelationshipType;
import java.util.UUID;

/**
 * Who or what a conversation is about. Person targets carry the person's name, role and
 * relationship; topic targets carry the topic title as {@code name}.
 */
public record ConversationTarget(
    ConversationType type,
    UUID personId,
    UUID topicId,
    String name,
    String role,
    RelationshipType relationshipType) {

  public static ConversationTarget forPerson(Person person) {
    return new ConversationTarget(
        person.isSelf() ? ConversationType.SELF : ConversationType.PERSON,
        person.getId(),
        null,
        person.getName(),
        person.getRole(),
        person.getRelationshipType());
  }

  public static ConversationTarget forTopic(Topic topic) {
    return new ConversationTarget(
        ConversationType.GENERAL, null, topic.getId(), topic.getTitle(), null, null);
  }

  public static ConversationTarget general() {
    return new ConversationTarget(ConversationType.GENERAL, null, null, null, null, null);
  }

  public boolean isGeneral() {
    return type == ConversationType.GENERAL;
  }

  /** Person id semantic search and learning are scoped to, or null for topic conversations. */
  public UUID scopePersonId() {
    return isGeneral() ? null : personId;
  }
}
