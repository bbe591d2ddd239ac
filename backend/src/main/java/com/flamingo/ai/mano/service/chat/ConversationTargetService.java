package com.flamingo.ai.mano.service.chat;

import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.domain.repository.ChatMessageRepository;
import com.flamingo.ai.mano.domain.repository.PersonRepository;
import com.flamingo.ai.mano.domain.repository.TopicRepository;
import com.flamingo.ai.mano.exception.PersonNotFoundException;
import com.flamingo.ai.mano.exception.TopicNotFoundException;
import com.flamingo.ai.mano.service.context.model.ConversationTarget;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Resolves the person or topic a conversation is about and loads its recent history. */
@Service
@RequiredArgsConstructor
public class ConversationTargetService {

  private final PersonRepository personRepository;
  private final TopicRepository topicRepository;
  private final ChatMessageRepository chatMessageRepository;

  /**
   * Resolves the conversation target. A person id takes precedence over a topic id; with neither
   * the conversation is general.
   *
   * @throws PersonNotFoundException when the person does not belong to the user
   * @throws TopicNotFoundException when the topic does not belong to the user
   */
  @Transactional(readOnly = true)
  public ConversationTarget resolve(String userId, UUID personId, UUID topicId) {
    if (personId != null) {
      return personRepository
          .findByIdAndUserId(personId, userId)
          .map(ConversationTarget::forPerson)
          .orElseThrow(() -> new PersonNotFoundException(personId));
    }
    if (topicId != null) {
      return topicRepository
          .findByIdAndUserId(topicId, userId)
          .map(ConversationTarget::forTopic)
          .orElseThrow(() -> new TopicNotFoundException(topicId));
    }
    return ConversationTarget.general();
  }

  /** The latest {@code limit} messages of the conversation, oldest first. */
  @Transactional(readOnly = true)
  public List<ChatMessage> loadHistory(String userId, ConversationTarget target, int limit) {
    Pageable page = Pageable.ofSize(limit);
    List<ChatMessage> newestFirst;
    if (target.personId() != null) {
      newestFirst = chatMessageRepository.findRecentByPerson(userId, target.personId(), page);
    } else if (target.topicId() != null) {
      newestFirst = chatMessageRepository.findRecentByTopic(userId, target.topicId(), page);
    } else {
      newestFirst = chatMessageRepository.findRecentGeneral(userId, page);
    }
    List<ChatMessage> history = new ArrayList<>(newestFirst);
    Collections.reverse(history);
    return history;
  }
}
