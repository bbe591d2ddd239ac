package com.flamingo.ai.mano.exception;

import java.util.UUID;

/** Thrown when a topic does not exist or belongs to another user. */
public class TopicNotFoundException extends RuntimeException {

  private final UUID topicId;

  public TopicNotFoundException(UUID topicId) {
    super("Topic not found: " + topicId);
    this.topicId = topicId;
  }

  public UUID getTopicId() {
    return topicId;
  }
}
