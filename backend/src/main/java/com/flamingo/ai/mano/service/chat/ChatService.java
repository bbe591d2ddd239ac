package com.flamingo.ai.mano.service.chat;

import com.flamingo.ai.mano.api.dto.response.StreamChunkResponse;
import java.util.UUID;
import reactor.core.publisher.Flux;

/** Runs a coaching turn: context, prompt, streamed reply and background mining. */
public interface ChatService {

  /**
   * Streams Mano's reply to a message.
   *
   * @param userId the manager
   * @param personId the person the conversation is about, or null
   * @param topicId the topic the conversation is about, or null
   * @param userMessage the manager's message
   * @return token events followed by a done or error event
   */
  Flux<StreamChunkResponse> streamChat(
      String userId, UUID personId, UUID topicId, String userMessage);
}
