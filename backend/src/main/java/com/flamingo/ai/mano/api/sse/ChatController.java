package com.flamingo.ai.mano.api.sse;

import com.flamingo.ai.mano.api.dto.request.ChatRequest;
import com.flamingo.ai.mano.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.mano.service.chat.ChatService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Streams coaching replies over Server-Sent Events. */
@RestController
@RequestMapping("/api/chat")
@Slf4j
public class ChatController {

  private final ChatService chatService;
  private final MeterRegistry meterRegistry;
  private final AtomicInteger activeConnections = new AtomicInteger(0);

  public ChatController(ChatService chatService, MeterRegistry meterRegistry) {
    this.chatService = chatService;
    this.meterRegistry = meterRegistry;
    meterRegistry.gauge("sse.connections.active", activeConnections);
  }

  /**
   * Streams Mano's reply to a message.
   *
   * @param request user, optional person or topic, and the message
   * @return token events followed by a done or error event
   */
  @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<StreamChunkResponse> streamChat(@Valid @RequestBody ChatRequest request) {
    log.info(
        "Starting chat stream for user {} (person={}, topic={})",
        request.getUserId(),
        request.getPersonId(),
        request.getTopicId());
    activeConnections.incrementAndGet();

    return chatService
        .streamChat(
            request.getUserId(), request.getPersonId(), request.getTopicId(), request.getMessage())
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Chat stream completed for user {}", request.getUserId());
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("Chat stream error for user {}: {}", request.getUserId(), e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Chat stream cancelled for user {}", request.getUserId());
            });
  }
}
