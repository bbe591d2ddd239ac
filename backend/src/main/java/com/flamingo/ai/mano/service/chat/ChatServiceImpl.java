package com.flamingo.ai.mano.service.chat;

import com.flamingo.ai.mano.agent.CoachingStreamingAgent;
import com.flamingo.ai.mano.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.domain.entity.Person;
import com.flamingo.ai.mano.domain.entity.UserProfile;
import com.flamingo.ai.mano.domain.enums.MessageRole;
import com.flamingo.ai.mano.domain.repository.ChatMessageRepository;
import com.flamingo.ai.mano.domain.repository.PersonRepository;
import com.flamingo.ai.mano.domain.repository.UserProfileRepository;
import com.flamingo.ai.mano.exception.LlmServiceException;
import com.flamingo.ai.mano.service.context.ManagementContextService;
import com.flamingo.ai.mano.service.context.model.ConversationTarget;
import com.flamingo.ai.mano.service.context.model.ManagementContext;
import com.flamingo.ai.mano.service.detection.DetectedPerson;
import com.flamingo.ai.mano.service.detection.PersonDetectionResult;
import com.flamingo.ai.mano.service.detection.PersonMentionDetector;
import com.flamingo.ai.mano.service.learning.LearningService;
import com.flamingo.ai.mano.service.prompt.PromptAssembler;
import com.flamingo.ai.mano.service.task.BackgroundTaskDispatcher;
import com.flamingo.ai.mano.service.task.EmbeddingBackfillService;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/** Streams coaching replies and hands finished turns to the background mining jobs. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatServiceImpl implements ChatService {

  static final int HISTORY_LIMIT = 10;

  private final ConversationTargetService targetService;
  private final ManagementContextService managementContextService;
  private final PromptAssembler promptAssembler;
  private final CoachingStreamingAgent coachingStreamingAgent;
  private final ChatMessageRepository chatMessageRepository;
  private final UserProfileRepository userProfileRepository;
  private final PersonRepository personRepository;
  private final PersonMentionDetector personMentionDetector;
  private final LearningService learningService;
  private final EmbeddingBackfillService embeddingBackfillService;
  private final BackgroundTaskDispatcher taskDispatcher;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "chat.stream", description = "Time to start a coaching reply")
  @CircuitBreaker(name = "openai", fallbackMethod = "streamChatFallback")
  public Flux<StreamChunkResponse> streamChat(
      String userId, UUID personId, UUID topicId, String userMessage) {
    ConversationTarget target = targetService.resolve(userId, personId, topicId);
    List<ChatMessage> history = targetService.loadHistory(userId, target, HISTORY_LIMIT);
    log.debug(
        "Chat turn for user {} ({} conversation, {} prior messages)",
        userId,
        target.type(),
        history.size());

    ChatMessage userEntry = saveMessage(userId, target, MessageRole.USER, userMessage);

    ManagementContext context = managementContextService.buildContext(userId, target, userMessage);
    UserProfile profile = userProfileRepository.findById(userId).orElse(null);
    String systemPrompt = promptAssembler.render(target, context, history, profile);
    log.debug("Rendered system prompt with {} characters", systemPrompt.length());

    List<dev.langchain4j.data.message.ChatMessage> messages =
        List.of(SystemMessage.from(systemPrompt), UserMessage.from(userMessage));

    Sinks.Many<StreamChunkResponse> sink = Sinks.many().unicast().onBackpressureBuffer();
    StringBuilder reply = new StringBuilder();
    AtomicInteger tokenCount = new AtomicInteger(0);

    try {
      coachingStreamingAgent
          .chat(messages)
          .onPartialResponse(
              token -> {
                reply.append(token);
                tokenCount.incrementAndGet();
                var result = sink.tryEmitNext(StreamChunkResponse.token(token));
                if (result.isFailure()) {
                  log.warn("Failed to emit token: {}", result);
                }
              })
          .onCompleteResponse(
              response -> {
                if (reply.toString().isBlank()) {
                  log.warn("Coaching stream for user {} finished without content", userId);
                  meterRegistry.counter("chat.errors").increment();
                  sink.tryEmitNext(
                      StreamChunkResponse.error(
                          UUID.randomUUID().toString().substring(0, 8),
                          "Mano could not finish this reply. Please try again."));
                  sink.tryEmitComplete();
                  return;
                }
                ChatMessage assistantEntry =
                    saveMessage(userId, target, MessageRole.ASSISTANT, reply.toString());
                meterRegistry.counter("chat.messages.generated").increment();
                meterRegistry.counter("chat.tokens.generated").increment(tokenCount.get());

                List<ChatMessage> turn = new ArrayList<>(history);
                turn.add(userEntry);
                turn.add(assistantEntry);
                scheduleMining(userId, target, turn, userMessage);

                sink.tryEmitNext(
                    StreamChunkResponse.done(assistantEntry.getId().toString(), tokenCount.get()));
                sink.tryEmitComplete();
              })
          .onError(
              error -> {
                log.error("Error during coaching stream: {}", error.getMessage(), error);
                meterRegistry.counter("chat.errors").increment();
                sink.tryEmitNext(
                    StreamChunkResponse.error(
                        UUID.randomUUID().toString().substring(0, 8),
                        "Mano could not finish this reply. Please try again."));
                sink.tryEmitComplete();
              })
          .start();
    } catch (RuntimeException e) {
      throw new LlmServiceException("Failed to start coaching stream", e);
    }
    return sink.asFlux();
  }

  /** Pattern learning, person detection and embedding backfill run after the reply is saved. */
  private void scheduleMining(
      String userId, ConversationTarget target, List<ChatMessage> turn, String userMessage) {
    taskDispatcher.submit(
        "pattern-learning",
        () -> learningService.recordFromConversation(userId, turn, target.scopePersonId(), target));
    taskDispatcher.submit("person-detection", () -> detectNewPeople(userId, userMessage));
    embeddingBackfillService.scheduleBackfill(userId);
  }

  /** Looks for people in the manager's message who are not on the roster yet. */
  private void detectNewPeople(String userId, String userMessage) {
    List<String> rosterNames =
        personRepository.findByUserIdOrderByNameAsc(userId).stream()
            .filter(person -> !person.isSelf())
            .map(Person::getName)
            .toList();
    PersonDetectionResult result = personMentionDetector.detect(userId, userMessage, rosterNames);
    if (result.people().isEmpty()) {
      return;
    }
    meterRegistry.counter("chat.people.detected").increment(result.people().size());
    log.info(
        "Detected new people for user {} via {}: {}",
        userId,
        result.method(),
        result.people().stream().map(DetectedPerson::name).collect(Collectors.joining(", ")));
  }

  private ChatMessage saveMessage(
      String userId, ConversationTarget target, MessageRole role, String content) {
    return chatMessageRepository.save(
        ChatMessage.builder()
            .userId(userId)
            .personId(target.personId())
            .topicId(target.topicId())
            .role(role)
            .content(content)
            .build());
  }

  @SuppressWarnings("unused")
  private Flux<StreamChunkResponse> streamChatFallback(
      String userId, UUID personId, UUID topicId, String userMessage, LlmServiceException e) {
    log.error("Coaching stream could not start for user {}: {}", userId, e.getMessage());
    String errorId = UUID.randomUUID().toString().substring(0, 8);
    return Flux.just(StreamChunkResponse.error(errorId, e.getUserMessage()));
  }

  @SuppressWarnings("unused")
  private Flux<StreamChunkResponse> streamChatFallback(
      String userId, UUID personId, UUID topicId, String userMessage, CallNotPermittedException e) {
    log.warn("Coaching circuit breaker open, rejecting turn for user {}", userId);
    return Flux.just(
        StreamChunkResponse.error(
            UUID.randomUUID().toString().substring(0, 8),
            "Mano is temporarily unavailable. Please try again in a moment."));
  }
}
